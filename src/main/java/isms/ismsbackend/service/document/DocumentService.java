package isms.ismsbackend.service.document;

import isms.ismsbackend.common.AuthenticatedActor;
import isms.ismsbackend.dto.request.DocumentCreateRequestDto;
import isms.ismsbackend.dto.request.DocumentListFilter;
import isms.ismsbackend.dto.request.DocumentUpdateRequestDto;
import isms.ismsbackend.dto.response.ControlSummaryDto;
import isms.ismsbackend.dto.response.DocumentListResponseDto;
import isms.ismsbackend.dto.response.DocumentResponseDto;
import isms.ismsbackend.entity.UserEntity;
import isms.ismsbackend.entity.document.Document;
import isms.ismsbackend.entity.document.DocumentRisk;
import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import isms.ismsbackend.enums.StorageLocation;
import isms.ismsbackend.exception.DocumentNotFoundException;
import isms.ismsbackend.exception.DocumentValidationException;
import isms.ismsbackend.repository.UserRepository;
import isms.ismsbackend.repository.document.DocumentControlRepository;
import isms.ismsbackend.repository.document.DocumentRepository;
import isms.ismsbackend.repository.document.DocumentRiskRepository;
import isms.ismsbackend.service.cache.DocumentChangedEvent;
import isms.ismsbackend.service.storage.StorageIdentifiers;
import isms.ismsbackend.service.storage.StorageLocationResolver;
import isms.ismsbackend.util.DateUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * 문서 등록/수정/조회/소프트 삭제.
 * 저장소 식별자가 바뀌면 문서 URL을 다시 만들고, 변경 후에는 캐시 무효화 이벤트를 발행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService {

    private final DocumentRepository documentRepository;
    private final DocumentControlRepository documentControlRepository;
    private final DocumentRiskRepository documentRiskRepository;
    private final UserRepository userRepository;
    private final VersionHistoryService versionHistoryService;
    private final StorageLocationResolver storageLocationResolver;
    private final DocumentResponseMapper responseMapper;
    private final ApplicationEventPublisher eventPublisher;

    // ==================== 조회 ====================

    /**
     * 목록 조회 (createdAt 내림차순).
     * URL이 비어 있지만 식별자가 모두 있는 문서는 이 시점에 URL을 채워 저장한다.
     */
    @Transactional
    public DocumentListResponseDto list(DocumentListFilter filter, String graphToken) {
        Pageable pageable = PageRequest.of(filter.getPage() - 1, filter.getLimit(),
                Sort.by(Sort.Direction.DESC, "createdAt"));

        Page<Document> page = documentRepository.searchDocuments(
                filter.getType(),
                filter.getStatus(),
                StringUtils.hasText(filter.getOwnerId()) ? filter.getOwnerId() : null,
                DateUtil.parseTimestamp(filter.getNextReviewFrom(), "nextReviewFrom"),
                DateUtil.parseTimestamp(filter.getNextReviewTo(), "nextReviewTo"),
                pageable);

        page.getContent().forEach(document -> backfillUrl(document, graphToken));

        List<DocumentResponseDto> data = page.getContent().stream()
                .map(responseMapper::toResponse)
                .toList();
        int totalPages = (int) Math.ceil((double) page.getTotalElements() / filter.getLimit());

        return new DocumentListResponseDto(data, new DocumentListResponseDto.Pagination(
                filter.getPage(), filter.getLimit(), page.getTotalElements(), totalPages));
    }

    /**
     * 상세 조회: owner, 연결 통제항목, 연결 리스크 id, 현재 버전 노트 포함
     */
    @Transactional(readOnly = true)
    public DocumentResponseDto get(String documentId) {
        Document document = documentRepository.findByIdWithOwner(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        DocumentResponseDto response = responseMapper.toResponse(document);
        response.setControls(documentControlRepository.findByDocumentIdWithControl(documentId).stream()
                .map(link -> ControlSummaryDto.from(link.getControl()))
                .toList());
        response.setRiskIds(documentRiskRepository.findByDocumentId(documentId).stream()
                .map(DocumentRisk::getRiskId)
                .toList());
        response.setCurrentVersionNotes(
                versionHistoryService.findNotes(documentId, document.getVersion()).orElse(null));
        return response;
    }

    // ==================== 등록 ====================

    @Transactional
    public DocumentResponseDto create(DocumentCreateRequestDto request, AuthenticatedActor actor, String graphToken) {
        UserEntity owner = userRepository.findById(request.getOwnerUserId())
                .orElseThrow(() -> new DocumentValidationException("Owner user not found: " + request.getOwnerUserId()));

        String documentId = StringUtils.hasText(request.getId()) ? request.getId() : UUID.randomUUID().toString();
        if (documentRepository.existsById(documentId)) {
            throw new DocumentValidationException("Document id already exists: " + documentId);
        }

        StorageLocation location = request.getStorageLocation();
        rejectInactiveIdentifiers(location,
                hasAnyText(request.getSharePointSiteId(), request.getSharePointDriveId(), request.getSharePointItemId()),
                hasAnyText(request.getConfluenceSpaceKey(), request.getConfluencePageId()));

        Document document = new Document();
        document.setId(documentId);
        document.setTitle(request.getTitle());
        document.setType(request.getType());
        document.setStatus(request.getStatus());
        document.setVersion(request.getVersion());
        document.setOwner(owner);
        document.setStorageLocation(location);
        document.setSharePointSiteId(emptyToNull(request.getSharePointSiteId()));
        document.setSharePointDriveId(emptyToNull(request.getSharePointDriveId()));
        document.setSharePointItemId(emptyToNull(request.getSharePointItemId()));
        document.setConfluenceSpaceKey(emptyToNull(request.getConfluenceSpaceKey()));
        document.setConfluencePageId(emptyToNull(request.getConfluencePageId()));
        // POLICY는 요청에 값이 없으면 확인(acknowledgement) 필요
        document.setRequiresAcknowledgement(request.getRequiresAcknowledgement() != null
                ? request.getRequiresAcknowledgement()
                : request.getType() == DocumentType.POLICY);
        document.setLastChangedDate(DateUtil.parseTimestamp(request.getLastChangedDate(), "lastChangedDate"));
        document.setLastReviewDate(DateUtil.parseTimestamp(request.getLastReviewDate(), "lastReviewDate"));
        document.setNextReviewDate(DateUtil.parseTimestamp(request.getNextReviewDate(), "nextReviewDate"));

        StorageIdentifiers identifiers = StorageIdentifiers.of(document);
        if (storageLocationResolver.identifiersComplete(location, identifiers)) {
            document.setDocumentUrl(storageLocationResolver.resolve(location, identifiers, graphToken).orElse(null));
        }

        Document saved = documentRepository.save(document);
        log.info("문서 등록 완료: id={}, type={}, owner={}, actor={}",
                saved.getId(), saved.getType(), owner.getId(), actor.getUserId());

        if (StringUtils.hasText(request.getVersionNotes())) {
            eventPublisher.publishEvent(
                    new InitialVersionNotesEvent(saved.getId(), request.getVersionNotes(), actor.getUserId()));
        }
        return responseMapper.toResponse(saved);
    }

    // ==================== 수정 ====================

    /**
     * 부분 수정. 요청에 있는 필드만 바꾼다. 버전 라벨은 바꾸지 않는다.
     */
    @Transactional
    public DocumentResponseDto update(String documentId, DocumentUpdateRequestDto patch,
                                      AuthenticatedActor actor, String graphToken) {
        Document document = documentRepository.findByIdWithOwner(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        if (patch.getTitle() != null) {
            if (!StringUtils.hasText(patch.getTitle())) {
                throw new DocumentValidationException("title must not be empty");
            }
            document.setTitle(patch.getTitle());
        }

        if (patch.getOwnerUserId() != null) {
            if (!StringUtils.hasText(patch.getOwnerUserId())) {
                throw new DocumentValidationException("ownerUserId must not be empty");
            }
            UserEntity owner = userRepository.findById(patch.getOwnerUserId())
                    .orElseThrow(() -> new DocumentValidationException("Owner user not found: " + patch.getOwnerUserId()));
            document.setOwner(owner);
        }

        StorageLocation previousLocation = document.getStorageLocation();
        StorageLocation targetLocation = patch.getStorageLocation() != null ? patch.getStorageLocation() : previousLocation;
        rejectInactiveIdentifiers(targetLocation,
                hasAnyText(patch.getSharePointSiteId(), patch.getSharePointDriveId(), patch.getSharePointItemId()),
                hasAnyText(patch.getConfluenceSpaceKey(), patch.getConfluencePageId()));

        boolean storageChanged = targetLocation != previousLocation || identifiersChanged(document, patch);

        // POLICY로 바뀌는 경우에만 확인 필요 기본값 적용. POLICY에서 벗어날 때는 건드리지 않는다.
        if (patch.getType() != null) {
            if (patch.getType() == DocumentType.POLICY && document.getType() != DocumentType.POLICY
                    && patch.getRequiresAcknowledgement() == null) {
                document.setRequiresAcknowledgement(true);
            }
            document.setType(patch.getType());
        }
        if (patch.getRequiresAcknowledgement() != null) {
            document.setRequiresAcknowledgement(patch.getRequiresAcknowledgement());
        }
        if (patch.getStatus() != null) {
            document.setStatus(patch.getStatus());
        }

        if (targetLocation != previousLocation) {
            document.setStorageLocation(targetLocation);
            if (targetLocation == StorageLocation.SHAREPOINT) {
                document.clearConfluenceIds();
            } else {
                document.clearSharePointIds();
            }
        }
        applyClearable(patch.getSharePointSiteId(), document::setSharePointSiteId);
        applyClearable(patch.getSharePointDriveId(), document::setSharePointDriveId);
        applyClearable(patch.getSharePointItemId(), document::setSharePointItemId);
        applyClearable(patch.getConfluenceSpaceKey(), document::setConfluenceSpaceKey);
        applyClearable(patch.getConfluencePageId(), document::setConfluencePageId);

        applyDate(patch.getLastChangedDate(), "lastChangedDate", document::setLastChangedDate);
        applyDate(patch.getLastReviewDate(), "lastReviewDate", document::setLastReviewDate);
        applyDate(patch.getNextReviewDate(), "nextReviewDate", document::setNextReviewDate);

        if (storageChanged) {
            // 식별자가 불완전하거나 URL 생성에 실패하면 이전 URL을 남기지 않고 비운다
            String url = storageLocationResolver
                    .resolve(targetLocation, StorageIdentifiers.of(document), graphToken)
                    .orElse(null);
            document.setDocumentUrl(url);
            log.info("문서 URL 재생성: id={}, location={}, resolved={}", documentId, targetLocation, url != null);
        }

        if (patch.getVersionNotes() != null) {
            versionHistoryService.upsert(document, document.getVersion(), patch.getVersionNotes(), actor.getUserId());
        }

        documentRepository.save(document);
        log.info("문서 수정 완료: id={}, actor={}", documentId, actor.getUserId());

        eventPublisher.publishEvent(new DocumentChangedEvent(documentId, "UPDATE"));
        return responseMapper.toResponse(document);
    }

    // ==================== 삭제 ====================

    /**
     * 소프트 삭제: 상태만 SUPERSEDED로 바꾼다
     */
    @Transactional
    public DocumentResponseDto softDelete(String documentId) {
        Document document = documentRepository.findByIdWithOwner(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        document.setStatus(DocumentStatus.SUPERSEDED);
        documentRepository.save(document);
        log.info("문서 소프트 삭제: id={}", documentId);

        eventPublisher.publishEvent(new DocumentChangedEvent(documentId, "SOFT_DELETE"));
        return responseMapper.toResponse(document);
    }

    // ==================== 내부 ====================

    private void backfillUrl(Document document, String graphToken) {
        if (document.getDocumentUrl() != null) {
            return;
        }
        StorageIdentifiers identifiers = StorageIdentifiers.of(document);
        if (!storageLocationResolver.identifiersComplete(document.getStorageLocation(), identifiers)) {
            return;
        }
        storageLocationResolver.resolve(document.getStorageLocation(), identifiers, graphToken)
                .ifPresent(url -> {
                    document.setDocumentUrl(url);
                    log.info("누락된 문서 URL 보완: id={}", document.getId());
                });
    }

    /**
     * 비활성 저장소의 식별자를 값과 함께 보내면 거절
     */
    private void rejectInactiveIdentifiers(StorageLocation location, boolean sharePointSupplied, boolean confluenceSupplied) {
        if (location == StorageLocation.SHAREPOINT && confluenceSupplied) {
            throw new DocumentValidationException("Confluence identifiers cannot be set on a SHAREPOINT document");
        }
        if (location == StorageLocation.CONFLUENCE && sharePointSupplied) {
            throw new DocumentValidationException("SharePoint identifiers cannot be set on a CONFLUENCE document");
        }
    }

    private boolean identifiersChanged(Document document, DocumentUpdateRequestDto patch) {
        return changed(patch.getSharePointSiteId(), document.getSharePointSiteId())
                || changed(patch.getSharePointDriveId(), document.getSharePointDriveId())
                || changed(patch.getSharePointItemId(), document.getSharePointItemId())
                || changed(patch.getConfluenceSpaceKey(), document.getConfluenceSpaceKey())
                || changed(patch.getConfluencePageId(), document.getConfluencePageId());
    }

    private static boolean changed(Optional<String> patchValue, String current) {
        return patchValue != null && !Objects.equals(normalize(patchValue), current);
    }

    private static void applyClearable(Optional<String> patchValue, Consumer<String> setter) {
        if (patchValue != null) {
            setter.accept(normalize(patchValue));
        }
    }

    private static void applyDate(Optional<String> patchValue, String fieldName,
                                  Consumer<LocalDateTime> setter) {
        if (patchValue != null) {
            setter.accept(DateUtil.parseTimestamp(patchValue.orElse(null), fieldName));
        }
    }

    private static String normalize(Optional<String> value) {
        return value.filter(StringUtils::hasLength).orElse(null);
    }

    private static String emptyToNull(String value) {
        return StringUtils.hasLength(value) ? value : null;
    }

    private static boolean hasAnyText(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return true;
            }
        }
        return false;
    }

    @SafeVarargs
    private static boolean hasAnyText(Optional<String>... values) {
        for (Optional<String> value : values) {
            if (value != null && value.filter(StringUtils::hasText).isPresent()) {
                return true;
            }
        }
        return false;
    }
}
