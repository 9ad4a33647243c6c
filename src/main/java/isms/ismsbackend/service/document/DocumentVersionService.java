package isms.ismsbackend.service.document;

import isms.ismsbackend.common.AuthenticatedActor;
import isms.ismsbackend.dto.request.VersionUpdateRequestDto;
import isms.ismsbackend.dto.response.DocumentResponseDto;
import isms.ismsbackend.dto.response.VersionHistoryResponseDto;
import isms.ismsbackend.dto.response.VersionNotesResponseDto;
import isms.ismsbackend.entity.document.Document;
import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.exception.DocumentNotFoundException;
import isms.ismsbackend.exception.VersionAlreadyExistsException;
import isms.ismsbackend.exception.VersionMismatchException;
import isms.ismsbackend.repository.document.DocumentRepository;
import isms.ismsbackend.service.cache.DocumentChangedEvent;
import isms.ismsbackend.util.DateUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 문서 버전 전환 (낙관적 동시성 검사) 및 버전 노트 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentVersionService {

    static final String CURRENT_VERSION = "current";

    private final DocumentRepository documentRepository;
    private final VersionHistoryService versionHistoryService;
    private final DocumentResponseMapper responseMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 버전 올리기
     * 1. 요청의 currentVersion이 저장된 버전과 다르면 아무것도 바꾸지 않고 거절
     * 2. newVersion 이력 upsert (작성자, 식별자 스냅샷)
     * 3. 버전 변경, APPROVED 이면 lastChangedDate 갱신, 검토일 반영
     * 4. 커밋 후 캐시 무효화
     */
    @Transactional
    public DocumentResponseDto advanceVersion(String documentId, VersionUpdateRequestDto request, AuthenticatedActor actor) {
        Document document = documentRepository.findByIdWithOwner(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        if (!document.getVersion().equals(request.getCurrentVersion())) {
            log.info("버전 불일치: documentId={}, expected={}, current={}",
                    documentId, request.getCurrentVersion(), document.getVersion());
            throw new VersionMismatchException(documentId, document.getVersion());
        }

        String newVersion = request.getNewVersion();
        LocalDateTime lastReviewDate = parseIfPresent(request.getLastReviewDate(), "lastReviewDate");
        LocalDateTime nextReviewDate = parseIfPresent(request.getNextReviewDate(), "nextReviewDate");

        try {
            versionHistoryService.upsert(document, newVersion, request.getNotes(), actor.getUserId());

            document.setVersion(newVersion);
            if (document.getStatus() == DocumentStatus.APPROVED) {
                document.setLastChangedDate(LocalDateTime.now(clock));
            }
            if (request.getLastReviewDate() != null) {
                document.setLastReviewDate(lastReviewDate);
            }
            if (request.getNextReviewDate() != null) {
                document.setNextReviewDate(nextReviewDate);
            }

            // 유니크 제약 위반을 여기서 확인하기 위해 즉시 flush
            documentRepository.saveAndFlush(document);
        } catch (DataIntegrityViolationException e) {
            log.warn("버전 중복: documentId={}, version={}", documentId, newVersion);
            throw new VersionAlreadyExistsException(newVersion, e);
        }

        log.info("버전 변경 완료: documentId={}, {} -> {}, actor={}",
                documentId, request.getCurrentVersion(), newVersion, actor.getUserId());
        eventPublisher.publishEvent(new DocumentChangedEvent(documentId, "VERSION"));
        return responseMapper.toResponse(document);
    }

    /**
     * @param version 조회할 버전. null/빈 값/"current"는 현재 버전
     */
    @Transactional(readOnly = true)
    public VersionNotesResponseDto getVersionNotes(String documentId, String version) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        String target = !StringUtils.hasText(version) || CURRENT_VERSION.equals(version)
                ? document.getVersion()
                : version;
        String notes = versionHistoryService.findNotes(documentId, target).orElse(null);
        return new VersionNotesResponseDto(documentId, target, notes);
    }

    @Transactional(readOnly = true)
    public List<VersionHistoryResponseDto> listVersionHistory(String documentId) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        return versionHistoryService.listHistory(documentId).stream()
                .map(entry -> VersionHistoryResponseDto.of(entry, document))
                .toList();
    }

    private LocalDateTime parseIfPresent(Optional<String> value, String fieldName) {
        if (value == null) {
            return null;
        }
        return value.map(v -> DateUtil.parseTimestamp(v, fieldName)).orElse(null);
    }
}
