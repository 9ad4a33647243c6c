package isms.ismsbackend.service.document;

import isms.ismsbackend.common.AuthenticatedActor;
import isms.ismsbackend.config.IntegrationProperties;
import isms.ismsbackend.dto.request.BulkImportRequestDto;
import isms.ismsbackend.dto.response.BulkImportResultDto;
import isms.ismsbackend.entity.UserEntity;
import isms.ismsbackend.entity.document.Document;
import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import isms.ismsbackend.enums.ImportAction;
import isms.ismsbackend.enums.StorageLocation;
import isms.ismsbackend.exception.DocumentValidationException;
import isms.ismsbackend.repository.UserRepository;
import isms.ismsbackend.repository.document.DocumentRepository;
import isms.ismsbackend.service.cache.DocumentChangedEvent;
import isms.ismsbackend.service.storage.SharePointGraphClient;
import isms.ismsbackend.service.storage.SharePointItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * SharePoint 항목을 문서로 일괄 가져오기.
 * 항목마다 별도 트랜잭션으로 처리하며, 실패한 항목은 errors에 모으고 나머지는 계속 진행한다.
 */
@Slf4j
@Service
public class DocumentImportService {

    static final String DEFAULT_VERSION = "1.0";

    private final DocumentRepository documentRepository;
    private final UserRepository userRepository;
    private final SharePointGraphClient graphClient;
    private final DocumentResponseMapper responseMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final IntegrationProperties.SharePoint sharePointSettings;
    private final TransactionTemplate transactionTemplate;

    public DocumentImportService(DocumentRepository documentRepository,
                                 UserRepository userRepository,
                                 SharePointGraphClient graphClient,
                                 DocumentResponseMapper responseMapper,
                                 ApplicationEventPublisher eventPublisher,
                                 IntegrationProperties properties,
                                 PlatformTransactionManager transactionManager) {
        this.documentRepository = documentRepository;
        this.userRepository = userRepository;
        this.graphClient = graphClient;
        this.responseMapper = responseMapper;
        this.eventPublisher = eventPublisher;
        this.sharePointSettings = properties.getSharepoint();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public BulkImportResultDto bulkImport(BulkImportRequestDto request, String accessToken, AuthenticatedActor actor) {
        if (!StringUtils.hasText(accessToken)) {
            throw new DocumentValidationException(
                    "Access token required. Please provide X-Graph-Token header with Microsoft Graph access token.");
        }

        BulkImportRequestDto.Defaults defaults =
                request.getDefaults() != null ? request.getDefaults() : new BulkImportRequestDto.Defaults();
        UserEntity owner = resolveOwner(defaults, actor);

        List<BulkImportResultDto.ItemResult> results = new ArrayList<>();
        List<BulkImportResultDto.ItemError> errors = new ArrayList<>();

        for (BulkImportRequestDto.Item item : request.getItems()) {
            String itemId = item.getItemId();
            String siteId = StringUtils.hasText(item.getSiteId()) ? item.getSiteId() : sharePointSettings.getDefaultSiteId();
            String driveId = StringUtils.hasText(item.getDriveId()) ? item.getDriveId() : sharePointSettings.getDefaultDriveId();

            if (!StringUtils.hasText(siteId) || !StringUtils.hasText(driveId)) {
                errors.add(new BulkImportResultDto.ItemError(itemId, "Site ID and Drive ID are required"));
                continue;
            }

            try {
                Optional<SharePointItem> sharePointItem = graphClient.getItem(accessToken, siteId, driveId, itemId);
                if (sharePointItem.isEmpty()) {
                    errors.add(new BulkImportResultDto.ItemError(itemId, "SharePoint item not found or inaccessible"));
                    continue;
                }

                results.add(transactionTemplate.execute(status ->
                        importItem(siteId, driveId, itemId, sharePointItem.get(), defaults, owner)));
            } catch (Exception e) {
                log.error("[bulkImport] 항목 가져오기 실패: itemId={}", itemId, e);
                errors.add(new BulkImportResultDto.ItemError(itemId,
                        e.getMessage() != null ? e.getMessage() : "Failed to import document"));
            }
        }

        log.info("일괄 가져오기 완료: total={}, success={}, failed={}, actor={}",
                request.getItems().size(), results.size(), errors.size(), actor.getUserId());
        return new BulkImportResultDto(results.size(), errors.size(), request.getItems().size(), results, errors);
    }

    /**
     * 같은 (site, drive, item) 문서가 있으면 갱신, 없으면 생성
     */
    private BulkImportResultDto.ItemResult importItem(String siteId, String driveId, String itemId,
                                                      SharePointItem sharePointItem,
                                                      BulkImportRequestDto.Defaults defaults,
                                                      UserEntity owner) {
        String title = StringUtils.hasText(sharePointItem.getName()) ? sharePointItem.getName() : itemId;
        Optional<Document> existing = documentRepository.findBySharePointItem(siteId, driveId, itemId);

        if (existing.isPresent()) {
            Document document = existing.get();
            // 파일 이름이 바뀌었을 수 있으므로 제목은 항상 갱신, 나머지는 defaults가 있을 때만
            document.setTitle(title);
            if (defaults.getType() != null) {
                document.setType(defaults.getType());
            }
            if (StringUtils.hasText(defaults.getVersion())) {
                document.setVersion(defaults.getVersion());
            }
            if (defaults.getStatus() != null) {
                document.setStatus(defaults.getStatus());
            }
            if (StringUtils.hasText(sharePointItem.getWebUrl())) {
                document.setDocumentUrl(sharePointItem.getWebUrl());
            }
            documentRepository.save(document);
            eventPublisher.publishEvent(new DocumentChangedEvent(document.getId(), "IMPORT"));

            log.info("가져오기 - 기존 문서 갱신: id={}, itemId={}", document.getId(), itemId);
            return new BulkImportResultDto.ItemResult(itemId, title, ImportAction.UPDATED,
                    responseMapper.toResponse(document));
        }

        DocumentType type = defaults.getType() != null ? defaults.getType() : DocumentType.OTHER;
        Document document = new Document();
        document.setId(UUID.randomUUID().toString());
        document.setTitle(title);
        document.setType(type);
        document.setStatus(defaults.getStatus() != null ? defaults.getStatus() : DocumentStatus.DRAFT);
        document.setVersion(StringUtils.hasText(defaults.getVersion()) ? defaults.getVersion() : DEFAULT_VERSION);
        document.setStorageLocation(StorageLocation.SHAREPOINT);
        document.setSharePointSiteId(siteId);
        document.setSharePointDriveId(driveId);
        document.setSharePointItemId(itemId);
        document.setDocumentUrl(StringUtils.hasText(sharePointItem.getWebUrl()) ? sharePointItem.getWebUrl() : null);
        document.setRequiresAcknowledgement(type == DocumentType.POLICY);
        document.setOwner(owner);

        Document saved = documentRepository.save(document);
        log.info("가져오기 - 문서 생성: id={}, itemId={}", saved.getId(), itemId);
        return new BulkImportResultDto.ItemResult(itemId, title, ImportAction.CREATED,
                responseMapper.toResponse(saved));
    }

    /**
     * defaults.ownerUserId → 요청자 id → 요청자 email 순으로 소유자 결정
     */
    private UserEntity resolveOwner(BulkImportRequestDto.Defaults defaults, AuthenticatedActor actor) {
        if (StringUtils.hasText(defaults.getOwnerUserId())) {
            return userRepository.findById(defaults.getOwnerUserId())
                    .orElseThrow(() -> new DocumentValidationException(
                            "Owner user not found: " + defaults.getOwnerUserId()));
        }

        Optional<UserEntity> owner = userRepository.findById(actor.getUserId());
        if (owner.isEmpty() && StringUtils.hasText(actor.getEmail())) {
            owner = userRepository.findByEmail(actor.getEmail());
        }
        return owner.orElseThrow(() -> new DocumentValidationException(
                "Owner user ID is required. User must exist in the database, or ownerUserId must be provided in defaults."));
    }
}
