package isms.ismsbackend.service.document;

import isms.ismsbackend.entity.document.Document;
import isms.ismsbackend.entity.document.DocumentVersionHistory;
import isms.ismsbackend.exception.DocumentNotFoundException;
import isms.ismsbackend.repository.document.DocumentRepository;
import isms.ismsbackend.repository.document.DocumentVersionHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 버전별 변경 노트 저장소. (문서, 버전)당 1행만 유지한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VersionHistoryService {

    private final DocumentVersionHistoryRepository historyRepository;
    private final DocumentRepository documentRepository;

    /**
     * 있으면 노트/수정자 갱신, 없으면 새로 생성.
     * 두 경우 모두 현재 저장소 식별자를 스냅샷으로 남긴다.
     * @param notes 빈 문자열은 null로 저장
     */
    @Transactional
    public DocumentVersionHistory upsert(Document document, String version, String notes, String actorId) {
        Optional<DocumentVersionHistory> existing =
                historyRepository.findByDocumentIdAndVersion(document.getId(), version);

        if (existing.isPresent()) {
            DocumentVersionHistory entry = existing.get();
            entry.setNotes(StringUtils.hasLength(notes) ? notes : null);
            entry.setUpdatedBy(actorId);
            // 갱신 시에는 값이 있는 식별자만 덮어쓴다
            overwriteIfPresent(entry, document);
            log.info("버전 이력 갱신: documentId={}, version={}, actor={}", document.getId(), version, actorId);
            return historyRepository.save(entry);
        }

        DocumentVersionHistory entry = new DocumentVersionHistory();
        entry.setId(UUID.randomUUID().toString());
        entry.setDocumentId(document.getId());
        entry.setVersion(version);
        entry.setNotes(StringUtils.hasLength(notes) ? notes : null);
        entry.setSharePointSiteId(document.getSharePointSiteId());
        entry.setSharePointDriveId(document.getSharePointDriveId());
        entry.setSharePointItemId(document.getSharePointItemId());
        entry.setConfluenceSpaceKey(document.getConfluenceSpaceKey());
        entry.setConfluencePageId(document.getConfluencePageId());
        entry.setCreatedBy(actorId);
        entry.setUpdatedBy(actorId);
        log.info("버전 이력 생성: documentId={}, version={}, actor={}", document.getId(), version, actorId);
        return historyRepository.save(entry);
    }

    /**
     * 문서 등록 직후 최초 이력 기록. 문서 트랜잭션이 커밋된 뒤 별도 트랜잭션으로 실행된다.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public DocumentVersionHistory recordInitial(String documentId, String notes, String actorId) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        return upsert(document, document.getVersion(), notes, actorId);
    }

    @Transactional(readOnly = true)
    public Optional<String> findNotes(String documentId, String version) {
        return historyRepository.findByDocumentIdAndVersion(documentId, version)
                .map(DocumentVersionHistory::getNotes);
    }

    @Transactional(readOnly = true)
    public List<DocumentVersionHistory> listHistory(String documentId) {
        return historyRepository.findByDocumentIdOrderByCreatedAtDesc(documentId);
    }

    private void overwriteIfPresent(DocumentVersionHistory entry, Document document) {
        if (StringUtils.hasText(document.getSharePointSiteId())) {
            entry.setSharePointSiteId(document.getSharePointSiteId());
        }
        if (StringUtils.hasText(document.getSharePointDriveId())) {
            entry.setSharePointDriveId(document.getSharePointDriveId());
        }
        if (StringUtils.hasText(document.getSharePointItemId())) {
            entry.setSharePointItemId(document.getSharePointItemId());
        }
        if (StringUtils.hasText(document.getConfluenceSpaceKey())) {
            entry.setConfluenceSpaceKey(document.getConfluenceSpaceKey());
        }
        if (StringUtils.hasText(document.getConfluencePageId())) {
            entry.setConfluencePageId(document.getConfluencePageId());
        }
    }
}
