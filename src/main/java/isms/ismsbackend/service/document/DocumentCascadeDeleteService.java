package isms.ismsbackend.service.document;

import isms.ismsbackend.config.IntegrationProperties;
import isms.ismsbackend.dto.response.DocumentResponseDto;
import isms.ismsbackend.entity.document.Document;
import isms.ismsbackend.exception.DocumentDeleteTimeoutException;
import isms.ismsbackend.exception.DocumentNotFoundException;
import isms.ismsbackend.repository.document.AcknowledgmentRepository;
import isms.ismsbackend.repository.document.DocumentControlRepository;
import isms.ismsbackend.repository.document.DocumentRepository;
import isms.ismsbackend.repository.document.DocumentRiskRepository;
import isms.ismsbackend.repository.document.DocumentVersionHistoryRepository;
import isms.ismsbackend.repository.document.ReviewTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 문서 하드 삭제. 종속 레코드를 순서대로 지운 뒤 문서를 지운다.
 * 전체가 하나의 트랜잭션(제한 시간 있음)이며 중간 실패 시 모두 롤백된다.
 */
@Slf4j
@Service
public class DocumentCascadeDeleteService {

    private final TransactionTemplate transactionTemplate;
    private final DocumentRepository documentRepository;
    private final ReviewTaskRepository reviewTaskRepository;
    private final AcknowledgmentRepository acknowledgmentRepository;
    private final DocumentControlRepository documentControlRepository;
    private final DocumentRiskRepository documentRiskRepository;
    private final DocumentVersionHistoryRepository versionHistoryRepository;
    private final DocumentResponseMapper responseMapper;

    public DocumentCascadeDeleteService(PlatformTransactionManager transactionManager,
                                        IntegrationProperties properties,
                                        DocumentRepository documentRepository,
                                        ReviewTaskRepository reviewTaskRepository,
                                        AcknowledgmentRepository acknowledgmentRepository,
                                        DocumentControlRepository documentControlRepository,
                                        DocumentRiskRepository documentRiskRepository,
                                        DocumentVersionHistoryRepository versionHistoryRepository,
                                        DocumentResponseMapper responseMapper) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(properties.getRegistry().getHardDeleteTimeoutSeconds());
        this.documentRepository = documentRepository;
        this.reviewTaskRepository = reviewTaskRepository;
        this.acknowledgmentRepository = acknowledgmentRepository;
        this.documentControlRepository = documentControlRepository;
        this.documentRiskRepository = documentRiskRepository;
        this.versionHistoryRepository = versionHistoryRepository;
        this.responseMapper = responseMapper;
    }

    /**
     * 삭제 순서: 검토 작업 → 확인 기록 → 통제항목 연결 → 리스크 연결 → 버전 이력 → 문서
     * @return 삭제 직전 문서 상태
     */
    public DocumentResponseDto hardDelete(String documentId) {
        try {
            return transactionTemplate.execute(status -> {
                Document document = documentRepository.findByIdWithOwner(documentId)
                        .orElseThrow(() -> new DocumentNotFoundException(documentId));
                // 벌크 삭제가 영속성 컨텍스트를 비우기 전에 응답을 만들어 둔다
                DocumentResponseDto deleted = responseMapper.toResponse(document);

                int reviewTasks = reviewTaskRepository.deleteByDocumentId(documentId);
                int acknowledgments = acknowledgmentRepository.deleteByDocumentId(documentId);
                int controls = documentControlRepository.deleteByDocumentId(documentId);
                int risks = documentRiskRepository.deleteByDocumentId(documentId);
                int history = versionHistoryRepository.deleteByDocumentId(documentId);

                if (documentRepository.deleteDocumentById(documentId) == 0) {
                    throw new DocumentNotFoundException(documentId);
                }

                log.info("문서 하드 삭제 완료: id={}, reviewTasks={}, acknowledgments={}, controls={}, risks={}, history={}",
                        documentId, reviewTasks, acknowledgments, controls, risks, history);
                return deleted;
            });
        } catch (TransactionTimedOutException | QueryTimeoutException e) {
            log.error("[hardDelete] 제한 시간 초과로 롤백: documentId={}", documentId, e);
            throw new DocumentDeleteTimeoutException(documentId, e);
        }
    }
}
