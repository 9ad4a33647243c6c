package isms.ismsbackend.service.document;

import isms.ismsbackend.dto.response.DocumentResponseDto;
import isms.ismsbackend.exception.DocumentDeleteTimeoutException;
import isms.ismsbackend.exception.DocumentNotFoundException;
import isms.ismsbackend.repository.document.AcknowledgmentRepository;
import isms.ismsbackend.repository.document.DocumentControlRepository;
import isms.ismsbackend.repository.document.DocumentRepository;
import isms.ismsbackend.repository.document.DocumentRiskRepository;
import isms.ismsbackend.repository.document.DocumentVersionHistoryRepository;
import isms.ismsbackend.repository.document.ReviewTaskRepository;
import isms.ismsbackend.support.DocumentFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("문서 하드 삭제")
class DocumentCascadeDeleteServiceTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private ReviewTaskRepository reviewTaskRepository;

    @Mock
    private AcknowledgmentRepository acknowledgmentRepository;

    @Mock
    private DocumentControlRepository documentControlRepository;

    @Mock
    private DocumentRiskRepository documentRiskRepository;

    @Mock
    private DocumentVersionHistoryRepository versionHistoryRepository;

    private DocumentCascadeDeleteService deleteService;

    @BeforeEach
    void setUp() {
        deleteService = new DocumentCascadeDeleteService(
                transactionManager,
                DocumentFixtures.properties(),
                documentRepository,
                reviewTaskRepository,
                acknowledgmentRepository,
                documentControlRepository,
                documentRiskRepository,
                versionHistoryRepository,
                new DocumentResponseMapper(DocumentFixtures.fixedClock(), DocumentFixtures.properties()));
    }

    @Test
    @DisplayName("종속 레코드를 먼저 지우고 삭제 전 스냅샷 반환")
    void deletesInOrder() {
        when(documentRepository.findByIdWithOwner("doc-1"))
                .thenReturn(Optional.of(DocumentFixtures.sharePointDocument("doc-1")));
        when(documentRepository.deleteDocumentById("doc-1")).thenReturn(1);

        DocumentResponseDto deleted = deleteService.hardDelete("doc-1");

        assertThat(deleted.getId()).isEqualTo("doc-1");
        assertThat(deleted.getTitle()).isEqualTo("Information Security Policy");

        InOrder order = inOrder(reviewTaskRepository, acknowledgmentRepository, documentControlRepository,
                documentRiskRepository, versionHistoryRepository, documentRepository, transactionManager);
        order.verify(reviewTaskRepository).deleteByDocumentId("doc-1");
        order.verify(acknowledgmentRepository).deleteByDocumentId("doc-1");
        order.verify(documentControlRepository).deleteByDocumentId("doc-1");
        order.verify(documentRiskRepository).deleteByDocumentId("doc-1");
        order.verify(versionHistoryRepository).deleteByDocumentId("doc-1");
        order.verify(documentRepository).deleteDocumentById("doc-1");
        order.verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("없는 문서는 404, 아무것도 지우지 않음")
    void missingDocument() {
        when(documentRepository.findByIdWithOwner("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> deleteService.hardDelete("missing"))
                .isInstanceOf(DocumentNotFoundException.class);

        verifyNoInteractions(reviewTaskRepository, acknowledgmentRepository, documentControlRepository,
                documentRiskRepository, versionHistoryRepository);
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("쿼리 타임아웃은 롤백 후 삭제 타임아웃으로 변환")
    void queryTimeout() {
        when(documentRepository.findByIdWithOwner("doc-1"))
                .thenReturn(Optional.of(DocumentFixtures.sharePointDocument("doc-1")));
        when(documentRiskRepository.deleteByDocumentId("doc-1"))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        assertThatThrownBy(() -> deleteService.hardDelete("doc-1"))
                .isInstanceOf(DocumentDeleteTimeoutException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);

        verify(versionHistoryRepository, never()).deleteByDocumentId("doc-1");
        verify(documentRepository, never()).deleteDocumentById("doc-1");
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    @DisplayName("커밋 시 트랜잭션 제한 시간 초과도 삭제 타임아웃")
    void transactionTimeout() {
        when(documentRepository.findByIdWithOwner("doc-1"))
                .thenReturn(Optional.of(DocumentFixtures.sharePointDocument("doc-1")));
        when(documentRepository.deleteDocumentById("doc-1")).thenReturn(1);
        doThrow(new TransactionTimedOutException("deadline exceeded")).when(transactionManager).commit(any());

        assertThatThrownBy(() -> deleteService.hardDelete("doc-1"))
                .isInstanceOf(DocumentDeleteTimeoutException.class);
    }

    @Test
    @DisplayName("그 외 실패는 롤백 후 그대로 전파")
    void otherFailurePropagates() {
        when(documentRepository.findByIdWithOwner("doc-1"))
                .thenReturn(Optional.of(DocumentFixtures.sharePointDocument("doc-1")));
        when(acknowledgmentRepository.deleteByDocumentId("doc-1"))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThatThrownBy(() -> deleteService.hardDelete("doc-1"))
                .isInstanceOf(DataAccessResourceFailureException.class);

        verify(transactionManager).rollback(any());
        verify(documentRepository, never()).deleteDocumentById("doc-1");
    }
}
