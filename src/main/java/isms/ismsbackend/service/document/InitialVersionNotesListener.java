package isms.ismsbackend.service.document;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 최초 버전 이력 기록. 실패해도 이미 커밋된 문서 등록에는 영향이 없다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InitialVersionNotesListener {

    private final VersionHistoryService versionHistoryService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDocumentCreated(InitialVersionNotesEvent event) {
        try {
            versionHistoryService.recordInitial(event.getDocumentId(), event.getNotes(), event.getActorId());
        } catch (Exception e) {
            log.error("[createDocument] 최초 버전 이력 기록 실패: documentId={}", event.getDocumentId(), e);
        }
    }
}
