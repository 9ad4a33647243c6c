package isms.ismsbackend.service.cache;

import isms.ismsbackend.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.Executor;

/**
 * 커밋 이후 캐시 무효화를 전용 스레드 풀에 넘긴다. 응답은 이 결과를 기다리지 않는다.
 */
@Slf4j
@Component
public class DocumentCacheInvalidationListener {

    private final CacheInvalidationNotifier notifier;
    private final Executor cacheInvalidationExecutor;

    public DocumentCacheInvalidationListener(CacheInvalidationNotifier notifier,
                                             @Qualifier(AsyncConfig.CACHE_INVALIDATION_EXECUTOR) Executor cacheInvalidationExecutor) {
        this.notifier = notifier;
        this.cacheInvalidationExecutor = cacheInvalidationExecutor;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDocumentChanged(DocumentChangedEvent event) {
        log.debug("캐시 무효화 요청: {}", event);
        cacheInvalidationExecutor.execute(
                new CacheInvalidationTask(event.getDocumentId(), event.getReason(), notifier));
    }
}
