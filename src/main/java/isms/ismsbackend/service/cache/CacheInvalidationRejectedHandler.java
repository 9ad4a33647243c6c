package isms.ismsbackend.service.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 캐시 무효화 대기열이 가득 찼을 때 요청을 버리고 WARN 로그를 남긴다
 */
@Slf4j
public class CacheInvalidationRejectedHandler implements RejectedExecutionHandler {

    @Override
    public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
        if (task instanceof CacheInvalidationTask invalidation) {
            log.warn("캐시 무효화 대기열 초과로 요청 폐기: documentId={}, reason={}, queued={}",
                    invalidation.getDocumentId(), invalidation.getReason(), executor.getQueue().size());
        } else {
            log.warn("캐시 무효화 대기열 초과로 작업 폐기: task={}, queued={}", task, executor.getQueue().size());
        }
    }
}
