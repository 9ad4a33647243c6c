package isms.ismsbackend.service.cache;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 캐시 무효화 작업 단위. 거절 시 로그에 documentId를 남기기 위해 Runnable로 감싼다.
 */
@Getter
@RequiredArgsConstructor
public class CacheInvalidationTask implements Runnable {

    private final String documentId;
    private final String reason;
    private final CacheInvalidationNotifier notifier;

    @Override
    public void run() {
        notifier.invalidate(documentId);
    }
}
