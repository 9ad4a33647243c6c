package isms.ismsbackend.service.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DocumentCacheInvalidationListenerTest {

    @Mock
    private CacheInvalidationNotifier notifier;

    @Mock
    private Executor executor;

    private DocumentCacheInvalidationListener listener;

    @BeforeEach
    void setUp() {
        listener = new DocumentCacheInvalidationListener(notifier, executor);
    }

    @Test
    @DisplayName("변경 이벤트는 documentId를 담은 작업으로 전용 풀에 넘긴다")
    void submitsTaskToExecutor() {
        listener.onDocumentChanged(new DocumentChangedEvent("doc-1", "UPDATE"));

        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).execute(captor.capture());
        verify(notifier, never()).invalidate(anyString());

        assertThat(captor.getValue()).isInstanceOf(CacheInvalidationTask.class);
        CacheInvalidationTask task = (CacheInvalidationTask) captor.getValue();
        assertThat(task.getDocumentId()).isEqualTo("doc-1");
        assertThat(task.getReason()).isEqualTo("UPDATE");

        task.run();
        verify(notifier).invalidate("doc-1");
    }
}
