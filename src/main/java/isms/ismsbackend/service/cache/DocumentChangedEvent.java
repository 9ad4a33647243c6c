package isms.ismsbackend.service.cache;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 문서 내용/버전이 바뀌어 렌더링 캐시를 비워야 함을 알리는 이벤트
 */
@Getter
@ToString
@RequiredArgsConstructor
public class DocumentChangedEvent {

    private final String documentId;
    // 로그용 (UPDATE, VERSION, SOFT_DELETE, IMPORT)
    private final String reason;
}
