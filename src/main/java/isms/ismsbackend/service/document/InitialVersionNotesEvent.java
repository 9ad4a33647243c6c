package isms.ismsbackend.service.document;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 문서 등록 요청에 versionNotes가 있을 때 발행. 커밋 후 최초 이력으로 기록된다.
 */
@Getter
@RequiredArgsConstructor
public class InitialVersionNotesEvent {
    private final String documentId;
    private final String notes;
    private final String actorId;
}
