package isms.ismsbackend.common;

public interface ResponseCode {

    // 유효성 검사 실패를 나타내는 코드
    String VALIDATION_FAIL = "VF";

    // 인증 실패
    String AUTHORIZATION_FAIL = "AF";

    // 대상 문서/버전/연결이 없음
    String NOT_FOUND = "NF";

    // 버전 불일치 (낙관적 동시성 검사 실패)
    String VERSION_MISMATCH = "VM";

    // 이미 존재하는 버전
    String VERSION_EXISTS = "VE";

    // 이미 연결된 통제항목
    String LINK_CONFLICT = "LC";

    // 하드 삭제 시간 초과
    String TIMEOUT = "TO";

    // 데이터베이스 오류를 나타내는 코드
    String DATABASE_ERROR = "DBE";
}
