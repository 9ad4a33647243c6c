package isms.ismsbackend.enums;

public enum ReviewTaskStatus {
    PENDING,     // 검토 대기
    COMPLETED,   // 검토 완료
    OVERDUE      // 기한 초과
}
