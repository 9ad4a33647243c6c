package isms.ismsbackend.enums;

/**
 * 문서 상태
 */
public enum DocumentStatus {
    DRAFT,
    IN_REVIEW,
    APPROVED,
    /**
     * 소프트 삭제 시 전환되는 상태
     */
    SUPERSEDED;

    /**
     * 검토 일정(overdue/upcoming) 계산 대상 상태인지
     */
    public boolean isReviewTracked() {
        return this == APPROVED || this == IN_REVIEW;
    }
}
