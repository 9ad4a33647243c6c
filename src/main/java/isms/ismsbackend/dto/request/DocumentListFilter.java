package isms.ismsbackend.dto.request;

import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 문서 목록 조회 조건 (쿼리 파라미터)
 */
@Getter
@Setter
@NoArgsConstructor
public class DocumentListFilter {

    private DocumentType type;
    private DocumentStatus status;
    private String ownerId;
    private String nextReviewFrom;
    private String nextReviewTo;

    @Min(1)
    private int page = 1;

    @Min(1)
    @Max(10000)
    private int limit = 20;
}
