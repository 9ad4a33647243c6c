package isms.ismsbackend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Optional;

/**
 * 버전 올리기 요청. currentVersion은 클라이언트가 마지막으로 본 버전.
 */
@Getter
@Setter
@NoArgsConstructor
public class VersionUpdateRequestDto {

    @NotBlank
    private String currentVersion;

    @NotBlank
    private String newVersion;

    @NotBlank
    private String notes;

    // null: 변경 없음, empty/빈 문자열: 비우기
    private Optional<String> lastReviewDate;
    private Optional<String> nextReviewDate;
}
