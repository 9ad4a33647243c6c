package isms.ismsbackend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseDto {
    private String code;
    private String error;
    private String message;
    // 버전 불일치일 때만
    private String currentVersion;
    private LocalDateTime timestamp;
    private String path;
}
