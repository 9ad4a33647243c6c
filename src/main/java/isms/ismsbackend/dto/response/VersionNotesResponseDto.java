package isms.ismsbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class VersionNotesResponseDto {
    private String documentId;
    private String version;
    private String notes;
}
