package isms.ismsbackend.dto.request;

import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * SharePoint 항목 일괄 가져오기 요청
 */
@Getter
@Setter
@NoArgsConstructor
public class BulkImportRequestDto {

    @NotEmpty
    @Valid
    private List<Item> items = new ArrayList<>();

    private Defaults defaults = new Defaults();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        @NotBlank
        private String itemId;
        // 미지정 시 integration.sharepoint.default-* 사용
        private String siteId;
        private String driveId;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Defaults {
        private DocumentType type;
        private DocumentStatus status;
        private String version;
        private String ownerUserId;
    }
}
