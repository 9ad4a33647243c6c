package isms.ismsbackend.dto.response;

import isms.ismsbackend.enums.ImportAction;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class BulkImportResultDto {
    private int success;
    private int failed;
    private int total;
    private List<ItemResult> results;
    private List<ItemError> errors;

    @Getter
    @AllArgsConstructor
    public static class ItemResult {
        private String itemId;
        private String name;
        private ImportAction action;
        private DocumentResponseDto document;
    }

    @Getter
    @AllArgsConstructor
    public static class ItemError {
        private String itemId;
        private String error;
    }
}
