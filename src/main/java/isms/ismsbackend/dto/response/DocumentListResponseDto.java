package isms.ismsbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class DocumentListResponseDto {
    private List<DocumentResponseDto> data;
    private Pagination pagination;

    @Getter
    @AllArgsConstructor
    public static class Pagination {
        private int page;
        private int limit;
        private long total;
        private int totalPages;
    }
}
