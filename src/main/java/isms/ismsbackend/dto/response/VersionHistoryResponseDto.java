package isms.ismsbackend.dto.response;

import isms.ismsbackend.entity.document.Document;
import isms.ismsbackend.entity.document.DocumentVersionHistory;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
public class VersionHistoryResponseDto {
    private String id;
    private String documentId;
    private String version;
    private String notes;
    private String sharePointSiteId;
    private String sharePointDriveId;
    private String sharePointItemId;
    private String confluenceSpaceKey;
    private String confluencePageId;
    private String createdBy;
    private String updatedBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private DocumentSummary document;

    @Getter
    @AllArgsConstructor
    public static class DocumentSummary {
        private String id;
        private String title;
        private String version;
    }

    public static VersionHistoryResponseDto of(DocumentVersionHistory entry, Document document) {
        VersionHistoryResponseDto dto = new VersionHistoryResponseDto();
        dto.setId(entry.getId());
        dto.setDocumentId(entry.getDocumentId());
        dto.setVersion(entry.getVersion());
        dto.setNotes(entry.getNotes());
        dto.setSharePointSiteId(entry.getSharePointSiteId());
        dto.setSharePointDriveId(entry.getSharePointDriveId());
        dto.setSharePointItemId(entry.getSharePointItemId());
        dto.setConfluenceSpaceKey(entry.getConfluenceSpaceKey());
        dto.setConfluencePageId(entry.getConfluencePageId());
        dto.setCreatedBy(entry.getCreatedBy());
        dto.setUpdatedBy(entry.getUpdatedBy());
        dto.setCreatedAt(entry.getCreatedAt());
        dto.setUpdatedAt(entry.getUpdatedAt());
        dto.setDocument(new DocumentSummary(document.getId(), document.getTitle(), document.getVersion()));
        return dto;
    }
}
