package isms.ismsbackend.service.document;

import isms.ismsbackend.config.IntegrationProperties;
import isms.ismsbackend.dto.response.DocumentResponseDto;
import isms.ismsbackend.dto.response.OwnerSummaryDto;
import isms.ismsbackend.entity.UserEntity;
import isms.ismsbackend.entity.document.Document;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Document 엔티티 → 응답 DTO. 검토 일정 플래그는 조회 시점 기준으로 계산한다.
 */
@Component
@RequiredArgsConstructor
public class DocumentResponseMapper {

    private final Clock clock;
    private final IntegrationProperties properties;

    public DocumentResponseDto toResponse(Document document) {
        DocumentResponseDto dto = new DocumentResponseDto();
        dto.setId(document.getId());
        dto.setTitle(document.getTitle());
        dto.setType(document.getType());
        dto.setStorageLocation(document.getStorageLocation());
        dto.setSharePointSiteId(document.getSharePointSiteId());
        dto.setSharePointDriveId(document.getSharePointDriveId());
        dto.setSharePointItemId(document.getSharePointItemId());
        dto.setConfluenceSpaceKey(document.getConfluenceSpaceKey());
        dto.setConfluencePageId(document.getConfluencePageId());
        dto.setDocumentUrl(document.getDocumentUrl());
        dto.setVersion(document.getVersion());
        dto.setStatus(document.getStatus());
        dto.setRequiresAcknowledgement(document.isRequiresAcknowledgement());
        dto.setLastChangedDate(document.getLastChangedDate());
        dto.setLastReviewDate(document.getLastReviewDate());
        dto.setNextReviewDate(document.getNextReviewDate());
        dto.setCreatedAt(document.getCreatedAt());
        dto.setUpdatedAt(document.getUpdatedAt());

        UserEntity owner = document.getOwner();
        if (owner != null) {
            dto.setOwnerUserId(owner.getId());
            dto.setOwner(OwnerSummaryDto.from(owner));
        }

        applyReviewFlags(dto, document);
        return dto;
    }

    /**
     * 지연: nextReviewDate < now
     * 임박: now <= nextReviewDate <= now + 창(기본 30일)
     * APPROVED / IN_REVIEW 외에는 모두 false
     */
    void applyReviewFlags(DocumentResponseDto dto, Document document) {
        LocalDateTime next = document.getNextReviewDate();
        if (next == null || document.getStatus() == null || !document.getStatus().isReviewTracked()) {
            dto.setIsOverdueReview(false);
            dto.setIsUpcomingReview(false);
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime windowEnd = now.plusDays(properties.getRegistry().getUpcomingReviewWindowDays());
        dto.setIsOverdueReview(next.isBefore(now));
        dto.setIsUpcomingReview(!next.isBefore(now) && !next.isAfter(windowEnd));
    }
}
