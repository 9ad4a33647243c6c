package isms.ismsbackend.repository.document;

import isms.ismsbackend.entity.document.Document;
import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface DocumentRepository extends JpaRepository<Document, String> {

    /**
     * 소유자 정보를 함께 조회 (응답에 owner 포함)
     */
    @Query("SELECT d FROM Document d JOIN FETCH d.owner WHERE d.id = :id")
    Optional<Document> findByIdWithOwner(@Param("id") String id);

    /**
     * 목록 조회. 조건이 null이면 해당 조건은 무시한다.
     * 정렬은 Pageable(createdAt DESC)로 지정. owner는 함께 로딩 (N+1 방지)
     */
    @EntityGraph(attributePaths = "owner")
    @Query("""
        SELECT d FROM Document d
        WHERE (:type IS NULL OR d.type = :type)
        AND (:status IS NULL OR d.status = :status)
        AND (:ownerId IS NULL OR d.owner.id = :ownerId)
        AND (:nextReviewFrom IS NULL OR d.nextReviewDate >= :nextReviewFrom)
        AND (:nextReviewTo IS NULL OR d.nextReviewDate <= :nextReviewTo)
    """)
    Page<Document> searchDocuments(
            @Param("type") DocumentType type,
            @Param("status") DocumentStatus status,
            @Param("ownerId") String ownerId,
            @Param("nextReviewFrom") LocalDateTime nextReviewFrom,
            @Param("nextReviewTo") LocalDateTime nextReviewTo,
            Pageable pageable
    );

    /**
     * SharePoint 항목 식별자로 기존 문서 조회 (일괄 가져오기 중복 방지)
     */
    @Query("SELECT d FROM Document d JOIN FETCH d.owner " +
            "WHERE d.sharePointSiteId = :siteId " +
            "AND d.sharePointDriveId = :driveId " +
            "AND d.sharePointItemId = :itemId")
    Optional<Document> findBySharePointItem(@Param("siteId") String siteId,
                                            @Param("driveId") String driveId,
                                            @Param("itemId") String itemId);

    /**
     * 하드 삭제 마지막 단계. 종속 테이블 정리 후 호출해야 한다.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Document d WHERE d.id = :id")
    int deleteDocumentById(@Param("id") String id);
}
