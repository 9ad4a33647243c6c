package isms.ismsbackend.repository.document;

import isms.ismsbackend.entity.document.DocumentVersionHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DocumentVersionHistoryRepository extends JpaRepository<DocumentVersionHistory, String> {

    Optional<DocumentVersionHistory> findByDocumentIdAndVersion(String documentId, String version);

    List<DocumentVersionHistory> findByDocumentIdOrderByCreatedAtDesc(String documentId);

    long countByDocumentId(String documentId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DocumentVersionHistory h WHERE h.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
