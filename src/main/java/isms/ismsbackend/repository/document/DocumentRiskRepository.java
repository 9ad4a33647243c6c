package isms.ismsbackend.repository.document;

import isms.ismsbackend.entity.document.DocumentRisk;
import isms.ismsbackend.entity.document.DocumentRiskId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DocumentRiskRepository extends JpaRepository<DocumentRisk, DocumentRiskId> {

    List<DocumentRisk> findByDocumentId(String documentId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DocumentRisk dr WHERE dr.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
