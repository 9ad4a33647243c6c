package isms.ismsbackend.repository.document;

import isms.ismsbackend.entity.document.DocumentControl;
import isms.ismsbackend.entity.document.DocumentControlId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DocumentControlRepository extends JpaRepository<DocumentControl, DocumentControlId> {

    /**
     * 문서에 연결된 통제항목 (control 함께 로딩)
     */
    @Query("SELECT dc FROM DocumentControl dc JOIN FETCH dc.control c " +
            "WHERE dc.documentId = :documentId ORDER BY c.code ASC")
    List<DocumentControl> findByDocumentIdWithControl(@Param("documentId") String documentId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DocumentControl dc WHERE dc.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
