package isms.ismsbackend.repository.document;

import isms.ismsbackend.entity.document.ReviewTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ReviewTaskRepository extends JpaRepository<ReviewTask, String> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ReviewTask r WHERE r.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
