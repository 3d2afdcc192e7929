package cn.bitsleep.sysdocs.repo;

import cn.bitsleep.sysdocs.domain.Document;
import cn.bitsleep.sysdocs.domain.DocumentPriority;
import cn.bitsleep.sysdocs.domain.DocumentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DocumentRepository extends JpaRepository<Document, String> {

    // null filter values match everything
    @Query("""
            SELECT d FROM Document d
            WHERE (:status IS NULL OR d.status = :status)
            AND (:priority IS NULL OR d.priority = :priority)
            ORDER BY d.createdAt DESC, d.id DESC
            """)
    List<Document> filter(@Param("status") DocumentStatus status,
                          @Param("priority") DocumentPriority priority);
}
