package com.flamingo.ai.agenticrag.domain.repository;

import com.flamingo.ai.agenticrag.domain.entity.Document;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /** Deletes the document ingested from a source; its chunks go with it. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM Document d WHERE d.source = :source")
  int deleteBySource(@Param("source") String source);
}
