package io.b2mash.outline.section;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SectionRepository extends JpaRepository<Section, UUID> {
  List<Section> findByTemplateIdOrderBySortOrderAscCreatedAtDesc(UUID templateId);

  long countByTemplateId(UUID templateId);

  @Query("SELECT COALESCE(MAX(s.sortOrder), 0) FROM Section s WHERE s.templateId = :templateId")
  int findMaxSortOrder(@Param("templateId") UUID templateId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM Section s WHERE s.templateId = :templateId")
  void deleteByTemplateId(@Param("templateId") UUID templateId);
}
