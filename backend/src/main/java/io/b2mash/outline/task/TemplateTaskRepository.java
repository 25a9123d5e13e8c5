package io.b2mash.outline.task;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TemplateTaskRepository extends JpaRepository<TemplateTask, UUID> {
  List<TemplateTask> findBySectionIdOrderBySortOrderAscCreatedAtAsc(UUID sectionId);

  List<TemplateTask> findByTemplateIdOrderBySortOrderAscCreatedAtAsc(UUID templateId);

  long countByTemplateId(UUID templateId);

  @Query(
      "SELECT COALESCE(MAX(t.sortOrder), 0) FROM TemplateTask t"
          + " WHERE t.sectionId = :sectionId AND t.parentId IS NULL")
  int findMaxRootSortOrder(@Param("sectionId") UUID sectionId);

  @Query("SELECT COALESCE(MAX(t.sortOrder), 0) FROM TemplateTask t WHERE t.parentId = :parentId")
  int findMaxChildSortOrder(@Param("parentId") UUID parentId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM TemplateTask t WHERE t.sectionId = :sectionId")
  void deleteBySectionId(@Param("sectionId") UUID sectionId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM TemplateTask t WHERE t.templateId = :templateId")
  void deleteByTemplateId(@Param("templateId") UUID templateId);
}
