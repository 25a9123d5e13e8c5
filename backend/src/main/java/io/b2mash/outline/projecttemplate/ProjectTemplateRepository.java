package io.b2mash.outline.projecttemplate;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectTemplateRepository extends JpaRepository<ProjectTemplate, UUID> {
  List<ProjectTemplate> findAllByOrderByNameAsc();
}
