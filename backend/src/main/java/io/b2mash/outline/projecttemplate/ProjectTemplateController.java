package io.b2mash.outline.projecttemplate;

import io.b2mash.outline.projecttemplate.dto.CreateTemplateRequest;
import io.b2mash.outline.projecttemplate.dto.ProjectTemplateResponse;
import io.b2mash.outline.projecttemplate.dto.UpdateTemplateRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/project-templates")
public class ProjectTemplateController {

  private final ProjectTemplateService projectTemplateService;

  public ProjectTemplateController(ProjectTemplateService projectTemplateService) {
    this.projectTemplateService = projectTemplateService;
  }

  @GetMapping
  public ResponseEntity<List<ProjectTemplateResponse>> listTemplates() {
    return ResponseEntity.ok(projectTemplateService.list());
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProjectTemplateResponse> getTemplate(@PathVariable UUID id) {
    return ResponseEntity.ok(projectTemplateService.get(id));
  }

  @PostMapping
  public ResponseEntity<ProjectTemplateResponse> createTemplate(
      @Valid @RequestBody CreateTemplateRequest request) {
    var response = projectTemplateService.create(request);
    return ResponseEntity.created(URI.create("/api/project-templates/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<ProjectTemplateResponse> updateTemplate(
      @PathVariable UUID id, @Valid @RequestBody UpdateTemplateRequest request) {
    return ResponseEntity.ok(projectTemplateService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteTemplate(@PathVariable UUID id) {
    projectTemplateService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/duplicate")
  public ResponseEntity<ProjectTemplateResponse> duplicateTemplate(@PathVariable UUID id) {
    var response = projectTemplateService.duplicate(id);
    return ResponseEntity.created(URI.create("/api/project-templates/" + response.id()))
        .body(response);
  }
}
