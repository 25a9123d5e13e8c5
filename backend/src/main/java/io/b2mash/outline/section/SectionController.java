package io.b2mash.outline.section;

import io.b2mash.outline.section.dto.CreateSectionRequest;
import io.b2mash.outline.section.dto.ReorderSectionsRequest;
import io.b2mash.outline.section.dto.SectionResponse;
import io.b2mash.outline.section.dto.UpdateSectionRequest;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SectionController {

  private final SectionService sectionService;

  public SectionController(SectionService sectionService) {
    this.sectionService = sectionService;
  }

  @GetMapping("/api/project-templates/{templateId}/sections")
  public ResponseEntity<List<SectionResponse>> listSections(@PathVariable UUID templateId) {
    return ResponseEntity.ok(
        sectionService.listByTemplate(templateId).stream().map(SectionResponse::from).toList());
  }

  @PostMapping("/api/sections")
  public ResponseEntity<SectionResponse> createSection(
      @Valid @RequestBody CreateSectionRequest request) {
    var section =
        sectionService.create(request.templateId(), request.title(), request.description());
    return ResponseEntity.created(URI.create("/api/sections/" + section.getId()))
        .body(SectionResponse.from(section));
  }

  @PutMapping("/api/sections/{id}")
  public ResponseEntity<SectionResponse> updateSection(
      @PathVariable UUID id, @Valid @RequestBody UpdateSectionRequest request) {
    return ResponseEntity.ok(
        SectionResponse.from(sectionService.update(id, request.title(), request.description())));
  }

  @DeleteMapping("/api/sections/{id}")
  public ResponseEntity<Void> deleteSection(@PathVariable UUID id) {
    sectionService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/api/project-templates/{templateId}/sections/order")
  public ResponseEntity<List<SectionResponse>> reorderSections(
      @PathVariable UUID templateId, @Valid @RequestBody ReorderSectionsRequest request) {
    return ResponseEntity.ok(
        sectionService.reorder(templateId, request.sectionIds()).stream()
            .map(SectionResponse::from)
            .toList());
  }
}
