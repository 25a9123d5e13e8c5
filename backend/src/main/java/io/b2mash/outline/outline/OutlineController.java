package io.b2mash.outline.outline;

import io.b2mash.outline.outline.dto.AddSubtaskRequest;
import io.b2mash.outline.outline.dto.MoveSectionRequest;
import io.b2mash.outline.outline.dto.MoveTaskRequest;
import io.b2mash.outline.outline.dto.OutlineRowResponse;
import io.b2mash.outline.outline.dto.OutlineTaskResponse;
import io.b2mash.outline.outline.dto.SectionOutlineResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/project-templates/{templateId}/outline")
public class OutlineController {

  private final OutlineService outlineService;

  public OutlineController(OutlineService outlineService) {
    this.outlineService = outlineService;
  }

  @GetMapping
  public ResponseEntity<List<SectionOutlineResponse>> getOutline(@PathVariable UUID templateId) {
    return ResponseEntity.ok(
        outlineService.getForest(templateId).stream().map(SectionOutlineResponse::from).toList());
  }

  /** Pre-order rows of one section with their indent depth. */
  @GetMapping("/sections/{sectionId}/rows")
  public ResponseEntity<List<OutlineRowResponse>> getRows(
      @PathVariable UUID templateId, @PathVariable UUID sectionId) {
    return ResponseEntity.ok(
        outlineService.getRows(templateId, sectionId).stream()
            .map(OutlineRowResponse::from)
            .toList());
  }

  @PostMapping("/sections/{sectionId}/move")
  public ResponseEntity<ReorderOutcome> moveSection(
      @PathVariable UUID templateId,
      @PathVariable UUID sectionId,
      @RequestBody MoveSectionRequest request) {
    return ResponseEntity.ok(
        outlineService.moveSection(templateId, sectionId, request.targetIndex()));
  }

  @PostMapping("/tasks/{taskId}/subtasks")
  public ResponseEntity<OutlineTaskResponse> addSubtask(
      @PathVariable UUID templateId,
      @PathVariable UUID taskId,
      @Valid @RequestBody AddSubtaskRequest request) {
    var task = outlineService.addSubtask(templateId, taskId, request.title());
    return ResponseEntity.created(URI.create("/api/tasks/" + task.id()))
        .body(OutlineTaskResponse.from(task));
  }

  @PostMapping("/tasks/{taskId}/move")
  public ResponseEntity<OutlineTaskResponse> moveTask(
      @PathVariable UUID templateId,
      @PathVariable UUID taskId,
      @RequestBody MoveTaskRequest request) {
    return ResponseEntity.ok(
        OutlineTaskResponse.from(outlineService.moveTask(templateId, taskId, request.parentId())));
  }
}
