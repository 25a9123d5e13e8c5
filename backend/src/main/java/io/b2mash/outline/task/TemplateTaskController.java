package io.b2mash.outline.task;

import io.b2mash.outline.task.dto.CreateTaskRequest;
import io.b2mash.outline.task.dto.ReorderTasksRequest;
import io.b2mash.outline.task.dto.TemplateTaskResponse;
import io.b2mash.outline.task.dto.UpdateTaskRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TemplateTaskController {

  private final TemplateTaskService taskService;

  public TemplateTaskController(TemplateTaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping("/api/sections/{sectionId}/tasks")
  public ResponseEntity<List<TemplateTaskResponse>> listTasks(@PathVariable UUID sectionId) {
    return ResponseEntity.ok(
        taskService.listBySection(sectionId).stream().map(TemplateTaskResponse::from).toList());
  }

  @GetMapping("/api/tasks/{id}")
  public ResponseEntity<TemplateTaskResponse> getTask(@PathVariable UUID id) {
    return ResponseEntity.ok(TemplateTaskResponse.from(taskService.get(id)));
  }

  @PostMapping("/api/tasks")
  public ResponseEntity<TemplateTaskResponse> createTask(
      @Valid @RequestBody CreateTaskRequest request) {
    var task = taskService.create(request);
    return ResponseEntity.created(URI.create("/api/tasks/" + task.getId()))
        .body(TemplateTaskResponse.from(task));
  }

  @PatchMapping("/api/tasks/{id}")
  public ResponseEntity<TemplateTaskResponse> updateTask(
      @PathVariable UUID id, @Valid @RequestBody UpdateTaskRequest request) {
    return ResponseEntity.ok(TemplateTaskResponse.from(taskService.update(id, request.toPatch())));
  }

  @DeleteMapping("/api/tasks/{id}")
  public ResponseEntity<Void> deleteTask(@PathVariable UUID id) {
    taskService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/api/sections/{sectionId}/tasks/order")
  public ResponseEntity<List<TemplateTaskResponse>> reorderTasks(
      @PathVariable UUID sectionId, @Valid @RequestBody ReorderTasksRequest request) {
    return ResponseEntity.ok(
        taskService.reorderSiblings(sectionId, request.parentId(), request.taskIds()).stream()
            .map(TemplateTaskResponse::from)
            .toList());
  }
}
