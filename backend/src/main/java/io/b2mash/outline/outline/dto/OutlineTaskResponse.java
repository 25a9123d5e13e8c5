package io.b2mash.outline.outline.dto;

import io.b2mash.outline.outline.OutlineNode;
import io.b2mash.outline.outline.TaskNode;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record OutlineTaskResponse(
    UUID id,
    UUID parentId,
    String title,
    String description,
    LocalDate dueDate,
    String assignedTo,
    Integer estimatedDays,
    int offsetDays,
    List<OutlineTaskResponse> children) {

  public static OutlineTaskResponse from(OutlineNode node) {
    return of(node.task(), node.children().stream().map(OutlineTaskResponse::from).toList());
  }

  /** A single task without its subtree. */
  public static OutlineTaskResponse from(TaskNode task) {
    return of(task, List.of());
  }

  private static OutlineTaskResponse of(TaskNode task, List<OutlineTaskResponse> children) {
    return new OutlineTaskResponse(
        task.id(),
        task.parentId(),
        task.title(),
        task.description(),
        task.dueDate(),
        task.assignedTo(),
        task.estimatedDays(),
        task.offsetDays(),
        children);
  }
}
