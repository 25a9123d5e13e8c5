package io.b2mash.outline.task.dto;

import io.b2mash.outline.task.TaskPatch;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.UUID;

/**
 * PATCH body for a template task. Absent (null) fields are left unchanged; the {@code clear*} and
 * {@code detachParent} flags explicitly reset a field.
 */
public record UpdateTaskRequest(
    @Size(max = 300) String title,
    String description,
    LocalDate dueDate,
    String assignedTo,
    @Min(0) Integer estimatedDays,
    Integer offsetDays,
    UUID parentId,
    boolean detachParent,
    boolean clearDueDate,
    boolean clearAssignee) {

  public TaskPatch toPatch() {
    var builder = TaskPatch.builder();
    if (title != null) {
      builder.title(title);
    }
    if (description != null) {
      builder.description(description);
    }
    if (clearDueDate) {
      builder.dueDate(null);
    } else if (dueDate != null) {
      builder.dueDate(dueDate);
    }
    if (clearAssignee) {
      builder.assignedTo(null);
    } else if (assignedTo != null) {
      builder.assignedTo(assignedTo);
    }
    if (estimatedDays != null) {
      builder.estimatedDays(estimatedDays);
    }
    if (offsetDays != null) {
      builder.offsetDays(offsetDays);
    }
    if (detachParent) {
      builder.parentId(null);
    } else if (parentId != null) {
      builder.parentId(parentId);
    }
    return builder.build();
  }
}
