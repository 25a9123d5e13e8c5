package io.b2mash.outline.outline;

import io.b2mash.outline.task.TemplateTask;
import java.time.LocalDate;
import java.util.UUID;

/** Immutable cached copy of one task row. Carries no child list; see {@link OutlineNode}. */
public record TaskNode(
    UUID id,
    UUID templateId,
    UUID sectionId,
    UUID parentId,
    String title,
    String description,
    LocalDate dueDate,
    String assignedTo,
    Integer estimatedDays,
    int offsetDays,
    int sortOrder) {

  public static TaskNode from(TemplateTask task) {
    return new TaskNode(
        task.getId(),
        task.getTemplateId(),
        task.getSectionId(),
        task.getParentId(),
        task.getTitle(),
        task.getDescription(),
        task.getDueDate(),
        task.getAssignedTo(),
        task.getEstimatedDays(),
        task.getOffsetDays(),
        task.getSortOrder());
  }
}
