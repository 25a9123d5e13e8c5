package io.b2mash.outline.task.dto;

import io.b2mash.outline.task.TemplateTask;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record TemplateTaskResponse(
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
    int sortOrder,
    Instant updatedAt) {

  public static TemplateTaskResponse from(TemplateTask task) {
    return new TemplateTaskResponse(
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
        task.getSortOrder(),
        task.getUpdatedAt());
  }
}
