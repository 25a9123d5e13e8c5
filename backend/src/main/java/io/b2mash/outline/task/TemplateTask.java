package io.b2mash.outline.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One task row of a template outline. The tree is recorded only through {@link #parentId}; child
 * lists are always derived and never stored.
 */
@Entity
@Table(name = "template_tasks")
public class TemplateTask {

  /** Assignee sentinel meaning "whoever instantiates the template". */
  public static final String ASSIGNEE_SELF = "me";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "template_id", nullable = false)
  private UUID templateId;

  @Column(name = "section_id", nullable = false)
  private UUID sectionId;

  // Weak reference: plain UUID, no FK. A dangling value makes the task a root of its section.
  @Column(name = "parent_id")
  private UUID parentId;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "assigned_to", length = 64)
  private String assignedTo;

  @Column(name = "estimated_days")
  private Integer estimatedDays;

  @Column(name = "offset_days", nullable = false)
  private int offsetDays;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TemplateTask() {}

  public TemplateTask(
      UUID templateId,
      UUID sectionId,
      UUID parentId,
      String title,
      String description,
      int sortOrder) {
    this.templateId = templateId;
    this.sectionId = sectionId;
    this.parentId = parentId;
    this.title = title;
    this.description = description;
    this.sortOrder = sortOrder;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void applyDetails(
      String title,
      String description,
      LocalDate dueDate,
      String assignedTo,
      Integer estimatedDays,
      int offsetDays) {
    this.title = title;
    this.description = description;
    this.dueDate = dueDate;
    this.assignedTo = assignedTo;
    this.estimatedDays = estimatedDays;
    this.offsetDays = offsetDays;
    this.updatedAt = Instant.now();
  }

  public void reparent(UUID parentId, int sortOrder) {
    this.parentId = parentId;
    this.sortOrder = sortOrder;
    this.updatedAt = Instant.now();
  }

  public void moveTo(int sortOrder) {
    this.sortOrder = sortOrder;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public UUID getSectionId() {
    return sectionId;
  }

  public UUID getParentId() {
    return parentId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public String getAssignedTo() {
    return assignedTo;
  }

  public Integer getEstimatedDays() {
    return estimatedDays;
  }

  public int getOffsetDays() {
    return offsetDays;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
