package io.b2mash.outline.section;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A milestone: the explicitly ordered top-level container of a template's tasks. */
@Entity
@Table(name = "sections")
public class Section {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  // Owner stored as plain UUID, no @ManyToOne. Template deletion removes sections explicitly.
  @Column(name = "template_id", nullable = false)
  private UUID templateId;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Section() {}

  public Section(UUID templateId, String title, String description, int sortOrder) {
    this.templateId = templateId;
    this.title = title;
    this.description = description;
    this.sortOrder = sortOrder;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void rename(String title, String description) {
    this.title = title;
    this.description = description;
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

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
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
