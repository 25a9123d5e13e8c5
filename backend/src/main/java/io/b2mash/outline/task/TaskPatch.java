package io.b2mash.outline.task;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Partial update of a template task. Only fields named in {@link #fields()} change; a named field
 * set to {@code null} clears it (for {@link Field#PARENT} this moves the task to the section root).
 */
public final class TaskPatch {

  public enum Field {
    TITLE,
    DESCRIPTION,
    DUE_DATE,
    ASSIGNED_TO,
    ESTIMATED_DAYS,
    OFFSET_DAYS,
    PARENT
  }

  private final Set<Field> fields;
  private final String title;
  private final String description;
  private final LocalDate dueDate;
  private final String assignedTo;
  private final Integer estimatedDays;
  private final Integer offsetDays;
  private final UUID parentId;

  private TaskPatch(Builder builder) {
    this.fields = Collections.unmodifiableSet(EnumSet.copyOf(builder.fields));
    this.title = builder.title;
    this.description = builder.description;
    this.dueDate = builder.dueDate;
    this.assignedTo = builder.assignedTo;
    this.estimatedDays = builder.estimatedDays;
    this.offsetDays = builder.offsetDays;
    this.parentId = builder.parentId;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static TaskPatch rename(String title) {
    return builder().title(title).build();
  }

  public static TaskPatch moveUnder(UUID parentId) {
    return builder().parentId(parentId).build();
  }

  public static TaskPatch moveToRoot() {
    return builder().parentId(null).build();
  }

  public boolean has(Field field) {
    return fields.contains(field);
  }

  public boolean changesParent() {
    return has(Field.PARENT);
  }

  public Set<Field> fields() {
    return fields;
  }

  public String title() {
    return title;
  }

  public String description() {
    return description;
  }

  public LocalDate dueDate() {
    return dueDate;
  }

  public String assignedTo() {
    return assignedTo;
  }

  public Integer estimatedDays() {
    return estimatedDays;
  }

  public Integer offsetDays() {
    return offsetDays;
  }

  public UUID parentId() {
    return parentId;
  }

  @Override
  public String toString() {
    return "TaskPatch" + fields;
  }

  public static final class Builder {

    private final EnumSet<Field> fields = EnumSet.noneOf(Field.class);
    private String title;
    private String description;
    private LocalDate dueDate;
    private String assignedTo;
    private Integer estimatedDays;
    private Integer offsetDays;
    private UUID parentId;

    private Builder() {}

    public Builder title(String title) {
      this.title = title;
      fields.add(Field.TITLE);
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      fields.add(Field.DESCRIPTION);
      return this;
    }

    public Builder dueDate(LocalDate dueDate) {
      this.dueDate = dueDate;
      fields.add(Field.DUE_DATE);
      return this;
    }

    public Builder assignedTo(String assignedTo) {
      this.assignedTo = assignedTo;
      fields.add(Field.ASSIGNED_TO);
      return this;
    }

    public Builder estimatedDays(Integer estimatedDays) {
      this.estimatedDays = estimatedDays;
      fields.add(Field.ESTIMATED_DAYS);
      return this;
    }

    public Builder offsetDays(Integer offsetDays) {
      this.offsetDays = offsetDays;
      fields.add(Field.OFFSET_DAYS);
      return this;
    }

    public Builder parentId(UUID parentId) {
      this.parentId = parentId;
      fields.add(Field.PARENT);
      return this;
    }

    public TaskPatch build() {
      return new TaskPatch(this);
    }
  }
}
