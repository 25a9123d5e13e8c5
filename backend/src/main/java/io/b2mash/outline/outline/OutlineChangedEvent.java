package io.b2mash.outline.outline;

import java.time.Instant;
import java.util.UUID;

/** Published after a confirmed outline write, once the cached snapshot has been reloaded. */
public record OutlineChangedEvent(UUID templateId, Kind kind, UUID entityId, Instant occurredAt) {

  public enum Kind {
    TASK_CREATED,
    TASK_UPDATED,
    TASK_DELETED,
    TASKS_REORDERED,
    SECTION_CREATED,
    SECTION_UPDATED,
    SECTION_DELETED,
    SECTIONS_REORDERED;

    public boolean changesSectionSet() {
      return this == SECTION_CREATED || this == SECTION_DELETED;
    }
  }

  public static OutlineChangedEvent of(UUID templateId, Kind kind, UUID entityId) {
    return new OutlineChangedEvent(templateId, kind, entityId, Instant.now());
  }
}
