package io.b2mash.outline.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Raised inside the writing transaction whenever a template's sections or tasks change, whatever
 * the entry point. Listeners that cache template content react after commit.
 */
public record TemplateContentChangedEvent(
    UUID templateId, String entityType, UUID entityId, String action, Instant occurredAt) {

  public static TemplateContentChangedEvent of(
      UUID templateId, String entityType, UUID entityId, String action) {
    return new TemplateContentChangedEvent(
        templateId, entityType, entityId, action, Instant.now());
  }

  public boolean templateDeleted() {
    return "project_template".equals(entityType) && "deleted".equals(action);
  }
}
