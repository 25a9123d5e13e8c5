package io.b2mash.outline.outline;

import io.b2mash.outline.section.Section;
import java.util.UUID;

public record SectionNode(
    UUID id, UUID templateId, String title, String description, int sortOrder) {

  public static SectionNode from(Section section) {
    return new SectionNode(
        section.getId(),
        section.getTemplateId(),
        section.getTitle(),
        section.getDescription(),
        section.getSortOrder());
  }
}
