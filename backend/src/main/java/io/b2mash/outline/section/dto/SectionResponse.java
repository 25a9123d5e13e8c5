package io.b2mash.outline.section.dto;

import io.b2mash.outline.section.Section;
import java.util.UUID;

public record SectionResponse(
    UUID id, UUID templateId, String title, String description, int sortOrder) {

  public static SectionResponse from(Section section) {
    return new SectionResponse(
        section.getId(),
        section.getTemplateId(),
        section.getTitle(),
        section.getDescription(),
        section.getSortOrder());
  }
}
