package io.b2mash.outline.outline.dto;

import io.b2mash.outline.outline.SectionOutline;
import java.util.List;
import java.util.UUID;

public record SectionOutlineResponse(
    UUID id, String title, String description, int taskCount, List<OutlineTaskResponse> tasks) {

  public static SectionOutlineResponse from(SectionOutline outline) {
    return new SectionOutlineResponse(
        outline.section().id(),
        outline.section().title(),
        outline.section().description(),
        outline.taskCount(),
        outline.roots().stream().map(OutlineTaskResponse::from).toList());
  }
}
