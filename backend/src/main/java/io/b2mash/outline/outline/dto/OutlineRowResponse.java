package io.b2mash.outline.outline.dto;

import io.b2mash.outline.outline.TreeBuilder;
import java.util.UUID;

public record OutlineRowResponse(
    UUID id, UUID parentId, String title, int depth, boolean hasChildren) {

  public static OutlineRowResponse from(TreeBuilder.Row row) {
    var task = row.node().task();
    return new OutlineRowResponse(
        task.id(), task.parentId(), task.title(), row.depth(), row.node().hasChildren());
  }
}
