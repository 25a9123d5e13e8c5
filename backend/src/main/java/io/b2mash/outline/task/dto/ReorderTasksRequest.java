package io.b2mash.outline.task.dto;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

/** Full sibling order under {@code parentId} (or the section root when null). */
public record ReorderTasksRequest(UUID parentId, @NotNull List<UUID> taskIds) {}
