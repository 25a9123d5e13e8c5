package io.b2mash.outline.outline.dto;

import java.util.UUID;

/** New parent for a task; null moves it to the root level of its section. */
public record MoveTaskRequest(UUID parentId) {}
