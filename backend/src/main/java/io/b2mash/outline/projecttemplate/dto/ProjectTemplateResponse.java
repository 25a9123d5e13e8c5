package io.b2mash.outline.projecttemplate.dto;

import java.time.Instant;
import java.util.UUID;

public record ProjectTemplateResponse(
    UUID id,
    String name,
    String description,
    String meetingType,
    int sectionCount,
    int taskCount,
    Instant createdAt,
    Instant updatedAt) {}
