package io.b2mash.outline.task.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record CreateTaskRequest(
    @NotNull UUID sectionId,
    UUID parentId,
    @NotBlank @Size(max = 300) String title,
    String description) {}
