package io.b2mash.outline.section.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record CreateSectionRequest(
    @NotNull UUID templateId, @NotBlank @Size(max = 300) String title, String description) {}
