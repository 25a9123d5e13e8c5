package io.b2mash.outline.section.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateSectionRequest(@NotBlank @Size(max = 300) String title, String description) {}
