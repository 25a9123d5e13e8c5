package io.b2mash.outline.outline.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddSubtaskRequest(@NotBlank @Size(max = 300) String title) {}
