package io.b2mash.outline.projecttemplate.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateTemplateRequest(
    @NotBlank @Size(max = 300) String name,
    String description,
    @Size(max = 50) String meetingType) {}
