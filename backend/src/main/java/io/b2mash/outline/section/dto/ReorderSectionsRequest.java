package io.b2mash.outline.section.dto;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

public record ReorderSectionsRequest(@NotNull List<UUID> sectionIds) {}
