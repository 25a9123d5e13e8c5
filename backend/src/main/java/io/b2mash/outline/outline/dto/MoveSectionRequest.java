package io.b2mash.outline.outline.dto;

/** Drop position for a dragged section; out-of-range indexes are clamped. */
public record MoveSectionRequest(int targetIndex) {}
