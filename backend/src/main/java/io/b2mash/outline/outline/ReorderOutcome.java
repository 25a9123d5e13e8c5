package io.b2mash.outline.outline;

import java.util.List;
import java.util.UUID;

/**
 * Result of one drop. {@code superseded} is set when a later drop replaced this one before its
 * response could take effect; {@code order} is then the order displayed at that moment.
 */
public record ReorderOutcome(
    UUID templateId, List<UUID> order, ReorderState state, long sequence, boolean superseded) {

  public ReorderOutcome {
    order = List.copyOf(order);
  }
}
