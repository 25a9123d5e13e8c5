package io.b2mash.outline.outline;

/**
 * Lifecycle of a section drag. Dragging itself is tracked by the view and never reaches the
 * engine.
 */
public enum ReorderState {
  /** Displayed order equals the last confirmed order. */
  IDLE,
  /** A drop was applied locally and its request is waiting for the previous one to settle. */
  OPTIMISTICALLY_REORDERED,
  /** The request carrying the full order is in flight. */
  RECONCILING,
  CONFIRMED,
  /** The latest request failed; the last confirmed order is displayed again. */
  ROLLED_BACK
}
