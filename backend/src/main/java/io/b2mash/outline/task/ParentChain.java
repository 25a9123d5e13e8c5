package io.b2mash.outline.task;

import java.util.HashSet;
import java.util.UUID;
import java.util.function.Function;

/** Ancestor walks over parent pointers. Tolerates malformed data that already contains loops. */
public final class ParentChain {

  private ParentChain() {}

  /**
   * Returns true when attaching {@code taskId} under {@code newParentId} would make the task its
   * own ancestor, i.e. the new parent is the task itself or one of its descendants.
   *
   * @param parentOf resolves an id to its current parent id, or null for roots and unknown ids
   */
  public static boolean wouldCreateCycle(
      UUID taskId, UUID newParentId, Function<UUID, UUID> parentOf) {
    if (newParentId == null) {
      return false;
    }
    var seen = new HashSet<UUID>();
    UUID current = newParentId;
    while (current != null && seen.add(current)) {
      if (current.equals(taskId)) {
        return true;
      }
      current = parentOf.apply(current);
    }
    return false;
  }
}
