package io.b2mash.outline.outline;

import java.util.List;

/** A task with its derived children. Built by {@link TreeBuilder}, never read back as input. */
public record OutlineNode(TaskNode task, List<OutlineNode> children) {

  public OutlineNode {
    children = List.copyOf(children);
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }
}
