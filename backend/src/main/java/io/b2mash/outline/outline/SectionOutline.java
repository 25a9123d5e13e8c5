package io.b2mash.outline.outline;

import java.util.List;

public record SectionOutline(SectionNode section, List<OutlineNode> roots) {

  public SectionOutline {
    roots = List.copyOf(roots);
  }

  public int taskCount() {
    return TreeBuilder.count(roots);
  }
}
