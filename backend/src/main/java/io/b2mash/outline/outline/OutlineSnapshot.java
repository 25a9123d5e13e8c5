package io.b2mash.outline.outline;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One confirmed copy of a template's sections and flat task list. {@code version} grows with every
 * successful load, so derived values can be memoized on it.
 */
public record OutlineSnapshot(
    UUID templateId, long version, List<SectionNode> sections, List<TaskNode> tasks) {

  public OutlineSnapshot {
    sections = List.copyOf(sections);
    tasks = List.copyOf(tasks);
  }

  public List<UUID> sectionIds() {
    return sections.stream().map(SectionNode::id).toList();
  }

  public Optional<TaskNode> task(UUID id) {
    return tasks.stream().filter(t -> t.id().equals(id)).findFirst();
  }

  /** Parent lookup for ancestor walks; unknown ids resolve to null. */
  public Function<UUID, UUID> parentLookup() {
    Map<UUID, TaskNode> byId =
        tasks.stream().collect(Collectors.toMap(TaskNode::id, t -> t, (first, dup) -> first));
    return id -> {
      var node = byId.get(id);
      return node != null ? node.parentId() : null;
    };
  }
}
