package io.b2mash.outline.outline;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Turns flat task rows into ordered trees using each row's parent pointer.
 *
 * <p>The build is total: rows with no parent, a parent missing from the input, a parent equal to
 * themselves, or a parent chain that loops back to themselves all become roots. Roots and
 * children keep input order, so the same input always yields the same forest.
 */
@Component
public class TreeBuilder {

  public List<OutlineNode> buildForest(List<TaskNode> nodes) {
    if (nodes == null || nodes.isEmpty()) {
      return List.of();
    }

    // First occurrence of an id wins.
    Map<UUID, TaskNode> index = new LinkedHashMap<>();
    for (TaskNode node : nodes) {
      index.putIfAbsent(node.id(), node);
    }

    Set<UUID> cyclic = findCycleMembers(index);

    Map<UUID, List<UUID>> childIds = new HashMap<>();
    List<UUID> rootIds = new ArrayList<>();
    for (TaskNode node : index.values()) {
      UUID parentId = node.parentId();
      if (parentId == null || !index.containsKey(parentId) || cyclic.contains(node.id())) {
        rootIds.add(node.id());
      } else {
        childIds.computeIfAbsent(parentId, k -> new ArrayList<>()).add(node.id());
      }
    }

    List<OutlineNode> forest = new ArrayList<>(rootIds.size());
    for (UUID rootId : rootIds) {
      forest.add(assemble(rootId, index, childIds));
    }
    return List.copyOf(forest);
  }

  /**
   * Groups tasks under their sections, in the given section order. Tasks whose section is not
   * listed are left out.
   */
  public List<SectionOutline> buildSections(List<SectionNode> sections, List<TaskNode> tasks) {
    Map<UUID, List<TaskNode>> bySection = new LinkedHashMap<>();
    for (SectionNode section : sections) {
      bySection.put(section.id(), new ArrayList<>());
    }
    for (TaskNode task : tasks) {
      var bucket = bySection.get(task.sectionId());
      if (bucket != null) {
        bucket.add(task);
      }
    }
    return sections.stream()
        .map(section -> new SectionOutline(section, buildForest(bySection.get(section.id()))))
        .toList();
  }

  /** Depth-first, pre-order listing paired with each node's depth (roots are depth 0). */
  public List<Row> flatten(List<OutlineNode> forest) {
    List<Row> rows = new ArrayList<>();
    var stack = new ArrayList<Row>();
    for (int i = forest.size() - 1; i >= 0; i--) {
      stack.add(new Row(forest.get(i), 0));
    }
    while (!stack.isEmpty()) {
      Row row = stack.remove(stack.size() - 1);
      rows.add(row);
      var children = row.node().children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.add(new Row(children.get(i), row.depth() + 1));
      }
    }
    return rows;
  }

  /** Depth of the task in the forest, or -1 when it is not there. */
  public int depthOf(List<OutlineNode> forest, UUID taskId) {
    return flatten(forest).stream()
        .filter(row -> row.node().task().id().equals(taskId))
        .mapToInt(Row::depth)
        .findFirst()
        .orElse(-1);
  }

  static int count(List<OutlineNode> forest) {
    int total = 0;
    var stack = new ArrayList<>(forest);
    while (!stack.isEmpty()) {
      var node = stack.remove(stack.size() - 1);
      total++;
      stack.addAll(node.children());
    }
    return total;
  }

  public record Row(OutlineNode node, int depth) {}

  /**
   * Marks every node that lies on a parent-pointer cycle. Nodes that merely lead into a cycle are
   * not marked; they attach normally because the cycle members they point at become roots.
   */
  private static Set<UUID> findCycleMembers(Map<UUID, TaskNode> index) {
    Set<UUID> cyclic = new HashSet<>();
    Set<UUID> done = new HashSet<>();
    for (UUID start : index.keySet()) {
      if (done.contains(start)) {
        continue;
      }
      List<UUID> path = new ArrayList<>();
      Map<UUID, Integer> positionOnPath = new HashMap<>();
      UUID current = start;
      while (current != null && index.containsKey(current) && !done.contains(current)) {
        Integer seenAt = positionOnPath.get(current);
        if (seenAt != null) {
          cyclic.addAll(path.subList(seenAt, path.size()));
          break;
        }
        positionOnPath.put(current, path.size());
        path.add(current);
        current = index.get(current).parentId();
      }
      done.addAll(path);
    }
    return cyclic;
  }

  // Iterative to keep deep outlines off the call stack.
  private static OutlineNode assemble(
      UUID rootId, Map<UUID, TaskNode> index, Map<UUID, List<UUID>> childIds) {
    Map<UUID, OutlineNode> built = new HashMap<>();
    var stack = new ArrayList<UUID>();
    var expanded = new HashSet<UUID>();
    stack.add(rootId);
    while (!stack.isEmpty()) {
      UUID id = stack.get(stack.size() - 1);
      var children = childIds.getOrDefault(id, List.of());
      if (expanded.add(id)) {
        for (int i = children.size() - 1; i >= 0; i--) {
          stack.add(children.get(i));
        }
        continue;
      }
      stack.remove(stack.size() - 1);
      var childNodes = new ArrayList<OutlineNode>(children.size());
      for (UUID childId : children) {
        childNodes.add(built.remove(childId));
      }
      built.put(id, new OutlineNode(index.get(id), childNodes));
    }
    return built.get(rootId);
  }
}
