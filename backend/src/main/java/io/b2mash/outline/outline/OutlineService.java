package io.b2mash.outline.outline;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.outline.exception.ResourceNotFoundException;
import io.b2mash.outline.task.TaskPatch;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Read side of the outline: the section forests in the order the viewer currently sees, which
 * includes a drop that is still being confirmed.
 */
@Service
public class OutlineService {

  private final OutlineReadModel readModel;
  private final SectionOrderingEngine orderingEngine;
  private final OutlineMutationCoordinator coordinator;
  private final TreeBuilder treeBuilder;
  private final Cache<ForestKey, List<SectionOutline>> forests;

  public OutlineService(
      OutlineReadModel readModel,
      SectionOrderingEngine orderingEngine,
      OutlineMutationCoordinator coordinator,
      TreeBuilder treeBuilder,
      OutlineProperties properties) {
    this.readModel = readModel;
    this.orderingEngine = orderingEngine;
    this.coordinator = coordinator;
    this.treeBuilder = treeBuilder;
    this.forests = Caffeine.newBuilder().maximumSize(properties.forestCacheMaxSize()).build();
  }

  /** Memoized on the snapshot version and the displayed section order. */
  public List<SectionOutline> getForest(UUID templateId) {
    var snapshot = Futures.join(readModel.load(templateId));
    var sections = orderSections(snapshot.sections(), orderingEngine.reconcile(snapshot));
    var sectionOrder = sections.stream().map(SectionNode::id).toList();
    var key = new ForestKey(templateId, snapshot.version(), sectionOrder);
    return forests.get(key, k -> treeBuilder.buildSections(sections, snapshot.tasks()));
  }

  public List<TreeBuilder.Row> getRows(UUID templateId, UUID sectionId) {
    return getForest(templateId).stream()
        .filter(outline -> outline.section().id().equals(sectionId))
        .findFirst()
        .map(outline -> treeBuilder.flatten(outline.roots()))
        .orElseThrow(() -> new ResourceNotFoundException("Section", sectionId));
  }

  /** Drops a section at {@code targetIndex} and waits for the store to settle the new order. */
  public ReorderOutcome moveSection(UUID templateId, UUID sectionId, int targetIndex) {
    return Futures.join(orderingEngine.drop(templateId, sectionId, targetIndex));
  }

  public TaskNode addSubtask(UUID templateId, UUID parentId, String title) {
    return Futures.join(coordinator.addSubtask(templateId, parentId, title));
  }

  /** Moves a task under {@code newParentId}, or to its section's root level when null. */
  public TaskNode moveTask(UUID templateId, UUID taskId, UUID newParentId) {
    var patch = newParentId == null ? TaskPatch.moveToRoot() : TaskPatch.moveUnder(newParentId);
    return Futures.join(coordinator.updateTask(templateId, taskId, patch));
  }

  /**
   * Applies a displayed order to loaded sections. Sections the order does not know yet keep
   * their loaded position at the end; ids of sections that are gone are skipped.
   */
  static List<SectionNode> orderSections(
      List<SectionNode> loaded, Optional<List<UUID>> displayed) {
    if (displayed.isEmpty()) {
      return loaded;
    }
    var byId =
        loaded.stream()
            .collect(Collectors.toMap(SectionNode::id, Function.identity(), (a, b) -> a));
    var ordered = new ArrayList<SectionNode>(loaded.size());
    var placed = new HashMap<UUID, Boolean>();
    for (UUID id : displayed.get()) {
      var section = byId.get(id);
      if (section != null && placed.putIfAbsent(id, Boolean.TRUE) == null) {
        ordered.add(section);
      }
    }
    for (SectionNode section : loaded) {
      if (!placed.containsKey(section.id())) {
        ordered.add(section);
      }
    }
    return ordered;
  }

  private record ForestKey(UUID templateId, long version, List<UUID> sectionOrder) {}
}
