package io.b2mash.outline.outline;

import io.b2mash.outline.exception.InvalidStateException;
import io.b2mash.outline.exception.ResourceNotFoundException;
import io.b2mash.outline.outline.OutlineChangedEvent.Kind;
import io.b2mash.outline.task.ParentChain;
import io.b2mash.outline.task.TaskPatch;
import io.b2mash.outline.task.dto.CreateTaskRequest;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Sends outline edits to the store and reloads the cached snapshot once the store confirms them.
 *
 * <p>Nothing is applied locally ahead of the store: a failed call leaves the cache exactly as it
 * was. Input problems are reported as failed futures before any store call is made.
 */
@Service
public class OutlineMutationCoordinator {

  private static final Logger log = LoggerFactory.getLogger(OutlineMutationCoordinator.class);

  private final OutlineBackend backend;
  private final OutlineReadModel readModel;
  private final ApplicationEventPublisher eventPublisher;

  public OutlineMutationCoordinator(
      OutlineBackend backend,
      OutlineReadModel readModel,
      ApplicationEventPublisher eventPublisher) {
    this.backend = backend;
    this.readModel = readModel;
    this.eventPublisher = eventPublisher;
  }

  public CompletableFuture<TaskNode> createTask(
      UUID templateId, UUID sectionId, UUID parentId, String title, String description) {
    if (isBlank(title)) {
      return CompletableFuture.failedFuture(
          new InvalidStateException("Invalid task", "Task title is required."));
    }
    var input = new CreateTaskRequest(sectionId, parentId, title.trim(), description);
    return confirmed(templateId, Kind.TASK_CREATED, backend.createTask(input), TaskNode::id);
  }

  /** Creates a child of {@code parentId} in the parent's section. */
  public CompletableFuture<TaskNode> addSubtask(UUID templateId, UUID parentId, String title) {
    if (isBlank(title)) {
      return CompletableFuture.failedFuture(
          new InvalidStateException("Invalid task", "Task title is required."));
    }
    return readModel
        .load(templateId)
        .thenCompose(
            snapshot -> {
              var parent = snapshot.task(parentId);
              if (parent.isEmpty()) {
                return CompletableFuture.failedFuture(
                    new ResourceNotFoundException("TemplateTask", parentId));
              }
              return createTask(templateId, parent.get().sectionId(), parentId, title, "");
            });
  }

  public CompletableFuture<TaskNode> updateTask(UUID templateId, UUID id, TaskPatch patch) {
    if (patch.has(TaskPatch.Field.TITLE) && isBlank(patch.title())) {
      return CompletableFuture.failedFuture(
          new InvalidStateException("Invalid task", "Task title is required."));
    }
    if (patch.changesParent() && patch.parentId() != null) {
      var rejection = checkNewParent(templateId, id, patch.parentId());
      if (rejection != null) {
        return CompletableFuture.failedFuture(rejection);
      }
    }
    return confirmed(templateId, Kind.TASK_UPDATED, backend.updateTask(id, patch), TaskNode::id);
  }

  /**
   * Deletes one task. Callers confirm destructive intent first. Children are not deleted; they
   * show up as roots of the section after the reload.
   */
  public CompletableFuture<Void> deleteTask(UUID templateId, UUID id) {
    return confirmed(templateId, Kind.TASK_DELETED, backend.deleteTask(id), ignored -> id);
  }

  /** Persists a drag-reordered list of siblings under {@code parentId} (null for roots). */
  public CompletableFuture<Void> reorderTasks(
      UUID templateId, UUID sectionId, UUID parentId, List<UUID> orderedTaskIds) {
    return confirmed(
        templateId,
        Kind.TASKS_REORDERED,
        backend.reorderTasks(sectionId, parentId, List.copyOf(orderedTaskIds)),
        ignored -> parentId != null ? parentId : sectionId);
  }

  public CompletableFuture<SectionNode> createSection(UUID templateId, String title) {
    if (isBlank(title)) {
      return CompletableFuture.failedFuture(
          new InvalidStateException("Invalid section", "Section title is required."));
    }
    return confirmed(
        templateId,
        Kind.SECTION_CREATED,
        backend.createSection(templateId, title.trim()),
        SectionNode::id);
  }

  public CompletableFuture<SectionNode> renameSection(
      UUID templateId, UUID sectionId, String title, String description) {
    if (isBlank(title)) {
      return CompletableFuture.failedFuture(
          new InvalidStateException("Invalid section", "Section title is required."));
    }
    return confirmed(
        templateId,
        Kind.SECTION_UPDATED,
        backend.updateSection(sectionId, title.trim(), description),
        SectionNode::id);
  }

  /** Deletes the section and every task in it. Callers confirm destructive intent first. */
  public CompletableFuture<Void> deleteSection(UUID templateId, UUID sectionId) {
    return confirmed(
        templateId, Kind.SECTION_DELETED, backend.deleteSection(sectionId), ignored -> sectionId);
  }

  /**
   * Checks a reparent against the cached flat list. The store repeats the check authoritatively;
   * this only spares a round trip for moves that are already known to be invalid.
   */
  private RuntimeException checkNewParent(UUID templateId, UUID id, UUID newParentId) {
    if (newParentId.equals(id)) {
      return new InvalidStateException("Invalid parent", "A task cannot be its own parent.");
    }
    var snapshot = readModel.cached(templateId).orElse(null);
    if (snapshot == null) {
      return null;
    }
    var task = snapshot.task(id).orElse(null);
    var parent = snapshot.task(newParentId).orElse(null);
    if (task != null && parent != null && !task.sectionId().equals(parent.sectionId())) {
      return new InvalidStateException(
          "Invalid parent", "Parent task " + newParentId + " belongs to another section.");
    }
    if (ParentChain.wouldCreateCycle(id, newParentId, snapshot.parentLookup())) {
      return new InvalidStateException(
          "Invalid parent", "Task " + newParentId + " is a descendant of " + id + ".");
    }
    return null;
  }

  /**
   * Completes with the store's result after the snapshot reload. A not-found failure still
   * triggers a reload, because the cached list is known to be out of date.
   */
  private <T> CompletableFuture<T> confirmed(
      UUID templateId, Kind kind, CompletableFuture<T> write, Function<T, UUID> entityId) {
    return write
        .whenComplete(
            (result, ex) -> {
              if (ex != null && Futures.unwrap(ex) instanceof ResourceNotFoundException) {
                log.info("Outline of template {} is stale, reloading", templateId);
                readModel.refresh(templateId);
              }
            })
        .thenCompose(
            result ->
                readModel
                    .refresh(templateId)
                    .handle(
                        (snapshot, reloadFailure) -> {
                          if (reloadFailure != null) {
                            // The write stands; drop the old entry so the next read reloads.
                            readModel.invalidate(templateId);
                          }
                          log.info("Outline {} {} confirmed", templateId, kind);
                          eventPublisher.publishEvent(
                              OutlineChangedEvent.of(templateId, kind, entityId.apply(result)));
                          return result;
                        }));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
