package io.b2mash.outline.outline;

import io.b2mash.outline.task.TaskPatch;
import io.b2mash.outline.task.dto.CreateTaskRequest;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous view of the task and section store as the outline engine consumes it. Futures fail
 * with the store's typed errors ({@code InvalidStateException}, {@code ResourceNotFoundException},
 * {@code ReorderConflictException}) or with {@code OutlineTransportException}.
 */
public interface OutlineBackend {

  CompletableFuture<List<SectionNode>> listSections(UUID templateId);

  CompletableFuture<List<TaskNode>> listTasksForSection(UUID sectionId);

  CompletableFuture<TaskNode> createTask(CreateTaskRequest input);

  CompletableFuture<TaskNode> updateTask(UUID id, TaskPatch patch);

  CompletableFuture<Void> deleteTask(UUID id);

  CompletableFuture<Void> reorderTasks(UUID sectionId, UUID parentId, List<UUID> orderedTaskIds);

  CompletableFuture<SectionNode> createSection(UUID templateId, String title);

  CompletableFuture<SectionNode> updateSection(UUID id, String title, String description);

  /** Also removes every task of the section. */
  CompletableFuture<Void> deleteSection(UUID id);

  CompletableFuture<Void> reorderSections(UUID templateId, List<UUID> orderedSectionIds);
}
