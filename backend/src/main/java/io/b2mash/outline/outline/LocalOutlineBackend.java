package io.b2mash.outline.outline;

import io.b2mash.outline.exception.OutlineTransportException;
import io.b2mash.outline.section.SectionService;
import io.b2mash.outline.task.TaskPatch;
import io.b2mash.outline.task.TemplateTaskService;
import io.b2mash.outline.task.dto.CreateTaskRequest;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/** Runs each store call in its own transaction on the outline executor. */
@Component
public class LocalOutlineBackend implements OutlineBackend {

  private static final Logger log = LoggerFactory.getLogger(LocalOutlineBackend.class);

  private final SectionService sectionService;
  private final TemplateTaskService taskService;
  private final Executor executor;

  public LocalOutlineBackend(
      SectionService sectionService,
      TemplateTaskService taskService,
      @Qualifier("outlineBackendExecutor") Executor executor) {
    this.sectionService = sectionService;
    this.taskService = taskService;
    this.executor = executor;
  }

  @Override
  public CompletableFuture<List<SectionNode>> listSections(UUID templateId) {
    return call(
        "listSections",
        () -> sectionService.listByTemplate(templateId).stream().map(SectionNode::from).toList());
  }

  @Override
  public CompletableFuture<List<TaskNode>> listTasksForSection(UUID sectionId) {
    return call(
        "listTasksForSection",
        () -> taskService.listBySection(sectionId).stream().map(TaskNode::from).toList());
  }

  @Override
  public CompletableFuture<TaskNode> createTask(CreateTaskRequest input) {
    return call("createTask", () -> TaskNode.from(taskService.create(input)));
  }

  @Override
  public CompletableFuture<TaskNode> updateTask(UUID id, TaskPatch patch) {
    return call("updateTask", () -> TaskNode.from(taskService.update(id, patch)));
  }

  @Override
  public CompletableFuture<Void> deleteTask(UUID id) {
    return call(
        "deleteTask",
        () -> {
          taskService.delete(id);
          return null;
        });
  }

  @Override
  public CompletableFuture<Void> reorderTasks(
      UUID sectionId, UUID parentId, List<UUID> orderedTaskIds) {
    return call(
        "reorderTasks",
        () -> {
          taskService.reorderSiblings(sectionId, parentId, orderedTaskIds);
          return null;
        });
  }

  @Override
  public CompletableFuture<SectionNode> createSection(UUID templateId, String title) {
    return call(
        "createSection", () -> SectionNode.from(sectionService.create(templateId, title, null)));
  }

  @Override
  public CompletableFuture<SectionNode> updateSection(UUID id, String title, String description) {
    return call(
        "updateSection", () -> SectionNode.from(sectionService.update(id, title, description)));
  }

  @Override
  public CompletableFuture<Void> deleteSection(UUID id) {
    return call(
        "deleteSection",
        () -> {
          sectionService.delete(id);
          return null;
        });
  }

  @Override
  public CompletableFuture<Void> reorderSections(UUID templateId, List<UUID> orderedSectionIds) {
    return call(
        "reorderSections",
        () -> {
          sectionService.reorder(templateId, orderedSectionIds);
          return null;
        });
  }

  private <T> CompletableFuture<T> call(String operation, Supplier<T> work) {
    try {
      return CompletableFuture.supplyAsync(
          () -> {
            try {
              return work.get();
            } catch (DataAccessException e) {
              log.warn("Store call {} failed: {}", operation, e.getMessage());
              throw new OutlineTransportException(operation + " failed", e);
            }
          },
          executor);
    } catch (RejectedExecutionException e) {
      log.warn("Store call {} rejected: executor saturated", operation);
      return CompletableFuture.failedFuture(
          new OutlineTransportException(operation + " rejected: store busy", e));
    }
  }
}
