package io.b2mash.outline.task;

import io.b2mash.outline.event.TemplateContentChangedEvent;
import io.b2mash.outline.exception.InvalidStateException;
import io.b2mash.outline.exception.ReorderConflictException;
import io.b2mash.outline.exception.ResourceNotFoundException;
import io.b2mash.outline.section.Section;
import io.b2mash.outline.section.SectionRepository;
import io.b2mash.outline.task.dto.CreateTaskRequest;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TemplateTaskService {

  private static final Logger log = LoggerFactory.getLogger(TemplateTaskService.class);

  private final TemplateTaskRepository taskRepository;
  private final SectionRepository sectionRepository;
  private final ApplicationEventPublisher eventPublisher;

  public TemplateTaskService(
      TemplateTaskRepository taskRepository,
      SectionRepository sectionRepository,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.sectionRepository = sectionRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public List<TemplateTask> listBySection(UUID sectionId) {
    requireSection(sectionId);
    return taskRepository.findBySectionIdOrderBySortOrderAscCreatedAtAsc(sectionId);
  }

  @Transactional(readOnly = true)
  public TemplateTask get(UUID id) {
    return requireTask(id);
  }

  @Transactional
  public TemplateTask create(CreateTaskRequest request) {
    requireTitle(request.title());
    Section section = requireSection(request.sectionId());

    int sortOrder;
    if (request.parentId() == null) {
      sortOrder = taskRepository.findMaxRootSortOrder(section.getId()) + 1;
    } else {
      var parent = requireTask(request.parentId());
      requireSameSection(parent, section.getId());
      sortOrder = taskRepository.findMaxChildSortOrder(parent.getId()) + 1;
    }

    var task =
        new TemplateTask(
            section.getTemplateId(),
            section.getId(),
            request.parentId(),
            request.title().trim(),
            request.description(),
            sortOrder);
    task = taskRepository.save(task);

    log.info(
        "Created template task {} in section {} (parent={})",
        task.getId(),
        section.getId(),
        request.parentId());
    publish(task, "created");
    return task;
  }

  @Transactional
  public TemplateTask update(UUID id, TaskPatch patch) {
    var task = requireTask(id);

    String title = task.getTitle();
    if (patch.has(TaskPatch.Field.TITLE)) {
      requireTitle(patch.title());
      title = patch.title().trim();
    }
    task.applyDetails(
        title,
        patch.has(TaskPatch.Field.DESCRIPTION) ? patch.description() : task.getDescription(),
        patch.has(TaskPatch.Field.DUE_DATE) ? patch.dueDate() : task.getDueDate(),
        patch.has(TaskPatch.Field.ASSIGNED_TO)
            ? normalizeAssignee(patch.assignedTo())
            : task.getAssignedTo(),
        patch.has(TaskPatch.Field.ESTIMATED_DAYS)
            ? patch.estimatedDays()
            : task.getEstimatedDays(),
        patch.has(TaskPatch.Field.OFFSET_DAYS) && patch.offsetDays() != null
            ? patch.offsetDays()
            : task.getOffsetDays());

    if (patch.changesParent() && !Objects.equals(patch.parentId(), task.getParentId())) {
      reparent(task, patch.parentId());
    }

    task = taskRepository.save(task);
    log.info("Updated template task {} fields={}", id, patch.fields());
    publish(task, "updated");
    return task;
  }

  /** Deletes only the task itself. Its children keep their parent id and surface as roots. */
  @Transactional
  public void delete(UUID id) {
    var task = requireTask(id);
    taskRepository.delete(task);
    log.info("Deleted template task {} from section {}", id, task.getSectionId());
    publish(task, "deleted");
  }

  /**
   * Persists a sibling order. {@code orderedIds} must name exactly the current children of {@code
   * parentId} (section roots when null), otherwise the client works from a stale list.
   */
  @Transactional
  public List<TemplateTask> reorderSiblings(UUID sectionId, UUID parentId, List<UUID> orderedIds) {
    var section = requireSection(sectionId);
    var siblings =
        taskRepository.findBySectionIdOrderBySortOrderAscCreatedAtAsc(sectionId).stream()
            .filter(t -> Objects.equals(t.getParentId(), parentId))
            .collect(Collectors.toMap(TemplateTask::getId, Function.identity()));

    if (orderedIds.size() != siblings.size()
        || new HashSet<>(orderedIds).size() != orderedIds.size()
        || !siblings.keySet().containsAll(orderedIds)) {
      throw new ReorderConflictException(
          "Stale task order",
          "Submitted order does not match the current subtasks of "
              + (parentId == null ? "section " + sectionId : "task " + parentId));
    }

    for (int i = 0; i < orderedIds.size(); i++) {
      siblings.get(orderedIds.get(i)).moveTo(i + 1);
    }
    var saved = taskRepository.saveAll(orderedIds.stream().map(siblings::get).toList());
    log.info("Reordered {} tasks under section {} parent {}", saved.size(), sectionId, parentId);
    eventPublisher.publishEvent(
        TemplateContentChangedEvent.of(
            section.getTemplateId(), "task", parentId != null ? parentId : sectionId, "reordered"));
    return saved;
  }

  private void publish(TemplateTask task, String action) {
    eventPublisher.publishEvent(
        TemplateContentChangedEvent.of(task.getTemplateId(), "task", task.getId(), action));
  }

  private void reparent(TemplateTask task, UUID newParentId) {
    if (newParentId == null) {
      task.reparent(null, taskRepository.findMaxRootSortOrder(task.getSectionId()) + 1);
      return;
    }
    if (newParentId.equals(task.getId())) {
      throw new InvalidStateException("Invalid parent", "A task cannot be its own parent.");
    }
    var parent = requireTask(newParentId);
    requireSameSection(parent, task.getSectionId());

    var parentById = new HashMap<UUID, UUID>();
    var sectionTasks =
        taskRepository.findBySectionIdOrderBySortOrderAscCreatedAtAsc(task.getSectionId());
    for (var t : sectionTasks) {
      if (t.getParentId() != null) {
        parentById.put(t.getId(), t.getParentId());
      }
    }
    if (ParentChain.wouldCreateCycle(task.getId(), newParentId, parentById::get)) {
      throw new InvalidStateException(
          "Invalid parent",
          "Task " + newParentId + " is a descendant of " + task.getId() + ".");
    }
    task.reparent(newParentId, taskRepository.findMaxChildSortOrder(newParentId) + 1);
  }

  private TemplateTask requireTask(UUID id) {
    return taskRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("TemplateTask", id));
  }

  private Section requireSection(UUID sectionId) {
    return sectionRepository
        .findById(sectionId)
        .orElseThrow(() -> new ResourceNotFoundException("Section", sectionId));
  }

  private static void requireSameSection(TemplateTask parent, UUID sectionId) {
    if (!parent.getSectionId().equals(sectionId)) {
      throw new InvalidStateException(
          "Invalid parent", "Parent task " + parent.getId() + " belongs to another section.");
    }
  }

  private static void requireTitle(String title) {
    if (title == null || title.isBlank()) {
      throw new InvalidStateException("Invalid task", "Task title is required.");
    }
  }

  private static String normalizeAssignee(String assignedTo) {
    if (assignedTo == null || assignedTo.isBlank()) {
      return null;
    }
    if (TemplateTask.ASSIGNEE_SELF.equals(assignedTo)) {
      return assignedTo;
    }
    try {
      return UUID.fromString(assignedTo).toString();
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException(
          "Invalid assignee", "Assignee must be a member id or \"me\", got " + assignedTo);
    }
  }
}
