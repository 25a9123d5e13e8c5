package io.b2mash.outline.projecttemplate;

import io.b2mash.outline.event.TemplateContentChangedEvent;
import io.b2mash.outline.exception.ResourceNotFoundException;
import io.b2mash.outline.projecttemplate.dto.CreateTemplateRequest;
import io.b2mash.outline.projecttemplate.dto.ProjectTemplateResponse;
import io.b2mash.outline.projecttemplate.dto.UpdateTemplateRequest;
import io.b2mash.outline.section.Section;
import io.b2mash.outline.section.SectionRepository;
import io.b2mash.outline.task.TemplateTask;
import io.b2mash.outline.task.TemplateTaskRepository;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectTemplateService {

  private static final Logger log = LoggerFactory.getLogger(ProjectTemplateService.class);

  private final ProjectTemplateRepository templateRepository;
  private final SectionRepository sectionRepository;
  private final TemplateTaskRepository taskRepository;
  private final ApplicationEventPublisher eventPublisher;

  public ProjectTemplateService(
      ProjectTemplateRepository templateRepository,
      SectionRepository sectionRepository,
      TemplateTaskRepository taskRepository,
      ApplicationEventPublisher eventPublisher) {
    this.templateRepository = templateRepository;
    this.sectionRepository = sectionRepository;
    this.taskRepository = taskRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public ProjectTemplateResponse create(CreateTemplateRequest request) {
    var template =
        templateRepository.save(
            new ProjectTemplate(request.name(), request.description(), request.meetingType()));
    log.info("Created template {}", template.getId());
    return buildResponse(template);
  }

  @Transactional
  public ProjectTemplateResponse update(UUID id, UpdateTemplateRequest request) {
    var template = requireTemplate(id);
    template.update(request.name(), request.description(), request.meetingType());
    template = templateRepository.save(template);
    log.info("Updated template {}", id);
    return buildResponse(template);
  }

  /** Deletes the template with all of its sections and tasks. */
  @Transactional
  public void delete(UUID id) {
    requireTemplate(id);
    taskRepository.deleteByTemplateId(id);
    sectionRepository.deleteByTemplateId(id);
    templateRepository.deleteById(id);
    log.info("Deleted template {}", id);
    eventPublisher.publishEvent(
        TemplateContentChangedEvent.of(id, "project_template", id, "deleted"));
  }

  @Transactional(readOnly = true)
  public List<ProjectTemplateResponse> list() {
    return templateRepository.findAllByOrderByNameAsc().stream().map(this::buildResponse).toList();
  }

  @Transactional(readOnly = true)
  public ProjectTemplateResponse get(UUID id) {
    return buildResponse(requireTemplate(id));
  }

  /**
   * Copies the template, its sections and its task hierarchy. Tasks are inserted first without
   * parents, then re-linked through an old-id to new-id map. A parent id that did not resolve in
   * the source stays dangling in the copy so the outline renders the same.
   */
  @Transactional
  public ProjectTemplateResponse duplicate(UUID id) {
    var source = requireTemplate(id);
    var copy =
        templateRepository.save(
            new ProjectTemplate(
                source.getName() + " (Copy)", source.getDescription(), source.getMeetingType()));

    var sectionIdMap = new HashMap<UUID, UUID>();
    for (Section section :
        sectionRepository.findByTemplateIdOrderBySortOrderAscCreatedAtDesc(source.getId())) {
      var sectionCopy =
          sectionRepository.save(
              new Section(
                  copy.getId(),
                  section.getTitle(),
                  section.getDescription(),
                  section.getSortOrder()));
      sectionIdMap.put(section.getId(), sectionCopy.getId());
    }

    var sourceTasks = taskRepository.findByTemplateIdOrderBySortOrderAscCreatedAtAsc(id);
    var taskIdMap = new HashMap<UUID, TemplateTask>();
    for (TemplateTask task : sourceTasks) {
      UUID sectionId = sectionIdMap.get(task.getSectionId());
      if (sectionId == null) {
        continue;
      }
      var taskCopy =
          new TemplateTask(
              copy.getId(),
              sectionId,
              null,
              task.getTitle(),
              task.getDescription(),
              task.getSortOrder());
      taskCopy.applyDetails(
          task.getTitle(),
          task.getDescription(),
          task.getDueDate(),
          task.getAssignedTo(),
          task.getEstimatedDays(),
          task.getOffsetDays());
      taskIdMap.put(task.getId(), taskRepository.save(taskCopy));
    }

    for (TemplateTask task : sourceTasks) {
      var taskCopy = taskIdMap.get(task.getId());
      if (taskCopy == null || task.getParentId() == null) {
        continue;
      }
      var parentCopy = taskIdMap.get(task.getParentId());
      taskCopy.reparent(
          parentCopy != null ? parentCopy.getId() : task.getParentId(), task.getSortOrder());
      taskRepository.save(taskCopy);
    }

    log.info("Duplicated template {} -> {} ({} tasks)", id, copy.getId(), taskIdMap.size());
    return buildResponse(copy);
  }

  private ProjectTemplate requireTemplate(UUID id) {
    return templateRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("ProjectTemplate", id));
  }

  private ProjectTemplateResponse buildResponse(ProjectTemplate template) {
    return new ProjectTemplateResponse(
        template.getId(),
        template.getName(),
        template.getDescription(),
        template.getMeetingType(),
        (int) sectionRepository.countByTemplateId(template.getId()),
        (int) taskRepository.countByTemplateId(template.getId()),
        template.getCreatedAt(),
        template.getUpdatedAt());
  }
}
