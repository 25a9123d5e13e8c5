package io.b2mash.outline.section;

import io.b2mash.outline.event.TemplateContentChangedEvent;
import io.b2mash.outline.exception.InvalidStateException;
import io.b2mash.outline.exception.ReorderConflictException;
import io.b2mash.outline.exception.ResourceNotFoundException;
import io.b2mash.outline.projecttemplate.ProjectTemplateRepository;
import io.b2mash.outline.task.TemplateTaskRepository;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SectionService {

  private static final Logger log = LoggerFactory.getLogger(SectionService.class);

  private final SectionRepository sectionRepository;
  private final TemplateTaskRepository taskRepository;
  private final ProjectTemplateRepository templateRepository;
  private final ApplicationEventPublisher eventPublisher;

  public SectionService(
      SectionRepository sectionRepository,
      TemplateTaskRepository taskRepository,
      ProjectTemplateRepository templateRepository,
      ApplicationEventPublisher eventPublisher) {
    this.sectionRepository = sectionRepository;
    this.taskRepository = taskRepository;
    this.templateRepository = templateRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public List<Section> listByTemplate(UUID templateId) {
    requireTemplate(templateId);
    return sectionRepository.findByTemplateIdOrderBySortOrderAscCreatedAtDesc(templateId);
  }

  /** New sections are appended after the current last one. */
  @Transactional
  public Section create(UUID templateId, String title, String description) {
    requireTitle(title);
    requireTemplate(templateId);
    int sortOrder = sectionRepository.findMaxSortOrder(templateId) + 1;
    var section =
        sectionRepository.save(new Section(templateId, title.trim(), description, sortOrder));
    log.info(
        "Created section {} in template {} at position {}",
        section.getId(),
        templateId,
        sortOrder);
    publish(templateId, section.getId(), "created");
    return section;
  }

  @Transactional
  public Section update(UUID id, String title, String description) {
    requireTitle(title);
    var section = requireSection(id);
    section.rename(title.trim(), description);
    section = sectionRepository.save(section);
    log.info("Renamed section {}", id);
    publish(section.getTemplateId(), id, "updated");
    return section;
  }

  /** Removes the section together with every task filed under it. */
  @Transactional
  public void delete(UUID id) {
    var section = requireSection(id);
    taskRepository.deleteBySectionId(id);
    sectionRepository.deleteById(id);
    log.info("Deleted section {} of template {}", id, section.getTemplateId());
    publish(section.getTemplateId(), id, "deleted");
  }

  /**
   * Rewrites {@code sortOrder} to 1..n following {@code orderedIds}. The list must be a
   * permutation of the template's current sections; tasks are never touched.
   */
  @Transactional
  public List<Section> reorder(UUID templateId, List<UUID> orderedIds) {
    var current =
        listByTemplate(templateId).stream()
            .collect(Collectors.toMap(Section::getId, Function.identity()));

    if (orderedIds.size() != current.size()
        || new HashSet<>(orderedIds).size() != orderedIds.size()
        || !current.keySet().containsAll(orderedIds)) {
      throw new ReorderConflictException(
          "Stale section order",
          "Submitted order does not match the "
              + current.size()
              + " sections of template "
              + templateId);
    }

    for (int i = 0; i < orderedIds.size(); i++) {
      current.get(orderedIds.get(i)).moveTo(i + 1);
    }
    var saved = sectionRepository.saveAll(orderedIds.stream().map(current::get).toList());
    log.info("Reordered {} sections of template {}", saved.size(), templateId);
    publish(templateId, templateId, "reordered");
    return saved;
  }

  private void publish(UUID templateId, UUID sectionId, String action) {
    eventPublisher.publishEvent(
        TemplateContentChangedEvent.of(templateId, "section", sectionId, action));
  }

  private Section requireSection(UUID id) {
    return sectionRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Section", id));
  }

  private void requireTemplate(UUID templateId) {
    if (!templateRepository.existsById(templateId)) {
      throw new ResourceNotFoundException("ProjectTemplate", templateId);
    }
  }

  private static void requireTitle(String title) {
    if (title == null || title.isBlank()) {
      throw new InvalidStateException("Invalid section", "Section title is required.");
    }
  }
}
