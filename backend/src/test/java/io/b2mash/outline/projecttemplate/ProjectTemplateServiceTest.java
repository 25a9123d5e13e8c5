package io.b2mash.outline.projecttemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import io.b2mash.outline.exception.ResourceNotFoundException;
import io.b2mash.outline.section.Section;
import io.b2mash.outline.section.SectionRepository;
import io.b2mash.outline.task.TemplateTask;
import io.b2mash.outline.task.TemplateTaskRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class ProjectTemplateServiceTest {

  @Mock private ProjectTemplateRepository templateRepository;
  @Mock private SectionRepository sectionRepository;
  @Mock private TemplateTaskRepository taskRepository;
  @Mock private ApplicationEventPublisher eventPublisher;

  private ProjectTemplateService service;

  @BeforeEach
  void setUp() {
    service =
        new ProjectTemplateService(
            templateRepository, sectionRepository, taskRepository, eventPublisher);
  }

  @Test
  void duplicate_relinksParentsToCopiedTasks() {
    var source = withId(new ProjectTemplate("Onboarding", "desc", "KICKOFF"), UUID.randomUUID());
    var section = withId(new Section(source.getId(), "Week 1", null, 1), UUID.randomUUID());
    var parent = task(source.getId(), section.getId(), null, "Parent");
    var child = task(source.getId(), section.getId(), parent.getId(), "Child");
    var dangling = task(source.getId(), section.getId(), UUID.randomUUID(), "Dangling");

    when(templateRepository.findById(source.getId())).thenReturn(Optional.of(source));
    when(templateRepository.save(any(ProjectTemplate.class)))
        .thenAnswer(inv -> withId(inv.getArgument(0), UUID.randomUUID()));
    when(sectionRepository.findByTemplateIdOrderBySortOrderAscCreatedAtDesc(source.getId()))
        .thenReturn(List.of(section));
    when(sectionRepository.save(any(Section.class)))
        .thenAnswer(inv -> withId(inv.getArgument(0), UUID.randomUUID()));
    when(taskRepository.findByTemplateIdOrderBySortOrderAscCreatedAtAsc(source.getId()))
        .thenReturn(List.of(parent, child, dangling));
    var saved = new ArrayList<TemplateTask>();
    when(taskRepository.save(any(TemplateTask.class)))
        .thenAnswer(
            inv -> {
              TemplateTask task = inv.getArgument(0);
              if (task.getId() == null) {
                withId(task, UUID.randomUUID());
                saved.add(task);
              }
              return task;
            });

    var response = service.duplicate(source.getId());

    assertThat(response.name()).isEqualTo("Onboarding (Copy)");
    assertThat(saved).hasSize(3);
    var parentCopy = saved.get(0);
    var childCopy = saved.get(1);
    var danglingCopy = saved.get(2);
    assertThat(parentCopy.getParentId()).isNull();
    assertThat(childCopy.getParentId()).isEqualTo(parentCopy.getId());
    assertThat(danglingCopy.getParentId()).isEqualTo(dangling.getParentId());
    assertThat(childCopy.getSectionId()).isNotEqualTo(section.getId());
  }

  @Test
  void delete_removesTasksThenSectionsThenTemplate() {
    var id = UUID.randomUUID();
    when(templateRepository.findById(id))
        .thenReturn(Optional.of(withId(new ProjectTemplate("T", null, null), id)));

    service.delete(id);

    var order = inOrder(taskRepository, sectionRepository, templateRepository);
    order.verify(taskRepository).deleteByTemplateId(id);
    order.verify(sectionRepository).deleteByTemplateId(id);
    order.verify(templateRepository).deleteById(id);
  }

  @Test
  void get_unknownTemplate_throwsNotFound() {
    var id = UUID.randomUUID();
    when(templateRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.get(id)).isInstanceOf(ResourceNotFoundException.class);
  }

  private static TemplateTask task(UUID templateId, UUID sectionId, UUID parentId, String title) {
    return withId(
        new TemplateTask(templateId, sectionId, parentId, title, null, 1), UUID.randomUUID());
  }

  private static <T> T withId(T entity, UUID id) {
    try {
      var idField = entity.getClass().getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(entity, id);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set ID", e);
    }
    return entity;
  }
}
