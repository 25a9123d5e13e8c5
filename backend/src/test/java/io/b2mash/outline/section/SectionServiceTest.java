package io.b2mash.outline.section;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.outline.exception.InvalidStateException;
import io.b2mash.outline.exception.ReorderConflictException;
import io.b2mash.outline.exception.ResourceNotFoundException;
import io.b2mash.outline.projecttemplate.ProjectTemplateRepository;
import io.b2mash.outline.task.TemplateTaskRepository;
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
class SectionServiceTest {

  private static final UUID TEMPLATE_ID = UUID.randomUUID();

  @Mock private SectionRepository sectionRepository;
  @Mock private TemplateTaskRepository taskRepository;
  @Mock private ProjectTemplateRepository templateRepository;
  @Mock private ApplicationEventPublisher eventPublisher;

  private SectionService service;

  @BeforeEach
  void setUp() {
    service =
        new SectionService(sectionRepository, taskRepository, templateRepository, eventPublisher);
  }

  @Test
  void create_appendsAfterLastSection() {
    when(templateRepository.existsById(TEMPLATE_ID)).thenReturn(true);
    when(sectionRepository.findMaxSortOrder(TEMPLATE_ID)).thenReturn(2);
    when(sectionRepository.save(any(Section.class))).thenAnswer(inv -> inv.getArgument(0));

    var section = service.create(TEMPLATE_ID, " Kickoff ", null);

    assertThat(section.getTitle()).isEqualTo("Kickoff");
    assertThat(section.getSortOrder()).isEqualTo(3);
  }

  @Test
  void create_blankTitle_throwsInvalidState() {
    assertThatThrownBy(() -> service.create(TEMPLATE_ID, "", null))
        .isInstanceOf(InvalidStateException.class);
    verify(sectionRepository, never()).save(any());
  }

  @Test
  void create_unknownTemplate_throwsNotFound() {
    when(templateRepository.existsById(TEMPLATE_ID)).thenReturn(false);

    assertThatThrownBy(() -> service.create(TEMPLATE_ID, "Kickoff", null))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void delete_removesTasksThenSection() {
    var section = sectionWithId(UUID.randomUUID(), 1);
    when(sectionRepository.findById(section.getId())).thenReturn(Optional.of(section));

    service.delete(section.getId());

    var order = inOrder(taskRepository, sectionRepository);
    order.verify(taskRepository).deleteBySectionId(section.getId());
    order.verify(sectionRepository).deleteById(section.getId());
  }

  @Test
  void reorder_permutation_rewritesSortOrderAndLeavesTasksAlone() {
    var s1 = sectionWithId(UUID.randomUUID(), 1);
    var s2 = sectionWithId(UUID.randomUUID(), 2);
    var s3 = sectionWithId(UUID.randomUUID(), 3);
    when(templateRepository.existsById(TEMPLATE_ID)).thenReturn(true);
    when(sectionRepository.findByTemplateIdOrderBySortOrderAscCreatedAtDesc(TEMPLATE_ID))
        .thenReturn(List.of(s1, s2, s3));
    when(sectionRepository.saveAll(any())).thenAnswer(inv -> inv.getArgument(0));

    var saved = service.reorder(TEMPLATE_ID, List.of(s3.getId(), s1.getId(), s2.getId()));

    assertThat(saved)
        .extracting(Section::getId)
        .containsExactly(s3.getId(), s1.getId(), s2.getId());
    assertThat(s3.getSortOrder()).isEqualTo(1);
    assertThat(s1.getSortOrder()).isEqualTo(2);
    assertThat(s2.getSortOrder()).isEqualTo(3);
    verify(taskRepository, never()).saveAll(any());
  }

  @Test
  void reorder_missingSection_throwsReorderConflict() {
    var s1 = sectionWithId(UUID.randomUUID(), 1);
    var s2 = sectionWithId(UUID.randomUUID(), 2);
    when(templateRepository.existsById(TEMPLATE_ID)).thenReturn(true);
    when(sectionRepository.findByTemplateIdOrderBySortOrderAscCreatedAtDesc(TEMPLATE_ID))
        .thenReturn(List.of(s1, s2));

    assertThatThrownBy(() -> service.reorder(TEMPLATE_ID, List.of(s1.getId(), UUID.randomUUID())))
        .isInstanceOf(ReorderConflictException.class);
  }

  @Test
  void reorder_duplicateIds_throwsReorderConflict() {
    var s1 = sectionWithId(UUID.randomUUID(), 1);
    var s2 = sectionWithId(UUID.randomUUID(), 2);
    when(templateRepository.existsById(TEMPLATE_ID)).thenReturn(true);
    when(sectionRepository.findByTemplateIdOrderBySortOrderAscCreatedAtDesc(TEMPLATE_ID))
        .thenReturn(List.of(s1, s2));

    assertThatThrownBy(() -> service.reorder(TEMPLATE_ID, List.of(s1.getId(), s1.getId())))
        .isInstanceOf(ReorderConflictException.class);
    verify(sectionRepository, never()).saveAll(any());
  }

  private static Section sectionWithId(UUID id, int sortOrder) {
    var section = new Section(TEMPLATE_ID, "Section " + sortOrder, null, sortOrder);
    try {
      var idField = Section.class.getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(section, id);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set section ID", e);
    }
    return section;
  }
}
