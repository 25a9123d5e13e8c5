package io.b2mash.outline.outline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class OutlineViewStateTest {

  private final UUID s1 = UUID.randomUUID();
  private final UUID s2 = UUID.randomUUID();
  private final OutlineViewState viewState = new OutlineViewState();

  @Test
  void onSectionsLoaded_firstLoad_expandsEverySection() {
    viewState.onSectionsLoaded(List.of(s1, s2));

    assertThat(viewState.isSectionExpanded(s1)).isTrue();
    assertThat(viewState.isSectionExpanded(s2)).isTrue();
  }

  @Test
  void onSectionsLoaded_laterLoad_keepsCollapsedSectionsCollapsed() {
    var s3 = UUID.randomUUID();
    viewState.onSectionsLoaded(List.of(s1, s2));
    viewState.toggleSection(s1);

    viewState.onSectionsLoaded(List.of(s1, s2, s3));

    assertThat(viewState.isSectionExpanded(s1)).isFalse();
    assertThat(viewState.isSectionExpanded(s2)).isTrue();
    assertThat(viewState.isSectionExpanded(s3)).isFalse();
  }

  @Test
  void onSectionsLoaded_removedSection_isForgotten() {
    viewState.onSectionsLoaded(List.of(s1, s2));
    viewState.startRenamingSection(s2);

    viewState.onSectionsLoaded(List.of(s1));

    assertThat(viewState.expandedSections()).containsExactly(s1);
    assertThat(viewState.renamingSection()).isEmpty();
  }

  @Test
  void toggleTask_twice_restoresCollapsed() {
    var task = UUID.randomUUID();

    viewState.toggleTask(task);
    assertThat(viewState.isTaskExpanded(task)).isTrue();

    viewState.toggleTask(task);
    assertThat(viewState.isTaskExpanded(task)).isFalse();
  }

  @Test
  void startEditingTask_replacesPreviousEdit() {
    var first = UUID.randomUUID();
    var second = UUID.randomUUID();

    viewState.startEditingTask(first);
    viewState.startEditingTask(second);

    assertThat(viewState.editingTask()).contains(second);
    assertThat(viewState.isEditing(first)).isFalse();

    viewState.finishEditingTask();
    assertThat(viewState.editingTask()).isEmpty();
  }

  @Test
  void finishRenamingSection_clearsRename() {
    viewState.startRenamingSection(s1);
    assertThat(viewState.renamingSection()).contains(s1);

    viewState.finishRenamingSection();

    assertThat(viewState.renamingSection()).isEmpty();
  }

  @Test
  void forgetTask_clearsExpansionAndEdit() {
    var task = UUID.randomUUID();
    viewState.toggleTask(task);
    viewState.startEditingTask(task);

    viewState.forgetTask(task);

    assertThat(viewState.isTaskExpanded(task)).isFalse();
    assertThat(viewState.editingTask()).isEmpty();
  }
}
