package io.b2mash.outline.outline;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Per-viewer display bookkeeping for one template outline: which sections and tasks are expanded,
 * and which single task or section is being edited. Not shared, not persisted.
 */
public class OutlineViewState {

  private final Set<UUID> expandedSections = new LinkedHashSet<>();
  private final Set<UUID> expandedTasks = new HashSet<>();
  private boolean sectionsLoaded;
  private UUID editingTaskId;
  private UUID editingSectionId;

  /**
   * Called with the section ids every time the section list is (re)loaded. The first load expands
   * everything; later loads only forget sections that disappeared.
   */
  public void onSectionsLoaded(Collection<UUID> sectionIds) {
    if (!sectionsLoaded) {
      expandedSections.addAll(sectionIds);
      sectionsLoaded = true;
      return;
    }
    expandedSections.retainAll(sectionIds);
    if (editingSectionId != null && !sectionIds.contains(editingSectionId)) {
      editingSectionId = null;
    }
  }

  public boolean isSectionExpanded(UUID sectionId) {
    return expandedSections.contains(sectionId);
  }

  public void toggleSection(UUID sectionId) {
    if (!expandedSections.remove(sectionId)) {
      expandedSections.add(sectionId);
    }
  }

  public boolean isTaskExpanded(UUID taskId) {
    return expandedTasks.contains(taskId);
  }

  public void toggleTask(UUID taskId) {
    if (!expandedTasks.remove(taskId)) {
      expandedTasks.add(taskId);
    }
  }

  /** Starting an edit replaces any edit already in progress. */
  public void startEditingTask(UUID taskId) {
    editingTaskId = taskId;
  }

  public void finishEditingTask() {
    editingTaskId = null;
  }

  public Optional<UUID> editingTask() {
    return Optional.ofNullable(editingTaskId);
  }

  public boolean isEditing(UUID taskId) {
    return taskId.equals(editingTaskId);
  }

  public void startRenamingSection(UUID sectionId) {
    editingSectionId = sectionId;
  }

  public void finishRenamingSection() {
    editingSectionId = null;
  }

  public Optional<UUID> renamingSection() {
    return Optional.ofNullable(editingSectionId);
  }

  /** Drops bookkeeping for a deleted task. */
  public void forgetTask(UUID taskId) {
    expandedTasks.remove(taskId);
    if (taskId.equals(editingTaskId)) {
      editingTaskId = null;
    }
  }

  public Set<UUID> expandedSections() {
    return Set.copyOf(expandedSections);
  }
}
