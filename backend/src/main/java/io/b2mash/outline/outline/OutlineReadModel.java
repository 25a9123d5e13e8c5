package io.b2mash.outline.outline;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.outline.event.TemplateContentChangedEvent;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Local cache of each template's sections and flat task list.
 *
 * <p>Entries are replaced only by a load that completed successfully, and a load never overwrites
 * an entry produced by a load that started later. Nothing edits a cached snapshot in place.
 */
@Component
public class OutlineReadModel {

  private static final Logger log = LoggerFactory.getLogger(OutlineReadModel.class);

  private final OutlineBackend backend;
  private final Cache<UUID, OutlineSnapshot> snapshots;
  private final AtomicLong versions = new AtomicLong();
  // Loads started at or before this version may predate the invalidating write.
  private final Cache<UUID, Long> invalidatedAt;

  public OutlineReadModel(OutlineBackend backend, OutlineProperties properties) {
    this.backend = backend;
    this.snapshots = Caffeine.newBuilder().expireAfterWrite(properties.snapshotTtl()).build();
    this.invalidatedAt = Caffeine.newBuilder().expireAfterWrite(properties.snapshotTtl()).build();
  }

  /** Cached snapshot if present, otherwise a fresh load. */
  public CompletableFuture<OutlineSnapshot> load(UUID templateId) {
    var cached = snapshots.getIfPresent(templateId);
    if (cached != null) {
      return CompletableFuture.completedFuture(cached);
    }
    return refresh(templateId);
  }

  public Optional<OutlineSnapshot> cached(UUID templateId) {
    return Optional.ofNullable(snapshots.getIfPresent(templateId));
  }

  /** Re-reads sections and their tasks. On failure the previous entry stays untouched. */
  public CompletableFuture<OutlineSnapshot> refresh(UUID templateId) {
    long version = versions.incrementAndGet();
    return backend
        .listSections(templateId)
        .thenCompose(
            sections -> {
              List<CompletableFuture<List<TaskNode>>> perSection =
                  sections.stream().map(s -> backend.listTasksForSection(s.id())).toList();
              return CompletableFuture.allOf(perSection.toArray(new CompletableFuture<?>[0]))
                  .thenApply(
                      ignored ->
                          new OutlineSnapshot(
                              templateId,
                              version,
                              sections,
                              perSection.stream().flatMap(f -> f.join().stream()).toList()));
            })
        .thenApply(this::store)
        .whenComplete(
            (snapshot, ex) -> {
              if (ex != null) {
                log.warn(
                    "Outline reload for template {} failed: {}",
                    templateId,
                    Futures.unwrap(ex).getMessage());
              }
            });
  }

  public void invalidate(UUID templateId) {
    invalidatedAt.asMap().merge(templateId, versions.get(), Math::max);
    snapshots.invalidate(templateId);
  }

  /** Version of the most recently started load. */
  long latestVersion() {
    return versions.get();
  }

  /** Drops the cached snapshot once a write to the template's content has committed. */
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTemplateContentChanged(TemplateContentChangedEvent event) {
    log.debug(
        "Template {} {} {} {}, dropping cached outline",
        event.templateId(),
        event.entityType(),
        event.entityId(),
        event.action());
    invalidate(event.templateId());
  }

  private OutlineSnapshot store(OutlineSnapshot loaded) {
    var floor = invalidatedAt.getIfPresent(loaded.templateId());
    if (floor != null && loaded.version() <= floor) {
      log.debug(
          "Not caching outline load v{} for template {}: started before an invalidation",
          loaded.version(),
          loaded.templateId());
      return loaded;
    }
    var winner =
        snapshots
            .asMap()
            .merge(
                loaded.templateId(),
                loaded,
                (existing, incoming) ->
                    existing.version() > incoming.version() ? existing : incoming);
    if (winner != loaded) {
      log.debug(
          "Discarded outline load v{} for template {}: v{} is newer",
          loaded.version(),
          loaded.templateId(),
          winner.version());
    }
    return winner;
  }
}
