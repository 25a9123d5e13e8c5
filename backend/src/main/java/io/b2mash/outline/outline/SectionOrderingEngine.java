package io.b2mash.outline.outline;

import io.b2mash.outline.event.TemplateContentChangedEvent;
import io.b2mash.outline.exception.InvalidStateException;
import io.b2mash.outline.outline.OutlineChangedEvent.Kind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Optimistic drag-and-drop ordering of a template's sections.
 *
 * <p>A drop changes the displayed order immediately and then sends the full order to the store.
 * Per template, requests go out one at a time in drop order; a queued request that a newer drop
 * has already replaced is never sent. Every drop gets a sequence number, and only the response to
 * the latest one may change what is displayed: an older success only moves the confirmed order
 * forward, an older failure is ignored. When the latest request fails, the last confirmed order
 * is displayed again. While nothing is outstanding, a snapshot loaded after the last confirmation
 * carries the store's order, including reorders made outside this engine, and replaces both
 * orders.
 */
@Service
public class SectionOrderingEngine {

  private static final Logger log = LoggerFactory.getLogger(SectionOrderingEngine.class);

  private final OutlineBackend backend;
  private final OutlineReadModel readModel;
  private final ApplicationEventPublisher eventPublisher;
  private final ConcurrentHashMap<UUID, TemplateOrder> orders = new ConcurrentHashMap<>();

  public SectionOrderingEngine(
      OutlineBackend backend,
      OutlineReadModel readModel,
      ApplicationEventPublisher eventPublisher) {
    this.backend = backend;
    this.readModel = readModel;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Moves {@code draggedId} to {@code targetIndex}, clamped to the list bounds. Every other id
   * keeps its relative order. Moving an id to its current index returns an equal list.
   */
  public static List<UUID> move(List<UUID> order, UUID draggedId, int targetIndex) {
    int from = order.indexOf(draggedId);
    if (from < 0) {
      throw new InvalidStateException(
          "Unknown section", "Section " + draggedId + " is not part of this outline.");
    }
    int to = Math.max(0, Math.min(targetIndex, order.size() - 1));
    var moved = new ArrayList<>(order);
    moved.remove(from);
    moved.add(to, draggedId);
    return List.copyOf(moved);
  }

  /**
   * Applies a drop locally and reconciles it with the store. With a cached snapshot the optimistic
   * order is in place before this method returns.
   */
  public CompletableFuture<ReorderOutcome> drop(UUID templateId, UUID draggedId, int targetIndex) {
    return readModel
        .load(templateId)
        .thenCompose(
            snapshot -> {
              var order = stateFor(templateId, snapshot);
              return issue(templateId, order, snapshot, draggedId, targetIndex);
            });
  }

  /** Order currently shown for the template, if the engine has seen it. */
  public Optional<List<UUID>> displayedOrder(UUID templateId) {
    var order = orders.get(templateId);
    if (order == null) {
      return Optional.empty();
    }
    synchronized (order) {
      return Optional.of(order.displayed);
    }
  }

  public Optional<List<UUID>> confirmedOrder(UUID templateId) {
    var order = orders.get(templateId);
    if (order == null) {
      return Optional.empty();
    }
    synchronized (order) {
      return Optional.of(order.confirmed);
    }
  }

  /**
   * Order to display for a loaded snapshot. An idle engine first takes the snapshot's order when
   * the snapshot was loaded after its last confirmation. Empty for templates never dropped on.
   */
  public Optional<List<UUID>> reconcile(OutlineSnapshot snapshot) {
    var order = orders.get(snapshot.templateId());
    if (order == null) {
      return Optional.empty();
    }
    synchronized (order) {
      adoptStoreOrder(order, snapshot);
      return Optional.of(order.displayed);
    }
  }

  public ReorderState state(UUID templateId) {
    var order = orders.get(templateId);
    if (order == null) {
      return ReorderState.IDLE;
    }
    synchronized (order) {
      return order.state;
    }
  }

  /** Adopts the order of a fresh snapshot unless a reorder is still outstanding. */
  @EventListener
  public void onOutlineChanged(OutlineChangedEvent event) {
    if (!event.kind().changesSectionSet()) {
      return;
    }
    var order = orders.get(event.templateId());
    var snapshot = readModel.cached(event.templateId());
    if (order == null || snapshot.isEmpty()) {
      return;
    }
    synchronized (order) {
      if (order.pending > 0) {
        log.debug(
            "Template {} has {} reorder request(s) outstanding, keeping displayed order",
            event.templateId(),
            order.pending);
        return;
      }
      adoptStoreOrder(order, snapshot.get());
    }
  }

  /** Forgets a deleted template once the deletion has committed. */
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTemplateContentChanged(TemplateContentChangedEvent event) {
    if (event.templateDeleted() && orders.remove(event.templateId()) != null) {
      log.debug("Template {} deleted, dropped its section order", event.templateId());
    }
  }

  /**
   * Takes the store's order from a snapshot loaded after the last confirmation. Callers hold the
   * lock on {@code order}.
   */
  private static void adoptStoreOrder(TemplateOrder order, OutlineSnapshot snapshot) {
    if (order.pending > 0 || snapshot.version() <= order.syncedVersion) {
      return;
    }
    order.syncedVersion = snapshot.version();
    var loaded = snapshot.sectionIds();
    if (order.confirmed.equals(loaded) && order.displayed.equals(loaded)) {
      return;
    }
    log.debug("Template {} order changed in the store, now {}", snapshot.templateId(), loaded);
    order.confirmed = loaded;
    order.displayed = loaded;
    order.state = ReorderState.IDLE;
  }

  private TemplateOrder stateFor(UUID templateId, OutlineSnapshot snapshot) {
    return orders.computeIfAbsent(templateId, id -> new TemplateOrder(snapshot));
  }

  private CompletableFuture<ReorderOutcome> issue(
      UUID templateId,
      TemplateOrder order,
      OutlineSnapshot snapshot,
      UUID draggedId,
      int targetIndex) {
    CompletableFuture<Void> previous;
    CompletableFuture<Void> next = new CompletableFuture<>();
    long sequence;
    List<UUID> proposed;
    synchronized (order) {
      adoptStoreOrder(order, snapshot);
      try {
        proposed = move(order.displayed, draggedId, targetIndex);
      } catch (InvalidStateException e) {
        return CompletableFuture.failedFuture(e);
      }
      if (proposed.equals(order.displayed)) {
        return CompletableFuture.completedFuture(
            new ReorderOutcome(templateId, order.displayed, order.state, order.issued, false));
      }
      order.displayed = proposed;
      order.state = ReorderState.OPTIMISTICALLY_REORDERED;
      sequence = ++order.issued;
      order.pending++;
      previous = order.tail;
      order.tail = next;
    }
    log.debug("Template {} drop #{} applied locally: {}", templateId, sequence, proposed);

    var result = previous.thenCompose(ignored -> send(templateId, order, sequence, proposed));
    result.whenComplete((outcome, ex) -> next.complete(null));
    return result;
  }

  private CompletableFuture<ReorderOutcome> send(
      UUID templateId, TemplateOrder order, long sequence, List<UUID> proposed) {
    synchronized (order) {
      if (sequence != order.issued) {
        order.pending--;
        log.debug("Template {} drop #{} replaced before sending", templateId, sequence);
        return CompletableFuture.completedFuture(
            new ReorderOutcome(templateId, order.displayed, order.state, sequence, true));
      }
      order.state = ReorderState.RECONCILING;
    }
    CompletableFuture<Void> request;
    try {
      request = backend.reorderSections(templateId, proposed);
    } catch (RuntimeException e) {
      request = CompletableFuture.failedFuture(e);
    }
    return request.handle((ignored, ex) -> settle(templateId, order, sequence, proposed, ex));
  }

  private ReorderOutcome settle(
      UUID templateId, TemplateOrder order, long sequence, List<UUID> proposed, Throwable ex) {
    ReorderOutcome outcome;
    synchronized (order) {
      order.pending--;
      boolean latest = sequence == order.issued;
      if (ex == null) {
        if (sequence > order.confirmedSequence) {
          order.confirmed = proposed;
          order.confirmedSequence = sequence;
        }
        // Loads started before this point may still carry the replaced order.
        order.syncedVersion = Math.max(order.syncedVersion, readModel.latestVersion());
        if (latest) {
          order.state = ReorderState.CONFIRMED;
        } else {
          log.debug("Template {} drop #{} confirmed after a newer drop", templateId, sequence);
        }
        outcome = new ReorderOutcome(templateId, order.displayed, order.state, sequence, !latest);
      } else if (latest) {
        order.displayed = order.confirmed;
        order.state = ReorderState.ROLLED_BACK;
        var failure = Futures.asRuntime(ex);
        log.warn(
            "Template {} drop #{} rejected, restored confirmed order: {}",
            templateId,
            sequence,
            failure.getMessage());
        throw failure;
      } else {
        log.debug("Template {} drop #{} failed after a newer drop, ignoring", templateId, sequence);
        outcome = new ReorderOutcome(templateId, order.displayed, order.state, sequence, true);
      }
    }
    if (!outcome.superseded()) {
      eventPublisher.publishEvent(
          OutlineChangedEvent.of(templateId, Kind.SECTIONS_REORDERED, templateId));
    }
    return outcome;
  }

  private static final class TemplateOrder {

    private List<UUID> confirmed;
    private List<UUID> displayed;
    private ReorderState state = ReorderState.IDLE;
    private long issued;
    private long confirmedSequence;
    private long syncedVersion;
    private int pending;
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    private TemplateOrder(OutlineSnapshot initial) {
      this.confirmed = initial.sectionIds();
      this.displayed = this.confirmed;
      this.syncedVersion = initial.version();
    }
  }
}
