package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.application.port.MetricsPort;
import ca.gc.cra.ember.application.port.RecordSink;
import ca.gc.cra.ember.domain.record.DecodedRecord;
import ca.gc.cra.ember.infrastructure.exec.ExecutorFactories;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Non-blocking handoff from ingestion threads to the fusion engine.
 *
 * <p>Each location owns a bounded mailbox. When a mailbox is full the oldest pending record is dropped and
 * {@value MetricNames#HANDOFF_DROPPED} is incremented, so the newest reading always gets through. At most one
 * drain task per location runs at a time on the shared worker pool, which keeps records of one location in
 * submission order and the location state single-writer.</p>
 */
public final class FusionDispatcher implements RecordSink, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(FusionDispatcher.class);
  private static final int DRAIN_BATCH = 64;

  private final SensorFusionEngine engine;
  private final int capacity;
  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final MetricsPort metrics;
  private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();

  /**
   * Creates a dispatcher with its own worker pool sized from the fusion settings.
   *
   * @param engine fusion engine
   * @param metrics metrics sink
   */
  public FusionDispatcher(SensorFusionEngine engine, MetricsPort metrics) {
    this(engine,
        engine.settings().mailboxCapacity(),
        ExecutorFactories.newFixedPool(engine.settings().workers(), "ember-fusion"),
        metrics,
        true);
  }

  /**
   * Creates a dispatcher that runs drain tasks on a caller-supplied executor.
   *
   * @param engine fusion engine
   * @param capacity per-location mailbox bound
   * @param executor executor for drain tasks; not shut down by {@link #close()}
   * @param metrics metrics sink
   */
  public FusionDispatcher(SensorFusionEngine engine, int capacity, Executor executor, MetricsPort metrics) {
    this(engine, capacity, executor, metrics, false);
  }

  private FusionDispatcher(
      SensorFusionEngine engine, int capacity, Executor executor, MetricsPort metrics, boolean owned) {
    this.engine = Objects.requireNonNull(engine, "engine");
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.executor = Objects.requireNonNull(executor, "executor");
    this.ownedExecutor = owned ? (ExecutorService) executor : null;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void submit(String locationId, DecodedRecord record) {
    Objects.requireNonNull(locationId, "locationId");
    Objects.requireNonNull(record, "record");
    Mailbox mailbox = mailboxes.computeIfAbsent(locationId, Mailbox::new);
    boolean schedule;
    mailbox.lock.lock();
    try {
      if (mailbox.queue.size() >= capacity) {
        mailbox.queue.pollFirst();
        metrics.increment(MetricNames.HANDOFF_DROPPED, locationId);
      }
      mailbox.queue.offerLast(record);
      metrics.gauge(MetricNames.HANDOFF_DEPTH, locationId, mailbox.queue.size());
      schedule = !mailbox.scheduled;
      mailbox.scheduled = true;
    } finally {
      mailbox.lock.unlock();
    }
    if (schedule) {
      schedule(mailbox);
    }
  }

  /**
   * Number of records waiting for a location.
   *
   * @param locationId location
   * @return pending count
   */
  public int depth(String locationId) {
    Mailbox mailbox = mailboxes.get(locationId);
    if (mailbox == null) {
      return 0;
    }
    mailbox.lock.lock();
    try {
      return mailbox.queue.size();
    } finally {
      mailbox.lock.unlock();
    }
  }

  /**
   * Returns whether every mailbox is empty and no drain task is running.
   *
   * @return {@code true} when idle
   */
  public boolean isIdle() {
    for (Mailbox mailbox : mailboxes.values()) {
      mailbox.lock.lock();
      try {
        if (mailbox.scheduled || !mailbox.queue.isEmpty()) {
          return false;
        }
      } finally {
        mailbox.lock.unlock();
      }
    }
    return true;
  }

  private void schedule(Mailbox mailbox) {
    try {
      executor.execute(() -> drain(mailbox));
    } catch (RejectedExecutionException ex) {
      mailbox.lock.lock();
      try {
        mailbox.scheduled = false;
      } finally {
        mailbox.lock.unlock();
      }
      log.warn("Fusion executor rejected drain for location {}; records stay queued", mailbox.locationId, ex);
    }
  }

  private void drain(Mailbox mailbox) {
    MDC.put("location", mailbox.locationId);
    try {
      for (int processed = 0; processed < DRAIN_BATCH; processed++) {
        DecodedRecord record;
        mailbox.lock.lock();
        try {
          record = mailbox.queue.pollFirst();
          if (record == null) {
            mailbox.scheduled = false;
            return;
          }
          metrics.gauge(MetricNames.HANDOFF_DEPTH, mailbox.locationId, mailbox.queue.size());
        } finally {
          mailbox.lock.unlock();
        }
        try {
          engine.onRecord(mailbox.locationId, record);
        } catch (RuntimeException ex) {
          log.error("Fusion failed for {} record at location {}", record.kind(), mailbox.locationId, ex);
        }
      }
    } finally {
      MDC.remove("location");
    }
    // batch exhausted with records left; yield the worker to other locations
    schedule(mailbox);
  }

  @Override
  public void close() {
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Fusion workers did not finish within 5s; forcing shutdown");
        ownedExecutor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      ownedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class Mailbox {
    private final String locationId;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<DecodedRecord> queue = new ArrayDeque<>();
    private boolean scheduled;

    private Mailbox(String locationId) {
      this.locationId = locationId;
    }
  }
}
