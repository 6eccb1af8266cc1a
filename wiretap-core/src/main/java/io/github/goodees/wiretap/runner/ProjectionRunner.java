package io.github.goodees.wiretap.runner;

/*-
 * #%L
 * wiretap
 * %%
 * Copyright (C) 2026 The Wiretap Authors
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.projection.Checkpoint;
import io.github.goodees.wiretap.core.projection.Projection;
import io.github.goodees.wiretap.core.projection.ProjectionException;
import io.github.goodees.wiretap.core.store.EventLog;
import io.github.goodees.wiretap.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one projection up to date with the event log.
 *
 * <p>Each batch reads events after the projection's checkpoint, applies them in order, and moves the checkpoint
 * to the last of them only after all were applied. When a batch fails, the next one starts from the same
 * checkpoint; the projection skips the events it already applied.
 *
 * <p>Failed batches are retried with {@link BackoffPolicy}; once consecutive failures exceed its max retries, the
 * projection is {@link ProjectionStatus#FAILED} and {@link #run(ShutdownSignal)} returns. Only
 * {@link #rebuild()} recovers it.
 */
public class ProjectionRunner<E> {
    private final Projection<?, E> projection;
    private final EventLog<E> log;
    private final ProjectionConfiguration config;
    private final Clock clock;
    private final Logger logger;
    // serializes batches and rebuilds
    private final ReentrantLock work = new ReentrantLock();

    private ProjectionStatus status = ProjectionStatus.HEALTHY;
    private Checkpoint checkpoint;
    private long eventsProcessed;
    private String lastError;
    private Duration lag;
    private int consecutiveFailures;

    public ProjectionRunner(Projection<?, E> projection, EventLog<E> log, ProjectionConfiguration config) {
        this(projection, log, config, Clock.systemUTC());
    }

    public ProjectionRunner(Projection<?, E> projection, EventLog<E> log, ProjectionConfiguration config,
            Clock clock) {
        this.projection = Objects.requireNonNull(projection);
        this.log = Objects.requireNonNull(log);
        this.config = Objects.requireNonNull(config);
        this.clock = clock;
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + projection.getName());
    }

    public String getName() {
        return projection.getName();
    }

    public Projection<?, E> getProjection() {
        return projection;
    }

    /**
     * Follow the log until the signal is triggered, or retries are exhausted.
     * @param signal shutdown signal, observed between batches
     */
    public void run(ShutdownSignal signal) {
        logger.info("Projection {} started", getName());
        try {
            if (config.isRebuildOnStartup() && !rebuildOnStartup()) {
                return;
            }
            while (!signal.isTriggered()) {
                Duration wait;
                try {
                    int applied = processBatch();
                    wait = applied < config.getBatchSize() ? config.getPollInterval() : Duration.ZERO;
                } catch (ProjectionException | RuntimeException e) {
                    int failures = recordFailure(e);
                    if (config.getBackoff().isExhausted(failures)) {
                        markFailed();
                        logger.error("Projection {} failed after {} consecutive failures", getName(), failures, e);
                        return;
                    }
                    wait = config.getBackoff().delayFor(failures);
                    logger.warn("Projection {} batch failed ({} consecutive), retrying in {} ms", getName(), failures,
                        wait.toMillis(), e);
                }
                if (!wait.isZero() && signal.await(wait)) {
                    break;
                }
            }
            logger.info("Projection {} stopped at {}", getName(), health().getCheckpoint().orElse(null));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Projection {} interrupted", getName());
        }
    }

    private boolean rebuildOnStartup() {
        try {
            rebuild();
            return true;
        } catch (ProjectionException | RuntimeException e) {
            logger.error("Rebuild of projection {} on startup failed", getName(), e);
            return false;
        }
    }

    /**
     * Apply single batch of events after the checkpoint.
     * @return number of events read
     * @throws ProjectionException when reading, applying or checkpointing fails
     */
    public int processBatch() throws ProjectionException {
        work.lock();
        try {
            long started = System.nanoTime();
            Optional<Checkpoint> current = projection.lastCheckpoint();
            long after = current.map(Checkpoint::getPosition).orElse(0L);
            List<StoredEvent<E>> batch = read(after);
            StoredEvent<E> last = applyAll(batch);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            recordSuccess(last == null ? current.orElse(null) : Checkpoint.of(last), batch.size(), elapsed,
                lagAfter(last, batch.size()));
            if (!batch.isEmpty()) {
                logger.debug("Projection {} applied {} events up to {} in {} ms", getName(), batch.size(),
                    last.getPosition(), elapsed.toMillis());
            }
            return batch.size();
        } finally {
            work.unlock();
        }
    }

    /**
     * Reset the projection and replay all events from the beginning. Blocks until done; batches of a running loop
     * wait meanwhile.
     * @throws ProjectionException when the replay fails, leaving the projection FAILED
     */
    public void rebuild() throws ProjectionException {
        work.lock();
        try {
            setStatus(ProjectionStatus.REBUILDING);
            logger.info("Rebuilding projection {}", getName());
            long started = System.nanoTime();
            projection.reset();
            synchronized (this) {
                checkpoint = null;
                eventsProcessed = 0;
            }
            long after = 0;
            long total = 0;
            long nextReport = config.getProgressInterval();
            while (true) {
                List<StoredEvent<E>> batch = read(after);
                if (batch.isEmpty()) {
                    break;
                }
                StoredEvent<E> last = applyAll(batch);
                after = last.getPosition();
                total += batch.size();
                synchronized (this) {
                    checkpoint = Checkpoint.of(last);
                    eventsProcessed = total;
                }
                if (total >= nextReport) {
                    logger.info("Rebuild of {} progressed to {} events, position {}", getName(), total, after);
                    while (nextReport <= total) {
                        nextReport += config.getProgressInterval();
                    }
                }
            }
            synchronized (this) {
                status = ProjectionStatus.HEALTHY;
                consecutiveFailures = 0;
                lastError = null;
                lag = Duration.ZERO;
            }
            logger.info("Projection {} rebuilt from {} events in {} ms", getName(), total,
                Duration.ofNanos(System.nanoTime() - started).toMillis());
        } catch (ProjectionException | RuntimeException e) {
            recordFailure(e);
            markFailed();
            throw e;
        } finally {
            work.unlock();
        }
    }

    private List<StoredEvent<E>> read(long afterPosition) throws ProjectionException {
        try (EventLog.StoredEvents<E> events = log.readAfter(config.getSelector(), afterPosition,
            config.getBatchSize())) {
            return events.toList();
        } catch (EventStoreException | RuntimeException e) {
            throw ProjectionException.readFailed(getName(), e);
        }
    }

    private StoredEvent<E> applyAll(List<StoredEvent<E>> batch) throws ProjectionException {
        StoredEvent<E> last = null;
        for (StoredEvent<E> event : batch) {
            projection.applyEvent(event);
            last = event;
        }
        if (last != null) {
            projection.setCheckpoint(Checkpoint.of(last));
        }
        return last;
    }

    private Duration lagAfter(StoredEvent<E> last, int batchSize) {
        if (last == null || batchSize < config.getBatchSize()) {
            return Duration.ZERO;
        }
        // full batch, more events are likely waiting
        Duration behind = Duration.between(last.getTimestamp(), clock.instant());
        return behind.isNegative() ? Duration.ZERO : behind;
    }

    private synchronized void recordSuccess(Checkpoint checkpoint, int applied, Duration elapsed, Duration lag) {
        this.checkpoint = checkpoint;
        this.eventsProcessed += applied;
        this.lag = lag;
        this.consecutiveFailures = 0;
        if (status != ProjectionStatus.REBUILDING) {
            if (elapsed.compareTo(config.getMaxLagWarning()) > 0) {
                if (status != ProjectionStatus.LAGGING) {
                    logger.warn("Projection {} is lagging, batch took {} ms", getName(), elapsed.toMillis());
                }
                status = ProjectionStatus.LAGGING;
            } else {
                status = ProjectionStatus.HEALTHY;
            }
        }
    }

    private synchronized int recordFailure(Exception e) {
        lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        return ++consecutiveFailures;
    }

    private synchronized void markFailed() {
        status = ProjectionStatus.FAILED;
    }

    private synchronized void setStatus(ProjectionStatus status) {
        this.status = status;
    }

    public synchronized ProjectionStatus getStatus() {
        return status;
    }

    public synchronized ProjectionHealth health() {
        return new ProjectionHealth(getName(), status, checkpoint, eventsProcessed, lastError, lag,
                consecutiveFailures);
    }
}
