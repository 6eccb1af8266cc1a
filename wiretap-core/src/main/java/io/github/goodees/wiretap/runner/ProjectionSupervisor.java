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

import io.github.goodees.wiretap.core.projection.Projection;
import io.github.goodees.wiretap.core.projection.ProjectionException;
import io.github.goodees.wiretap.core.store.EventLog;
import io.github.goodees.wiretap.monitoring.SystemHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs registered projections, each as its own task on the executor service, and reports their health.
 *
 * <p>All runners share one {@link ShutdownSignal}. Stopping triggers it and waits for runners to finish their
 * current batch.
 */
public class ProjectionSupervisor<E> {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionSupervisor.class);

    private final EventLog<E> log;
    private final ExecutorService executorService;
    private final Clock clock;
    private final ShutdownSignal signal = new ShutdownSignal();
    private final Map<String, ProjectionRunner<E>> runners = new LinkedHashMap<>();
    private final Map<String, Future<?>> tasks = new LinkedHashMap<>();
    private boolean started;

    public ProjectionSupervisor(EventLog<E> log, ExecutorService executorService) {
        this(log, executorService, Clock.systemUTC());
    }

    public ProjectionSupervisor(EventLog<E> log, ExecutorService executorService, Clock clock) {
        this.log = log;
        this.executorService = executorService;
        this.clock = clock;
    }

    /**
     * Register a projection. Projections registered after start are started immediately.
     * @param projection the projection, its name must be unique
     * @param config runner configuration
     * @return the runner of the projection
     */
    public synchronized ProjectionRunner<E> register(Projection<?, E> projection, ProjectionConfiguration config) {
        if (runners.containsKey(projection.getName())) {
            throw new IllegalArgumentException("Projection " + projection.getName() + " is already registered");
        }
        ProjectionRunner<E> runner = new ProjectionRunner<>(projection, log, config, clock);
        runners.put(projection.getName(), runner);
        if (started) {
            launch(runner);
        }
        return runner;
    }

    public synchronized void start() {
        if (signal.isTriggered()) {
            throw new IllegalStateException("Supervisor was already stopped");
        }
        if (started) {
            return;
        }
        started = true;
        runners.values().forEach(this::launch);
        logger.info("Started {} projections", runners.size());
    }

    private void launch(ProjectionRunner<E> runner) {
        tasks.put(runner.getName(), executorService.submit(() -> runner.run(signal)));
    }

    /**
     * Signal all runners to stop and wait for them.
     * @param timeout maximum time to wait
     * @return true if all runners stopped in time
     * @throws InterruptedException when interrupted while waiting
     */
    public boolean stop(Duration timeout) throws InterruptedException {
        signal.trigger();
        List<Map.Entry<String, Future<?>>> running;
        synchronized (this) {
            running = new ArrayList<>(tasks.entrySet());
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean stopped = true;
        for (Map.Entry<String, Future<?>> task : running) {
            try {
                task.getValue().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logger.warn("Projection {} did not stop within {}", task.getKey(), timeout);
                stopped = false;
            } catch (ExecutionException e) {
                logger.error("Projection {} terminated abnormally", task.getKey(), e.getCause());
            }
        }
        logger.info("Projections stopped: {}", stopped);
        return stopped;
    }

    /**
     * Rebuild projection from scratch. A runner that stopped because of failure is restarted afterwards.
     * @param name name of the projection
     * @throws ProjectionException when rebuild fails
     */
    public void rebuild(String name) throws ProjectionException {
        ProjectionRunner<E> runner = runner(name)
                .orElseThrow(() -> new IllegalArgumentException("No projection named " + name));
        runner.rebuild();
        synchronized (this) {
            Future<?> task = tasks.get(name);
            if (started && !signal.isTriggered() && (task == null || task.isDone())) {
                logger.info("Restarting projection {} after rebuild", name);
                launch(runner);
            }
        }
    }

    public synchronized Optional<ProjectionRunner<E>> runner(String name) {
        return Optional.ofNullable(runners.get(name));
    }

    public synchronized List<ProjectionHealth> health() {
        List<ProjectionHealth> result = new ArrayList<>();
        runners.values().forEach(r -> result.add(r.health()));
        return result;
    }

    public Optional<ProjectionHealth> health(String name) {
        return runner(name).map(ProjectionRunner::health);
    }

    public SystemHealth systemHealth() {
        return SystemHealth.of(health(), clock.instant());
    }
}
