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

import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.core.store.EventStore;
import io.github.goodees.wiretap.immutables.events.DepositedEvent;
import io.github.goodees.wiretap.immutables.events.LedgerEvent;
import io.github.goodees.wiretap.monitoring.SystemHealth;
import io.github.goodees.wiretap.monitoring.SystemStatus;
import io.github.goodees.wiretap.store.inmemory.InMemoryEventStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.github.goodees.wiretap.runner.ProjectionRunnerTest.awaitCondition;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProjectionSupervisorTest {
    private InMemoryEventStore<LedgerEvent> store;
    private ExecutorService executorService;
    private ProjectionSupervisor<LedgerEvent> supervisor;
    private ProjectionConfiguration config;

    @Before
    public void setUp() throws Exception {
        store = new InMemoryEventStore<>();
        executorService = Executors.newCachedThreadPool();
        supervisor = new ProjectionSupervisor<>(store, executorService);
        config = new ProjectionConfiguration.Builder()
                .pollInterval(Duration.ofMillis(5))
                .backoff(new BackoffPolicy.Builder().maxRetries(1).initialDelay(Duration.ofMillis(1))
                        .maxDelay(Duration.ofMillis(1)).build())
                .build();
        store.append(StreamId.of("account", "alice"), EventStore.NO_STREAM, Arrays.asList(
            DepositedEvent.of("alice", 10), DepositedEvent.of("alice", 20)));
    }

    @After
    public void tearDown() throws InterruptedException {
        supervisor.stop(Duration.ofSeconds(5));
        executorService.shutdownNow();
    }

    @Test
    public void registered_projections_follow_the_store() throws Exception {
        FlakyProjection first = new FlakyProjection("first");
        FlakyProjection second = new FlakyProjection("second");
        supervisor.register(first, config);
        supervisor.register(second, config);
        supervisor.start();
        store.append(StreamId.of("account", "bob"), EventStore.NO_STREAM, Arrays.asList(DepositedEvent.of("bob", 5)));

        awaitCondition(() -> first.getState().balance("bob") == 5 && second.getState().balance("bob") == 5);
        assertEquals(30, first.getState().balance("alice"));
        assertTrue(supervisor.stop(Duration.ofSeconds(5)));
        SystemHealth health = supervisor.systemHealth();
        assertEquals(SystemStatus.HEALTHY, health.getStatus());
        assertEquals(2, health.getSummary().getTotal());
        assertEquals(3, supervisor.health("first").get().getEventsProcessed());
    }

    @Test
    public void projection_registered_after_start_is_started() throws Exception {
        supervisor.start();
        FlakyProjection late = new FlakyProjection("late");
        supervisor.register(late, config);
        awaitCondition(() -> late.getState().balance("alice") == 30);
    }

    @Test(expected = IllegalArgumentException.class)
    public void projection_names_are_unique() {
        supervisor.register(new FlakyProjection("dup"), config);
        supervisor.register(new FlakyProjection("dup"), config);
    }

    @Test
    public void failed_projection_makes_system_unhealthy_until_rebuilt() throws Exception {
        FlakyProjection healthy = new FlakyProjection("healthy");
        FlakyProjection broken = new FlakyProjection("broken").failing(Integer.MAX_VALUE);
        supervisor.register(healthy, config);
        supervisor.register(broken, config);
        supervisor.start();
        awaitCondition(() -> supervisor.health("broken").get().isFailed());
        assertEquals(SystemStatus.UNHEALTHY, supervisor.systemHealth().getStatus());
        assertEquals(1, supervisor.systemHealth().getSummary().getFailed());

        broken.failuresLeft.set(0);
        supervisor.rebuild("broken");
        assertEquals(ProjectionStatus.HEALTHY, supervisor.runner("broken").get().getStatus());
        // restarted runner keeps following
        store.append(StreamId.of("account", "alice"), 2, Arrays.asList(DepositedEvent.of("alice", 1)));
        awaitCondition(() -> broken.getState().balance("alice") == 31);
        assertEquals(SystemStatus.HEALTHY, supervisor.systemHealth().getStatus());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rebuild_of_unknown_projection_fails() throws Exception {
        supervisor.rebuild("missing");
    }

    @Test(expected = IllegalStateException.class)
    public void stopped_supervisor_cannot_start() throws Exception {
        supervisor.stop(Duration.ofSeconds(1));
        supervisor.start();
    }

    @Test
    public void unknown_projection_has_no_health() {
        assertFalse(supervisor.health("missing").isPresent());
    }
}
