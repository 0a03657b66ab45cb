package io.github.goodees.evsource.core.projection;

/*-
 * #%L
 * evsource-core
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
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

import ch.qos.logback.classic.Level;
import io.github.goodees.evsource.core.Event;
import io.github.goodees.evsource.core.EventType;
import io.github.goodees.evsource.core.RecordingAppender;
import io.github.goodees.evsource.store.inmemory.InMemoryEventStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static io.github.goodees.evsource.core.TestEvents.event;
import static io.github.goodees.evsource.core.TestEvents.events;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DefaultEventProjectionTest {
    private static final String LOGGER = "io.github.goodees.evsource.test.projection";

    @Rule
    public TestName testName = new TestName();

    private InMemoryEventStore store;
    private DefaultEventProjection engine;
    private RecordingAppender log;

    @Before
    public void setUp() {
        log = RecordingAppender.attach(LOGGER);
        store = new InMemoryEventStore();
        engine = engine(config().build());
    }

    @After
    public void tearDown() {
        engine.stopBackgroundProcessor();
        store.close();
        log.detach();
    }

    private String name() {
        return testName.getMethodName();
    }

    private static ImmutableProjectionConfig.Builder config() {
        return ProjectionConfig.builder()
                .backgroundWorkers(2)
                .batchSize(200)
                .batchTimeout(Duration.ofMillis(50))
                .retryAttempts(0)
                .stateUpdateInterval(Duration.ZERO)
                .shutdownTimeout(Duration.ofSeconds(5));
    }

    private DefaultEventProjection engine(ProjectionConfig config) {
        return new DefaultEventProjection(store, config, Clock.systemUTC(), LoggerFactory.getLogger(LOGGER));
    }

    private static ImmutableProjection.Builder projection(String id, ProjectionHandler handler) {
        return Projection.builder()
                .id(id)
                .name("Projection " + id)
                .type(ProjectionType.AGGREGATION)
                .eventTypes(EnumSet.of(EventType.CREATE, EventType.UPDATE))
                .handler(handler);
    }

    private static void await(String description, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }

    private long processed(String projectionId) {
        try {
            return engine.getProjectionState(projectionId).getEventsProcessed();
        } catch (ProjectionException e) {
            throw new AssertionError(e);
        }
    }

    @Test
    public void created_projection_is_registered() throws ProjectionException {
        engine.createProjection(projection(name(), new CountingHandler()).build());

        Projection projection = engine.getProjection(name());
        assertEquals("Projection " + name(), projection.getName());
        assertEquals(0, projection.getVersion());
        assertTrue(projection.getCreatedAt().isPresent());
        assertFalse(projection.getData().isPresent());
        assertEquals(0, engine.getProjectionState(name()).getEventsProcessed());
    }

    @Test
    public void projection_without_event_types_is_rejected() {
        try {
            engine.createProjection(projection(name(), new CountingHandler())
                    .eventTypes(EnumSet.noneOf(EventType.class)).build());
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.VALIDATION, e.getFault());
            assertThat(e.getMessage(), containsString("at least one event type"));
        }
    }

    @Test
    public void projection_without_name_is_rejected() {
        try {
            engine.createProjection(projection(name(), new CountingHandler()).name(" ").build());
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.VALIDATION, e.getFault());
        }
    }

    @Test
    public void projection_without_handler_is_rejected() {
        try {
            engine.createProjection(Projection.builder()
                    .id(name())
                    .name(name())
                    .type(ProjectionType.STATE)
                    .addEventTypes(EventType.CREATE)
                    .handlerType("unknown")
                    .build());
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.VALIDATION, e.getFault());
            assertThat(e.getMessage(), containsString("projection handler is required"));
        }
    }

    @Test
    public void handler_is_resolved_by_type() throws Exception {
        CountingHandler handler = new CountingHandler();
        engine.registerHandler("counter", handler);
        assertTrue(engine.getHandler("counter").isPresent());
        assertFalse(engine.getHandler("other").isPresent());

        engine.createProjection(Projection.builder()
                .id(name())
                .name(name())
                .type(ProjectionType.STATISTICS)
                .addEventTypes(EventType.CREATE)
                .handlerType("counter")
                .build());
        store.saveEvents(events(name(), 1, 2));

        assertEquals(1, engine.rebuildProjection(name()));
        assertEquals(1, handler.count());
    }

    @Test
    public void duplicate_projection_is_rejected() throws ProjectionException {
        engine.createProjection(projection(name(), new CountingHandler()).build());
        try {
            engine.createProjection(projection(name(), new CountingHandler()).build());
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.DUPLICATE, e.getFault());
        }
    }

    @Test
    public void projection_count_is_limited() throws ProjectionException {
        engine = engine(config().maxProjections(1).build());
        engine.createProjection(projection(name() + "-1", new CountingHandler()).build());
        try {
            engine.createProjection(projection(name() + "-2", new CountingHandler()).build());
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.LIMIT_REACHED, e.getFault());
        }
    }

    @Test
    public void update_increments_version_and_keeps_data() throws Exception {
        engine.createProjection(projection(name(), new CountingHandler()).build());
        store.saveEvents(events(name(), 1, 3));
        engine.rebuildProjection(name());
        Projection created = engine.getProjection(name());

        engine.updateProjection(projection(name(), new CountingHandler()).name("renamed").build());

        Projection updated = engine.getProjection(name());
        assertEquals("renamed", updated.getName());
        assertEquals(1, updated.getVersion());
        assertEquals(created.getCreatedAt(), updated.getCreatedAt());
        assertEquals(3L, updated.getData().get());
    }

    @Test
    public void unknown_projection_is_not_found() {
        try {
            engine.updateProjection(projection(name(), new CountingHandler()).build());
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.NOT_FOUND, e.getFault());
        }
        try {
            engine.getProjectionMetrics(name());
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals("projection not found: " + name(), e.getMessage());
        }
    }

    @Test
    public void deleted_projection_is_gone() throws ProjectionException {
        engine.createProjection(projection(name(), new CountingHandler()).build());
        engine.deleteProjection(name());
        try {
            engine.getProjection(name());
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals(ProjectionException.Fault.NOT_FOUND, e.getFault());
        }
        assertEquals(0, engine.getProjectionStats().getTotalProjections());
    }

    @Test
    public void projections_are_listed_by_filter_and_page() throws ProjectionException {
        for (int i = 1; i <= 5; i++) {
            engine.createProjection(projection("p" + i, new CountingHandler())
                    .type(i % 2 == 1 ? ProjectionType.AGGREGATION : ProjectionType.STATE)
                    .active(i != 5)
                    .build());
        }

        assertThat(ids(engine.listProjections(ProjectionFilter.builder().type(ProjectionType.AGGREGATION).build())),
                contains("p1", "p3", "p5"));
        assertThat(ids(engine.listProjections(ProjectionFilter.builder().offset(1).limit(2).build())),
                contains("p2", "p3"));
        assertThat(ids(engine.listProjections(ProjectionFilter.builder().active(false).build())),
                contains("p5"));
        assertEquals(5, engine.listProjections(ProjectionFilter.all()).size());

        ProjectionStats stats = engine.getProjectionStats();
        assertEquals(5, stats.getTotalProjections());
        assertEquals(4, stats.getActiveProjections());
        assertEquals(Long.valueOf(3), stats.getProjectionsByType().get("aggregation"));
        assertEquals(Long.valueOf(2), stats.getProjectionsByType().get("state"));
    }

    private static List<String> ids(List<Projection> projections) {
        return projections.stream().map(Projection::getId).collect(Collectors.toList());
    }

    @Test(timeout = 10000)
    public void events_of_aggregate_are_applied_in_order() throws Exception {
        CountingHandler handler = new CountingHandler();
        engine.createProjection(projection(name(), handler).build());
        engine.startBackgroundProcessor();

        List<Event> first = events(name() + "-a", 1, 50);
        List<Event> second = events(name() + "-b", 1, 50);
        for (int i = 0; i < 50; i++) {
            assertTrue(engine.processEvent(first.get(i)));
            assertTrue(engine.processEvent(second.get(i)));
        }
        await("100 processed events", () -> processed(name()) == 100);

        Map<String, List<Long>> versions = handler.versionsByAggregate();
        List<Long> expected = new ArrayList<>();
        for (long v = 1; v <= 50; v++) {
            expected.add(v);
        }
        assertEquals(expected, versions.get(name() + "-a"));
        assertEquals(expected, versions.get(name() + "-b"));
        assertEquals(100L, engine.getProjection(name()).getData().get());
    }

    @Test(timeout = 10000)
    public void failing_projection_does_not_affect_others() throws Exception {
        engine.createProjection(projection(name() + "-good", new CountingHandler()).build());
        engine.createProjection(projection(name() + "-bad", new FailingHandler()).build());
        engine.startBackgroundProcessor();

        assertEquals(10, engine.processEvents(events(name(), 1, 10)));
        await("good projection", () -> processed(name() + "-good") == 10);
        await("bad projection failures", () -> {
            try {
                return engine.getProjectionState(name() + "-bad").getErrorsCount() == 10;
            } catch (ProjectionException e) {
                throw new AssertionError(e);
            }
        });

        ProjectionState good = engine.getProjectionState(name() + "-good");
        assertEquals(10, good.getLastVersion());
        assertEquals(name() + "-10", good.getLastEventId().get());
        assertEquals(0, good.getErrorsCount());
        ProjectionState bad = engine.getProjectionState(name() + "-bad");
        assertEquals(0, bad.getEventsProcessed());
        assertEquals("projection is broken", bad.getErrorMessage().get());
        assertTrue(bad.getLastError().isPresent());

        assertEquals(ProjectionMetrics.Health.HEALTHY, engine.getProjectionMetrics(name() + "-good").getHealth());
        assertEquals(ProjectionMetrics.Health.FAILING, engine.getProjectionMetrics(name() + "-bad").getHealth());
        ProjectionStats stats = engine.getProjectionStats();
        assertEquals(10, stats.getEventsProcessed());
        assertEquals(0.5, stats.getErrorRate(), 0.001);
        assertThat(log.messages(Level.ERROR), hasItem(containsString("Projection " + name() + "-bad failed")));
    }

    @Test(timeout = 10000)
    public void events_submitted_before_start_are_processed() throws Exception {
        engine.createProjection(projection(name(), new CountingHandler()).build());
        assertTrue(engine.processEvent(event(name(), 1)));
        engine.startBackgroundProcessor();
        await("queued event", () -> processed(name()) == 1);
    }

    @Test
    public void stopped_engine_drops_events() throws ProjectionException {
        engine.createProjection(projection(name(), new CountingHandler()).build());
        engine.startBackgroundProcessor();
        engine.stopBackgroundProcessor();

        assertFalse(engine.processEvent(event(name(), 1)));
        assertEquals(1, engine.getProjectionStats().getDroppedEvents());
        assertThat(log.messages(Level.WARN), hasItem(containsString("dropping event " + name() + "-1")));
        try {
            engine.startBackgroundProcessor();
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("already stopped"));
        }
    }

    @Test(timeout = 10000)
    public void stop_waits_for_queued_events() throws Exception {
        CountingHandler handler = new CountingHandler() {
            @Override
            public Object project(Event event, Projection projection) throws Exception {
                Thread.sleep(10);
                return super.project(event, projection);
            }
        };
        engine.createProjection(projection(name(), handler).build());
        engine.startBackgroundProcessor();
        engine.processEvents(events(name(), 1, 20));

        engine.stopBackgroundProcessor();

        assertEquals(20, handler.count());
    }

    @Test
    public void rebuild_applies_stored_events_chronologically() throws Exception {
        CountingHandler handler = new CountingHandler();
        engine.createProjection(projection(name(), handler).build());
        store.saveEvents(events(name() + "-b", 1, 2));
        store.saveEvents(events(name() + "-a", 1, 3));

        assertEquals(5, engine.rebuildProjection(name()));

        assertEquals(Arrays.asList(name() + "-a-1", name() + "-b-1", name() + "-a-2", name() + "-b-2",
                name() + "-a-3"), handler.ids());
        assertEquals(5L, engine.getProjection(name()).getData().get());
        assertEquals(5, engine.getProjectionState(name()).getEventsProcessed());
    }

    @Test
    public void rebuild_of_aggregate_projection_reads_only_its_events() throws Exception {
        CountingHandler handler = new CountingHandler();
        engine.createProjection(projection(name(), handler).aggregateId(name() + "-a")
                .eventTypes(EnumSet.of(EventType.UPDATE)).build());
        store.saveEvents(events(name() + "-a", 1, 4));
        store.saveEvents(events(name() + "-b", 1, 4));

        assertEquals(3, engine.rebuildProjection(name()));
        assertEquals(Arrays.asList(name() + "-a-2", name() + "-a-3", name() + "-a-4"), handler.ids());
        assertEquals(1, engine.rebuildAllProjections());
    }

    @Test
    public void reset_clears_state_but_keeps_data() throws Exception {
        engine.createProjection(projection(name(), new CountingHandler()).build());
        store.saveEvents(events(name(), 1, 3));
        engine.rebuildProjection(name());

        engine.resetProjection(name());

        ProjectionState state = engine.getProjectionState(name());
        assertEquals(0, state.getEventsProcessed());
        assertEquals(0, state.getLastVersion());
        assertFalse(state.getLastEventId().isPresent());
        assertEquals(3L, engine.getProjection(name()).getData().get());
    }

    @Test(timeout = 10000)
    public void inactive_projection_receives_nothing() throws Exception {
        CountingHandler inactive = new CountingHandler();
        engine.createProjection(projection(name() + "-inactive", inactive).active(false).build());
        engine.createProjection(projection(name(), new CountingHandler()).build());
        engine.startBackgroundProcessor();

        engine.processEvents(events(name(), 1, 5));
        await("active projection", () -> processed(name()) == 5);

        assertEquals(0, inactive.count());
    }

    @Test(timeout = 10000)
    public void connected_engine_receives_committed_events() throws Exception {
        CountingHandler handler = new CountingHandler();
        engine.createProjection(projection(name(), handler).build());
        engine.startBackgroundProcessor();
        engine.connect(store);

        store.saveEvents(events(name(), 1, 3));
        store.saveEvent(event(name() + "-other", 1, EventType.DELETE));

        await("committed events", () -> processed(name()) == 3);
        assertEquals(Arrays.asList(name() + "-1", name() + "-2", name() + "-3"), handler.ids());
    }

    @Test(timeout = 10000)
    public void metrics_reflect_processed_events() throws Exception {
        engine.createProjection(projection(name(), new CountingHandler()).build());
        engine.startBackgroundProcessor();
        engine.processEvents(events(name(), 1, 4));
        await("processed events", () -> processed(name()) == 4);

        ProjectionMetrics metrics = engine.getProjectionMetrics(name());
        assertEquals(4, metrics.getEventsProcessed());
        assertEquals(0.0, metrics.getErrorRate(), 0.0);
        assertTrue(metrics.getEventsPerSecond() > 0);
        assertTrue(metrics.getLastProcessed().isPresent());
        assertTrue(engine.getProjection(name()).getLastProcessed().isPresent());
    }

    static class CountingHandler implements ProjectionHandler {
        private final List<Event> events = new ArrayList<>();
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public boolean canHandle(Event event) {
            return true;
        }

        @Override
        public Object project(Event event, Projection projection) throws Exception {
            synchronized (events) {
                events.add(event);
            }
            count.incrementAndGet();
            return projection.getData().map(Long.class::cast).orElse(0L) + 1;
        }

        int count() {
            return count.get();
        }

        List<String> ids() {
            synchronized (events) {
                return events.stream().map(Event::getId).collect(Collectors.toList());
            }
        }

        Map<String, List<Long>> versionsByAggregate() {
            Map<String, List<Long>> result = new LinkedHashMap<>();
            synchronized (events) {
                for (Event event : events) {
                    result.computeIfAbsent(event.getAggregateId(), k -> new ArrayList<>()).add(event.getVersion());
                }
            }
            return result;
        }
    }

    static class FailingHandler implements ProjectionHandler {
        @Override
        public boolean canHandle(Event event) {
            return true;
        }

        @Override
        public Object project(Event event, Projection projection) {
            throw new IllegalStateException("projection is broken");
        }
    }
}
