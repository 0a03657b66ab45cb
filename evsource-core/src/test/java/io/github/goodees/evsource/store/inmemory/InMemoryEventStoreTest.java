package io.github.goodees.evsource.store.inmemory;

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

import io.github.goodees.evsource.core.Event;
import io.github.goodees.evsource.core.EventType;
import io.github.goodees.evsource.core.Payload;
import io.github.goodees.evsource.core.TestEvents;
import io.github.goodees.evsource.core.store.AggregateInfo;
import io.github.goodees.evsource.core.store.EventStoreException;
import io.github.goodees.evsource.core.store.EventStoreHealth;
import io.github.goodees.evsource.core.store.EventStoreInfo;
import io.github.goodees.evsource.core.store.EventStoreStats;
import io.github.goodees.evsource.core.store.JacksonSerialization;
import io.github.goodees.evsource.core.store.Snapshot;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static io.github.goodees.evsource.core.TestEvents.BASE;
import static io.github.goodees.evsource.core.TestEvents.event;
import static io.github.goodees.evsource.core.TestEvents.events;
import static io.github.goodees.evsource.core.TestEvents.range;
import static io.github.goodees.evsource.core.TestEvents.versions;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InMemoryEventStoreTest {
    @Rule
    public TestName testName = new TestName();

    private InMemoryEventStore store;

    @Before
    public void setUp() {
        store = new InMemoryEventStore(EventStoreConfig.builder().nodeId("test").build());
    }

    @After
    public void tearDown() {
        store.close();
    }

    private String name() {
        return testName.getMethodName();
    }

    @Test
    public void saved_versions_are_contiguous() throws EventStoreException {
        store.saveEvents(events(name(), 1, 3));
        store.saveEvent(event(name(), 4));
        store.saveEvent(event(name(), 5));

        assertArrayEquals(range(1, 5), versions(store.getAllEvents(name())));
        AggregateInfo info = store.getAggregateInfo(name());
        assertEquals(5, info.getVersion());
        assertEquals(5, info.getEventCount());
        assertEquals(TestEvents.AGGREGATE_TYPE, info.getAggregateType());
        assertEquals(BASE.plusSeconds(1), info.getFirstEvent().get());
        assertEquals(BASE.plusSeconds(5), info.getLastEvent().get());
    }

    @Test
    public void batch_breaking_continuity_is_rejected_as_a_whole() throws EventStoreException {
        store.saveEvents(events(name(), 1, 2));
        try {
            store.saveEvents(Arrays.asList(event(name(), 3), event(name(), 5)));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CONTINUITY, e.getFault());
        }
        assertArrayEquals(range(1, 2), versions(store.getAllEvents(name())));
        assertEquals(2, store.getAggregateInfo(name()).getVersion());
    }

    @Test
    public void version_gap_reports_expected_version() throws EventStoreException {
        store.saveEvent(event("order-1", 1, EventType.CREATE));
        store.saveEvent(event("order-1", 2, EventType.UPDATE));
        try {
            store.saveEvent(event("order-1", 4, EventType.UPDATE));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CONTINUITY, e.getFault());
            assertThat(e.getMessage(), containsString("version gap detected: expected 3, got 4"));
        }
        assertEquals(2, store.getAggregateInfo("order-1").getVersion());
    }

    @Test
    public void first_event_must_have_version_one() {
        try {
            store.saveEvent(event(name(), 2));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CONTINUITY, e.getFault());
            assertTrue(store.getAllEvents(name()).isEmpty());
        }
    }

    @Test
    public void batch_may_interleave_aggregates() throws EventStoreException {
        store.saveEvents(Arrays.asList(event(name() + "-a", 1), event(name() + "-b", 1), event(name() + "-a", 2),
                event(name() + "-b", 2)));
        assertEquals(2, store.getAggregateInfo(name() + "-a").getVersion());
        assertEquals(2, store.getAggregateInfo(name() + "-b").getVersion());
    }

    @Test
    public void invalid_event_is_rejected_without_side_effects() throws EventStoreException {
        store.saveEvent(event(name(), 1));
        Event withoutId = TestEvents.builder(name(), 2, EventType.UPDATE).id(null).build();
        try {
            store.saveEvents(Arrays.asList(withoutId, event(name(), 3)));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.VALIDATION, e.getFault());
            assertThat(e.getMessage(), containsString("event ID is required"));
        }
        assertEquals(1, store.getAllEvents(name()).size());
        assertEquals(1, store.getEventStats().getTotalEvents());
    }

    @Test
    public void oversized_event_is_rejected() {
        InMemoryEventStore small = new InMemoryEventStore(EventStoreConfig.builder().maxEventSize(256).build());
        try {
            char[] text = new char[1024];
            Arrays.fill(text, 'x');
            small.saveEvent(TestEvents.builder(name(), 1, EventType.CREATE)
                    .data(Payload.ofText("text/plain", new String(text)))
                    .build());
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.VALIDATION, e.getFault());
            assertThat(e.getMessage(), containsString("exceeds maximum allowed size 256"));
        } finally {
            small.close();
        }
    }

    @Test
    public void range_query_includes_both_bounds() throws EventStoreException {
        store.saveEvents(events(name(), 1, 10));
        for (long from = 1; from <= 10; from++) {
            for (long to = from; to <= 10; to++) {
                assertArrayEquals("range " + from + ".." + to, range(from, to),
                        versions(store.getEvents(name(), from, to)));
            }
        }
        assertTrue(store.getEvents(name(), 11, 20).isEmpty());
    }

    @Test
    public void unknown_aggregate_has_no_events() {
        assertTrue(store.getAllEvents(name()).isEmpty());
        assertTrue(store.getEvents(name(), 1, 10).isEmpty());
        try {
            store.getAggregateInfo(name());
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.NOT_FOUND, e.getFault());
        }
    }

    @Test
    public void events_by_type_are_ordered_across_aggregates() throws EventStoreException {
        store.saveEvents(events(name() + "-b", 1, 2));
        store.saveEvents(events(name() + "-a", 1, 3));

        List<Event> updates = store.getEventsByType(EventType.UPDATE, 0);
        assertEquals(3, updates.size());
        assertEquals(name() + "-a-2", updates.get(0).getId());
        assertEquals(name() + "-b-2", updates.get(1).getId());
        assertEquals(name() + "-a-3", updates.get(2).getId());

        List<Event> limited = store.getEventsByType(EventType.UPDATE, 2);
        assertEquals(updates.subList(0, 2), limited);
        assertTrue(store.getEventsByType(EventType.DELETE, 0).isEmpty());
    }

    @Test
    public void time_range_excludes_bounds() throws EventStoreException {
        store.saveEvents(events(name(), 1, 5));
        List<Event> inRange = store.getEventsByTimeRange(BASE.plusSeconds(1), BASE.plusSeconds(5), 0);
        assertArrayEquals(range(2, 4), versions(inRange));
        assertEquals(1, store.getEventsByTimeRange(BASE, BASE.plusSeconds(10), 1).size());
    }

    @Test
    public void snapshot_requires_stored_version() throws EventStoreException {
        store.saveEvents(events(name(), 1, 2));
        try {
            store.createSnapshot(name(), 3, Payload.ofText("text/plain", "state"));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.NOT_FOUND, e.getFault());
        }
        try {
            store.createSnapshot(name() + "-unknown", 1, Payload.ofText("text/plain", "state"));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.NOT_FOUND, e.getFault());
        }
    }

    @Test
    public void latest_snapshot_replaces_previous_one() throws EventStoreException {
        store.saveEvents(events(name(), 1, 3));
        store.createSnapshot(name(), 2, Payload.ofText("text/plain", "two"));
        store.createSnapshot(name(), 3, Payload.ofText("text/plain", "three"));

        Snapshot snapshot = store.getSnapshot(name());
        assertEquals(3, snapshot.getVersion());
        assertEquals("three", snapshot.getData().asText());
        assertEquals(TestEvents.AGGREGATE_TYPE, snapshot.getAggregateType());
        assertEquals("test", snapshot.getMetadata().get("node_id"));
        assertTrue(store.getAggregateInfo(name()).getLastSnapshot().isPresent());
        assertEquals(2, store.getEventStats().getSnapshotCount());
    }

    @Test
    public void missing_snapshot_is_not_found() throws EventStoreException {
        store.saveEvent(event(name(), 1));
        try {
            store.getSnapshot(name());
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.NOT_FOUND, e.getFault());
        }
    }

    @Test
    public void compaction_keeps_aggregate_version() throws EventStoreException {
        store.saveEvents(events(name(), 1, 5));
        long sizeBefore = store.getEventStats().getStoreSize();

        assertEquals(3, store.compactEvents(name(), 3));
        assertThat(sizeBefore, greaterThan(store.getEventStats().getStoreSize()));

        assertArrayEquals(range(4, 5), versions(store.getAllEvents(name())));
        assertEquals(5, store.getAggregateInfo(name()).getVersion());
        store.saveEvent(event(name(), 6));
        assertArrayEquals(range(4, 6), versions(store.getAllEvents(name())));

        EventStoreStats stats = store.getEventStats();
        assertEquals(3, stats.getCompactionStats().getEventsCompacted());
        assertEquals(1, stats.getCompactionStats().getCompactionsCount());
        assertThat(stats.getCompactionStats().getSpaceReclaimed(), greaterThan(0L));
        assertTrue(stats.getCompactionStats().getLastCompaction().isPresent());
    }

    @Test
    public void compaction_of_unknown_aggregate_fails() {
        try {
            store.compactEvents(name(), 3);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.NOT_FOUND, e.getFault());
        }
    }

    @Test
    public void pruning_removes_events_up_to_threshold() throws EventStoreException {
        store.saveEvents(events(name(), 1, 5));
        store.saveEvents(events(name() + "-other", 1, 2));

        assertEquals(5, store.pruneEvents(BASE.plusSeconds(3)));

        assertArrayEquals(range(4, 5), versions(store.getAllEvents(name())));
        assertTrue(store.getAllEvents(name() + "-other").isEmpty());
        assertEquals(5, store.getAggregateInfo(name()).getVersion());
        assertEquals(5, store.getEventStats().getCompactionStats().getEventsPruned());
    }

    @Test
    public void maintenance_prunes_expired_events() throws EventStoreException {
        EventStoreConfig config = EventStoreConfig.builder().nodeId("maintained").eventTTL(Duration.ofSeconds(60))
                .build();
        InMemoryEventStore maintained = new InMemoryEventStore(config,
                JacksonSerialization.defaultObjectMapper(), Clock.fixed(BASE.plusSeconds(63), ZoneOffset.UTC),
                LoggerFactory.getLogger(name()));
        try {
            maintained.saveEvents(events(name(), 1, 5));
            maintained.runMaintenance();
            assertArrayEquals(range(4, 5), versions(maintained.getAllEvents(name())));
        } finally {
            maintained.close();
        }
    }

    @Test
    public void stats_count_events_by_type() throws EventStoreException {
        store.saveEvents(events(name(), 1, 3));
        store.getAllEvents(name());

        EventStoreStats stats = store.getEventStats();
        assertEquals(3, stats.getTotalEvents());
        assertEquals(1, stats.getTotalAggregates());
        assertEquals(Long.valueOf(1), stats.getEventsByType().get("create"));
        assertEquals(Long.valueOf(2), stats.getEventsByType().get("update"));
        assertEquals(1, stats.getWriteOperations());
        assertEquals(1, stats.getReadOperations());
        assertEquals(BASE.plusSeconds(3), stats.getLastEvent().get());
        assertThat(stats.getAverageEventSize(), greaterThan(0.0));
    }

    @Test
    public void info_describes_store() {
        EventStoreInfo info = store.getStoreInfo();
        assertEquals("in-memory", info.getStoreType());
        assertEquals("test", info.getNodeId());
        assertTrue(info.supports(EventStoreInfo.FEATURE_SNAPSHOTS));
        assertTrue(info.supports(EventStoreInfo.FEATURE_PRUNING));
        assertFalse(info.supports("replication"));
        assertEquals(10000, info.getConfiguration().get("stream_buffer_size"));
    }

    @Test
    public void closed_store_rejects_writes() throws EventStoreException {
        store.saveEvent(event(name(), 1));
        assertTrue(store.health().isHealthy());
        store.close();
        try {
            store.saveEvent(event(name(), 2));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
        EventStoreHealth health = store.health();
        assertEquals(EventStoreHealth.Status.STOPPED, health.getStatus());
        assertEquals(1, health.getEventCount());
        assertEquals(1, store.getAllEvents(name()).size());
    }
}
