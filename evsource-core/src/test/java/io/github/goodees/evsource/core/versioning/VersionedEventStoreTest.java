package io.github.goodees.evsource.core.versioning;

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
import io.github.goodees.evsource.core.store.EventStoreException;
import io.github.goodees.evsource.store.inmemory.MockEventStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.junit.rules.TestName;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.github.goodees.evsource.core.TestEvents.event;
import static io.github.goodees.evsource.core.TestEvents.events;
import static io.github.goodees.evsource.core.TestEvents.range;
import static io.github.goodees.evsource.core.TestEvents.versions;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class VersionedEventStoreTest {
    @Rule
    public TestName testName = new TestName();

    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private MockEventStore delegate;

    @Before
    public void setUp() {
        delegate = new MockEventStore();
    }

    @After
    public void tearDown() {
        delegate.close();
    }

    private String name() {
        return testName.getMethodName();
    }

    private VersionedEventStore versioned(ConflictResolution resolution) {
        return new VersionedEventStore(delegate, new DefaultEventVersioning(delegate,
                VersioningConfig.builder().conflictResolution(resolution).build()));
    }

    @Test
    public void unversioned_events_are_numbered_sequentially() throws EventStoreException {
        VersionedEventStore store = versioned(ConflictResolution.REJECT);
        store.saveEvents(Arrays.asList(event(name(), 0), event(name(), 0), event(name(), 0)));
        store.saveEvent(event(name(), 0));

        assertArrayEquals(range(1, 4), versions(delegate.getAllEvents(name())));
        assertEquals(4, store.getVersioning().getVersion(name()).getCurrentVersion());
    }

    @Test
    public void numbering_continues_from_stored_version() throws EventStoreException {
        delegate.saveEvents(events(name(), 1, 3));
        VersionedEventStore store = versioned(ConflictResolution.REJECT);
        store.saveEvent(event(name(), 0));
        assertEquals(4, delegate.getAggregateInfo(name()).getVersion());
    }

    @Test
    public void rejected_conflict_stores_nothing() throws EventStoreException {
        delegate.saveEvents(events(name(), 1, 2));
        VersionedEventStore store = versioned(ConflictResolution.REJECT);
        try {
            store.saveEvents(Arrays.asList(event(name(), 0), event(name(), 9)));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
        assertEquals(2, delegate.getAggregateInfo(name()).getVersion());
        assertEquals(2, store.getVersioning().getVersion(name()).getCurrentVersion());
        store.saveEvent(event(name(), 0));
        assertArrayEquals(range(1, 3), versions(store.getAllEvents(name())));
    }

    @Test
    public void resolved_version_still_has_to_follow_store_continuity() throws EventStoreException {
        delegate.saveEvents(events(name(), 1, 2));
        VersionedEventStore store = versioned(ConflictResolution.INCREMENT);
        try {
            store.saveEvent(event(name(), 5));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CONTINUITY, e.getFault());
        }
        assertEquals(2, delegate.getAggregateInfo(name()).getVersion());
        assertEquals(2, store.getVersioning().getVersion(name()).getCurrentVersion());
    }

    @Test
    public void failed_write_does_not_advance_version() throws EventStoreException {
        VersionedEventStore store = versioned(ConflictResolution.REJECT);
        delegate.throwExceptionOnce(EventStoreException.closed());
        try {
            store.saveEvent(event(name(), 0));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
        store.saveEvent(event(name(), 0));
        assertArrayEquals(range(1, 1), versions(delegate.getAllEvents(name())));
    }

    @Test
    public void unexpected_store_failure_does_not_advance_version() throws EventStoreException {
        delegate.saveEvents(events(name(), 1, 2));
        VersionedEventStore store = versioned(ConflictResolution.REJECT);
        delegate.failOnce(new IllegalStateException("store unavailable"));
        try {
            store.saveEvent(event(name(), 0));
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertEquals("store unavailable", e.getMessage());
        }
        assertEquals(2, store.getVersioning().getVersion(name()).getCurrentVersion());
        store.saveEvent(event(name(), 0));
        assertArrayEquals(range(1, 3), versions(delegate.getAllEvents(name())));
    }

    @Test
    public void blank_aggregate_id_is_rejected() {
        VersionedEventStore store = versioned(ConflictResolution.REJECT);
        try {
            store.saveEvent(event(" ", 0));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.VALIDATION, e.getFault());
        }
    }

    @Test(timeout = 20000)
    public void concurrent_writers_get_distinct_versions() throws Exception {
        VersionedEventStore store = versioned(ConflictResolution.REJECT);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 100; i++) {
            executor.execute(() -> {
                try {
                    store.saveEvent(event(name(), 0));
                } catch (EventStoreException e) {
                    collector.addError(e);
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        List<Event> saved = delegate.getAllEvents(name());
        assertArrayEquals(range(1, 100), versions(saved));
        assertTrue(store.getVersioning().getVersionConflicts(name()).isEmpty());
    }
}
