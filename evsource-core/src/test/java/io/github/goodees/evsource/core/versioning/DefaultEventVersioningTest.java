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

import io.github.goodees.evsource.core.EventType;
import io.github.goodees.evsource.core.TestEvents;
import io.github.goodees.evsource.core.store.EventStoreException;
import io.github.goodees.evsource.store.inmemory.InMemoryEventStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Instant;
import java.util.List;

import static io.github.goodees.evsource.core.TestEvents.event;
import static io.github.goodees.evsource.core.TestEvents.events;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DefaultEventVersioningTest {
    @Rule
    public TestName testName = new TestName();

    private InMemoryEventStore store;

    @Before
    public void setUp() throws EventStoreException {
        store = new InMemoryEventStore();
        store.saveEvents(events(name(), 1, 2));
    }

    @After
    public void tearDown() {
        store.close();
    }

    private String name() {
        return testName.getMethodName();
    }

    private DefaultEventVersioning versioning(ConflictResolution resolution) {
        return new DefaultEventVersioning(store, VersioningConfig.builder().conflictResolution(resolution).build());
    }

    @Test
    public void unknown_aggregate_starts_at_version_zero() throws EventStoreException {
        VersionInfo info = new DefaultEventVersioning(store).getVersion(name() + "-new");
        assertEquals(0, info.getCurrentVersion());
        assertTrue(info.getVersionHistory().isEmpty());
    }

    @Test
    public void version_is_initialized_from_store() throws EventStoreException {
        VersionInfo info = new DefaultEventVersioning(store).getVersion(name());
        assertEquals(2, info.getCurrentVersion());
        assertEquals(TestEvents.AGGREGATE_TYPE, info.getAggregateType());
    }

    @Test
    public void unversioned_events_get_next_version() throws EventStoreException {
        DefaultEventVersioning versioning = new DefaultEventVersioning(store);
        assertEquals(3, versioning.incrementVersion(name(), event(name(), 0)));
        assertEquals(4, versioning.incrementVersion(name(), event(name(), 0)));
        assertEquals(5, versioning.incrementVersion(name(), event(name(), 5)));

        VersionInfo info = versioning.getVersion(name());
        assertEquals(5, info.getCurrentVersion());
        assertEquals(name() + "-5", info.getLastEventId().get());
        assertEquals(3, info.getVersionHistory().size());
        assertTrue(versioning.getVersionConflicts(name()).isEmpty());
    }

    @Test
    public void increment_policy_resolves_to_following_version() throws EventStoreException {
        DefaultEventVersioning versioning = versioning(ConflictResolution.INCREMENT);
        long[] actualVersions = {1, 4, 10, 100};
        for (long actual : actualVersions) {
            String aggregateId = name() + "-" + actual;
            versioning.incrementVersion(aggregateId, event(aggregateId, 1));
            long resolved = versioning.incrementVersion(aggregateId, event(aggregateId, actual));
            assertEquals(actual + 1, resolved);
            assertEquals(actual + 1, versioning.getVersion(aggregateId).getCurrentVersion());
            List<VersionConflict> conflicts = versioning.getVersionConflicts(aggregateId);
            assertEquals(1, conflicts.size());
            assertEquals("resolved to " + (actual + 1), conflicts.get(0).getResolution().get());
        }
    }

    @Test
    public void reject_policy_fails_and_keeps_version() throws EventStoreException {
        DefaultEventVersioning versioning = versioning(ConflictResolution.REJECT);
        for (int attempt = 0; attempt < 3; attempt++) {
            try {
                versioning.incrementVersion(name(), event(name(), 7));
                fail("should have failed");
            } catch (EventStoreException e) {
                assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
            }
            assertEquals(2, versioning.getVersion(name()).getCurrentVersion());
        }
        List<VersionConflict> conflicts = versioning.getVersionConflicts(name());
        assertEquals(3, conflicts.size());
        assertEquals(3, conflicts.get(0).getExpectedVersion());
        assertEquals(7, conflicts.get(0).getActualVersion());
        assertEquals("rejected", conflicts.get(0).getResolution().get());
        assertEquals(0, versioning.getVersioningStats().getResolvedConflicts());
    }

    @Test
    public void accept_policies_pick_higher_or_lower_version() throws EventStoreException {
        assertEquals(7, versioning(ConflictResolution.ACCEPT_HIGHER).incrementVersion(name(), event(name(), 7)));
        assertEquals(3, versioning(ConflictResolution.ACCEPT_LOWER).incrementVersion(name(), event(name(), 7)));
    }

    @Test
    public void conflicts_can_be_resolved_directly() throws EventStoreException {
        VersionConflict conflict = new VersionConflict(name(), 3, 7, Instant.now());
        assertEquals(8, versioning(ConflictResolution.INCREMENT).resolveVersionConflict(conflict));
        try {
            versioning(ConflictResolution.REJECT).resolveVersionConflict(conflict);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
    }

    @Test
    public void validation_of_expected_version_records_mismatch() throws EventStoreException {
        DefaultEventVersioning versioning = new DefaultEventVersioning(store);
        versioning.validateVersion(name(), 2);
        try {
            versioning.validateVersion(name(), 1);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
        assertEquals(1, versioning.getVersionConflicts(name()).size());
        assertEquals(1, versioning.getVersioningStats().getTotalConflicts());
    }

    @Test
    public void history_is_limited_by_retention() throws EventStoreException {
        DefaultEventVersioning versioning = new DefaultEventVersioning(store,
                VersioningConfig.builder().historyRetention(3).build());
        for (int i = 0; i < 5; i++) {
            versioning.incrementVersion(name(), event(name(), 0));
        }
        List<VersionHistoryEntry> history = versioning.getVersionHistory(name(), 0);
        assertEquals(3, history.size());
        assertEquals(5, history.get(0).getVersion());
        assertEquals(7, history.get(2).getVersion());
        List<VersionHistoryEntry> latest = versioning.getVersionHistory(name(), 2);
        assertEquals(2, latest.size());
        assertEquals(6, latest.get(0).getVersion());
    }

    @Test
    public void history_can_be_extended_manually() throws EventStoreException {
        DefaultEventVersioning versioning = new DefaultEventVersioning(store);
        VersionHistoryEntry entry = new VersionHistoryEntry(2, name() + "-2", TestEvents.BASE, EventType.UPDATE,
                "imported");
        versioning.addVersionHistory(name(), entry);
        assertEquals(entry, versioning.getVersionHistory(name(), 1).get(0));
    }

    @Test
    public void disabled_history_stays_empty() throws EventStoreException {
        DefaultEventVersioning versioning = new DefaultEventVersioning(store,
                VersioningConfig.builder().enableHistory(false).build());
        versioning.incrementVersion(name(), event(name(), 0));
        assertTrue(versioning.getVersionHistory(name(), 0).isEmpty());
    }

    @Test
    public void stats_track_versions_and_conflicts() throws EventStoreException {
        DefaultEventVersioning versioning = versioning(ConflictResolution.INCREMENT);
        versioning.incrementVersion(name(), event(name(), 0));
        versioning.incrementVersion(name(), event(name(), 9));

        VersioningStats stats = versioning.getVersioningStats();
        assertEquals(2, stats.getTotalVersions());
        assertEquals(1, stats.getTotalConflicts());
        assertEquals(1, stats.getResolvedConflicts());
        assertTrue(stats.getLastConflict().isPresent());
        assertEquals(Long.valueOf(1), stats.getVersionDistribution().get(3L));
        assertEquals(Long.valueOf(1), stats.getVersionDistribution().get(10L));
    }

    @Test
    public void policy_names_are_resolved() {
        assertEquals(ConflictResolution.ACCEPT_HIGHER, ConflictResolution.fromName("accept-higher"));
        assertEquals(ConflictResolution.INCREMENT, ConflictResolution.fromName("INCREMENT"));
        assertEquals("accept-lower", ConflictResolution.ACCEPT_LOWER.policyName());
    }
}
