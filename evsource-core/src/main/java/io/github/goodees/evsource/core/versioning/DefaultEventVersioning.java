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
import io.github.goodees.evsource.core.store.AggregateInfo;
import io.github.goodees.evsource.core.store.EventStore;
import io.github.goodees.evsource.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Sequential versioning backed by an {@link EventStore}. Ledgers are cached in memory and initialized from
 * {@link EventStore#getAggregateInfo(String)}.
 */
public class DefaultEventVersioning implements EventVersioning {
    private final EventStore store;
    private final VersioningConfig config;
    private final Clock clock;
    private final Logger logger;

    private final Map<String, Ledger> ledgers = new HashMap<>();
    private final Map<String, List<VersionConflict>> conflicts = new HashMap<>();
    private final Map<Long, Long> versionDistribution = new TreeMap<>();
    private long totalVersions;
    private long totalConflicts;
    private long resolvedConflicts;
    private Instant lastConflict;

    public DefaultEventVersioning(EventStore store) {
        this(store, VersioningConfig.defaults());
    }

    public DefaultEventVersioning(EventStore store, VersioningConfig config) {
        this(store, config, Clock.systemUTC(), LoggerFactory.getLogger(DefaultEventVersioning.class));
    }

    public DefaultEventVersioning(EventStore store, VersioningConfig config, Clock clock, Logger logger) {
        this.store = Objects.requireNonNull(store, "Event store must be specified");
        this.config = Objects.requireNonNull(config, "Configuration must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
        this.logger = Objects.requireNonNull(logger, "Logger must be specified");
        if (config.getStrategy() != VersioningStrategy.SEQUENTIAL) {
            logger.info("Versioning strategy {} numbers versions sequentially", config.getStrategy());
        }
    }

    @Override
    public synchronized VersionInfo getVersion(String aggregateId) throws EventStoreException {
        return ledger(aggregateId).toInfo();
    }

    private Ledger ledger(String aggregateId) throws EventStoreException {
        Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        Ledger ledger = ledgers.get(aggregateId);
        if (ledger == null) {
            ledger = load(aggregateId);
            ledgers.put(aggregateId, ledger);
        }
        return ledger;
    }

    private Ledger load(String aggregateId) throws EventStoreException {
        try {
            AggregateInfo info = store.getAggregateInfo(aggregateId);
            logger.debug("Loaded version {} of aggregate {}", info.getVersion(), aggregateId);
            return new Ledger(aggregateId, info.getAggregateType(), info.getVersion());
        } catch (EventStoreException e) {
            if (e.getFault() == EventStoreException.Fault.NOT_FOUND) {
                return new Ledger(aggregateId, null, 0);
            }
            throw e;
        }
    }

    @Override
    public synchronized long incrementVersion(String aggregateId, Event event) throws EventStoreException {
        Objects.requireNonNull(event, "Event must be specified");
        Ledger ledger = ledger(aggregateId);
        long newVersion = ledger.currentVersion + 1;
        if (event.getVersion() != 0 && event.getVersion() != newVersion) {
            VersionConflict conflict = recordConflict(aggregateId, newVersion, event.getVersion());
            try {
                newVersion = resolveVersionConflict(conflict);
            } catch (EventStoreException e) {
                resolveRecorded(aggregateId, conflict, "rejected");
                logger.warn("Version conflict of aggregate {} rejected: expected {}, got {}", aggregateId,
                        conflict.getExpectedVersion(), conflict.getActualVersion());
                throw e;
            }
            resolveRecorded(aggregateId, conflict, "resolved to " + newVersion);
            resolvedConflicts++;
            logger.info("Version conflict of aggregate {} resolved by {}: expected {}, got {}, using {}", aggregateId,
                    config.getConflictResolution().policyName(), conflict.getExpectedVersion(),
                    conflict.getActualVersion(), newVersion);
        }
        ledger.currentVersion = newVersion;
        ledger.lastEventId = event.getId();
        ledger.lastEventTime = event.getTimestamp();
        if (ledger.aggregateType == null) {
            ledger.aggregateType = event.getAggregateType();
        }
        if (config.isEnableHistory()) {
            ledger.append(new VersionHistoryEntry(newVersion, event.getId(), event.getTimestamp(), event.getType()),
                    config.getHistoryRetention());
        }
        totalVersions++;
        versionDistribution.merge(newVersion, 1L, Long::sum);
        logger.debug("Version of aggregate {} incremented to {}", aggregateId, newVersion);
        return newVersion;
    }

    @Override
    public synchronized void validateVersion(String aggregateId, long expectedVersion) throws EventStoreException {
        long current = ledger(aggregateId).currentVersion;
        if (current != expectedVersion) {
            recordConflict(aggregateId, expectedVersion, current);
            logger.debug("Aggregate {} is at version {}, caller expected {}", aggregateId, current, expectedVersion);
            throw EventStoreException.versionMismatch(aggregateId, expectedVersion, current);
        }
    }

    private VersionConflict recordConflict(String aggregateId, long expectedVersion, long actualVersion) {
        Instant now = clock.instant();
        VersionConflict conflict = new VersionConflict(aggregateId, expectedVersion, actualVersion, now);
        conflicts.computeIfAbsent(aggregateId, id -> new ArrayList<>()).add(conflict);
        totalConflicts++;
        lastConflict = now;
        return conflict;
    }

    private void resolveRecorded(String aggregateId, VersionConflict conflict, String resolution) {
        List<VersionConflict> log = conflicts.get(aggregateId);
        int index = log.lastIndexOf(conflict);
        log.set(index, conflict.withResolution(resolution));
    }

    @Override
    public synchronized List<VersionHistoryEntry> getVersionHistory(String aggregateId, int limit)
            throws EventStoreException {
        Ledger ledger = ledger(aggregateId);
        if (!config.isEnableHistory()) {
            return Collections.emptyList();
        }
        List<VersionHistoryEntry> history = new ArrayList<>(ledger.history);
        if (limit > 0 && limit < history.size()) {
            return new ArrayList<>(history.subList(history.size() - limit, history.size()));
        }
        return history;
    }

    @Override
    public synchronized void addVersionHistory(String aggregateId, VersionHistoryEntry entry)
            throws EventStoreException {
        Objects.requireNonNull(entry, "History entry must be specified");
        Ledger ledger = ledger(aggregateId);
        if (config.isEnableHistory()) {
            ledger.append(entry, config.getHistoryRetention());
        }
    }

    @Override
    public long resolveVersionConflict(VersionConflict conflict) throws EventStoreException {
        ConflictResolution policy = config.getConflictResolution();
        if (policy == ConflictResolution.REJECT) {
            throw EventStoreException.optimisticLock(conflict.getAggregateId(), conflict.getExpectedVersion(),
                    conflict.getActualVersion());
        }
        return policy.resolve(conflict.getExpectedVersion(), conflict.getActualVersion());
    }

    @Override
    public synchronized List<VersionConflict> getVersionConflicts(String aggregateId) {
        List<VersionConflict> log = conflicts.get(aggregateId);
        return log == null ? Collections.emptyList() : new ArrayList<>(log);
    }

    @Override
    public synchronized VersioningStats getVersioningStats() {
        return ImmutableVersioningStats.builder()
                .totalVersions(totalVersions)
                .totalConflicts(totalConflicts)
                .resolvedConflicts(resolvedConflicts)
                .lastConflict(Optional.ofNullable(lastConflict))
                .versionDistribution(versionDistribution)
                .build();
    }

    @Override
    public synchronized void forget(String aggregateId) {
        if (ledgers.remove(aggregateId) != null) {
            logger.debug("Version ledger of aggregate {} dropped", aggregateId);
        }
    }

    private static final class Ledger {
        final String aggregateId;
        String aggregateType;
        long currentVersion;
        String lastEventId;
        Instant lastEventTime;
        final Deque<VersionHistoryEntry> history = new ArrayDeque<>();

        Ledger(String aggregateId, String aggregateType, long currentVersion) {
            this.aggregateId = aggregateId;
            this.aggregateType = aggregateType;
            this.currentVersion = currentVersion;
        }

        void append(VersionHistoryEntry entry, int retention) {
            history.addLast(entry);
            while (history.size() > retention) {
                history.removeFirst();
            }
        }

        VersionInfo toInfo() {
            return new VersionInfo(aggregateId, aggregateType, currentVersion, lastEventId, lastEventTime,
                    new ArrayList<>(history));
        }
    }
}
