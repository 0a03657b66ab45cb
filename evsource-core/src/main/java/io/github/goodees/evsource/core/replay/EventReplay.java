package io.github.goodees.evsource.core.replay;

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

import java.time.Instant;

/**
 * Reads events back out of a store and drives them through a handler.
 *
 * <p>Replay runs on the calling thread, parallel replay additionally on a pool of workers. Interrupting the calling
 * thread stops the replay between events and during retry waits.
 */
public interface EventReplay {

    /**
     * Replay events of an aggregate within version range using configured strategy.
     * @param aggregateId the aggregate
     * @param fromVersion lowest version, inclusive
     * @param toVersion highest version, inclusive
     * @param handler the handler
     * @return final progress
     * @throws ReplayException when replay was aborted or interrupted
     */
    ReplayProgress replayEvents(String aggregateId, long fromVersion, long toVersion, ReplayHandler handler)
            throws ReplayException;

    ReplayProgress replayAllEvents(String aggregateId, ReplayHandler handler) throws ReplayException;

    /**
     * Replay events of a type across aggregates, with timestamp at or after given instant, in chronological order.
     * @param type event type
     * @param fromTime earliest timestamp
     * @param handler the handler
     * @return final progress
     * @throws ReplayException when replay was aborted or interrupted
     */
    ReplayProgress replayEventsByType(EventType type, Instant fromTime, ReplayHandler handler) throws ReplayException;

    /**
     * Restore handler from the stored snapshot, and sequentially replay events following it.
     *
     * <p>The stored snapshot must be exactly at {@code snapshotVersion}. A snapshot at any other version is rejected
     * rather than combined with events following the requested version, as the state it carries would not match them.
     * @param aggregateId the aggregate
     * @param snapshotVersion version of the stored snapshot
     * @param handler the handler, receives {@link ReplayHandler#restoreSnapshot} first
     * @return final progress
     * @throws ReplayException when no snapshot at given version is stored, or replay fails
     */
    ReplayProgress replayFromSnapshot(String aggregateId, long snapshotVersion, ReplayHandler handler)
            throws ReplayException;

    /**
     * Sequentially replay versions {@code 1..targetVersion} to reconstruct the state at that version.
     * @param aggregateId the aggregate
     * @param targetVersion last version to apply
     * @param handler the handler
     * @param <S> type of state
     * @return the state of the handler after replay
     * @throws ReplayException when replay was aborted or interrupted
     */
    <S> S replayToState(String aggregateId, long targetVersion, StateReplayHandler<S> handler) throws ReplayException;

    ReplayStats getReplayStats();
}
