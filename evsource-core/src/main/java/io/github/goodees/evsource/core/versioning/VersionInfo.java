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

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Version ledger of an aggregate, as known to {@link EventVersioning}.
 */
public final class VersionInfo {
    private final String aggregateId;
    private final String aggregateType;
    private final long currentVersion;
    private final String lastEventId;
    private final Instant lastEventTime;
    private final List<VersionHistoryEntry> versionHistory;

    public VersionInfo(String aggregateId, String aggregateType, long currentVersion, String lastEventId,
                       Instant lastEventTime, List<VersionHistoryEntry> versionHistory) {
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.currentVersion = currentVersion;
        this.lastEventId = lastEventId;
        this.lastEventTime = lastEventTime;
        this.versionHistory = Collections.unmodifiableList(versionHistory);
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public long getCurrentVersion() {
        return currentVersion;
    }

    public Optional<String> getLastEventId() {
        return Optional.ofNullable(lastEventId);
    }

    public Optional<Instant> getLastEventTime() {
        return Optional.ofNullable(lastEventTime);
    }

    /**
     * Retained history, oldest first. Empty when history is disabled.
     * @return history entries
     */
    public List<VersionHistoryEntry> getVersionHistory() {
        return versionHistory;
    }

    @Override
    public String toString() {
        return "VersionInfo[aggregate=" + aggregateId + ", version=" + currentVersion + ", lastEvent=" + lastEventId
                + "]";
    }
}
