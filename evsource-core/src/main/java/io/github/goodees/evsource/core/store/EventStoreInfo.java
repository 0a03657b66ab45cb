package io.github.goodees.evsource.core.store;

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

import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Static description of an event store instance.
 */
@Value.Immutable
@ValueStyle
public abstract class EventStoreInfo {
    public static final String FEATURE_SAVE_EVENTS = "save_events";
    public static final String FEATURE_GET_EVENTS = "get_events";
    public static final String FEATURE_STREAM_EVENTS = "stream_events";
    public static final String FEATURE_SNAPSHOTS = "create_snapshots";
    public static final String FEATURE_COMPACTION = "compaction";
    public static final String FEATURE_PRUNING = "pruning";

    public abstract String getStoreType();

    public abstract String getVersion();

    public abstract String getNodeId();

    public abstract Instant getStartTime();

    public abstract List<String> getSupportedFeatures();

    public abstract Map<String, Object> getConfiguration();

    public boolean supports(String feature) {
        return getSupportedFeatures().contains(feature);
    }
}
