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

import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

/**
 * Configuration of {@link DefaultEventVersioning}.
 */
@Value.Immutable
@ValueStyle
public abstract class VersioningConfig {

    @Value.Default
    public VersioningStrategy getStrategy() {
        return VersioningStrategy.SEQUENTIAL;
    }

    @Value.Default
    public boolean isEnableHistory() {
        return true;
    }

    /**
     * Number of history entries retained per aggregate.
     * @return history retention
     */
    @Value.Default
    public int getHistoryRetention() {
        return 100;
    }

    @Value.Default
    public ConflictResolution getConflictResolution() {
        return ConflictResolution.REJECT;
    }

    @Value.Check
    protected void check() {
        if (getHistoryRetention() <= 0) {
            throw new IllegalStateException("History retention must be positive, got " + getHistoryRetention());
        }
    }

    public static ImmutableVersioningConfig.Builder builder() {
        return ImmutableVersioningConfig.builder();
    }

    public static VersioningConfig defaults() {
        return builder().build();
    }
}
