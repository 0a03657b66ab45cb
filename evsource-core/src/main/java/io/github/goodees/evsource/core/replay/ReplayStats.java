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

import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Value.Immutable
@ValueStyle
public abstract class ReplayStats {

    public abstract long getTotalReplays();

    public abstract long getSuccessfulReplays();

    public abstract long getFailedReplays();

    public abstract long getTotalEventsReplayed();

    public abstract Duration getAverageReplayTime();

    public abstract Optional<Instant> getLastReplayTime();

    public abstract Optional<String> getLastReplayError();
}
