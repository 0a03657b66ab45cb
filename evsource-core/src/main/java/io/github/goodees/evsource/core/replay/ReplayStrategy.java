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

/**
 * How events are driven through a replay handler.
 */
public enum ReplayStrategy {
    /** One event at a time in version order. The only strategy preserving order between events. */
    SEQUENTIAL,
    /** Events are spread over a pool of workers without any ordering. Handler must be order independent. */
    PARALLEL,
    /** Sequential replay in chunks of configured size, with progress reported per chunk. */
    BATCH
}
