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

import io.github.goodees.evsource.core.Event;
import io.github.goodees.evsource.core.store.Snapshot;

/**
 * Domain logic driven by replay. Handlers used with {@link ReplayStrategy#PARALLEL} are invoked from multiple threads.
 */
public interface ReplayHandler {

    /**
     * Decide whether the event is of interest. Events the handler cannot handle are skipped.
     * @param event the event
     * @return true if {@link #handle(Event)} should be invoked
     */
    boolean canHandle(Event event);

    /**
     * Apply an event.
     * @param event the event
     * @throws Exception on failure, the invocation may be retried
     */
    void handle(Event event) throws Exception;

    default String getHandlerType() {
        return getClass().getSimpleName();
    }

    /**
     * Initialize state from a snapshot before events following the snapshot are replayed.
     * @param snapshot the snapshot
     * @throws Exception when the snapshot cannot be applied
     * @see EventReplay#replayFromSnapshot(String, long, ReplayHandler)
     */
    default void restoreSnapshot(Snapshot snapshot) throws Exception {
    }
}
