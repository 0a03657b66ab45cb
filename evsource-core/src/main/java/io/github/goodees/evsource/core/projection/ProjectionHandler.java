package io.github.goodees.evsource.core.projection;

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

/**
 * Domain logic of a projection. The engine calls {@link #canHandle(Event)} for every event matching the filters of the
 * projection and {@link #project(Event, Projection)} when it returns true.
 *
 * <p>Calls for one projection never overlap, but subsequent calls may come from different threads.
 */
public interface ProjectionHandler {

    boolean canHandle(Event event);

    /**
     * Apply the event to the projection.
     * @param event the event
     * @param projection the projection with its current data
     * @return new data of the projection, or null to keep the current data
     * @throws Exception when the event cannot be applied. The failure is recorded against the projection only.
     */
    Object project(Event event, Projection projection) throws Exception;

    default String getHandlerType() {
        return getClass().getSimpleName();
    }
}
