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
import io.github.goodees.evsource.core.store.EventStore;
import io.github.goodees.evsource.core.store.EventStoreException;
import io.github.goodees.evsource.core.store.EventSubscription;

import java.util.List;
import java.util.Optional;

/**
 * Registry of projections fed by a stream of committed events.
 *
 * <p>Events passed to {@link #processEvent(Event)} are applied asynchronously by a fixed pool of workers. Events of the
 * same aggregate are applied in the order they were submitted. A handler failure is recorded against the one
 * projection it belongs to and never affects the caller, other projections or the workers.
 */
public interface EventProjection extends AutoCloseable {

    /**
     * Register new projection. State and metrics of the projection start at zero.
     * @param projection the definition. When it carries no handler, the handler registered under
     *                   {@link Projection#getHandlerType()} is used.
     * @throws ProjectionException when the definition is incomplete, id is taken or the limit is reached
     */
    void createProjection(Projection projection) throws ProjectionException;

    /**
     * Replace definition of existing projection. Creation time and current data are retained unless the new
     * definition carries data.
     * @param projection new definition
     * @throws ProjectionException when the projection does not exist or the definition is incomplete
     */
    void updateProjection(Projection projection) throws ProjectionException;

    void deleteProjection(String projectionId) throws ProjectionException;

    Projection getProjection(String projectionId) throws ProjectionException;

    /**
     * List projections matching the filter, ordered by id, with offset and limit applied.
     * @param filter the criteria
     * @return matching projections
     */
    List<Projection> listProjections(ProjectionFilter filter);

    /**
     * Submit event for asynchronous processing. Never blocks.
     * @param event the event
     * @return false when the event was dropped, because the queue is full or the engine is stopped
     */
    boolean processEvent(Event event);

    /**
     * Submit events in order.
     * @param events the events
     * @return number of accepted events
     */
    int processEvents(List<Event> events);

    /**
     * Reset the projection and apply all relevant stored events synchronously, in order.
     * @param projectionId the projection
     * @return number of events applied successfully
     * @throws ProjectionException when the projection does not exist
     */
    long rebuildProjection(String projectionId) throws ProjectionException;

    /**
     * Rebuild every registered projection. Failure of one rebuild does not stop the others.
     * @return number of rebuilt projections
     */
    int rebuildAllProjections();

    ProjectionState getProjectionState(String projectionId) throws ProjectionException;

    /**
     * Zero state and metrics of a projection. Its data is left intact.
     * @param projectionId the projection
     * @throws ProjectionException when the projection does not exist
     */
    void resetProjection(String projectionId) throws ProjectionException;

    ProjectionStats getProjectionStats();

    ProjectionMetrics getProjectionMetrics(String projectionId) throws ProjectionException;

    void registerHandler(String handlerType, ProjectionHandler handler);

    Optional<ProjectionHandler> getHandler(String handlerType);

    /**
     * Feed events committed to the store into this engine, until the returned subscription or the engine is closed.
     * @param store the store
     * @return the subscription
     * @throws EventStoreException when the store does not accept subscriptions
     */
    EventSubscription connect(EventStore store) throws EventStoreException;

    /**
     * Start distributor and worker threads. Calling it on a running engine has no effect.
     * @throws IllegalStateException when the engine was already stopped
     */
    void startBackgroundProcessor();

    /**
     * Stop accepting events, drain queued events within the shutdown timeout and stop the threads.
     */
    void stopBackgroundProcessor();

    @Override
    default void close() {
        stopBackgroundProcessor();
    }
}
