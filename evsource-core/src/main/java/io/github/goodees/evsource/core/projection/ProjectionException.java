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

/**
 * Failure of a registry operation of the projection engine. Handler failures are never reported this way, they are
 * recorded in {@link ProjectionState}.
 */
public class ProjectionException extends Exception {
    private final Fault fault;

    public enum Fault {
        /** Projection definition is incomplete. */
        VALIDATION,
        /** No projection with given id. */
        NOT_FOUND,
        /** Projection with the id already exists. */
        DUPLICATE,
        /** Maximum number of projections reached. */
        LIMIT_REACHED
    }

    protected ProjectionException(Fault fault, String message) {
        super(message);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    public static ProjectionException invalid(String reason) {
        return new ProjectionException(Fault.VALIDATION, "projection validation failed: " + reason);
    }

    public static ProjectionException notFound(String projectionId) {
        return new ProjectionException(Fault.NOT_FOUND, "projection not found: " + projectionId);
    }

    public static ProjectionException duplicate(String projectionId) {
        return new ProjectionException(Fault.DUPLICATE, "projection already exists: " + projectionId);
    }

    public static ProjectionException limitReached(int maxProjections) {
        return new ProjectionException(Fault.LIMIT_REACHED, "maximum projections limit reached: " + maxProjections);
    }
}
