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

import io.github.goodees.evsource.core.store.EventStoreException;

import java.util.Optional;

/**
 * Replay did not complete. Progress made until the failure is available if any events were replayed.
 */
public class ReplayException extends Exception {
    private final ReplayProgress progress;

    protected ReplayException(String message, Throwable cause, ReplayProgress progress) {
        super(message, cause);
        this.progress = progress;
    }

    public Optional<ReplayProgress> getProgress() {
        return Optional.ofNullable(progress);
    }

    public static ReplayException failedAt(long version, Throwable cause, ReplayProgress progress) {
        return new ReplayException("replay failed at version " + version + ": " + cause.getMessage(), cause,
                progress);
    }

    public static ReplayException interrupted(InterruptedException cause, ReplayProgress progress) {
        return new ReplayException("replay interrupted", cause, progress);
    }

    public static ReplayException workerFailed(Throwable cause, ReplayProgress progress) {
        return new ReplayException("replay worker failed: " + cause.getMessage(), cause, progress);
    }

    public static ReplayException storeFailure(String operation, EventStoreException cause) {
        return new ReplayException("failed to " + operation + ": " + cause.getMessage(), cause, null);
    }

    public static ReplayException snapshotMismatch(String aggregateId, long requested, long stored) {
        return new ReplayException("snapshot of aggregate " + aggregateId + " is at version " + stored
                + ", requested " + requested, null, null);
    }

    public static ReplayException snapshotRestoreFailed(String aggregateId, Exception cause) {
        return new ReplayException("failed to restore snapshot of aggregate " + aggregateId + ": "
                + cause.getMessage(), cause, null);
    }
}
