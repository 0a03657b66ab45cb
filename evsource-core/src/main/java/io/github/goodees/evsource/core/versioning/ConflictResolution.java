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

import java.util.Locale;

/**
 * Policy applied when an event carries a version different from the one the aggregate expects next.
 */
public enum ConflictResolution {
    /** The write fails, version of the aggregate is unchanged. */
    REJECT {
        @Override
        long resolve(long expectedVersion, long actualVersion) {
            throw new UnsupportedOperationException("Rejected conflicts are not resolved");
        }
    },
    /** The higher of both versions wins. */
    ACCEPT_HIGHER {
        @Override
        long resolve(long expectedVersion, long actualVersion) {
            return Math.max(expectedVersion, actualVersion);
        }
    },
    /** The lower of both versions wins. */
    ACCEPT_LOWER {
        @Override
        long resolve(long expectedVersion, long actualVersion) {
            return Math.min(expectedVersion, actualVersion);
        }
    },
    /** The version following the one carried by the event. */
    INCREMENT {
        @Override
        long resolve(long expectedVersion, long actualVersion) {
            return actualVersion + 1;
        }
    };

    abstract long resolve(long expectedVersion, long actualVersion);

    public String policyName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Resolve policy from its name, e. g. {@code accept-higher}.
     * @param name policy name, case insensitive, dash or underscore separated
     * @return the policy
     * @throws IllegalArgumentException for unknown names
     */
    public static ConflictResolution fromName(String name) {
        if (name != null) {
            for (ConflictResolution resolution : values()) {
                if (resolution.policyName().equalsIgnoreCase(name.trim().replace('_', '-'))) {
                    return resolution;
                }
            }
        }
        throw new IllegalArgumentException("Unknown conflict resolution: " + name);
    }
}
