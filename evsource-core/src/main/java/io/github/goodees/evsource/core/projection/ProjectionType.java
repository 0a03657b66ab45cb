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

import java.util.Locale;

/**
 * Kind of view a projection maintains. The engine treats all kinds the same, the type serves filtering and statistics.
 */
public enum ProjectionType {
    AGGREGATION, STATE, STATISTICS, MATERIALIZED, CUSTOM;

    private final String typeName = name().toLowerCase(Locale.ROOT);

    public String typeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
