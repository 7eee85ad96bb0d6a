/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.projcubes.core;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Supported aggregation functions.
 * @author mengran
 *
 */
public enum Aggregation {

    SUM,
    MEAN,
    COUNT,
    MIN,
    MAX;

    /**
     * @return value used to fill a missing pivot cell: 0 for {@link #SUM} and {@link #COUNT}, otherwise
     * {@link AggregateValue#NO_VALUE}.
     */
    public AggregateValue identity() {
        switch (this) {
        case SUM:
            return AggregateValue.of(BigDecimal.ZERO.setScale(Aggregations.IND_SCALE));
        case COUNT:
            return AggregateValue.of(BigDecimal.ZERO);
        default:
            return AggregateValue.NO_VALUE;
        }
    }

    /**
     * @param name case-insensitive function name, <code>avg</code> and <code>average</code> are accepted for
     * {@link #MEAN}
     * @return function
     * @throws AggregationException if name is not supported
     */
    public static Aggregation parse(String name) {

        if (name == null) {
            throw new AggregationException("Unsupported aggregation", "null");
        }
        String n = name.trim().toUpperCase(Locale.ROOT);
        if ("AVG".equals(n) || "AVERAGE".equals(n)) {
            return MEAN;
        }
        for (Aggregation a : values()) {
            if (a.name().equals(n)) {
                return a;
            }
        }
        throw new AggregationException("Unsupported aggregation", name);
    }
}
