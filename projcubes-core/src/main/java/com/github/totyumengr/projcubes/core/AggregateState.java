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
import java.math.RoundingMode;

/**
 * Partial aggregate of one measure over a subset of records. States of disjoint subsets {@link #merge(AggregateState)
 * merge} into the state of their union, and every {@link Aggregation} is derived from a state: mean is
 * sum / numeric count of the same state.
 *
 * <p>Not thread-safe, one state belongs to one bucket being collected.
 * @author mengran
 *
 */
final class AggregateState {

    private BigDecimal sum = BigDecimal.ZERO;
    /**
     * Numeric values seen, the denominator of mean.
     */
    private long numeric;
    /**
     * All records seen, numeric or not.
     */
    private long rows;
    private BigDecimal min;
    private BigDecimal max;

    void accept(BigDecimal value) {
        rows++;
        if (value == null) {
            return;
        }
        numeric++;
        sum = sum.add(value);
        if (min == null || value.compareTo(min) < 0) {
            min = value;
        }
        if (max == null || value.compareTo(max) > 0) {
            max = value;
        }
    }

    AggregateState merge(AggregateState other) {
        rows += other.rows;
        numeric += other.numeric;
        sum = sum.add(other.sum);
        if (other.min != null && (min == null || other.min.compareTo(min) < 0)) {
            min = other.min;
        }
        if (other.max != null && (max == null || other.max.compareTo(max) > 0)) {
            max = other.max;
        }
        return this;
    }

    AggregateState copy() {
        return new AggregateState().merge(this);
    }

    AggregateValue value(Aggregation aggregation) {

        switch (aggregation) {
        case SUM:
            return AggregateValue.of(sum.setScale(Aggregations.IND_SCALE, RoundingMode.HALF_UP));
        case COUNT:
            return AggregateValue.of(BigDecimal.valueOf(rows));
        case MEAN:
            if (numeric == 0) {
                return AggregateValue.NO_VALUE;
            }
            return AggregateValue.of(sum.divide(BigDecimal.valueOf(numeric), Aggregations.IND_SCALE,
                    RoundingMode.HALF_UP));
        case MIN:
            return min == null ? AggregateValue.NO_VALUE
                    : AggregateValue.of(min.setScale(Aggregations.IND_SCALE, RoundingMode.HALF_UP));
        case MAX:
            return max == null ? AggregateValue.NO_VALUE
                    : AggregateValue.of(max.setScale(Aggregations.IND_SCALE, RoundingMode.HALF_UP));
        default:
            throw new AggregationException("Unsupported aggregation", aggregation.name());
        }
    }

    @Override
    public String toString() {
        return "AggregateState [sum=" + sum + ", numeric=" + numeric + ", rows=" + rows + ", min=" + min
                + ", max=" + max + "]";
    }

}
