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

import org.springframework.util.Assert;

/**
 * Result of one aggregation, either a decimal or the explicit {@link #NO_VALUE} (for example the mean of zero
 * numeric values). Never 0 and never NaN in place of "no value".
 * @author mengran
 *
 */
public final class AggregateValue {

    public static final AggregateValue NO_VALUE = new AggregateValue(null);

    private final BigDecimal value;

    private AggregateValue(BigDecimal value) {
        this.value = value;
    }

    public static AggregateValue of(BigDecimal value) {
        Assert.notNull(value, "Use NO_VALUE for absent aggregate.");
        return new AggregateValue(value);
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * @return decimal value
     * @throws IllegalStateException if this is {@link #NO_VALUE}
     */
    public BigDecimal decimal() {
        if (value == null) {
            throw new IllegalStateException("Aggregate has no value.");
        }
        return value;
    }

    /**
     * @param other returned when no value
     * @return decimal value or other
     */
    public BigDecimal orElse(BigDecimal other) {
        return value == null ? other : value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AggregateValue)) {
            return false;
        }
        AggregateValue other = (AggregateValue) obj;
        if (value == null || other.value == null) {
            return value == other.value;
        }
        return value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value == null ? "n/a" : value.toPlainString();
    }

}
