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

import java.util.Locale;

import org.springframework.util.Assert;

/**
 * A measure with the function to aggregate it by. The same measure can be requested several times with different
 * functions in one query.
 * @author mengran
 *
 */
public final class MeasureSpec {

    private final String measure;
    private final Aggregation aggregation;

    public MeasureSpec(String measure, Aggregation aggregation) {
        Assert.hasText(measure, "Measure name can not empty.");
        Assert.notNull(aggregation, "Aggregation can not null.");
        this.measure = measure;
        this.aggregation = aggregation;
    }

    public static MeasureSpec of(String measure, Aggregation aggregation) {
        return new MeasureSpec(measure, aggregation);
    }

    public static MeasureSpec sum(String measure) {
        return new MeasureSpec(measure, Aggregation.SUM);
    }

    public static MeasureSpec mean(String measure) {
        return new MeasureSpec(measure, Aggregation.MEAN);
    }

    public static MeasureSpec count(String measure) {
        return new MeasureSpec(measure, Aggregation.COUNT);
    }

    public static MeasureSpec min(String measure) {
        return new MeasureSpec(measure, Aggregation.MIN);
    }

    public static MeasureSpec max(String measure) {
        return new MeasureSpec(measure, Aggregation.MAX);
    }

    public String getMeasure() {
        return measure;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MeasureSpec)) {
            return false;
        }
        MeasureSpec other = (MeasureSpec) obj;
        return measure.equals(other.measure) && aggregation == other.aggregation;
    }

    @Override
    public int hashCode() {
        return 31 * measure.hashCode() + aggregation.hashCode();
    }

    @Override
    public String toString() {
        return aggregation.name().toLowerCase(Locale.ROOT) + "(" + measure + ")";
    }

}
