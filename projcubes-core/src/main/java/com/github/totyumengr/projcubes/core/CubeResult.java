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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.function.BiConsumer;

/**
 * Immutable result of one cube query: {@link DimensionKey} to per-measure aggregates, margins included. Iteration is
 * ordered by {@link DimensionKey#compareTo(DimensionKey)} so exports and tests are reproducible.
 *
 * @author mengran
 *
 */
public final class CubeResult {

    private final String label;
    private final List<String> dimensions;
    private final List<MeasureSpec> measures;
    private final SortedMap<DimensionKey, Map<MeasureSpec, AggregateValue>> cells;

    CubeResult(String label, List<String> dimensions, List<MeasureSpec> measures,
            SortedMap<DimensionKey, Map<MeasureSpec, AggregateValue>> cells) {
        this.label = label;
        this.dimensions = Collections.unmodifiableList(new ArrayList<String>(dimensions));
        this.measures = Collections.unmodifiableList(new ArrayList<MeasureSpec>(measures));
        this.cells = Collections.unmodifiableSortedMap(cells);
    }

    /**
     * @return name of query produced this result, for example the roll-up level.
     */
    public String getLabel() {
        return label;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public List<MeasureSpec> getMeasures() {
        return measures;
    }

    /**
     * @return <code>true</code> means zero buckets, a valid outcome and not an error.
     */
    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * @return number of keys, margins included
     */
    public int size() {
        return cells.size();
    }

    /**
     * @return number of real dimension combinations, margins excluded
     */
    public int bucketCount() {
        int count = 0;
        for (DimensionKey key : cells.keySet()) {
            if (!key.isMargin()) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return ordered keys, margins included
     */
    public Set<DimensionKey> keys() {
        return cells.keySet();
    }

    /**
     * @return ordered entries, margins included
     */
    public Set<Map.Entry<DimensionKey, Map<MeasureSpec, AggregateValue>>> entries() {
        return cells.entrySet();
    }

    public void forEach(BiConsumer<DimensionKey, Map<MeasureSpec, AggregateValue>> action) {
        cells.forEach(action);
    }

    public boolean contains(DimensionKey key) {
        return cells.containsKey(key);
    }

    /**
     * @param key bucket key
     * @return aggregates of bucket, <code>null</code> if key not present
     */
    public Map<MeasureSpec, AggregateValue> get(DimensionKey key) {
        return cells.get(key);
    }

    /**
     * @param spec requested measure
     * @param members key members, raw values are normalized
     * @return aggregate, <code>null</code> if key not present
     * @throws SchemaException if spec was not requested
     */
    public AggregateValue get(MeasureSpec spec, Object... members) {

        if (!measures.contains(spec)) {
            throw new SchemaException("Measure not in result", spec.toString());
        }
        Map<MeasureSpec, AggregateValue> values = cells.get(DimensionKey.of(members));
        return values == null ? null : values.get(spec);
    }

    /**
     * @return key of grand total margin, every dimension is {@link ReservedMember#ALL}. {@link DimensionKey#EMPTY}
     * when no dimension is active.
     */
    public DimensionKey grandTotalKey() {
        Object[] all = new Object[dimensions.size()];
        for (int i = 0; i < all.length; i++) {
            all[i] = ReservedMember.ALL;
        }
        return DimensionKey.wrap(all);
    }

    /**
     * @return grand total aggregates, <code>null</code> if not computed or the result is empty.
     */
    public Map<MeasureSpec, AggregateValue> grandTotal() {
        return cells.get(grandTotalKey());
    }

    @Override
    public String toString() {
        return "CubeResult [label=" + label + ", dimensions=" + dimensions + ", measures=" + measures + ", cells="
                + cells + "]";
    }

}
