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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

/**
 * Two axis table of one {@link MeasureSpec}. Row and column keys are sorted, a combination absent from the data is
 * filled with {@link Aggregation#identity()}. Row margins, column margins and the corner are aggregated from the raw
 * bucket states, never from the filled grid, so a mean margin is weighted by records.
 * @author mengran
 *
 */
public final class PivotTable {

    private final MeasureSpec spec;
    private final List<String> rowDimensions;
    private final List<String> columnDimensions;
    private final List<DimensionKey> rowKeys;
    private final List<DimensionKey> columnKeys;
    private final Map<DimensionKey, Map<DimensionKey, AggregateValue>> cells;
    private final Map<DimensionKey, AggregateValue> rowMargins;
    private final Map<DimensionKey, AggregateValue> columnMargins;
    private final AggregateValue corner;

    private PivotTable(MeasureSpec spec, List<String> rowDimensions, List<String> columnDimensions,
            List<DimensionKey> rowKeys, List<DimensionKey> columnKeys,
            Map<DimensionKey, Map<DimensionKey, AggregateValue>> cells, Map<DimensionKey, AggregateValue> rowMargins,
            Map<DimensionKey, AggregateValue> columnMargins, AggregateValue corner) {
        this.spec = spec;
        this.rowDimensions = Collections.unmodifiableList(new ArrayList<String>(rowDimensions));
        this.columnDimensions = Collections.unmodifiableList(new ArrayList<String>(columnDimensions));
        this.rowKeys = Collections.unmodifiableList(rowKeys);
        this.columnKeys = Collections.unmodifiableList(columnKeys);
        this.cells = cells;
        this.rowMargins = rowMargins;
        this.columnMargins = columnMargins;
        this.corner = corner;
    }

    /**
     * @param spec measure of table
     * @param rowDimensions leading dimensions of bucket keys
     * @param columnDimensions trailing dimensions of bucket keys
     * @param buckets raw states keyed by row members followed by column members
     * @return filled table
     */
    static PivotTable of(MeasureSpec spec, List<String> rowDimensions, List<String> columnDimensions,
            Aggregator.Buckets buckets) {

        int[] rowIndexes = new int[rowDimensions.size()];
        for (int i = 0; i < rowIndexes.length; i++) {
            rowIndexes[i] = i;
        }
        int[] columnIndexes = new int[columnDimensions.size()];
        for (int i = 0; i < columnIndexes.length; i++) {
            columnIndexes[i] = rowIndexes.length + i;
        }
        int slot = buckets.slots.get(spec.getMeasure());

        Map<DimensionKey, Map<DimensionKey, AggregateValue>> present =
                new HashMap<DimensionKey, Map<DimensionKey, AggregateValue>>();
        Map<DimensionKey, AggregateState> rowStates = new TreeMap<DimensionKey, AggregateState>();
        Map<DimensionKey, AggregateState> columnStates = new TreeMap<DimensionKey, AggregateState>();
        AggregateState cornerState = null;
        for (Entry<DimensionKey, AggregateState[]> e : buckets.states.entrySet()) {
            DimensionKey row = e.getKey().project(rowIndexes);
            DimensionKey column = e.getKey().project(columnIndexes);
            AggregateState state = e.getValue()[slot];

            Map<DimensionKey, AggregateValue> rowCells = present.get(row);
            if (rowCells == null) {
                rowCells = new HashMap<DimensionKey, AggregateValue>();
                present.put(row, rowCells);
            }
            rowCells.put(column, state.value(spec.getAggregation()));

            merge(rowStates, row, state);
            merge(columnStates, column, state);
            cornerState = cornerState == null ? state.copy() : cornerState.merge(state);
        }

        List<DimensionKey> rowKeys = new ArrayList<DimensionKey>(rowStates.keySet());
        List<DimensionKey> columnKeys = new ArrayList<DimensionKey>(columnStates.keySet());
        AggregateValue identity = spec.getAggregation().identity();
        Map<DimensionKey, Map<DimensionKey, AggregateValue>> cells =
                new HashMap<DimensionKey, Map<DimensionKey, AggregateValue>>();
        for (DimensionKey row : rowKeys) {
            Map<DimensionKey, AggregateValue> rowCells = new HashMap<DimensionKey, AggregateValue>();
            for (DimensionKey column : columnKeys) {
                AggregateValue value = present.get(row).get(column);
                rowCells.put(column, value == null ? identity : value);
            }
            cells.put(row, rowCells);
        }

        return new PivotTable(spec, rowDimensions, columnDimensions, rowKeys, columnKeys, cells,
                values(rowStates, spec), values(columnStates, spec),
                cornerState == null ? identity : cornerState.value(spec.getAggregation()));
    }

    private static void merge(Map<DimensionKey, AggregateState> states, DimensionKey key, AggregateState state) {
        AggregateState target = states.get(key);
        if (target == null) {
            states.put(key, state.copy());
        } else {
            target.merge(state);
        }
    }

    private static Map<DimensionKey, AggregateValue> values(Map<DimensionKey, AggregateState> states,
            MeasureSpec spec) {
        Map<DimensionKey, AggregateValue> values = new HashMap<DimensionKey, AggregateValue>();
        for (Entry<DimensionKey, AggregateState> e : states.entrySet()) {
            values.put(e.getKey(), e.getValue().value(spec.getAggregation()));
        }
        return values;
    }

    public MeasureSpec getSpec() {
        return spec;
    }

    public List<String> getRowDimensions() {
        return rowDimensions;
    }

    public List<String> getColumnDimensions() {
        return columnDimensions;
    }

    public List<DimensionKey> getRowKeys() {
        return rowKeys;
    }

    public List<DimensionKey> getColumnKeys() {
        return columnKeys;
    }

    public boolean isEmpty() {
        return rowKeys.isEmpty();
    }

    /**
     * @param row row key
     * @param column column key
     * @return aggregate, identity when combination is absent from data
     * @throws SchemaException if row or column is not a key of table
     */
    public AggregateValue getCell(DimensionKey row, DimensionKey column) {
        Map<DimensionKey, AggregateValue> rowCells = cells.get(row);
        if (rowCells == null) {
            throw new SchemaException("Unknown pivot row", String.valueOf(row));
        }
        AggregateValue value = rowCells.get(column);
        if (value == null) {
            throw new SchemaException("Unknown pivot column", String.valueOf(column));
        }
        return value;
    }

    /**
     * @param row row key
     * @return aggregate of every record of row
     */
    public AggregateValue getRowMargin(DimensionKey row) {
        AggregateValue value = rowMargins.get(row);
        if (value == null) {
            throw new SchemaException("Unknown pivot row", String.valueOf(row));
        }
        return value;
    }

    /**
     * @param column column key
     * @return aggregate of every record of column
     */
    public AggregateValue getColumnMargin(DimensionKey column) {
        AggregateValue value = columnMargins.get(column);
        if (value == null) {
            throw new SchemaException("Unknown pivot column", String.valueOf(column));
        }
        return value;
    }

    /**
     * @return aggregate of every record, {@link Aggregation#identity()} when table is empty
     */
    public AggregateValue getCorner() {
        return corner;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(spec).append(' ').append(rowDimensions).append(" x ").append(columnDimensions).append('\n');
        for (DimensionKey row : rowKeys) {
            sb.append(row);
            for (DimensionKey column : columnKeys) {
                sb.append('\t').append(column).append('=').append(cells.get(row).get(column));
            }
            sb.append("\tTOTAL=").append(rowMargins.get(row)).append('\n');
        }
        sb.append("TOTAL");
        for (DimensionKey column : columnKeys) {
            sb.append('\t').append(column).append('=').append(columnMargins.get(column));
        }
        sb.append("\tTOTAL=").append(corner);
        return sb.toString();
    }

}
