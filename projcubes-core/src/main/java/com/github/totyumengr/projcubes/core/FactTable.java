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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.stream.Stream;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Fact table object of <a href="http://en.wikipedia.org/wiki/Star_schema">Star Schema</a>, denormalized: one record
 * per analyzed project with dimension columns (discrete members) and measure columns (numbers).
 *
 * <p>Immutable after {@link FactTableBuilder#done()}, so it can be shared by any number of concurrent queries.
 *
 * @author mengran
 *
 */
public class FactTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FactTable.class);

    private final Meta meta;

    private final List<Record> records;

    /**
     * Bitmap index for speed up filtering. Key is dimension name, then member.
     */
    private final Map<String, Map<Object, RoaringBitmap>> bitmapIndex;

    static class Meta {

        String name;
        private LinkedHashMap<String, Integer> measureColumnNames = new LinkedHashMap<String, Integer>();
        private LinkedHashMap<String, Integer> dimColumnNames = new LinkedHashMap<String, Integer>();

        @Override
        public String toString() {
            return "Meta [name=" + name + ", measure columnNames=" + measureColumnNames.keySet()
                    + ", dimension columnNames=" + dimColumnNames.keySet() + "]";
        }
    }

    /**
     * Holding detail data, streaming calculation target object.
     * @author mengran
     *
     */
    public class Record {

        private final int id;     // Position in fact-table, also the bitmap index bit.

        private final Object[] dimOfFact;

        /**
         * <code>null</code> means missing or non-numeric value.
         */
        private final BigDecimal[] measureOfFact;

        private Record(int id, Object[] dimOfFact, BigDecimal[] measureOfFact) {
            super();
            this.id = id;
            this.dimOfFact = dimOfFact;
            this.measureOfFact = measureOfFact;
        }

        public int getId() {
            return id;
        }

        /**
         * @param measureName measure column
         * @return value or <code>null</code> when missing
         */
        public BigDecimal getMeasure(String measureName) {
            return measureOfFact[FactTable.this.getMeasureIndex(measureName)];
        }

        BigDecimal getMeasure(int index) {
            return measureOfFact[index];
        }

        /**
         * @param dimName dimension column
         * @return member, {@link ReservedMember#UNKNOWN} when missing
         */
        public Object getDim(String dimName) {
            return dimOfFact[FactTable.this.getDimIndex(dimName)];
        }

        Object getDim(int index) {
            return dimOfFact[index];
        }

        @Override
        public String toString() {
            return "Record [id=" + id + "]";
        }

    }

    private FactTable(Meta meta, List<Record> records, Map<String, Map<Object, RoaringBitmap>> bitmapIndex) {
        this.meta = meta;
        this.records = Collections.unmodifiableList(records);
        this.bitmapIndex = bitmapIndex;
    }

    /**
     * Normalize a raw dimension value into a member: <code>null</code> and blank text become
     * {@link ReservedMember#UNKNOWN}, integral numbers become {@link Long}, other numbers become a stripped
     * {@link BigDecimal}, anything else is kept as text.
     * @param value raw value
     * @return member
     */
    public static Object member(Object value) {

        if (value == null) {
            return ReservedMember.UNKNOWN;
        }
        if (value instanceof ReservedMember || value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            BigDecimal decimal = measure(value);
            if (decimal == null) {
                return ReservedMember.UNKNOWN;
            }
            decimal = decimal.stripTrailingZeros();
            if (decimal.scale() <= 0 && decimal.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0
                    && decimal.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) >= 0) {
                return decimal.longValueExact();
            }
            return decimal;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? ReservedMember.UNKNOWN : text;
    }

    /**
     * Normalize a raw measure value.
     * @param value raw value
     * @return decimal, <code>null</code> when missing or non-numeric (NaN, infinite, unparsable text)
     */
    public static BigDecimal measure(Object value) {

        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return (Double.isNaN(d) || Double.isInfinite(d)) ? null : BigDecimal.valueOf(d);
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            LOGGER.debug("Non-numeric measure value {} is treated as missing.", value);
            return null;
        }
    }

    /**
     * Builder pattern class for {@link FactTable}, chain model begin with {@link #build(String)}
     * and end with {@link #done()}. One builder instance builds one fact-table, nothing shared between threads.
     *
     * @author mengran
     *
     */
    public static class FactTableBuilder {

        private Meta meta;
        private List<Record> records;
        private FactTable current;
        private boolean done = false;

        public FactTableBuilder build(String name) {

            if (meta != null) {
                throw new IllegalStateException("Previous building " + meta.name + " is doing, call #done to finish it.");
            }
            Assert.hasText(name, "Fact-table name can not empty.");

            meta = new Meta();
            meta.name = name;
            records = new ArrayList<Record>();
            current = new FactTable(meta, records, new HashMap<String, Map<Object, RoaringBitmap>>());
            return this;
        }

        private void checkBuilding() {
            if (meta == null || done) {
                throw new IllegalStateException("Current building is not started or already done, call #build first.");
            }
        }

        public FactTableBuilder addDimColumns(List<String> dimColumnNames) {

            checkBuilding();
            Assert.isTrue(records.isEmpty(), "Columns must be declared before data.");
            for (String dimName : dimColumnNames) {
                Assert.hasText(dimName, "Dimension name can not empty.");
                if (meta.dimColumnNames.containsKey(dimName) || meta.measureColumnNames.containsKey(dimName)) {
                    throw new IllegalStateException("Column " + dimName + " has exists.");
                }
                meta.dimColumnNames.put(dimName, meta.dimColumnNames.size());
            }
            return this;
        }

        public FactTableBuilder addMeasureColumns(List<String> measureColumnNames) {

            checkBuilding();
            Assert.isTrue(records.isEmpty(), "Columns must be declared before data.");
            for (String measureName : measureColumnNames) {
                Assert.hasText(measureName, "Measure name can not empty.");
                if (meta.dimColumnNames.containsKey(measureName) || meta.measureColumnNames.containsKey(measureName)) {
                    throw new IllegalStateException("Column " + measureName + " has exists.");
                }
                meta.measureColumnNames.put(measureName, meta.measureColumnNames.size());
            }
            return this;
        }

        /**
         * Append one record.
         * @param dimDatas raw dimension values in declared order, see {@link FactTable#member(Object)}
         * @param measureDatas raw measure values in declared order, see {@link FactTable#measure(Object)}
         * @return this builder
         */
        public FactTableBuilder addRow(List<?> dimDatas, List<?> measureDatas) {

            checkBuilding();
            if (dimDatas.size() != meta.dimColumnNames.size()) {
                throw new IllegalStateException("Expect " + meta.dimColumnNames.size() + " dimension values but "
                        + dimDatas.size());
            }
            if (measureDatas.size() != meta.measureColumnNames.size()) {
                throw new IllegalStateException("Expect " + meta.measureColumnNames.size() + " measure values but "
                        + measureDatas.size());
            }

            Object[] dims = new Object[dimDatas.size()];
            for (int i = 0; i < dims.length; i++) {
                dims[i] = member(dimDatas.get(i));
            }
            BigDecimal[] measures = new BigDecimal[measureDatas.size()];
            for (int i = 0; i < measures.length; i++) {
                measures[i] = measure(measureDatas.get(i));
            }
            records.add(current.new Record(records.size(), dims, measures));
            return this;
        }

        /**
         * Append one record by column name, absent columns are missing values.
         * @param row column name to raw value
         * @return this builder
         */
        public FactTableBuilder addRow(Map<String, ?> row) {

            checkBuilding();
            for (String column : row.keySet()) {
                if (!meta.dimColumnNames.containsKey(column) && !meta.measureColumnNames.containsKey(column)) {
                    throw new SchemaException("Unknown column in row", column);
                }
            }
            List<Object> dims = new ArrayList<Object>(meta.dimColumnNames.size());
            for (String dimName : meta.dimColumnNames.keySet()) {
                dims.add(row.get(dimName));
            }
            List<Object> measures = new ArrayList<Object>(meta.measureColumnNames.size());
            for (String measureName : meta.measureColumnNames.keySet()) {
                measures.add(row.get(measureName));
            }
            return addRow(dims, measures);
        }

        public FactTable done() {

            checkBuilding();
            done = true;

            long enterTime = System.currentTimeMillis();
            for (Entry<String, Integer> dim : meta.dimColumnNames.entrySet()) {
                Map<Object, RoaringBitmap> index = new HashMap<Object, RoaringBitmap>();
                for (Record record : records) {
                    RoaringBitmap bitmap = index.get(record.dimOfFact[dim.getValue()]);
                    if (bitmap == null) {
                        bitmap = new RoaringBitmap();
                        index.put(record.dimOfFact[dim.getValue()], bitmap);
                    }
                    bitmap.add(record.getId());
                }
                long usedBytes = 0;
                for (RoaringBitmap bitmap : index.values()) {
                    bitmap.runOptimize();
                    usedBytes += bitmap.getSizeInBytes();
                }
                current.bitmapIndex.put(dim.getKey(), index);
                LOGGER.debug("Index for {} has {} members using {} bytes", dim.getKey(), index.size(), usedBytes);
            }
            LOGGER.info("Build completed: name {} with {} dimension columns, {} measure columns and {} records in {} ms.",
                    meta.name, meta.dimColumnNames.size(), meta.measureColumnNames.size(), records.size(),
                    System.currentTimeMillis() - enterTime);

            return current;
        }
    }

    public String getName() {
        return meta.name;
    }

    /**
     * @return dimension column names in declared order
     */
    public List<String> getDims() {
        return new ArrayList<String>(meta.dimColumnNames.keySet());
    }

    /**
     * @return measure column names in declared order
     */
    public List<String> getMeasures() {
        return new ArrayList<String>(meta.measureColumnNames.keySet());
    }

    public boolean hasDim(String dimName) {
        return dimName != null && meta.dimColumnNames.containsKey(dimName);
    }

    public boolean hasMeasure(String measureName) {
        return measureName != null && meta.measureColumnNames.containsKey(measureName);
    }

    public int size() {
        return records.size();
    }

    public List<Record> getRecords() {
        return records;
    }

    /**
     * @param parallel specify Java8 Stream mode
     * @return all records
     */
    public Stream<Record> stream(boolean parallel) {
        return parallel ? records.parallelStream() : records.stream();
    }

    /**
     * Records matching every filter: members of one dimension are OR-ed, dimensions are AND-ed.
     * @param filterDims dimension name to accepted members (raw values are normalized)
     * @param parallel specify Java8 Stream mode
     * @return matching records, empty stream when nothing matches
     * @throws SchemaException if a filter dimension is not a dimension column
     */
    public Stream<Record> filter(Map<String, ? extends Collection<?>> filterDims, boolean parallel) {

        if (filterDims == null || filterDims.isEmpty()) {
            return stream(parallel);
        }
        RoaringBitmap ands = null;
        for (Entry<String, ? extends Collection<?>> entry : filterDims.entrySet()) {
            Map<Object, RoaringBitmap> index = bitmapIndex.get(entry.getKey());
            if (index == null) {
                throw new SchemaException("Unknown filter dimension", entry.getKey());
            }
            RoaringBitmap ors = new RoaringBitmap();
            for (Object v : entry.getValue()) {
                RoaringBitmap o = index.get(member(v));
                if (o != null) {
                    ors.or(o);
                }
            }
            if (ands == null) {
                ands = ors;
            } else {
                ands.and(ors);
            }
        }
        LOGGER.debug("Filter {} matches {} records", filterDims, ands.getCardinality());
        Stream<Record> stream = ands.stream().mapToObj(id -> records.get(id));
        return parallel ? stream.parallel() : stream;
    }

    /**
     * @param dimName dimension column
     * @return distinct members of dimension, {@link ReservedMember#UNKNOWN} included when present
     */
    public Set<Object> members(String dimName) {
        Map<Object, RoaringBitmap> index = bitmapIndex.get(dimName);
        if (index == null) {
            throw new SchemaException("Unknown dimension", dimName);
        }
        return Collections.unmodifiableSet(new HashSet<Object>(index.keySet()));
    }

    /**
     * Measure index by search {@link #meta}, high performance is very important.
     * @param measureName measure names
     * @return measure index in fact-table
     * @throws SchemaException if measure name is empty or invalid.
     */
    public int getMeasureIndex(String measureName) throws SchemaException {

        Integer index = measureName == null ? null : meta.measureColumnNames.get(measureName);
        if (index == null) {
            throw new SchemaException("Unknown measure", String.valueOf(measureName));
        }
        return index;
    }

    /**
     * Dimension index by search {@link #meta}, high performance is very important.
     * @param dimName Dimension names
     * @return dimension index in fact-table
     * @throws SchemaException if dimension name is empty or invalid.
     */
    public int getDimIndex(String dimName) throws SchemaException {

        Integer index = dimName == null ? null : meta.dimColumnNames.get(dimName);
        if (index == null) {
            throw new SchemaException("Unknown dimension", String.valueOf(dimName));
        }
        return index;
    }

    @Override
    public String toString() {
        return "FactTable [meta=" + meta + ", records=" + records.size() + "]";
    }

}
