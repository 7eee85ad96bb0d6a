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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import com.github.totyumengr.projcubes.core.FactTable.Record;

/**
 * Groups records into buckets keyed by active dimension members and aggregates every requested measure, then adds
 * margin buckets merged from the raw bucket states.
 *
 * <p>Collection is done by Java8 stream {@link Collectors#groupingBy(Function, java.util.function.Supplier, Collector)
 * grouping}, in parallel mode the partial states of every sub-stream are merged by {@link AggregateState#merge}, so
 * the result is the same as in sequential mode.
 *
 * @author mengran
 *
 */
public class Aggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);

    /**
     * Dimension combinations count limit of {@link Margins#ALL_SUBTOTALS}.
     */
    static final int MAX_SUBTOTAL_DIMENSIONS = 16;

    /**
     * One active dimension: its name in result and how to read the member of a record.
     * @author mengran
     *
     */
    public static final class Grouping {

        private final String name;
        private final Function<Record, Object> extractor;

        private Grouping(String name, Function<Record, Object> extractor) {
            this.name = name;
            this.extractor = extractor;
        }

        /**
         * @param factTable owner of column
         * @param dimName dimension column
         * @return grouping by raw column members
         * @throws SchemaException if column is not a dimension
         */
        public static Grouping column(FactTable factTable, String dimName) {
            final int index = factTable.getDimIndex(dimName);
            return new Grouping(dimName, r -> r.getDim(index));
        }

        /**
         * @param name name in result
         * @param extractor member of record, must return normalized members
         * @return grouping
         */
        static Grouping of(String name, Function<Record, Object> extractor) {
            return new Grouping(name, extractor);
        }

        public String getName() {
            return name;
        }

        Object extract(Record record) {
            return extractor.apply(record);
        }

        @Override
        public String toString() {
            return "Grouping [" + name + "]";
        }
    }

    /**
     * Raw bucket states before materializing, one state per distinct measure.
     */
    static final class Buckets {

        final Map<String, Integer> slots;
        final Map<DimensionKey, AggregateState[]> states;

        Buckets(Map<String, Integer> slots, Map<DimensionKey, AggregateState[]> states) {
            this.slots = slots;
            this.states = states;
        }

        AggregateValue value(AggregateState[] bucket, MeasureSpec spec) {
            return bucket[slots.get(spec.getMeasure())].value(spec.getAggregation());
        }
    }

    private final FactTable factTable;
    private final boolean parallel;

    public Aggregator(FactTable factTable, boolean parallel) {
        Assert.notNull(factTable, "Fact-table can not null.");
        this.factTable = factTable;
        this.parallel = parallel;
    }

    public FactTable getFactTable() {
        return factTable;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Aggregate whole fact-table by dimension columns.
     * @param dimNames active dimension columns, empty means one bucket
     * @param specs measures
     * @param margins margin policy
     * @return fresh result
     */
    public CubeResult aggregate(List<String> dimNames, List<MeasureSpec> specs, Margins margins) {

        List<Grouping> groupings = new ArrayList<Grouping>(dimNames.size());
        for (String dimName : dimNames) {
            groupings.add(Grouping.column(factTable, dimName));
        }
        return aggregate("aggregate" + dimNames, factTable.stream(parallel), groupings, specs, margins);
    }

    /**
     * @param label name of result
     * @param records records to aggregate, normally a stream from {@link FactTable#filter}
     * @param groupings active dimensions
     * @param specs measures
     * @param margins margin policy
     * @return fresh result
     * @throws SchemaException if a measure is unknown
     * @throws AggregationException if a measure is not numeric
     */
    public CubeResult aggregate(String label, Stream<Record> records, List<Grouping> groupings,
            List<MeasureSpec> specs, Margins margins) {

        long enterTime = System.currentTimeMillis();
        Buckets buckets = group(records, groupings, specs);

        Map<DimensionKey, AggregateState[]> all = new HashMap<DimensionKey, AggregateState[]>(buckets.states);
        all.putAll(margins(buckets.states, groupings.size(), margins));

        TreeMap<DimensionKey, Map<MeasureSpec, AggregateValue>> cells =
                new TreeMap<DimensionKey, Map<MeasureSpec, AggregateValue>>();
        for (Entry<DimensionKey, AggregateState[]> e : all.entrySet()) {
            Map<MeasureSpec, AggregateValue> values = new LinkedHashMap<MeasureSpec, AggregateValue>();
            for (MeasureSpec spec : specs) {
                values.put(spec, buckets.value(e.getValue(), spec));
            }
            cells.put(e.getKey(), Collections.unmodifiableMap(values));
        }

        List<String> names = new ArrayList<String>(groupings.size());
        for (Grouping g : groupings) {
            names.add(g.getName());
        }
        LOGGER.info("Aggregate {} by {} measures {} result {} buckets, {} margins using {} ms.", label, names, specs,
                buckets.states.size(), cells.size() - buckets.states.size(), System.currentTimeMillis() - enterTime);
        return new CubeResult(label, names, specs, cells);
    }

    /**
     * @param specs requested measures
     * @return measure name to slot in bucket state array, and fact-table index of every slot
     */
    private Map<String, Integer> slots(List<MeasureSpec> specs) {

        Assert.notEmpty(specs, "At least one measure is required.");
        Map<String, Integer> slots = new LinkedHashMap<String, Integer>();
        for (MeasureSpec spec : specs) {
            String measure = spec.getMeasure();
            if (!factTable.hasMeasure(measure)) {
                if (factTable.hasDim(measure)) {
                    throw new AggregationException("Non-numeric column can not be aggregated", measure);
                }
                throw new SchemaException("Unknown measure", measure);
            }
            if (!slots.containsKey(measure)) {
                slots.put(measure, slots.size());
            }
        }
        return slots;
    }

    Buckets group(Stream<Record> records, List<Grouping> groupings, List<MeasureSpec> specs) {

        final Map<String, Integer> slots = slots(specs);
        final int[] measureIndexes = new int[slots.size()];
        for (Entry<String, Integer> e : slots.entrySet()) {
            measureIndexes[e.getValue()] = factTable.getMeasureIndex(e.getKey());
        }
        final Grouping[] keyOf = groupings.toArray(new Grouping[0]);

        Collector<Record, AggregateState[], AggregateState[]> bucketCollector = Collector.of(
            () -> {
                AggregateState[] states = new AggregateState[measureIndexes.length];
                for (int i = 0; i < states.length; i++) {
                    states[i] = new AggregateState();
                }
                return states;
            },
            (states, r) -> {
                for (int i = 0; i < states.length; i++) {
                    states[i].accept(r.getMeasure(measureIndexes[i]));
                }
            },
            (x, y) -> {
                for (int i = 0; i < x.length; i++) {
                    x[i].merge(y[i]);
                }
                return x;
            });

        Map<DimensionKey, AggregateState[]> states = records.collect(Collectors.groupingBy(r -> {
            Object[] members = new Object[keyOf.length];
            for (int i = 0; i < keyOf.length; i++) {
                members[i] = keyOf[i].extract(r);
            }
            return DimensionKey.wrap(members);
        }, HashMap::new, bucketCollector));

        return new Buckets(slots, states);
    }

    /**
     * @param buckets real buckets, never margins
     * @param dimCount active dimension count
     * @param margins policy
     * @return margin buckets merged from copies of the real bucket states
     */
    static Map<DimensionKey, AggregateState[]> margins(Map<DimensionKey, AggregateState[]> buckets, int dimCount,
            Margins margins) {

        Map<DimensionKey, AggregateState[]> result = new HashMap<DimensionKey, AggregateState[]>();
        if (margins == Margins.NONE || dimCount == 0 || buckets.isEmpty()) {
            return result;
        }
        if (margins == Margins.GRAND_TOTAL) {
            Object[] all = new Object[dimCount];
            Arrays.fill(all, ReservedMember.ALL);
            DimensionKey grandTotalKey = DimensionKey.wrap(all);
            for (AggregateState[] states : buckets.values()) {
                mergeInto(result, grandTotalKey, states);
            }
            return result;
        }

        Assert.isTrue(dimCount <= MAX_SUBTOTAL_DIMENSIONS, "Too many dimensions for all subtotals: " + dimCount);
        int full = (1 << dimCount) - 1;
        for (int mask = 1; mask <= full; mask++) {
            for (Entry<DimensionKey, AggregateState[]> e : buckets.entrySet()) {
                DimensionKey marginKey = e.getKey();
                for (int i = 0; i < dimCount; i++) {
                    if ((mask & (1 << i)) != 0) {
                        marginKey = marginKey.with(i, ReservedMember.ALL);
                    }
                }
                mergeInto(result, marginKey, e.getValue());
            }
        }
        return result;
    }

    private static void mergeInto(Map<DimensionKey, AggregateState[]> result, DimensionKey key,
            AggregateState[] states) {
        AggregateState[] target = result.get(key);
        if (target == null) {
            target = new AggregateState[states.length];
            for (int i = 0; i < target.length; i++) {
                target[i] = new AggregateState();
            }
            result.put(key, target);
        }
        for (int i = 0; i < target.length; i++) {
            target[i].merge(states[i]);
        }
    }

}
