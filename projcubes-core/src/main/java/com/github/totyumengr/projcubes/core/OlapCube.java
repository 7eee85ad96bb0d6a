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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.ObjectUtils;
import org.springframework.util.StopWatch;

import com.github.totyumengr.projcubes.core.Aggregator.Grouping;

/**
 * In-memory cube base on java8 stream feature, answering the classical OLAP operations over one immutable
 * {@link FactTable} described by a {@link CubeCatalog}.
 *
 * <p>{@link OlapCube} holds no mutable state: every operation reads the fact-table and returns a fresh result, so one
 * instance can be queried by many threads without locks. Filters use the bitmap index of the fact-table, see
 * <a href="https://github.com/lemire/RoaringBitmap">RoaringBitmap</a>.
 *
 * @author mengran
 *
 * @see Aggregator
 */
public class OlapCube implements Aggregations {

    private static final Logger LOGGER = LoggerFactory.getLogger(OlapCube.class);

    private final FactTable factTable;
    private final CubeCatalog.Resolved catalog;
    private final Margins margins;
    private final boolean parallel;
    private final Aggregator aggregator;

    /**
     * Cube with grand total margins in sequential mode.
     * @param factTable source records
     * @param catalog names exposed by cube
     * @throws SchemaException if catalog does not match fact-table
     * @throws AggregationException if a catalog measure is not numeric
     */
    public OlapCube(FactTable factTable, CubeCatalog catalog) {
        this(factTable, catalog.resolve(factTable), Margins.GRAND_TOTAL, false);
    }

    private OlapCube(FactTable factTable, CubeCatalog.Resolved catalog, Margins margins, boolean parallel) {
        Assert.notNull(margins, "Margins can not null.");
        this.factTable = factTable;
        this.catalog = catalog;
        this.margins = margins;
        this.parallel = parallel;
        this.aggregator = new Aggregator(factTable, parallel);
    }

    /**
     * @param margins margin policy of results
     * @return copy of this cube
     */
    public OlapCube withMargins(Margins margins) {
        return new OlapCube(factTable, catalog, margins, parallel);
    }

    /**
     * @param parallel specify Java8 Stream mode
     * @return copy of this cube
     */
    public OlapCube withParallel(boolean parallel) {
        return new OlapCube(factTable, catalog, margins, parallel);
    }

    public FactTable getFactTable() {
        return factTable;
    }

    public CubeCatalog.Resolved getCatalog() {
        return catalog;
    }

    public Margins getMargins() {
        return margins;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * @return every catalog measure with its default aggregation
     */
    public List<MeasureSpec> defaultSpecs() {
        return catalog.defaultSpecs();
    }

    private List<Grouping> groupings(List<String> dimNames) {
        List<Grouping> groupings = new ArrayList<Grouping>(dimNames.size());
        for (String dimName : dimNames) {
            catalog.checkDimension(dimName);
            groupings.add(Grouping.column(factTable, dimName));
        }
        return groupings;
    }

    private List<String> without(Collection<String> excluded) {
        List<String> dims = new ArrayList<String>(catalog.getDimensions());
        dims.removeAll(excluded);
        return dims;
    }

    // ---------------------------- Aggregation API ----------------------------

    @Override
    public CubeResult aggregate(List<String> dimNames, List<MeasureSpec> specs) {

        return aggregator.aggregate("aggregate" + dimNames, factTable.stream(parallel), groupings(dimNames), specs,
                margins);
    }

    @Override
    public CubeResult slice(String dimName, Object value) {

        // Delegate to overload method
        return slice(dimName, value, defaultSpecs());
    }

    @Override
    public CubeResult slice(String dimName, Object value, List<MeasureSpec> specs) {

        catalog.checkDimension(dimName);
        Map<String, List<Object>> filter = Collections.singletonMap(dimName, Collections.singletonList(value));
        return aggregator.aggregate("slice" + filter, factTable.filter(filter, parallel),
                groupings(without(Collections.singleton(dimName))), specs, margins);
    }

    @Override
    public CubeResult dice(Map<String, ?> filters) {

        // Delegate to overload method
        return dice(filters, defaultSpecs());
    }

    @Override
    public CubeResult dice(Map<String, ?> filters, List<MeasureSpec> specs) {

        Assert.notNull(filters, "Dice filters can not null.");
        Map<String, Collection<?>> members = new LinkedHashMap<String, Collection<?>>();
        for (Entry<String, ?> entry : filters.entrySet()) {
            catalog.checkDimension(entry.getKey());
            Object value = entry.getValue();
            if (value instanceof Collection) {
                members.put(entry.getKey(), (Collection<?>) value);
            } else if (ObjectUtils.isArray(value)) {
                members.put(entry.getKey(), Arrays.asList(ObjectUtils.toObjectArray(value)));
            } else {
                members.put(entry.getKey(), Collections.singletonList(value));
            }
        }
        return aggregator.aggregate("dice" + members, factTable.filter(members, parallel),
                groupings(without(members.keySet())), specs, margins);
    }

    @Override
    public List<CubeResult> rollUp(String dimName, Hierarchy hierarchy) {

        // Delegate to overload method
        return rollUp(dimName, hierarchy, defaultSpecs());
    }

    @Override
    public List<CubeResult> rollUp(String dimName, Hierarchy hierarchy, List<MeasureSpec> specs) {

        catalog.checkDimension(dimName);
        // Fail before computing any level
        for (Hierarchy.Level level : hierarchy.getLevels()) {
            level.grouping(factTable, dimName);
        }

        StopWatch stopWatch = new StopWatch("rollUp " + dimName);
        List<CubeResult> results = new ArrayList<CubeResult>(hierarchy.size());
        for (int i = 0; i < hierarchy.size(); i++) {
            stopWatch.start(hierarchy.getLevel(i).getName());
            results.add(rollUpLevel(dimName, hierarchy, i, specs));
            stopWatch.stop();
        }
        LOGGER.info("Roll up {} through {} using {} ms.", dimName, hierarchy, stopWatch.getTotalTimeMillis());
        LOGGER.debug(stopWatch.prettyPrint());
        return results;
    }

    @Override
    public CubeResult rollUpLevel(String dimName, Hierarchy hierarchy, int levelIndex) {

        // Delegate to overload method
        return rollUpLevel(dimName, hierarchy, levelIndex, defaultSpecs());
    }

    @Override
    public CubeResult rollUpLevel(String dimName, Hierarchy hierarchy, int levelIndex, List<MeasureSpec> specs) {

        catalog.checkDimension(dimName);
        Hierarchy.Level level = hierarchy.getLevel(levelIndex);
        List<String> dims = catalog.getDimensions();
        List<Grouping> groupings = new ArrayList<Grouping>(dims.size());
        for (String dim : dims) {
            groupings.add(dim.equals(dimName) ? level.grouping(factTable, dimName) : Grouping.column(factTable, dim));
        }
        return aggregator.aggregate(level.getName(), factTable.stream(parallel), groupings, specs, margins);
    }

    @Override
    public CubeResult drillDown(String dimName, Object parentValue, String childDimName) {

        // Delegate to overload method
        return drillDown(dimName, parentValue, childDimName, defaultSpecs());
    }

    @Override
    public CubeResult drillDown(String dimName, Object parentValue, String childDimName, List<MeasureSpec> specs) {

        factTable.getDimIndex(dimName);
        factTable.getDimIndex(childDimName);

        List<String> dims = without(Collections.singleton(dimName));
        if (!dims.contains(childDimName)) {
            dims.add(childDimName);
        }
        List<Grouping> groupings = new ArrayList<Grouping>(dims.size());
        for (String dim : dims) {
            groupings.add(Grouping.column(factTable, dim));
        }
        Map<String, List<Object>> filter = Collections.singletonMap(dimName, Collections.singletonList(parentValue));
        return aggregator.aggregate("drillDown" + filter + " to " + childDimName, factTable.filter(filter, parallel),
                groupings, specs, margins);
    }

    @Override
    public PivotTable pivot(List<String> rowDims, List<String> colDims, String measure, Aggregation aggregation) {

        return pivot(rowDims, colDims, Collections.singletonList(MeasureSpec.of(measure, aggregation))).get(0);
    }

    @Override
    public List<PivotTable> pivot(List<String> rowDims, List<String> colDims, List<MeasureSpec> specs) {

        long enterTime = System.currentTimeMillis();
        Set<String> overlap = new HashSet<String>(rowDims);
        overlap.retainAll(colDims);
        if (!overlap.isEmpty()) {
            throw new SchemaException("Dimensions on both pivot axes", overlap.toArray(new String[0]));
        }
        List<String> dims = new ArrayList<String>(rowDims);
        dims.addAll(colDims);

        Aggregator.Buckets buckets = aggregator.group(factTable.stream(parallel), groupings(dims), specs);
        List<PivotTable> tables = new ArrayList<PivotTable>(specs.size());
        for (MeasureSpec spec : specs) {
            tables.add(PivotTable.of(spec, rowDims, colDims, buckets));
        }
        LOGGER.info("Pivot {} by {} measures {} result {} buckets using {} ms.", rowDims, colDims, specs,
                buckets.states.size(), System.currentTimeMillis() - enterTime);
        return tables;
    }

    @Override
    public CubeInfo describe() {
        return new CubeInfo(factTable, catalog);
    }

    @Override
    public String toString() {
        return "OlapCube [factTable=" + factTable + ", catalog=" + catalog.getCatalog() + ", margins=" + margins
                + ", parallel=" + parallel + "]";
    }

}
