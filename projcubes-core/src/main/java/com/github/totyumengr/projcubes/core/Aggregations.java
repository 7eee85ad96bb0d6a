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

import java.util.List;
import java.util.Map;

/**
 * <p>Define supported cube operations. Every operation has a form aggregating all catalog measures by their default
 * {@link Aggregation} and a form taking explicit {@link MeasureSpec}s.
 *
 * <p>Operations never modify the cube, an empty result means nothing matched and is not an error. Unknown names
 * fail fast with {@link SchemaException}.
 * @author mengran
 *
 */
public interface Aggregations {

    /**
     * Calculation scale
     */
    int IND_SCALE = 8;

    /**
     * Aggregate by given dimensions. It equal to "SELECT {dims}, AGG({measure}) FROM {fact table of cube} GROUP BY
     * {dims}" plus margins.
     * @param dimNames catalog dimensions, empty means one bucket
     * @param specs measures
     * @return result of aggregate operation
     */
    CubeResult aggregate(List<String> dimNames, List<MeasureSpec> specs);

    /**
     * Keep records where dimension equals value, then aggregate by catalog dimensions except the sliced one.
     * @param dimName catalog dimension
     * @param value member
     * @return result of slice operation
     */
    CubeResult slice(String dimName, Object value);

    /**
     * @see #slice(String, Object)
     */
    CubeResult slice(String dimName, Object value, List<MeasureSpec> specs);

    /**
     * Keep records matching every filter, then aggregate by catalog dimensions except the filtered ones. It equal to
     * "... WHERE {dimension1 IN (a, b, c)} AND {dimension2 = d} GROUP BY {other dimensions}".
     * @param filters dimension to single member, array or collection of members
     * @return result of dice operation
     */
    CubeResult dice(Map<String, ?> filters);

    /**
     * @see #dice(Map)
     */
    CubeResult dice(Map<String, ?> filters, List<MeasureSpec> specs);

    /**
     * Aggregate every level of hierarchy, dimension member replaced by level member.
     * @param dimName catalog dimension rolled up
     * @param hierarchy levels from finest to coarsest
     * @return one result per level in hierarchy order
     */
    List<CubeResult> rollUp(String dimName, Hierarchy hierarchy);

    /**
     * @see #rollUp(String, Hierarchy)
     */
    List<CubeResult> rollUp(String dimName, Hierarchy hierarchy, List<MeasureSpec> specs);

    /**
     * @see #rollUpLevel(String, Hierarchy, int, List)
     */
    CubeResult rollUpLevel(String dimName, Hierarchy hierarchy, int levelIndex);

    /**
     * @param dimName catalog dimension rolled up
     * @param hierarchy levels from finest to coarsest
     * @param levelIndex level in hierarchy
     * @param specs measures
     * @return result of one level
     */
    CubeResult rollUpLevel(String dimName, Hierarchy hierarchy, int levelIndex, List<MeasureSpec> specs);

    /**
     * Keep records where dimension equals parent member, then aggregate by catalog dimensions except the parent one
     * plus the child dimension.
     * @param dimName parent dimension
     * @param parentValue parent member
     * @param childDimName finer dimension
     * @return result of drill-down operation
     */
    CubeResult drillDown(String dimName, Object parentValue, String childDimName);

    /**
     * @see #drillDown(String, Object, String)
     */
    CubeResult drillDown(String dimName, Object parentValue, String childDimName, List<MeasureSpec> specs);

    /**
     * Two axis table of one measure.
     * @param rowDims row dimensions
     * @param colDims column dimensions
     * @param measure measure name
     * @param aggregation function
     * @return result of pivot operation
     */
    PivotTable pivot(List<String> rowDims, List<String> colDims, String measure, Aggregation aggregation);

    /**
     * @return one pivot table per spec, in given order
     * @see #pivot(List, List, String, Aggregation)
     */
    List<PivotTable> pivot(List<String> rowDims, List<String> colDims, List<MeasureSpec> specs);

    /**
     * @return summary of dimensions, measures and members
     */
    CubeInfo describe();

}
