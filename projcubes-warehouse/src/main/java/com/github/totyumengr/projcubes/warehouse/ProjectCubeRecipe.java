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
package com.github.totyumengr.projcubes.warehouse;

import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.BUDGET_CATEGORY;
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.CLIENT_ID;
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.DEVIATION_TYPE;
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.PRODUCTIVITY_CATEGORY;
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.QUALITY_CATEGORY;
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.START_PERIOD;
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.START_YEAR;
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.STATUS;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.github.totyumengr.projcubes.core.Aggregation;
import com.github.totyumengr.projcubes.core.MeasureSpec;
import com.github.totyumengr.projcubes.core.OlapCube;
import com.github.totyumengr.projcubes.core.PivotTable;

/**
 * Predefined pivots over the project fact-table, each with its own aggregation per measure. Needs a cube with the
 * {@link ProjectCatalogs#full() full} catalog.
 * @author mengran
 *
 */
public enum ProjectCubeRecipe {

    /**
     * Client and status by start period.
     */
    BASE(dims(CLIENT_ID, STATUS), dims(START_PERIOD),
            ProjectMeasure.BUDGET.spec(Aggregation.SUM),
            ProjectMeasure.REAL_COST.spec(Aggregation.SUM),
            ProjectMeasure.AVERAGE_PRODUCTIVITY.spec(Aggregation.MEAN)),

    PRODUCTIVITY_QUALITY(dims(PRODUCTIVITY_CATEGORY, QUALITY_CATEGORY), dims(STATUS),
            ProjectMeasure.PROJECT_ID.spec(Aggregation.COUNT),
            ProjectMeasure.BUDGET.spec(Aggregation.MEAN),
            ProjectMeasure.BUDGET_DEVIATION.spec(Aggregation.MEAN)),

    FINANCIAL(dims(BUDGET_CATEGORY, DEVIATION_TYPE), dims(CLIENT_ID),
            ProjectMeasure.PROJECT_ID.spec(Aggregation.COUNT),
            ProjectMeasure.BUDGET.spec(Aggregation.SUM),
            ProjectMeasure.REAL_COST.spec(Aggregation.SUM),
            ProjectMeasure.BUDGET_DEVIATION.spec(Aggregation.SUM)),

    TEMPORAL_STATUS(dims(START_YEAR, STATUS), dims(QUALITY_CATEGORY),
            ProjectMeasure.PROJECT_ID.spec(Aggregation.COUNT),
            ProjectMeasure.TEST_SUCCESS_RATE.spec(Aggregation.MEAN),
            ProjectMeasure.AVERAGE_PRODUCTIVITY.spec(Aggregation.MEAN)),

    MULTI_MEASURE(dims(CLIENT_ID), dims(STATUS),
            ProjectMeasure.BUDGET.spec(Aggregation.SUM),
            ProjectMeasure.REAL_COST.spec(Aggregation.SUM),
            ProjectMeasure.BUDGET_DEVIATION.spec(Aggregation.SUM),
            ProjectMeasure.AVERAGE_PRODUCTIVITY.spec(Aggregation.MEAN),
            ProjectMeasure.TEST_SUCCESS_RATE.spec(Aggregation.MEAN),
            ProjectMeasure.PERCENT_LATE_TASKS.spec(Aggregation.MEAN),
            ProjectMeasure.PERCENT_LATE_MILESTONES.spec(Aggregation.MEAN)),

    /**
     * Executive summary by client and start period.
     */
    EXECUTIVE(dims(CLIENT_ID), dims(START_PERIOD),
            ProjectMeasure.PROJECT_ID.spec(Aggregation.COUNT),
            ProjectMeasure.BUDGET.spec(Aggregation.SUM),
            ProjectMeasure.REAL_COST.spec(Aggregation.SUM),
            ProjectMeasure.ROI.spec(Aggregation.MEAN),
            ProjectMeasure.BUDGET_EFFICIENCY.spec(Aggregation.MEAN),
            ProjectMeasure.QUALITY_INDICATOR.spec(Aggregation.MEAN),
            ProjectMeasure.AVERAGE_PRODUCTIVITY.spec(Aggregation.MEAN));

    private final List<String> rowDims;
    private final List<String> colDims;
    private final List<MeasureSpec> specs;

    private ProjectCubeRecipe(List<String> rowDims, List<String> colDims, MeasureSpec... specs) {
        this.rowDims = Collections.unmodifiableList(rowDims);
        this.colDims = Collections.unmodifiableList(colDims);
        this.specs = Collections.unmodifiableList(Arrays.asList(specs));
    }

    private static List<String> dims(ProjectDimension... dimensions) {
        return ProjectDimension.columns(dimensions);
    }

    public List<String> getRowDimensions() {
        return rowDims;
    }

    public List<String> getColumnDimensions() {
        return colDims;
    }

    public List<MeasureSpec> getSpecs() {
        return specs;
    }

    /**
     * @param cube cube over project fact-table
     * @return one pivot per measure, in declared order
     */
    public List<PivotTable> build(OlapCube cube) {
        return cube.pivot(rowDims, colDims, specs);
    }

}
