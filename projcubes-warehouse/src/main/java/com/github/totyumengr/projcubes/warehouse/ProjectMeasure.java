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

import java.util.ArrayList;
import java.util.List;

import com.github.totyumengr.projcubes.core.Aggregation;
import com.github.totyumengr.projcubes.core.CubeCatalog;
import com.github.totyumengr.projcubes.core.MeasureSpec;

/**
 * Measure columns of the project fact-table with their default aggregation: amounts are summed, percentages, rates
 * and productivity are averaged, identifiers are counted.
 * @author mengran
 *
 */
public enum ProjectMeasure {

    BUDGET("budget", Aggregation.SUM),
    REAL_COST("real_cost", Aggregation.SUM),
    /**
     * Budget minus real cost, negative means over budget.
     */
    BUDGET_DEVIATION("budget_deviation", Aggregation.SUM),
    PENALTY_AMOUNT("penalty_amount", Aggregation.SUM),
    AVERAGE_PRODUCTIVITY("average_productivity", Aggregation.MEAN),
    TEST_SUCCESS_RATE("test_success_rate", Aggregation.MEAN),
    ERROR_RATE("error_rate", Aggregation.MEAN),
    PERCENT_LATE_TASKS("percent_late_tasks", Aggregation.MEAN),
    PERCENT_LATE_MILESTONES("percent_late_milestones", Aggregation.MEAN),
    PROJECT_ID("project_id", Aggregation.COUNT),

    ROI("roi", Aggregation.MEAN),
    BUDGET_EFFICIENCY("budget_efficiency", Aggregation.MEAN),
    QUALITY_INDICATOR("quality_indicator", Aggregation.MEAN),
    BUDGET_COMPLIANCE("budget_compliance", Aggregation.MEAN),
    DEVIATION_PERCENT("deviation_percent", Aggregation.MEAN),
    PENALTY_PERCENT("penalty_percent", Aggregation.MEAN),
    /**
     * 1 when delivered without final delay, the mean is the on-time rate.
     */
    ON_TIME("on_time", Aggregation.MEAN),
    /**
     * 1 when cancelled, the mean is the cancellation rate.
     */
    CANCELLED("cancelled", Aggregation.MEAN);

    private final String column;
    private final Aggregation defaultAggregation;

    private ProjectMeasure(String column, Aggregation defaultAggregation) {
        this.column = column;
        this.defaultAggregation = defaultAggregation;
    }

    public String column() {
        return column;
    }

    public Aggregation defaultAggregation() {
        return defaultAggregation;
    }

    public MeasureSpec spec() {
        return MeasureSpec.of(column, defaultAggregation);
    }

    public MeasureSpec spec(Aggregation aggregation) {
        return MeasureSpec.of(column, aggregation);
    }

    public static List<String> columns() {
        List<String> columns = new ArrayList<String>(values().length);
        for (ProjectMeasure m : values()) {
            columns.add(m.column);
        }
        return columns;
    }

    /**
     * @param builder catalog under construction
     * @param measures measures to add with their default aggregation
     * @return builder
     */
    static CubeCatalog.Builder addTo(CubeCatalog.Builder builder, ProjectMeasure... measures) {
        for (ProjectMeasure m : measures) {
            builder.measure(m.column, m.defaultAggregation);
        }
        return builder;
    }

}
