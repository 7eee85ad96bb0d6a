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
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.START_PERIOD;
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.START_YEAR;
import static com.github.totyumengr.projcubes.warehouse.ProjectDimension.STATUS;

import com.github.totyumengr.projcubes.core.CubeCatalog;

/**
 * Catalogs over the project fact-table.
 * @author mengran
 *
 */
public final class ProjectCatalogs {

    private ProjectCatalogs() {
    }

    /**
     * @return every dimension and measure, used by the predefined recipes
     */
    public static CubeCatalog full() {
        return ProjectMeasure.addTo(CubeCatalog.builder().dimensions(ProjectDimension.columns()),
                ProjectMeasure.values()).build();
    }

    /**
     * @return client, status and time dimensions with the financial and delivery measures
     */
    public static CubeCatalog projects() {
        return ProjectMeasure.addTo(CubeCatalog.builder()
                .dimensions(ProjectDimension.columns(CLIENT_ID, STATUS, START_YEAR, START_PERIOD, BUDGET_CATEGORY)),
                ProjectMeasure.BUDGET, ProjectMeasure.REAL_COST, ProjectMeasure.BUDGET_DEVIATION,
                ProjectMeasure.PENALTY_AMOUNT, ProjectMeasure.AVERAGE_PRODUCTIVITY, ProjectMeasure.TEST_SUCCESS_RATE,
                ProjectMeasure.PROJECT_ID).build();
    }

    /**
     * @return measures feeding {@link KpiScorecard}
     */
    public static CubeCatalog kpis() {
        CubeCatalog.Builder builder = CubeCatalog.builder()
            .dimensions(ProjectDimension.columns(CLIENT_ID, STATUS, START_YEAR, START_PERIOD));
        for (KpiScorecard.Kpi kpi : KpiScorecard.Kpi.values()) {
            builder.measure(kpi.getMeasure().column(), kpi.getMeasure().defaultAggregation());
        }
        return builder.build();
    }

}
