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

import java.util.List;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.github.totyumengr.projcubes.core.CubeInfo;
import com.github.totyumengr.projcubes.core.PivotTable;

/**
 * Loads the warehouse once at startup and logs the cube description, the recipes and the KPI alerts.
 * @author mengran
 *
 */
@Component
@ConditionalOnProperty(name = "projcubes.bootstrap.enabled", havingValue = "true")
public class ProjectBootstrapRunner implements CommandLineRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectBootstrapRunner.class);

    @Autowired
    private ProjectAnalysisService analysisService;
    @Value("${projcubes.bootstrap.session:projects}")
    private String sessionName;

    @Override
    public void run(String... args) throws Exception {

        String handle = analysisService.open(sessionName);
        CubeInfo info = analysisService.cube(handle).describe();
        LOGGER.info("Session {} ready: {} records, dimension members {}", handle, info.getRecordCount(),
                info.getMemberCounts());

        for (ProjectCubeRecipe recipe : ProjectCubeRecipe.values()) {
            List<PivotTable> tables = analysisService.recipe(handle, recipe);
            for (PivotTable table : tables) {
                LOGGER.info("{} {}: {} rows x {} columns, total {}", recipe, table.getSpec(),
                        table.getRowKeys().size(), table.getColumnKeys().size(), table.getCorner());
            }
        }

        KpiScorecard scorecard = analysisService.scorecard(handle);
        for (KpiScorecard.Kpi kpi : KpiScorecard.Kpi.values()) {
            LOGGER.info("KPI {} = {} ({})", kpi, scorecard.getValue(kpi), scorecard.getStatus(kpi));
        }
        for (KpiScorecard.Alert alert : scorecard.alerts()) {
            LOGGER.warn("{} alert on {}: {} against target {}. {}", alert.getSeverity(), alert.getKpi(),
                    alert.getValue(), alert.getTarget(), alert.getRecommendation());
        }
        for (Entry<Object, KpiScorecard> e : analysisService.scorecardBy(handle, ProjectDimension.CLIENT_ID)
                .entrySet()) {
            LOGGER.info("Client {} has {} alerts over {} projects.", e.getKey(), e.getValue().alerts().size(),
                    e.getValue().getProjectCount());
        }
    }

}
