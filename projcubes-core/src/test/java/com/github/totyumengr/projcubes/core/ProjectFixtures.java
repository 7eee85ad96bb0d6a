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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import com.github.totyumengr.projcubes.core.FactTable.FactTableBuilder;

/**
 * Loads the small project data-set shared by tests.
 * @author mengran
 *
 */
final class ProjectFixtures {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectFixtures.class);

    static final String DATA_FILE = "projects.data";

    private ProjectFixtures() {
    }

    static FactTable projects(String name) throws IOException {

        FactTableBuilder builder = new FactTableBuilder().build(name)
            .addDimColumns(Arrays.asList("client_id", "status", "start_year", "start_period", "budget_category"))
            .addMeasureColumns(Arrays.asList("budget", "real_cost", "average_productivity", "test_success_rate"));

        long startTime = System.currentTimeMillis();
        ClassPathResource resource = new ClassPathResource(DATA_FILE);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line = null;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith("#")) {
                    continue;
                }
                String[] split = line.split("\t", -1);
                Integer clientId = split[0].isEmpty() ? null : Integer.valueOf(split[0]);
                builder.addRow(Arrays.asList(clientId, split[1], Integer.valueOf(split[2]), split[3], split[4]),
                        Arrays.asList(split[5], split[6], split[7], split[8]));
            }
        }
        LOGGER.info("prepare {} - {}ms", DATA_FILE, System.currentTimeMillis() - startTime);
        return builder.done();
    }

    static CubeCatalog catalog() {

        return CubeCatalog.builder()
            .dimension("client_id", "status", "start_period")
            .measure("budget")
            .measure("real_cost", Aggregation.SUM)
            .measure("average_productivity", Aggregation.MEAN)
            .measure("test_success_rate", Aggregation.MEAN)
            .build();
    }

}
