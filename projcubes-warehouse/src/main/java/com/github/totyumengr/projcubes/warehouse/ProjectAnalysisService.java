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

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.projcubes.core.AnalysisSessionManager;
import com.github.totyumengr.projcubes.core.CubeCatalog;
import com.github.totyumengr.projcubes.core.CubeResult;
import com.github.totyumengr.projcubes.core.FactTable;
import com.github.totyumengr.projcubes.core.Margins;
import com.github.totyumengr.projcubes.core.OlapCube;
import com.github.totyumengr.projcubes.core.PivotTable;

/**
 * Analysis sessions over freshly loaded project facts. Every session owns its cube, a refresh reloads the facts and
 * swaps the cube of that session only.
 * @author mengran
 *
 */
@Service
public class ProjectAnalysisService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectAnalysisService.class);

    private final AnalysisSessionManager sessionManager = new AnalysisSessionManager();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    private ProjectFactLoader loader;
    @Value("${projcubes.cube.margins:GRAND_TOTAL}")
    private Margins margins;
    @Value("${projcubes.cube.parallel:false}")
    private boolean parallel;

    /**
     * @param name session name
     * @return handle of session using the {@link ProjectCatalogs#full() full} catalog
     */
    public String open(String name) {
        return open(name, ProjectCatalogs.full());
    }

    /**
     * @param name session name
     * @param catalog names exposed by session
     * @return handle of session
     */
    public String open(String name, CubeCatalog catalog) {

        FactTable factTable = loader.loadFactTable(name);
        OlapCube cube = new OlapCube(factTable, catalog).withMargins(margins).withParallel(parallel);
        return sessionManager.open(name, cube);
    }

    public OlapCube cube(String handle) {
        return sessionManager.get(handle).cube();
    }

    /**
     * Reload facts of session, running queries keep the previous cube.
     * @param handle session handle
     * @return new cube
     */
    public OlapCube refresh(String handle) {

        String name = sessionManager.get(handle).getName();
        OlapCube cube = sessionManager.replace(handle, loader.loadFactTable(name));
        LOGGER.info("Refreshed session {} with {} records.", handle, cube.getFactTable().size());
        return cube;
    }

    public void close(String handle) {
        sessionManager.close(handle);
    }

    public List<String> handles() {
        return sessionManager.handles();
    }

    /**
     * @param handle session handle
     * @param filterDims JSON object of dimension to one member or an array of members, for example
     * <code>{"status":["Closed"],"start_year":2023}</code>. Blank means no filter.
     * @return dice of default measures
     * @throws IOException if JSON is malformed
     */
    public CubeResult dice(String handle, String filterDims) throws IOException {

        Map<String, Object> filters = !StringUtils.hasText(filterDims) ? null
                : objectMapper.readValue(filterDims, new TypeReference<Map<String, Object>>() {});
        LOGGER.debug("Dice {} by {}", handle, filters);
        OlapCube cube = cube(handle);
        if (filters == null || filters.isEmpty()) {
            return cube.aggregate(cube.getCatalog().getDimensions(), cube.defaultSpecs());
        }
        return cube.dice(filters);
    }

    public List<PivotTable> recipe(String handle, ProjectCubeRecipe recipe) {
        return recipe.build(cube(handle));
    }

    public KpiScorecard scorecard(String handle) {
        return KpiScorecard.overall(cube(handle));
    }

    public Map<Object, KpiScorecard> scorecardBy(String handle, ProjectDimension dimension) {
        return KpiScorecard.byMember(cube(handle), dimension.column());
    }

}
