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

/**
 * Dimension columns of the project fact-table.
 * @author mengran
 *
 */
public enum ProjectDimension {

    CLIENT_ID("client_id"),
    STATUS("status"),
    START_YEAR("start_year"),
    START_MONTH("start_month"),
    /**
     * <code>YYYY-Qn</code>
     */
    START_PERIOD("start_period"),
    BUDGET_CATEGORY("budget_category"),
    DEVIATION_TYPE("deviation_type"),
    PRODUCTIVITY_CATEGORY("productivity_category"),
    QUALITY_CATEGORY("quality_category");

    private final String column;

    private ProjectDimension(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public static List<String> columns(ProjectDimension... dimensions) {
        List<String> columns = new ArrayList<String>(dimensions.length);
        for (ProjectDimension d : dimensions) {
            columns.add(d.column);
        }
        return columns;
    }

    public static List<String> columns() {
        return columns(values());
    }

}
