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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a cube: catalog names, record count and distinct member count of every dimension.
 * @author mengran
 *
 */
public final class CubeInfo {

    private final String name;
    private final List<String> dimensions;
    private final Map<String, Aggregation> measures;
    private final int recordCount;
    private final Map<String, Integer> memberCounts;

    CubeInfo(FactTable factTable, CubeCatalog.Resolved catalog) {
        this.name = factTable.getName();
        this.dimensions = catalog.getDimensions();
        this.measures = catalog.getDefaults();
        this.recordCount = factTable.size();
        Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
        for (String dim : dimensions) {
            counts.put(dim, factTable.members(dim).size());
        }
        this.memberCounts = Collections.unmodifiableMap(counts);
    }

    public String getName() {
        return name;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    /**
     * @return measure to default aggregation, in catalog order
     */
    public Map<String, Aggregation> getMeasures() {
        return measures;
    }

    public int getRecordCount() {
        return recordCount;
    }

    /**
     * @return dimension to distinct member count, {@link ReservedMember#UNKNOWN} counted as a member
     */
    public Map<String, Integer> getMemberCounts() {
        return memberCounts;
    }

    @Override
    public String toString() {
        return "CubeInfo [name=" + name + ", dimensions=" + dimensions + ", measures=" + measures + ", recordCount="
                + recordCount + ", memberCounts=" + memberCounts + "]";
    }

}
