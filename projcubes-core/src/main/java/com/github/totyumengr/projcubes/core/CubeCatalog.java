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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Names of dimensions and measures a cube exposes, with the default {@link Aggregation} of every measure. Default
 * aggregations come from an explicit table, measures without an entry are summed.
 *
 * <p>Build by {@link #builder()}, then {@link #resolve(FactTable)} checks every name against a fact-table.
 * @author mengran
 *
 */
public final class CubeCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(CubeCatalog.class);

    private final List<String> dimensions;
    private final Map<String, Aggregation> defaults;

    private CubeCatalog(List<String> dimensions, Map<String, Aggregation> defaults) {
        this.dimensions = Collections.unmodifiableList(dimensions);
        this.defaults = Collections.unmodifiableMap(defaults);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param factTable source
     * @return catalog of every column, measures summed
     */
    public static CubeCatalog fromFactTable(FactTable factTable) {

        Builder builder = builder().dimensions(factTable.getDims());
        for (String measure : factTable.getMeasures()) {
            builder.measure(measure);
        }
        return builder.build();
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public List<String> getMeasures() {
        return new ArrayList<String>(defaults.keySet());
    }

    /**
     * @param measure catalog measure
     * @return default aggregation
     * @throws SchemaException if measure is not in catalog
     */
    public Aggregation defaultAggregation(String measure) {
        Aggregation aggregation = defaults.get(measure);
        if (aggregation == null) {
            throw new SchemaException("Measure not in catalog", String.valueOf(measure));
        }
        return aggregation;
    }

    /**
     * Check every name against fact-table.
     * @param factTable source
     * @return resolved catalog
     * @throws SchemaException if a name is absent or a dimension is a measure column
     * @throws AggregationException if a measure is a dimension column
     */
    public Resolved resolve(FactTable factTable) {

        List<String> missing = new ArrayList<String>();
        List<String> notDimension = new ArrayList<String>();
        List<String> notNumeric = new ArrayList<String>();
        for (String dim : dimensions) {
            if (factTable.hasMeasure(dim)) {
                notDimension.add(dim);
            } else if (!factTable.hasDim(dim)) {
                missing.add(dim);
            }
        }
        for (String measure : defaults.keySet()) {
            if (factTable.hasDim(measure)) {
                notNumeric.add(measure);
            } else if (!factTable.hasMeasure(measure)) {
                missing.add(measure);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException("Catalog names absent from fact-table " + factTable.getName(),
                    missing.toArray(new String[0]));
        }
        if (!notDimension.isEmpty()) {
            throw new SchemaException("Catalog dimensions are measure columns", notDimension.toArray(new String[0]));
        }
        if (!notNumeric.isEmpty()) {
            throw new AggregationException("Catalog measures are non-numeric columns",
                    notNumeric.toArray(new String[0]));
        }
        LOGGER.debug("Resolved catalog {} against {}", this, factTable.getName());
        return new Resolved(this);
    }

    @Override
    public String toString() {
        return "CubeCatalog [dimensions=" + dimensions + ", defaults=" + defaults + "]";
    }

    /**
     * Catalog checked against a fact-table.
     * @author mengran
     *
     */
    public static final class Resolved {

        private final CubeCatalog catalog;
        private final List<MeasureSpec> defaultSpecs;

        private Resolved(CubeCatalog catalog) {
            this.catalog = catalog;
            List<MeasureSpec> specs = new ArrayList<MeasureSpec>(catalog.defaults.size());
            for (Entry<String, Aggregation> e : catalog.defaults.entrySet()) {
                specs.add(MeasureSpec.of(e.getKey(), e.getValue()));
            }
            this.defaultSpecs = Collections.unmodifiableList(specs);
        }

        public List<String> getDimensions() {
            return catalog.dimensions;
        }

        public List<String> getMeasures() {
            return catalog.getMeasures();
        }

        public Map<String, Aggregation> getDefaults() {
            return catalog.defaults;
        }

        /**
         * @return every catalog measure with its default aggregation, in catalog order
         */
        public List<MeasureSpec> defaultSpecs() {
            return defaultSpecs;
        }

        public boolean hasDimension(String dimName) {
            return catalog.dimensions.contains(dimName);
        }

        /**
         * @param dimName name to check
         * @throws SchemaException if name is not a catalog dimension
         */
        public void checkDimension(String dimName) {
            if (!hasDimension(dimName)) {
                throw new SchemaException("Unknown dimension", String.valueOf(dimName));
            }
        }

        public CubeCatalog getCatalog() {
            return catalog;
        }
    }

    /**
     * Collect dimensions and the default aggregation table. Duplicate names fail when added.
     * @author mengran
     *
     */
    public static final class Builder {

        private final List<String> dimensions = new ArrayList<String>();
        private final Map<String, Aggregation> defaults = new LinkedHashMap<String, Aggregation>();

        private Builder() {
        }

        public Builder dimension(String... dimNames) {
            return dimensions(Arrays.asList(dimNames));
        }

        public Builder dimensions(List<String> dimNames) {
            for (String dimName : dimNames) {
                Assert.hasText(dimName, "Dimension name can not empty.");
                if (dimensions.contains(dimName) || defaults.containsKey(dimName)) {
                    throw new IllegalStateException("Catalog name " + dimName + " has exists.");
                }
                dimensions.add(dimName);
            }
            return this;
        }

        /**
         * Measure with default aggregation {@link Aggregation#SUM}.
         */
        public Builder measure(String measure) {
            return measure(measure, Aggregation.SUM);
        }

        public Builder measure(String measure, Aggregation aggregation) {
            Assert.hasText(measure, "Measure name can not empty.");
            Assert.notNull(aggregation, "Aggregation can not null.");
            if (dimensions.contains(measure) || defaults.containsKey(measure)) {
                throw new IllegalStateException("Catalog name " + measure + " has exists.");
            }
            defaults.put(measure, aggregation);
            return this;
        }

        public CubeCatalog build() {
            return new CubeCatalog(new ArrayList<String>(dimensions),
                    new LinkedHashMap<String, Aggregation>(defaults));
        }
    }

}
