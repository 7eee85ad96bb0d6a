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
import java.util.List;
import java.util.function.Function;

import org.springframework.util.Assert;

import com.github.totyumengr.projcubes.core.Aggregator.Grouping;

/**
 * Ordered levels of a roll-up, from most to least granular. A level is another dimension column of the same record,
 * a transform of the rolled dimension member, or the {@link ReservedMember#TOTAL} sentinel which may only be the last
 * level.
 * @author mengran
 *
 */
public final class Hierarchy {

    /**
     * Name of the sentinel level in {@link #of(String...)}.
     */
    public static final String TOTAL = "TOTAL";

    /**
     * One level of hierarchy.
     * @author mengran
     *
     */
    public static final class Level {

        private final String name;
        private final Function<Object, Object> transform;
        private final boolean total;

        private Level(String name, Function<Object, Object> transform, boolean total) {
            this.name = name;
            this.transform = transform;
            this.total = total;
        }

        /**
         * @param dimName dimension column holding the coarser member
         * @return column level
         */
        public static Level column(String dimName) {
            Assert.hasText(dimName, "Level name can not empty.");
            return new Level(dimName, null, false);
        }

        /**
         * @param name level name, used as result label
         * @param transform rolled member to coarser member, never called with {@link ReservedMember#UNKNOWN}
         * @return derived level
         */
        public static Level derived(String name, Function<Object, Object> transform) {
            Assert.hasText(name, "Level name can not empty.");
            Assert.notNull(transform, "Level transform can not null.");
            return new Level(name, transform, false);
        }

        public static Level total() {
            return new Level(TOTAL, null, true);
        }

        public String getName() {
            return name;
        }

        public boolean isTotal() {
            return total;
        }

        /**
         * @param factTable source records
         * @param dimName rolled dimension, keeps its name in result
         * @return grouping replacing member of rolled dimension by level member
         * @throws SchemaException if a column is not a dimension of fact-table
         */
        Grouping grouping(FactTable factTable, String dimName) {

            final int dimIndex = factTable.getDimIndex(dimName);
            if (total) {
                return Grouping.of(dimName, r -> ReservedMember.TOTAL);
            }
            if (transform != null) {
                return Grouping.of(dimName, r -> {
                    Object member = r.getDim(dimIndex);
                    return member == ReservedMember.UNKNOWN ? member : FactTable.member(transform.apply(member));
                });
            }
            final int levelIndex = factTable.getDimIndex(name);
            return Grouping.of(dimName, r -> r.getDim(levelIndex));
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private final List<Level> levels;

    public Hierarchy(List<Level> levels) {

        Assert.notEmpty(levels, "Hierarchy needs at least one level.");
        for (int i = 0; i < levels.size() - 1; i++) {
            if (levels.get(i).isTotal()) {
                throw new SchemaException("TOTAL must be the last level", levels.get(i + 1).getName());
            }
        }
        this.levels = Collections.unmodifiableList(new ArrayList<Level>(levels));
    }

    /**
     * @param levelNames dimension columns, {@link #TOTAL} means the sentinel level
     * @return hierarchy of column levels
     */
    public static Hierarchy of(String... levelNames) {

        List<Level> levels = new ArrayList<Level>(levelNames.length);
        for (String name : levelNames) {
            levels.add(TOTAL.equals(name) ? Level.total() : Level.column(name));
        }
        return new Hierarchy(levels);
    }

    public static Hierarchy of(Level... levels) {
        return new Hierarchy(Arrays.asList(levels));
    }

    public List<Level> getLevels() {
        return levels;
    }

    public int size() {
        return levels.size();
    }

    public Level getLevel(int index) {
        if (index < 0 || index >= levels.size()) {
            throw new SchemaException("Unknown level index", String.valueOf(index));
        }
        return levels.get(index);
    }

    @Override
    public String toString() {
        return "Hierarchy " + levels;
    }

}
