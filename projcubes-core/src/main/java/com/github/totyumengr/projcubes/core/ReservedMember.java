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

/**
 * Pseudo members of a dimension. They never collide with data values even when a data value has the same text,
 * because they are compared by identity.
 *
 * @author mengran
 *
 */
public enum ReservedMember {

    /**
     * Missing dimension value, a bucket of its own.
     */
    UNKNOWN("(unknown)"),
    /**
     * Margin member, stands for every member of the dimension.
     */
    ALL("ALL"),
    /**
     * Top level of a roll-up hierarchy.
     */
    TOTAL("TOTAL");

    private final String label;

    private ReservedMember(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
