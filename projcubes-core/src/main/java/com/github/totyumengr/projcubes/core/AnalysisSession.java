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

import java.util.concurrent.atomic.AtomicReference;

/**
 * Named handle to a current {@link OlapCube}. Replacing the fact-table swaps the cube atomically, callers holding
 * the previous cube keep reading its immutable fact-table.
 * @author mengran
 *
 */
public final class AnalysisSession {

    private final String handle;
    private final String name;
    private final AtomicReference<OlapCube> cube;

    AnalysisSession(String handle, String name, OlapCube cube) {
        this.handle = handle;
        this.name = name;
        this.cube = new AtomicReference<OlapCube>(cube);
    }

    public String getHandle() {
        return handle;
    }

    public String getName() {
        return name;
    }

    /**
     * @return cube current at the time of call
     */
    public OlapCube cube() {
        return cube.get();
    }

    /**
     * @param factTable new source records, checked against the catalog of current cube
     * @return previous cube
     */
    OlapCube replace(FactTable factTable) {
        OlapCube previous = cube.get();
        OlapCube next = new OlapCube(factTable, previous.getCatalog().getCatalog())
                .withMargins(previous.getMargins()).withParallel(previous.isParallel());
        cube.set(next);
        return previous;
    }

    @Override
    public String toString() {
        return "AnalysisSession [handle=" + handle + ", name=" + name + ", cube=" + cube.get() + "]";
    }

}
