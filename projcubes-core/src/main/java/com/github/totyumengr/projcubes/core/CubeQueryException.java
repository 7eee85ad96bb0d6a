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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Base of structural query errors detected by cube engine. Always carry the offending names so caller can report
 * them back, an empty result is never reported by this exception.
 *
 * @author mengran
 *
 * @see SchemaException
 * @see AggregationException
 */
public abstract class CubeQueryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> names;

    protected CubeQueryException(String message, String... names) {
        super(message + " " + Arrays.toString(names));
        this.names = Collections.unmodifiableList(Arrays.asList(names));
    }

    /**
     * @return offending dimension, measure, level or aggregation names.
     */
    public List<String> getNames() {
        return names;
    }

}
