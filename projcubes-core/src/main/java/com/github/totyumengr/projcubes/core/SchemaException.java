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
 * Unknown dimension, measure or hierarchy level name, or a column used with the wrong role.
 * @author mengran
 *
 */
public class SchemaException extends CubeQueryException {

    private static final long serialVersionUID = 1L;

    public SchemaException(String message, String... names) {
        super(message, names);
    }

}
