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
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Keeps {@link AnalysisSession}s addressed by handle. Sessions are independent of each other, nothing is shared
 * between them except this registry.
 * @author mengran
 *
 */
public class AnalysisSessionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisSessionManager.class);

    private final Map<String, AnalysisSession> sessions = new ConcurrentHashMap<String, AnalysisSession>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param name session name
     * @param factTable source records
     * @param catalog names exposed
     * @return handle of new session
     * @throws SchemaException if catalog does not match fact-table
     */
    public String open(String name, FactTable factTable, CubeCatalog catalog) {
        return open(name, new OlapCube(factTable, catalog));
    }

    /**
     * @param name session name
     * @param cube configured cube
     * @return handle of new session
     */
    public String open(String name, OlapCube cube) {

        Assert.hasText(name, "Session name can not empty.");
        Assert.notNull(cube, "Cube can not null.");
        String handle = name + "-" + sequence.incrementAndGet();
        sessions.put(handle, new AnalysisSession(handle, name, cube));
        LOGGER.info("Opened session {} on {} with {} records.", handle, cube.getFactTable().getName(),
                cube.getFactTable().size());
        return handle;
    }

    /**
     * @param handle session handle
     * @return session
     * @throws IllegalArgumentException if handle is unknown
     */
    public AnalysisSession get(String handle) {

        AnalysisSession session = handle == null ? null : sessions.get(handle);
        if (session == null) {
            throw new IllegalArgumentException("Unknown session handle " + handle);
        }
        return session;
    }

    /**
     * Swap fact-table of session, running queries keep the previous cube.
     * @param handle session handle
     * @param factTable new source records
     * @return new current cube
     * @throws IllegalArgumentException if handle is unknown
     */
    public OlapCube replace(String handle, FactTable factTable) {

        AnalysisSession session = get(handle);
        OlapCube current;
        synchronized (session) {
            OlapCube previous = session.replace(factTable);
            current = session.cube();
            LOGGER.info("Replaced fact-table of session {}: {} records to {} records.", handle,
                    previous.getFactTable().size(), factTable.size());
        }
        return current;
    }

    /**
     * @param handle session handle
     * @throws IllegalArgumentException if handle is unknown
     */
    public void close(String handle) {

        if (handle == null || sessions.remove(handle) == null) {
            throw new IllegalArgumentException("Unknown session handle " + handle);
        }
        LOGGER.info("Closed session {}", handle);
    }

    /**
     * @return handles of open sessions
     */
    public List<String> handles() {
        return new ArrayList<String>(sessions.keySet());
    }

}
