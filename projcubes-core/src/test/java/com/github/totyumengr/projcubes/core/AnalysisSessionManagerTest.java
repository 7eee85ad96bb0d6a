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

import org.junit.Assert;
import org.junit.Test;

import com.github.totyumengr.projcubes.core.FactTable.FactTableBuilder;

/**
 * @author mengran
 *
 */
public class AnalysisSessionManagerTest {

    private static final MeasureSpec BUDGET = MeasureSpec.sum("budget");

    private static FactTable extra() {
        return new FactTableBuilder().build("extra")
            .addDimColumns(Arrays.asList("client_id", "status", "start_year", "start_period", "budget_category"))
            .addMeasureColumns(Arrays.asList("budget", "real_cost", "average_productivity", "test_success_rate"))
            .addRow(Arrays.asList(9, "Closed", 2025, "2025-Q1", "Small"), Arrays.asList(1000, 900, 100, 0.5))
            .done();
    }

    @Test
    public void testOpenGetClose() throws Throwable {

        AnalysisSessionManager manager = new AnalysisSessionManager();
        String handle = manager.open("projects", ProjectFixtures.projects("testOpenGetClose"),
                ProjectFixtures.catalog());
        String other = manager.open("projects", ProjectFixtures.projects("testOpenGetClose"),
                ProjectFixtures.catalog());
        Assert.assertNotEquals(handle, other);
        Assert.assertEquals(2, manager.handles().size());

        AnalysisSession session = manager.get(handle);
        Assert.assertEquals("projects", session.getName());
        Assert.assertEquals("900000.00000000", session.cube().aggregate(Collections.<String>emptyList(),
                Collections.singletonList(BUDGET)).get(BUDGET).toString());

        manager.close(handle);
        Assert.assertEquals(Collections.singletonList(other), manager.handles());
        try {
            manager.get(handle);
            Assert.fail();
        } catch (IllegalArgumentException e) {
            // Closed
        }
        try {
            manager.close(handle);
            Assert.fail();
        } catch (IllegalArgumentException e) {
            // Closed
        }
    }

    @Test
    public void testReplace() throws Throwable {

        AnalysisSessionManager manager = new AnalysisSessionManager();
        OlapCube cube = new OlapCube(ProjectFixtures.projects("testReplace"), ProjectFixtures.catalog())
            .withMargins(Margins.ALL_SUBTOTALS);
        String handle = manager.open("projects", cube);

        OlapCube before = manager.get(handle).cube();
        OlapCube after = manager.replace(handle, extra());
        Assert.assertSame(after, manager.get(handle).cube());
        Assert.assertEquals(Margins.ALL_SUBTOTALS, after.getMargins());

        // Previous cube still answers from its own records
        Assert.assertEquals(9, before.describe().getRecordCount());
        Assert.assertEquals(1, after.describe().getRecordCount());
        Assert.assertEquals("1000.00000000", after.slice("status", "Closed", Collections.singletonList(BUDGET))
            .grandTotal().get(BUDGET).toString());
    }

    @Test
    public void testReplaceMismatchedSchema() throws Throwable {

        AnalysisSessionManager manager = new AnalysisSessionManager();
        String handle = manager.open("projects", ProjectFixtures.projects("testReplaceMismatchedSchema"),
                ProjectFixtures.catalog());
        FactTable narrow = new FactTableBuilder().build("narrow")
            .addDimColumns(Collections.singletonList("status"))
            .addMeasureColumns(Collections.singletonList("budget"))
            .done();
        try {
            manager.replace(handle, narrow);
            Assert.fail();
        } catch (SchemaException e) {
            Assert.assertTrue(e.getNames().contains("client_id"));
        }
        Assert.assertEquals(9, manager.get(handle).cube().describe().getRecordCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownHandle() throws Throwable {
        new AnalysisSessionManager().replace("nothing-1", extra());
    }

}
