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

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import com.github.totyumengr.projcubes.core.FactTable.FactTableBuilder;
import com.github.totyumengr.projcubes.core.FactTable.Record;

/**
 * @author mengran
 *
 */
public class FactTableTest {

    private static FactTable factTable;

    @BeforeClass
    public static void prepare() throws Throwable {
        factTable = ProjectFixtures.projects("FactTableTest");
    }

    @Test
    public void testMeta() throws Throwable {

        Assert.assertEquals("FactTableTest", factTable.getName());
        Assert.assertEquals(9, factTable.size());
        Assert.assertEquals(Arrays.asList("client_id", "status", "start_year", "start_period", "budget_category"),
                factTable.getDims());
        Assert.assertEquals(Arrays.asList("budget", "real_cost", "average_productivity", "test_success_rate"),
                factTable.getMeasures());
        Assert.assertEquals(3, factTable.getMeasureIndex("test_success_rate"));
        Assert.assertTrue(factTable.hasDim("status"));
        Assert.assertFalse(factTable.hasMeasure("status"));
    }

    @Test
    public void testRecord() throws Throwable {

        Record first = factTable.getRecords().get(0);
        Assert.assertEquals(0, first.getId());
        Assert.assertEquals(1L, first.getDim("client_id"));
        Assert.assertEquals(2022L, first.getDim("start_year"));
        Assert.assertEquals(new BigDecimal("40000"), first.getMeasure("budget"));

        Record cancelled = factTable.getRecords().get(2);
        Assert.assertNull(cancelled.getMeasure("average_productivity"));
        Assert.assertSame(ReservedMember.UNKNOWN, factTable.getRecords().get(8).getDim("client_id"));
    }

    @Test
    public void testMemberNormalize() throws Throwable {

        Assert.assertSame(ReservedMember.UNKNOWN, FactTable.member(null));
        Assert.assertSame(ReservedMember.UNKNOWN, FactTable.member("   "));
        Assert.assertEquals("Closed", FactTable.member(" Closed "));
        Assert.assertEquals(7L, FactTable.member(7));
        Assert.assertEquals(7L, FactTable.member(new BigDecimal("7.000")));
        Assert.assertEquals(new BigDecimal("0.85"), FactTable.member(0.85d));
        Assert.assertSame(ReservedMember.UNKNOWN, FactTable.member(Double.NaN));
        Assert.assertSame(ReservedMember.ALL, FactTable.member(ReservedMember.ALL));

        Assert.assertNull(FactTable.measure(Double.POSITIVE_INFINITY));
        Assert.assertNull(FactTable.measure("twelve"));
        Assert.assertEquals(new BigDecimal("12.5"), FactTable.measure("12.5"));
    }

    @Test
    public void testFilter() throws Throwable {

        Map<String, List<?>> filter = new HashMap<String, List<?>>();
        filter.put("status", Collections.singletonList("Closed"));
        filter.put("start_year", Arrays.asList(2022, 2024));
        List<Integer> ids = factTable.filter(filter, false).map(Record::getId).collect(Collectors.toList());
        Assert.assertEquals(Arrays.asList(0, 1, 6, 7, 8), ids);

        Assert.assertEquals(5L, factTable.filter(filter, true).count());
        Assert.assertEquals(9L, factTable.filter(null, false).count());

        filter.put("budget_category", Collections.singletonList("Tiny"));
        Assert.assertEquals(0L, factTable.filter(filter, false).count());
    }

    @Test(expected = SchemaException.class)
    public void testFilterUnknownDimension() throws Throwable {
        factTable.filter(Collections.singletonMap("region", Collections.singletonList("North")), false);
    }

    @Test
    public void testMembers() throws Throwable {

        Assert.assertEquals(4, factTable.members("client_id").size());
        Assert.assertTrue(factTable.members("client_id").contains(ReservedMember.UNKNOWN));
        Assert.assertTrue(factTable.members("status").containsAll(Arrays.asList("Closed", "Cancelled")));
    }

    @Test
    public void testBuilderMisuse() throws Throwable {

        FactTableBuilder builder = new FactTableBuilder().build("testBuilderMisuse")
            .addDimColumns(Collections.singletonList("status"))
            .addMeasureColumns(Collections.singletonList("budget"));
        try {
            builder.addMeasureColumns(Collections.singletonList("status"));
            Assert.fail();
        } catch (IllegalStateException e) {
            // Duplicate column
        }
        try {
            builder.addRow(Arrays.asList("Closed", "extra"), Collections.singletonList(1));
            Assert.fail();
        } catch (IllegalStateException e) {
            // Wrong width
        }
        try {
            Map<String, Object> row = new HashMap<String, Object>();
            row.put("region", "North");
            builder.addRow(row);
            Assert.fail();
        } catch (SchemaException e) {
            Assert.assertEquals(Collections.singletonList("region"), e.getNames());
        }

        Map<String, Object> row = new HashMap<String, Object>();
        row.put("status", "Closed");
        FactTable done = builder.addRow(row).done();
        Assert.assertEquals(1, done.size());
        Assert.assertNull(done.getRecords().get(0).getMeasure("budget"));
        try {
            builder.addRow(row);
            Assert.fail();
        } catch (IllegalStateException e) {
            // Already done
        }
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testImmutable() throws Throwable {
        factTable.getRecords().clear();
    }

}
