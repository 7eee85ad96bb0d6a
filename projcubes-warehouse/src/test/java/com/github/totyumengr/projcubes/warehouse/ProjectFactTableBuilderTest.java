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
package com.github.totyumengr.projcubes.warehouse;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

import com.github.totyumengr.projcubes.core.FactTable;
import com.github.totyumengr.projcubes.core.FactTable.Record;
import com.github.totyumengr.projcubes.core.ReservedMember;

/**
 * @author mengran
 *
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class ProjectFactTableBuilderTest {

    private static FactTable factTable;

    @BeforeClass
    public static void prepare() throws Throwable {
        factTable = WarehouseFixtures.factTable("ProjectFactTableBuilderTest");
    }

    private static BigDecimal d(String value) {
        return new BigDecimal(value);
    }

    @Test
    public void test_1_1_Columns() throws Throwable {

        Assert.assertEquals(ProjectDimension.columns(), factTable.getDims());
        Assert.assertEquals(ProjectMeasure.columns(), factTable.getMeasures());
        Assert.assertEquals(4, factTable.size());
    }

    @Test
    public void test_1_2_Status_Period() throws Throwable {

        Assert.assertEquals("Closed", ProjectFactTableBuilder.status(0));
        Assert.assertEquals("Cancelled", ProjectFactTableBuilder.status(1));
        Assert.assertNull(ProjectFactTableBuilder.status(null));

        Assert.assertEquals("2023-Q1", ProjectFactTableBuilder.startPeriod(2023, 3));
        Assert.assertEquals("2023-Q2", ProjectFactTableBuilder.startPeriod(2023, 4));
        Assert.assertEquals("2024-Q4", ProjectFactTableBuilder.startPeriod(2024, 12));
        Assert.assertNull(ProjectFactTableBuilder.startPeriod(2024, 13));
        Assert.assertNull(ProjectFactTableBuilder.startPeriod(null, 1));
    }

    @Test
    public void test_1_3_Categories_Bin_Edges() throws Throwable {

        Assert.assertNull(ProjectFactTableBuilder.budgetCategory(BigDecimal.ZERO));
        Assert.assertEquals("Small", ProjectFactTableBuilder.budgetCategory(d("50000")));
        Assert.assertEquals("Medium", ProjectFactTableBuilder.budgetCategory(d("50000.01")));
        Assert.assertEquals("Large", ProjectFactTableBuilder.budgetCategory(d("200000")));
        Assert.assertEquals("Mega", ProjectFactTableBuilder.budgetCategory(d("200001")));

        Assert.assertEquals("Low", ProjectFactTableBuilder.productivityCategory(d("200")));
        Assert.assertEquals("Very High", ProjectFactTableBuilder.productivityCategory(d("900")));
        Assert.assertNull(ProjectFactTableBuilder.productivityCategory(null));

        Assert.assertEquals("Medium", ProjectFactTableBuilder.qualityCategory(d("0.85")));
        Assert.assertEquals("Excellent", ProjectFactTableBuilder.qualityCategory(d("1")));
        Assert.assertNull(ProjectFactTableBuilder.qualityCategory(d("1.2")));

        Assert.assertEquals("Over Budget", ProjectFactTableBuilder.deviationType(d("-1")));
        Assert.assertEquals("On Budget", ProjectFactTableBuilder.deviationType(d("0.00")));
        Assert.assertEquals("Under Budget", ProjectFactTableBuilder.deviationType(d("3")));
    }

    @Test
    public void test_1_4_Ratios() throws Throwable {

        Assert.assertEquals(0, d("-25").compareTo(ProjectFactTableBuilder.roi(d("40000"), d("50000"))));
        Assert.assertEquals(0, d("0.8").compareTo(ProjectFactTableBuilder.budgetEfficiency(d("40000"), d("50000"))));
        Assert.assertNull(ProjectFactTableBuilder.budgetEfficiency(d("40000"), BigDecimal.ZERO));
        // 0.9 * 0.4 + 0.9 * 0.6
        Assert.assertEquals(0, d("0.9").compareTo(ProjectFactTableBuilder.qualityIndicator(d("0.9"), d("10"))));

        Assert.assertEquals(0, d("0.8").compareTo(ProjectFactTableBuilder.budgetCompliance(d("40000"), d("50000"))));
        Assert.assertEquals(0, BigDecimal.ONE.compareTo(
                ProjectFactTableBuilder.budgetCompliance(d("80000"), d("20000"))));
        Assert.assertEquals(0, BigDecimal.ZERO.compareTo(
                ProjectFactTableBuilder.budgetCompliance(BigDecimal.ZERO, d("20000"))));

        Assert.assertEquals(0, d("25").compareTo(ProjectFactTableBuilder.deviationPercent(d("40000"), d("50000"))));
        Assert.assertEquals(0, d("75").compareTo(ProjectFactTableBuilder.deviationPercent(d("80000"), d("20000"))));
        Assert.assertEquals(0, d("2.5").compareTo(ProjectFactTableBuilder.penaltyPercent(d("40000"), d("1000"))));
    }

    @Test
    public void test_2_1_Derived_Record() throws Throwable {

        Record first = factTable.getRecords().get(0);
        Assert.assertEquals("C001", first.getDim("client_id"));
        Assert.assertEquals("Closed", first.getDim("status"));
        Assert.assertEquals(2023L, first.getDim("start_year"));
        Assert.assertEquals("2023-Q1", first.getDim("start_period"));
        Assert.assertEquals("Small", first.getDim("budget_category"));
        Assert.assertEquals("Over Budget", first.getDim("deviation_type"));
        Assert.assertEquals("Medium", first.getDim("productivity_category"));
        Assert.assertEquals("High", first.getDim("quality_category"));
        Assert.assertEquals(0, d("-10000").compareTo(first.getMeasure("budget_deviation")));
        Assert.assertEquals(0, BigDecimal.ONE.compareTo(first.getMeasure("on_time")));
        Assert.assertEquals(0, BigDecimal.ZERO.compareTo(first.getMeasure("cancelled")));
    }

    @Test
    public void test_2_2_Missing_Values() throws Throwable {

        Record cancelled = factTable.getRecords().get(2);
        Assert.assertEquals("Cancelled", cancelled.getDim("status"));
        Assert.assertNull(cancelled.getMeasure("on_time"));

        ProjectRecord blank = new ProjectRecord();
        blank.setProjectId(99L);
        FactTable table = new ProjectFactTableBuilder().build("blank", Arrays.asList(blank));
        Record r = table.getRecords().get(0);
        for (String dim : table.getDims()) {
            Assert.assertEquals(dim, ReservedMember.UNKNOWN, r.getDim(dim));
        }
        Assert.assertNull(r.getMeasure("budget_compliance"));
        Assert.assertEquals(0, d("99").compareTo(r.getMeasure("project_id")));
    }

    @Test
    public void test_2_3_Stored_Deviation_Wins() throws Throwable {

        ProjectRecord r = WarehouseFixtures.record(1, "C009", 0, 2024, 2, 0, "1000", "900", "0", "0", "1", "100",
                "0", "0");
        r.setBudgetDeviation(d("-5"));
        List<Object> dims = new ProjectFactTableBuilder().dimensions(r);
        Assert.assertEquals("Over Budget", dims.get(ProjectDimension.DEVIATION_TYPE.ordinal()));
    }

}
