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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import com.github.totyumengr.projcubes.core.FactTable.FactTableBuilder;

/**
 * @author mengran
 *
 */
public class AggregatorTest {

    private static final MeasureSpec SUM = MeasureSpec.sum("budget");
    private static final MeasureSpec COUNT = MeasureSpec.count("budget");
    private static final MeasureSpec MEAN = MeasureSpec.mean("budget");
    private static final MeasureSpec MIN = MeasureSpec.min("budget");
    private static final MeasureSpec MAX = MeasureSpec.max("budget");

    private static FactTable statusBudget;

    @BeforeClass
    public static void prepare() throws Throwable {

        statusBudget = new FactTableBuilder().build("AggregatorTest")
            .addDimColumns(Collections.singletonList("status"))
            .addMeasureColumns(Collections.singletonList("budget"))
            .addRow(Collections.singletonList("Closed"), Collections.singletonList(100))
            .addRow(Collections.singletonList("Closed"), Collections.singletonList(200))
            .addRow(Collections.singletonList("Cancelled"), Collections.singletonList(50))
            .addRow(Collections.singletonList("Closed"), Collections.singletonList(300))
            .addRow(Collections.singletonList("Cancelled"), Collections.singletonList(150))
            .done();
    }

    @Test
    public void testSumByStatus() throws Throwable {

        CubeResult result = new Aggregator(statusBudget, false).aggregate(Collections.singletonList("status"),
                Collections.singletonList(SUM), Margins.GRAND_TOTAL);
        Assert.assertEquals(3, result.size());
        Assert.assertEquals(2, result.bucketCount());
        Assert.assertEquals("600.00000000", result.get(SUM, "Closed").toString());
        Assert.assertEquals("200.00000000", result.get(SUM, "Cancelled").toString());
        Assert.assertEquals("800.00000000", result.get(SUM, ReservedMember.ALL).toString());
        Assert.assertEquals(DimensionKey.of(ReservedMember.ALL), result.grandTotalKey());
    }

    @Test
    public void testSliceWorkedExample() throws Throwable {

        CubeResult result = new OlapCube(statusBudget, CubeCatalog.fromFactTable(statusBudget))
            .slice("status", "Closed", Arrays.asList(COUNT, SUM));
        Assert.assertTrue(result.getDimensions().isEmpty());
        Assert.assertEquals("3", result.get(COUNT).toString());
        Assert.assertEquals("600.00000000", result.get(SUM).toString());
    }

    @Test
    public void testEveryAggregation() throws Throwable {

        CubeResult result = new Aggregator(statusBudget, false).aggregate(Collections.<String>emptyList(),
                Arrays.asList(SUM, COUNT, MEAN, MIN, MAX), Margins.GRAND_TOTAL);
        Map<MeasureSpec, AggregateValue> all = result.get(DimensionKey.EMPTY);
        Assert.assertEquals(1, result.size());
        Assert.assertEquals("800.00000000", all.get(SUM).toString());
        Assert.assertEquals("5", all.get(COUNT).toString());
        Assert.assertEquals("160.00000000", all.get(MEAN).toString());
        Assert.assertEquals("50.00000000", all.get(MIN).toString());
        Assert.assertEquals("300.00000000", all.get(MAX).toString());
        // Keys follow request order
        Assert.assertEquals(Arrays.asList(SUM, COUNT, MEAN, MIN, MAX), Arrays.asList(all.keySet().toArray()));
    }

    @Test
    public void testMissingValues() throws Throwable {

        FactTable factTable = new FactTableBuilder().build("testMissingValues")
            .addDimColumns(Collections.singletonList("status"))
            .addMeasureColumns(Collections.singletonList("budget"))
            .addRow(Collections.singletonList("Closed"), Collections.singletonList(10))
            .addRow(Collections.singletonList("Closed"), Collections.singletonList(null))
            .addRow(Collections.singletonList("Closed"), Collections.singletonList(Double.NaN))
            .addRow(Collections.singletonList("Cancelled"), Collections.singletonList("n/a"))
            .addRow(Collections.singletonList(null), Collections.singletonList(" 5.5 "))
            .done();

        CubeResult result = new Aggregator(factTable, false).aggregate(Collections.singletonList("status"),
                Arrays.asList(SUM, COUNT, MEAN, MIN), Margins.GRAND_TOTAL);

        Assert.assertEquals("10.00000000", result.get(SUM, "Closed").toString());
        Assert.assertEquals("3", result.get(COUNT, "Closed").toString());
        Assert.assertEquals("10.00000000", result.get(MEAN, "Closed").toString());

        // No numeric value: sum is zero, mean and min have no value
        Assert.assertEquals(AggregateValue.of(BigDecimal.ZERO), result.get(SUM, "Cancelled"));
        Assert.assertEquals("1", result.get(COUNT, "Cancelled").toString());
        Assert.assertSame(AggregateValue.NO_VALUE, result.get(MEAN, "Cancelled"));
        Assert.assertSame(AggregateValue.NO_VALUE, result.get(MIN, "Cancelled"));
        Assert.assertFalse(result.get(MEAN, "Cancelled").isPresent());

        Assert.assertEquals("5.50000000", result.get(SUM, ReservedMember.UNKNOWN).toString());
        // Mean of margin is sum / numeric count of all records
        Assert.assertEquals("7.75000000", result.get(MEAN, ReservedMember.ALL).toString());
        Assert.assertEquals("5", result.get(COUNT, ReservedMember.ALL).toString());

        Assert.assertEquals(Arrays.asList(DimensionKey.of("Cancelled"), DimensionKey.of("Closed"),
                DimensionKey.of(ReservedMember.UNKNOWN), DimensionKey.of(ReservedMember.ALL)),
                Arrays.asList(result.keys().toArray()));
    }

    @Test
    public void testEmptyFactTable() throws Throwable {

        FactTable empty = new FactTableBuilder().build("testEmptyFactTable")
            .addDimColumns(Collections.singletonList("status"))
            .addMeasureColumns(Collections.singletonList("budget"))
            .done();

        CubeResult result = new Aggregator(empty, false).aggregate(Collections.singletonList("status"),
                Collections.singletonList(SUM), Margins.ALL_SUBTOTALS);
        Assert.assertTrue(result.isEmpty());
        Assert.assertNull(result.grandTotal());

        Assert.assertTrue(new Aggregator(empty, true).aggregate(Collections.<String>emptyList(),
                Collections.singletonList(MEAN), Margins.GRAND_TOTAL).isEmpty());
    }

    @Test
    public void testMarginsNone() throws Throwable {

        CubeResult result = new Aggregator(statusBudget, false).aggregate(Collections.singletonList("status"),
                Collections.singletonList(SUM), Margins.NONE);
        Assert.assertEquals(2, result.size());
        Assert.assertNull(result.grandTotal());
    }

    @Test
    public void testPartialStatesMerge() throws Throwable {

        // Associative and commutative: any split of records merges to the whole
        List<Integer> values = Arrays.asList(100, 200, 50, 300, 150);
        AggregateState whole = new AggregateState();
        AggregateState left = new AggregateState();
        AggregateState right = new AggregateState();
        for (int i = 0; i < values.size(); i++) {
            BigDecimal v = FactTable.measure(values.get(i));
            whole.accept(v);
            (i % 2 == 0 ? left : right).accept(v);
        }
        AggregateState merged = right.copy().merge(left);
        for (Aggregation aggregation : Aggregation.values()) {
            Assert.assertEquals(whole.value(aggregation), merged.value(aggregation));
        }
    }

    @Test
    public void testParallelEqualsSequential() throws Throwable {

        FactTableBuilder builder = new FactTableBuilder().build("testParallelEqualsSequential")
            .addDimColumns(Arrays.asList("a", "b"))
            .addMeasureColumns(Collections.singletonList("budget"));
        for (int i = 0; i < 20000; i++) {
            builder.addRow(Arrays.asList(i % 7, "m" + (i % 13)),
                    Collections.singletonList(i % 11 == 0 ? null : new BigDecimal(i).movePointLeft(2)));
        }
        FactTable factTable = builder.done();

        List<MeasureSpec> specs = Arrays.asList(SUM, COUNT, MEAN, MIN, MAX);
        CubeResult sequential = new Aggregator(factTable, false).aggregate(Arrays.asList("a", "b"), specs,
                Margins.ALL_SUBTOTALS);
        CubeResult parallel = new Aggregator(factTable, true).aggregate(Arrays.asList("a", "b"), specs,
                Margins.ALL_SUBTOTALS);

        Assert.assertEquals(7 * 13 + 7 + 13 + 1, sequential.size());
        Assert.assertEquals(Arrays.asList(sequential.keys().toArray()), Arrays.asList(parallel.keys().toArray()));
        for (DimensionKey key : sequential.keys()) {
            Assert.assertEquals(sequential.get(key), parallel.get(key));
        }
    }

    @Test
    public void testInvalidMeasures() throws Throwable {

        Aggregator aggregator = new Aggregator(statusBudget, false);
        try {
            aggregator.aggregate(Collections.singletonList("status"),
                    Collections.singletonList(MeasureSpec.sum("status")), Margins.NONE);
            Assert.fail();
        } catch (AggregationException e) {
            Assert.assertEquals(Collections.singletonList("status"), e.getNames());
        }
        try {
            aggregator.aggregate(Collections.singletonList("status"),
                    Collections.singletonList(MeasureSpec.sum("revenue")), Margins.NONE);
            Assert.fail();
        } catch (SchemaException e) {
            Assert.assertEquals(Collections.singletonList("revenue"), e.getNames());
        }
        try {
            aggregator.aggregate(Collections.singletonList("region"), Collections.singletonList(SUM), Margins.NONE);
            Assert.fail();
        } catch (SchemaException e) {
            Assert.assertEquals(Collections.singletonList("region"), e.getNames());
        }
    }

    @Test
    public void testParseAggregation() throws Throwable {

        Assert.assertEquals(Aggregation.MEAN, Aggregation.parse("avg"));
        Assert.assertEquals(Aggregation.MEAN, Aggregation.parse(" Mean "));
        Assert.assertEquals(Aggregation.COUNT, Aggregation.parse("count"));
        try {
            Aggregation.parse("median");
            Assert.fail();
        } catch (AggregationException e) {
            Assert.assertEquals(Collections.singletonList("median"), e.getNames());
        }
    }

    @Test
    public void testNumericMemberOrder() throws Throwable {

        FactTable factTable = new FactTableBuilder().build("testNumericMemberOrder")
            .addDimColumns(Collections.singletonList("score"))
            .addMeasureColumns(Collections.singletonList("budget"))
            .addRow(Collections.singletonList(100), Collections.singletonList(1))
            .addRow(Collections.singletonList(new BigDecimal("1.5")), Collections.singletonList(2))
            .addRow(Collections.singletonList(2), Collections.singletonList(3))
            .addRow(Collections.singletonList("n/a"), Collections.singletonList(4))
            .done();

        CubeResult result = new Aggregator(factTable, false).aggregate(Collections.singletonList("score"),
                Collections.singletonList(SUM), Margins.GRAND_TOTAL);
        // Long and BigDecimal members compare by value, not by text
        Assert.assertEquals(Arrays.asList(DimensionKey.of(new BigDecimal("1.5")), DimensionKey.of(2),
                DimensionKey.of(100), DimensionKey.of("n/a"), DimensionKey.of(ReservedMember.ALL)),
                Arrays.asList(result.keys().toArray()));

        Assert.assertTrue(DimensionKey.MEMBER_ORDER.compare(new BigDecimal("1.5"), 2L) < 0);
        Assert.assertTrue(DimensionKey.MEMBER_ORDER.compare(100L, new BigDecimal("99.5")) > 0);
        Assert.assertTrue(DimensionKey.MEMBER_ORDER.compare(9L, 10L) < 0);
    }

    @Test
    public void testResultIsReadOnly() throws Throwable {

        CubeResult result = new Aggregator(statusBudget, false).aggregate(Collections.singletonList("status"),
                Collections.singletonList(SUM), Margins.GRAND_TOTAL);
        Map<MeasureSpec, AggregateValue> closed = result.get(DimensionKey.of("Closed"));
        try {
            closed.put(SUM, AggregateValue.of(BigDecimal.ZERO));
            Assert.fail();
        } catch (UnsupportedOperationException e) {
            // Expected
        }
        try {
            result.grandTotal().clear();
            Assert.fail();
        } catch (UnsupportedOperationException e) {
            // Expected
        }
        Assert.assertEquals("600.00000000", result.get(SUM, "Closed").toString());
        Assert.assertEquals("800.00000000", result.grandTotal().get(SUM).toString());
    }

    @Test
    public void testGrandTotalManyDimensions() throws Throwable {

        List<String> dims = new ArrayList<String>();
        List<Object> first = new ArrayList<Object>();
        List<Object> second = new ArrayList<Object>();
        for (int i = 0; i < 32; i++) {
            dims.add("d" + i);
            first.add("a" + i);
            second.add("b" + i);
        }
        FactTable factTable = new FactTableBuilder().build("testGrandTotalManyDimensions")
            .addDimColumns(dims)
            .addMeasureColumns(Collections.singletonList("budget"))
            .addRow(first, Collections.singletonList(10))
            .addRow(second, Collections.singletonList(20))
            .done();

        CubeResult result = new Aggregator(factTable, false).aggregate(dims, Arrays.asList(SUM, COUNT),
                Margins.GRAND_TOTAL);
        Assert.assertEquals(2, result.bucketCount());
        Assert.assertEquals(3, result.size());
        Assert.assertNotNull(result.grandTotal());
        Assert.assertEquals("30.00000000", result.grandTotal().get(SUM).toString());
        Assert.assertEquals("2", result.grandTotal().get(COUNT).toString());
        for (int i = 0; i < 32; i++) {
            Assert.assertEquals(ReservedMember.ALL, result.grandTotalKey().get(i));
        }

        try {
            new Aggregator(factTable, false).aggregate(dims, Collections.singletonList(SUM), Margins.ALL_SUBTOTALS);
            Assert.fail();
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("32"));
        }
    }

    @Test
    public void testMeasureSpecLocaleIndependent() throws Throwable {

        Locale locale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Assert.assertEquals("min(budget)", MIN.toString());
            Assert.assertEquals("sum(budget)", SUM.toString());
            Assert.assertEquals(Aggregation.MIN, Aggregation.parse("min"));
        } finally {
            Locale.setDefault(locale);
        }
    }

}
