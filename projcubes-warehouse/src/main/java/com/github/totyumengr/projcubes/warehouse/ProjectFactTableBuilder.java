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
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.totyumengr.projcubes.core.FactTable;
import com.github.totyumengr.projcubes.core.FactTable.FactTableBuilder;

/**
 * Turns project view rows into a {@link FactTable}: derives status, start period, the analytic categories and the
 * per-project ratios. Categories use left-open bins, a value outside every bin is a missing member.
 * @author mengran
 *
 */
public class ProjectFactTableBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectFactTableBuilder.class);

    private static final int RATIO_SCALE = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final BigDecimal[] BUDGET_BINS = {
        BigDecimal.ZERO, new BigDecimal("50000"), new BigDecimal("100000"), new BigDecimal("200000")};
    private static final String[] BUDGET_LABELS = {"Small", "Medium", "Large", "Mega"};

    private static final BigDecimal[] PRODUCTIVITY_BINS = {
        BigDecimal.ZERO, new BigDecimal("200"), new BigDecimal("400"), new BigDecimal("600")};
    private static final String[] PRODUCTIVITY_LABELS = {"Low", "Medium", "High", "Very High"};

    private static final BigDecimal[] QUALITY_BINS = {
        BigDecimal.ZERO, new BigDecimal("0.7"), new BigDecimal("0.85"), new BigDecimal("0.95"), BigDecimal.ONE};
    private static final String[] QUALITY_LABELS = {"Low", "Medium", "High", "Excellent"};

    /**
     * @param name fact-table name
     * @param records project rows
     * @return fact-table with every {@link ProjectDimension} and {@link ProjectMeasure}
     */
    public FactTable build(String name, Iterable<ProjectRecord> records) {

        FactTableBuilder builder = new FactTableBuilder().build(name)
            .addDimColumns(ProjectDimension.columns())
            .addMeasureColumns(ProjectMeasure.columns());
        int count = 0;
        for (ProjectRecord record : records) {
            builder.addRow(dimensions(record), measures(record));
            count++;
        }
        LOGGER.info("Derived categories and ratios of {} projects into {}", count, name);
        return builder.done();
    }

    List<Object> dimensions(ProjectRecord r) {

        Map<ProjectDimension, Object> dims = new EnumMap<ProjectDimension, Object>(ProjectDimension.class);
        dims.put(ProjectDimension.CLIENT_ID, r.getClientCode());
        dims.put(ProjectDimension.STATUS, status(r.getCancelled()));
        dims.put(ProjectDimension.START_YEAR, r.getStartYear());
        dims.put(ProjectDimension.START_MONTH, r.getStartMonth());
        dims.put(ProjectDimension.START_PERIOD, startPeriod(r.getStartYear(), r.getStartMonth()));
        dims.put(ProjectDimension.BUDGET_CATEGORY, budgetCategory(r.getBudget()));
        dims.put(ProjectDimension.DEVIATION_TYPE, deviationType(deviation(r)));
        dims.put(ProjectDimension.PRODUCTIVITY_CATEGORY, productivityCategory(r.getAverageProductivity()));
        dims.put(ProjectDimension.QUALITY_CATEGORY, qualityCategory(r.getTestSuccessRate()));

        List<Object> values = new ArrayList<Object>(dims.size());
        for (ProjectDimension d : ProjectDimension.values()) {
            values.add(dims.get(d));
        }
        return values;
    }

    List<Object> measures(ProjectRecord r) {

        BigDecimal budget = r.getBudget();
        BigDecimal cost = r.getRealCost();
        Map<ProjectMeasure, Object> measures = new EnumMap<ProjectMeasure, Object>(ProjectMeasure.class);
        measures.put(ProjectMeasure.BUDGET, budget);
        measures.put(ProjectMeasure.REAL_COST, cost);
        measures.put(ProjectMeasure.BUDGET_DEVIATION, deviation(r));
        measures.put(ProjectMeasure.PENALTY_AMOUNT, r.getPenaltyAmount());
        measures.put(ProjectMeasure.AVERAGE_PRODUCTIVITY, r.getAverageProductivity());
        measures.put(ProjectMeasure.TEST_SUCCESS_RATE, r.getTestSuccessRate());
        measures.put(ProjectMeasure.ERROR_RATE, r.getErrorRate());
        measures.put(ProjectMeasure.PERCENT_LATE_TASKS, r.getPercentLateTasks());
        measures.put(ProjectMeasure.PERCENT_LATE_MILESTONES, r.getPercentLateMilestones());
        measures.put(ProjectMeasure.PROJECT_ID, r.getProjectId());
        measures.put(ProjectMeasure.ROI, roi(budget, cost));
        measures.put(ProjectMeasure.BUDGET_EFFICIENCY, budgetEfficiency(budget, cost));
        measures.put(ProjectMeasure.QUALITY_INDICATOR, qualityIndicator(r.getTestSuccessRate(),
                r.getPercentLateTasks()));
        measures.put(ProjectMeasure.BUDGET_COMPLIANCE, budgetCompliance(budget, cost));
        measures.put(ProjectMeasure.DEVIATION_PERCENT, deviationPercent(budget, cost));
        measures.put(ProjectMeasure.PENALTY_PERCENT, penaltyPercent(budget, r.getPenaltyAmount()));
        measures.put(ProjectMeasure.ON_TIME, r.getFinalDelayDays() == null ? null
                : (r.getFinalDelayDays() <= 0 ? BigDecimal.ONE : BigDecimal.ZERO));
        measures.put(ProjectMeasure.CANCELLED, r.getCancelled() == null ? null
                : (r.getCancelled() == 1 ? BigDecimal.ONE : BigDecimal.ZERO));

        List<Object> values = new ArrayList<Object>(measures.size());
        for (ProjectMeasure m : ProjectMeasure.values()) {
            values.add(measures.get(m));
        }
        return values;
    }

    // ---------------------------- Categories ----------------------------

    static String status(Integer cancelled) {
        if (cancelled == null) {
            return null;
        }
        return cancelled == 1 ? "Cancelled" : "Closed";
    }

    static String startPeriod(Integer year, Integer month) {
        if (year == null || month == null || month < 1 || month > 12) {
            return null;
        }
        return year + "-Q" + ((month - 1) / 3 + 1);
    }

    static String budgetCategory(BigDecimal budget) {
        return bin(budget, BUDGET_BINS, BUDGET_LABELS);
    }

    static String productivityCategory(BigDecimal productivity) {
        return bin(productivity, PRODUCTIVITY_BINS, PRODUCTIVITY_LABELS);
    }

    static String qualityCategory(BigDecimal testSuccessRate) {
        return bin(testSuccessRate, QUALITY_BINS, QUALITY_LABELS);
    }

    static String deviationType(BigDecimal deviation) {
        if (deviation == null) {
            return null;
        }
        int sign = deviation.signum();
        return sign < 0 ? "Over Budget" : sign > 0 ? "Under Budget" : "On Budget";
    }

    /**
     * @param value value to classify
     * @param edges ascending edges, bin i is (edges[i], edges[i+1]], last bin is unbounded when there are as many
     * edges as labels
     * @param labels bin labels
     * @return label, <code>null</code> when outside every bin
     */
    private static String bin(BigDecimal value, BigDecimal[] edges, String[] labels) {
        if (value == null || value.compareTo(edges[0]) <= 0) {
            return null;
        }
        for (int i = 0; i < labels.length; i++) {
            boolean lastUnbounded = i + 1 >= edges.length;
            if (lastUnbounded || value.compareTo(edges[i + 1]) <= 0) {
                return labels[i];
            }
        }
        return null;
    }

    // ---------------------------- Ratios ----------------------------

    static BigDecimal deviation(ProjectRecord r) {
        if (r.getBudgetDeviation() != null) {
            return r.getBudgetDeviation();
        }
        if (r.getBudget() == null || r.getRealCost() == null) {
            return null;
        }
        return r.getBudget().subtract(r.getRealCost());
    }

    /**
     * @return (budget - cost) / budget * 100
     */
    static BigDecimal roi(BigDecimal budget, BigDecimal cost) {
        if (budget == null || cost == null || budget.signum() <= 0) {
            return null;
        }
        return budget.subtract(cost).multiply(HUNDRED).divide(budget, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * @return budget / cost
     */
    static BigDecimal budgetEfficiency(BigDecimal budget, BigDecimal cost) {
        if (budget == null || cost == null || cost.signum() <= 0) {
            return null;
        }
        return budget.divide(cost, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * @return test success * 0.4 + on-time task share * 0.6
     */
    static BigDecimal qualityIndicator(BigDecimal testSuccessRate, BigDecimal percentLateTasks) {
        if (testSuccessRate == null || percentLateTasks == null) {
            return null;
        }
        BigDecimal onTimeTasks = HUNDRED.subtract(percentLateTasks).divide(HUNDRED, RATIO_SCALE, RoundingMode.HALF_UP);
        return testSuccessRate.multiply(new BigDecimal("0.4")).add(onTimeTasks.multiply(new BigDecimal("0.6")));
    }

    /**
     * @return min(1, budget / cost), 0 without budget
     */
    static BigDecimal budgetCompliance(BigDecimal budget, BigDecimal cost) {
        if (budget == null || cost == null) {
            return null;
        }
        if (budget.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        if (cost.signum() <= 0) {
            return BigDecimal.ONE;
        }
        return BigDecimal.ONE.min(budget.divide(cost, RATIO_SCALE, RoundingMode.HALF_UP));
    }

    /**
     * @return |cost - budget| / budget * 100, 0 without budget
     */
    static BigDecimal deviationPercent(BigDecimal budget, BigDecimal cost) {
        if (budget == null || cost == null) {
            return null;
        }
        if (budget.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return cost.subtract(budget).abs().multiply(HUNDRED).divide(budget, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * @return penalty / budget * 100, 0 without budget
     */
    static BigDecimal penaltyPercent(BigDecimal budget, BigDecimal penalty) {
        if (budget == null || penalty == null) {
            return null;
        }
        if (budget.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return penalty.multiply(HUNDRED).divide(budget, RATIO_SCALE, RoundingMode.HALF_UP);
    }

}
