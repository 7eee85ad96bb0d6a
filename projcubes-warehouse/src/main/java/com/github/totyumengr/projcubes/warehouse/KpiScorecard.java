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
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.totyumengr.projcubes.core.AggregateValue;
import com.github.totyumengr.projcubes.core.Aggregation;
import com.github.totyumengr.projcubes.core.CubeResult;
import com.github.totyumengr.projcubes.core.DimensionKey;
import com.github.totyumengr.projcubes.core.MeasureSpec;
import com.github.totyumengr.projcubes.core.OlapCube;

/**
 * Business KPIs of a set of projects. Every KPI is the row-weighted mean of one per-project measure, scaled to a
 * percentage and compared with its target and poor threshold.
 * @author mengran
 *
 */
public final class KpiScorecard {

    private static final Logger LOGGER = LoggerFactory.getLogger(KpiScorecard.class);

    private static final int VALUE_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static enum Status {
        GOOD, FAIR, POOR,
        /**
         * No project has a value for the measure.
         */
        NO_DATA
    }

    public static enum Severity {
        HIGH, MEDIUM
    }

    public static enum Kpi {

        BUDGET_COMPLIANCE(ProjectMeasure.BUDGET_COMPLIANCE, HUNDRED, true, 90, 85,
                "Review estimation and cost control process"),
        BUDGET_DEVIATION(ProjectMeasure.DEVIATION_PERCENT, BigDecimal.ONE, false, 5, 10,
                "Improve accuracy of initial estimates"),
        PENALTIES(ProjectMeasure.PENALTY_PERCENT, BigDecimal.ONE, false, 2, 5,
                "Strengthen risk management and contract compliance"),
        ON_TIME(ProjectMeasure.ON_TIME, HUNDRED, true, 85, 70,
                "Optimize schedule planning and dependency management"),
        CANCELLED(ProjectMeasure.CANCELLED, HUNDRED, false, 5, 10,
                "Review project selection and feasibility criteria"),
        LATE_TASKS(ProjectMeasure.PERCENT_LATE_TASKS, BigDecimal.ONE, false, 10, 20,
                "Improve follow-up of operational tasks"),
        LATE_MILESTONES(ProjectMeasure.PERCENT_LATE_MILESTONES, BigDecimal.ONE, false, 10, 20,
                "Reinforce coordination between teams on key deliverables"),
        ERROR_RATE(ProjectMeasure.ERROR_RATE, HUNDRED, false, 5, 10,
                "Adopt better development and code review practices"),
        /**
         * Mean productivity in hours mapped to a percentage, 0 hours is 100% and 1000 hours is 0%.
         */
        PRODUCTIVITY(ProjectMeasure.AVERAGE_PRODUCTIVITY, BigDecimal.ONE, true, 75, 60,
                "Optimize resource allocation and remove blockers") {
            @Override
            BigDecimal percent(BigDecimal mean) {
                BigDecimal thousand = BigDecimal.valueOf(1000);
                return HUNDRED.min(thousand.subtract(mean).multiply(HUNDRED).divide(thousand));
            }
        },
        TEST_SUCCESS(ProjectMeasure.TEST_SUCCESS_RATE, HUNDRED, true, 90, 80,
                "Strengthen testing and quality control process");

        private final ProjectMeasure measure;
        private final BigDecimal scale;
        private final boolean higherIsBetter;
        private final BigDecimal target;
        private final BigDecimal poorThreshold;
        private final String recommendation;

        private Kpi(ProjectMeasure measure, BigDecimal scale, boolean higherIsBetter, int target, int poorThreshold,
                String recommendation) {
            this.measure = measure;
            this.scale = scale;
            this.higherIsBetter = higherIsBetter;
            this.target = BigDecimal.valueOf(target);
            this.poorThreshold = BigDecimal.valueOf(poorThreshold);
            this.recommendation = recommendation;
        }

        public ProjectMeasure getMeasure() {
            return measure;
        }

        public boolean isHigherBetter() {
            return higherIsBetter;
        }

        public BigDecimal getTarget() {
            return target;
        }

        public BigDecimal getPoorThreshold() {
            return poorThreshold;
        }

        public String getRecommendation() {
            return recommendation;
        }

        MeasureSpec spec() {
            return measure.spec(Aggregation.MEAN);
        }

        BigDecimal percent(BigDecimal mean) {
            return mean.multiply(scale);
        }

        /**
         * @param value KPI percentage
         * @return status of value against target and poor threshold
         */
        public Status status(BigDecimal value) {
            if (value == null) {
                return Status.NO_DATA;
            }
            if (higherIsBetter) {
                return value.compareTo(target) >= 0 ? Status.GOOD
                        : value.compareTo(poorThreshold) < 0 ? Status.POOR : Status.FAIR;
            }
            return value.compareTo(target) <= 0 ? Status.GOOD
                    : value.compareTo(poorThreshold) > 0 ? Status.POOR : Status.FAIR;
        }
    }

    /**
     * KPI outside its target.
     */
    public static final class Alert {

        private final Kpi kpi;
        private final BigDecimal value;
        private final Severity severity;

        Alert(Kpi kpi, BigDecimal value, Severity severity) {
            this.kpi = kpi;
            this.value = value;
            this.severity = severity;
        }

        public Kpi getKpi() {
            return kpi;
        }

        public BigDecimal getValue() {
            return value;
        }

        public BigDecimal getTarget() {
            return kpi.getTarget();
        }

        public Severity getSeverity() {
            return severity;
        }

        public String getRecommendation() {
            return kpi.getRecommendation();
        }

        @Override
        public String toString() {
            return "Alert [kpi=" + kpi + ", value=" + value + ", target=" + kpi.getTarget() + ", severity=" + severity
                    + "]";
        }
    }

    private final int projectCount;
    private final Map<Kpi, BigDecimal> values;

    private KpiScorecard(int projectCount, Map<Kpi, BigDecimal> values) {
        this.projectCount = projectCount;
        this.values = values;
    }

    private static List<MeasureSpec> specs() {
        List<MeasureSpec> specs = new ArrayList<MeasureSpec>(Kpi.values().length + 1);
        specs.add(ProjectMeasure.PROJECT_ID.spec(Aggregation.COUNT));
        for (Kpi kpi : Kpi.values()) {
            specs.add(kpi.spec());
        }
        return specs;
    }

    private static KpiScorecard of(Map<MeasureSpec, AggregateValue> aggregates) {

        Map<Kpi, BigDecimal> values = new EnumMap<Kpi, BigDecimal>(Kpi.class);
        if (aggregates == null) {
            return new KpiScorecard(0, values);
        }
        for (Kpi kpi : Kpi.values()) {
            AggregateValue mean = aggregates.get(kpi.spec());
            if (mean.isPresent()) {
                values.put(kpi, kpi.percent(mean.decimal()).setScale(VALUE_SCALE, RoundingMode.HALF_UP));
            }
        }
        int count = aggregates.get(ProjectMeasure.PROJECT_ID.spec(Aggregation.COUNT)).decimal().intValue();
        return new KpiScorecard(count, values);
    }

    /**
     * @param cube cube over project fact-table, the catalog of cube is not consulted for measures
     * @return scorecard of every project
     */
    public static KpiScorecard overall(OlapCube cube) {

        CubeResult result = cube.aggregate(Collections.<String>emptyList(), specs());
        KpiScorecard scorecard = of(result.get(DimensionKey.EMPTY));
        LOGGER.info("Scorecard of {} projects: {}", scorecard.projectCount, scorecard.values);
        return scorecard;
    }

    /**
     * @param cube cube over project fact-table
     * @param dimName catalog dimension, for example client_id
     * @return scorecard per member in member order, margins excluded
     */
    public static Map<Object, KpiScorecard> byMember(OlapCube cube, String dimName) {

        CubeResult result = cube.aggregate(Collections.singletonList(dimName), specs());
        Map<Object, KpiScorecard> scorecards = new LinkedHashMap<Object, KpiScorecard>();
        for (Entry<DimensionKey, Map<MeasureSpec, AggregateValue>> e : result.entries()) {
            if (!e.getKey().isMargin()) {
                scorecards.put(e.getKey().get(0), of(e.getValue()));
            }
        }
        LOGGER.info("Scorecards by {} for {} members.", dimName, scorecards.size());
        return scorecards;
    }

    public int getProjectCount() {
        return projectCount;
    }

    /**
     * @param kpi KPI
     * @return percentage rounded to 2 decimals, <code>null</code> when no data
     */
    public BigDecimal getValue(Kpi kpi) {
        return values.get(kpi);
    }

    public Status getStatus(Kpi kpi) {
        return kpi.status(values.get(kpi));
    }

    /**
     * @return KPIs not reaching their target in KPI order, POOR is {@link Severity#HIGH} and FAIR is
     * {@link Severity#MEDIUM}
     */
    public List<Alert> alerts() {

        List<Alert> alerts = new ArrayList<Alert>();
        for (Kpi kpi : Kpi.values()) {
            Status status = getStatus(kpi);
            if (status == Status.POOR) {
                alerts.add(new Alert(kpi, values.get(kpi), Severity.HIGH));
            } else if (status == Status.FAIR) {
                alerts.add(new Alert(kpi, values.get(kpi), Severity.MEDIUM));
            }
        }
        return alerts;
    }

    @Override
    public String toString() {
        return "KpiScorecard [projectCount=" + projectCount + ", values=" + values + "]";
    }

}
