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
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Service;

import com.github.totyumengr.projcubes.core.FactTable;

/**
 * Reads the denormalized project view of the warehouse, columns are bound by label:
 * <pre>
 * project_id, client_code, cancelled, start_year, start_month, final_delay_days, budget, real_cost,
 * budget_deviation, penalty_amount, error_rate, test_success_rate, average_productivity, percent_late_tasks,
 * percent_late_milestones
 * </pre>
 * @author mengran
 *
 */
@Service
public class ProjectFactLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectFactLoader.class);

    @Autowired
    private DataSource dataSource;
    @Value("${projcubes.builder.sourceSql}")
    private String sourceSql;
    /**
     * {@link Integer#MIN_VALUE} turns on MySQL streaming result-set.
     */
    @Value("${projcubes.builder.fetchSize:0}")
    private int fetchSize;

    /**
     * @return one record per row of source SQL
     */
    public List<ProjectRecord> load() {

        long enterTime = System.currentTimeMillis();
        LOGGER.info("Start fetching project facts using {}", sourceSql);

        JdbcTemplate template = new JdbcTemplate(dataSource);
        List<ProjectRecord> records = new ArrayList<ProjectRecord>();
        template.query(new PreparedStatementCreator() {

            @Override
            public PreparedStatement createPreparedStatement(Connection con) throws SQLException {

                PreparedStatement stmt = con.prepareStatement(sourceSql, ResultSet.TYPE_FORWARD_ONLY,
                        ResultSet.CONCUR_READ_ONLY);
                if (fetchSize != 0) {
                    try {
                        stmt.setFetchSize(fetchSize);
                        LOGGER.info("Set fetch size {}", stmt.getFetchSize());
                    } catch (SQLException e) {
                        LOGGER.warn("Fetch size {} not supported by driver, keep default. {}", fetchSize,
                                e.getMessage());
                    }
                }
                return stmt;
            }
        }, new RowCallbackHandler() {

            @Override
            public void processRow(ResultSet rs) throws SQLException {
                records.add(toRecord(rs));
            }
        });

        LOGGER.info("Fetched {} project facts in {} ms.", records.size(), System.currentTimeMillis() - enterTime);
        return records;
    }

    /**
     * @param name fact-table name
     * @return fact-table of freshly loaded projects
     */
    public FactTable loadFactTable(String name) {
        return new ProjectFactTableBuilder().build(name, load());
    }

    static ProjectRecord toRecord(ResultSet rs) throws SQLException {

        ProjectRecord record = new ProjectRecord();
        long projectId = rs.getLong("project_id");
        record.setProjectId(rs.wasNull() ? null : projectId);
        record.setClientCode(rs.getString("client_code"));
        record.setCancelled(getInteger(rs, "cancelled"));
        record.setStartYear(getInteger(rs, "start_year"));
        record.setStartMonth(getInteger(rs, "start_month"));
        record.setFinalDelayDays(getInteger(rs, "final_delay_days"));
        record.setBudget(getDecimal(rs, "budget"));
        record.setRealCost(getDecimal(rs, "real_cost"));
        record.setBudgetDeviation(getDecimal(rs, "budget_deviation"));
        record.setPenaltyAmount(getDecimal(rs, "penalty_amount"));
        record.setErrorRate(getDecimal(rs, "error_rate"));
        record.setTestSuccessRate(getDecimal(rs, "test_success_rate"));
        record.setAverageProductivity(getDecimal(rs, "average_productivity"));
        record.setPercentLateTasks(getDecimal(rs, "percent_late_tasks"));
        record.setPercentLateMilestones(getDecimal(rs, "percent_late_milestones"));
        return record;
    }

    private static Integer getInteger(ResultSet rs, String label) throws SQLException {
        int value = rs.getInt(label);
        return rs.wasNull() ? null : value;
    }

    // FLOAT columns, keep the shortest decimal representation
    private static BigDecimal getDecimal(ResultSet rs, String label) throws SQLException {
        double value = rs.getDouble(label);
        return rs.wasNull() ? null : BigDecimal.valueOf(value);
    }

}
