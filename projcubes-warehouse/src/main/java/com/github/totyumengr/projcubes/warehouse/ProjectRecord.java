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

/**
 * One row of the denormalized project view, values as read from warehouse. Any value may be <code>null</code>.
 * @author mengran
 *
 */
public class ProjectRecord {

    private Long projectId;
    private String clientCode;
    /**
     * 1 cancelled, 0 closed
     */
    private Integer cancelled;
    private Integer startYear;
    private Integer startMonth;
    private BigDecimal budget;
    private BigDecimal realCost;
    /**
     * Budget minus real cost
     */
    private BigDecimal budgetDeviation;
    private BigDecimal penaltyAmount;
    private Integer finalDelayDays;
    private BigDecimal errorRate;
    private BigDecimal testSuccessRate;
    private BigDecimal averageProductivity;
    private BigDecimal percentLateTasks;
    private BigDecimal percentLateMilestones;

    public Long getProjectId() {
        return projectId;
    }

    public void setProjectId(Long projectId) {
        this.projectId = projectId;
    }

    public String getClientCode() {
        return clientCode;
    }

    public void setClientCode(String clientCode) {
        this.clientCode = clientCode;
    }

    public Integer getCancelled() {
        return cancelled;
    }

    public void setCancelled(Integer cancelled) {
        this.cancelled = cancelled;
    }

    public Integer getStartYear() {
        return startYear;
    }

    public void setStartYear(Integer startYear) {
        this.startYear = startYear;
    }

    public Integer getStartMonth() {
        return startMonth;
    }

    public void setStartMonth(Integer startMonth) {
        this.startMonth = startMonth;
    }

    public BigDecimal getBudget() {
        return budget;
    }

    public void setBudget(BigDecimal budget) {
        this.budget = budget;
    }

    public BigDecimal getRealCost() {
        return realCost;
    }

    public void setRealCost(BigDecimal realCost) {
        this.realCost = realCost;
    }

    public BigDecimal getBudgetDeviation() {
        return budgetDeviation;
    }

    public void setBudgetDeviation(BigDecimal budgetDeviation) {
        this.budgetDeviation = budgetDeviation;
    }

    public BigDecimal getPenaltyAmount() {
        return penaltyAmount;
    }

    public void setPenaltyAmount(BigDecimal penaltyAmount) {
        this.penaltyAmount = penaltyAmount;
    }

    public Integer getFinalDelayDays() {
        return finalDelayDays;
    }

    public void setFinalDelayDays(Integer finalDelayDays) {
        this.finalDelayDays = finalDelayDays;
    }

    public BigDecimal getErrorRate() {
        return errorRate;
    }

    public void setErrorRate(BigDecimal errorRate) {
        this.errorRate = errorRate;
    }

    public BigDecimal getTestSuccessRate() {
        return testSuccessRate;
    }

    public void setTestSuccessRate(BigDecimal testSuccessRate) {
        this.testSuccessRate = testSuccessRate;
    }

    public BigDecimal getAverageProductivity() {
        return averageProductivity;
    }

    public void setAverageProductivity(BigDecimal averageProductivity) {
        this.averageProductivity = averageProductivity;
    }

    public BigDecimal getPercentLateTasks() {
        return percentLateTasks;
    }

    public void setPercentLateTasks(BigDecimal percentLateTasks) {
        this.percentLateTasks = percentLateTasks;
    }

    public BigDecimal getPercentLateMilestones() {
        return percentLateMilestones;
    }

    public void setPercentLateMilestones(BigDecimal percentLateMilestones) {
        this.percentLateMilestones = percentLateMilestones;
    }

    @Override
    public String toString() {
        return "ProjectRecord [projectId=" + projectId + ", clientCode=" + clientCode + ", cancelled=" + cancelled
                + ", startYear=" + startYear + ", startMonth=" + startMonth + ", budget=" + budget + ", realCost="
                + realCost + "]";
    }

}
