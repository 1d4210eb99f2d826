package com.deliveryhealth.scoring;

/**
 * Display labels used as contribution keys.
 */
public final class MetricLabels {
    public static final String SCHEDULE_VARIANCE = "Schedule Variance";
    public static final String FORECAST_SLIP = "Forecast Slip";
    public static final String BACKLOG_GROWTH = "Backlog Growth";
    public static final String REQ_CHURN = "Req. Churn";
    public static final String DEFECT_ESCAPE = "Defect Escape Rate";
    public static final String CRITICAL_DEFECTS = "Critical Defects";
    public static final String TEAM_CHURN = "Team Churn";
    public static final String BLOCKED_DAYS = "Blocked Days";
    public static final String UNPLANNED_WORK = "Unplanned Work";
    public static final String DEPENDENCIES = "Dependencies";
    public static final String CPI = "CPI (Cost)";
    public static final String SPI = "SPI (Schedule)";
    public static final String MILESTONES = "Milestone Hit Rate";
    public static final String THROUGHPUT = "Throughput";
    public static final String CYCLE_TIME = "Cycle Time";
    public static final String WIP_ADHERENCE = "WIP Adherence";
    public static final String AGING_WIP = "Aging WIP";

    private MetricLabels() {
    }
}
