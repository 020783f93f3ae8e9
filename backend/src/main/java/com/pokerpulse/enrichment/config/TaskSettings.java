package com.pokerpulse.enrichment.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class TaskSettings {

    @Value("${pokerpulse.tasks.batch-size:25}")
    private int batchSize = 25;

    @Value("${pokerpulse.tasks.max-targets:5000}")
    private int maxTargets = 5000;

    @Value("${pokerpulse.tasks.max-duration-minutes:30}")
    private long maxDurationMinutes = 30;

    @Value("${pokerpulse.tasks.max-item-errors:200}")
    private int maxItemErrors = 200;

    @Value("${pokerpulse.tasks.retention-days:7}")
    private int retentionDays = 7;

    @Value("${pokerpulse.tasks.resume-on-startup:true}")
    private boolean resumeOnStartup = true;

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    public int getMaxTargets() { return maxTargets; }
    public void setMaxTargets(int maxTargets) { this.maxTargets = maxTargets; }
    public Duration getMaxDuration() { return Duration.ofMinutes(maxDurationMinutes); }
    public void setMaxDurationMinutes(long maxDurationMinutes) { this.maxDurationMinutes = maxDurationMinutes; }
    public int getMaxItemErrors() { return maxItemErrors; }
    public int getRetentionDays() { return retentionDays; }
    public boolean isResumeOnStartup() { return resumeOnStartup; }
}
