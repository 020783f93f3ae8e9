package com.pokerpulse.enrichment.dto;

import com.pokerpulse.enrichment.model.TaskType;

import java.time.LocalDate;
import java.util.List;

/**
 * Bulk task submission. The selector fields are optional filters; explicit {@code ids} win over filters.
 * {@code assignVenueId} turns a venue reassignment into a manual move of every target to that venue.
 */
public class TaskSubmissionRequest {
    private TaskType taskType;
    private List<Long> ids;
    private Long venueId;
    private LocalDate from;
    private LocalDate to;
    private Long assignVenueId;

    public TaskSubmissionRequest() {}

    public TaskSubmissionRequest(TaskType taskType, List<Long> ids) {
        this.taskType = taskType;
        this.ids = ids;
    }

    public TaskType getTaskType() { return taskType; }
    public void setTaskType(TaskType taskType) { this.taskType = taskType; }
    public List<Long> getIds() { return ids; }
    public void setIds(List<Long> ids) { this.ids = ids; }
    public Long getVenueId() { return venueId; }
    public void setVenueId(Long venueId) { this.venueId = venueId; }
    public LocalDate getFrom() { return from; }
    public void setFrom(LocalDate from) { this.from = from; }
    public LocalDate getTo() { return to; }
    public void setTo(LocalDate to) { this.to = to; }
    public Long getAssignVenueId() { return assignVenueId; }
    public void setAssignVenueId(Long assignVenueId) { this.assignVenueId = assignVenueId; }
}
