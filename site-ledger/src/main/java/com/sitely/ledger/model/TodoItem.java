package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
public class TodoItem {

    private String id;
    private String title;
    private String description;
    private TodoType type;
    private LocalDate deadline;
    private boolean completed;
    private Instant completedAt;
    private TodoPriority priority;

    /** Optional; todos are not owned by a site and survive its deletion. */
    private String siteId;

    private Instant createdAt;
}
