package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class TodoUpdate {

    private String title;
    private String description;
    private LocalDate deadline;
    private Boolean completed;
    private TodoPriority priority;
}
