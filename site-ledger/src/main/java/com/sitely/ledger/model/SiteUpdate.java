package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Partial site update; null fields are left untouched.
 */
@Data
@Builder
public class SiteUpdate {

    private String name;
    private SiteType type;
    private String location;
    private LocalDate startDate;
    private LocalDate endDate;
    private Boolean running;
    private String ownerName;
    private String contact;
}
