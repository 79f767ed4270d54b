package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A construction site and the root of every cascade.
 *
 *  - endDate is only kept while the site is closed (running == false)
 *  - siteCode is the 6-char share code; fallback codes can be longer
 *  - userId is null for sites created before per-user ownership existed
 */
@Data
@Builder(toBuilder = true)
public class Site {

    private String id;
    private String name;
    private SiteType type;
    private String location;
    private LocalDate startDate;
    private LocalDate endDate;
    private boolean running;
    private String ownerName;
    private String contact;
    private String siteCode;
    private String userId;
    private Instant createdAt;
}
