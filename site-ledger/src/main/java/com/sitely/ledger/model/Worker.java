package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
public class Worker {

    private String id;
    private String siteId;
    private String name;

    /** Free text as entered on site, e.g. "35" or "approx 40". */
    private String age;

    private String contact;
    private String village;
    private WorkerCategory category;
    private String photoUri;
    private LocalDate joiningDate;
}
