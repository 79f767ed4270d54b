package com.sitely.ledger.migration.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * One element of the legacy "@sites" array.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacySite {

    private String id;
    private String siteCode;
    private String name;
    private String type;
    private String location;
    private String startDate;
    private String endDate;

    @JsonProperty("isRunning")
    private Boolean running;

    private String ownerName;
    private String contact;
    private String createdAt;
}
