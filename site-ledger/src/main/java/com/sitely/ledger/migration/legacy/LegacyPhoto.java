package com.sitely.ledger.migration.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyPhoto {

    private String id;
    private String siteId;
    private String groupId;
    private String uri;
    private String description;
    private String date;
    private String time;
}
