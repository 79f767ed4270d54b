package com.sitely.ledger.migration.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyWorker {

    private String id;
    private String siteId;
    private String name;
    private String age;
    private String contact;
    private String village;
    private String category;
    private String photoUri;
    private String joiningDate;
}
