package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
public class Photo {

    private String id;
    private String siteId;
    private String groupId;
    private String uri;
    private String description;
    private LocalDate date;
    private String time;
}
