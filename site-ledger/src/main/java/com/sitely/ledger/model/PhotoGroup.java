package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
public class PhotoGroup {

    private String id;
    private String siteId;
    private String name;
    private Instant createdAt;
}
