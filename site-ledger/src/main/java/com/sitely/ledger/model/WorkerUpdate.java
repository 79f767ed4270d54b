package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

/**
 * Partial worker update; null fields are left untouched. Ledger rows keep the
 * name and category captured when they were written.
 */
@Data
@Builder
public class WorkerUpdate {

    private String name;
    private String age;
    private String contact;
    private String village;
    private WorkerCategory category;
    private String photoUri;
}
