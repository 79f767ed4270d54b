package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

/**
 * Partial photo update. Set clearGroup to move a photo out of its group.
 */
@Data
@Builder
public class PhotoUpdate {

    private String description;
    private String groupId;
    private boolean clearGroup;
}
