package com.sitely.ledger.sync;

import java.util.List;

/**
 * Remote copy of locally committed entities. Best effort only: callers invoke
 * it after the local transaction has committed and treat any failure as a
 * warning, never as a failure of the local operation.
 */
public interface CloudMirror {

    void upsert(MirroredEntity kind, String id, Object entity);

    /**
     * Sites the user saved on another device, by site code.
     */
    List<SavedSiteReference> fetchSavedSites(String userId);
}
