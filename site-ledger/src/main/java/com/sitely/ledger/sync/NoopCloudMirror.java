package com.sitely.ledger.sync;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Default mirror for installations with no remote backend configured.
 */
@Slf4j
public class NoopCloudMirror implements CloudMirror {

    @Override
    public void upsert(MirroredEntity kind, String id, Object entity) {
        log.trace("No cloud mirror configured; skipping {} {}", kind, id);
    }

    @Override
    public List<SavedSiteReference> fetchSavedSites(String userId) {
        return List.of();
    }
}
