package com.sitely.ledger.sync;

import java.time.Instant;

public record SavedSiteReference(String siteId, String siteCode, String siteName, Instant savedAt) {
}
