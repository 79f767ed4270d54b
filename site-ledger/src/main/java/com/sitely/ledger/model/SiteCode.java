package com.sitely.ledger.model;

/**
 * A generated share code. fallback is true when collision checks ran out and a
 * timestamp suffix was appended; such codes are only probably unique.
 */
public record SiteCode(String value, boolean fallback) {
}
