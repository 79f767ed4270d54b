package com.sitely.ledger.migration;

import java.util.Optional;
import java.util.Set;

/**
 * The pre-relational persistence format: a flat map of string keys to string
 * values, most of them JSON arrays of one entity type.
 */
public interface LegacyStore {

    Optional<String> get(String key);

    Set<String> keys();

    void put(String key, String value);
}
