package com.sitely.ledger.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class SettingsRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<String> find(String key) {
        return jdbcTemplate.queryForList(
                "SELECT setting_value FROM settings WHERE setting_key = ?", String.class, key)
                .stream().findFirst();
    }

    public void put(String key, String value) {
        jdbcTemplate.update(
                "MERGE INTO settings (setting_key, setting_value) KEY (setting_key) VALUES (?, ?)", key, value);
    }

    public int delete(String key) {
        return jdbcTemplate.update("DELETE FROM settings WHERE setting_key = ?", key);
    }
}
