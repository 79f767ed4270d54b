package com.sitely.ledger.service;

import com.sitely.ledger.exception.LedgerConstraintException;
import com.sitely.ledger.repository.SettingsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;

/**
 * The two-row settings table: UI language and the onboarding flag.
 */
@Service
@RequiredArgsConstructor
public class SettingsService {

    public static final String LANGUAGE = "language";
    public static final String ONBOARDING_DONE = "onboarding_done";

    static final String DEFAULT_LANGUAGE = "en";
    private static final Set<String> KNOWN_KEYS = Set.of(LANGUAGE, ONBOARDING_DONE);

    private final StorageInitializer storageInitializer;
    private final LedgerTransactions transactions;
    private final SettingsRepository settingsRepository;

    public Optional<String> getSetting(String key) {
        requireKnown(key);
        storageInitializer.awaitReady();
        return settingsRepository.find(key);
    }

    public void setSetting(String key, String value) {
        requireKnown(key);
        if (value == null) {
            throw new LedgerConstraintException("Setting " + key + " needs a value");
        }
        storageInitializer.awaitReady();
        transactions.run(() -> settingsRepository.put(key, value));
    }

    public String getLanguage() {
        return getSetting(LANGUAGE).orElse(DEFAULT_LANGUAGE);
    }

    public void setLanguage(String language) {
        setSetting(LANGUAGE, language);
    }

    public boolean isOnboardingDone() {
        return getSetting(ONBOARDING_DONE).map("true"::equals).orElse(false);
    }

    public void setOnboardingDone() {
        setSetting(ONBOARDING_DONE, "true");
    }

    public void resetOnboardingDone() {
        storageInitializer.awaitReady();
        transactions.run(() -> settingsRepository.delete(ONBOARDING_DONE));
    }

    private static void requireKnown(String key) {
        if (!KNOWN_KEYS.contains(key)) {
            throw new LedgerConstraintException("Unknown setting: " + key);
        }
    }
}
