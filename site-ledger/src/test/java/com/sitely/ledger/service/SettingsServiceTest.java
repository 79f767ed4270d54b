package com.sitely.ledger.service;

import com.sitely.ledger.TestLedger;
import com.sitely.ledger.exception.LedgerConstraintException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsServiceTest {

    private SettingsService settings;

    @BeforeEach
    void setUp() {
        settings = new TestLedger().settingsService;
    }

    @Test
    @DisplayName("language defaults to en until one is set")
    void language() {
        assertThat(settings.getLanguage()).isEqualTo("en");

        settings.setLanguage("mr");
        settings.setLanguage("hi");

        assertThat(settings.getLanguage()).isEqualTo("hi");
        assertThat(settings.getSetting(SettingsService.LANGUAGE)).contains("hi");
    }

    @Test
    @DisplayName("onboarding flag can be set and reset")
    void onboarding() {
        assertThat(settings.isOnboardingDone()).isFalse();

        settings.setOnboardingDone();
        assertThat(settings.isOnboardingDone()).isTrue();

        settings.resetOnboardingDone();
        assertThat(settings.isOnboardingDone()).isFalse();
    }

    @Test
    @DisplayName("only the two known keys are accepted")
    void unknownKeyRejected() {
        assertThatThrownBy(() -> settings.setSetting("theme", "dark"))
                .isInstanceOf(LedgerConstraintException.class);
        assertThatThrownBy(() -> settings.getSetting("theme"))
                .isInstanceOf(LedgerConstraintException.class);
    }
}
