package com.sitely.ledger.service;

import com.sitely.ledger.config.SiteLedgerProperties;
import com.sitely.ledger.exception.LedgerConstraintException;
import com.sitely.ledger.model.SiteCode;
import com.sitely.ledger.repository.SiteRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;
import java.util.Random;

/**
 * Short shareable site codes from [A-Z0-9].
 *
 * Each candidate is checked against existing sites. After the configured
 * number of collisions the last candidate gets a two-character suffix from
 * the clock and is returned unchecked. That fallback is best effort: it is
 * very unlikely to collide but is not guaranteed unique, and it is logged.
 */
@Component
@Slf4j
public class SiteCodeGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final SiteRepository siteRepository;
    private final SiteLedgerProperties properties;
    private final Clock clock;
    private final Random random;

    @Autowired
    public SiteCodeGenerator(SiteRepository siteRepository, SiteLedgerProperties properties, Clock clock) {
        this(siteRepository, properties, clock, new SecureRandom());
    }

    SiteCodeGenerator(SiteRepository siteRepository, SiteLedgerProperties properties, Clock clock, Random random) {
        this.siteRepository = siteRepository;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    public SiteCode generateUniqueSiteCode() {
        int maxAttempts = properties.getSiteCode().getMaxAttempts();
        String candidate = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            candidate = randomCode();
            if (!siteRepository.existsBySiteCode(candidate)) {
                return new SiteCode(candidate, false);
            }
            log.debug("Site code {} taken (attempt {}/{})", candidate, attempt, maxAttempts);
        }

        String fallback = candidate + timestampSuffix();
        log.warn("No free site code after {} attempts; using suffixed code {} (uniqueness not guaranteed)",
                maxAttempts, fallback);
        return new SiteCode(fallback, true);
    }

    /**
     * Normalises a code chosen by the caller. It must be exactly the configured
     * length of [A-Z0-9] after upper-casing and must not be held by another site.
     */
    public String claimSuppliedCode(String supplied) {
        String code = supplied.trim().toUpperCase(Locale.ROOT);
        int length = properties.getSiteCode().getLength();
        if (code.length() != length || !code.chars().allMatch(c -> ALPHABET.indexOf(c) >= 0)) {
            throw new LedgerConstraintException(
                    "Site code must be " + length + " characters of A-Z and 0-9: " + supplied);
        }
        if (siteRepository.existsBySiteCode(code)) {
            throw new LedgerConstraintException("Site code already in use: " + code);
        }
        return code;
    }

    String randomCode() {
        int length = properties.getSiteCode().getLength();
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }

    private String timestampSuffix() {
        String base36 = Long.toString(clock.millis(), 36);
        return base36.substring(Math.max(0, base36.length() - 2)).toUpperCase(Locale.ROOT);
    }
}
