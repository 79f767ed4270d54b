package com.sitely.ledger.service;

import com.sitely.ledger.config.SiteLedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * The retention horizon. Ledger rows dated on or after {@link #cutoff()} are
 * live; anything before it is hidden from reads and removed by the sweep.
 */
@Component
@RequiredArgsConstructor
public class RetentionPolicy {

    private final Clock clock;
    private final SiteLedgerProperties properties;

    public LocalDate cutoff() {
        return LocalDate.now(clock).minusYears(properties.getRetention().getYears());
    }
}
