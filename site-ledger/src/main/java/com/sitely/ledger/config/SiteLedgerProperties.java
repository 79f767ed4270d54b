package com.sitely.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "site-ledger")
@Data
public class SiteLedgerProperties {

    /** Run schema, legacy migration and retention sweep when the context starts. */
    private boolean initOnStartup = true;

    private Retention retention = new Retention();
    private Legacy legacy = new Legacy();
    private SiteCode siteCode = new SiteCode();

    @Data
    public static class Retention {
        /** Ledger rows dated before today minus this many years are hidden and purged. */
        private int years = 3;
        private boolean scheduledSweepEnabled = true;
        private String cron = "0 30 3 * * *";
    }

    @Data
    public static class Legacy {
        private boolean enabled = true;

        /** JSON object file holding the flat key-value blobs of the pre-relational store. */
        private String path = System.getProperty("user.home") + "/.sitely/legacy-store.json";
    }

    @Data
    public static class SiteCode {
        private int length = 6;
        private int maxAttempts = 20;
    }
}
