package com.sitely.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitely.ledger.migration.JsonFileLegacyStore;
import com.sitely.ledger.migration.LegacyStore;
import com.sitely.ledger.sync.CloudMirror;
import com.sitely.ledger.sync.NoopCloudMirror;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public LegacyStore legacyStore(SiteLedgerProperties properties, ObjectMapper objectMapper) {
        return new JsonFileLegacyStore(Paths.get(properties.getLegacy().getPath()), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public CloudMirror cloudMirror() {
        return new NoopCloudMirror();
    }
}
