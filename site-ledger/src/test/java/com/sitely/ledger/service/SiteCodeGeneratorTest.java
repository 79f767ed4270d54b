package com.sitely.ledger.service;

import com.sitely.ledger.TestLedger;
import com.sitely.ledger.config.SiteLedgerProperties;
import com.sitely.ledger.model.Site;
import com.sitely.ledger.model.SiteCode;
import com.sitely.ledger.model.SiteType;
import com.sitely.ledger.repository.SiteRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SiteCodeGeneratorTest {

    @Mock
    private SiteRepository siteRepository;

    @Test
    @DisplayName("1,000 sites created in a row all get distinct six-character codes")
    void thousandSequentialCodesAreUnique() {
        TestLedger ledger = new TestLedger();
        Set<String> codes = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            Site site = ledger.ledgerStore.createSite(Site.builder()
                    .name("Site " + i).type(SiteType.SHOP).running(true).build());
            assertThat(site.getSiteCode()).matches("[A-Z0-9]{6}");
            codes.add(site.getSiteCode());
        }

        assertThat(codes).hasSize(1000);
    }

    @Test
    @DisplayName("a free candidate is returned as is")
    void returnsFirstFreeCandidate() {
        when(siteRepository.existsBySiteCode(anyString())).thenReturn(true, true, false);
        SiteCodeGenerator generator = new SiteCodeGenerator(siteRepository, new SiteLedgerProperties(),
                Clock.systemUTC(), new Random(7));

        SiteCode code = generator.generateUniqueSiteCode();

        assertThat(code.fallback()).isFalse();
        assertThat(code.value()).matches("[A-Z0-9]{6}");
        verify(siteRepository, times(3)).existsBySiteCode(anyString());
    }

    @Test
    @DisplayName("after 20 collisions the last candidate gets a timestamp suffix and is flagged")
    void fallsBackToSuffixedCode() {
        when(siteRepository.existsBySiteCode(anyString())).thenReturn(true);
        Instant now = Instant.parse("2026-06-15T10:00:00Z");
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        SiteCodeGenerator generator = new SiteCodeGenerator(siteRepository, new SiteLedgerProperties(),
                clock, new Random(7));

        SiteCode code = generator.generateUniqueSiteCode();

        String base36 = Long.toString(now.toEpochMilli(), 36);
        String suffix = base36.substring(base36.length() - 2).toUpperCase(Locale.ROOT);
        assertThat(code.fallback()).isTrue();
        assertThat(code.value()).hasSize(8).endsWith(suffix);
        assertThat(code.value().substring(0, 6)).matches("[A-Z0-9]{6}");
        verify(siteRepository, times(20)).existsBySiteCode(anyString());
    }
}
