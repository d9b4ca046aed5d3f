package com.premiergroup.revcontent_client.dto;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CampaignRequestTest {

    @Test
    void testValidRequest() {
        List<String> countries = new ArrayList<>(List.of("US", "GB"));

        CampaignRequest request = new CampaignRequest("Test", new BigDecimal("50.0"), new BigDecimal("0.10"), countries);
        countries.add("FR");

        assertEquals(List.of("US", "GB"), request.countryCodes());
    }

    @Test
    void testRejectsBlankName() {
        assertThrows(IllegalArgumentException.class,
                () -> new CampaignRequest(" ", BigDecimal.TEN, BigDecimal.ONE, List.of("US")));
    }

    @Test
    void testRejectsNonPositiveAmounts() {
        assertThrows(IllegalArgumentException.class,
                () -> new CampaignRequest("Test", new BigDecimal("-1"), BigDecimal.ONE, List.of("US")));
        assertThrows(IllegalArgumentException.class,
                () -> new CampaignRequest("Test", BigDecimal.TEN, BigDecimal.ZERO, List.of("US")));
    }

    @Test
    void testRejectsEmptyCountries() {
        assertThrows(IllegalArgumentException.class,
                () -> new CampaignRequest("Test", BigDecimal.TEN, BigDecimal.ONE, List.of()));
    }

    @Test
    void testSummaryDefaultsMissingMetricsToZero() {
        CampaignStatsSummary summary = CampaignStatsSummary.of("c-1", Map.of("status", "active"));

        assertEquals("c-1", summary.campaignId());
        assertEquals(0, summary.impressions());
        assertEquals(0, summary.clicks());
    }

    @Test
    void testSummaryKeepsReportedMetrics() {
        CampaignStatsSummary summary = CampaignStatsSummary.of("c-1", Map.of("impressions", 1000, "clicks", 42));

        assertEquals(1000, summary.impressions());
        assertEquals(42, summary.clicks());
    }
}
