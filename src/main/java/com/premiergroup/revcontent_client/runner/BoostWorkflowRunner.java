package com.premiergroup.revcontent_client.runner;

import com.premiergroup.revcontent_client.client.RevcontentApiClient;
import com.premiergroup.revcontent_client.config.RevcontentProperties;
import com.premiergroup.revcontent_client.dto.CampaignRequest;
import com.premiergroup.revcontent_client.dto.CampaignStatsSummary;
import com.premiergroup.revcontent_client.logging.LogLevels;
import com.premiergroup.revcontent_client.service.StatsFileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Authenticates, creates the configured boost, fetches its stats and saves the first record.
 * A failing step is logged and ends the run.
 */
@Component
@Log4j2
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "revcontent.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BoostWorkflowRunner implements CommandLineRunner {

    private final RevcontentApiClient revcontentApiClient;
    private final StatsFileService statsFileService;
    private final RevcontentProperties properties;

    @Override
    public void run(String... args) {
        try {
            revcontentApiClient.authenticate();
        } catch (Exception e) {
            log.error("Authentication error: {}", e.getMessage(), e);
            return;
        }

        String campaignId;
        try {
            campaignId = revcontentApiClient.createCampaign(campaignRequest());
            log.log(LogLevels.SUCCESS, "Campaign created. ID: {}", campaignId);
        } catch (Exception e) {
            log.error("Create campaign error: {}", e.getMessage(), e);
            return;
        }

        try {
            List<Map<String, Object>> stats = revcontentApiClient.getCampaignStats(campaignId);
            if (stats.isEmpty()) {
                log.warn("No stats returned for campaign {}.", campaignId);
                return;
            }

            Map<String, Object> first = stats.get(0);
            CampaignStatsSummary summary = CampaignStatsSummary.of(campaignId, first);
            System.out.println("\n--- Campaign Statistics ---");
            System.out.printf("Campaign ID: %s%n", summary.campaignId());
            System.out.printf("Impressions: %s%n", summary.impressions());
            System.out.printf("Clicks: %s%n", summary.clicks());

            statsFileService.save(first, campaignId);
        } catch (Exception e) {
            log.error("Stats error: {}", e.getMessage(), e);
        }
    }

    private CampaignRequest campaignRequest() {
        RevcontentProperties.Campaign campaign = properties.getCampaign();
        return new CampaignRequest(
                campaign.getName(),
                campaign.getBudget(),
                campaign.getBid(),
                campaign.getCountryCodes());
    }
}
