package com.premiergroup.revcontent_client.dto;

import java.util.Map;
import java.util.Objects;

public record CampaignStatsSummary(
        String campaignId,
        Object impressions,
        Object clicks
) {

    /**
     * Builds the summary from one performance record; missing metrics count as 0.
     */
    public static CampaignStatsSummary of(String campaignId, Map<String, Object> stats) {
        return new CampaignStatsSummary(
                campaignId,
                Objects.requireNonNullElse(stats.get("impressions"), 0),
                Objects.requireNonNullElse(stats.get("clicks"), 0)
        );
    }
}
