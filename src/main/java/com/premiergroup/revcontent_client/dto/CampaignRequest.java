package com.premiergroup.revcontent_client.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Boost to create: name, total budget and default bid (USD), targeted country codes.
 */
public record CampaignRequest(
        String name,
        BigDecimal budget,
        BigDecimal bid,
        List<String> countryCodes
) {

    public CampaignRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Campaign name must not be blank");
        }
        if (budget == null || budget.signum() <= 0) {
            throw new IllegalArgumentException("Campaign budget must be positive: " + budget);
        }
        if (bid == null || bid.signum() <= 0) {
            throw new IllegalArgumentException("Campaign bid must be positive: " + bid);
        }
        if (countryCodes == null || countryCodes.isEmpty()) {
            throw new IllegalArgumentException("At least one country code is required");
        }
        countryCodes = List.copyOf(countryCodes);
    }
}
