package com.premiergroup.revcontent_client.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code revcontent.*}. The API URL and credentials normally arrive through
 * the environment or a {@code .env} file.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "revcontent")
public class RevcontentProperties {

    @NotBlank(message = "revcontent.api-url must be set (API_URL)")
    private String apiUrl;

    @NotBlank
    private String clientId;

    @NotBlank
    private String clientSecret;

    @Valid
    private Campaign campaign = new Campaign();

    @Valid
    private Stats stats = new Stats();

    private Runner runner = new Runner();

    @Data
    public static class Campaign {

        @NotBlank
        private String name;

        @NotNull
        @Positive
        private BigDecimal budget;

        @NotNull
        @Positive
        private BigDecimal bid;

        @NotEmpty
        private List<String> countryCodes = new ArrayList<>();
    }

    @Data
    public static class Stats {

        @NotBlank
        private String outputDir = ".";
    }

    @Data
    public static class Runner {

        private boolean enabled = true;
    }
}
