package com.premiergroup.revcontent_client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.revcontent_client.client.RevcontentApiClient;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(RevcontentProperties.class)
@Log4j2
public class RevcontentConfig {

    @Bean
    public RestTemplate revcontentRestTemplate(RestTemplateBuilder builder) {
        return builder.build();
    }

    @Bean
    public RevcontentApiClient revcontentApiClient(RestTemplate revcontentRestTemplate,
                                                   ObjectMapper objectMapper,
                                                   RevcontentProperties properties) {
        String apiUrl = properties.getApiUrl().endsWith("/")
                ? properties.getApiUrl().substring(0, properties.getApiUrl().length() - 1)
                : properties.getApiUrl();
        log.info("Revcontent API client configured for {}", apiUrl);
        return new RevcontentApiClient(
                revcontentRestTemplate,
                objectMapper,
                apiUrl,
                properties.getClientId(),
                properties.getClientSecret());
    }
}
