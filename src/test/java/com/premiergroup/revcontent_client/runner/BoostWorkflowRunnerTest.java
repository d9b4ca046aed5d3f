package com.premiergroup.revcontent_client.runner;

import com.premiergroup.revcontent_client.client.RevcontentApiClient;
import com.premiergroup.revcontent_client.config.RevcontentProperties;
import com.premiergroup.revcontent_client.dto.CampaignRequest;
import com.premiergroup.revcontent_client.exception.BadRequestException;
import com.premiergroup.revcontent_client.exception.NotAuthenticatedException;
import com.premiergroup.revcontent_client.exception.ProtocolViolationException;
import com.premiergroup.revcontent_client.service.StatsFileService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BoostWorkflowRunnerTest {

    @Mock
    private RevcontentApiClient revcontentApiClient;

    @Mock
    private StatsFileService statsFileService;

    private BoostWorkflowRunner runner;

    @BeforeEach
    void setUp() {
        RevcontentProperties properties = new RevcontentProperties();
        properties.getCampaign().setName("Test Campaign");
        properties.getCampaign().setBudget(new BigDecimal("50.0"));
        properties.getCampaign().setBid(new BigDecimal("0.10"));
        properties.getCampaign().setCountryCodes(List.of("US"));
        runner = new BoostWorkflowRunner(revcontentApiClient, statsFileService, properties);
    }

    @Test
    void testFullSequenceSavesFirstRecord() {
        Map<String, Object> first = Map.of("impressions", 1000, "clicks", 42);
        when(revcontentApiClient.createCampaign(any(CampaignRequest.class))).thenReturn("test_campaign_id");
        when(revcontentApiClient.getCampaignStats("test_campaign_id"))
                .thenReturn(List.of(first, Map.of("impressions", 1, "clicks", 0)));

        runner.run();

        InOrder inOrder = inOrder(revcontentApiClient, statsFileService);
        inOrder.verify(revcontentApiClient).authenticate();
        inOrder.verify(revcontentApiClient).createCampaign(
                new CampaignRequest("Test Campaign", new BigDecimal("50.0"), new BigDecimal("0.10"), List.of("US")));
        inOrder.verify(revcontentApiClient).getCampaignStats("test_campaign_id");
        inOrder.verify(statsFileService).save(first, "test_campaign_id");
    }

    @Test
    void testStopsAfterFailedAuthentication() {
        doThrow(new BadRequestException("Authentication failed with 400 Bad Request: invalid_client - x", "{}"))
                .when(revcontentApiClient).authenticate();

        assertDoesNotThrow(() -> runner.run());

        verify(revcontentApiClient, never()).createCampaign(any(CampaignRequest.class));
        verify(revcontentApiClient, never()).getCampaignStats(anyString());
        verifyNoInteractions(statsFileService);
    }

    @Test
    void testStopsAfterFailedCampaignCreation() {
        when(revcontentApiClient.createCampaign(any(CampaignRequest.class)))
                .thenThrow(new NotAuthenticatedException());

        runner.run();

        verify(revcontentApiClient, never()).getCampaignStats(anyString());
        verifyNoInteractions(statsFileService);
    }

    @Test
    void testStatsFailureIsReportedNotThrown() {
        when(revcontentApiClient.createCampaign(any(CampaignRequest.class))).thenReturn("c-1");
        when(revcontentApiClient.getCampaignStats("c-1"))
                .thenThrow(new ProtocolViolationException("Response JSON does not contain \"data\" key.", null, "{}"));

        assertDoesNotThrow(() -> runner.run());

        verifyNoInteractions(statsFileService);
    }

    @Test
    void testNothingSavedWhenNoStatsReturned() {
        when(revcontentApiClient.createCampaign(any(CampaignRequest.class))).thenReturn("c-1");
        when(revcontentApiClient.getCampaignStats("c-1")).thenReturn(List.of());

        runner.run();

        verifyNoInteractions(statsFileService);
    }
}
