package com.premiergroup.revcontent_client.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.premiergroup.revcontent_client.dto.CampaignRequest;
import com.premiergroup.revcontent_client.exception.BadRequestException;
import com.premiergroup.revcontent_client.exception.NotAuthenticatedException;
import com.premiergroup.revcontent_client.exception.ProtocolViolationException;
import com.premiergroup.revcontent_client.exception.RequestFailedException;
import com.premiergroup.revcontent_client.exception.RevcontentApiException;
import com.premiergroup.revcontent_client.logging.LogLevels;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the Revcontent API.
 * <p>
 * Authenticates with the client-credentials grant, creates boosts (campaigns) and reads their
 * performance stats. Every call is a single blocking round trip; nothing is retried and an expired
 * token is never refreshed. Not thread-safe: the session token is plain mutable state.
 */
@Log4j2
public class RevcontentApiClient {

    static final String TOKEN_PATH = "/oauth/token";
    static final String CREATE_BOOST_PATH = "/stats/api/v1.0/boosts/add";
    static final String BOOST_PERFORMANCE_PATH = "/stats/api/v1.0/boosts/performance";

    private static final TypeReference<Map<String, Object>> STATS_RECORD = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String clientId;
    private final String clientSecret;

    private String accessToken;

    public RevcontentApiClient(RestTemplate restTemplate,
                               ObjectMapper objectMapper,
                               String apiUrl,
                               String clientId,
                               String clientSecret) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    /**
     * Requests an access token with the client credentials and keeps it for later calls.
     *
     * @throws BadRequestException         on HTTP 400, with the platform's error and description
     * @throws ProtocolViolationException  on HTTP 200 without an access token
     * @throws RequestFailedException      on any other status
     */
    public void authenticate() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setCacheControl(CacheControl.noCache());

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);

        log.info("Authenticating with Revcontent API...");
        ResponseEntity<String> response = send(RequestEntity.post(endpoint(TOKEN_PATH)).headers(headers).body(form));
        HttpStatusCode status = response.getStatusCode();
        String body = response.getBody();

        if (status.isSameCodeAs(HttpStatus.OK)) {
            String token = textOrNull(readJsonOrViolation(status, body).get("access_token"));
            if (!StringUtils.hasLength(token)) {
                throw logged(new ProtocolViolationException("Access token not found in response.", status, body));
            }
            accessToken = token;
            log.log(LogLevels.SUCCESS, "Authentication successful.");
        } else if (status.isSameCodeAs(HttpStatus.BAD_REQUEST)) {
            JsonNode error = readJsonOrMissing(body);
            String message = String.format("Authentication failed with 400 Bad Request: %s - %s",
                    error.path("error").asText("unknown_error"),
                    error.path("error_description").asText("No description provided."));
            throw logged(new BadRequestException(message, body));
        } else {
            throw logged(new RequestFailedException(
                    String.format("Authentication failed: %d %s", status.value(), body), status, body));
        }
    }

    public String createCampaign(String name, BigDecimal budget, BigDecimal bid, List<String> countries) {
        requireAuthenticated();
        return createCampaign(new CampaignRequest(name, budget, bid, countries));
    }

    /**
     * Creates a boost and returns the id the platform assigned to it.
     *
     * @throws NotAuthenticatedException   if {@link #authenticate()} has not succeeded yet
     * @throws ProtocolViolationException  if a 200/201 response carries no campaign id
     */
    public String createCampaign(CampaignRequest request) {
        requireAuthenticated();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", request.name());
        payload.put("budget", request.budget());
        payload.put("bid_amount", request.bid());
        payload.put("country_codes", request.countryCodes());

        log.info("Creating campaign: {} (budget: {}, bid: {}, countries: {})",
                request.name(), request.budget(), request.bid(), request.countryCodes());
        ResponseEntity<String> response = send(
                RequestEntity.post(endpoint(CREATE_BOOST_PATH)).headers(authHeaders()).body(payload));
        HttpStatusCode status = response.getStatusCode();
        String body = response.getBody();

        if (!status.isSameCodeAs(HttpStatus.OK) && !status.isSameCodeAs(HttpStatus.CREATED)) {
            throw apiError(response);
        }

        JsonNode data = readJsonOrViolation(status, body).path("data");
        if (!data.isArray() || data.isEmpty() || !data.get(0).hasNonNull("id")) {
            throw logged(new ProtocolViolationException(
                    "Create campaign response does not contain campaign ID.", status, body));
        }

        String campaignId = data.get(0).get("id").asText();
        log.log(LogLevels.SUCCESS, "Campaign created successfully, ID: {}", campaignId);
        return campaignId;
    }

    /**
     * Fetches the performance records of one boost, exactly as the platform returned them.
     * An empty list is a valid answer.
     *
     * @throws NotAuthenticatedException   if {@link #authenticate()} has not succeeded yet
     * @throws ProtocolViolationException  if a 200 response has no "data" key
     */
    public List<Map<String, Object>> getCampaignStats(String campaignId) {
        requireAuthenticated();

        URI uri = UriComponentsBuilder.fromHttpUrl(apiUrl + BOOST_PERFORMANCE_PATH)
                .queryParam("boost_id", "{boostId}")
                .encode()
                .buildAndExpand(campaignId)
                .toUri();

        log.info("Fetching stats for campaign: {}", campaignId);
        ResponseEntity<String> response = send(RequestEntity.get(uri).headers(authHeaders()).build());
        HttpStatusCode status = response.getStatusCode();
        String body = response.getBody();

        if (!status.isSameCodeAs(HttpStatus.OK)) {
            throw apiError(response);
        }

        JsonNode data = readJsonOrViolation(status, body).get("data");
        if (data == null || data.isNull()) {
            throw logged(new ProtocolViolationException(
                    "Response JSON does not contain \"data\" key.", status, body));
        }

        List<Map<String, Object>> stats = toRecords(data, status, body);
        log.log(LogLevels.SUCCESS, "Stats received for campaign {}: {}", campaignId, stats);
        return stats;
    }

    private List<Map<String, Object>> toRecords(JsonNode data, HttpStatusCode status, String body) {
        try {
            if (data.isObject()) {
                return List.of(objectMapper.convertValue(data, STATS_RECORD));
            }
            if (data.isArray()) {
                List<Map<String, Object>> records = new ArrayList<>(data.size());
                for (JsonNode element : data) {
                    records.add(objectMapper.convertValue(element, STATS_RECORD));
                }
                return records;
            }
        } catch (IllegalArgumentException e) {
            throw logged(new ProtocolViolationException(
                    "Response \"data\" is not a list of stats records.", status, body, e));
        }
        throw logged(new ProtocolViolationException(
                "Response \"data\" is not a list of stats records.", status, body));
    }

    /**
     * Maps a rejected create/stats response to its exception; callers always throw the result.
     */
    private RevcontentApiException apiError(ResponseEntity<String> response) {
        HttpStatusCode status = response.getStatusCode();
        String body = response.getBody();

        if (!status.isSameCodeAs(HttpStatus.BAD_REQUEST)) {
            return logged(new RequestFailedException(
                    String.format("API request failed: %d %s", status.value(), body), status, body));
        }

        String details = body;
        try {
            JsonNode errors = objectMapper.readTree(body == null ? "" : body).path("errors");
            if (isErrorList(errors)) {
                details = describeErrors(errors);
            }
        } catch (JsonProcessingException e) {
            log.debug("400 response body is not JSON: {}", e.getOriginalMessage());
        }
        return logged(new BadRequestException("400 Bad Request: " + details, body));
    }

    private static boolean isErrorList(JsonNode errors) {
        if (!errors.isArray()) {
            return false;
        }
        for (JsonNode error : errors) {
            if (!error.isObject()) {
                return false;
            }
        }
        return true;
    }

    private static String describeErrors(JsonNode errors) {
        List<String> messages = new ArrayList<>();
        for (JsonNode error : errors) {
            messages.add(String.format("[%s] %s - %s",
                    error.path("code").asText("Unknown code"),
                    error.path("title").asText("Unknown title"),
                    error.path("detail").asText("No details provided")));
        }
        return String.join("; ", messages);
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setCacheControl(CacheControl.noCache());
        return headers;
    }

    private void requireAuthenticated() {
        if (!StringUtils.hasLength(accessToken)) {
            throw logged(new NotAuthenticatedException());
        }
    }

    private ResponseEntity<String> send(RequestEntity<?> request) {
        try {
            return restTemplate.exchange(request, String.class);
        } catch (HttpStatusCodeException e) {
            return ResponseEntity.status(e.getStatusCode())
                    .headers(e.getResponseHeaders())
                    .body(e.getResponseBodyAsString());
        }
    }

    private URI endpoint(String path) {
        return URI.create(apiUrl + path);
    }

    private JsonNode readJsonOrViolation(HttpStatusCode status, String body) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw logged(new ProtocolViolationException("Response is not valid JSON.", status, body, e));
        }
    }

    private JsonNode readJsonOrMissing(String body) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON: {}", e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static <E extends RevcontentApiException> E logged(E exception) {
        log.error(exception.getMessage());
        return exception;
    }
}
