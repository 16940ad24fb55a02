package com.poker.tracker.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poker.tracker.model.Hand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the external hand analysis backend. Sends parsed hands as JSON
 * and returns the commentary text. Failures are logged and come back empty.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HandAnalysisClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${analysis.api.base-url}")
    private String baseUrl;

    @Value("${analysis.api.hand-endpoint}")
    private String handEndpoint;

    @Value("${analysis.api.session-endpoint}")
    private String sessionEndpoint;

    public Optional<String> analyzeHand(Hand hand) {
        return post(handEndpoint, Map.of("hand", hand), "hand " + hand.getHandId());
    }

    public Optional<String> analyzeSession(List<Hand> hands) {
        if (hands.isEmpty()) {
            return Optional.empty();
        }
        return post(sessionEndpoint, Map.of("hands", hands), "session of " + hands.size() + " hands");
    }

    private Optional<String> post(String endpoint, Map<String, Object> payload, String subject) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            String body = objectMapper.writeValueAsString(payload);

            log.debug("Requesting analysis of {} from {}", subject, baseUrl + endpoint);
            String response = restTemplate.postForObject(baseUrl + endpoint, new HttpEntity<>(body, headers), String.class);

            if (response == null || response.isBlank()) {
                log.warn("Empty analysis response for {}", subject);
                return Optional.empty();
            }
            return parseResponse(response, subject);

        } catch (JsonProcessingException e) {
            log.error("Could not serialize {}: {}", subject, e.getMessage());
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Error requesting analysis of {}: {}", subject, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> parseResponse(String response, String subject) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode commentary = root.path("commentary");
            if (commentary.isMissingNode() || commentary.isNull() || commentary.asText().isBlank()) {
                log.warn("Analysis response for {} has no commentary", subject);
                return Optional.empty();
            }
            return Optional.of(commentary.asText());
        } catch (JsonProcessingException e) {
            log.error("Error parsing analysis response for {}: {}", subject, e.getMessage());
            return Optional.empty();
        }
    }
}
