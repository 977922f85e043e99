package com.practicum.homeworkbot.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.practicum.homeworkbot.config.HomeworkBotConfig;
import com.practicum.homeworkbot.exception.MalformedPayloadException;
import com.practicum.homeworkbot.exception.TransportException;
import com.practicum.homeworkbot.exception.WrongStatusCodeException;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;

/**
 * Reads homework statuses from the review API. One request per call; retrying is the poller's job.
 */
@Component
public class HomeworkApiClient {

    private static final Logger log = LoggerFactory.getLogger(HomeworkApiClient.class);

    static final String FROM_DATE_PARAM = "from_date";

    private final RestClient restClient;
    private final HomeworkBotConfig config;
    private final ObjectMapper objectMapper;

    public HomeworkApiClient(@Qualifier("homeworkRestClient") RestClient restClient,
                             HomeworkBotConfig config,
                             ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Fetches statuses changed at or after {@code cursor}.
     *
     * @param cursor epoch seconds sent as {@code from_date}
     * @return decoded response body
     * @throws TransportException        if the request could not be completed
     * @throws WrongStatusCodeException  if the API answered with anything but 200
     * @throws MalformedPayloadException if the body is not JSON
     */
    @Observed(name = "homework.fetch", contextualName = "fetch-homework-statuses")
    public JsonNode fetch(long cursor) {
        RawResponse response;
        try {
            response = restClient.get()
                    .uri(uriBuilder -> uriBuilder.queryParam(FROM_DATE_PARAM, cursor).build())
                    .header(HttpHeaders.AUTHORIZATION, "OAuth " + config.getApiToken())
                    .accept(MediaType.APPLICATION_JSON)
                    .exchange((request, clientResponse) -> new RawResponse(
                            clientResponse.getStatusCode().value(),
                            clientResponse.getStatusText(),
                            StreamUtils.copyToString(clientResponse.getBody(), StandardCharsets.UTF_8)));
        } catch (RestClientException e) {
            throw new TransportException("Request to " + config.getEndpoint() + " failed: " + e.getMessage(), e);
        }

        if (response.status() != HttpStatus.OK.value()) {
            log.warn("Review API answered HTTP {} {}, body: {}", response.status(), response.reason(), response.body());
            throw new WrongStatusCodeException(config.getEndpoint(), response.status(), response.reason(), response.body());
        }

        log.debug("Fetched homework statuses from_date={}", cursor);
        return decode(response.body());
    }

    private JsonNode decode(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null ? node : MissingNode.getInstance();
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Response body is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private record RawResponse(int status, String reason, String body) {}
}
