package com.phillippitts.champ.service.ensemble;

import com.phillippitts.champ.exception.EndpointException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.Objects;

/**
 * {@link ModelTransport} over Spring's {@link RestClient}.
 *
 * <p>POSTs {@code {"prompt": ..., "round_id": ...}} as JSON. The per-attempt timeout is a property of
 * the request factory the {@code RestClient} was built with; non-2xx statuses surface from
 * {@code retrieve()} as {@link RestClientException}s.
 */
public class RestClientModelTransport implements ModelTransport {

    private final RestClient restClient;

    public RestClientModelTransport(RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    public String generate(URI endpoint, String prompt, String roundId) {
        String payload = new JSONObject()
                .put("prompt", prompt)
                .put("round_id", roundId)
                .toString();
        String body;
        try {
            body = restClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new EndpointException("Request to " + endpoint + " failed: " + e.getMessage(), e);
        }
        return ModelReplyParser.extractText(body);
    }
}
