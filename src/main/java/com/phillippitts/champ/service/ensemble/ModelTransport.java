package com.phillippitts.champ.service.ensemble;

import com.phillippitts.champ.exception.EndpointException;

import java.net.URI;

/**
 * Performs a single generate attempt against an endpoint. No retries.
 */
@FunctionalInterface
public interface ModelTransport {

    /**
     * @param endpoint endpoint URL
     * @param prompt   prompt text
     * @param roundId  round identifier
     * @return answer text extracted from the response body
     * @throws EndpointException on I/O error, timeout, non-2xx status or malformed body
     */
    String generate(URI endpoint, String prompt, String roundId);
}
