package com.phillippitts.champ.service.ensemble;

import com.phillippitts.champ.exception.EndpointException;

/**
 * Contract for one remote inference endpoint taking part in a dispatch round.
 *
 * <p>Thread Safety: implementations must tolerate concurrent {@link #generate} calls and
 * concurrent stats reads.
 */
public interface ModelClient {

    /**
     * @return configured endpoint name used in results, logs and metrics
     */
    String getName();

    /**
     * Performs one logical generate request, retrying transient failures internally.
     *
     * @param prompt  prompt text
     * @param roundId round identifier forwarded to the endpoint
     * @return answer text and latency of the successful attempt
     * @throws EndpointException once retries are exhausted
     */
    ModelResponse generate(String prompt, String roundId);

    /**
     * @return a copy of the rolling call counters
     */
    EndpointStats getStats();

    /**
     * @return true while the client's error count is below its health threshold
     */
    boolean isHealthy();
}
