package com.phillippitts.champ.service.ensemble;

import java.util.Objects;

/**
 * Answer from one successful endpoint attempt.
 *
 * @param text      model output ("" when the endpoint returned neither {@code text} nor {@code response})
 * @param latencyMs wall time of the successful attempt in milliseconds
 */
public record ModelResponse(String text, double latencyMs) {
    public ModelResponse {
        Objects.requireNonNull(text, "text");
    }
}
