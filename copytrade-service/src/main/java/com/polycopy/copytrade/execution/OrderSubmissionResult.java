package com.polycopy.copytrade.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Executor response; {@code clobResponse} is the CLOB's order payload passed through verbatim.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderSubmissionResult(
        String mode,
        JsonNode clobResponse
) {
}
