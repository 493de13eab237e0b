package com.chatrelay.error;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed set of failure classifications used for error-count aggregation.
 *
 * The JSON names double as map keys in the metrics read model.
 */
public enum ErrorCategory {
    @JsonProperty("api")
    API("api"),
    @JsonProperty("config")
    CONFIG("config"),
    @JsonProperty("protocol")
    PROTOCOL("protocol"),
    @JsonProperty("validation")
    VALIDATION("validation"),
    @JsonProperty("not_found")
    NOT_FOUND("not_found"),
    @JsonProperty("rate_limit")
    RATE_LIMIT("rate_limit"),
    @JsonProperty("network")
    NETWORK("network"),
    @JsonProperty("internal")
    INTERNAL("internal");

    private final String label;

    ErrorCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
