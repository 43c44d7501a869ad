package com.tablesmith.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A check constraint. The expression is a raw dialect fragment and is never inspected.
 */
public record DbCheck(
        @JsonProperty("name") String name,
        @JsonProperty("expression") String expression
) {}
