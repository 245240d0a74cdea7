package com.centinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.OptionalDouble;

/**
 * Counting progress as reported by the source: processed and expected units
 * (tally sheets). Either value may be absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Progress(
        @JsonProperty("processed_units") Long processedUnits,
        @JsonProperty("total_units") Long totalUnits
) {

    public static Progress unknown() {
        return new Progress(null, null);
    }

    /**
     * Completion percentage recomputed from the integer counters.
     * Empty when either counter is missing or the expected total is zero.
     */
    @JsonIgnore
    public OptionalDouble completionPercentage() {
        if (processedUnits == null || totalUnits == null || totalUnits <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(processedUnits * 100.0 / totalUnits);
    }
}
