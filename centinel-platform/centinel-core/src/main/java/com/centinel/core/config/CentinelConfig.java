package com.centinel.core.config;

import com.centinel.core.normalizer.FieldMapConfig;
import com.centinel.core.rules.RuleConfig;
import com.centinel.core.rules.RuleRegistry;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Complete configuration of the evidence pipeline, loaded once at startup and
 * passed explicitly to the components that need it.
 */
public record CentinelConfig(
        @JsonProperty("field_map") FieldMapConfig fieldMap,
        @JsonProperty("candidate_count") int candidateCount,
        @JsonProperty("required_keys") List<String> requiredKeys,
        @JsonProperty("rules") RuleConfig rules,
        @JsonProperty("pipeline") PipelineSettings pipeline
) {

    public CentinelConfig {
        Objects.requireNonNull(fieldMap, "Field map cannot be null");
        Objects.requireNonNull(rules, "Rule config cannot be null");
        Objects.requireNonNull(pipeline, "Pipeline settings cannot be null");
        requiredKeys = requiredKeys != null ? List.copyOf(requiredKeys) : List.of();
    }

    public static CentinelConfig defaults() {
        return new CentinelConfig(FieldMapConfig.defaults(), 0, List.of(),
                RuleConfig.defaults(), PipelineSettings.defaults());
    }

    @JsonCreator
    static CentinelConfig fromJson(
            @JsonProperty("field_map") FieldMapConfig fieldMap,
            @JsonProperty("candidate_count") Integer candidateCount,
            @JsonProperty("required_keys") List<String> requiredKeys,
            @JsonProperty("rules") RuleConfig rules,
            @JsonProperty("pipeline") PipelineSettings pipeline) {
        return new CentinelConfig(
                fieldMap != null ? fieldMap : FieldMapConfig.defaults(),
                candidateCount != null ? candidateCount : 0,
                requiredKeys,
                rules != null ? rules : RuleConfig.defaults(),
                pipeline != null ? pipeline : PipelineSettings.defaults());
    }

    public CentinelConfig withRules(RuleConfig newRules) {
        return new CentinelConfig(fieldMap, candidateCount, requiredKeys, newRules, pipeline);
    }

    public CentinelConfig withFieldMap(FieldMapConfig newFieldMap) {
        return new CentinelConfig(newFieldMap, candidateCount, requiredKeys, rules, pipeline);
    }

    public CentinelConfig withPipeline(PipelineSettings newPipeline) {
        return new CentinelConfig(fieldMap, candidateCount, requiredKeys, rules, newPipeline);
    }

    /**
     * Validates against the built-in rule set.
     */
    public void validate() {
        validate(RuleRegistry.defaults().ids());
    }

    public void validate(Collection<String> knownRuleIds) {
        if (candidateCount < 0) {
            throw new ConfigurationException("candidate_count cannot be negative: " + candidateCount);
        }
        for (String key : requiredKeys) {
            if (key == null || key.isBlank()) {
                throw new ConfigurationException("required_keys cannot contain blank paths");
            }
        }
        fieldMap.validate();
        rules.validate();
        rules.validateRuleIds(knownRuleIds);
        pipeline.validate();
    }
}
