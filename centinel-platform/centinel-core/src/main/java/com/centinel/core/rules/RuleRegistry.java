package com.centinel.core.rules;

import com.centinel.core.config.ConfigurationException;

import java.util.*;

/**
 * Ordered set of available rules. The order is the evaluation order and is
 * part of the rule-set version.
 */
public final class RuleRegistry {

    public static final String RULE_SET_VERSION = "1.1.0";

    private final List<IntegrityRule> rules;
    private final Map<String, IntegrityRule> byId;

    public RuleRegistry(List<IntegrityRule> rules) {
        Objects.requireNonNull(rules, "Rules cannot be null");
        Map<String, IntegrityRule> index = new LinkedHashMap<>();
        for (IntegrityRule rule : rules) {
            Objects.requireNonNull(rule, "Rule cannot be null");
            if (index.putIfAbsent(rule.id(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
        }
        this.rules = List.copyOf(rules);
        this.byId = Collections.unmodifiableMap(index);
    }

    /**
     * The built-in rule set.
     */
    public static RuleRegistry defaults() {
        return new RuleRegistry(List.of(
                new AccumulatedCountIntegrityRule(),
                new TemporalMonotonicityRule(),
                new ArithmeticConsistencyRule(),
                new AtypicalVariationRule(),
                new ImplicitRewriteRule(),
                new RelativeVariationRule(),
                new ScrutinyJumpRule(),
                new TotalsDiscrepancyRule(),
                new TurnoutImpossibleRule(),
                new ProcessedUnitsOverflowRule(),
                new NullBlankShareRule(),
                new BenfordFirstDigitRule(),
                new LastDigitUniformityRule()));
    }

    public List<IntegrityRule> rules() {
        return rules;
    }

    public List<String> ids() {
        return List.copyOf(byId.keySet());
    }

    public Optional<IntegrityRule> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Rules named in {@code ids}, in registry order.
     *
     * @throws ConfigurationException if an id is not registered
     */
    public List<IntegrityRule> select(Collection<String> ids) {
        Objects.requireNonNull(ids, "Rule ids cannot be null");
        for (String id : ids) {
            if (!byId.containsKey(id)) {
                throw new ConfigurationException("Unknown rule '" + id + "', known rules: " + ids());
            }
        }
        Set<String> wanted = new HashSet<>(ids);
        return rules.stream().filter(rule -> wanted.contains(rule.id())).toList();
    }

    /**
     * Ids of the rules switched on by {@code config}, in registry order.
     */
    public List<String> enabledIds(RuleConfig config) {
        return rules.stream().map(IntegrityRule::id).filter(config::isEnabled).toList();
    }
}
