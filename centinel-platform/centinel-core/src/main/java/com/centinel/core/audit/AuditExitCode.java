package com.centinel.core.audit;

/**
 * Process exit status of an audit run. When several conditions hold the most
 * severe wins: configuration error, then no enabled rules, then chain
 * failure, then normalization failure.
 */
public enum AuditExitCode {
    SUCCESS(0),
    CHAIN_VERIFICATION_FAILED(2),
    NORMALIZATION_FAILED(3),
    NO_ENABLED_RULES(4),
    CONFIGURATION_ERROR(5);

    private final int code;

    AuditExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    static AuditExitCode of(boolean noRules, boolean chainFailed, boolean normalizationFailed) {
        if (noRules) {
            return NO_ENABLED_RULES;
        }
        if (chainFailed) {
            return CHAIN_VERIFICATION_FAILED;
        }
        if (normalizationFailed) {
            return NORMALIZATION_FAILED;
        }
        return SUCCESS;
    }
}
