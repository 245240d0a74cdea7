package com.centinel.core.config;

import com.centinel.core.CentinelException;

/**
 * Invalid or unreadable configuration. Raised before any document is processed.
 */
public class ConfigurationException extends CentinelException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
