package com.fops.core.error;

/**
 * A request cannot proceed with the current configuration: missing
 * credentials, a target outside the allow-list, or an unsupported platform.
 * Raised before any side effect and never retried.
 */
public class ConfigurationException extends FopsException {

    public ConfigurationException(String message) {
        super(message);
    }
}
