package com.fops.core.security;

import com.fops.core.error.ConfigurationException;

public class NotAllowListedException extends ConfigurationException {

    private final String target;

    public NotAllowListedException(String target) {
        super("Target not allow-listed: " + target);
        this.target = target;
    }

    public String target() {
        return target;
    }
}
