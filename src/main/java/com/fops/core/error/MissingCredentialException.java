package com.fops.core.error;

public class MissingCredentialException extends ConfigurationException {

    private final String platform;

    public MissingCredentialException(String platform) {
        super("No API token configured for " + platform);
        this.platform = platform;
    }

    public String platform() {
        return platform;
    }
}
