package com.fops.publish;

import com.fops.core.error.ConfigurationException;

public class UnsupportedPlatformException extends ConfigurationException {

    public UnsupportedPlatformException(String repoUrl) {
        super("Unsupported repository platform: " + repoUrl);
    }
}
