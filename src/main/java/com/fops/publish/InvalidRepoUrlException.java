package com.fops.publish;

import com.fops.core.error.ConfigurationException;

public class InvalidRepoUrlException extends ConfigurationException {

    public InvalidRepoUrlException(String platform, String url) {
        super("Invalid " + platform + " URL: " + url);
    }
}
