package com.fops.publish;

import com.fops.core.error.FopsException;

import java.util.Locale;

/**
 * A git platform REST call failed. {@link #status()} is the HTTP status, or
 * {@code 0} when no response was received.
 */
public class PlatformApiException extends FopsException {

    private final String platform;
    private final int status;
    private final String responseBody;

    public PlatformApiException(String platform, int status, String message, String responseBody) {
        super(message);
        this.platform = platform;
        this.status = status;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    public PlatformApiException(String platform, String message, Throwable cause) {
        super(message, cause);
        this.platform = platform;
        this.status = 0;
        this.responseBody = "";
    }

    public String platform() {
        return platform;
    }

    public int status() {
        return status;
    }

    public String responseBody() {
        return responseBody;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    /**
     * True for the "already exists" rejections both platforms return when a
     * branch, pull request or merge request is created a second time.
     */
    public boolean isAlreadyExists() {
        if (status != 400 && status != 409 && status != 422) {
            return false;
        }
        return responseBody.toLowerCase(Locale.ROOT).contains("already exists");
    }
}
