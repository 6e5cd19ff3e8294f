package com.fops.publish;

/**
 * Outcome of a publish or attach call, with the id of the audit entry that
 * recorded it.
 *
 * @param success  whether the platform call went through
 * @param url      proposal URL; null when publishing failed
 * @param error    failure message, null on success
 * @param auditId  audit entry written for this call
 * @param rejected true when the call was refused by configuration (allow-list,
 *                 credentials, platform) rather than failing at the platform
 */
public record PublishResult(boolean success, String url, String error, String auditId, boolean rejected) {

    public static PublishResult succeeded(String url, String auditId) {
        return new PublishResult(true, url, null, auditId, false);
    }

    public static PublishResult failed(String url, String error, String auditId, boolean rejected) {
        return new PublishResult(false, url, error, auditId, rejected);
    }
}
