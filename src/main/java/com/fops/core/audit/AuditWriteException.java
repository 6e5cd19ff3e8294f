package com.fops.core.audit;

import com.fops.core.error.FopsException;

/**
 * An audit entry could not be made durable. Always propagated: a proposal
 * without its audit record must not be reported as successful.
 */
public class AuditWriteException extends FopsException {

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
