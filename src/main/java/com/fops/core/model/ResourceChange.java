package com.fops.core.model;

import java.io.Serializable;

/**
 * One planned resource change, in plan emission order.
 *
 * @param type     resource type, e.g. {@code aws_s3_bucket}
 * @param name     resource name within its module
 * @param action   planned action
 * @param provider provider name, empty when the plan omits it
 * @param address  full resource address, e.g. {@code module.net.aws_vpc.main}
 */
public record ResourceChange(
    String type,
    String name,
    ChangeAction action,
    String provider,
    String address
) implements Serializable {}
