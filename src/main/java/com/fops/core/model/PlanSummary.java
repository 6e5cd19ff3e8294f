package com.fops.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Terraform-style add/change/destroy counters.
 */
public record PlanSummary(int add, int change, int destroy) implements Serializable {

    public static PlanSummary of(List<ResourceChange> changes) {
        int add = 0;
        int change = 0;
        int destroy = 0;
        for (ResourceChange rc : changes) {
            switch (rc.action()) {
                case CREATE -> add++;
                case UPDATE -> change++;
                case DELETE -> destroy++;
                default -> { }
            }
        }
        return new PlanSummary(add, change, destroy);
    }
}
