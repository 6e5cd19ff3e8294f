package com.fops.publish;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Generates {@code fops-<kind>-<yyyyMMdd-HHmmss>} branch names (UTC).
 */
@Component
public class BranchNames {

    private static final DateTimeFormatter SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Clock clock;

    public BranchNames(Clock clock) {
        this.clock = clock;
    }

    public String next(String kind) {
        String slug = kind.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return "fops-" + slug + "-" + SUFFIX.format(clock.instant().atZone(ZoneOffset.UTC));
    }
}
