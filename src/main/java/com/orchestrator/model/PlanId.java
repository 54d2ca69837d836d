package com.orchestrator.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A plan identifier split into its version-independent base and optional version.
 * {@code "plan-42-v3"} parses to base {@code "plan-42"} and version {@code 3};
 * an id without a {@code -v<N>} suffix is its own base.
 *
 * @param basePlanId The id without the version suffix.
 * @param version    The version number, or {@code null} when the id is unversioned.
 */
public record PlanId(String basePlanId, Integer version) {

    private static final Pattern VERSIONED = Pattern.compile("^(.+)-v(\\d+)$");

    public static PlanId parse(String planId) {
        Matcher matcher = VERSIONED.matcher(planId);
        if (matcher.matches()) {
            return new PlanId(matcher.group(1), Integer.parseInt(matcher.group(2)));
        }
        return new PlanId(planId, null);
    }
}
