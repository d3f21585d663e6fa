package com.metricsentinel.core.rules;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Entity and metric scope of a rule.
 *
 * <p>
 * Entity and metric entries are glob patterns where {@code *} matches any
 * run of characters. An empty list matches everything.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScopeFilter {

    private static final ScopeFilter ALL = new ScopeFilter(List.of(), List.of());

    private final List<Pattern> entities;
    private final List<Pattern> metrics;

    private ScopeFilter(List<Pattern> entities, List<Pattern> metrics) {
        this.entities = entities;
        this.metrics = metrics;
    }

    public static ScopeFilter of(List<String> entityGlobs, List<String> metricGlobs) {
        Objects.requireNonNull(entityGlobs, "entityGlobs must not be null");
        Objects.requireNonNull(metricGlobs, "metricGlobs must not be null");
        return new ScopeFilter(
                entityGlobs.stream().map(ScopeFilter::compile).toList(),
                metricGlobs.stream().map(ScopeFilter::compile).toList());
    }

    public static ScopeFilter all() {
        return ALL;
    }

    public boolean matches(String entityId, String metric) {
        return matchesAny(entities, entityId) && matchesAny(metrics, metric);
    }

    /**
     * @param glob  pattern with {@code *} wildcards
     * @param value value to test; {@code null} never matches
     * @return {@code true} if the whole value matches the pattern
     */
    public static boolean globMatches(String glob, String value) {
        Objects.requireNonNull(glob, "glob must not be null");
        return value != null && compile(glob).matcher(value).matches();
    }

    private static boolean matchesAny(List<Pattern> patterns, String value) {
        if (patterns.isEmpty()) {
            return true;
        }
        if (value == null) {
            return false;
        }
        for (Pattern p : patterns) {
            if (p.matcher(value).matches()) {
                return true;
            }
        }
        return false;
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        int from = 0;
        int star;
        while ((star = glob.indexOf('*', from)) >= 0) {
            if (star > from) {
                regex.append(Pattern.quote(glob.substring(from, star)));
            }
            regex.append(".*");
            from = star + 1;
        }
        if (from < glob.length()) {
            regex.append(Pattern.quote(glob.substring(from)));
        }
        return Pattern.compile(regex.toString());
    }
}
