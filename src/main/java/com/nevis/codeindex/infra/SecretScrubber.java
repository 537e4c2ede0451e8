package com.nevis.codeindex.infra;

import java.util.List;
import java.util.regex.Pattern;

/** Redacts credentials from text that is about to be logged or persisted. */
public final class SecretScrubber {

    public static final String REDACTED = "[REDACTED]";

    private record Rule(Pattern pattern, String replacement) {}

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("(?<=://)[^/\\s@]+@"), REDACTED + "@"),
            new Rule(Pattern.compile("ghp_[A-Za-z0-9_]{20,}"), REDACTED),
            new Rule(Pattern.compile("github_pat_[A-Za-z0-9_]{20,}"), REDACTED),
            new Rule(Pattern.compile("glpat-[A-Za-z0-9\\-_]{20,}"), REDACTED),
            new Rule(Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9\\-_.~+/]+=*"), "Bearer " + REDACTED),
            new Rule(Pattern.compile("(?i)\\b(access_token|private_token|api_key|token)=[^&\\s]+"), "$1=" + REDACTED));

    private SecretScrubber() {
    }

    public static String scrub(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Rule rule : RULES) {
            result = rule.pattern().matcher(result).replaceAll(rule.replacement());
        }
        return result;
    }
}
