package com.jobgrid.logging;

import com.jobgrid.config.JobGridProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts credentials from job log messages before they are stored.
 */
@Component
public class LogSanitizer {

    private final List<Rule> rules;

    public LogSanitizer(JobGridProperties properties) {
        String replacement = Matcher.quoteReplacement(properties.getLogs().getSanitizerReplacement());
        List<Rule> compiled = new ArrayList<>();
        for (JobGridProperties.SanitizerPattern pattern : properties.getLogs().getSanitizerPatterns()) {
            if (pattern.getRegex() == null || pattern.getRegex().isBlank()) {
                continue;
            }
            String template = pattern.getReplacement() == null ? "{replacement}" : pattern.getReplacement();
            compiled.add(new Rule(Pattern.compile(pattern.getRegex()), template.replace("{replacement}", replacement)));
        }
        this.rules = List.copyOf(compiled);
    }

    public String sanitize(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String sanitized = message;
        for (Rule rule : rules) {
            sanitized = rule.pattern().matcher(sanitized).replaceAll(rule.replacement());
        }
        return sanitized;
    }

    private record Rule(Pattern pattern, String replacement) {
    }
}
