package com.stocksync.routing;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Filename pattern plus destination template. {@value #CODE_PLACEHOLDER} in the template is
 * replaced with the pattern's first capture group.
 */
public final class RoutingRule {
    public static final String CODE_PLACEHOLDER = "{code}";

    private final Pattern pattern;
    private final String destinationTemplate;

    private RoutingRule(Pattern pattern, String destinationTemplate) {
        this.pattern = pattern;
        this.destinationTemplate = destinationTemplate;
    }

    public static RoutingRule of(String regex, String destinationTemplate) {
        if (regex == null || regex.isBlank()) {
            throw new IllegalArgumentException("routing pattern must not be blank");
        }
        if (destinationTemplate == null || destinationTemplate.isBlank()) {
            throw new IllegalArgumentException("routing destination must not be blank for pattern " + regex);
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex.trim(), Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid routing pattern: " + regex, e);
        }
        String template = trimSlashes(destinationTemplate.trim());
        if (template.contains(CODE_PLACEHOLDER) && pattern.matcher("").groupCount() < 1) {
            throw new IllegalArgumentException("routing destination " + template
                    + " uses " + CODE_PLACEHOLDER + " but pattern " + regex + " has no capture group");
        }
        return new RoutingRule(pattern, template);
    }

    public boolean matches(String filename) {
        return pattern.matcher(filename).find();
    }

    /**
     * Destination for a matching filename. Empty when the pattern does not match, or when the
     * template needs a code and the capture group took no part in the match.
     */
    public Optional<String> resolve(String filename) {
        Matcher m = pattern.matcher(filename);
        if (!m.find()) {
            return Optional.empty();
        }
        if (!destinationTemplate.contains(CODE_PLACEHOLDER)) {
            return Optional.of(destinationTemplate);
        }
        String code = m.group(1);
        if (code == null) {
            return Optional.empty();
        }
        return Optional.of(destinationTemplate.replace(CODE_PLACEHOLDER, code));
    }

    public String pattern() {
        return pattern.pattern();
    }

    public String destinationTemplate() {
        return destinationTemplate;
    }

    @Override
    public String toString() {
        return pattern.pattern() + " => " + destinationTemplate;
    }

    private static String trimSlashes(String value) {
        String out = value.replace('\\', '/');
        while (out.startsWith("/")) {
            out = out.substring(1);
        }
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
