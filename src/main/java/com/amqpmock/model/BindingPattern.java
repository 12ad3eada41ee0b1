package com.amqpmock.model;

import java.util.regex.Pattern;

/**
 * A binding key compiled once into an anchored matcher.
 *
 * <p>A key containing {@code #} has every {@code #} turned into "any run of characters,
 * dots included". Otherwise a key containing {@code *} has every {@code *} turned into
 * "any run of characters without a dot". Everything else in the key is matched literally,
 * and the whole routing key must match.
 */
public final class BindingPattern {
    private static final String MULTI_WORD = ".*";
    private static final String SINGLE_WORD = "[^.]*";

    private final String source;
    private final Pattern pattern;

    private BindingPattern(String source, Pattern pattern) {
        this.source = source;
        this.pattern = pattern;
    }

    public static BindingPattern compile(String bindingKey) {
        if (bindingKey == null) {
            throw new IllegalArgumentException("Binding key must not be null");
        }

        String regex;
        if (bindingKey.indexOf('#') >= 0) {
            regex = translate(bindingKey, '#', MULTI_WORD);
        } else if (bindingKey.indexOf('*') >= 0) {
            regex = translate(bindingKey, '*', SINGLE_WORD);
        } else {
            regex = Pattern.quote(bindingKey);
        }
        return new BindingPattern(bindingKey, Pattern.compile(regex));
    }

    private static String translate(String bindingKey, char wildcard, String replacement) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int index;
        while ((index = bindingKey.indexOf(wildcard, start)) >= 0) {
            if (index > start) {
                regex.append(Pattern.quote(bindingKey.substring(start, index)));
            }
            regex.append(replacement);
            start = index + 1;
        }
        if (start < bindingKey.length()) {
            regex.append(Pattern.quote(bindingKey.substring(start)));
        }
        return regex.toString();
    }

    public boolean matches(String routingKey) {
        return routingKey != null && pattern.matcher(routingKey).matches();
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return String.format("BindingPattern{source='%s', regex='%s'}", source, pattern.pattern());
    }
}
