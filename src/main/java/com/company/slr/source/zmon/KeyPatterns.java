package com.company.slr.source.zmon;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shell-style glob patterns over KairosDB {@code key} tags: {@code *}, {@code ?},
 * {@code [seq]} and {@code [!seq]}. Matching is case-sensitive and covers the whole key.
 */
public final class KeyPatterns {

    private static final String REGEX_META = "\\.^$|+(){}[]";

    private static final KeyPatterns NONE = new KeyPatterns(List.of());

    private final List<Pattern> patterns;

    private KeyPatterns(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    public static KeyPatterns of(Collection<String> globs) {
        if (globs == null || globs.isEmpty()) {
            return NONE;
        }
        return new KeyPatterns(globs.stream().map(KeyPatterns::compile).toList());
    }

    public boolean matchesAny(String key) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(key).matches()) {
                return true;
            }
        }
        return false;
    }

    static Pattern compile(String glob) {
        return Pattern.compile(toRegex(glob), Pattern.DOTALL);
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        int i = 0;
        int n = glob.length();

        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') j++;
                if (j < n && glob.charAt(j) == ']') j++;
                while (j < n && glob.charAt(j) != ']') j++;

                if (j >= n) {
                    // Unterminated: a literal bracket
                    regex.append("\\[");
                } else {
                    String set = glob.substring(i, j);
                    i = j + 1;
                    regex.append('[');
                    if (set.startsWith("!")) {
                        regex.append('^');
                        set = set.substring(1);
                    } else if (set.startsWith("^")) {
                        regex.append('\\');
                    }
                    regex.append(set.replace("\\", "\\\\").replace("[", "\\[").replace("&&", "&\\&"));
                    regex.append(']');
                }
            } else {
                if (REGEX_META.indexOf(c) >= 0) {
                    regex.append('\\');
                }
                regex.append(c);
            }
        }
        return regex.toString();
    }
}
