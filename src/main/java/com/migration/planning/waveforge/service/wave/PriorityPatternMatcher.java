package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.exception.MalformedPatternException;

import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches object names against user prioritization patterns.
 *
 * A pattern without {@code *} or {@code ?} is compared as an exact string, so names containing
 * brackets are not mistaken for character classes. Any other pattern is a glob supporting
 * {@code *}, {@code ?}, {@code [seq]} and {@code [!seq]}. Exact names are checked before globs.
 */
public final class PriorityPatternMatcher {

    private static final PriorityPatternMatcher NONE = new PriorityPatternMatcher(Set.of(), List.of());

    private final Set<String> exactNames;
    private final List<Pattern> globs;

    private PriorityPatternMatcher(Set<String> exactNames, List<Pattern> globs) {
        this.exactNames = exactNames;
        this.globs = globs;
    }

    /**
     * Compile all patterns up front.
     *
     * @throws MalformedPatternException on the first null, blank or unparsable pattern
     */
    public static PriorityPatternMatcher compile(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return NONE;
        }
        Set<String> exact = new HashSet<>();
        List<Pattern> globs = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                throw new MalformedPatternException(String.valueOf(pattern), "pattern must not be blank");
            }
            if (pattern.indexOf('*') < 0 && pattern.indexOf('?') < 0) {
                exact.add(pattern);
            } else {
                globs.add(toRegex(pattern));
            }
        }
        return new PriorityPatternMatcher(exact, globs);
    }

    public static PriorityPatternMatcher none() {
        return NONE;
    }

    public boolean isEmpty() {
        return exactNames.isEmpty() && globs.isEmpty();
    }

    public boolean matches(Object node) {
        if (isEmpty() || node == null) {
            return false;
        }
        String name = node.toString();
        if (exactNames.contains(name)) {
            return true;
        }
        for (Pattern glob : globs) {
            if (glob.matcher(name).matches()) {
                return true;
            }
        }
        return false;
    }

    public boolean matchesAny(Collection<?> nodes) {
        if (isEmpty()) {
            return false;
        }
        for (Object node : nodes) {
            if (matches(node)) {
                return true;
            }
        }
        return false;
    }

    private static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                regex.append(".*");
                i++;
            } else if (c == '?') {
                regex.append('.');
                i++;
            } else if (c == '[') {
                int close = findClassEnd(glob, i);
                if (close < 0) {
                    throw new MalformedPatternException(glob, "unterminated character class at index " + i);
                }
                regex.append(toCharacterClass(glob.substring(i + 1, close)));
                i = close + 1;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        try {
            return Pattern.compile(regex.toString(), Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            throw new MalformedPatternException(glob, e.getDescription(), e);
        }
    }

    // a ']' right after '[' or '[!' is a literal member of the class
    private static int findClassEnd(String glob, int open) {
        int j = open + 1;
        if (j < glob.length() && glob.charAt(j) == '!') {
            j++;
        }
        if (j < glob.length() && glob.charAt(j) == ']') {
            j++;
        }
        while (j < glob.length() && glob.charAt(j) != ']') {
            j++;
        }
        return j < glob.length() ? j : -1;
    }

    private static String toCharacterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int start = 0;
        if (body.startsWith("!")) {
            cls.append('^');
            start = 1;
        }
        for (int k = start; k < body.length(); k++) {
            char c = body.charAt(k);
            if (c == '-' && k > start && k < body.length() - 1) {
                cls.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                cls.append(c);
            } else {
                cls.append('\\').append(c);
            }
        }
        return cls.append(']').toString();
    }
}
