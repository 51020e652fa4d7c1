package io.virtserve.core.engine;

import io.virtserve.core.error.RegexBudgetExceededException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs {@link Pattern}s over a step-counting view of their input so that a catastrophically
 * backtracking pattern is aborted after a fixed number of character reads instead of stalling
 * the calling thread.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class BoundedRegex {

    private BoundedRegex() {}

    /**
     * Tests whether the pattern matches anywhere in the input.
     *
     * @throws RegexBudgetExceededException if the run reads more than {@code maxSteps} characters
     */
    public static boolean find(Pattern pattern, String input, int maxSteps) {
        return pattern.matcher(new CountingCharSequence(input, pattern, maxSteps)).find();
    }

    /**
     * Removes every match of the pattern from the input.
     *
     * @throws RegexBudgetExceededException if the run reads more than {@code maxSteps} characters
     */
    public static String removeAll(Pattern pattern, String input, int maxSteps) {
        Matcher matcher = pattern.matcher(new CountingCharSequence(input, pattern, maxSteps));
        if (!matcher.find()) {
            return input;
        }
        StringBuilder result = new StringBuilder(input.length());
        int last = 0;
        do {
            result.append(input, last, matcher.start());
            last = matcher.end();
        } while (matcher.find());
        result.append(input, last, input.length());
        return result.toString();
    }

    private static final class CountingCharSequence implements CharSequence {

        private final String text;
        private final Pattern pattern;
        private final int maxSteps;
        private int steps;

        CountingCharSequence(String text, Pattern pattern, int maxSteps) {
            this.text = text;
            this.pattern = pattern;
            this.maxSteps = maxSteps;
        }

        @Override
        public char charAt(int index) {
            if (++steps > maxSteps) {
                throw new RegexBudgetExceededException(pattern.pattern(), maxSteps);
            }
            return text.charAt(index);
        }

        @Override
        public int length() {
            return text.length();
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            return text.subSequence(start, end);
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
