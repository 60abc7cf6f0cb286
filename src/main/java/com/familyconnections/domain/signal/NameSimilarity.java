package com.familyconnections.domain.signal;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Token-sorted similarity ratio on a 0-100 scale.
 *
 * <p>Names are upper-cased, split on anything that is not a letter or digit,
 * sorted and re-joined, so {@code "SMITH-JONES"} and {@code "Jones Smith"}
 * compare equal. The ratio is {@code 200 * lcs / (len(a) + len(b))}, the
 * indel-distance ratio commonly used for fuzzy name matching.
 */
public final class NameSimilarity {

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private NameSimilarity() {
    }

    public static double tokenSortRatio(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        String left = sortedTokens(a);
        String right = sortedTokens(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 100.0;
        }
        int common = LCS.apply(left, right);
        return 200.0 * common / (left.length() + right.length());
    }

    static String sortedTokens(String value) {
        return Arrays.stream(SEPARATORS.split(value.toUpperCase(Locale.ROOT)))
            .filter(token -> !token.isEmpty())
            .sorted()
            .collect(Collectors.joining(" "));
    }
}
