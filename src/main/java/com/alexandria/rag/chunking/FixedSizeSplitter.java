package com.alexandria.rag.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-safe fixed window splitter. Each window starts from a chars-per-token estimate, is
 * narrowed by binary search against the exact counter, grown back in galloping steps while it
 * still fits, and finally pulled back to the best natural boundary.
 */
final class FixedSizeSplitter {

    private static final int EXPANSION_STEP = 16;
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s");

    private final TokenCounter tokenCounter;

    FixedSizeSplitter(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    List<String> split(String text, int maxChars, int minChars, int overlap, int maxTokens, double charsPerToken) {
        List<String> pieces = new ArrayList<>();
        int length = text.length();
        int start = skipWhitespace(text, 0);

        while (start < length) {
            int limit = Math.min(length, start + maxChars);
            int end = tokenSafeEnd(text, start, limit, maxTokens, charsPerToken);
            if (end < length) {
                end = bestBoundary(text, start, end, minChars);
            }

            String piece = text.substring(start, end).strip();
            if (!piece.isEmpty()) {
                pieces.add(piece);
            }
            if (end >= length) {
                break;
            }

            // at most half the window is repeated so every step makes progress
            int effectiveOverlap = Math.min(overlap, (end - start) / 2);
            start = skipWhitespace(text, end - effectiveOverlap);
        }
        return pieces;
    }

    private int tokenSafeEnd(String text, int start, int limit, int maxTokens, double charsPerToken) {
        long estimated = start + Math.max(1L, (long) (maxTokens * charsPerToken));
        int end = (int) Math.min(limit, estimated);

        if (!fits(text, start, end, maxTokens)) {
            return largestFitting(text, start, start + 1, end - 1, maxTokens, start + 1);
        }

        int step = EXPANSION_STEP;
        while (end < limit) {
            int candidate = Math.min(limit, end + step);
            if (!fits(text, start, candidate, maxTokens)) {
                return largestFitting(text, start, end + 1, candidate - 1, maxTokens, end);
            }
            end = candidate;
            step *= 2;
        }
        return end;
    }

    private int largestFitting(String text, int start, int lo, int hi, int maxTokens, int fallback) {
        int best = fallback;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (fits(text, start, mid, maxTokens)) {
                best = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return best;
    }

    private boolean fits(String text, int start, int end, int maxTokens) {
        return tokenCounter.count(text.substring(start, end)) <= maxTokens;
    }

    /**
     * Paragraph, then sentence, then line, then word. A boundary is only taken when the piece
     * before it reaches {@code minChars}.
     */
    private int bestBoundary(String text, int start, int end, int minChars) {
        int minEnd = Math.max(start + 1, start + minChars);

        int paragraph = text.lastIndexOf("\n\n", end - 2);
        if (paragraph >= start && paragraph + 2 >= minEnd) {
            return paragraph + 2;
        }

        Matcher matcher = SENTENCE_END.matcher(text).region(start, end);
        int sentence = -1;
        while (matcher.find()) {
            sentence = matcher.start() + 1;
        }
        if (sentence >= minEnd) {
            return sentence;
        }

        int line = text.lastIndexOf('\n', end - 1);
        if (line >= start && line + 1 >= minEnd) {
            return line + 1;
        }

        int word = text.lastIndexOf(' ', end - 1);
        if (word >= start && word + 1 >= minEnd) {
            return word + 1;
        }
        return end;
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
