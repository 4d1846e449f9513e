package com.inboxsearch.ingest;

import java.util.ArrayList;
import java.util.List;

import com.inboxsearch.runtime.ConfigurationException;

/**
 * Splits message bodies into bounded, overlapping chunks. Output depends only on the input text
 * and the configured sizes, so re-ingesting a message yields the same chunks.
 */
public class Chunker {
    public static final int DEFAULT_BOUNDARY_LOOKBACK = 120;

    private final int maxChunkChars;
    private final int overlapChars;
    private final int boundaryLookback;

    public Chunker(int maxChunkChars, int overlapChars) {
        this(maxChunkChars, overlapChars, DEFAULT_BOUNDARY_LOOKBACK);
    }

    public Chunker(int maxChunkChars, int overlapChars, int boundaryLookback) {
        if (overlapChars < 0 || maxChunkChars <= overlapChars) {
            throw new ConfigurationException(
                    "chunk sizes require maxChunkChars > overlapChars >= 0, got max=%d overlap=%d"
                            .formatted(maxChunkChars, overlapChars));
        }
        if (boundaryLookback < 0) {
            throw new ConfigurationException("boundaryLookback must be >= 0");
        }
        this.maxChunkChars = maxChunkChars;
        this.overlapChars = overlapChars;
        this.boundaryLookback = boundaryLookback;
    }

    public static List<String> chunk(String text, int maxChunkChars, int overlapChars) {
        return new Chunker(maxChunkChars, overlapChars).chunk(text);
    }

    public List<String> chunk(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        while (true) {
            int hardEnd = Math.min(length, start + maxChunkChars);
            if (hardEnd == length) {
                chunks.add(text.substring(start));
                break;
            }
            int end = cutPosition(text, start, hardEnd);
            chunks.add(text.substring(start, end));
            start = end - overlapChars;
            // end never splits a pair and end - start > overlapChars, so stepping forward stays inside the chunk
            if (Character.isLowSurrogate(text.charAt(start))) {
                start++;
            }
        }
        return chunks;
    }

    // The cut must leave more than overlapChars in the chunk, otherwise the next start would not advance.
    private int cutPosition(String text, int start, int hardEnd) {
        int earliest = Math.max(start + overlapChars + 1, hardEnd - boundaryLookback);
        for (int cut = hardEnd; cut >= earliest; cut--) {
            if (isSentenceBoundary(text, start, cut)) {
                return cut;
            }
        }
        for (int cut = hardEnd; cut >= earliest; cut--) {
            if (Character.isWhitespace(text.charAt(cut - 1))) {
                return cut;
            }
        }
        if (Character.isHighSurrogate(text.charAt(hardEnd - 1)) && hardEnd - 1 >= earliest) {
            return hardEnd - 1;
        }
        return hardEnd;
    }

    private static boolean isSentenceBoundary(String text, int start, int cut) {
        char last = text.charAt(cut - 1);
        if (last == '\n') {
            return true;
        }
        if (!Character.isWhitespace(last) || cut - 2 < start) {
            return false;
        }
        char terminator = text.charAt(cut - 2);
        return terminator == '.' || terminator == '!' || terminator == '?';
    }
}
