package io.surfworks.songfolder.media;

import java.util.Comparator;
import java.util.Locale;

/**
 * Compares file names so that embedded runs of digits compare by numeric value.
 *
 * <p>"track2.mp3" sorts before "track10.mp3". Letters compare case-insensitively.
 * Names that are equal under those rules (e.g. "a01" and "a1", or "A" and "a") fall
 * back to plain string order so the ordering stays total and stable across scans.
 */
public final class NaturalOrderComparator implements Comparator<String> {

    /** Shared instance; the comparator is stateless. */
    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    @Override
    public int compare(String a, String b) {
        int result = compareNatural(a.toLowerCase(Locale.ROOT), b.toLowerCase(Locale.ROOT));
        return result != 0 ? result : a.compareTo(b);
    }

    private static int compareNatural(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);

            if (isDigit(ca) && isDigit(cb)) {
                int endA = digitRunEnd(a, i);
                int endB = digitRunEnd(b, j);
                int cmp = compareDigitRuns(a, i, endA, b, j, endB);
                if (cmp != 0) {
                    return cmp;
                }
                i = endA;
                j = endB;
                continue;
            }

            // A digit run sorts before text at the same position
            if (isDigit(ca) != isDigit(cb)) {
                return isDigit(ca) ? -1 : 1;
            }
            if (ca != cb) {
                return Character.compare(ca, cb);
            }
            i++;
            j++;
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    private static int compareDigitRuns(String a, int startA, int endA, String b, int startB, int endB) {
        int sigA = skipLeadingZeros(a, startA, endA);
        int sigB = skipLeadingZeros(b, startB, endB);

        // Longer significant run means larger value; no overflow for arbitrarily long runs
        int lenA = endA - sigA;
        int lenB = endB - sigB;
        if (lenA != lenB) {
            return Integer.compare(lenA, lenB);
        }
        for (int k = 0; k < lenA; k++) {
            int cmp = Character.compare(a.charAt(sigA + k), b.charAt(sigB + k));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static int skipLeadingZeros(String s, int start, int end) {
        int pos = start;
        while (pos < end - 1 && s.charAt(pos) == '0') {
            pos++;
        }
        return pos;
    }

    private static int digitRunEnd(String s, int start) {
        int pos = start;
        while (pos < s.length() && isDigit(s.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
