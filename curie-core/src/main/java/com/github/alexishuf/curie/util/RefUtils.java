package com.github.alexishuf.curie.util;

import org.checkerframework.checker.index.qual.NonNegative;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for path-like references whose segments are separated by a single delimiter
 * char ({@code /} for CURIE references, {@code :} for URN namespace-specific strings).
 *
 * <p>All methods treat the empty string as a reference with zero segments.</p>
 */
public class RefUtils {

    /**
     * Appends all non-empty {@code segments} to {@code ref}, placing {@code delim} between
     * consecutive segments. {@code delim} is not placed before the first appended segment
     * if {@code ref} is empty.
     *
     * <p>Segments are appended verbatim: a segment containing {@code delim} will introduce
     * more than one segment in the result.</p>
     *
     * @param ref the reference to extend. May be empty
     * @param delim the segment delimiter
     * @param segments segments to append. Empty strings are ignored
     * @return {@code ref} itself if there is no non-empty segment, else a new string.
     */
    public static String join(String ref, char delim, String... segments) {
        int capacity = ref.length(), nonEmpty = 0;
        for (String s : segments) {
            if (s.isEmpty()) continue;
            capacity += s.length() + 1;
            ++nonEmpty;
        }
        if (nonEmpty == 0)
            return ref;
        StringBuilder b = new StringBuilder(capacity).append(ref);
        for (String s : segments) {
            if (s.isEmpty()) continue;
            if (b.length() > 0) b.append(delim);
            b.append(s);
        }
        return b.toString();
    }

    /**
     * Removes the last {@code n} segments of {@code ref}.
     *
     * <p>Delimiters are counted from the end of {@code ref}, thus
     * {@code cut(join(r, d, a, b), d, 1)} is {@code join(r, d, a)} regardless of how many
     * segments {@code r} has.</p>
     *
     * @param ref the reference
     * @param delim the segment delimiter
     * @param n how many trailing segments to remove
     * @return {@code ref} if {@code n == 0}, the empty string if {@code ref} has {@code n}
     *         or fewer segments, else the prefix of {@code ref} before the {@code n}-th
     *         delimiter counting from the end.
     * @throws IllegalArgumentException if {@code n < 0}
     */
    public static String cut(String ref, char delim, @NonNegative int n) {
        if (n < 0)
            throw new IllegalArgumentException("n="+n+" < 0");
        int i = ref.length();
        for (int remaining = n; remaining > 0; --remaining) {
            if ((i = ref.lastIndexOf(delim, i-1)) < 0)
                return "";
        }
        return i == ref.length() ? ref : ref.substring(0, i);
    }

    /**
     * The last {@code n} segments of {@code ref}, the complement of
     * {@link #cut(String, char, int)}.
     *
     * @return the empty string if {@code n == 0}, {@code ref} if it has {@code n} or fewer
     *         segments, else the suffix of {@code ref} after the {@code n}-th delimiter
     *         counting from the end.
     * @throws IllegalArgumentException if {@code n < 0}
     */
    public static String suffix(String ref, char delim, @NonNegative int n) {
        if (n < 0)
            throw new IllegalArgumentException("n="+n+" < 0");
        if (n == 0)
            return "";
        int i = ref.length();
        for (int remaining = n; remaining > 0; --remaining) {
            if ((i = ref.lastIndexOf(delim, i-1)) < 0)
                return ref;
        }
        return ref.substring(i+1);
    }

    /** The text after the last {@code delim} in {@code ref} or {@code ref} if there is none. */
    public static String last(String ref, char delim) {
        int i = ref.lastIndexOf(delim);
        return i < 0 ? ref : ref.substring(i+1);
    }

    /** The text before the last {@code delim} in {@code ref} or {@code ""} if there is none. */
    public static String allButLast(String ref, char delim) {
        int i = ref.lastIndexOf(delim);
        return i < 0 ? "" : ref.substring(0, i);
    }

    /** The text before the first {@code delim} in {@code ref} or {@code ref} if there is none. */
    public static String first(String ref, char delim) {
        int i = ref.indexOf(delim);
        return i < 0 ? ref : ref.substring(0, i);
    }

    /** The text after the first {@code delim} in {@code ref} or {@code ""} if there is none. */
    public static String allButFirst(String ref, char delim) {
        int i = ref.indexOf(delim);
        return i < 0 ? "" : ref.substring(i+1);
    }

    /**
     * Splits {@code ref} at every {@code delim}, keeping empty segments.
     *
     * @return an empty list if {@code ref} is empty, else a list with one more element
     *         than there are occurrences of {@code delim} in {@code ref}.
     */
    public static List<String> segments(String ref, char delim) {
        if (ref.isEmpty())
            return List.of();
        List<String> list = new ArrayList<>();
        for (int begin = 0, end; ; begin = end+1) {
            end = ref.indexOf(delim, begin);
            if (end < 0) {
                list.add(ref.substring(begin));
                return list;
            }
            list.add(ref.substring(begin, end));
        }
    }

    /** Number of segments in {@code ref}, equivalent to {@code segments(ref, delim).size()}. */
    public static @NonNegative int count(String ref, char delim) {
        if (ref.isEmpty())
            return 0;
        int n = 1;
        for (int i = ref.indexOf(delim); i >= 0; i = ref.indexOf(delim, i+1))
            ++n;
        return n;
    }
}
