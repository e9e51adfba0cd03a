package com.github.alexishuf.curie;

import com.github.alexishuf.curie.exceptions.CurieFormatException;
import com.github.alexishuf.curie.util.RefUtils;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable compact URI, as defined in
 * <a href="https://www.w3.org/TR/2010/NOTE-curie-20101216/">CURIE Syntax 1.0</a>:
 *
 * <pre>
 *   safe_curie  :=   '[' curie ']'
 *   curie       :=   [ [ prefix ] ':' ] reference
 *   prefix      :=   NCName
 *   reference   :=   irelative-ref (as defined in IRI)
 * </pre>
 *
 * <p>The first {@code :} separates the scheme (the prefix) from the reference. Further
 * {@code :} chars belong to the reference. The reference is a {@code /}-delimited sequence
 * of segments. Omitting the scheme (and the {@code :}) yields a relative CURIE, omitting the
 * reference yields a namespace-only CURIE (e.g., {@code a:}) and omitting both yields
 * {@link Curie#EMPTY}.</p>
 *
 * <p>Instances are plain text: every decomposition is computed by scanning the text and
 * every composition ({@link Curie#join(String...)}, {@link Curie#cut(int)}, ...) yields a
 * new instance. Character classes are never validated, thus any text is accepted.</p>
 */
public final class Curie implements Comparable<Curie> {
    public static final Curie EMPTY = new Curie("");

    public static final char SCHEME_SEP = ':';
    public static final char SEGMENT_SEP = '/';

    private final String text;
    private int hash;

    /* --- --- --- construction --- --- --- */

    private Curie(String text) { this.text = text; }

    /**
     * Creates {@code scheme:reference} or, if {@code scheme} is empty, a relative CURIE from
     * {@code reference} without its leading {@code :} chars.
     *
     * @param scheme the scheme (i.e., prefix). A single trailing {@code :} is tolerated
     * @param reference the reference, may be empty
     * @return a {@link Curie}, {@link Curie#EMPTY} if both arguments are empty.
     */
    public static Curie of(String scheme, String reference) {
        if (!scheme.isEmpty() && scheme.charAt(scheme.length()-1) == SCHEME_SEP)
            scheme = scheme.substring(0, scheme.length()-1);
        if (scheme.isEmpty())
            return relative(reference);
        return new Curie(scheme + SCHEME_SEP + reference);
    }

    /** {@code text} without leading {@code :} chars, {@link Curie#EMPTY} if nothing is left. */
    private static Curie relative(String text) {
        int begin = 0, len = text.length();
        while (begin < len && text.charAt(begin) == SCHEME_SEP)
            ++begin;
        if (begin == len)
            return EMPTY;
        return new Curie(begin == 0 ? text : text.substring(begin));
    }

    /**
     * Parses {@code scheme:reference} text, optionally wrapped as a safe CURIE
     * ({@code [scheme:reference]}).
     *
     * <p>The text is normalized: leading {@code :} chars (a present but empty scheme) are
     * dropped, yielding a relative CURIE.</p>
     *
     * <p>Only the first and last chars are checked for brackets. Brackets elsewhere are
     * kept as part of the reference, thus {@code "[a]b]"} yields {@code a]b} and
     * {@code "]["} is taken as raw text.</p>
     *
     * @param text the raw or safe CURIE text
     * @return the parsed {@link Curie}
     * @throws CurieFormatException if {@code text} starts with {@code [} but does not end with
     *                              {@code ]} or vice-versa.
     */
    public static Curie parse(CharSequence text) throws CurieFormatException {
        String s = text.toString();
        int len = s.length();
        boolean open = len > 0 && s.charAt(0) == '[', close = len > 0 && s.charAt(len-1) == ']';
        if (open && close && len > 1)
            s = s.substring(1, len-1);
        else if (open || close)
            throw new CurieFormatException(text, "Unbalanced brackets in safe CURIE");
        return relative(s);
    }

    /**
     * Equivalent to {@link Curie#parse(CharSequence)} but returns {@code null} for
     * {@code null} input.
     */
    public static @Nullable Curie parseNullable(@Nullable CharSequence text) {
        return text == null ? null : parse(text);
    }

    /* --- --- --- decomposition --- --- --- */

    /** The scheme and the reference of a {@link Curie}. Either or both may be empty. */
    public record Parts(String scheme, String reference) {
        public Curie toCurie() { return of(scheme, reference); }
    }

    /**
     * Splits this CURIE at the first {@code :}.
     *
     * @return {@code ("", "")} for {@link Curie#EMPTY}, {@code ("", text)} for a relative
     *         CURIE and {@code (before, after)} the first {@code :} otherwise.
     */
    public Parts split() {
        int colon = text.indexOf(SCHEME_SEP);
        if (colon < 0)
            return new Parts("", text);
        return new Parts(text.substring(0, colon), text.substring(colon+1));
    }

    /** The text before the first {@code :} or {@code ""} if there is no {@code :}. */
    public String scheme() {
        int colon = text.indexOf(SCHEME_SEP);
        return colon < 0 ? "" : text.substring(0, colon);
    }

    /** The text after the first {@code :} or the whole text if there is no {@code :}. */
    public String reference() {
        int colon = text.indexOf(SCHEME_SEP);
        return colon < 0 ? text : text.substring(colon+1);
    }

    /** Whether this is the zero CURIE (i.e., empty text). */
    public boolean isEmpty() { return text.isEmpty(); }

    /** Whether this CURIE has a scheme (i.e., it is not relative). */
    public boolean hasScheme() { return text.indexOf(SCHEME_SEP) >= 0; }

    /**
     * The last segment of the reference.
     *
     * <pre>
     *   a:b/c/d ⟼ d
     *   a:      ⟼ ""
     * </pre>
     */
    public String base() {
        return RefUtils.last(reference(), SEGMENT_SEP);
    }

    /**
     * This CURIE without the last segment of its reference.
     *
     * <pre>
     *   a:b/c/d ⟼ a:b/c
     *   a:b     ⟼ a:
     *   a:      ⟼ a:
     * </pre>
     */
    public Curie path() {
        Parts p = split();
        if (p.reference.isEmpty())
            return this;
        return of(p.scheme, RefUtils.allButLast(p.reference, SEGMENT_SEP));
    }

    /**
     * The first segment of the reference.
     *
     * <pre>
     *   a:b/c/d ⟼ b
     *   a:      ⟼ ""
     * </pre>
     */
    public String head() {
        return RefUtils.first(reference(), SEGMENT_SEP);
    }

    /**
     * This CURIE without the first segment of its reference.
     *
     * <pre>
     *   a:b/c/d ⟼ a:c/d
     *   a:b     ⟼ a:
     * </pre>
     */
    public Curie tail() {
        Parts p = split();
        if (p.reference.isEmpty())
            return this;
        return of(p.scheme, RefUtils.allButFirst(p.reference, SEGMENT_SEP));
    }

    /**
     * The scheme followed by all reference segments. The scheme is {@code ""} for relative
     * CURIEs and an empty reference contributes no segment:
     *
     * <pre>
     *   ""      ⟼ []
     *   a:      ⟼ [a]
     *   b       ⟼ ["", b]
     *   a:b/c   ⟼ [a, b, c]
     * </pre>
     */
    public List<String> segments() {
        if (text.isEmpty())
            return List.of();
        Parts p = split();
        List<String> refSegments = RefUtils.segments(p.reference, SEGMENT_SEP);
        List<String> list = new ArrayList<>(refSegments.size()+1);
        list.add(p.scheme);
        list.addAll(refSegments);
        return Collections.unmodifiableList(list);
    }

    /** Equivalent to {@code segments().size()}. */
    public @NonNegative int rank() {
        if (text.isEmpty())
            return 0;
        return 1 + RefUtils.count(reference(), SEGMENT_SEP);
    }

    /* --- --- --- composition --- --- --- */

    /**
     * Appends non-empty {@code segments} to the reference, keeping the scheme.
     *
     * <pre>
     *   a:b × [c, d, e] ⟼ a:b/c/d/e
     *   a:  × [c, d]    ⟼ a:c/d
     *   a:b × [""]      ⟼ a:b
     * </pre>
     *
     * @param segments segments to append verbatim. Empty segments are ignored
     * @return a new {@link Curie} or {@code this} if all segments are empty
     */
    public Curie join(String... segments) {
        Parts p = split();
        String ref = RefUtils.join(p.reference, SEGMENT_SEP, segments);
        //noinspection StringEquality
        return ref == p.reference ? this : of(p.scheme, ref);
    }

    /**
     * Appends the scheme (if present) and the reference segments of {@code child}.
     *
     * <pre>
     *   a:b × c:d/e ⟼ a:b/c/d/e
     *   a:b × d/e   ⟼ a:b/d/e
     * </pre>
     */
    public Curie join(Curie child) {
        if (child.isEmpty())
            return this;
        Parts c = child.split();
        return join(c.scheme, c.reference);
    }

    /**
     * Removes the last {@code n} segments from the reference, keeping the scheme.
     *
     * <pre>
     *   a:b/c/d/e ⟼¹ a:b/c/d
     *   a:b/c/d/e ⟼² a:b/c
     *   a:b/c/d/e ⟼⁴ a:
     * </pre>
     *
     * @param n number of segments to remove. {@code 0} returns {@code this}
     * @return a {@link Curie} with the same scheme and a shorter (possibly empty) reference.
     * @throws IllegalArgumentException if {@code n < 0}
     */
    public Curie cut(@NonNegative int n) {
        if (n == 0)
            return this;
        Parts p = split();
        return of(p.scheme, RefUtils.cut(p.reference, SEGMENT_SEP, n));
    }

    /**
     * The last {@code n} segments of the reference, i.e., what {@link Curie#cut(int)} removes.
     *
     * <pre>
     *   a:b/c/d/e ⟼¹ e
     *   a:b/c/d/e ⟼² d/e
     *   a:b/c/d/e ⟼⁹ b/c/d/e
     * </pre>
     *
     * @throws IllegalArgumentException if {@code n < 0}
     */
    public String suffix(@NonNegative int n) {
        return RefUtils.suffix(reference(), SEGMENT_SEP, n);
    }

    /* --- --- --- ordering and equality --- --- --- */

    /**
     * Compares by {@link Curie#rank()} first, then segment-by-segment (see
     * {@link Curie#segments()}). Different texts with equal segments are ordered by text.
     */
    @Override public int compareTo(Curie o) {
        if (o == this)
            return 0;
        int diff = Integer.compare(rank(), o.rank());
        if (diff != 0)
            return diff;
        List<String> mine = segments(), theirs = o.segments();
        for (int i = 0, n = mine.size(); i < n; i++) {
            if ((diff = mine.get(i).compareTo(theirs.get(i))) != 0)
                return diff;
        }
        return text.compareTo(o.text);
    }

    /** Equivalent to {@code compareTo(other) < 0}. */
    public boolean lt(Curie other) { return compareTo(other) < 0; }

    @Override public boolean equals(Object o) {
        return o == this || (o instanceof Curie c && c.text.equals(text));
    }

    @Override public int hashCode() {
        int h = hash;
        if (h == 0)
            hash = h = text.hashCode();
        return h;
    }

    /* --- --- --- text forms --- --- --- */

    /** {@code [scheme:reference]} or {@code ""} for {@link Curie#EMPTY}. */
    public String safe() { return text.isEmpty() ? "" : "[" + text + "]"; }

    /** The canonical (non-safe) {@code scheme:reference} text. */
    @Override public String toString() { return text; }
}
