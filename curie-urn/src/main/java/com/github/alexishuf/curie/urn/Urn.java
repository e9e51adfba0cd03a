package com.github.alexishuf.curie.urn;

import com.github.alexishuf.curie.Curie;
import com.github.alexishuf.curie.exceptions.CurieFormatException;
import com.github.alexishuf.curie.util.RefUtils;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * A Uniform Resource Name, as in <a href="https://www.rfc-editor.org/rfc/rfc8141">RFC 8141</a>,
 * considered only as an identity:
 *
 * <pre>
 *   namestring   = "urn" ":" NID ":" NSS
 *   NID          = (alphanum) 0*30(ldh) (alphanum)
 *   ldh          = alphanum / "-"
 *   NSS          = pchar *(pchar / "/" / ":")
 * </pre>
 *
 * <p>The NSS is handled as a sequence of {@code :}-separated segments, mirroring the
 * {@code /}-separated reference of a {@link Curie}. Like {@link Curie}, no character
 * classes are validated.</p>
 */
public final class Urn implements Comparable<Urn> {
    public static final String PREFIX = "urn:";
    public static final char SEGMENT_SEP = ':';
    public static final Urn EMPTY = new Urn("");

    private final String text;

    private Urn(String text) { this.text = text; }

    /* --- --- --- construction --- --- --- */

    /**
     * Creates {@code urn:nid:nss} or {@code urn:nid} if {@code nss} is empty.
     */
    public static Urn of(String nid, String nss) {
        return new Urn(nss.isEmpty() ? PREFIX + nid : PREFIX + nid + SEGMENT_SEP + nss);
    }

    /** Whether {@code text} is empty or is {@code urn:} followed by at least two chars. */
    public static boolean isValid(CharSequence text) {
        int len = text.length();
        return len == 0 || (len > PREFIX.length()+1
                            && PREFIX.contentEquals(text.subSequence(0, PREFIX.length())));
    }

    /**
     * Wraps {@code text} as an {@link Urn}.
     *
     * @throws CurieFormatException if {@code text} is not {@link #isValid(CharSequence)}
     */
    public static Urn parse(CharSequence text) throws CurieFormatException {
        if (!isValid(text))
            throw new CurieFormatException(text, "Not an URN");
        return text.length() == 0 ? EMPTY : new Urn(text.toString());
    }

    /** Equivalent to {@link #parse(CharSequence)} but maps {@code null} to {@code null}. */
    public static @Nullable Urn parseNullable(@Nullable CharSequence text) {
        return text == null ? null : parse(text);
    }

    /* --- --- --- decomposition --- --- --- */

    /** The namespace identifier and the namespace-specific string of an {@link Urn}. */
    public record Parts(String nid, String nss) {
        public Urn toUrn() { return of(nid, nss); }
    }

    /**
     * Splits into NID and NSS. Returns {@code ("", "")} for {@link #EMPTY} and for text
     * shorter than {@code urn:x}.
     */
    public Parts split() {
        if (text.length() <= PREFIX.length())
            return new Parts("", "");
        int colon = text.indexOf(SEGMENT_SEP, PREFIX.length());
        if (colon < 0)
            return new Parts(text.substring(PREFIX.length()), "");
        return new Parts(text.substring(PREFIX.length(), colon), text.substring(colon+1));
    }

    public String nid() { return split().nid(); }
    public String nss() { return split().nss(); }

    public boolean isEmpty() { return text.isEmpty(); }

    /** The last segment of the NSS, {@code ""} if the NSS is empty. */
    public String base() { return RefUtils.last(nss(), SEGMENT_SEP); }

    /** This URN without the last NSS segment. {@code this} if the NSS is empty. */
    public Urn path() {
        Parts p = split();
        return p.nss.isEmpty() ? this : of(p.nid, RefUtils.allButLast(p.nss, SEGMENT_SEP));
    }

    /** The first segment of the NSS, {@code ""} if the NSS is empty. */
    public String head() { return RefUtils.first(nss(), SEGMENT_SEP); }

    /** This URN without the first NSS segment. {@code this} if the NSS is empty. */
    public Urn tail() {
        Parts p = split();
        return p.nss.isEmpty() ? this : of(p.nid, RefUtils.allButFirst(p.nss, SEGMENT_SEP));
    }

    /** The NSS segments. */
    public List<String> segments() { return RefUtils.segments(nss(), SEGMENT_SEP); }

    /* --- --- --- composition --- --- --- */

    /**
     * Appends non-empty {@code segments} to the NSS.
     *
     * <pre>
     *   urn:a:b:c × [d, e, f] ⟼ urn:a:b:c:d:e:f
     * </pre>
     */
    public Urn join(String... segments) {
        Parts p = split();
        String nss = RefUtils.join(p.nss, SEGMENT_SEP, segments);
        //noinspection StringEquality
        return nss == p.nss ? this : of(p.nid, nss);
    }

    /**
     * Removes the last {@code n} NSS segments.
     *
     * @throws IllegalArgumentException if {@code n < 0}
     */
    public Urn cut(@NonNegative int n) {
        if (n == 0)
            return this;
        Parts p = split();
        return of(p.nid, RefUtils.cut(p.nss, SEGMENT_SEP, n));
    }

    /* --- --- --- CURIE mapping --- --- --- */

    /**
     * Maps {@code urn:nid:a:b} to the {@link Curie} {@code nid:a/b}. Empty NSS segments
     * are dropped.
     */
    public static Curie toIri(Urn urn) {
        Parts p = urn.split();
        String ref = RefUtils.join("", Curie.SEGMENT_SEP,
                                   RefUtils.segments(p.nss, SEGMENT_SEP).toArray(String[]::new));
        return Curie.of(p.nid, ref);
    }

    /**
     * Maps the {@link Curie} {@code nid:a/b} to {@code urn:nid:a:b} and {@link Curie#EMPTY}
     * to {@link Urn#EMPTY}.
     */
    public static Urn toUrn(Curie curie) {
        if (curie.isEmpty())
            return EMPTY;
        Curie.Parts p = curie.split();
        return of(p.scheme(), p.reference().replace(Curie.SEGMENT_SEP, SEGMENT_SEP));
    }

    /** Equivalent to {@link #toIri(Urn)}. */
    public Curie toIri() { return toIri(this); }

    /* --- --- --- Object methods --- --- --- */

    @Override public int compareTo(Urn o) { return text.compareTo(o.text); }

    @Override public boolean equals(Object o) {
        return o == this || (o instanceof Urn u && u.text.equals(text));
    }

    @Override public int hashCode() { return text.hashCode(); }

    @Override public String toString() { return text; }
}
