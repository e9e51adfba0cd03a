package com.github.alexishuf.curie;

import com.github.alexishuf.curie.util.UriUtils;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.common.returnsreceiver.qual.This;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;

/**
 * An immutable table mapping schemes (CURIE prefixes) to absolute URI stems, used to expand
 * {@link Curie}s into absolute URIs and to compact absolute URIs into {@link Curie}s.
 *
 * <p>Compaction picks the entry with the longest stem that is a prefix of the URI. If two
 * schemes map to the same stem, the scheme that sorts first wins.</p>
 */
public final class Namespaces {
    private static final Logger log = LoggerFactory.getLogger(Namespaces.class);

    public static final String RDF  = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String RDFS = "http://www.w3.org/2000/01/rdf-schema#";
    public static final String XSD  = "http://www.w3.org/2001/XMLSchema#";
    public static final String OWL  = "http://www.w3.org/2002/07/owl#";

    public static final Namespaces EMPTY = new Namespaces(new TreeMap<>());

    private static final Namespaces BUILTIN = builder().put("rdf", RDF).put("rdfs", RDFS)
                                                        .put("xsd", XSD).put("owl", OWL)
                                                        .build();

    private final SortedMap<String, String> stems;
    /** Entries of {@code stems} by descending stem length, then by scheme. */
    private final List<Map.Entry<String, String>> byStemLength;

    private Namespaces(TreeMap<String, String> stems) {
        this.stems = Collections.unmodifiableSortedMap(stems);
        var list = new ArrayList<Map.Entry<String, String>>(stems.size());
        for (var e : stems.entrySet())
            list.add(Map.entry(e.getKey(), e.getValue()));
        list.sort(Comparator.<Map.Entry<String, String>>comparingInt(e -> -e.getValue().length())
                            .thenComparing(Map.Entry::getKey));
        this.byStemLength = list;
    }

    /* --- --- --- builder --- --- --- */

    public static final class Builder {
        private final TreeMap<String, String> stems = new TreeMap<>();

        private Builder() {}

        /**
         * Maps {@code scheme} to {@code stem}, replacing any previous mapping.
         *
         * @param scheme a non-empty prefix name without {@code :} or {@code /}. A single
         *               trailing {@code :} is tolerated and removed.
         * @param stem a non-empty absolute URI prefix. Surrounding {@code <>}, as in a
         *             SPARQL {@code PREFIX} declaration, are removed.
         * @throws IllegalArgumentException if {@code scheme} or {@code stem} are invalid
         */
        public @This Builder put(String scheme, String stem) {
            stems.put(checkScheme(scheme), checkStem(stem));
            return this;
        }

        public @This Builder putAll(Map<String, String> map) {
            for (var e : map.entrySet()) put(e.getKey(), e.getValue());
            return this;
        }

        public @This Builder putAll(Namespaces other) {
            stems.putAll(other.stems);
            return this;
        }

        public @This Builder remove(String scheme) {
            stems.remove(stripColon(scheme));
            return this;
        }

        public Namespaces build() {
            return stems.isEmpty() ? EMPTY : new Namespaces(new TreeMap<>(stems));
        }

        private static String stripColon(String scheme) {
            int last = scheme.length()-1;
            return last >= 0 && scheme.charAt(last) == Curie.SCHEME_SEP
                    ? scheme.substring(0, last) : scheme;
        }

        private static String checkScheme(String scheme) {
            String name = stripColon(scheme.trim());
            if (name.isEmpty())
                throw new IllegalArgumentException("Empty scheme");
            if (name.indexOf(Curie.SCHEME_SEP) >= 0 || name.indexOf(Curie.SEGMENT_SEP) >= 0)
                throw new IllegalArgumentException("scheme \""+scheme+"\" contains : or /");
            return name;
        }

        private static String checkStem(String stem) {
            String s = stem.trim();
            if (s.length() > 1 && s.charAt(0) == '<' && s.charAt(s.length()-1) == '>')
                s = s.substring(1, s.length()-1);
            if (s.isEmpty())
                throw new IllegalArgumentException("Empty stem");
            return s;
        }
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() { return new Builder().putAll(this); }

    /* --- --- --- factories --- --- --- */

    /** Equivalent to {@code builder().putAll(map).build()}. */
    public static Namespaces of(Map<String, String> map) {
        return builder().putAll(map).build();
    }

    /** Mappings for {@code rdf}, {@code rdfs}, {@code xsd} and {@code owl}. */
    public static Namespaces builtin() { return BUILTIN; }

    /* --- --- --- accessors --- --- --- */

    public int size() { return stems.size(); }

    public boolean isEmpty() { return stems.isEmpty(); }

    /** An unmodifiable view of the scheme to stem mappings, sorted by scheme. */
    public SortedMap<String, String> asMap() { return stems; }

    /**
     * Gets the stem for {@code scheme}.
     *
     * @param scheme the scheme, without the trailing {@code :}
     * @return the stem or {@code null} if {@code scheme} is not mapped.
     */
    public @Nullable String lookup(String scheme) { return stems.get(scheme); }

    public boolean contains(String scheme) { return stems.containsKey(scheme); }

    /* --- --- --- resolution --- --- --- */

    /**
     * Compacts {@code uri} into a {@link Curie} using the longest stem that is a prefix
     * of {@code uri}. The text after the stem is normalized with {@link UriUtils#decode(String)}.
     *
     * <pre>
     *   http://en.wikipedia.org/wiki/CURIE ⟼ wiki:CURIE
     * </pre>
     *
     * @param uri an absolute URI
     * @return {@code scheme:reference} if some stem matches, else {@code uri} unchanged as a
     *         {@link Curie}.
     */
    public Curie create(String uri) {
        for (var e : byStemLength) {
            String stem = e.getValue();
            if (uri.startsWith(stem)) {
                log.trace("{} matched stem {} of {}", uri, stem, e.getKey());
                return Curie.of(e.getKey(), UriUtils.decode(uri.substring(stem.length())));
            }
        }
        return Curie.of("", uri);
    }

    /** Equivalent to {@link #create(String)}. */
    public Curie fromUri(String uri) { return create(uri); }

    /**
     * Expands {@code curie} into an absolute URI.
     *
     * <pre>
     *   wiki:CURIE ⟼ http://en.wikipedia.org/wiki/CURIE
     * </pre>
     *
     * @return {@code ""} for {@link Curie#EMPTY}, the stem of the scheme followed by the
     *         reference if the scheme is mapped, else {@code curie.toString()}.
     */
    public String uri(Curie curie) {
        if (curie.isEmpty())
            return "";
        Curie.Parts parts = curie.split();
        String stem = parts.scheme().isEmpty() ? null : stems.get(parts.scheme());
        return stem == null ? curie.toString() : stem + parts.reference();
    }

    /**
     * Parses {@link #uri(Curie)} as a {@link URI}.
     *
     * @throws URISyntaxException if {@link URI#URI(String)} rejects the expansion.
     */
    public URI url(Curie curie) throws URISyntaxException {
        return new URI(uri(curie));
    }

    /* --- --- --- Object methods --- --- --- */

    @Override public boolean equals(Object o) {
        return o == this || (o instanceof Namespaces n && n.stems.equals(stems));
    }

    @Override public int hashCode() { return stems.hashCode(); }

    @Override public String toString() { return "Namespaces"+stems; }
}
