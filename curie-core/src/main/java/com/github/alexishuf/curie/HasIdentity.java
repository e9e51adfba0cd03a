package com.github.alexishuf.curie;

/**
 * Anything identified by a {@link Curie}.
 *
 * <p>Domain types hold a {@link Curie} field and expose it through {@link #identity()}:</p>
 *
 * <pre>{@code
 *   record Person(Curie id, @Nullable Curie father, List<Curie> friends)
 *           implements HasIdentity {
 *       @Override public Curie identity() { return id; }
 *   }
 * }</pre>
 */
public interface HasIdentity {
    /** The identifier of this thing, {@link Curie#EMPTY} if it has none (yet). */
    Curie identity();

    /** Orders by {@link #identity()}. */
    static int compare(HasIdentity l, HasIdentity r) {
        return l.identity().compareTo(r.identity());
    }
}
