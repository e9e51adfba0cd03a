package com.github.alexishuf.curie.gson;

import com.github.alexishuf.curie.Curie;
import com.github.alexishuf.curie.urn.Urn;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Provides {@link CurieTypeAdapter} and {@link UrnTypeAdapter} to a {@link Gson}. */
public final class CurieTypeAdapterFactory implements TypeAdapterFactory {
    public static final CurieTypeAdapterFactory INSTANCE = new CurieTypeAdapterFactory();

    private CurieTypeAdapterFactory() {}

    /** Registers {@link #INSTANCE} into {@code builder}. */
    public static GsonBuilder register(GsonBuilder builder) {
        return builder.registerTypeAdapterFactory(INSTANCE);
    }

    /** A {@link Gson} with default settings plus {@link #INSTANCE}. */
    public static Gson gson() { return register(new GsonBuilder()).create(); }

    @SuppressWarnings("unchecked")
    @Override public <T> @Nullable TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        Class<? super T> raw = type.getRawType();
        if (raw == Curie.class) return (TypeAdapter<T>) CurieTypeAdapter.INSTANCE;
        if (raw == Urn.class)   return (TypeAdapter<T>) UrnTypeAdapter.INSTANCE;
        return null;
    }
}
