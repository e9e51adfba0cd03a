package com.github.alexishuf.curie.gson;

import com.github.alexishuf.curie.exceptions.CurieFormatException;
import com.github.alexishuf.curie.urn.Urn;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;

/**
 * Writes and reads an {@link Urn} as its plain text. Both directions require the value
 * to satisfy {@link Urn#isValid(CharSequence)}.
 */
public final class UrnTypeAdapter extends TypeAdapter<Urn> {
    public static final UrnTypeAdapter INSTANCE = new UrnTypeAdapter();

    private UrnTypeAdapter() {}

    /**
     * @throws CurieFormatException if {@code value} is not empty and does not start
     *                              with {@code urn:}
     */
    @Override public void write(JsonWriter out, @Nullable Urn value) throws IOException {
        if (value == null) {
            out.nullValue();
            return;
        }
        String text = value.toString();
        if (!Urn.isValid(text))
            throw new CurieFormatException(text, "Will not serialize invalid URN");
        out.value(text);
    }

    @Override public @Nullable Urn read(JsonReader in) throws IOException {
        JsonToken token = in.peek();
        if (token == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        if (token != JsonToken.STRING)
            throw new JsonSyntaxException("Expected URN string, got "+token+" at "+in.getPath());
        String path = in.getPath();
        try {
            return Urn.parse(in.nextString());
        } catch (CurieFormatException e) {
            throw new JsonSyntaxException(e.getMessage()+" at "+path, e);
        }
    }
}
