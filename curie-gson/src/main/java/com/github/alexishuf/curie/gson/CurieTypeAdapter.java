package com.github.alexishuf.curie.gson;

import com.github.alexishuf.curie.Curie;
import com.github.alexishuf.curie.exceptions.CurieFormatException;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;

/**
 * Writes a {@link Curie} as its {@link Curie#safe()} form: {@code "[a:b/c]"} or {@code ""}
 * for {@link Curie#EMPTY}.
 *
 * <p>Reading accepts {@code null}, {@code ""} and bracketed strings only. A non-empty string
 * without surrounding brackets, or any non-string JSON value, is rejected with a
 * {@link JsonSyntaxException}.</p>
 */
public final class CurieTypeAdapter extends TypeAdapter<Curie> {
    public static final CurieTypeAdapter INSTANCE = new CurieTypeAdapter();

    private CurieTypeAdapter() {}

    @Override public void write(JsonWriter out, @Nullable Curie value) throws IOException {
        if (value == null) out.nullValue();
        else               out.value(value.safe());
    }

    @Override public @Nullable Curie read(JsonReader in) throws IOException {
        JsonToken token = in.peek();
        if (token == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        if (token != JsonToken.STRING)
            throw new JsonSyntaxException("Expected safe CURIE string, got "+token
                                          +" at "+in.getPath());
        String path = in.getPath(), text = in.nextString();
        if (text.isEmpty())
            return Curie.EMPTY;
        try {
            if (text.charAt(0) != '[' || text.charAt(text.length()-1) != ']')
                throw new CurieFormatException(text, "CURIE not in safe [scheme:reference] form");
            return Curie.parse(text);
        } catch (CurieFormatException e) {
            throw new JsonSyntaxException(e.getMessage()+" at "+path, e);
        }
    }
}
