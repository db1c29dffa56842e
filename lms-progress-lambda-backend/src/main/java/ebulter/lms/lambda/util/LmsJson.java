package ebulter.lms.lambda.util;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Instant;

/**
 * Shared Gson configuration: snake_case field names and ISO-8601 instants
 */
public final class LmsJson {
    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeAdapter(Instant.class, new InstantTypeAdapter().nullSafe())
            .create();

    private LmsJson() {
    }

    public static Gson gson() {
        return GSON;
    }

    static class InstantTypeAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            // Older clients send epoch milliseconds
            if (in.peek() == JsonToken.NUMBER) {
                return Instant.ofEpochMilli(in.nextLong());
            }
            return Instant.parse(in.nextString());
        }
    }
}
