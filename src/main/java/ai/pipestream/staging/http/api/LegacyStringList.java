package ai.pipestream.staging.http.api;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;

import java.io.IOException;
import java.util.List;

/**
 * A list of strings in the legacy document style.
 * <p>
 * XML: {@code <targetGroups><string>a</string><string>b</string></targetGroups>}.
 * JSON: a plain array.
 */
@JsonSerialize(using = LegacyStringList.Serializer.class)
public final class LegacyStringList {

    static final String ITEM_ELEMENT = "string";

    private final List<String> values;

    private LegacyStringList(List<String> values) {
        this.values = List.copyOf(values);
    }

    public static LegacyStringList of(String... values) {
        return new LegacyStringList(List.of(values));
    }

    public static LegacyStringList of(List<String> values) {
        return new LegacyStringList(values);
    }

    public List<String> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((LegacyStringList) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Serializer extends StdSerializer<LegacyStringList> {

        public Serializer() {
            super(LegacyStringList.class);
        }

        @Override
        public void serialize(LegacyStringList list, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            if (gen instanceof ToXmlGenerator) {
                // each item becomes a <string> child of the property element
                gen.writeStartObject();
                for (String value : list.values) {
                    gen.writeStringField(ITEM_ELEMENT, value);
                }
                gen.writeEndObject();
                return;
            }
            gen.writeStartArray();
            for (String value : list.values) {
                gen.writeString(value);
            }
            gen.writeEndArray();
        }
    }
}
