package io.netnotes.fastscroll.view;

import java.util.Set;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import io.netnotes.fastscroll.utils.JsonHelpers;

/**
 * An immutable bag of declared style attributes, the programmatic
 * counterpart of attributes set on a view in a layout file.
 *
 * Values are kept as JSON primitives; {@link ResolvedStyle} does the
 * typed lookups and falls back through the theme.
 */
public final class StyleAttributes {
    public static final StyleAttributes EMPTY = new StyleAttributes(new JsonObject());

    private final JsonObject values;

    private StyleAttributes(JsonObject values) {
        this.values = values;
    }

    public static StyleAttributes fromJson(JsonObject json) {
        return json == null ? EMPTY : new StyleAttributes(json.deepCopy());
    }

    public static StyleAttributes fromJson(String json) {
        return fromJson(JsonHelpers.parseObject(json));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(String attr) {
        JsonElement element = values.get(attr);
        return element != null && !element.isJsonNull();
    }

    public String getString(String attr) {
        return JsonHelpers.getString(values, attr, null);
    }

    JsonElement get(String attr) {
        return values.get(attr);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.size() == 0;
    }

    public JsonObject toJson() {
        return values.deepCopy();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final JsonObject values = new JsonObject();

        private Builder() {}

        public Builder set(String attr, String value) {
            values.add(attr, new JsonPrimitive(value));
            return this;
        }

        public Builder set(String attr, Number value) {
            values.add(attr, new JsonPrimitive(value));
            return this;
        }

        public Builder set(String attr, boolean value) {
            values.add(attr, new JsonPrimitive(value));
            return this;
        }

        public StyleAttributes build() {
            return new StyleAttributes(values.deepCopy());
        }
    }
}
