package com.transys.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nullable;

final class ParseUtil {
    private ParseUtil() {
    }

    static Stream<JsonElement> stream(JsonArray array) {
        return StreamSupport.stream(Spliterators.spliterator(array.iterator(), array.size(),
                        Spliterator.IMMUTABLE | Spliterator.SIZED | Spliterator.ORDERED), false);
    }

    static List<String> strings(JsonArray array) {
        return stream(array).map(JsonElement::getAsString).toList();
    }

    /** Plain Java value of a JSON element: strings for primitives, lists for arrays. */
    @Nullable
    static Object value(JsonElement element) {
        if (element.isJsonNull()) {
            return null;
        }
        if (element instanceof JsonPrimitive primitive) {
            return primitive.getAsString();
        }
        if (element instanceof JsonArray array) {
            return stream(array).map(ParseUtil::value).toList();
        }
        throw new IllegalArgumentException("Unsupported value " + element);
    }
}
