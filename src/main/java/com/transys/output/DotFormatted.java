package com.transys.output;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public interface DotFormatted {
    Pattern ESCAPED = Pattern.compile("([\"\\\\])");

    String dotString();

    static String toDotString(Object object) {
        if (object instanceof Optional<?> optional) {
            return optional.map(DotFormatted::toDotString).orElse("/");
        }
        if (object instanceof Collection<?> collection) {
            return collection.stream()
                    .map(DotFormatted::toDotString)
                    .sorted()
                    .collect(Collectors.joining(",", "{", "}"));
        }
        return (object instanceof DotFormatted format) ? format.dotString() : String.valueOf(object);
    }

    static String escape(String string) {
        return ESCAPED.matcher(string).replaceAll("\\\\$1");
    }
}
