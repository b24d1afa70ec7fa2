/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.format;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

import io.pgjson.annotation.Immutable;
import io.pgjson.encoder.value.JsonStrings;

/**
 * The punctuation of the enveloped format. The compact variant writes no whitespace at all; the pretty variant
 * indents members with tabs, puts every member on its own line and adds a space after colons and commas.
 */
@Immutable
final class JsonTokens {

    static final JsonTokens COMPACT = new JsonTokens(false);
    static final JsonTokens PRETTY = new JsonTokens(true);

    private final boolean pretty;

    private JsonTokens(boolean pretty) {
        this.pretty = pretty;
    }

    static JsonTokens of(boolean pretty) {
        return pretty ? PRETTY : COMPACT;
    }

    boolean isPretty() {
        return pretty;
    }

    String separator() {
        return pretty ? ", " : ",";
    }

    String colon() {
        return pretty ? ": " : ":";
    }

    StringBuilder indent(StringBuilder out, int depth) {
        if (pretty) {
            for (int i = 0; i < depth; i++) {
                out.append('\t');
            }
        }
        return out;
    }

    /**
     * Write the indented, quoted member name followed by the colon.
     */
    StringBuilder name(StringBuilder out, int depth, String name) {
        indent(out, depth);
        return JsonStrings.quote(name, out).append(colon());
    }

    /**
     * Write a complete member. {@code more} tells whether another member of the same object follows.
     */
    StringBuilder field(StringBuilder out, int depth, String name, CharSequence literal, boolean more) {
        name(out, depth, name).append(literal);
        return endMember(out, more);
    }

    StringBuilder stringField(StringBuilder out, int depth, String name, String text, boolean more) {
        JsonStrings.quoteOrNull(text, name(out, depth, name));
        return endMember(out, more);
    }

    StringBuilder openObject(StringBuilder out, int depth, String name) {
        name(out, depth, name).append('{');
        return pretty ? out.append('\n') : out;
    }

    StringBuilder closeObject(StringBuilder out, int depth, boolean more) {
        indent(out, depth).append('}');
        return endMember(out, more);
    }

    StringBuilder endMember(StringBuilder out, boolean more) {
        if (more) {
            out.append(',');
        }
        return pretty ? out.append('\n') : out;
    }

    /**
     * Write a JSON array of the rendered elements.
     */
    <T> String array(List<T> elements, Function<T, CharSequence> renderer) {
        final StringBuilder out = new StringBuilder().append('[');
        for (Iterator<T> it = elements.iterator(); it.hasNext();) {
            out.append(renderer.apply(it.next()));
            if (it.hasNext()) {
                out.append(separator());
            }
        }
        return out.append(']').toString();
    }

    /**
     * Write a JSON object whose member names and values are rendered from the elements.
     */
    <T> String object(List<T> elements, Function<T, String> names, Function<T, CharSequence> values) {
        final StringBuilder out = new StringBuilder().append('{');
        for (Iterator<T> it = elements.iterator(); it.hasNext();) {
            T element = it.next();
            JsonStrings.quote(names.apply(element), out).append(colon()).append(values.apply(element));
            if (it.hasNext()) {
                out.append(separator());
            }
        }
        return out.append('}').toString();
    }
}
