package com.challenges.mxql.category;

import com.challenges.mxql.payload.PayloadNode;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;

/**
 * Reads strict JSON documents, such as category catalog files, into payload trees.
 */
public class JsonPayloadReader {
    private final JsonFactory factory = new JsonFactory();

    public PayloadNode read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken first = parser.nextToken();
            if (first == null) {
                throw new IOException("Empty JSON document");
            }
            return readValue(parser, first);
        }
    }

    private PayloadNode readValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> new PayloadNode.PayloadString(parser.getText());
            case VALUE_NUMBER_INT -> PayloadNode.PayloadNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> PayloadNode.PayloadNumber.of(parser.getDoubleValue());
            case VALUE_TRUE -> new PayloadNode.PayloadBoolean(true);
            case VALUE_FALSE -> new PayloadNode.PayloadBoolean(false);
            case VALUE_NULL -> new PayloadNode.PayloadNull();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private PayloadNode.PayloadObject readObject(JsonParser parser) throws IOException {
        MutableMap<String, PayloadNode> fields = MapAdapter.adapt(new LinkedHashMap<>());

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, readValue(parser, parser.nextToken()));
        }

        return new PayloadNode.PayloadObject(fields);
    }

    private PayloadNode.PayloadArray readArray(JsonParser parser) throws IOException {
        MutableList<PayloadNode> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token == null) {
                throw new IOException("Unterminated JSON array");
            }
            elements.add(readValue(parser, token));
        }

        return new PayloadNode.PayloadArray(elements);
    }
}
