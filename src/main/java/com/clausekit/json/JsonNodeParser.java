package com.clausekit.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;

public class JsonNodeParser {
    private final JsonFactory factory = new JsonFactory();

    public JsonNode parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseDocument(parser);
        }
    }

    public JsonNode parse(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return parseDocument(parser);
        }
    }

    private JsonNode parseDocument(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token == null) {
            throw new IOException("Empty JSON input");
        }
        return parseValue(parser, token);
    }

    private JsonNode parseValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> JsonNode.JsonNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> JsonNode.JsonNumber.of(parser.getDoubleValue());
            case VALUE_TRUE -> new JsonNode.JsonBoolean(true);
            case VALUE_FALSE -> new JsonNode.JsonBoolean(false);
            case VALUE_NULL -> new JsonNode.JsonNull();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonNode.JsonObject parseObject(JsonParser parser) throws IOException {
        var fields = Maps.mutable.<String, JsonNode>empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
            if (token != JsonToken.FIELD_NAME) {
                throw new IOException("Unexpected JSON token: " + token);
            }
            String fieldName = parser.getCurrentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return new JsonNode.JsonObject(fields.toImmutable());
    }

    private JsonNode.JsonArray parseArray(JsonParser parser) throws IOException {
        var elements = Lists.mutable.<JsonNode>empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return new JsonNode.JsonArray(elements.toImmutable());
    }
}
