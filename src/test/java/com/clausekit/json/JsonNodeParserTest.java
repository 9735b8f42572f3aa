package com.clausekit.json;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class JsonNodeParserTest {

    private final JsonNodeParser parser = new JsonNodeParser();

    @Test
    public void testParseQueryDocument() throws IOException {
        JsonNode node = parser.parse("{\"database\": 1, \"query\": {\"filter\": [\"=\", [\"field-id\", 10], 2.5], \"limit\": null, \"distinct\": true}}");

        assertTrue(node instanceof JsonNode.JsonObject);
        JsonNode.JsonObject query = (JsonNode.JsonObject) ((JsonNode.JsonObject) node).fields().get("query");
        assertEquals(3, query.fields().size());
        assertEquals(new JsonNode.JsonNull(), query.fields().get("limit"));
        assertEquals(new JsonNode.JsonBoolean(true), query.fields().get("distinct"));

        JsonNode.JsonArray filter = (JsonNode.JsonArray) query.fields().get("filter");
        assertEquals(JsonNode.of("="), filter.elements().get(0));
        assertEquals(JsonNode.JsonArray.of(JsonNode.of("field-id"), JsonNode.of(10)), filter.elements().get(1));
        assertEquals(2.5, ((JsonNode.JsonNumber) filter.elements().get(2)).numberValue().doubleValue(), 0.0001);
    }

    @Test
    public void testParseFromStream() throws IOException {
        JsonNode node = parser.parse(new ByteArrayInputStream("[\"count\"]".getBytes(StandardCharsets.UTF_8)));
        assertEquals(new JsonNode.JsonArray(Lists.immutable.of(JsonNode.of("count"))), node);
    }

    @Test
    public void testStructuralEquality() throws IOException {
        assertEquals(parser.parse("{\"a\": [1, {\"b\": \"c\"}], \"d\": null}"), parser.parse("{\"d\": null, \"a\": [1, {\"b\": \"c\"}]}"));
        assertNotEquals(parser.parse("[1, 2]"), parser.parse("[2, 1]"));
    }

    @Test
    public void testMalformedInput() {
        assertThrows(IOException.class, () -> parser.parse("{\"a\": [1, 2}"));
        assertThrows(IOException.class, () -> parser.parse(""));
    }

    @Test
    public void testImmutableUpdates() {
        JsonNode.JsonObject empty = JsonNode.JsonObject.empty();
        JsonNode.JsonObject withField = empty.with("filter", JsonNode.of(1));
        assertTrue(empty.fields().isEmpty());
        assertEquals(JsonNode.of(1), withField.fields().get("filter"));

        JsonNode.JsonArray array = JsonNode.JsonArray.empty().with(JsonNode.of(1)).with(JsonNode.of(2));
        JsonNode.JsonArray replaced = array.withElementAt(0, JsonNode.of(3));
        assertEquals(JsonNode.JsonArray.of(JsonNode.of(1), JsonNode.of(2)), array);
        assertEquals(JsonNode.JsonArray.of(JsonNode.of(3), JsonNode.of(2)), replaced);
    }
}
