package com.clausekit.path;

import com.clausekit.json.JsonNode;
import com.clausekit.json.JsonNodeParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class KeyPathTest {

    private JsonNode json(String text) throws IOException {
        return new JsonNodeParser().parse(text);
    }

    @Test
    public void testParse() {
        assertEquals(KeyPath.root(), KeyPath.parse("."));
        assertEquals(KeyPath.of("query", "filter"), KeyPath.parse(".query.filter"));
        assertEquals(KeyPath.of("query", "joins", 0, "condition"), KeyPath.parse(".query.joins[0].condition"));
        assertEquals(KeyPath.of(2), KeyPath.parse(".[2]"));
        assertEquals(KeyPath.of("breakout", -1), KeyPath.parse(".breakout.[-1]"));
    }

    @Test
    public void testToStringRoundTrips() {
        KeyPath path = KeyPath.of("query", "joins", 0, "condition");
        assertEquals(".query.joins[0].condition", path.toString());
        assertEquals(path, KeyPath.parse(path.toString()));
        assertEquals(".", KeyPath.root().toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "query.filter", "..query", ".query.", ".a[x]", ".a[1"})
    public void testParseRejectsInvalidPaths(String path) {
        assertThrows(IllegalArgumentException.class, () -> KeyPath.parse(path));
    }

    @Test
    public void testOfRejectsUnsupportedKeys() {
        assertThrows(IllegalArgumentException.class, () -> KeyPath.of("query", 1.5));
    }

    @Test
    public void testGet() throws IOException {
        JsonNode doc = json("{\"query\": {\"breakout\": [[\"field-id\", 1], [\"field-id\", 2]]}}");
        assertEquals(json("[\"field-id\", 2]"), KeyPath.parse(".query.breakout[1]").get(doc));
        assertEquals(json("[\"field-id\", 2]"), KeyPath.parse(".query.breakout[-1]").get(doc));
        assertSame(doc, KeyPath.root().get(doc));
    }

    @Test
    public void testGetFailsOnMissingElement() throws IOException {
        JsonNode doc = json("{\"query\": {}}");
        KeyPathException e = assertThrows(KeyPathException.class, () -> KeyPath.parse(".query.filter").get(doc));
        assertTrue(e.getMessage().contains(".query.filter"));
        assertThrows(KeyPathException.class, () -> KeyPath.parse(".query[0]").get(doc));
    }

    @Test
    public void testFind() throws IOException {
        JsonNode doc = json("{\"query\": {\"filter\": [\"=\", 1, 2]}}");
        assertEquals(Optional.of(json("[\"=\", 1, 2]")), KeyPath.parse(".query.filter").find(doc));
        assertEquals(Optional.empty(), KeyPath.parse(".query.breakout").find(doc));
        assertThrows(KeyPathException.class, () -> KeyPath.parse(".outer.filter").find(doc));
    }

    @Test
    public void testUpdateSharesUntouchedSubtrees() throws IOException {
        JsonNode doc = json("{\"query\": {\"filter\": [\"=\", 1, 2], \"breakout\": [[\"field-id\", 1]]}, \"database\": 1}");
        JsonNode replacement = json("[\"=\", 1, 3]");
        JsonNode updated = KeyPath.parse(".query.filter").update(doc, filter -> replacement);

        assertEquals(json("{\"query\": {\"filter\": [\"=\", 1, 3], \"breakout\": [[\"field-id\", 1]]}, \"database\": 1}"), updated);
        assertSame(KeyPath.parse(".query.breakout").get(doc), KeyPath.parse(".query.breakout").get(updated));
        assertEquals(json("[\"=\", 1, 2]"), KeyPath.parse(".query.filter").get(doc));
    }

    @Test
    public void testUpdateReturnsSameDocumentWhenNothingChanges() throws IOException {
        JsonNode doc = json("{\"query\": {\"filter\": [\"=\", 1, 2]}}");
        assertSame(doc, KeyPath.parse(".query.filter").update(doc, filter -> filter));
    }

    @Test
    public void testAssocAddsFinalMember() throws IOException {
        JsonNode doc = json("{\"query\": {}}");
        JsonNode updated = KeyPath.parse(".query.filter").assoc(doc, json("[\"=\", 1, 2]"));
        assertEquals(json("{\"query\": {\"filter\": [\"=\", 1, 2]}}"), updated);
        assertEquals(json("{\"query\": {}}"), doc);
    }

    @Test
    public void testAssocReplacesArrayElement() throws IOException {
        JsonNode doc = json("{\"breakout\": [1, 2, 3]}");
        assertEquals(json("{\"breakout\": [1, 20, 3]}"), KeyPath.parse(".breakout[1]").assoc(doc, JsonNode.of(20)));
        assertThrows(KeyPathException.class, () -> KeyPath.parse(".breakout[3]").assoc(doc, JsonNode.of(20)));
    }

    @Test
    public void testAssocDoesNotFabricateIntermediates() throws IOException {
        JsonNode doc = json("{}");
        assertThrows(KeyPathException.class, () -> KeyPath.parse(".query.filter").assoc(doc, JsonNode.of(1)));
        assertThrows(KeyPathException.class, () -> KeyPath.parse(".query").assoc(JsonNode.of(1), JsonNode.of(1)));
    }

    @Test
    public void testAssocAtRootReplacesDocument() throws IOException {
        assertEquals(JsonNode.of(1), KeyPath.root().assoc(json("{}"), JsonNode.of(1)));
    }
}
