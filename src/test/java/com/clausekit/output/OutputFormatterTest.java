package com.clausekit.output;

import com.clausekit.json.JsonNode;
import com.clausekit.json.JsonNodeParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class OutputFormatterTest {

    private JsonNode json(String text) throws IOException {
        return new JsonNodeParser().parse(text);
    }

    @Test
    public void testCompact() throws IOException {
        OutputFormatter formatter = new OutputFormatter(false, true);
        assertEquals("{\"query\":{\"filter\":[\"=\",[\"field-id\",10],20],\"limit\":null}}",
            formatter.format(json("{\"query\": {\"limit\": null, \"filter\": [\"=\", [\"field-id\", 10], 20]}}")));
        assertEquals("[]", formatter.format(json("[]")));
        assertEquals("{}", formatter.format(json("{}")));
    }

    @Test
    public void testPretty() throws IOException {
        OutputFormatter formatter = new OutputFormatter(true, true);
        String expected = "{\n"
            + "  \"filter\": [\n"
            + "    \"and\",\n"
            + "    true,\n"
            + "    1.5\n"
            + "  ],\n"
            + "  \"limit\": 10\n"
            + "}";
        assertEquals(expected, formatter.format(json("{\"limit\": 10, \"filter\": [\"and\", true, 1.5]}")));
    }

    @Test
    public void testEscaping() {
        OutputFormatter formatter = new OutputFormatter(false);
        assertEquals("\"a\\\"b\\\\c\\nd\\u0001\"", formatter.format(JsonNode.of("a\"b\\c\nd\u0001")));
    }

    @Test
    public void testWholeNumbersFromDoubles() {
        assertEquals("20", new OutputFormatter(false).format(JsonNode.JsonNumber.of(20.0)));
    }
}
