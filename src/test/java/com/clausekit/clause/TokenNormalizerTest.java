package com.clausekit.clause;

import com.clausekit.json.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class TokenNormalizerTest {

    @ParameterizedTest
    @CsvSource({
        "FIELD_ID, field-id",
        "field-id, field-id",
        "Field_Id, field-id",
        "field_id, field-id",
        "and, and",
        "AND, and",
        "=, =",
        "starts-with, starts-with",
        "Metabase_Ns/Field_Id, metabase-ns/field-id"
    })
    public void testNormalize(String token, String expected) {
        assertEquals(expected, TokenNormalizer.normalize(token).name());
    }

    @Test
    public void testSpellingVariantsNormalizeAlike() {
        Tag tag = TokenNormalizer.normalize("FIELD_ID");
        assertEquals(tag, TokenNormalizer.normalize("field-id"));
        assertEquals(tag, TokenNormalizer.normalize("Field_Id"));
        assertEquals(tag, Tag.of("field_id"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"FIELD_ID", "datetime-field", "Aggregation_Options", "x"})
    public void testNormalizeIsIdempotent(String token) {
        Tag once = TokenNormalizer.normalize(token);
        assertEquals(once, TokenNormalizer.normalize(once.name()));
        assertEquals(once, TokenNormalizer.normalize(once));
    }

    @Test
    public void testNormalizeJsonString() {
        assertEquals(Tag.AND, TokenNormalizer.normalize(new JsonNode.JsonString("AND")));
    }

    @Test
    public void testNormalizeRejectsNonStringNode() {
        assertThrows(IllegalArgumentException.class, () -> TokenNormalizer.normalize(JsonNode.of(10)));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "field id", "\tand"})
    public void testNormalizeRejectsNonIdentifiers(String token) {
        assertFalse(TokenNormalizer.isIdentifier(token));
        assertThrows(IllegalArgumentException.class, () -> TokenNormalizer.normalize(token));
    }

    @Test
    public void testTagPoolStaysBounded() {
        for (int i = 0; i < 200_000; i++) {
            TokenNormalizer.normalize("Head_" + i);
            Clauses.isClause(JsonNode.JsonArray.of(JsonNode.of("x" + i)));
        }
        assertTrue(Tag.pooledCount() <= Tag.POOL_SIZE);
        assertEquals(Tag.of("head-5"), TokenNormalizer.normalize("HEAD_5"));
    }

    @Test
    public void testTagEquality() {
        assertEquals(Tag.of("and"), Tag.AND);
        assertEquals(Tag.of("field-id").hashCode(), Tag.of("FIELD_ID").hashCode());
        assertNotEquals(Tag.of("and"), Tag.of("or"));
    }
}
