package com.clausekit.clause;

import com.clausekit.json.JsonNode;

import java.util.Locale;

/**
 * Converts the spelling variants a clause tag may arrive in ({@code lisp-case}, {@code snake_case},
 * {@code SCREAMING_SNAKE_CASE}, mixed case) into a single canonical {@link Tag}.
 *
 * <pre>
 *   normalize("FIELD_ID"), normalize("field-id") and normalize("Field_Id") are all equal to Tag "field-id"
 * </pre>
 *
 * A namespace prefix ({@code ns/name}) is kept and normalized the same way.
 */
public final class TokenNormalizer {
    private TokenNormalizer() {
    }

    public static Tag normalize(String token) {
        if (!isIdentifier(token)) {
            throw new IllegalArgumentException("Not a clause identifier: " + quote(token));
        }
        return Tag.intern(token.toLowerCase(Locale.ROOT).replace('_', '-'));
    }

    public static Tag normalize(Tag tag) {
        return tag;
    }

    public static Tag normalize(JsonNode token) {
        if (token instanceof JsonNode.JsonString s) {
            return normalize(s.value());
        }
        throw new IllegalArgumentException("Not a clause identifier: " + token);
    }

    /**
     * True if {@code token} can name a clause: non-empty and free of whitespace.
     */
    public static boolean isIdentifier(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            if (Character.isWhitespace(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String quote(String token) {
        return token == null ? "null" : "\"" + token + "\"";
    }
}
