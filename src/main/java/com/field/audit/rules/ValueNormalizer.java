package com.field.audit.rules;

import org.apache.commons.text.translate.AggregateTranslator;
import org.apache.commons.text.translate.CharSequenceTranslator;
import org.apache.commons.text.translate.EntityArrays;
import org.apache.commons.text.translate.LookupTranslator;
import org.apache.commons.text.translate.NumericEntityUnescaper;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reduces a display string to the form used for materiality checks.
 *
 * <p>Steps, in order: decode HTML/XML entities, strip markup tags, trim, collapse whitespace runs
 * to a single space, canonicalize a whole-string JSON object, trim again. Strings that look like
 * a JSON object but fail to parse are kept as plain text.</p>
 *
 * <p>Pure and thread-safe.</p>
 */
public class ValueNormalizer {

    private static final CharSequenceTranslator ENTITY_DECODER = new AggregateTranslator(
            new LookupTranslator(EntityArrays.BASIC_UNESCAPE),
            new LookupTranslator(EntityArrays.APOS_UNESCAPE),
            new LookupTranslator(EntityArrays.ISO8859_1_UNESCAPE),
            new LookupTranslator(EntityArrays.HTML40_EXTENDED_UNESCAPE),
            new NumericEntityUnescaper()
    );

    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("</?[A-Za-z!?][^>]*>");
    // Non-breaking spaces come out of &nbsp; and count as whitespace here.
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern JSON_OBJECT = Pattern.compile("^\\{.*}$", Pattern.DOTALL);

    private final Canonicalizer canonicalizer;

    public ValueNormalizer() {
        this(new Canonicalizer());
    }

    public ValueNormalizer(Canonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /**
     * Normalizes a value for comparison. Null is treated as the empty string.
     */
    public String normalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String result = decodeEntities(value);
        result = stripTags(result);
        result = collapseWhitespace(result.trim());
        if (JSON_OBJECT.matcher(result).matches()) {
            String json = result;
            result = canonicalizer.parseJson(json)
                    .filter(Map.class::isInstance)
                    .map(canonicalizer::toJson)
                    .orElse(json);
        }
        return result.trim();
    }

    /**
     * Checks whether two values are equal once normalized.
     */
    public boolean areEquivalent(String first, String second) {
        return normalize(first).equals(normalize(second));
    }

    /**
     * Decodes entities and collapses whitespace without touching markup.
     * Used for text sub-fields of nested items.
     */
    public String decodeAndCollapse(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return collapseWhitespace(decodeEntities(value)).trim();
    }

    static String decodeEntities(String value) {
        return ENTITY_DECODER.translate(value);
    }

    static String stripTags(String value) {
        String withoutComments = COMMENT.matcher(value).replaceAll("");
        return TAG.matcher(withoutComments).replaceAll("");
    }

    static String collapseWhitespace(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ");
    }
}
