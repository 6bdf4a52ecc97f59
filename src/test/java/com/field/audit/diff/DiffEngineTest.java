package com.field.audit.diff;

import com.field.audit.rules.ValueNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DiffEngineTest {

    private DiffEngine diffEngine;
    private ValueNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ValueNormalizer();
        diffEngine = new DiffEngine(normalizer);
    }

    @Test
    @DisplayName("Should describe a material change using normalized values")
    void testMaterialChange() {
        Optional<String> diff = diffEngine.diff("<p>Hello</p>", "Hello   World ");

        assertEquals(Optional.of("Changed from: Hello\nTo: Hello World"), diff);
    }

    @Test
    @DisplayName("Should report no change for cosmetic edits")
    void testCosmeticEdits() {
        assertTrue(diffEngine.diff("Fish & Chips", "<b>Fish &amp; Chips</b>  ").isEmpty());
        assertTrue(diffEngine.diff("{\"a\":1,\"b\":2}", "{\"b\": 2, \"a\": 1}").isEmpty());
        assertTrue(diffEngine.diff(null, "").isEmpty());
    }

    @Test
    @DisplayName("Should report additions and removals against empty values")
    void testEmptySides() {
        assertEquals(Optional.of("Changed from: \nTo: New"), diffEngine.diff("", "New"));
        assertEquals(Optional.of("Changed from: Old\nTo: "), diffEngine.diff("Old", null));
    }

    @ParameterizedTest
    @DisplayName("A diff should exist exactly when normalized values differ")
    @CsvSource(delimiter = '|', value = {
            "A|A ",
            "A|B",
            "<i>x</i>|x",
            "a  b|a b",
            "1.00|1.0",
            "&lt;tag&gt;|''",
            "{\"k\":\"\"}|{}"
    })
    void testDetectionMatchesNormalization(String a, String b) {
        boolean differs = !normalizer.normalize(a).equals(normalizer.normalize(b));
        assertEquals(differs, diffEngine.diff(a, b).isPresent());
        assertEquals(differs, diffEngine.isMaterial(a, b));
    }
}
