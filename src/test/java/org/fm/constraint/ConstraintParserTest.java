package org.fm.constraint;

import org.fm.model.ConstraintType;
import org.fm.model.CrossTreeConstraint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ConstraintParserTest {

    private static final Set<String> FEATURES = Set.of("A", "B", "Big Screen");

    private final ConstraintParser parser = new ConstraintParser();

    @ParameterizedTest
    @ValueSource(strings = {"A requires B", "A implies B", "A -> B", "A => B", "B is required by A",
            "B is required for A", "B feature is required for A", "A REQUIRES B."})
    void recognizesRequiresForms(String text) {
        CrossTreeConstraint constraint = parser.parse(text, null, FEATURES);

        assertEquals(ConstraintType.REQUIRES, constraint.getType());
        assertEquals("A", constraint.getSubject());
        assertEquals("B", constraint.getObject());
        assertEquals("Requires(A, B)", constraint.toFormalString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"A excludes B", "A -> !B", "A implies not B", "A and B are mutually exclusive",
            "A is incompatible with B", "!(A & B)", "not (A and B)"})
    void recognizesExcludesForms(String text) {
        CrossTreeConstraint constraint = parser.parse(text, null, FEATURES);

        assertEquals(ConstraintType.EXCLUDES, constraint.getType());
        assertEquals("A", constraint.getSubject());
        assertEquals("B", constraint.getObject());
    }

    @Test
    void prefersTranslationOverEnglishStatement() {
        CrossTreeConstraint constraint = parser.parse("Whenever A is on, B must be on too", " A implies B ", FEATURES);

        assertEquals(ConstraintType.REQUIRES, constraint.getType());
        assertEquals("A implies B", constraint.getTranslation());
        assertEquals("Whenever A is on, B must be on too", constraint.getEnglishStatement());
    }

    @Test
    void acceptsQuotedFeatureNames() {
        CrossTreeConstraint constraint = parser.parse("\"Big Screen\" requires B", null, FEATURES);

        assertEquals("Big Screen", constraint.getSubject());
    }

    @Test
    void acceptsKeywordsAsFeatureNames() {
        Set<String> features = Set.of("For", "With", "Is", "Not", "By", "Are", "And", "Feature");

        CrossTreeConstraint requires = parser.parse("For requires With", null, features);
        assertEquals("Requires(For, With)", requires.toFormalString());

        CrossTreeConstraint excludes = parser.parse("Is excludes Not", null, features);
        assertEquals(ConstraintType.EXCLUDES, excludes.getType());
        assertEquals("Is", excludes.getSubject());
        assertEquals("Not", excludes.getObject());

        CrossTreeConstraint requiredBy = parser.parse("By is required for Are", null, features);
        assertEquals("Requires(Are, By)", requiredBy.toFormalString());

        CrossTreeConstraint notBoth = parser.parse("not (And and Feature)", null, features);
        assertEquals(ConstraintType.EXCLUDES, notBoth.getType());
        assertEquals("And", notBoth.getSubject());
        assertEquals("Feature", notBoth.getObject());
    }

    @Test
    void readsRequiredForStatementWithFeatureWord() {
        CrossTreeConstraint constraint = parser.parse("Location feature is required for ByLocation", null,
                Set.of("Location", "ByLocation"));

        assertEquals("Requires(ByLocation, Location)", constraint.toFormalString());
    }

    @Test
    void unknownFeatureMakesConstraintUnsupported() {
        CrossTreeConstraint constraint = parser.parse("A requires Z", null, FEATURES);

        assertFalse(constraint.isSupported());
        assertNull(constraint.getSubject());
        assertEquals("feature sconosciuta: Z", constraint.getReason());
    }

    @ParameterizedTest
    @ValueSource(strings = {"A maybe B", "A requires", "A or B", "A requires B requires A", ""})
    void unrecognizedTextIsUnsupportedWithReason(String text) {
        CrossTreeConstraint constraint = parser.parse(text, null, FEATURES);

        assertEquals(ConstraintType.UNSUPPORTED, constraint.getType());
        assertTrue(constraint.getReason() != null && !constraint.getReason().isEmpty());
        assertEquals(text, constraint.getEnglishStatement());
    }
}
