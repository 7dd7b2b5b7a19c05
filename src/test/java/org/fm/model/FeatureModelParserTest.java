package org.fm.model;

import org.fm.TestModels;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class FeatureModelParserTest {

    private final FeatureModelParser parser = new FeatureModelParser();

    @Test
    void buildsTreeInDocumentOrder() {
        FeatureModel model = TestModels.load(TestModels.SEARCH_APP);

        assertEquals("Root", model.getRoot().getName());
        assertEquals(List.of("Root", "Search", "ByName", "ByLocation", "Location", "Payment", "Card", "Cash"),
                model.getFeatureNames());

        Feature search = model.getFeature("Search");
        assertTrue(search.isMandatory());
        assertEquals(GroupType.XOR, search.getGroup());
        assertEquals("Root", search.getParent());
        assertEquals(GroupType.OR, model.getFeature("Payment").getGroup());
        assertFalse(model.getFeature("Location").isMandatory());
        assertEquals(GroupType.NONE, model.getRoot().getGroup());
    }

    @Test
    void readsConstraintsWithTranslation() {
        FeatureModel model = TestModels.load(TestModels.SEARCH_APP);

        assertEquals(1, model.getConstraints().size());
        CrossTreeConstraint constraint = model.getConstraints().get(0);
        assertEquals(ConstraintType.REQUIRES, constraint.getType());
        assertEquals("ByLocation", constraint.getSubject());
        assertEquals("Location", constraint.getObject());
        assertEquals("Location feature is required for ByLocation", constraint.getEnglishStatement());
        assertTrue(model.getUnsupportedConstraints().isEmpty());
    }

    @Test
    void keepsUnrecognizedConstraintsAsUnsupported() {
        FeatureModel model = TestModels.load(TestModels.UNSUPPORTED_CONSTRAINT);

        assertEquals(2, model.getConstraints().size());
        assertEquals(1, model.getUnsupportedConstraints().size());
        assertEquals(ConstraintType.EXCLUDES, model.getConstraints().get(1).getType());
    }

    @Test
    void ancestorsAndDescendants() {
        FeatureModel model = TestModels.load(TestModels.SEARCH_APP);

        assertEquals(List.of("Search", "Root"),
                model.getAncestors("ByName").stream().map(Feature::getName).collect(Collectors.toList()));
        assertEquals(List.of("Card", "Cash"),
                model.getDescendants("Payment").stream().map(Feature::getName).collect(Collectors.toList()));
        assertTrue(model.getAncestors("Root").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> model.getAncestors("Ghost"));
    }

    @Test
    void rendersIndentedTree() {
        FeatureModel model = TestModels.load(TestModels.XOR_MANDATORY);

        assertEquals("Root\n  A *  [XOR]\n    B\n    C\n", model.render());
    }

    @Test
    void acceptsFeatureAsDocumentElement() {
        FeatureModel model = parser.parseString("<feature name=\"Solo\"/>");

        assertEquals(1, model.size());
        assertNull(model.getRoot().getParent());
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(ModelParseException.class, () -> parser.parseString(""));
        assertThrows(ModelParseException.class, () -> parser.parseString("<featureModel><feature name=\"R\">"));
        assertThrows(ModelParseException.class, () -> parser.parseString("<featureModel/>"));
    }

    @Test
    void rejectsStructuralErrors() {
        ModelParseException duplicate = assertThrows(ModelParseException.class, () -> parser.parseString(
                "<m><feature name=\"R\"><feature name=\"A\"/><feature name=\"A\"/></feature></m>"));
        assertTrue(duplicate.getMessage().contains("duplicato"));

        assertThrows(ModelParseException.class, () -> parser.parseString(
                "<m><feature name=\"R\"><feature/></feature></m>"));
        assertThrows(ModelParseException.class, () -> parser.parseString(
                "<m><feature name=\"R\"><group type=\"maybe\"><feature name=\"A\"/></group></feature></m>"));
        assertThrows(ModelParseException.class, () -> parser.parseString(
                "<m><feature name=\"R\"><group type=\"xor\"/></feature></m>"));
        assertThrows(ModelParseException.class, () -> parser.parseString(
                "<m><feature name=\"R\"><group type=\"or\"><feature name=\"A\"/></group><feature name=\"B\"/></feature></m>"));
        assertThrows(ModelParseException.class, () -> parser.parseString(
                "<m><feature name=\"R\"><group type=\"or\"><option name=\"A\"/></group></feature></m>"));
        assertThrows(ModelParseException.class, () -> parser.parseString(
                "<m><feature name=\"R\"/><constraint><translation>R requires R</translation></constraint></m>"));
    }

    @Test
    void rejectsDoctypeDeclarations() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE m [<!ENTITY x \"R\">]><m><feature name=\"&x;\"/></m>";

        assertThrows(ModelParseException.class, () -> parser.parseString(xml));
    }

    @Test
    void rejectsNonXmlFiles(@TempDir Path dir) throws Exception {
        Path text = Files.writeString(dir.resolve("model.txt"), "<m><feature name=\"R\"/></m>");

        assertThrows(ModelParseException.class, () -> parser.parse(text));
        assertThrows(ModelParseException.class, () -> parser.parse(dir.resolve("missing.xml")));
    }

    @Test
    void parsesFromPath() {
        FeatureModel model = parser.parse(TestModels.path(TestModels.XOR_MANDATORY));

        assertEquals(4, model.size());
    }
}
