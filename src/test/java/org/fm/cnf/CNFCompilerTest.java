package org.fm.cnf;

import org.fm.TestModels;
import org.fm.constraint.UnsupportedConstraintException;
import org.fm.model.FeatureModel;
import org.fm.oracle.CDCLOracle;
import org.fm.oracle.OracleKind;
import org.fm.oracle.SatOracle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class CNFCompilerTest {

    private final CNFCompiler compiler = new CNFCompiler();

    @Test
    void emitsClausesAndRulesInVisitOrder() {
        CompiledFormula formula = compiler.compile(TestModels.load(TestModels.XOR_MANDATORY));

        assertEquals(List.of(
                List.of(1),
                List.of(-1, 2),
                List.of(-2, 1),
                List.of(-2, 3, 4),
                List.of(-3, -4),
                List.of(-3, 2),
                List.of(-4, 2)), formula.getClauses());
        assertEquals(List.of(
                "Root",
                "Root → A",
                "A → Root",
                "A → (B ∨ C)",
                "¬(B ∧ C)",
                "B → A",
                "C → A"), formula.getRules());

        VariableRegistry registry = formula.getRegistry();
        assertEquals(1, registry.idOf("Root"));
        assertEquals(2, registry.idOf("A"));
        assertEquals(3, registry.idOf("B"));
        assertEquals(4, registry.idOf("C"));
        assertEquals("C", registry.nameOf(-4));
    }

    @Test
    void compilationIsDeterministic() {
        FeatureModel model = TestModels.load(TestModels.SEARCH_APP);

        CompiledFormula first = compiler.compile(model);
        CompiledFormula second = new CNFCompiler().compile(model);

        assertEquals(first.getClauses(), second.getClauses());
        assertEquals(first.getRules(), second.getRules());
        assertEquals(first.getRegistry().asMap(), second.getRegistry().asMap());
        assertEquals(first.toDimacs(), second.toDimacs());
    }

    @Test
    void encodesCrossTreeConstraints() {
        CompiledFormula requires = compiler.compile(TestModels.load(TestModels.SEARCH_APP));
        int byLocation = requires.getRegistry().idOf("ByLocation");
        int location = requires.getRegistry().idOf("Location");
        int last = requires.getClauseCount() - 1;
        assertEquals(List.of(-byLocation, location), requires.getClauses().get(last));
        assertEquals("ByLocation → Location", requires.getRules().get(last));

        CompiledFormula excludes = compiler.compile(TestModels.load(TestModels.UNSATISFIABLE));
        int lastExcludes = excludes.getClauseCount() - 1;
        assertEquals(List.of(-2, -3), excludes.getClauses().get(lastExcludes));
        assertEquals("¬(A ∧ B)", excludes.getRules().get(lastExcludes));
    }

    @Test
    void orGroupHasNoPairwiseExclusion() {
        CompiledFormula formula = compiler.compile(TestModels.load(TestModels.SEARCH_APP));

        assertTrue(formula.getRules().contains("Payment → (Card ∨ Cash)"));
        assertFalse(formula.getRules().contains("¬(Card ∧ Cash)"));
        assertTrue(formula.getRules().contains("¬(ByName ∧ ByLocation)"));
    }

    @Test
    void mandatoryFeatureIsEntailedWheneverParentIs() {
        CompiledFormula formula = compiler.compile(TestModels.load(TestModels.XOR_MANDATORY));
        int a = formula.getRegistry().idOf("A");

        try (SatOracle oracle = new CDCLOracle()) {
            formula.getClauses().forEach(oracle::addClause);
            oracle.addClause(List.of(-a));
            assertFalse(oracle.solve());
        }
    }

    @ParameterizedTest
    @EnumSource(OracleKind.class)
    void mandatoryChildAndOptionalParentAreEquivalent(OracleKind kind) {
        CompiledFormula formula = compiler.compile(TestModels.load(TestModels.NESTED_MANDATORY));
        int p = formula.getRegistry().idOf("P");
        int f = formula.getRegistry().idOf("F");

        assertFalse(solveWith(kind, formula, List.of(p), List.of(-f)));
        assertFalse(solveWith(kind, formula, List.of(f), List.of(-p)));
        assertTrue(solveWith(kind, formula, List.of(p), List.of(f)));
        assertTrue(solveWith(kind, formula, List.of(-p), List.of(-f)));
    }

    private static boolean solveWith(OracleKind kind, CompiledFormula formula, List<Integer> first,
                                     List<Integer> second) {
        try (SatOracle oracle = kind.newOracle(Duration.ofSeconds(5))) {
            formula.getClauses().forEach(oracle::addClause);
            oracle.addClause(first);
            oracle.addClause(second);
            return oracle.solve();
        }
    }

    @Test
    void xorChildrenAreNeverSelectedTogether() {
        CompiledFormula formula = compiler.compile(TestModels.load(TestModels.XOR_MANDATORY));
        int b = formula.getRegistry().idOf("B");
        int c = formula.getRegistry().idOf("C");

        try (SatOracle oracle = new CDCLOracle()) {
            formula.getClauses().forEach(oracle::addClause);
            oracle.addClause(List.of(b));
            oracle.addClause(List.of(c));
            assertFalse(oracle.solve());
        }
        try (SatOracle oracle = new CDCLOracle()) {
            formula.getClauses().forEach(oracle::addClause);
            oracle.addClause(List.of(-b));
            oracle.addClause(List.of(-c));
            assertFalse(oracle.solve());
        }
        try (SatOracle oracle = new CDCLOracle()) {
            formula.getClauses().forEach(oracle::addClause);
            oracle.addClause(List.of(b));
            assertTrue(oracle.solve());
            assertTrue(oracle.getModel().contains(-c));
        }
    }

    @Test
    void unsupportedConstraintIsReportedInLenientMode() {
        CompiledFormula formula = compiler.compile(TestModels.load(TestModels.UNSUPPORTED_CONSTRAINT));

        assertEquals(1, formula.getUnsupportedConstraints().size());
        assertEquals(formula.getClauseCount(), formula.getRules().size());
        assertTrue(formula.getRules().contains("¬(A ∧ B)"));
    }

    @Test
    void unsupportedConstraintFailsInStrictMode() {
        FeatureModel model = TestModels.load(TestModels.UNSUPPORTED_CONSTRAINT);
        CNFCompiler strict = new CNFCompiler(true);

        UnsupportedConstraintException error = assertThrows(UnsupportedConstraintException.class,
                () -> strict.compile(model));
        assertEquals("A should usually come with B when it is convenient", error.getConstraintText());
    }

    @Test
    void exportsDimacsWithVariableComments() {
        CompiledFormula formula = compiler.compile(TestModels.load(TestModels.XOR_MANDATORY));

        String expected = "c 1 Root\nc 2 A\nc 3 B\nc 4 C\n" +
                "p cnf 4 7\n" +
                "1 0\n-1 2 0\n-2 1 0\n-2 3 4 0\n-3 -4 0\n-3 2 0\n-4 2 0\n";
        assertEquals(expected, formula.toDimacs());
    }
}
