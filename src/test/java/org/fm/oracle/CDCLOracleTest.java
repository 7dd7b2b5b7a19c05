package org.fm.oracle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class CDCLOracleTest {

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void findsModelSatisfyingAllClauses() {
        try (CDCLOracle oracle = new CDCLOracle()) {
            oracle.addClause(List.of(1, 2));
            oracle.addClause(List.of(-1));
            oracle.addClause(List.of(-2, 3));

            assertTrue(oracle.solve());
            assertEquals(List.of(-1, 2, 3), oracle.getModel());
            assertEquals(3, oracle.getVariableCount());
        }
    }

    @Test
    void prefersNegativePolarity() {
        try (CDCLOracle oracle = new CDCLOracle()) {
            oracle.addClause(List.of(1, 2, 3));

            assertTrue(oracle.solve());
            assertEquals(2, oracle.getModel().stream().filter(literal -> literal < 0).count());
        }
    }

    @Test
    void detectsContradictoryUnits() {
        try (CDCLOracle oracle = new CDCLOracle()) {
            oracle.addClause(List.of(1));
            oracle.addClause(List.of(-1));

            assertFalse(oracle.solve());
            assertFalse(oracle.solve());
            assertThrows(IllegalStateException.class, oracle::getModel);
        }
    }

    @Test
    void emptyClauseMakesFormulaUnsatisfiable() {
        try (CDCLOracle oracle = new CDCLOracle()) {
            oracle.addClause(List.of(1, 2));
            oracle.addClause(List.of());

            assertFalse(oracle.solve());
        }
    }

    @Test
    void tautologiesAreIgnored() {
        try (CDCLOracle oracle = new CDCLOracle()) {
            oracle.addClause(List.of(1, -1));
            oracle.addClause(List.of(-1));

            assertTrue(oracle.solve());
            assertEquals(List.of(-1), oracle.getModel());
        }
    }

    @Test
    void clausesAccumulateBetweenSolves() {
        try (CDCLOracle oracle = new CDCLOracle()) {
            oracle.addClause(List.of(1, 2));
            assertTrue(oracle.solve());

            oracle.addClause(List.of(-1));
            assertTrue(oracle.solve());
            assertTrue(oracle.getModel().contains(2));

            oracle.addClause(List.of(-2));
            assertFalse(oracle.solve());
            assertEquals(3, oracle.getStatistics().getSolves());
        }
    }

    @Test
    void pigeonholeRequiresConflictLearning() {
        try (CDCLOracle oracle = new CDCLOracle()) {
            pigeonhole(4, 3).forEach(oracle::addClause);

            assertFalse(oracle.solve());
            assertTrue(oracle.getStatistics().getConflicts() > 0);
            assertTrue(oracle.getLearnedClauseCount() > 0);
        }
    }

    @Test
    void conflictBudgetIsEnforced() {
        try (CDCLOracle oracle = new CDCLOracle(1)) {
            pigeonhole(5, 4).forEach(oracle::addClause);

            assertThrows(OracleException.class, oracle::solve);
        }
    }

    @Test
    void interruptionStopsSearch() {
        try (CDCLOracle oracle = new CDCLOracle()) {
            oracle.addClause(List.of(1, 2));
            Thread.currentThread().interrupt();

            assertThrows(OracleException.class, oracle::solve);
        }
    }

    @Test
    void rejectsInvalidInput() {
        try (CDCLOracle oracle = new CDCLOracle()) {
            assertThrows(IllegalArgumentException.class, () -> oracle.addClause(List.of(1, 0)));
            assertThrows(IllegalArgumentException.class, () -> oracle.addClause(null));
        }
        assertThrows(IllegalArgumentException.class, () -> new CDCLOracle(0));

        CDCLOracle closed = new CDCLOracle();
        closed.close();
        assertThrows(IllegalStateException.class, () -> closed.addClause(List.of(1)));
        assertThrows(IllegalStateException.class, closed::solve);
    }

    @Test
    void agreesWithSat4jOnRandomFormulas() {
        Random random = new Random(20240501L);
        for (int round = 0; round < 60; round++) {
            int variables = 8 + random.nextInt(8);
            List<List<Integer>> clauses = randomThreeSat(random, variables, (int) (variables * 4.3));

            try (CDCLOracle cdcl = new CDCLOracle(); Sat4jOracle sat4j = new Sat4jOracle()) {
                clauses.forEach(cdcl::addClause);
                clauses.forEach(sat4j::addClause);

                boolean expected = sat4j.solve();
                assertEquals(expected, cdcl.solve(), "Esito diverso al round " + round + ": " + clauses);
                if (expected) {
                    assertSatisfies(cdcl.getModel(), clauses);
                }
            }
        }
    }

    //region SUPPORTO

    static List<List<Integer>> pigeonhole(int pigeons, int holes) {
        List<List<Integer>> clauses = new ArrayList<>();
        for (int p = 0; p < pigeons; p++) {
            List<Integer> somewhere = new ArrayList<>();
            for (int h = 0; h < holes; h++) {
                somewhere.add(p * holes + h + 1);
            }
            clauses.add(somewhere);
        }
        for (int h = 0; h < holes; h++) {
            for (int p = 0; p < pigeons; p++) {
                for (int q = p + 1; q < pigeons; q++) {
                    clauses.add(List.of(-(p * holes + h + 1), -(q * holes + h + 1)));
                }
            }
        }
        return clauses;
    }

    private static List<List<Integer>> randomThreeSat(Random random, int variables, int clauseCount) {
        List<List<Integer>> clauses = new ArrayList<>();
        for (int i = 0; i < clauseCount; i++) {
            Set<Integer> used = new HashSet<>();
            List<Integer> clause = new ArrayList<>();
            while (clause.size() < 3) {
                int variable = 1 + random.nextInt(variables);
                if (used.add(variable)) {
                    clause.add(random.nextBoolean() ? variable : -variable);
                }
            }
            clauses.add(clause);
        }
        return clauses;
    }

    static void assertSatisfies(List<Integer> model, List<List<Integer>> clauses) {
        Set<Integer> trueLiterals = new HashSet<>(model);
        for (List<Integer> clause : clauses) {
            assertTrue(clause.stream().anyMatch(trueLiterals::contains), "Clausola non soddisfatta: " + clause);
        }
    }

    //endregion
}
