package org.fm.oracle;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class Sat4jOracleTest {

    @Test
    void solvesIncrementally() {
        try (Sat4jOracle oracle = new Sat4jOracle(Duration.ofSeconds(5))) {
            oracle.addClause(List.of(1, 2));
            assertTrue(oracle.solve());
            assertEquals(2, oracle.getModel().size());

            oracle.addClause(List.of(-1));
            oracle.addClause(List.of(-2, 3));
            assertTrue(oracle.solve());
            assertEquals(List.of(-1, 2, 3), oracle.getModel());

            oracle.addClause(List.of(-3));
            assertFalse(oracle.solve());
        }
    }

    @Test
    void contradictionAtInsertionIsRemembered() {
        try (Sat4jOracle oracle = new Sat4jOracle()) {
            oracle.addClause(List.of(1));
            oracle.addClause(List.of(-1));
            oracle.addClause(List.of(2));

            assertFalse(oracle.solve());
            assertThrows(IllegalStateException.class, oracle::getModel);
        }
    }

    @Test
    void emptyClauseIsUnsatisfiable() {
        try (Sat4jOracle oracle = new Sat4jOracle()) {
            oracle.addClause(List.of());

            assertFalse(oracle.solve());
        }
    }

    @Test
    void provesPigeonholeUnsatisfiable() {
        try (Sat4jOracle oracle = new Sat4jOracle()) {
            CDCLOracleTest.pigeonhole(4, 3).forEach(oracle::addClause);

            assertFalse(oracle.solve());
        }
    }

    @Test
    void oracleKindFactory() {
        assertSame(OracleKind.SAT4J, OracleKind.fromName(" Sat4J "));
        assertSame(OracleKind.CDCL, OracleKind.fromName("cdcl"));
        assertThrows(IllegalArgumentException.class, () -> OracleKind.fromName("minisat"));

        try (SatOracle oracle = OracleKind.SAT4J.newOracle(Duration.ofSeconds(1))) {
            assertTrue(oracle instanceof Sat4jOracle);
        }
        try (SatOracle oracle = OracleKind.CDCL.newOracle(null)) {
            assertTrue(oracle instanceof CDCLOracle);
        }
    }
}
