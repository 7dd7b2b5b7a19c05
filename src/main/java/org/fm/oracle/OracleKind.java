package org.fm.oracle;

import java.time.Duration;
import java.util.Locale;

/**
 * Implementazioni disponibili del {@link SatOracle}.
 */
public enum OracleKind {

    /** Solver CDCL interno */
    CDCL,

    /** Adapter sul solver MiniSat-style di Sat4j */
    SAT4J;

    /**
     * Crea un nuovo oracle, uno per sessione.
     *
     * @param timeout limite di tempo per singola solve (usato da Sat4j; il CDCL interno
     *                rispetta l'interruzione del thread)
     */
    public SatOracle newOracle(Duration timeout) {
        return switch (this) {
            case CDCL -> new CDCLOracle();
            case SAT4J -> new Sat4jOracle(timeout);
        };
    }

    /**
     * @param value "cdcl" o "sat4j", senza distinzione di maiuscole
     */
    public static OracleKind fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Nome oracle mancante");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Oracle non supportato: " + value + " (ammessi: cdcl, sat4j)", e);
        }
    }
}
