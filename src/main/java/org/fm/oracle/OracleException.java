package org.fm.oracle;

/**
 * Fallimento del SAT oracle: timeout, interruzione, budget di conflitti esaurito o
 * errore interno del solver. Non rappresenta mai l'insoddisfacibilità della formula,
 * che è un esito normale di {@link SatOracle#solve()}.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
