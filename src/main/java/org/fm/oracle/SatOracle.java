package org.fm.oracle;

import java.util.List;

/**
 * SAT ORACLE - Solver incrementale visto come collaboratore opaco
 *
 * Le clausole si accumulano tra una chiamata e l'altra all'interno della stessa
 * sessione; un'istanza appartiene a una sola sessione di enumerazione o validazione
 * e non va condivisa tra thread.
 *
 * PROTOCOLLO:
 * 1. {@link #addClause(List)} per ogni clausola (letterali DIMACS, mai 0)
 * 2. {@link #solve()}
 * 3. {@link #getModel()} solo se l'ultima solve ha restituito true
 * 4. eventuali nuove clausole e nuove solve
 * 5. {@link #close()}
 */
public interface SatOracle extends AutoCloseable {

    /**
     * Aggiunge una clausola alla sessione. La clausola vuota rende la formula
     * insoddisfacibile per sempre.
     *
     * @param clause letterali con segno, diversi da 0
     * @throws IllegalArgumentException se un letterale è null o 0
     */
    void addClause(List<Integer> clause);

    /**
     * @return true se le clausole accumulate sono soddisfacibili
     * @throws OracleException se il solver non riesce a decidere
     */
    boolean solve();

    /**
     * Assegnamento completo trovato dall'ultima {@link #solve()} riuscita: un letterale
     * per ogni variabile 1..n, in ordine di ID (positivo = vera).
     *
     * @throws IllegalStateException se l'ultima solve non ha trovato un modello
     */
    List<Integer> getModel();

    /**
     * @return numero di variabili note all'oracle (massimo ID visto)
     */
    int getVariableCount();

    /**
     * Rilascia le risorse del solver; l'oracle non è più utilizzabile.
     */
    @Override
    void close();
}
