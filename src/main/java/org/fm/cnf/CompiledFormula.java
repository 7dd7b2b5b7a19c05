package org.fm.cnf;

import org.fm.model.CrossTreeConstraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * FORMULA COMPILATA - Clausole CNF numeriche con rule log parallelo
 *
 * Risultato immutabile di una sessione di compilazione del feature model:
 * - clausole in formato DIMACS (positivo = feature selezionata, negativo = esclusa)
 * - rule log leggibile, una regola per ogni clausola e nello stesso ordine
 * - registro delle variabili usato per produrre gli ID
 * - vincoli cross-tree non codificati, riportati invece che scartati in silenzio
 *
 * INVARIANTI VERIFICATE ALLA COSTRUZIONE:
 * - clausole.size() == regole.size()
 * - ogni letterale è diverso da 0 e referenzia una variabile registrata
 */
public final class CompiledFormula {

    private static final Logger LOGGER = Logger.getLogger(CompiledFormula.class.getName());

    private final List<List<Integer>> clauses;
    private final List<String> rules;
    private final VariableRegistry registry;
    private final List<CrossTreeConstraint> unsupportedConstraints;

    CompiledFormula(List<List<Integer>> clauses, List<String> rules, VariableRegistry registry,
                    List<CrossTreeConstraint> unsupportedConstraints) {
        List<List<Integer>> frozen = new ArrayList<>(clauses.size());
        for (List<Integer> clause : clauses) {
            frozen.add(List.copyOf(clause));
        }

        this.clauses = Collections.unmodifiableList(frozen);
        this.rules = List.copyOf(rules);
        this.registry = registry;
        this.unsupportedConstraints = List.copyOf(unsupportedConstraints);

        validateIntegrity();
        logStatistics();
    }

    //region VALIDAZIONE E INTEGRITÀ

    private void validateIntegrity() {
        if (clauses.size() != rules.size()) {
            throw new IllegalStateException("Rule log non allineato: clausole=" + clauses.size() +
                    ", regole=" + rules.size());
        }

        int variableCount = registry.size();
        for (int clauseIndex = 0; clauseIndex < clauses.size(); clauseIndex++) {
            for (Integer literal : clauses.get(clauseIndex)) {
                if (literal == null || literal == 0 || Math.abs(literal) > variableCount) {
                    throw new IllegalStateException("Letterale non valido in clausola " + clauseIndex +
                            ": " + literal + " (variabili=" + variableCount + ")");
                }
            }
        }
    }

    private void logStatistics() {
        LOGGER.fine(String.format("Formula compilata: %d clausole, %d variabili, %d vincoli non supportati",
                clauses.size(), registry.size(), unsupportedConstraints.size()));

        if (LOGGER.isLoggable(Level.FINEST)) {
            Map<Integer, Long> lengthDistribution = clauses.stream()
                    .collect(Collectors.groupingBy(List::size, Collectors.counting()));
            LOGGER.finest("Distribuzione lunghezza clausole: " + lengthDistribution);
            LOGGER.finest("Mapping completo variabili: " + registry.asMap());
        }
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return clausole immutabili in ordine di emissione
     */
    public List<List<Integer>> getClauses() {
        return clauses;
    }

    /**
     * @return regole leggibili, una per clausola
     */
    public List<String> getRules() {
        return rules;
    }

    public VariableRegistry getRegistry() {
        return registry;
    }

    public int getVariableCount() {
        return registry.size();
    }

    public int getClauseCount() {
        return clauses.size();
    }

    /**
     * @return vincoli cross-tree presenti nel modello ma privi di clausola
     */
    public List<CrossTreeConstraint> getUnsupportedConstraints() {
        return unsupportedConstraints;
    }

    /**
     * Esporta la formula in formato DIMACS CNF. Le righe di commento iniziali riportano
     * il mapping ID → nome feature.
     */
    public String toDimacs() {
        StringBuilder out = new StringBuilder();
        for (int id = 1; id <= registry.size(); id++) {
            out.append("c ").append(id).append(' ').append(registry.nameOf(id)).append('\n');
        }
        out.append("p cnf ").append(registry.size()).append(' ').append(clauses.size()).append('\n');

        for (List<Integer> clause : clauses) {
            for (Integer literal : clause) {
                out.append(literal).append(' ');
            }
            out.append("0\n");
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return String.format("CompiledFormula{clausole=%d, variabili=%d, non_supportati=%d}",
                clauses.size(), registry.size(), unsupportedConstraints.size());
    }

    //endregion
}
