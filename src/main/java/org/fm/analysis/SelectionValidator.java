package org.fm.analysis;

import org.fm.cnf.CNFCompiler;
import org.fm.cnf.CompiledFormula;
import org.fm.model.FeatureModel;
import org.fm.oracle.SatOracle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * VALIDATORE DI SELEZIONI - Verifica di coerenza tramite oracle e diagnostica strutturale
 *
 * ALGORITMO:
 * 1. Compila il modello da zero
 * 2. Fissa ogni feature del modello con una clausola unitaria: positiva se selezionata,
 *    negativa altrimenti
 * 3. SAT → selezione valida, nessun messaggio
 * 4. UNSAT → messaggi di {@link ViolationDiagnostics}; se la visita non trova nulla,
 *    un messaggio generico
 *
 * I nomi sconosciuti al modello non entrano nella formula: sono segnalati con un
 * warning e riportati in {@link ValidationResult#getIgnoredNames()}, senza influire
 * sulla validità.
 */
public class SelectionValidator {

    private static final Logger LOGGER = Logger.getLogger(SelectionValidator.class.getName());

    static final String GENERIC_VIOLATION = "Selection violates the model constraints";

    private final CNFCompiler compiler;
    private final Supplier<SatOracle> oracleFactory;
    private final ViolationDiagnostics diagnostics = new ViolationDiagnostics();

    public SelectionValidator(Supplier<SatOracle> oracleFactory) {
        this(new CNFCompiler(), oracleFactory);
    }

    public SelectionValidator(CNFCompiler compiler, Supplier<SatOracle> oracleFactory) {
        if (compiler == null || oracleFactory == null) {
            throw new IllegalArgumentException("Compilatore e factory dell'oracle sono obbligatori");
        }
        this.compiler = compiler;
        this.oracleFactory = oracleFactory;
    }

    /**
     * @param model modello di riferimento
     * @param selection feature da considerare selezionate, tutte le altre sono escluse
     * @return validità e messaggi diagnostici ordinati
     */
    public ValidationResult validate(FeatureModel model, Collection<String> selection) {
        if (model == null || selection == null) {
            throw new IllegalArgumentException("Modello e selezione non possono essere null");
        }

        Set<String> selected = new LinkedHashSet<>();
        List<String> ignored = new ArrayList<>();
        for (String name : selection) {
            String trimmed = name == null ? "" : name.trim();
            if (model.contains(trimmed)) {
                selected.add(trimmed);
            } else {
                ignored.add(trimmed);
            }
        }
        if (!ignored.isEmpty()) {
            LOGGER.warning("Feature sconosciute ignorate nella selezione: " + ignored);
        }

        if (isConsistent(model, selected)) {
            LOGGER.fine(() -> "Selezione " + selected + " valida");
            return ValidationResult.valid(ignored);
        }

        List<String> explanations = diagnostics.diagnose(model, selected);
        List<String> messages = explanations.isEmpty() ? List.of(GENERIC_VIOLATION) : explanations;
        LOGGER.fine(() -> "Selezione " + selected + " non valida: " + messages);
        return ValidationResult.invalid(messages, ignored);
    }

    private boolean isConsistent(FeatureModel model, Set<String> selected) {
        CompiledFormula formula = compiler.compile(model);

        try (SatOracle oracle = oracleFactory.get()) {
            formula.getClauses().forEach(oracle::addClause);
            for (String name : model.getFeatureNames()) {
                int id = formula.getRegistry().idOf(name);
                oracle.addClause(List.of(selected.contains(name) ? id : -id));
            }
            return oracle.solve();
        }
    }
}
