package org.fm.analysis;

import org.fm.cnf.CNFCompiler;
import org.fm.cnf.CompiledFormula;
import org.fm.cnf.VariableRegistry;
import org.fm.model.Feature;
import org.fm.model.FeatureModel;
import org.fm.oracle.SatOracle;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * ENUMERATORE DEI PRODOTTI MINIMI VALIDI - Ciclo solve/blocco sull'oracle
 *
 * ALGORITMO:
 * 1. Compila il modello e carica le clausole in un oracle nuovo
 * 2. Finché l'oracle trova un modello:
 *    - candidato = nomi delle variabili vere (in ordine di ID)
 *    - clausola di blocco = negazione di ogni variabile vera
 * 3. Filtro di minimalità sui candidati accettati
 *
 * La clausola di blocco esclude ogni assegnamento il cui insieme di variabili vere
 * contiene quello appena trovato, sovrainsiemi compresi, quindi il ciclo termina.
 * Un prodotto minimo non viene mai bloccato: lo escluderebbe solo una soluzione
 * strettamente contenuta in esso, che ne contraddirebbe la minimalità. Il numero di soluzioni può però crescere in modo
 * esponenziale con le scelte indipendenti: i limiti di {@link EnumerationLimits}
 * fermano il ciclo e marcano il risultato come troncato. Il limite sul numero è
 * esatto, il troncamento è segnalato solo se esiste davvero un'altra soluzione.
 */
public class MVPEnumerator {

    private static final Logger LOGGER = Logger.getLogger(MVPEnumerator.class.getName());

    static final String REASON_MAX_SOLUTIONS = "raggiunto il limite di soluzioni";
    static final String REASON_TIMEOUT = "raggiunto il limite di tempo";

    private final CNFCompiler compiler;
    private final Supplier<SatOracle> oracleFactory;
    private final EnumerationLimits limits;

    public MVPEnumerator(Supplier<SatOracle> oracleFactory, EnumerationLimits limits) {
        this(new CNFCompiler(), oracleFactory, limits);
    }

    /**
     * @param oracleFactory produce un oracle nuovo per ogni enumerazione
     */
    public MVPEnumerator(CNFCompiler compiler, Supplier<SatOracle> oracleFactory, EnumerationLimits limits) {
        if (compiler == null || oracleFactory == null || limits == null) {
            throw new IllegalArgumentException("Compilatore, factory dell'oracle e limiti sono obbligatori");
        }
        this.compiler = compiler;
        this.oracleFactory = oracleFactory;
        this.limits = limits;
    }

    /**
     * Compila il modello da zero ed enumera i prodotti minimi.
     */
    public EnumerationResult enumerate(FeatureModel model) {
        return enumerate(model, compiler.compile(model));
    }

    /**
     * @param formula compilazione di {@code model} da cui leggere clausole e registro
     */
    public EnumerationResult enumerate(FeatureModel model, CompiledFormula formula) {
        long start = System.nanoTime();
        VariableRegistry registry = formula.getRegistry();

        List<Set<String>> candidates = new ArrayList<>();
        int solutionsSeen = 0;
        String truncationReason = null;

        try (SatOracle oracle = oracleFactory.get()) {
            formula.getClauses().forEach(oracle::addClause);

            while (true) {
                if (limits.hasTimeout() && System.nanoTime() - start > limits.getTimeout().toNanos()) {
                    truncationReason = REASON_TIMEOUT;
                    break;
                }
                if (!oracle.solve()) {
                    break;
                }
                if (solutionsSeen >= limits.getMaxSolutions()) {
                    truncationReason = REASON_MAX_SOLUTIONS;
                    break;
                }
                solutionsSeen++;

                Set<String> candidate = new LinkedHashSet<>();
                List<Integer> blocking = new ArrayList<>();
                for (int literal : oracle.getModel()) {
                    if (literal > 0) {
                        candidate.add(registry.nameOf(literal));
                        blocking.add(-literal);
                    }
                }

                assert isMandatoryComplete(model, candidate) : "Prodotto privo di una feature obbligatoria: " + candidate;
                candidates.add(candidate);
                LOGGER.finest("Soluzione " + solutionsSeen + ": " + candidate);

                // L'assegnamento tutto falso non ha letterali da bloccare
                if (blocking.isEmpty()) {
                    break;
                }
                oracle.addClause(blocking);
            }
        }

        MinimalityFilter filter = new MinimalityFilter();
        List<Set<String>> products = filter.filter(candidates);
        LOGGER.finest(filter::getFilterLog);

        boolean truncated = truncationReason != null;
        if (truncated) {
            LOGGER.warning(String.format("Enumerazione troncata dopo %d soluzioni: %s", solutionsSeen, truncationReason));
        }
        LOGGER.info(String.format("Enumerazione completata: %d soluzioni, %d prodotti minimi%s",
                solutionsSeen, products.size(), truncated ? " (troncata)" : ""));

        return new EnumerationResult(products, solutionsSeen, candidates.size(), truncated, truncationReason);
    }

    /**
     * Ogni feature selezionata ha selezionate anche tutte le figlie obbligatorie.
     * Le clausole lo garantiscono già: il controllo intercetta errori di codifica.
     */
    static boolean isMandatoryComplete(FeatureModel model, Set<String> selection) {
        for (String name : selection) {
            Feature feature = model.getFeature(name);
            if (feature == null) {
                continue;
            }
            for (Feature child : feature.getChildren()) {
                if (child.isMandatory() && !selection.contains(child.getName())) {
                    return false;
                }
            }
        }
        return true;
    }
}
