package org.fm.oracle;

import org.fm.support.AssignedLiteral;
import org.fm.support.DecisionStack;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ORACLE CDCL - Solver incrementale con apprendimento guidato dai conflitti
 *
 * CICLO DI RICERCA (per ogni solve):
 * 1. Unit propagation fino al punto fisso
 * 2. Conflitto al livello 0 → UNSAT; altrimenti analisi 1-UIP, clausola appresa,
 *    backjump non cronologico e asserzione del letterale UIP negato
 * 3. Nessun conflitto → decisione sulla variabile libera con attività più alta
 *    (a parità, ID più basso) con polarità negativa
 * 4. Nessuna variabile libera → SAT, il trail è il modello
 *
 * La polarità negativa fa trovare per prime le selezioni con meno feature, utile
 * per l'enumerazione dei prodotti minimi. Le clausole apprese sono conseguenze logiche
 * delle clausole della sessione e restano valide tra una solve e l'altra, perché le
 * clausole possono solo aumentare.
 *
 * LIMITI:
 * • budget di conflitti per singola solve, oltre il quale si lancia {@link OracleException}
 * • l'interruzione del thread chiamante interrompe la ricerca con {@link OracleException}
 */
public class CDCLOracle implements SatOracle {

    private static final Logger LOGGER = Logger.getLogger(CDCLOracle.class.getName());

    public static final int DEFAULT_CONFLICT_BUDGET = 1_000_000;

    private static final double ACTIVITY_DECAY = 0.95;
    private static final double RESCALE_LIMIT = 1e100;

    //region STATO DELLA SESSIONE

    private final int conflictBudget;
    private final List<List<Integer>> clauses = new ArrayList<>();
    private final List<List<Integer>> learnedClauses = new ArrayList<>();
    private final SolverStatistics statistics = new SolverStatistics();
    private final DecisionStack decisionStack = new DecisionStack();

    private int variableCount = 0;

    /** Valore per variabile: 0 libera, 1 vera, -1 falsa (indice 0 inutilizzato) */
    private int[] values = new int[1];

    /** Livello di decisione a cui la variabile è stata assegnata */
    private int[] levels = new int[1];

    /** Attività VSIDS: cresce per le variabili coinvolte nei conflitti */
    private double[] activity = new double[1];
    private double activityIncrement = 1.0;

    /** True dopo la clausola vuota o una solve UNSAT: le clausole non possono più tornare SAT */
    private boolean contradiction = false;

    private List<Integer> model = null;
    private boolean closed = false;

    //endregion

    public CDCLOracle() {
        this(DEFAULT_CONFLICT_BUDGET);
    }

    /**
     * @param conflictBudget numero massimo di conflitti per singola solve (> 0)
     */
    public CDCLOracle(int conflictBudget) {
        if (conflictBudget <= 0) {
            throw new IllegalArgumentException("Budget di conflitti deve essere > 0: " + conflictBudget);
        }
        this.conflictBudget = conflictBudget;
    }

    //region INTERFACCIA SatOracle

    @Override
    public void addClause(List<Integer> clause) {
        ensureOpen();
        if (clause == null) {
            throw new IllegalArgumentException("Clausola non può essere null");
        }

        Set<Integer> literals = new LinkedHashSet<>();
        boolean tautology = false;
        for (Integer literal : clause) {
            if (literal == null || literal == 0) {
                throw new IllegalArgumentException("Letterale non valido nella clausola " + clause);
            }
            growTo(Math.abs(literal));
            tautology |= literals.contains(-literal);
            literals.add(literal);
        }

        if (tautology) {
            LOGGER.finest("Clausola tautologica ignorata: " + clause);
            return;
        }
        if (literals.isEmpty()) {
            LOGGER.fine("Clausola vuota aggiunta: formula insoddisfacibile");
            contradiction = true;
            return;
        }
        clauses.add(List.copyOf(literals));
    }

    @Override
    public boolean solve() {
        ensureOpen();
        statistics.incrementSolves();
        long start = System.currentTimeMillis();
        model = null;

        try {
            if (contradiction) {
                return false;
            }
            boolean satisfiable = search();
            if (!satisfiable) {
                contradiction = true;
            }
            LOGGER.finest(() -> "Solve #" + statistics.getSolves() + ": " + (model != null ? "SAT" : "UNSAT"));
            return satisfiable;
        } finally {
            statistics.addSolveTime(System.currentTimeMillis() - start);
        }
    }

    @Override
    public List<Integer> getModel() {
        if (model == null) {
            throw new IllegalStateException("Nessun modello disponibile: l'ultima solve non è stata SAT");
        }
        return model;
    }

    @Override
    public int getVariableCount() {
        return variableCount;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            LOGGER.fine("Oracle CDCL chiuso: " + statistics);
            clauses.clear();
            learnedClauses.clear();
            model = null;
        }
    }

    public SolverStatistics getStatistics() {
        return statistics;
    }

    public int getLearnedClauseCount() {
        return learnedClauses.size();
    }

    //endregion

    //region RICERCA

    private boolean search() {
        for (AssignedLiteral removed : decisionStack.clear()) {
            values[removed.getVariable()] = 0;
        }

        int conflicts = 0;
        while (true) {
            checkInterruption();

            List<Integer> conflict = propagate();
            if (conflict != null) {
                statistics.incrementConflicts();
                if (++conflicts > conflictBudget) {
                    throw new OracleException("Budget di " + conflictBudget + " conflitti esaurito");
                }
                if (decisionStack.getLevel() == 0) {
                    return false;
                }
                learnFromConflict(conflict);
                continue;
            }

            int variable = pickBranchVariable();
            if (variable == 0) {
                model = buildModel();
                return true;
            }

            statistics.incrementDecisions();
            int level = decisionStack.addDecision(variable, false);
            values[variable] = -1;
            levels[variable] = level;
        }
    }

    /**
     * Unit propagation su clausole originali e apprese.
     *
     * @return clausola falsificata, null se il punto fisso è raggiunto senza conflitti
     */
    private List<Integer> propagate() {
        boolean progress;
        do {
            progress = false;
            for (List<List<Integer>> source : List.of(clauses, learnedClauses)) {
                for (List<Integer> clause : source) {
                    int unassigned = 0;
                    int unitLiteral = 0;
                    boolean satisfied = false;

                    for (int literal : clause) {
                        int value = literalValue(literal);
                        if (value > 0) {
                            satisfied = true;
                            break;
                        }
                        if (value == 0) {
                            unassigned++;
                            unitLiteral = literal;
                        }
                    }

                    if (satisfied) {
                        continue;
                    }
                    if (unassigned == 0) {
                        return clause;
                    }
                    if (unassigned == 1) {
                        imply(unitLiteral, clause);
                        progress = true;
                    }
                }
            }
        } while (progress);

        return null;
    }

    private void imply(int literal, List<Integer> reason) {
        int variable = Math.abs(literal);
        boolean value = literal > 0;

        values[variable] = value ? 1 : -1;
        levels[variable] = decisionStack.getLevel();
        decisionStack.addImpliedLiteral(variable, value, reason);
        statistics.incrementPropagations();
    }

    private int literalValue(int literal) {
        int value = values[Math.abs(literal)];
        return literal > 0 ? value : -value;
    }

    //endregion

    //region ANALISI DEI CONFLITTI

    /**
     * Analisi 1-UIP: risolve la clausola di conflitto con le reason del livello corrente,
     * risalendo il trail, finché resta un solo letterale di quel livello.
     */
    private void learnFromConflict(List<Integer> conflict) {
        int currentLevel = decisionStack.getLevel();
        List<AssignedLiteral> trail = decisionStack.getTopLevel();

        Set<Integer> seen = new HashSet<>();
        List<Integer> learned = new ArrayList<>();
        learned.add(0);                                 // Posto del letterale asserito

        List<Integer> reason = conflict;
        int index = trail.size() - 1;
        int pending = 0;
        AssignedLiteral pivot;

        while (true) {
            for (int literal : reason) {
                int variable = Math.abs(literal);
                if (levels[variable] == 0 || !seen.add(variable)) {
                    continue;
                }
                bumpActivity(variable);
                if (levels[variable] == currentLevel) {
                    pending++;
                } else {
                    learned.add(literal);
                }
            }

            if (pending == 0) {
                throw new IllegalStateException("Conflitto privo di letterali al livello " + currentLevel + ": " + conflict);
            }
            while (!seen.contains(trail.get(index).getVariable())) {
                index--;
            }
            pivot = trail.get(index--);
            if (--pending == 0) {
                break;
            }
            reason = pivot.getReason();
        }

        learned.set(0, -pivot.toDIMACSLiteral());

        int backjumpLevel = 0;
        for (int i = 1; i < learned.size(); i++) {
            backjumpLevel = Math.max(backjumpLevel, levels[Math.abs(learned.get(i))]);
        }

        for (AssignedLiteral removed : decisionStack.backtrackToLevel(backjumpLevel)) {
            values[removed.getVariable()] = 0;
        }
        statistics.incrementBackjumps();

        List<Integer> clause = List.copyOf(learned);
        learnedClauses.add(clause);
        statistics.incrementLearnedClauses();
        LOGGER.finest(() -> "Clausola appresa " + clause + ", backjump " + currentLevel + " → " + decisionStack.getLevel());

        imply(clause.get(0), clause);
        activityIncrement /= ACTIVITY_DECAY;
    }

    //endregion

    //region EURISTICA DI DECISIONE

    /**
     * @return variabile libera con attività massima, 0 se tutte assegnate
     */
    private int pickBranchVariable() {
        int best = 0;
        for (int variable = 1; variable <= variableCount; variable++) {
            if (values[variable] == 0 && (best == 0 || activity[variable] > activity[best])) {
                best = variable;
            }
        }
        return best;
    }

    private void bumpActivity(int variable) {
        activity[variable] += activityIncrement;
        if (activity[variable] > RESCALE_LIMIT) {
            for (int i = 1; i <= variableCount; i++) {
                activity[i] /= RESCALE_LIMIT;
            }
            activityIncrement /= RESCALE_LIMIT;
        }
    }

    //endregion

    //region SUPPORTO

    private List<Integer> buildModel() {
        List<Integer> assignment = new ArrayList<>(variableCount);
        for (int variable = 1; variable <= variableCount; variable++) {
            assignment.add(values[variable] > 0 ? variable : -variable);
        }
        return List.copyOf(assignment);
    }

    private void growTo(int variable) {
        if (variable > variableCount) {
            variableCount = variable;
            values = Arrays.copyOf(values, variable + 1);
            levels = Arrays.copyOf(levels, variable + 1);
            activity = Arrays.copyOf(activity, variable + 1);
        }
    }

    private void checkInterruption() {
        if (Thread.currentThread().isInterrupted()) {
            throw new OracleException("Solver CDCL interrotto");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Oracle già chiuso");
        }
    }

    //endregion
}
