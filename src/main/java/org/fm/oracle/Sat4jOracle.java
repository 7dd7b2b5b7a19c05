package org.fm.oracle;

import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adapter del solver MiniSat-style di Sat4j sull'interfaccia {@link SatOracle}.
 *
 * Sat4j segnala le clausole contraddittorie già in fase di aggiunta con
 * {@link ContradictionException}: da quel momento ogni solve restituisce false.
 * Il timeout di Sat4j vale per singola solve ed è riportato come {@link OracleException}.
 */
public class Sat4jOracle implements SatOracle {

    private static final Logger LOGGER = Logger.getLogger(Sat4jOracle.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final ISolver solver;
    private int variableCount = 0;
    private boolean contradiction = false;
    private List<Integer> model = null;
    private boolean closed = false;

    public Sat4jOracle() {
        this(DEFAULT_TIMEOUT);
    }

    /**
     * @param timeout limite per singola solve, arrotondato al secondo (minimo 1)
     */
    public Sat4jOracle(Duration timeout) {
        Duration effective = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.solver = SolverFactory.newDefault();
        this.solver.setTimeout((int) Math.max(1, Math.min(Integer.MAX_VALUE, effective.toSeconds())));
    }

    @Override
    public void addClause(List<Integer> clause) {
        ensureOpen();
        if (clause == null) {
            throw new IllegalArgumentException("Clausola non può essere null");
        }

        int[] literals = new int[clause.size()];
        for (int i = 0; i < literals.length; i++) {
            Integer literal = clause.get(i);
            if (literal == null || literal == 0) {
                throw new IllegalArgumentException("Letterale non valido nella clausola " + clause);
            }
            literals[i] = literal;
            variableCount = Math.max(variableCount, Math.abs(literal));
        }
        solver.newVar(variableCount);

        if (contradiction) {
            return;
        }
        if (literals.length == 0) {
            contradiction = true;
            return;
        }

        try {
            solver.addClause(new VecInt(literals));
        } catch (ContradictionException e) {
            LOGGER.fine("Clausola contraddittoria per Sat4j: " + clause + " (" + e.getMessage() + ")");
            contradiction = true;
        }
    }

    @Override
    public boolean solve() {
        ensureOpen();
        model = null;
        if (contradiction) {
            return false;
        }

        try {
            if (!solver.isSatisfiable()) {
                return false;
            }
        } catch (TimeoutException e) {
            LOGGER.log(Level.WARNING, "Timeout di Sat4j dopo " + solver.getTimeout() + "s", e);
            throw new OracleException("Sat4j non ha deciso entro il timeout", e);
        }

        boolean[] truth = new boolean[variableCount + 1];
        for (int literal : solver.model()) {
            if (Math.abs(literal) <= variableCount) {
                truth[Math.abs(literal)] = literal > 0;
            }
        }
        List<Integer> assignment = new ArrayList<>(variableCount);
        for (int variable = 1; variable <= variableCount; variable++) {
            assignment.add(truth[variable] ? variable : -variable);
        }
        model = List.copyOf(assignment);
        return true;
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
            solver.reset();
            model = null;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Oracle già chiuso");
        }
    }
}
