package org.fm.oracle;

/**
 * STATISTICHE SOLVER - Contatori cumulativi di una sessione dell'oracle CDCL
 *
 * I contatori si accumulano su tutte le solve della sessione: durante un'enumerazione
 * misurano il costo complessivo del ciclo solve/blocco.
 */
public class SolverStatistics {

    //region CONTATORI

    private int solves = 0;
    private int decisions = 0;
    private int propagations = 0;
    private int conflicts = 0;
    private int learnedClauses = 0;
    private int backjumps = 0;

    /** Tempo speso dentro solve(), in millisecondi */
    private long solveTimeMs = 0;

    //endregion

    //region INCREMENTI

    void incrementSolves() {
        solves++;
    }

    void incrementDecisions() {
        decisions++;
    }

    void incrementPropagations() {
        propagations++;
    }

    void incrementConflicts() {
        conflicts++;
    }

    void incrementLearnedClauses() {
        learnedClauses++;
    }

    void incrementBackjumps() {
        backjumps++;
    }

    void addSolveTime(long elapsedMs) {
        solveTimeMs += elapsedMs;
    }

    //endregion

    //region LETTURA

    public int getSolves() {
        return solves;
    }

    public int getDecisions() {
        return decisions;
    }

    public int getPropagations() {
        return propagations;
    }

    public int getConflicts() {
        return conflicts;
    }

    public int getLearnedClauses() {
        return learnedClauses;
    }

    public int getBackjumps() {
        return backjumps;
    }

    public long getSolveTimeMs() {
        return solveTimeMs;
    }

    /**
     * @return conflitti per decisione, 0 se non sono state prese decisioni
     */
    public double getConflictRate() {
        return decisions > 0 ? (double) conflicts / decisions : 0.0;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("SolverStatistics{solve=%d, decisioni=%d, propagazioni=%d, conflitti=%d, " +
                        "apprese=%d, backjump=%d, tempo=%dms}",
                solves, decisions, propagations, conflicts, learnedClauses, backjumps, solveTimeMs);
    }
}
