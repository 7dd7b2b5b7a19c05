package org.fm.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DECISION STACK - Trail del solver organizzato per livelli di decisione
 *
 * ORGANIZZAZIONE:
 * • livello 0: implicazioni che non dipendono da alcuna decisione (mai rimosso)
 * • livello i > 0: la i-esima decisione seguita dalle implicazioni che ha prodotto
 * • dentro ogni livello gli assegnamenti sono in ordine cronologico
 *
 * L'analisi dei conflitti percorre il livello corrente all'indietro; il backjump
 * rimuove in blocco i livelli superiori al target restituendo gli assegnamenti da
 * annullare.
 */
public class DecisionStack {

    private static final Logger LOGGER = Logger.getLogger(DecisionStack.class.getName());

    private final List<List<AssignedLiteral>> levels = new ArrayList<>();

    public DecisionStack() {
        levels.add(new ArrayList<>());
    }

    //region AGGIUNTA

    /**
     * Apre un nuovo livello con la decisione come primo elemento.
     *
     * @return livello appena creato
     */
    public int addDecision(int variable, boolean value) {
        List<AssignedLiteral> level = new ArrayList<>();
        level.add(AssignedLiteral.decision(variable, value));
        levels.add(level);

        LOGGER.finest(() -> String.format("Decisione %d=%s al livello %d", variable, value, getLevel()));
        return getLevel();
    }

    /**
     * Registra un'implicazione al livello corrente.
     *
     * @param reason clausola unitaria causante
     */
    public void addImpliedLiteral(int variable, boolean value, List<Integer> reason) {
        AssignedLiteral implication = AssignedLiteral.implication(variable, value, reason);
        levels.get(levels.size() - 1).add(implication);

        LOGGER.finest(() -> String.format("Implicazione %s al livello %d", implication, getLevel()));
    }

    //endregion

    //region BACKTRACKING

    /**
     * Backjump non cronologico: elimina tutti i livelli sopra {@code targetLevel}.
     *
     * @param targetLevel livello da conservare (0 ≤ target ≤ livello corrente)
     * @return assegnamenti rimossi, dal più recente al più vecchio
     */
    public List<AssignedLiteral> backtrackToLevel(int targetLevel) {
        int currentLevel = getLevel();
        if (targetLevel < 0 || targetLevel > currentLevel) {
            throw new IllegalArgumentException(
                    String.format("Livello target %d fuori range [0, %d]", targetLevel, currentLevel));
        }

        List<AssignedLiteral> removed = new ArrayList<>();
        while (getLevel() > targetLevel) {
            List<AssignedLiteral> level = levels.remove(levels.size() - 1);
            for (int i = level.size() - 1; i >= 0; i--) {
                removed.add(level.get(i));
            }
        }

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(String.format("Backjump %d → %d, %d assegnamenti annullati",
                    currentLevel, targetLevel, removed.size()));
        }
        return removed;
    }

    /**
     * Svuota il trail, livello 0 incluso, per una nuova ricerca.
     *
     * @return tutti gli assegnamenti rimossi
     */
    public List<AssignedLiteral> clear() {
        List<AssignedLiteral> removed = backtrackToLevel(0);
        List<AssignedLiteral> rootLevel = levels.get(0);
        for (int i = rootLevel.size() - 1; i >= 0; i--) {
            removed.add(rootLevel.get(i));
        }
        rootLevel.clear();
        return removed;
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @return livello corrente, 0 se non è stata presa alcuna decisione
     */
    public int getLevel() {
        return levels.size() - 1;
    }

    /**
     * @return vista immutabile degli assegnamenti del livello corrente in ordine cronologico
     */
    public List<AssignedLiteral> getTopLevel() {
        return Collections.unmodifiableList(levels.get(levels.size() - 1));
    }

    public List<AssignedLiteral> getAssignmentsAtLevel(int level) {
        if (level < 0 || level >= levels.size()) {
            throw new IndexOutOfBoundsException("Livello " + level + " fuori range [0, " + levels.size() + ")");
        }
        return Collections.unmodifiableList(levels.get(level));
    }

    public int getTotalAssignments() {
        return levels.stream().mapToInt(List::size).sum();
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder("DecisionStack{");
        for (int i = 0; i < levels.size(); i++) {
            if (i > 0) out.append(" | ");
            out.append(i).append(": ").append(levels.get(i));
        }
        return out.append('}').toString();
    }
}
