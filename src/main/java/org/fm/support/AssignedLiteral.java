package org.fm.support;

import java.util.List;
import java.util.Objects;

/**
 * LETTERALE ASSEGNATO - Variabile assegnata dal solver con la sua origine
 *
 * Una voce del trail del solver CDCL: la variabile, il valore e, per le implicazioni,
 * la clausola che l'ha resa unitaria (reason). Le decisioni non hanno reason.
 * La reason è indispensabile all'analisi dei conflitti, che risale il trail
 * sostituendo ogni letterale implicato con la clausola che lo ha prodotto.
 */
public final class AssignedLiteral {

    private final int variable;
    private final boolean value;
    private final List<Integer> reason;

    private AssignedLiteral(int variable, boolean value, List<Integer> reason) {
        if (variable <= 0) {
            throw new IllegalArgumentException("ID variabile deve essere > 0, ricevuto: " + variable);
        }
        this.variable = variable;
        this.value = value;
        this.reason = reason;
    }

    /**
     * @return decisione euristica, priva di clausola causante
     */
    public static AssignedLiteral decision(int variable, boolean value) {
        return new AssignedLiteral(variable, value, null);
    }

    /**
     * @param reason clausola unitaria che forza l'assegnamento (non vuota)
     * @return implicazione da unit propagation
     */
    public static AssignedLiteral implication(int variable, boolean value, List<Integer> reason) {
        if (reason == null || reason.isEmpty()) {
            throw new IllegalArgumentException("Le implicazioni richiedono una clausola causante non vuota");
        }
        int literal = value ? variable : -variable;
        if (!reason.contains(literal)) {
            throw new IllegalArgumentException("La clausola " + reason + " non contiene il letterale implicato " + literal);
        }
        return new AssignedLiteral(variable, value, List.copyOf(reason));
    }

    public int getVariable() {
        return variable;
    }

    public boolean getValue() {
        return value;
    }

    public boolean isDecision() {
        return reason == null;
    }

    /**
     * @return clausola causante, null per le decisioni
     */
    public List<Integer> getReason() {
        return reason;
    }

    /**
     * @return ID positivo se la variabile è vera, negativo se falsa
     */
    public int toDIMACSLiteral() {
        return value ? variable : -variable;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AssignedLiteral)) return false;
        AssignedLiteral other = (AssignedLiteral) obj;
        return variable == other.variable && value == other.value && isDecision() == other.isDecision();
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, value, isDecision());
    }

    @Override
    public String toString() {
        return isDecision()
                ? "D(" + toDIMACSLiteral() + ")"
                : "I(" + toDIMACSLiteral() + " ← " + reason + ")";
    }
}
