package org.fm.model;

/**
 * Tipo di un vincolo cross-tree dopo il parsing esplicito del testo.
 */
public enum ConstraintType {
    REQUIRES,       // Requires(A, B): A → B
    EXCLUDES,       // Excludes(A, B): ¬(A ∧ B)
    UNSUPPORTED     // Testo non riconosciuto o feature sconosciute: segnalato, nessuna clausola
}
