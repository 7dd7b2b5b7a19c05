package org.fm.model;

import java.util.Objects;

/**
 * VINCOLO CROSS-TREE - Variante etichettata Requires/Excludes con testo originale
 *
 * Conserva l'enunciato in linguaggio naturale così come compare nel documento, la
 * eventuale traduzione formale e l'esito del parsing esplicito:
 * - REQUIRES: subject → object
 * - EXCLUDES: ¬(subject ∧ object)
 * - UNSUPPORTED: nessuna clausola, motivo leggibile in {@link #getReason()}
 *
 * Creato una sola volta durante il parsing del modello e mai modificato.
 */
public final class CrossTreeConstraint {

    private final String englishStatement;
    private final String translation;
    private final ConstraintType type;
    private final String subject;
    private final String object;
    private final String reason;

    private CrossTreeConstraint(String englishStatement, String translation, ConstraintType type,
                                String subject, String object, String reason) {
        if (englishStatement == null) {
            throw new IllegalArgumentException("englishStatement non può essere null");
        }
        this.englishStatement = englishStatement;
        this.translation = translation;
        this.type = Objects.requireNonNull(type, "type");
        this.subject = subject;
        this.object = object;
        this.reason = reason;
    }

    //region FACTORY METHODS

    /**
     * @return vincolo Requires(subject, object)
     */
    public static CrossTreeConstraint requires(String englishStatement, String translation,
                                               String subject, String object) {
        requireFeatureNames(subject, object);
        return new CrossTreeConstraint(englishStatement, translation, ConstraintType.REQUIRES, subject, object, null);
    }

    /**
     * @return vincolo Excludes(subject, object)
     */
    public static CrossTreeConstraint excludes(String englishStatement, String translation,
                                               String subject, String object) {
        requireFeatureNames(subject, object);
        return new CrossTreeConstraint(englishStatement, translation, ConstraintType.EXCLUDES, subject, object, null);
    }

    /**
     * @param reason motivo leggibile per cui il vincolo non è codificabile
     * @return vincolo non supportato, riportato ma privo di clausole
     */
    public static CrossTreeConstraint unsupported(String englishStatement, String translation, String reason) {
        return new CrossTreeConstraint(englishStatement, translation, ConstraintType.UNSUPPORTED, null, null,
                reason == null ? "vincolo non riconosciuto" : reason);
    }

    private static void requireFeatureNames(String subject, String object) {
        if (subject == null || subject.isBlank() || object == null || object.isBlank()) {
            throw new IllegalArgumentException("Un vincolo supportato richiede due feature: " + subject + ", " + object);
        }
    }

    //endregion

    //region ACCESSORS

    public String getEnglishStatement() {
        return englishStatement;
    }

    /**
     * @return traduzione formale dichiarata nel documento, null se assente
     */
    public String getTranslation() {
        return translation;
    }

    /**
     * @return testo effettivamente sottoposto al parser: la traduzione se presente
     */
    public String getSourceText() {
        return translation != null ? translation : englishStatement;
    }

    public ConstraintType getType() {
        return type;
    }

    public boolean isSupported() {
        return type != ConstraintType.UNSUPPORTED;
    }

    /**
     * @return feature dipendente (A in Requires(A,B)), null se non supportato
     */
    public String getSubject() {
        return subject;
    }

    /**
     * @return feature richiesta o esclusa (B), null se non supportato
     */
    public String getObject() {
        return object;
    }

    /**
     * @return motivo del mancato supporto, null per vincoli supportati
     */
    public String getReason() {
        return reason;
    }

    //endregion

    /**
     * Forma compatta: Requires(A, B), Excludes(A, B) oppure Unsupported("testo").
     */
    public String toFormalString() {
        return switch (type) {
            case REQUIRES -> "Requires(" + subject + ", " + object + ")";
            case EXCLUDES -> "Excludes(" + subject + ", " + object + ")";
            case UNSUPPORTED -> "Unsupported(\"" + getSourceText() + "\")";
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        CrossTreeConstraint other = (CrossTreeConstraint) obj;
        return englishStatement.equals(other.englishStatement)
                && Objects.equals(translation, other.translation)
                && type == other.type
                && Objects.equals(subject, other.subject)
                && Objects.equals(object, other.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(englishStatement, translation, type, subject, object);
    }

    @Override
    public String toString() {
        return toFormalString() + " <- \"" + englishStatement + "\"";
    }
}
