package org.fm.constraint;

/**
 * Vincolo cross-tree il cui testo non corrisponde alla grammatica dei vincoli o che
 * nomina feature assenti dal modello.
 *
 * In modalità normale il parser lo converte in un vincolo UNSUPPORTED riportato
 * all'utente; in modalità strict il compilatore CNF lo propaga al chiamante.
 */
public class UnsupportedConstraintException extends RuntimeException {

    /** Testo che ha causato il rifiuto */
    private final String constraintText;

    public UnsupportedConstraintException(String constraintText, String message) {
        super(message);
        this.constraintText = constraintText;
    }

    public String getConstraintText() {
        return constraintText;
    }
}
