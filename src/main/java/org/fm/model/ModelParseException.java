package org.fm.model;

/**
 * Documento del modello malformato o incompleto. Nessun albero parziale sopravvive.
 */
public class ModelParseException extends RuntimeException {

    public ModelParseException(String message) {
        super(message);
    }

    public ModelParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
