package org.fm.analysis;

import java.util.List;

/**
 * Esito della validazione di una selezione: flag di validità e diagnostica ordinata,
 * vuota quando la selezione è valida.
 *
 * I nomi sconosciuti al modello sono riportati a parte e non influiscono sulla validità.
 */
public final class ValidationResult {

    private final boolean valid;
    private final List<String> messages;
    private final List<String> ignoredNames;

    private ValidationResult(boolean valid, List<String> messages, List<String> ignoredNames) {
        this.valid = valid;
        this.messages = List.copyOf(messages);
        this.ignoredNames = ignoredNames == null ? List.of() : List.copyOf(ignoredNames);
    }

    public static ValidationResult valid() {
        return valid(List.of());
    }

    /**
     * @param ignoredNames nomi della selezione assenti dal modello
     */
    public static ValidationResult valid(List<String> ignoredNames) {
        return new ValidationResult(true, List.of(), ignoredNames);
    }

    public static ValidationResult invalid(List<String> messages) {
        return invalid(messages, List.of());
    }

    public static ValidationResult invalid(List<String> messages, List<String> ignoredNames) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("Una selezione non valida richiede almeno un messaggio");
        }
        return new ValidationResult(false, messages, ignoredNames);
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getMessages() {
        return messages;
    }

    /**
     * @return nomi scartati perché sconosciuti al modello, in ordine di selezione
     */
    public List<String> getIgnoredNames() {
        return ignoredNames;
    }

    @Override
    public String toString() {
        String ignored = ignoredNames.isEmpty() ? "" : ", ignorati=" + ignoredNames;
        return valid
                ? "ValidationResult{valida" + ignored + "}"
                : "ValidationResult{non valida: " + messages + ignored + "}";
    }
}
