package org.fm.model;

import java.util.Locale;

/**
 * Relazione tra i figli immediati di una feature.
 *
 * NONE indica la composizione AND semplice: ogni figlio è obbligatorio od opzionale
 * secondo il proprio flag. OR e XOR valgono solo per i figli diretti, mai ricorsivamente.
 */
public enum GroupType {
    NONE,   // Composizione AND: figli indipendenti
    OR,     // Almeno un figlio selezionato
    XOR;    // Esattamente un figlio selezionato

    /**
     * Converte l'attributo {@code type} di un elemento {@code group} (case-insensitive).
     * Il valore "and" è accettato come sinonimo di composizione semplice.
     *
     * @param value testo dell'attributo
     * @return tipo di gruppo corrispondente
     * @throws IllegalArgumentException se il valore non è riconosciuto
     */
    public static GroupType fromAttribute(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Tipo di gruppo mancante");
        }

        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "XOR", "ALTERNATIVE" -> XOR;
            case "OR" -> OR;
            case "AND" -> NONE;
            default -> throw new IllegalArgumentException("Tipo di gruppo non supportato: " + value);
        };
    }
}
