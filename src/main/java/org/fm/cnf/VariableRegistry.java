package org.fm.cnf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * REGISTRO VARIABILI - Mapping bidirezionale nome feature ↔ ID variabile SAT
 *
 * Gli ID sono assegnati in modo lazy al primo riferimento, progressivi a partire da 1
 * nell'ordine di prima occorrenza. Il registro appartiene a una sola sessione di
 * compilazione: gli ID hanno senso solo insieme alle clausole prodotte con esso.
 *
 * INVARIANTI:
 * - ogni nome ha un ID univoco ≥ 1
 * - gli ID formano l'intervallo contiguo 1..size()
 * - il mapping inverso è sempre coerente con quello diretto
 */
public class VariableRegistry {

    private static final Logger LOGGER = Logger.getLogger(VariableRegistry.class.getName());

    /** Nome → ID, in ordine di registrazione */
    private final Map<String, Integer> variableMapping = new LinkedHashMap<>();

    /** ID → nome; l'indice 0 corrisponde all'ID 1 */
    private final List<String> reverseMapping = new ArrayList<>();

    /**
     * Restituisce l'ID della variabile, creandolo se il nome non è ancora registrato.
     *
     * @param name nome della feature (non vuoto)
     * @return ID univoco, sempre > 0
     */
    public int getOrCreate(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }

        return variableMapping.computeIfAbsent(name, key -> {
            reverseMapping.add(key);
            int newId = reverseMapping.size();
            LOGGER.finest("Nuova variabile mappata: " + key + " → ID " + newId);
            return newId;
        });
    }

    /**
     * @return ID registrato, oppure 0 se il nome è sconosciuto
     */
    public int idOf(String name) {
        Integer id = variableMapping.get(name);
        return id == null ? 0 : id;
    }

    /**
     * Nome associato a una variabile o a un letterale (il segno viene ignorato).
     *
     * @param literal ID o letterale con segno
     * @return nome della feature, null se l'ID non è registrato
     */
    public String nameOf(int literal) {
        int variable = Math.abs(literal);
        if (variable == 0 || variable > reverseMapping.size()) {
            return null;
        }
        return reverseMapping.get(variable - 1);
    }

    public boolean contains(String name) {
        return variableMapping.containsKey(name);
    }

    public int size() {
        return reverseMapping.size();
    }

    /**
     * @return vista immutabile del mapping nome → ID in ordine di registrazione
     */
    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(variableMapping);
    }

    @Override
    public String toString() {
        return "VariableRegistry" + variableMapping;
    }
}
