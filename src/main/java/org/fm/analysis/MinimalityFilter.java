package org.fm.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * FILTRO DI MINIMALITÀ - Principio di sussunzione applicato ai prodotti
 *
 * Un prodotto P sussume un prodotto Q se P ⊂ Q strettamente: Q contiene tutte le
 * feature di P e almeno una in più, quindi non è minimo e viene scartato.
 *
 * ESEMPIO:
 * Candidati: {root, A, B}, {root, A, B, C}, {root, A, D}
 * - {root, A, B} sussume {root, A, B, C} → elimina {root, A, B, C}
 * Risultato: {root, A, B}, {root, A, D}
 *
 * I duplicati collassano sulla prima occorrenza e l'ordine di scoperta è preservato.
 * Il confronto è tra insiemi di nomi, indipendente dall'ordine di inserimento.
 */
public class MinimalityFilter {

    private static final Logger LOGGER = Logger.getLogger(MinimalityFilter.class.getName());

    /** Registro leggibile dell'ultima esecuzione */
    private StringBuilder filterLog = new StringBuilder();

    private int eliminatedCount = 0;

    /**
     * @param candidates prodotti validi, eventualmente ripetuti
     * @return prodotti minimi in ordine di scoperta
     */
    public List<Set<String>> filter(List<Set<String>> candidates) {
        if (candidates == null) {
            throw new IllegalArgumentException("Lista dei candidati non può essere null");
        }

        filterLog = new StringBuilder("=== FILTRO DI MINIMALITÀ ===\n");
        eliminatedCount = 0;

        List<Set<String>> unique = new ArrayList<>();
        for (Set<String> candidate : candidates) {
            if (!unique.contains(candidate)) {
                unique.add(new LinkedHashSet<>(candidate));
            }
        }
        filterLog.append("Candidati distinti: ").append(unique.size())
                .append(" su ").append(candidates.size()).append('\n');

        List<Set<String>> minimal = new ArrayList<>();
        for (Set<String> candidate : unique) {
            Set<String> subsumer = findSubsumer(candidate, unique);
            if (subsumer == null) {
                minimal.add(candidate);
            } else {
                eliminatedCount++;
                filterLog.append("SUSSUNZIONE: ").append(subsumer)
                        .append(" ⊂ ").append(candidate)
                        .append(" → elimina ").append(candidate).append('\n');
                LOGGER.finest("Prodotto " + candidate + " non minimo, contiene " + subsumer);
            }
        }

        filterLog.append("Prodotti eliminati: ").append(eliminatedCount).append('\n');
        filterLog.append("Prodotti minimi: ").append(minimal.size()).append('\n');
        LOGGER.fine(String.format("Filtro di minimalità: %d candidati, %d minimi", unique.size(), minimal.size()));

        return minimal;
    }

    /**
     * @return un candidato strettamente contenuto in {@code candidate}, null se non esiste
     */
    private Set<String> findSubsumer(Set<String> candidate, List<Set<String>> all) {
        for (Set<String> other : all) {
            if (other.size() < candidate.size() && candidate.containsAll(other)) {
                return other;
            }
        }
        return null;
    }

    public String getFilterLog() {
        return filterLog.toString();
    }

    public int getEliminatedCount() {
        return eliminatedCount;
    }
}
