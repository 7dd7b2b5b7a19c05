package org.fm.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Esito dell'enumerazione dei prodotti minimi validi.
 */
public final class EnumerationResult {

    private final List<Set<String>> products;
    private final int solutionsSeen;
    private final int candidatesAccepted;
    private final boolean truncated;
    private final String truncationReason;

    EnumerationResult(List<Set<String>> products, int solutionsSeen, int candidatesAccepted,
                      boolean truncated, String truncationReason) {
        List<Set<String>> frozen = new ArrayList<>(products.size());
        for (Set<String> product : products) {
            frozen.add(Collections.unmodifiableSet(new LinkedHashSet<>(product)));
        }
        this.products = Collections.unmodifiableList(frozen);
        this.solutionsSeen = solutionsSeen;
        this.candidatesAccepted = candidatesAccepted;
        this.truncated = truncated;
        this.truncationReason = truncationReason;
    }

    /**
     * @return prodotti minimi in ordine di scoperta; le feature di ogni prodotto sono
     *         in ordine di ID di variabile
     */
    public List<Set<String>> getProducts() {
        return products;
    }

    /**
     * @return assegnamenti completi restituiti dall'oracle prima del filtro
     */
    public int getSolutionsSeen() {
        return solutionsSeen;
    }

    public int getCandidatesAccepted() {
        return candidatesAccepted;
    }

    /**
     * @return true se un limite ha fermato il ciclo prima di esaurire le soluzioni
     */
    public boolean isTruncated() {
        return truncated;
    }

    /**
     * @return motivo del troncamento, null se l'enumerazione è completa
     */
    public String getTruncationReason() {
        return truncationReason;
    }

    @Override
    public String toString() {
        return String.format("EnumerationResult{prodotti=%d, soluzioni=%d, troncato=%s}",
                products.size(), solutionsSeen, truncated);
    }
}
