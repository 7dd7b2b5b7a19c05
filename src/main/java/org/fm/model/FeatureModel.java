package org.fm.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * FEATURE MODEL - Albero immutabile con indice per nome e vincoli cross-tree
 *
 * La radice possiede l'intero albero; l'indice nome → feature viene costruito una sola
 * volta dopo la costruzione con una visita in pre-ordine, così che le fasi successive
 * (compilazione CNF, validazione, diagnostica) accedano ai nodi in O(1).
 *
 * Il modello non contiene stato mutabile: può essere condiviso tra richieste, mentre
 * registro delle variabili e oracolo SAT restano strettamente per singola chiamata.
 */
public final class FeatureModel {

    private static final Logger LOGGER = Logger.getLogger(FeatureModel.class.getName());

    private final Feature root;

    /** Indice in pre-ordine: l'ordine di iterazione coincide con la visita dell'albero */
    private final Map<String, Feature> index;

    private final List<CrossTreeConstraint> constraints;

    /**
     * @param root radice dell'albero (senza padre)
     * @param constraints vincoli cross-tree nell'ordine del documento
     * @throws ModelParseException se la radice ha un padre o esistono nomi duplicati
     */
    public FeatureModel(Feature root, List<CrossTreeConstraint> constraints) {
        if (root == null) {
            throw new ModelParseException("Feature radice mancante");
        }
        if (!root.isRoot()) {
            throw new ModelParseException("La radice " + root.getName() + " non può avere un padre");
        }

        this.root = root;
        this.index = Collections.unmodifiableMap(buildIndex(root));
        this.constraints = constraints == null ? List.of() : List.copyOf(constraints);

        LOGGER.fine(String.format("Feature model costruito: radice=%s, feature=%d, vincoli=%d",
                root.getName(), index.size(), this.constraints.size()));
    }

    /**
     * Visita in pre-ordine con stack esplicito; rifiuta nomi duplicati.
     */
    private static Map<String, Feature> buildIndex(Feature root) {
        Map<String, Feature> result = new LinkedHashMap<>();
        Deque<Feature> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            Feature current = pending.pop();
            if (result.putIfAbsent(current.getName(), current) != null) {
                throw new ModelParseException("Nome di feature duplicato: " + current.getName());
            }

            // Push in ordine inverso per preservare l'ordine di documento
            List<Feature> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }

        return result;
    }

    //region INTERROGAZIONE

    public Feature getRoot() {
        return root;
    }

    /**
     * @return feature con il nome dato, null se assente
     */
    public Feature getFeature(String name) {
        return index.get(name);
    }

    public boolean contains(String name) {
        return index.containsKey(name);
    }

    /**
     * @return tutte le feature in pre-ordine
     */
    public List<Feature> getFeatures() {
        return new ArrayList<>(index.values());
    }

    /**
     * @return nomi di tutte le feature in pre-ordine
     */
    public List<String> getFeatureNames() {
        return new ArrayList<>(index.keySet());
    }

    public int size() {
        return index.size();
    }

    public List<CrossTreeConstraint> getConstraints() {
        return constraints;
    }

    /**
     * @return vincoli che il parser non ha saputo codificare
     */
    public List<CrossTreeConstraint> getUnsupportedConstraints() {
        List<CrossTreeConstraint> unsupported = new ArrayList<>();
        for (CrossTreeConstraint constraint : constraints) {
            if (!constraint.isSupported()) {
                unsupported.add(constraint);
            }
        }
        return unsupported;
    }

    /**
     * @return antenati della feature dal padre fino alla radice
     * @throws IllegalArgumentException se la feature non esiste
     */
    public List<Feature> getAncestors(String name) {
        Feature current = requireFeature(name);
        List<Feature> ancestors = new ArrayList<>();
        while (!current.isRoot()) {
            current = index.get(current.getParent());
            ancestors.add(current);
        }
        return ancestors;
    }

    /**
     * @return discendenti della feature (esclusa) in pre-ordine
     * @throws IllegalArgumentException se la feature non esiste
     */
    public List<Feature> getDescendants(String name) {
        List<Feature> descendants = new ArrayList<>();
        collectDescendants(requireFeature(name), descendants);
        return descendants;
    }

    private void collectDescendants(Feature feature, List<Feature> accumulator) {
        for (Feature child : feature.getChildren()) {
            accumulator.add(child);
            collectDescendants(child, accumulator);
        }
    }

    private Feature requireFeature(String name) {
        Feature feature = index.get(name);
        if (feature == null) {
            throw new IllegalArgumentException("Feature sconosciuta: " + name);
        }
        return feature;
    }

    //endregion

    //region RAPPRESENTAZIONE

    /**
     * Rappresentazione indentata dell'albero: "*" dopo le feature obbligatorie,
     * tipo di gruppo tra parentesi quadre.
     *
     * <pre>
     * Root
     *   A *  [XOR]
     *     B
     *     C
     * </pre>
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        renderFeature(root, 0, out);
        return out.toString();
    }

    private void renderFeature(Feature feature, int depth, StringBuilder out) {
        out.append("  ".repeat(depth)).append(feature.getName());
        if (feature.isMandatory() && !feature.isRoot()) {
            out.append(" *");
        }
        if (feature.hasGroup()) {
            out.append("  [").append(feature.getGroup()).append(']');
        }
        out.append('\n');

        for (Feature child : feature.getChildren()) {
            renderFeature(child, depth + 1, out);
        }
    }

    @Override
    public String toString() {
        return String.format("FeatureModel{radice=%s, feature=%d, vincoli=%d}",
                root.getName(), index.size(), constraints.size());
    }

    //endregion
}
