package org.fm.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FEATURE - Nodo immutabile dell'albero del feature model
 *
 * Ogni feature possiede in modo esclusivo i propri figli e referenzia il padre solo per
 * nome: il nome è la chiave stabile usata sia dall'indice del modello sia dal registro
 * delle variabili SAT, distinta dalla relazione di possesso.
 *
 * INVARIANTI:
 * - nome non vuoto e univoco nell'intero albero (garantito da {@link FeatureModel})
 * - il flag mandatory è significativo solo se esiste un padre
 * - il gruppo descrive la relazione tra i soli figli immediati
 */
public final class Feature {

    /** Nome univoco, usato come chiave e come etichetta di variabile */
    private final String name;

    /** Obbligatorietà rispetto al padre (ignorata per la radice) */
    private final boolean mandatory;

    /** Nome del padre, null per la radice */
    private final String parent;

    /** Figli in ordine di documento */
    private final List<Feature> children;

    /** Relazione tra i figli immediati */
    private final GroupType group;

    /**
     * @param name nome univoco (non null, non vuoto)
     * @param mandatory true se obbligatoria rispetto al padre
     * @param parent nome del padre, null per la radice
     * @param children figli già costruiti (copiati difensivamente)
     * @param group tipo di gruppo dei figli (null equivale a NONE)
     * @throws IllegalArgumentException se il nome è vuoto o un figlio dichiara un altro padre
     */
    public Feature(String name, boolean mandatory, String parent, List<Feature> children, GroupType group) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Il nome della feature non può essere vuoto");
        }

        this.name = name;
        this.mandatory = mandatory;
        this.parent = parent;
        this.children = children == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(children));
        this.group = group == null ? GroupType.NONE : group;

        for (Feature child : this.children) {
            if (!name.equals(child.parent)) {
                throw new IllegalArgumentException("La feature " + child.name +
                        " dichiara il padre " + child.parent + " invece di " + name);
            }
        }
    }

    public String getName() {
        return name;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    public String getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public List<Feature> getChildren() {
        return children;
    }

    public GroupType getGroup() {
        return group;
    }

    /**
     * @return true se i figli formano un gruppo OR o XOR
     */
    public boolean hasGroup() {
        return group != GroupType.NONE;
    }

    /**
     * @return nomi dei figli immediati in ordine di documento
     */
    public List<String> getChildNames() {
        List<String> names = new ArrayList<>(children.size());
        for (Feature child : children) {
            names.add(child.name);
        }
        return names;
    }

    /**
     * Uguaglianza basata sul solo nome, univoco nel modello.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return name.equals(((Feature) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return String.format("Feature{name=%s, mandatory=%s, parent=%s, group=%s, figli=%d}",
                name, mandatory, parent, group, children.size());
    }
}
