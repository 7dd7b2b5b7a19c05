package org.fm.analysis;

import org.fm.model.Feature;
import org.fm.model.FeatureModel;
import org.fm.model.GroupType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Modifica interattiva di una selezione, una feature alla volta.
 *
 * Selezionare una feature seleziona anche i suoi antenati e, per ogni livello che
 * appartiene a un gruppo XOR, deseleziona le sorelle con i rispettivi sottoalberi.
 * Deselezionare una feature rimuove tutto il suo sottoalbero. Il risultato non è
 * necessariamente valido: va sottoposto a {@link SelectionValidator}.
 */
public class SelectionEditor {

    private final FeatureModel model;

    public SelectionEditor(FeatureModel model) {
        if (model == null) {
            throw new IllegalArgumentException("Feature model non può essere null");
        }
        this.model = model;
    }

    /**
     * @return nuova selezione in pre-ordine
     */
    public Set<String> select(Collection<String> selection, String featureName) {
        Feature feature = requireFeature(featureName);
        Set<String> result = new LinkedHashSet<>(selection);

        List<Feature> path = new ArrayList<>();
        path.add(feature);
        path.addAll(model.getAncestors(featureName));

        for (Feature member : path) {
            result.add(member.getName());
            if (member.isRoot()) {
                continue;
            }
            Feature parent = model.getFeature(member.getParent());
            if (parent.getGroup() == GroupType.XOR) {
                for (Feature sibling : parent.getChildren()) {
                    if (!sibling.equals(member)) {
                        removeSubtree(result, sibling);
                    }
                }
            }
        }
        return inModelOrder(result);
    }

    /**
     * @return nuova selezione in pre-ordine, senza la feature e i suoi discendenti
     */
    public Set<String> deselect(Collection<String> selection, String featureName) {
        Feature feature = requireFeature(featureName);
        Set<String> result = new LinkedHashSet<>(selection);
        removeSubtree(result, feature);
        return inModelOrder(result);
    }

    public Set<String> toggle(Collection<String> selection, String featureName) {
        return selection.contains(featureName)
                ? deselect(selection, featureName)
                : select(selection, featureName);
    }

    private void removeSubtree(Set<String> selection, Feature feature) {
        selection.remove(feature.getName());
        for (Feature descendant : model.getDescendants(feature.getName())) {
            selection.remove(descendant.getName());
        }
    }

    /**
     * Nomi sconosciuti al modello restano in coda, nell'ordine originale.
     */
    private Set<String> inModelOrder(Set<String> selection) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String name : model.getFeatureNames()) {
            if (selection.contains(name)) {
                ordered.add(name);
            }
        }
        ordered.addAll(selection);
        return ordered;
    }

    private Feature requireFeature(String featureName) {
        Feature feature = model.getFeature(featureName);
        if (feature == null) {
            throw new IllegalArgumentException("Feature sconosciuta: " + featureName);
        }
        return feature;
    }
}
