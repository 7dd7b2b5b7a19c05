package org.fm.analysis;

import org.fm.model.CrossTreeConstraint;
import org.fm.model.Feature;
import org.fm.model.FeatureModel;
import org.fm.model.GroupType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * DIAGNOSTICA - Spiegazioni leggibili di una selezione incoerente
 *
 * Percorre l'albero indipendentemente dall'oracle e ricava le violazioni in modo
 * strutturale. L'elenco è una spiegazione best-effort: non coincide necessariamente
 * con tutte le clausole violate.
 *
 * ORDINE DEI MESSAGGI:
 * 1. radice non selezionata
 * 2. per ogni feature in pre-ordine: obbligatoria mancante, padre mancante,
 *    gruppo XOR non esclusivo, gruppo OR vuoto
 * 3. vincoli cross-tree nell'ordine del documento
 */
public class ViolationDiagnostics {

    /**
     * @param model modello di riferimento
     * @param selected nomi delle feature selezionate (le altre sono escluse)
     * @return messaggi in ordine deterministico, vuoto se non emerge alcuna violazione
     */
    public List<String> diagnose(FeatureModel model, Set<String> selected) {
        List<String> messages = new ArrayList<>();

        Feature root = model.getRoot();
        if (!selected.contains(root.getName())) {
            messages.add("Root feature must be selected: " + root.getName());
        }

        for (Feature feature : model.getFeatures()) {
            String name = feature.getName();
            boolean isSelected = selected.contains(name);

            if (!feature.isRoot()) {
                boolean parentSelected = selected.contains(feature.getParent());
                if (feature.isMandatory() && parentSelected && !isSelected) {
                    messages.add("Missing mandatory feature: " + name);
                }
                if (isSelected && !parentSelected) {
                    messages.add("Feature " + name + " requires its parent " + feature.getParent());
                }
            }

            if (isSelected && feature.hasGroup()) {
                long chosen = feature.getChildNames().stream().filter(selected::contains).count();
                if (feature.getGroup() == GroupType.XOR && chosen != 1) {
                    messages.add("XOR group " + name + " must have exactly one selection");
                } else if (feature.getGroup() == GroupType.OR && chosen == 0) {
                    messages.add("OR group " + name + " must have at least one selection");
                }
            }
        }

        for (CrossTreeConstraint constraint : model.getConstraints()) {
            String subject = constraint.getSubject();
            String object = constraint.getObject();
            switch (constraint.getType()) {
                case REQUIRES -> {
                    if (selected.contains(subject) && !selected.contains(object)) {
                        messages.add(object + " feature is required for " + subject);
                    }
                }
                case EXCLUDES -> {
                    if (selected.contains(subject) && selected.contains(object)) {
                        messages.add(subject + " and " + object + " cannot be selected together");
                    }
                }
                case UNSUPPORTED -> {
                    // Nessuna clausola, nessuna violazione da spiegare
                }
            }
        }

        return messages;
    }
}
