package org.fm.cnf;

import org.fm.constraint.UnsupportedConstraintException;
import org.fm.model.CrossTreeConstraint;
import org.fm.model.Feature;
import org.fm.model.FeatureModel;
import org.fm.model.GroupType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * COMPILATORE CNF - Traduzione deterministica del feature model in clausole
 *
 * Visita l'albero in pre-ordine a partire dalla radice ed emette, per ogni clausola,
 * la corrispondente regola leggibile nel rule log.
 *
 * CODIFICA:
 * • radice r:                       [+r]                      "r"
 * • figlia obbligatoria f di p:     [-p, +f] e [-f, +p]       "p → f", "f → p"
 * • figlia opzionale f di p:        [-f, +p]                  "f → p"
 * • gruppo OR/XOR g con c1..ck:     [-g, +c1, ..., +ck]       "g → (c1 ∨ … ∨ ck)"
 * • solo XOR, per ogni coppia i<j:  [-ci, -cj]                "¬(ci ∧ cj)"
 * • Requires(A, B):                 [-A, +B]                  "A → B"
 * • Excludes(A, B):                 [-A, -B]                  "¬(A ∧ B)"
 *
 * Gli ID delle variabili sono registrati nell'ordine di visita: prima la feature
 * stessa, poi (per i gruppi) le figlie in ordine di documento. Ogni invocazione di
 * {@link #compile(FeatureModel)} usa un registro nuovo, quindi due compilazioni dello
 * stesso modello producono clausole e regole identiche.
 */
public class CNFCompiler {

    private static final Logger LOGGER = Logger.getLogger(CNFCompiler.class.getName());

    /** Se true un vincolo non supportato interrompe la compilazione */
    private final boolean strict;

    public CNFCompiler() {
        this(false);
    }

    /**
     * @param strict true per rifiutare i modelli con vincoli cross-tree non codificabili
     */
    public CNFCompiler(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    //region COMPILAZIONE

    /**
     * Compila il modello in una nuova formula.
     *
     * @param model feature model immutabile
     * @return clausole, rule log e registro della sessione
     * @throws UnsupportedConstraintException in modalità strict, al primo vincolo non supportato
     */
    public CompiledFormula compile(FeatureModel model) {
        if (model == null) {
            throw new IllegalArgumentException("Feature model non può essere null");
        }

        Session session = new Session();
        Feature root = model.getRoot();

        // Radice sempre selezionata
        int rootId = session.registry.getOrCreate(root.getName());
        session.emit(List.of(rootId), root.getName());
        compileGroup(root, session);

        for (Feature child : root.getChildren()) {
            compileFeature(child, session);
        }

        List<CrossTreeConstraint> unsupported = new ArrayList<>();
        for (CrossTreeConstraint constraint : model.getConstraints()) {
            compileConstraint(constraint, session, unsupported);
        }

        LOGGER.fine(String.format("Compilazione completata: %d clausole su %d variabili",
                session.clauses.size(), session.registry.size()));
        return new CompiledFormula(session.clauses, session.rules, session.registry, unsupported);
    }

    /**
     * Emette gli archi verso il padre, il gruppo della feature e scende nelle figlie.
     */
    private void compileFeature(Feature feature, Session session) {
        String name = feature.getName();
        String parent = feature.getParent();

        int featureId = session.registry.getOrCreate(name);
        int parentId = session.registry.getOrCreate(parent);

        if (feature.isMandatory()) {
            session.emit(List.of(-parentId, featureId), parent + " → " + name);
        }
        session.emit(List.of(-featureId, parentId), name + " → " + parent);

        compileGroup(feature, session);

        for (Feature child : feature.getChildren()) {
            compileFeature(child, session);
        }
    }

    /**
     * Clausola "almeno una" per OR e XOR, mutua esclusione a coppie per XOR.
     */
    private void compileGroup(Feature feature, Session session) {
        if (!feature.hasGroup()) {
            return;
        }

        List<Feature> children = feature.getChildren();
        int groupId = session.registry.getOrCreate(feature.getName());

        List<Integer> childIds = new ArrayList<>(children.size());
        for (Feature child : children) {
            childIds.add(session.registry.getOrCreate(child.getName()));
        }

        List<Integer> atLeastOne = new ArrayList<>(childIds.size() + 1);
        atLeastOne.add(-groupId);
        atLeastOne.addAll(childIds);
        session.emit(atLeastOne, feature.getName() + " → (" + String.join(" ∨ ", feature.getChildNames()) + ")");

        if (feature.getGroup() == GroupType.XOR) {
            for (int i = 0; i < children.size(); i++) {
                for (int j = i + 1; j < children.size(); j++) {
                    session.emit(List.of(-childIds.get(i), -childIds.get(j)),
                            "¬(" + children.get(i).getName() + " ∧ " + children.get(j).getName() + ")");
                }
            }
        }
    }

    private void compileConstraint(CrossTreeConstraint constraint, Session session,
                                   List<CrossTreeConstraint> unsupported) {
        switch (constraint.getType()) {
            case REQUIRES -> {
                int subject = session.registry.getOrCreate(constraint.getSubject());
                int object = session.registry.getOrCreate(constraint.getObject());
                session.emit(List.of(-subject, object), constraint.getSubject() + " → " + constraint.getObject());
            }
            case EXCLUDES -> {
                int subject = session.registry.getOrCreate(constraint.getSubject());
                int object = session.registry.getOrCreate(constraint.getObject());
                session.emit(List.of(-subject, -object),
                        "¬(" + constraint.getSubject() + " ∧ " + constraint.getObject() + ")");
            }
            case UNSUPPORTED -> {
                if (strict) {
                    throw new UnsupportedConstraintException(constraint.getSourceText(), constraint.getReason());
                }
                LOGGER.warning("Vincolo senza clausola: \"" + constraint.getSourceText() + "\" (" +
                        constraint.getReason() + ")");
                unsupported.add(constraint);
            }
        }
    }

    //endregion

    //region STATO DI SESSIONE

    /**
     * Stato di una singola compilazione: registro, clausole e regole avanzano insieme.
     */
    private static final class Session {
        private final VariableRegistry registry = new VariableRegistry();
        private final List<List<Integer>> clauses = new ArrayList<>();
        private final List<String> rules = new ArrayList<>();

        private void emit(List<Integer> clause, String rule) {
            clauses.add(clause);
            rules.add(rule);
            LOGGER.finest(() -> "Clausola " + clauses.size() + ": " +
                    clause.stream().map(String::valueOf).collect(Collectors.joining(" ")) + "  [" + rule + "]");
        }
    }

    //endregion
}
