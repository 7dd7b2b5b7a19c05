package org.fm.analysis;

import org.fm.cnf.CompiledFormula;
import org.fm.model.CrossTreeConstraint;
import org.fm.model.FeatureModel;

import java.util.List;
import java.util.Set;

/**
 * REPORT DI ANALISI - Tutto ciò che l'analisi di un modello produce
 *
 * CONTENUTO:
 * • albero delle feature in forma indentata
 * • rule log con la clausola corrispondente a ogni regola
 * • prodotti minimi validi ("MWP i: ...")
 * • vincoli cross-tree nella forma riconosciuta, con i non supportati e il motivo
 * • eventuale troncamento dell'enumerazione
 * • formula in formato DIMACS
 */
public final class AnalysisReport {

    private final FeatureModel model;
    private final CompiledFormula formula;
    private final EnumerationResult enumeration;
    private final long elapsedMs;

    AnalysisReport(FeatureModel model, CompiledFormula formula, EnumerationResult enumeration, long elapsedMs) {
        this.model = model;
        this.formula = formula;
        this.enumeration = enumeration;
        this.elapsedMs = elapsedMs;
    }

    //region ACCESSO AI RISULTATI

    public FeatureModel getModel() {
        return model;
    }

    public CompiledFormula getFormula() {
        return formula;
    }

    public EnumerationResult getEnumeration() {
        return enumeration;
    }

    public List<String> getRules() {
        return formula.getRules();
    }

    public List<Set<String>> getProducts() {
        return enumeration.getProducts();
    }

    public List<CrossTreeConstraint> getConstraints() {
        return model.getConstraints();
    }

    public List<CrossTreeConstraint> getUnsupportedConstraints() {
        return formula.getUnsupportedConstraints();
    }

    public boolean isTruncated() {
        return enumeration.isTruncated();
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    //endregion

    //region RAPPRESENTAZIONI TESTUALI

    public String renderTree() {
        return model.render();
    }

    /**
     * Una riga per regola: numero progressivo, regola e clausola DIMACS.
     */
    public String renderRules() {
        StringBuilder out = new StringBuilder();
        List<List<Integer>> clauses = formula.getClauses();
        List<String> rules = formula.getRules();
        for (int i = 0; i < rules.size(); i++) {
            out.append(String.format("%3d. %-40s %s%n", i + 1, rules.get(i), clauses.get(i)));
        }
        return out.toString();
    }

    public String renderProducts() {
        StringBuilder out = new StringBuilder();
        List<Set<String>> products = enumeration.getProducts();
        for (int i = 0; i < products.size(); i++) {
            out.append("MWP ").append(i + 1).append(": ").append(String.join(", ", products.get(i))).append('\n');
        }
        if (enumeration.isTruncated()) {
            out.append("(enumerazione troncata: ").append(enumeration.getTruncationReason()).append(")\n");
        }
        return out.toString();
    }

    public String renderConstraints() {
        StringBuilder out = new StringBuilder();
        for (CrossTreeConstraint constraint : model.getConstraints()) {
            out.append("- ").append(constraint.getEnglishStatement());
            if (constraint.isSupported()) {
                out.append("  ⇒  ").append(constraint.toFormalString());
            } else {
                out.append("  ⇒  NON SUPPORTATO (").append(constraint.getReason()).append(')');
            }
            out.append('\n');
        }
        return out.toString();
    }

    public String toDimacs() {
        return formula.toDimacs();
    }

    /**
     * Report completo in formato testo.
     */
    public String toText() {
        StringBuilder out = new StringBuilder();
        out.append("=================================[ FEATURE MODEL ]=================================\n");
        out.append(renderTree());
        out.append("====================================[ REGOLE ]=====================================\n");
        out.append(renderRules());
        out.append("================================[ VINCOLI CROSS-TREE ]=============================\n");
        out.append(model.getConstraints().isEmpty() ? "(nessuno)\n" : renderConstraints());
        out.append("============================[ PRODOTTI MINIMI VALIDI ]=============================\n");
        out.append(enumeration.getProducts().isEmpty() ? "(nessuno: modello insoddisfacibile)\n" : renderProducts());
        out.append("==================================[ STATISTICHE ]==================================\n");
        out.append("    Feature:    ").append(model.size()).append('\n');
        out.append("    Variabili:  ").append(formula.getVariableCount()).append('\n');
        out.append("    Clausole:   ").append(formula.getClauseCount()).append('\n');
        out.append("    Soluzioni:  ").append(enumeration.getSolutionsSeen()).append('\n');
        out.append("    Prodotti:   ").append(enumeration.getProducts().size()).append('\n');
        out.append("    Troncata:   ").append(enumeration.isTruncated() ? "sì" : "no").append('\n');
        out.append("    Tempo:      ").append(getElapsedMs()).append("ms\n");
        out.append("===================================================================================\n");
        return out.toString();
    }

    //endregion

    @Override
    public String toString() {
        return String.format("AnalysisReport{radice=%s, regole=%d, prodotti=%d, troncato=%s}",
                model.getRoot().getName(), formula.getClauseCount(), enumeration.getProducts().size(),
                enumeration.isTruncated());
    }
}
