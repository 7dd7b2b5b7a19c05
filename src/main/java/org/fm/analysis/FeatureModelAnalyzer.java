package org.fm.analysis;

import org.fm.cnf.CNFCompiler;
import org.fm.cnf.CompiledFormula;
import org.fm.model.FeatureModel;
import org.fm.model.FeatureModelParser;
import org.fm.oracle.OracleKind;
import org.fm.oracle.Sat4jOracle;
import org.fm.oracle.SatOracle;

import java.nio.file.Path;
import java.util.Collection;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * ANALIZZATORE - Punto di ingresso per caricamento, analisi e validazione
 *
 * Ogni chiamata lavora su stato proprio: la compilazione usa un registro nuovo e ogni
 * sessione crea il proprio oracle. L'analizzatore non conserva alcun modello, quindi
 * un'istanza può servire più richieste in sequenza.
 */
public class FeatureModelAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(FeatureModelAnalyzer.class.getName());

    private final FeatureModelParser parser = new FeatureModelParser();
    private final CNFCompiler compiler;
    private final MVPEnumerator enumerator;
    private final SelectionValidator validator;

    public FeatureModelAnalyzer() {
        this(OracleKind.CDCL, EnumerationLimits.defaults(), false);
    }

    /**
     * @param strict true per rifiutare i modelli con vincoli non supportati
     */
    public FeatureModelAnalyzer(OracleKind oracleKind, EnumerationLimits limits, boolean strict) {
        this(() -> oracleKind.newOracle(limits.hasTimeout() ? limits.getTimeout() : Sat4jOracle.DEFAULT_TIMEOUT),
                limits, strict);
    }

    /**
     * @param oracleFactory produce un oracle nuovo per ogni sessione
     */
    public FeatureModelAnalyzer(Supplier<SatOracle> oracleFactory, EnumerationLimits limits, boolean strict) {
        this.compiler = new CNFCompiler(strict);
        this.enumerator = new MVPEnumerator(compiler, oracleFactory, limits);
        this.validator = new SelectionValidator(compiler, oracleFactory);
    }

    public FeatureModel load(Path path) {
        return parser.parse(path);
    }

    public FeatureModel loadString(String xml) {
        return parser.parseString(xml);
    }

    /**
     * Compila il modello ed enumera i prodotti minimi.
     *
     * @throws org.fm.constraint.UnsupportedConstraintException in modalità strict
     * @throws org.fm.oracle.OracleException se l'oracle non riesce a decidere
     */
    public AnalysisReport analyze(FeatureModel model) {
        if (model == null) {
            throw new IllegalArgumentException("Feature model non può essere null");
        }
        long start = System.currentTimeMillis();

        CompiledFormula formula = compiler.compile(model);
        EnumerationResult enumeration = enumerator.enumerate(model, formula);

        long elapsed = System.currentTimeMillis() - start;
        LOGGER.info(String.format("Analisi di %s completata in %dms: %d regole, %d prodotti minimi",
                model.getRoot().getName(), elapsed, formula.getClauseCount(), enumeration.getProducts().size()));
        return new AnalysisReport(model, formula, enumeration, elapsed);
    }

    public AnalysisReport analyze(Path path) {
        return analyze(load(path));
    }

    public ValidationResult validate(FeatureModel model, Collection<String> selection) {
        return validator.validate(model, selection);
    }

    public boolean isStrict() {
        return compiler.isStrict();
    }
}
