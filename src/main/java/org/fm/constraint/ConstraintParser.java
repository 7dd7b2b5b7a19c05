package org.fm.constraint;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.fm.constraint.parser.FeatureConstraintLexer;
import org.fm.constraint.parser.FeatureConstraintParser;
import org.fm.model.CrossTreeConstraint;

import java.util.Set;
import java.util.logging.Logger;

/**
 * PARSER VINCOLI CROSS-TREE - Classificazione esplicita al posto del keyword matching
 *
 * Sottopone il testo del vincolo (traduzione formale se presente, altrimenti l'enunciato
 * inglese) alla grammatica ANTLR FeatureConstraint e verifica che entrambe le feature
 * nominate esistano nel modello.
 *
 * ESITI:
 * - testo riconosciuto e feature note → Requires/Excludes
 * - errore lessicale o sintattico → UNSUPPORTED con posizione e messaggio ANTLR
 * - feature sconosciuta → UNSUPPORTED con il nome mancante
 *
 * Il parser non lancia mai eccezioni per testo non riconosciuto: la decisione tra
 * segnalazione e fallimento (modalità strict) spetta al compilatore CNF.
 */
public class ConstraintParser {

    private static final Logger LOGGER = Logger.getLogger(ConstraintParser.class.getName());

    /**
     * Classifica un vincolo del documento.
     *
     * @param englishStatement enunciato originale (non null)
     * @param translation traduzione formale, null se assente
     * @param knownFeatures nomi delle feature dichiarate nell'albero
     * @return vincolo Requires, Excludes oppure UNSUPPORTED con motivo
     */
    public CrossTreeConstraint parse(String englishStatement, String translation, Set<String> knownFeatures) {
        if (englishStatement == null) {
            throw new IllegalArgumentException("englishStatement non può essere null");
        }

        String normalizedTranslation = translation == null || translation.isBlank() ? null : translation.trim();
        String sourceText = normalizedTranslation != null ? normalizedTranslation : englishStatement.trim();

        CrossTreeConstraint constraint;
        try {
            constraint = parseText(sourceText, englishStatement, normalizedTranslation);
        } catch (UnsupportedConstraintException e) {
            LOGGER.warning("Vincolo non riconosciuto \"" + sourceText + "\": " + e.getMessage());
            return CrossTreeConstraint.unsupported(englishStatement, normalizedTranslation, e.getMessage());
        }

        // Entrambe le feature devono appartenere all'albero
        for (String name : new String[]{constraint.getSubject(), constraint.getObject()}) {
            if (!knownFeatures.contains(name)) {
                String reason = "feature sconosciuta: " + name;
                LOGGER.warning("Vincolo \"" + sourceText + "\" scartato, " + reason);
                return CrossTreeConstraint.unsupported(englishStatement, normalizedTranslation, reason);
            }
        }

        return constraint;
    }

    /**
     * Esegue lexer, parser e visitor sul testo.
     *
     * @throws UnsupportedConstraintException al primo errore lessicale o sintattico
     */
    private CrossTreeConstraint parseText(String sourceText, String englishStatement, String translation) {
        if (sourceText.isEmpty()) {
            throw new UnsupportedConstraintException(sourceText, "testo del vincolo vuoto");
        }

        FailFastErrorListener errorListener = new FailFastErrorListener(sourceText);

        FeatureConstraintLexer lexer = new FeatureConstraintLexer(CharStreams.fromString(sourceText));
        lexer.removeErrorListeners();                       // Niente stampe su stderr
        lexer.addErrorListener(errorListener);

        FeatureConstraintParser parser = new FeatureConstraintParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.constraint();
        return new ConstraintTranslator(englishStatement, translation).visit(tree);
    }

    /**
     * Listener che interrompe il parsing al primo errore trasformandolo in
     * {@link UnsupportedConstraintException}.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        private final String sourceText;

        private FailFastErrorListener(String sourceText) {
            this.sourceText = sourceText;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new UnsupportedConstraintException(sourceText,
                    "posizione " + charPositionInLine + ": " + msg);
        }
    }
}
