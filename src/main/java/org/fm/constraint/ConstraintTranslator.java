package org.fm.constraint;

import org.fm.constraint.parser.FeatureConstraintBaseVisitor;
import org.fm.constraint.parser.FeatureConstraintParser.ConstraintContext;
import org.fm.constraint.parser.FeatureConstraintParser.ExcludesStatementContext;
import org.fm.constraint.parser.FeatureConstraintParser.IncompatibleStatementContext;
import org.fm.constraint.parser.FeatureConstraintParser.MutuallyExclusiveStatementContext;
import org.fm.constraint.parser.FeatureConstraintParser.NotBothStatementContext;
import org.fm.constraint.parser.FeatureConstraintParser.RequiredByStatementContext;
import org.fm.constraint.parser.FeatureConstraintParser.RequiresNotStatementContext;
import org.fm.constraint.parser.FeatureConstraintParser.RequiresStatementContext;
import org.fm.constraint.parser.FeatureConstraintParser.FeatureContext;
import org.fm.constraint.parser.FeatureConstraintParser.KeywordFeatureContext;
import org.fm.constraint.parser.FeatureConstraintParser.PlainFeatureContext;
import org.fm.constraint.parser.FeatureConstraintParser.QuotedFeatureContext;
import org.fm.model.CrossTreeConstraint;

import java.util.logging.Logger;

/**
 * TRADUTTORE VINCOLI - Visitor dall'albero sintattico ANTLR alla variante etichettata
 *
 * Ogni alternativa etichettata della grammatica FeatureConstraint produce direttamente
 * un {@link CrossTreeConstraint} Requires o Excludes, conservando enunciato originale e
 * traduzione formale. Il visitor non valida i nomi: il controllo di esistenza delle
 * feature spetta a {@link ConstraintParser}. Una parola chiave in posizione di feature
 * vale come nome, con la grafia del testo.
 *
 * CORRISPONDENZE:
 * - A requires B, A implies B, A -> B          → Requires(A, B)
 * - B [feature] is required by/for A            → Requires(A, B)
 * - A -> !B, A excludes B, A is incompatible with B,
 *   A and B are mutually exclusive, !(A & B)    → Excludes(A, B)
 */
class ConstraintTranslator extends FeatureConstraintBaseVisitor<CrossTreeConstraint> {

    private static final Logger LOGGER = Logger.getLogger(ConstraintTranslator.class.getName());

    private final String englishStatement;
    private final String translation;

    /**
     * @param englishStatement enunciato originale del documento
     * @param translation traduzione formale, null se assente
     */
    ConstraintTranslator(String englishStatement, String translation) {
        this.englishStatement = englishStatement;
        this.translation = translation;
    }

    @Override
    public CrossTreeConstraint visitConstraint(ConstraintContext ctx) {
        CrossTreeConstraint constraint = visit(ctx.statement());
        LOGGER.fine("Vincolo tradotto: " + constraint.toFormalString());
        return constraint;
    }

    //region REQUIRES

    @Override
    public CrossTreeConstraint visitRequiresStatement(RequiresStatementContext ctx) {
        return requires(ctx.feature(0), ctx.feature(1));
    }

    /**
     * "B is required by A": l'ordine testuale è invertito rispetto a Requires(A, B).
     */
    @Override
    public CrossTreeConstraint visitRequiredByStatement(RequiredByStatementContext ctx) {
        return requires(ctx.feature(1), ctx.feature(0));
    }

    //endregion

    //region EXCLUDES

    @Override
    public CrossTreeConstraint visitRequiresNotStatement(RequiresNotStatementContext ctx) {
        // A → ¬B equivale a ¬(A ∧ B)
        return excludes(ctx.feature(0), ctx.feature(1));
    }

    @Override
    public CrossTreeConstraint visitExcludesStatement(ExcludesStatementContext ctx) {
        return excludes(ctx.feature(0), ctx.feature(1));
    }

    @Override
    public CrossTreeConstraint visitMutuallyExclusiveStatement(MutuallyExclusiveStatementContext ctx) {
        return excludes(ctx.feature(0), ctx.feature(1));
    }

    @Override
    public CrossTreeConstraint visitIncompatibleStatement(IncompatibleStatementContext ctx) {
        return excludes(ctx.feature(0), ctx.feature(1));
    }

    @Override
    public CrossTreeConstraint visitNotBothStatement(NotBothStatementContext ctx) {
        return excludes(ctx.feature(0), ctx.feature(1));
    }

    //endregion

    //region NOMI DI FEATURE

    private CrossTreeConstraint requires(FeatureContext subject, FeatureContext object) {
        return CrossTreeConstraint.requires(englishStatement, translation, featureName(subject), featureName(object));
    }

    private CrossTreeConstraint excludes(FeatureContext subject, FeatureContext object) {
        return CrossTreeConstraint.excludes(englishStatement, translation, featureName(subject), featureName(object));
    }

    private String featureName(FeatureContext ctx) {
        if (ctx instanceof QuotedFeatureContext) {
            String text = ((QuotedFeatureContext) ctx).QUOTED().getText();
            return text.substring(1, text.length() - 1).trim();     // Rimuove le virgolette
        }
        if (ctx instanceof KeywordFeatureContext) {
            return ((KeywordFeatureContext) ctx).keyword().getText();
        }
        return ((PlainFeatureContext) ctx).IDENTIFIER().getText();
    }

    //endregion
}
