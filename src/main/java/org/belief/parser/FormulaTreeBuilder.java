package org.belief.parser;

import org.belief.antlr.LogicFormulaBaseVisitor;
import org.belief.antlr.LogicFormulaParser.AndContext;
import org.belief.antlr.LogicFormulaParser.FormulaContext;
import org.belief.antlr.LogicFormulaParser.IdContext;
import org.belief.antlr.LogicFormulaParser.IffContext;
import org.belief.antlr.LogicFormulaParser.ImpliesContext;
import org.belief.antlr.LogicFormulaParser.NotContext;
import org.belief.antlr.LogicFormulaParser.OrContext;
import org.belief.antlr.LogicFormulaParser.ParContext;
import org.belief.antlr.LogicFormulaParser.VarContext;
import org.belief.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERO FORMULE - Visitor dall'albero sintattico ANTLR a {@link Formula}
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Biimplicazione (<<>>), associativa a sinistra
 * - Implicazione (>>), associativa a sinistra
 * - Disgiunzione (|)
 * - Congiunzione (&)
 * - Negazione (~), unaria
 * - Variabili atomiche e parentesi
 *
 * A differenza della conversione CNF, il visitor conserva implicazioni e
 * biimplicazioni: l'albero prodotto è quello scritto dall'utente e viene
 * mostrato così com'è nella base di credenze.
 */
public class FormulaTreeBuilder extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.biconditional());
        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    //endregion

    //region OPERATORI BINARI

    /**
     * Catene di biimplicazioni: A <<>> B <<>> C → (A <<>> B) <<>> C
     */
    @Override
    public Formula visitIff(IffContext ctx) {
        Formula result = visit(ctx.implication(0));
        for (int i = 1; i < ctx.implication().size(); i++) {
            result = Formula.iff(result, visit(ctx.implication(i)));
        }
        return result;
    }

    /**
     * Catene di implicazioni: A >> B >> C → (A >> B) >> C
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula result = visit(ctx.disjunction(0));
        for (int i = 1; i < ctx.disjunction().size(); i++) {
            result = Formula.implies(result, visit(ctx.disjunction(i)));
        }
        return result;
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }

        List<Formula> disjuncts = new ArrayList<>();
        for (var conjunctionCtx : ctx.conjunction()) {
            disjuncts.add(visit(conjunctionCtx));
        }
        return Formula.or(disjuncts);
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        if (ctx.negation().size() == 1) {
            return visit(ctx.negation(0));
        }

        List<Formula> conjuncts = new ArrayList<>();
        for (var negationCtx : ctx.negation()) {
            conjuncts.add(visit(negationCtx));
        }
        return Formula.and(conjuncts);
    }

    //endregion

    //region NEGAZIONI, PARENTESI E ATOMI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public Formula visitId(IdContext ctx) {
        String variableName = ctx.IDENTIFIER().getText();
        LOGGER.finest("Variabile atomica: " + variableName);
        return Formula.atom(variableName);
    }

    //endregion
}
