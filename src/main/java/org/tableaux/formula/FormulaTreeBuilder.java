package org.tableaux.formula;

import org.tableaux.antlr.LogicFormulaBaseVisitor;
import org.tableaux.antlr.LogicFormulaParser.AndContext;
import org.tableaux.antlr.LogicFormulaParser.BraceContext;
import org.tableaux.antlr.LogicFormulaParser.BracketContext;
import org.tableaux.antlr.LogicFormulaParser.FormulaContext;
import org.tableaux.antlr.LogicFormulaParser.IdContext;
import org.tableaux.antlr.LogicFormulaParser.IffContext;
import org.tableaux.antlr.LogicFormulaParser.ImpliesContext;
import org.tableaux.antlr.LogicFormulaParser.NotContext;
import org.tableaux.antlr.LogicFormulaParser.OrContext;
import org.tableaux.antlr.LogicFormulaParser.ParContext;
import org.tableaux.antlr.LogicFormulaParser.PlainContext;
import org.tableaux.antlr.LogicFormulaParser.PrimaryContext;
import org.tableaux.antlr.LogicFormulaParser.SingleContext;
import org.tableaux.support.FormulaSymbol;

import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERO FORMULA - Visitor da albero sintattico ANTLR a PropositionalFormula
 *
 * Trasforma l'albero di parsing generato dalla grammatica LogicFormula nella
 * rappresentazione immutabile {@link PropositionalFormula}, senza alcuna
 * trasformazione semantica: ogni connettivo dell'input diventa esattamente
 * un nodo dell'albero (implicazioni e biimplicazioni sono preservate, perché
 * il tableau dispone di regole dedicate).
 *
 * ARCHITETTURA VISITOR:
 * • Ogni metodo visit gestisce un'alternativa etichettata della grammatica
 * • Conversione bottom-up: foglie -> radice
 * • Le parentesi (tonde, quadre, graffe) sono rimosse in modo trasparente
 */
class FormulaTreeBuilder extends LogicFormulaBaseVisitor<PropositionalFormula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public PropositionalFormula visitFormula(FormulaContext ctx) {
        return visit(ctx.expression());
    }

    //endregion

    //region CONNETTIVI BINARI

    @Override
    public PropositionalFormula visitAnd(AndContext ctx) {
        return buildBinary(FormulaSymbol.AND, ctx.left, ctx.right);
    }

    @Override
    public PropositionalFormula visitOr(OrContext ctx) {
        return buildBinary(FormulaSymbol.OR, ctx.left, ctx.right);
    }

    @Override
    public PropositionalFormula visitImplies(ImpliesContext ctx) {
        return buildBinary(FormulaSymbol.IMPLIES, ctx.left, ctx.right);
    }

    @Override
    public PropositionalFormula visitIff(IffContext ctx) {
        return buildBinary(FormulaSymbol.IFF, ctx.left, ctx.right);
    }

    /**
     * Costruisce il nodo binario visitando entrambi gli operandi.
     */
    private PropositionalFormula buildBinary(FormulaSymbol symbol,
                                             PrimaryContext left,
                                             PrimaryContext right) {
        LOGGER.finest("Elaborazione connettivo " + symbol);
        return PropositionalFormula.binary(symbol, visit(left), visit(right));
    }

    @Override
    public PropositionalFormula visitSingle(SingleContext ctx) {
        return visit(ctx.unary());
    }

    //endregion

    //region NEGAZIONI, PARENTESI E ATOMI

    @Override
    public PropositionalFormula visitNot(NotContext ctx) {
        LOGGER.finest("Elaborazione negazione unaria");
        return PropositionalFormula.not(visit(ctx.unary()));
    }

    @Override
    public PropositionalFormula visitPlain(PlainContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public PropositionalFormula visitPar(ParContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public PropositionalFormula visitBracket(BracketContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public PropositionalFormula visitBrace(BraceContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public PropositionalFormula visitId(IdContext ctx) {
        String variableName = ctx.IDENTIFIER().getText();
        LOGGER.finest("Elaborazione variabile atomica: " + variableName);
        return PropositionalFormula.atom(variableName);
    }

    //endregion
}
