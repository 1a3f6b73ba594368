package org.tableaux.rules;

import org.tableaux.formula.PropositionalFormula;
import org.tableaux.formula.SignedFormula;
import org.tableaux.support.FormulaSymbol;
import org.tableaux.support.Sign;

import java.util.List;

import static org.tableaux.formula.SignedFormula.assumeFalse;
import static org.tableaux.formula.SignedFormula.assumeTrue;

/**
 * REGOLE DI INFERENZA DEL TABLEAU - Tabella finita (connettivo, segno) -> decomposizione
 *
 * Ogni costante corrisponde a una riga della tabella delle regole con segno:
 *
 * | Formula    | Conclusioni                    | Tipo          |
 * |------------|--------------------------------|---------------|
 * | T(¬A)      | F(A)                           | α             |
 * | F(¬A)      | T(A)                           | α             |
 * | T(A∧B)     | T(A), T(B)                     | α             |
 * | F(A∧B)     | F(A) | F(B)                    | β             |
 * | T(A∨B)     | T(A) | T(B)                    | β             |
 * | F(A∨B)     | F(A), F(B)                     | α             |
 * | T(A→B)     | F(A) | T(B)                    | β             |
 * | F(A→B)     | T(A), F(B)                     | α             |
 * | T(A↔B)     | T(A),T(B) | F(A),F(B)          | β             |
 * | F(A↔B)     | T(A),F(B) | F(A),T(B)          | β             |
 *
 * Ogni conclusione è una sotto-formula propria della premessa: il numero di
 * connettivi decresce strettamente ad ogni applicazione.
 */
public enum InferenceRule {

    TRUE_NOT(FormulaSymbol.NOT, Sign.TRUE, RuleKind.NON_BRANCHING),
    FALSE_NOT(FormulaSymbol.NOT, Sign.FALSE, RuleKind.NON_BRANCHING),
    TRUE_AND(FormulaSymbol.AND, Sign.TRUE, RuleKind.NON_BRANCHING),
    FALSE_AND(FormulaSymbol.AND, Sign.FALSE, RuleKind.BRANCHING),
    TRUE_OR(FormulaSymbol.OR, Sign.TRUE, RuleKind.BRANCHING),
    FALSE_OR(FormulaSymbol.OR, Sign.FALSE, RuleKind.NON_BRANCHING),
    TRUE_IMPLIES(FormulaSymbol.IMPLIES, Sign.TRUE, RuleKind.BRANCHING),
    FALSE_IMPLIES(FormulaSymbol.IMPLIES, Sign.FALSE, RuleKind.NON_BRANCHING),
    TRUE_IFF(FormulaSymbol.IFF, Sign.TRUE, RuleKind.BRANCHING),
    FALSE_IFF(FormulaSymbol.IFF, Sign.FALSE, RuleKind.BRANCHING);

    private final FormulaSymbol symbol;
    private final Sign sign;
    private final RuleKind kind;

    InferenceRule(FormulaSymbol symbol, Sign sign, RuleKind kind) {
        this.symbol = symbol;
        this.sign = sign;
        this.kind = kind;
    }

    public FormulaSymbol getSymbol() {
        return symbol;
    }

    public Sign getSign() {
        return sign;
    }

    public RuleKind getKind() {
        return kind;
    }

    public boolean isBranching() {
        return kind == RuleKind.BRANCHING;
    }

    /**
     * Regola applicabile a una formula con segno non atomica.
     *
     * @param signed formula con segno il cui simbolo principale è un connettivo
     * @return la regola corrispondente
     * @throws IllegalArgumentException se la formula è atomica
     */
    public static InferenceRule forFormula(SignedFormula signed) {
        boolean positive = signed.getSign() == Sign.TRUE;
        return switch (signed.getFormula().getSymbol()) {
            case NOT -> positive ? TRUE_NOT : FALSE_NOT;
            case AND -> positive ? TRUE_AND : FALSE_AND;
            case OR -> positive ? TRUE_OR : FALSE_OR;
            case IMPLIES -> positive ? TRUE_IMPLIES : FALSE_IMPLIES;
            case IFF -> positive ? TRUE_IFF : FALSE_IFF;
            case ATOM -> throw new IllegalArgumentException("Nessuna regola per il letterale " + signed);
        };
    }

    /**
     * Decompone la premessa nelle conclusioni della regola.
     *
     * Per una regola α la lista esterna contiene una sola alternativa, per una
     * regola β un'alternativa per ciascun ramo figlio.
     *
     * @param premise formula (senza segno) a cui applicare la regola
     * @return alternative di conclusioni con segno
     */
    public List<List<SignedFormula>> decompose(PropositionalFormula premise) {
        if (premise.getSymbol() != symbol) {
            throw new IllegalArgumentException("Regola " + this + " non applicabile a " + premise);
        }

        if (symbol == FormulaSymbol.NOT) {
            PropositionalFormula operand = premise.getOperand();
            return List.of(List.of(new SignedFormula(sign.opposite(), operand)));
        }

        PropositionalFormula a = premise.getLeft();
        PropositionalFormula b = premise.getRight();

        return switch (this) {
            case TRUE_AND -> List.of(List.of(assumeTrue(a), assumeTrue(b)));
            case FALSE_AND -> List.of(List.of(assumeFalse(a)), List.of(assumeFalse(b)));
            case TRUE_OR -> List.of(List.of(assumeTrue(a)), List.of(assumeTrue(b)));
            case FALSE_OR -> List.of(List.of(assumeFalse(a), assumeFalse(b)));
            case TRUE_IMPLIES -> List.of(List.of(assumeFalse(a)), List.of(assumeTrue(b)));
            case FALSE_IMPLIES -> List.of(List.of(assumeTrue(a), assumeFalse(b)));
            case TRUE_IFF -> List.of(
                    List.of(assumeTrue(a), assumeTrue(b)),
                    List.of(assumeFalse(a), assumeFalse(b)));
            case FALSE_IFF -> List.of(
                    List.of(assumeTrue(a), assumeFalse(b)),
                    List.of(assumeFalse(a), assumeTrue(b)));
            case TRUE_NOT, FALSE_NOT -> throw new IllegalStateException("Negazione già gestita");
        };
    }
}
