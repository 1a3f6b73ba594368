package org.tableaux.formula;

import org.tableaux.support.Literal;
import org.tableaux.support.Sign;

import java.util.Objects;

/**
 * FORMULA CON SEGNO - Unità su cui operano le regole del tableau
 *
 * Associa a una formula il valore di verità assunto: T(A) afferma che A è vera,
 * F(A) che A è falsa. Una formula con segno su un atomo è un letterale.
 */
public final class SignedFormula {

    private final Sign sign;
    private final PropositionalFormula formula;

    /**
     * @param sign segno assunto (non null)
     * @param formula formula a cui si applica il segno (non null)
     * @throws IllegalArgumentException se un parametro è null
     */
    public SignedFormula(Sign sign, PropositionalFormula formula) {
        if (sign == null || formula == null) {
            throw new IllegalArgumentException("Segno e formula non possono essere null");
        }
        this.sign = sign;
        this.formula = formula;
    }

    public static SignedFormula assumeTrue(PropositionalFormula formula) {
        return new SignedFormula(Sign.TRUE, formula);
    }

    public static SignedFormula assumeFalse(PropositionalFormula formula) {
        return new SignedFormula(Sign.FALSE, formula);
    }

    /**
     * Formula con segno che afferma un letterale: a → T(a), ¬a → F(a).
     */
    public static SignedFormula of(Literal literal) {
        return new SignedFormula(literal.getSign(), PropositionalFormula.atom(literal.getName()));
    }

    public Sign getSign() {
        return sign;
    }

    public PropositionalFormula getFormula() {
        return formula;
    }

    /**
     * @return true se la formula è un atomo, cioè se non è ulteriormente espandibile
     */
    public boolean isLiteral() {
        return formula.isAtom();
    }

    /**
     * @return il letterale corrispondente
     * @throws IllegalStateException se la formula non è atomica
     */
    public Literal toLiteral() {
        if (!isLiteral()) {
            throw new IllegalStateException("Formula con segno non atomica: " + this);
        }
        return Literal.of(formula.getAtom(), sign);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignedFormula)) return false;
        SignedFormula that = (SignedFormula) o;
        return sign == that.sign && formula.equals(that.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sign, formula);
    }

    @Override
    public String toString() {
        return sign.getLabel() + "(" + formula + ")";
    }
}
