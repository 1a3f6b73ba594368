package org.tableaux.formula;

/**
 * Notazioni di rendering supportate da {@link PropositionalFormula#render(Notation)}.
 */
public enum Notation {
    /** (a ∧ (¬b)) - completamente parentesizzata, ri-parsabile */
    INFIX,
    /** ∧ a ¬b */
    PREFIX,
    /** a b¬ ∧ */
    POSTFIX
}
