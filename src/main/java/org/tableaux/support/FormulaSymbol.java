package org.tableaux.support;

import java.util.List;

/**
 * SIMBOLI DELLA LOGICA PROPOSIZIONALE - Vocabolario chiuso di atomi e connettivi
 *
 * Definisce l'insieme finito dei simboli ammessi nelle formule: variabili atomiche
 * e i cinque connettivi logici. L'insieme non è estendibile, per cui ogni
 * elaborazione sulle formule si esprime con switch esaustivi su questo enum.
 *
 * SIMBOLI SUPPORTATI:
 * • ATOM: variabile proposizionale (arietà 0)
 * • NOT: negazione ¬ (arietà 1)
 * • AND, OR, IMPLIES, IFF: connettivi binari ∧ ∨ → ↔ (arietà 2)
 *
 * Per ogni connettivo sono elencate anche le grafie alternative accettate dal parser
 * (es. "~" e "!" per la negazione), mentre il rendering usa sempre il glifo canonico.
 */
public enum FormulaSymbol {

    ATOM(0, "", List.of()),
    NOT(1, "¬", List.of("¬", "~", "!")),
    AND(2, "∧", List.of("∧", "&", "/\\")),
    OR(2, "∨", List.of("∨", "|", "\\/")),
    IMPLIES(2, "→", List.of("→", "->", ">>")),
    IFF(2, "↔", List.of("↔", "<->"));

    /** Numero di sotto-formule richieste dal simbolo */
    private final int arity;

    /** Glifo usato nel rendering delle formule */
    private final String glyph;

    /** Grafie accettate in input, la prima coincide con il glifo canonico */
    private final List<String> spellings;

    FormulaSymbol(int arity, String glyph, List<String> spellings) {
        this.arity = arity;
        this.glyph = glyph;
        this.spellings = spellings;
    }

    public int getArity() {
        return arity;
    }

    public String getGlyph() {
        return glyph;
    }

    public List<String> getSpellings() {
        return spellings;
    }

    /**
     * @return true per tutti i simboli tranne ATOM
     */
    public boolean isConnective() {
        return this != ATOM;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    /**
     * Applica la funzione di verità del connettivo.
     *
     * Per NOT viene considerato solo il primo argomento, il secondo è ignorato.
     *
     * @param left valore del primo (o unico) operando
     * @param right valore del secondo operando
     * @return valore di verità risultante
     * @throws IllegalStateException se invocato su ATOM
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case NOT -> !left;
            case AND -> left && right;
            case OR -> left || right;
            case IMPLIES -> !left || right;
            case IFF -> left == right;
            case ATOM -> throw new IllegalStateException("ATOM non ha funzione di verità");
        };
    }
}
