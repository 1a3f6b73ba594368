package org.tableaux.rules;

import org.tableaux.formula.SignedFormula;

import java.util.logging.Logger;

/**
 * Punto di accesso alla tabella delle regole: funzione totale sulle formule con segno.
 */
public final class InferenceRules {

    private static final Logger LOGGER = Logger.getLogger(InferenceRules.class.getName());

    private InferenceRules() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Espande una formula con segno secondo la tabella delle regole.
     *
     * @param signed formula con segno da espandere
     * @return TERMINAL per i letterali, altrimenti l'espansione α o β della regola applicabile
     */
    public static Expansion expand(SignedFormula signed) {
        if (signed.isLiteral()) {
            return Expansion.terminal();
        }
        InferenceRule rule = InferenceRule.forFormula(signed);
        Expansion expansion = Expansion.of(rule, rule.decompose(signed.getFormula()));
        LOGGER.finest(() -> "Regola " + rule + " su " + signed + " -> " + expansion.getAlternatives());
        return expansion;
    }
}
