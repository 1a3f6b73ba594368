package org.tableaux.classifier;

import org.tableaux.formula.PropositionalFormula;
import org.tableaux.formula.SignedFormula;
import org.tableaux.support.Literal;
import org.tableaux.support.Sign;
import org.tableaux.tableaux.Branch;
import org.tableaux.tableaux.Tableaux;
import org.tableaux.tableaux.TableauxBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * ESTRAZIONE TESTIMONI - Clausole congiuntive minime per formule contingenti
 *
 * Ogni ramo aperto del tableau T(f) (risp. F(f)) descrive una congiunzione di
 * letterali sotto cui f è vera (risp. falsa). Le clausole vengono poi ridotte:
 *
 * MINIMIZZAZIONE:
 * • Un letterale viene scartato se i restanti bastano ancora a fissare il valore
 *   di f, cioè se il tableau del segno opposto di f, con i letterali restanti
 *   alla radice, è chiuso
 * • La sufficienza è monotona rispetto all'aggiunta di letterali, per cui un solo
 *   passaggio ordinato produce una clausola senza sottoinsiemi propri sufficienti
 *
 * SUSSUNZIONE:
 * • Clausole duplicate e clausole che contengono strettamente un'altra clausola
 *   vengono eliminate, preservando l'ordine dei rami
 */
final class WitnessExtractor {

    private static final Logger LOGGER = Logger.getLogger(WitnessExtractor.class.getName());

    private final TableauxBuilder builder;

    WitnessExtractor(TableauxBuilder builder) {
        this.builder = builder;
    }

    /**
     * Estrae le clausole testimone dai rami aperti di un tableau.
     *
     * @param formula formula contingente
     * @param tableaux tableau di T(formula) per le clausole true-on, di F(formula) per le false-on
     * @return clausole minime, prive di duplicati e di clausole sussunte
     */
    List<ConjunctiveClause> extract(PropositionalFormula formula, Tableaux tableaux) {
        Sign forcedValue = tableaux.getRoots().get(0).getSign();

        List<ConjunctiveClause> minimized = new ArrayList<>();
        for (Branch branch : tableaux.getOpenBranches()) {
            ConjunctiveClause clause = minimize(formula, branch.getLiterals(), forcedValue);
            LOGGER.finest(() -> "Ramo " + branch.getLiterals() + " ridotto a " + clause);
            minimized.add(clause);
        }

        List<ConjunctiveClause> result = removeSubsumed(minimized);
        LOGGER.fine("Clausole " + (forcedValue == Sign.TRUE ? "true-on" : "false-on") + " per "
                + formula + ": " + result);
        return result;
    }

    //region MINIMIZZAZIONE

    private ConjunctiveClause minimize(PropositionalFormula formula, List<Literal> literals, Sign forcedValue) {
        List<Literal> current = new ArrayList<>(literals);
        for (Literal literal : literals) {
            List<Literal> candidate = new ArrayList<>(current);
            candidate.remove(literal);
            if (forces(formula, candidate, forcedValue)) {
                current = candidate;
            }
        }
        return new ConjunctiveClause(current);
    }

    /**
     * Verifica se i letterali bastano a fissare il valore di verità della formula:
     * il tableau che assume il valore opposto insieme ai letterali deve chiudersi.
     */
    private boolean forces(PropositionalFormula formula, List<Literal> literals, Sign forcedValue) {
        List<SignedFormula> roots = new ArrayList<>();
        roots.add(new SignedFormula(forcedValue.opposite(), formula));
        for (Literal literal : literals) {
            roots.add(SignedFormula.of(literal));
        }
        return builder.build(roots).isClosed();
    }

    //endregion

    //region SUSSUNZIONE

    private static List<ConjunctiveClause> removeSubsumed(List<ConjunctiveClause> clauses) {
        List<ConjunctiveClause> kept = new ArrayList<>();
        for (int i = 0; i < clauses.size(); i++) {
            ConjunctiveClause clause = clauses.get(i);
            boolean redundant = false;
            for (int j = 0; j < clauses.size() && !redundant; j++) {
                if (i == j) continue;
                ConjunctiveClause other = clauses.get(j);
                if (other.subsumes(clause)) {
                    // A parità di insieme si conserva solo la prima occorrenza
                    redundant = other.size() < clause.size() || j < i;
                }
            }
            if (!redundant) {
                kept.add(clause);
            }
        }
        return kept;
    }

    //endregion
}
