package org.tableaux.tableaux;

import org.tableaux.formula.SignedFormula;
import org.tableaux.rules.Expansion;
import org.tableaux.rules.InferenceRule;
import org.tableaux.rules.InferenceRules;
import org.tableaux.rules.RuleKind;
import org.tableaux.support.Literal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DEL TABLEAU - Espansione esaustiva di formule con segno
 *
 * Applica ricorsivamente la tabella delle regole fino a quando ogni ramo è chiuso
 * oppure contiene soltanto letterali. La visita è in profondità con uno stack
 * esplicito di rami in corso, per cui la profondità di ricorsione della JVM non
 * dipende dal numero di ramificazioni.
 *
 * STRATEGIA DI ESPANSIONE:
 * • Letterali: aggiunti al ramo con verifica incrementale di chiusura
 * • Regole α: applicate per prime, le conclusioni restano sullo stesso ramo
 * • Regole β: applicate solo quando non restano α, il ramo viene copiato per
 *   ciascuna alternativa (nessuna condivisione mutabile tra rami fratelli)
 * • Un ramo chiuso non viene più espanso
 *
 * TERMINAZIONE:
 * Ogni regola sostituisce una formula con sotto-formule proprie, per cui il numero
 * totale di connettivi in attesa su un ramo decresce strettamente.
 *
 * COMPLESSITÀ:
 * Il numero di rami è esponenziale nel caso pessimo (ogni regola β può raddoppiarli);
 * è una proprietà intrinseca del metodo, non un difetto.
 *
 * INTERRUZIONE:
 * Prima di ogni ramo estratto dallo stack viene controllato il flag di interruzione
 * del thread corrente; se è impostato la costruzione termina con
 * {@link CancellationException}, lasciando il flag invariato.
 */
public final class TableauxBuilder {

    private static final Logger LOGGER = Logger.getLogger(TableauxBuilder.class.getName());

    //region INTERFACCIA PUBBLICA

    /**
     * Costruisce il tableau completo di una singola formula con segno.
     *
     * @param root formula con segno alla radice
     * @return tableau con tutti i rami completamente espansi
     * @throws IllegalArgumentException se la radice è null
     */
    public Tableaux build(SignedFormula root) {
        if (root == null) {
            throw new IllegalArgumentException("La formula alla radice non può essere null");
        }
        return build(List.of(root));
    }

    /**
     * Costruisce il tableau di una congiunzione di formule con segno poste
     * tutte sulla radice (usato anche per verificare clausole testimone).
     *
     * @param roots formule con segno iniziali (lista non vuota)
     * @return tableau con tutti i rami completamente espansi
     * @throws IllegalArgumentException se la lista è null o vuota
     * @throws CancellationException se il thread corrente viene interrotto durante la costruzione
     */
    public Tableaux build(List<SignedFormula> roots) {
        if (roots == null || roots.isEmpty()) {
            throw new IllegalArgumentException("Il tableau richiede almeno una formula alla radice");
        }
        for (SignedFormula root : roots) {
            if (root == null) {
                throw new IllegalArgumentException("Le formule alla radice non possono essere null");
            }
        }

        LOGGER.fine("Costruzione tableau per " + roots);
        TableauxStatistics statistics = new TableauxStatistics();
        List<Branch> completed = new ArrayList<>();

        BranchState initial = new BranchState();
        for (SignedFormula root : roots) {
            initial.accept(root);
        }

        Deque<BranchState> worklist = new ArrayDeque<>();
        worklist.push(initial);

        while (!worklist.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.fine("Costruzione tableau interrotta con " + worklist.size() + " rami in attesa");
                throw new CancellationException("Costruzione del tableau interrotta");
            }
            BranchState state = worklist.pop();
            expandUntilComplete(state, worklist, statistics, completed);
        }

        statistics.stopTimer();
        Tableaux tableaux = new Tableaux(roots, completed, statistics);
        LOGGER.fine("Tableau completato " + (tableaux.isClosed() ? "[CHIUSO] " : "[APERTO] ") + statistics);
        return tableaux;
    }

    //endregion

    //region ESPANSIONE DEL RAMO

    /**
     * Espande un ramo finché non è chiuso, completo, oppure richiede una ramificazione.
     * In quest'ultimo caso le copie figlie vengono inserite nello stack di lavoro
     * in ordine inverso, così da visitare per prima l'alternativa sinistra.
     */
    private void expandUntilComplete(BranchState state, Deque<BranchState> worklist,
                                     TableauxStatistics statistics, List<Branch> completed) {
        while (true) {
            if (state.closingLiteral != null) {
                finish(state, statistics, completed);
                return;
            }

            if (!state.nonBranching.isEmpty()) {
                SignedFormula premise = state.nonBranching.pop();
                Expansion expansion = InferenceRules.expand(premise);
                statistics.recordRule(expansion.getRule());
                for (SignedFormula conclusion : expansion.getConclusions()) {
                    state.accept(conclusion);
                }
                continue;
            }

            if (!state.branching.isEmpty()) {
                SignedFormula premise = state.branching.pop();
                Expansion expansion = InferenceRules.expand(premise);
                statistics.recordRule(expansion.getRule());

                List<List<SignedFormula>> alternatives = expansion.getAlternatives();
                for (int i = alternatives.size() - 1; i >= 0; i--) {
                    BranchState child = state.copy();
                    for (SignedFormula conclusion : alternatives.get(i)) {
                        child.accept(conclusion);
                    }
                    worklist.push(child);
                }
                return;
            }

            finish(state, statistics, completed);
            return;
        }
    }

    private void finish(BranchState state, TableauxStatistics statistics, List<Branch> completed) {
        Branch branch = state.toBranch();
        statistics.recordBranch(branch);
        completed.add(branch);
        LOGGER.finest(() -> "Ramo completato: " + branch);
    }

    //endregion

    //region STATO DEL RAMO IN COSTRUZIONE

    /**
     * Ramo in costruzione: formule incontrate, letterali raggiunti e formule in attesa
     * di espansione, separate per tipo di regola.
     */
    private static final class BranchState {

        private final List<SignedFormula> entries;
        private final Set<Literal> literals;
        private final Deque<SignedFormula> nonBranching;
        private final Deque<SignedFormula> branching;
        private Literal closingLiteral;

        BranchState() {
            this.entries = new ArrayList<>();
            this.literals = new LinkedHashSet<>();
            this.nonBranching = new ArrayDeque<>();
            this.branching = new ArrayDeque<>();
        }

        private BranchState(BranchState other) {
            this.entries = new ArrayList<>(other.entries);
            this.literals = new LinkedHashSet<>(other.literals);
            this.nonBranching = new ArrayDeque<>(other.nonBranching);
            this.branching = new ArrayDeque<>(other.branching);
            this.closingLiteral = other.closingLiteral;
        }

        BranchState copy() {
            return new BranchState(this);
        }

        /**
         * Registra una nuova formula con segno sul ramo, classificandola come
         * letterale, premessa α o premessa β.
         */
        void accept(SignedFormula signed) {
            if (closingLiteral != null) {
                return;
            }
            entries.add(signed);

            RuleKind kind = signed.isLiteral() ? RuleKind.TERMINAL : InferenceRule.forFormula(signed).getKind();
            switch (kind) {
                case TERMINAL -> addLiteral(signed.toLiteral());
                case NON_BRANCHING -> nonBranching.push(signed);
                case BRANCHING -> branching.push(signed);
            }
        }

        /**
         * Aggiunge un letterale verificando subito la chiusura del ramo.
         */
        private void addLiteral(Literal literal) {
            if (literals.contains(literal.negate())) {
                closingLiteral = literal;
            }
            literals.add(literal);
        }

        Branch toBranch() {
            return new Branch(entries, new ArrayList<>(literals), closingLiteral);
        }
    }

    //endregion
}
