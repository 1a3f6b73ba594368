package org.tableaux.formula;

import org.tableaux.support.FormulaSymbol;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile della logica proposizionale
 *
 * Rappresenta una formula come albero etichettato da {@link FormulaSymbol}: le foglie
 * sono variabili atomiche, i nodi interni sono negazioni (un operando) o connettivi
 * binari (due operandi). La formula è costruita una sola volta, dal parser o per
 * composizione programmatica, e non viene più modificata: tutte le elaborazioni
 * successive (tableau, classificazione) sono attraversamenti in sola lettura.
 *
 * OPERAZIONI PRINCIPALI:
 * • atoms(): insieme ordinato delle variabili referenziate
 * • toString(): rendering infisso completamente parentesizzato, ri-parsabile
 * • render(Notation): rendering infisso, prefisso o postfisso
 * • without(Set): rimozione di variabili con semplificazione del connettivo
 * • evaluate(Map): valutazione rispetto a un assegnamento totale
 *
 * INVARIANTI:
 * • Numero di operandi pari all'arietà del simbolo
 * • Nessun operando null, nessun ciclo (costruzione bottom-up)
 * • Uguaglianza strutturale
 */
public final class PropositionalFormula {

    private static final Logger LOGGER = Logger.getLogger(PropositionalFormula.class.getName());

    /** Nomi ammessi per le variabili, coincidenti con il token IDENTIFIER della grammatica */
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    //region STRUTTURA DATI

    /** Simbolo del nodo corrente */
    private final FormulaSymbol symbol;

    /** Nome della variabile atomica (solo per nodi ATOM) */
    private final String atom;

    /** Operandi del nodo, in numero pari all'arietà del simbolo */
    private final List<PropositionalFormula> operands;

    /** Cache dell'hash strutturale, l'albero è immutabile */
    private final int hash;

    //endregion

    //region COSTRUTTORI E FACTORY

    private PropositionalFormula(FormulaSymbol symbol, String atom, List<PropositionalFormula> operands) {
        this.symbol = symbol;
        this.atom = atom;
        this.operands = operands;
        this.hash = Objects.hash(symbol, atom, operands);
    }

    /**
     * Costruisce nodo foglia per variabile atomica.
     *
     * @param name nome della variabile proposizionale, stessa forma dei token IDENTIFIER
     * @throws IllegalArgumentException se il nome è null o non è un identificatore valido
     */
    public static PropositionalFormula atom(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Nome variabile atomica non valido: '" + name
                    + "' (atteso [A-Za-z_][A-Za-z0-9_]*)");
        }
        return new PropositionalFormula(FormulaSymbol.ATOM, name, List.of());
    }

    /**
     * Costruisce nodo unario di negazione.
     *
     * @param operand sotto-formula da negare (non null)
     * @throws IllegalArgumentException se operand è null
     */
    public static PropositionalFormula not(PropositionalFormula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new PropositionalFormula(FormulaSymbol.NOT, null, List.of(operand));
    }

    public static PropositionalFormula and(PropositionalFormula left, PropositionalFormula right) {
        return binary(FormulaSymbol.AND, left, right);
    }

    public static PropositionalFormula or(PropositionalFormula left, PropositionalFormula right) {
        return binary(FormulaSymbol.OR, left, right);
    }

    public static PropositionalFormula implies(PropositionalFormula left, PropositionalFormula right) {
        return binary(FormulaSymbol.IMPLIES, left, right);
    }

    public static PropositionalFormula iff(PropositionalFormula left, PropositionalFormula right) {
        return binary(FormulaSymbol.IFF, left, right);
    }

    /**
     * Costruisce nodo binario per un connettivo di arietà 2.
     *
     * @param symbol connettivo binario (AND, OR, IMPLIES, IFF)
     * @param left operando sinistro (non null)
     * @param right operando destro (non null)
     * @throws IllegalArgumentException se il simbolo non è binario o un operando è null
     */
    public static PropositionalFormula binary(FormulaSymbol symbol, PropositionalFormula left, PropositionalFormula right) {
        if (symbol == null || !symbol.isBinary()) {
            throw new IllegalArgumentException("Simbolo deve essere un connettivo binario, ricevuto: " + symbol);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi del connettivo " + symbol + " non possono essere null");
        }
        return new PropositionalFormula(symbol, null, List.of(left, right));
    }

    /**
     * Analizza una formula testuale. Scorciatoia per {@link FormulaParser#parse(String)}.
     *
     * @throws FormulaSyntaxException se il testo non è una formula ben formata
     */
    public static PropositionalFormula parse(String text) {
        return FormulaParser.parse(text);
    }

    //endregion

    //region ACCESSORI

    public FormulaSymbol getSymbol() {
        return symbol;
    }

    /**
     * @return nome della variabile, null per i nodi non atomici
     */
    public String getAtom() {
        return atom;
    }

    public List<PropositionalFormula> getOperands() {
        return operands;
    }

    /**
     * @return unico operando di una negazione
     * @throws IllegalStateException se il nodo non è una negazione
     */
    public PropositionalFormula getOperand() {
        if (symbol != FormulaSymbol.NOT) {
            throw new IllegalStateException("Operando singolo disponibile solo per NOT, nodo: " + symbol);
        }
        return operands.get(0);
    }

    public PropositionalFormula getLeft() {
        requireBinary();
        return operands.get(0);
    }

    public PropositionalFormula getRight() {
        requireBinary();
        return operands.get(1);
    }

    private void requireBinary() {
        if (!symbol.isBinary()) {
            throw new IllegalStateException("Operandi sinistro/destro disponibili solo per connettivi binari, nodo: " + symbol);
        }
    }

    public boolean isAtom() {
        return symbol == FormulaSymbol.ATOM;
    }

    //endregion

    //region ANALISI STRUTTURALE

    /**
     * Raccoglie le variabili atomiche distinte raggiungibili dalla formula.
     *
     * @return insieme ordinato e non modificabile dei nomi di variabile
     */
    public SortedSet<String> atoms() {
        SortedSet<String> collected = new TreeSet<>();
        collectAtoms(collected);
        return Collections.unmodifiableSortedSet(collected);
    }

    private void collectAtoms(Set<String> collected) {
        if (symbol == FormulaSymbol.ATOM) {
            collected.add(atom);
            return;
        }
        for (PropositionalFormula operand : operands) {
            operand.collectAtoms(collected);
        }
    }

    /**
     * Numero di connettivi presenti nella formula.
     * Ogni regola del tableau lo riduce strettamente, da cui la terminazione.
     */
    public int size() {
        int count = symbol.isConnective() ? 1 : 0;
        for (PropositionalFormula operand : operands) {
            count += operand.size();
        }
        return count;
    }

    /**
     * Profondità dell'albero (un atomo ha profondità 0).
     */
    public int depth() {
        int max = 0;
        for (PropositionalFormula operand : operands) {
            max = Math.max(max, operand.depth() + 1);
        }
        return max;
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta la formula rispetto a un assegnamento delle sue variabili.
     *
     * @param assignment valore di verità per ogni variabile della formula
     * @return valore di verità della formula
     * @throws IllegalArgumentException se una variabile della formula non è assegnata
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return switch (symbol) {
            case ATOM -> {
                Boolean value = assignment.get(atom);
                if (value == null) {
                    throw new IllegalArgumentException("Variabile non assegnata: " + atom);
                }
                yield value;
            }
            case NOT -> !operands.get(0).evaluate(assignment);
            case AND, OR, IMPLIES, IFF -> symbol.apply(
                    operands.get(0).evaluate(assignment),
                    operands.get(1).evaluate(assignment));
        };
    }

    //endregion

    //region RIMOZIONE VARIABILI

    /**
     * Rimuove dalla formula ogni sotto-albero le cui variabili appartengono tutte
     * all'insieme indicato, semplificando il connettivo che lo racchiude.
     *
     * POLITICA DI SEMPLIFICAZIONE:
     * • A ∧ ∅, A ∨ ∅, A ↔ ∅ (e simmetrici) → A
     * • ∅ → B → B (antecedente rimosso, letto come vero)
     * • A → ∅ → ¬A (conseguente rimosso, letto come falso)
     * • ¬∅ → ∅
     *
     * Il connettivo diventa così una funzione del solo operando superstite.
     *
     * @param variables nomi delle variabili da rimuovere
     * @return formula ridotta, vuoto se l'intera formula è stata rimossa
     */
    public Optional<PropositionalFormula> without(Set<String> variables) {
        if (variables == null) {
            throw new IllegalArgumentException("Insieme di variabili da rimuovere non può essere null");
        }
        PropositionalFormula reduced = removeVariables(variables);
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Rimozione " + variables + " da " + this + " -> "
                    + (reduced == null ? "formula rimossa" : reduced.toString()));
        }
        return Optional.ofNullable(reduced);
    }

    /**
     * @return formula ridotta, null se completamente rimossa
     */
    private PropositionalFormula removeVariables(Set<String> variables) {
        return switch (symbol) {
            case ATOM -> variables.contains(atom) ? null : this;

            case NOT -> {
                PropositionalFormula operand = operands.get(0);
                PropositionalFormula reducedOperand = operand.removeVariables(variables);
                if (reducedOperand == null) {
                    yield null;
                }
                yield reducedOperand == operand ? this : not(reducedOperand);
            }

            case AND, OR, IMPLIES, IFF -> {
                PropositionalFormula left = operands.get(0);
                PropositionalFormula right = operands.get(1);
                PropositionalFormula reducedLeft = left.removeVariables(variables);
                PropositionalFormula reducedRight = right.removeVariables(variables);

                if (reducedLeft == null && reducedRight == null) {
                    yield null;
                } else if (reducedLeft == null) {
                    yield reducedRight;
                } else if (reducedRight == null) {
                    // Conseguente rimosso: A → falso ≡ ¬A
                    yield symbol == FormulaSymbol.IMPLIES ? not(reducedLeft) : reducedLeft;
                } else if (reducedLeft == left && reducedRight == right) {
                    yield this;
                } else {
                    yield binary(symbol, reducedLeft, reducedRight);
                }
            }
        };
    }

    //endregion

    //region RENDERING

    /**
     * Rendering nella notazione richiesta usando i glifi canonici.
     *
     * @param notation notazione di output
     * @return rappresentazione testuale deterministica
     */
    public String render(Notation notation) {
        StringBuilder builder = new StringBuilder();
        appendTo(builder, notation);
        return builder.toString();
    }

    private void appendTo(StringBuilder builder, Notation notation) {
        switch (symbol) {
            case ATOM -> builder.append(atom);

            case NOT -> {
                PropositionalFormula operand = operands.get(0);
                switch (notation) {
                    case INFIX -> {
                        builder.append('(').append(symbol.getGlyph());
                        operand.appendTo(builder, notation);
                        builder.append(')');
                    }
                    case PREFIX -> {
                        builder.append(symbol.getGlyph());
                        operand.appendTo(builder, notation);
                    }
                    case POSTFIX -> {
                        operand.appendTo(builder, notation);
                        builder.append(symbol.getGlyph());
                    }
                }
            }

            case AND, OR, IMPLIES, IFF -> {
                PropositionalFormula left = operands.get(0);
                PropositionalFormula right = operands.get(1);
                switch (notation) {
                    case INFIX -> {
                        builder.append('(');
                        left.appendTo(builder, notation);
                        builder.append(' ').append(symbol.getGlyph()).append(' ');
                        right.appendTo(builder, notation);
                        builder.append(')');
                    }
                    case PREFIX -> {
                        builder.append(symbol.getGlyph()).append(' ');
                        left.appendTo(builder, notation);
                        builder.append(' ');
                        right.appendTo(builder, notation);
                    }
                    case POSTFIX -> {
                        left.appendTo(builder, notation);
                        builder.append(' ');
                        right.appendTo(builder, notation);
                        builder.append(' ').append(symbol.getGlyph());
                    }
                }
            }
        }
    }

    /**
     * Rendering infisso completamente parentesizzato: il risultato, ri-analizzato
     * dal parser, produce una formula strutturalmente uguale.
     */
    @Override
    public String toString() {
        return render(Notation.INFIX);
    }

    //endregion

    //region UGUAGLIANZA STRUTTURALE

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropositionalFormula)) return false;
        PropositionalFormula that = (PropositionalFormula) o;
        return hash == that.hash
                && symbol == that.symbol
                && Objects.equals(atom, that.atom)
                && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    //endregion
}
