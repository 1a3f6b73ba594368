package org.tableaux.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.tableaux.antlr.LogicFormulaLexer;
import org.tableaux.antlr.LogicFormulaParser;

import java.util.logging.Logger;

/**
 * PARSER FORMULE - Punto di ingresso testuale del nucleo
 *
 * Coordina la pipeline ANTLR completa: Lexing -> Parsing -> Visitor -> PropositionalFormula.
 * La grammatica LogicFormula non definisce precedenze: ogni livello di parentesi
 * contiene al più un operatore binario, per cui l'input deve essere esplicitamente
 * parentesizzato dal chiamante.
 *
 * GESTIONE ERRORI:
 * • I listener di default di ANTLR (stampa su console e recupero) sono rimossi
 * • Ogni errore di lexer o parser interrompe subito l'analisi con FormulaSyntaxException
 * • Nessun errore viene recuperato silenziosamente
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Analizza una formula in notazione infissa.
     *
     * @param text formula testuale (non null)
     * @return albero della formula
     * @throws FormulaSyntaxException se il testo non è una formula ben formata
     * @throws IllegalArgumentException se il testo è null
     */
    public static PropositionalFormula parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }
        LOGGER.fine("Parsing formula: " + text);

        // Setup pipeline ANTLR
        CharStream input = CharStreams.fromString(text);
        LogicFormulaLexer lexer = new LogicFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        // Parsing e conversione
        ParseTree tree = parser.formula();
        PropositionalFormula formula = new FormulaTreeBuilder().visit(tree);

        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    /**
     * Listener che trasforma ogni segnalazione ANTLR in FormulaSyntaxException.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        private static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new FormulaSyntaxException(msg, line, charPositionInLine, e);
        }
    }
}
