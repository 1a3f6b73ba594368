package org.tableaux.formula;

/**
 * ERRORE SINTATTICO - Formula testuale non ben formata
 *
 * Unico tipo di errore del nucleo: sollevato esclusivamente durante il parsing,
 * mai dalla costruzione del tableau o dalla classificazione, che operano su
 * formule già ben formate per costruzione.
 *
 * CAUSE TIPICHE:
 * • Parentesi non bilanciate o di tipo diverso ("(a & b]")
 * • Token non riconosciuto ("a # b")
 * • Operando mancante ("a &", "(¬)")
 * • Più operatori binari allo stesso livello senza parentesi ("a & b | c")
 * • Negazione senza parentesi come operando di un connettivo binario ("~a | b")
 */
public class FormulaSyntaxException extends RuntimeException {

    /** Riga del token che ha causato l'errore (da 1) */
    private final int line;

    /** Colonna del token che ha causato l'errore (da 0) */
    private final int column;

    public FormulaSyntaxException(String message, int line, int column) {
        super("Errore sintattico (riga " + line + ", colonna " + column + "): " + message);
        this.line = line;
        this.column = column;
    }

    public FormulaSyntaxException(String message, int line, int column, Throwable cause) {
        super("Errore sintattico (riga " + line + ", colonna " + column + "): " + message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
