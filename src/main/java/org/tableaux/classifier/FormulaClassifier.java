package org.tableaux.classifier;

import org.tableaux.formula.FormulaParser;
import org.tableaux.formula.PropositionalFormula;
import org.tableaux.formula.SignedFormula;
import org.tableaux.tableaux.Tableaux;
import org.tableaux.tableaux.TableauxBuilder;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CLASSIFICATORE - Tautologia, contraddizione o contingenza con il metodo dei tableaux
 *
 * Costruisce due tableaux per la formula f:
 * 1. F(f): se tutti i rami sono chiusi nessun assegnamento rende f falsa → tautologia
 * 2. T(f): se tutti i rami sono chiusi nessun assegnamento rende f vera → contraddizione
 * 3. Altrimenti f è contingente
 *
 * SPIEGAZIONE DEL VERDETTO:
 * • Tautologia/contraddizione: cause minime ({@link MinimalCauseFinder})
 * • Contingenza: clausole true-on dai rami aperti di T(f) e false-on dai rami aperti
 *   di F(f), minimizzate ({@link WitnessExtractor})
 *
 * Ogni chiamata è sincrona e priva di effetti collaterali: i tableaux costruiti sono
 * scartati dopo l'estrazione del verdetto.
 */
public class FormulaClassifier {

    private static final Logger LOGGER = Logger.getLogger(FormulaClassifier.class.getName());

    private final TableauxBuilder builder;
    private final ClassifierConfiguration configuration;
    private final MinimalCauseFinder causeFinder;
    private final WitnessExtractor witnessExtractor;

    //region COSTRUZIONE

    public FormulaClassifier() {
        this(ClassifierConfiguration.defaults());
    }

    /**
     * @param configuration parametri della ricerca delle cause (non null)
     * @throws IllegalArgumentException se la configurazione è null
     */
    public FormulaClassifier(ClassifierConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione del classificatore non può essere null");
        }
        this.configuration = configuration;
        this.builder = new TableauxBuilder();
        this.causeFinder = new MinimalCauseFinder(builder, configuration);
        this.witnessExtractor = new WitnessExtractor(builder);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Classifica una formula e ne calcola la spiegazione.
     *
     * @param formula formula ben formata (non null)
     * @return verdetto con cause minime o clausole testimone
     */
    public Verdict classify(PropositionalFormula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da classificare non può essere null");
        }
        LOGGER.fine("Classificazione di " + formula + " con " + configuration);

        FormulaTableaux tableaux = tableaux(formula);
        VerdictType type = tableaux.getVerdictType();

        Verdict verdict = switch (type) {
            case TAUTOLOGY -> Verdict.tautology(formula, causeFinder.findMinimalCauses(formula, type));
            case CONTRADICTION -> Verdict.contradiction(formula, causeFinder.findMinimalCauses(formula, type));
            case CONTINGENCY -> Verdict.contingency(formula,
                    witnessExtractor.extract(formula, tableaux.getTrueTableaux()),
                    witnessExtractor.extract(formula, tableaux.getFalseTableaux()));
        };

        LOGGER.info("Formula " + formula + " classificata come " + type.getDescription());
        return verdict;
    }

    /**
     * Analizza e classifica una formula testuale.
     *
     * @throws org.tableaux.formula.FormulaSyntaxException se il testo non è ben formato
     */
    public Verdict classify(String text) {
        return classify(FormulaParser.parse(text));
    }

    /**
     * Solo lo stato logico, senza spiegazione.
     */
    public VerdictType status(PropositionalFormula formula) {
        return tableaux(formula).getVerdictType();
    }

    /**
     * Costruisce entrambi i tableaux della formula: F(f) e T(f).
     *
     * @param formula formula ben formata
     * @return coppia di tableaux con lo stato logico derivato
     * @throws IllegalStateException se entrambi i tableaux risultano chiusi
     */
    public FormulaTableaux tableaux(PropositionalFormula formula) {
        Tableaux falseTableaux = builder.build(SignedFormula.assumeFalse(formula));
        Tableaux trueTableaux = builder.build(SignedFormula.assumeTrue(formula));

        if (falseTableaux.isClosed() && trueTableaux.isClosed()) {
            // Impossibile per un tableau corretto: ogni assegnamento rende f vera o falsa
            IllegalStateException error = new IllegalStateException(
                    "Tableaux incoerenti: " + formula + " risulta sia tautologia che contraddizione");
            LOGGER.log(Level.SEVERE, "Errore nella costruzione dei tableaux", error);
            throw error;
        }
        return new FormulaTableaux(formula, falseTableaux, trueTableaux);
    }

    public ClassifierConfiguration getConfiguration() {
        return configuration;
    }

    //endregion

    //region COPPIA DI TABLEAUX

    /**
     * Tableaux della formula assunta falsa e assunta vera.
     */
    public static final class FormulaTableaux {

        private final PropositionalFormula formula;
        private final Tableaux falseTableaux;
        private final Tableaux trueTableaux;

        FormulaTableaux(PropositionalFormula formula, Tableaux falseTableaux, Tableaux trueTableaux) {
            this.formula = formula;
            this.falseTableaux = falseTableaux;
            this.trueTableaux = trueTableaux;
        }

        public PropositionalFormula getFormula() {
            return formula;
        }

        /** @return tableau di F(f), chiuso per le tautologie */
        public Tableaux getFalseTableaux() {
            return falseTableaux;
        }

        /** @return tableau di T(f), chiuso per le contraddizioni */
        public Tableaux getTrueTableaux() {
            return trueTableaux;
        }

        public VerdictType getVerdictType() {
            if (falseTableaux.isClosed()) {
                return VerdictType.TAUTOLOGY;
            }
            if (trueTableaux.isClosed()) {
                return VerdictType.CONTRADICTION;
            }
            return VerdictType.CONTINGENCY;
        }
    }

    //endregion
}
