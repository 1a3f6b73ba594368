package org.tableaux.tableaux;

import org.tableaux.rules.InferenceRule;

import java.util.EnumMap;
import java.util.Map;

/**
 * STATISTICHE TABLEAU - Metriche di costruzione di un singolo tableau
 *
 * Raccoglie i contatori aggiornati da {@link TableauxBuilder} durante l'espansione:
 * applicazioni di regole α e β, rami prodotti e chiusi, lunghezza massima di un
 * ramo e tempo di costruzione. Usate per il logging e per il driver.
 */
public class TableauxStatistics {

    //region CONTATORI METRICHE CORE

    /** Applicazioni di regole non ramificanti (α) */
    private int alphaApplications = 0;

    /** Applicazioni di regole ramificanti (β) */
    private int betaApplications = 0;

    /** Rami completamente espansi prodotti */
    private int branches = 0;

    /** Rami chiusi per letterali complementari */
    private int closedBranches = 0;

    /** Numero massimo di formule con segno su un singolo ramo */
    private int maxBranchLength = 0;

    /** Applicazioni per singola regola */
    private final Map<InferenceRule, Integer> ruleApplications = new EnumMap<>(InferenceRule.class);

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    /**
     * Inizializza le statistiche avviando immediatamente il timer.
     */
    public TableauxStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region OPERAZIONI DI INCREMENTO CONTATORI

    void recordRule(InferenceRule rule) {
        if (rule.isBranching()) {
            betaApplications++;
        } else {
            alphaApplications++;
        }
        ruleApplications.merge(rule, 1, Integer::sum);
    }

    void recordBranch(Branch branch) {
        branches++;
        if (branch.isClosed()) {
            closedBranches++;
        }
        maxBranchLength = Math.max(maxBranchLength, branch.getEntries().size());
    }

    /**
     * Ferma il timer. Operazione idempotente.
     */
    void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS LETTURA METRICHE

    public int getAlphaApplications() {
        return alphaApplications;
    }

    public int getBetaApplications() {
        return betaApplications;
    }

    public int getBranches() {
        return branches;
    }

    public int getClosedBranches() {
        return closedBranches;
    }

    public int getOpenBranches() {
        return branches - closedBranches;
    }

    public int getMaxBranchLength() {
        return maxBranchLength;
    }

    /**
     * @param rule regola di interesse
     * @return numero di applicazioni della regola (0 se mai applicata)
     */
    public int getApplications(InferenceRule rule) {
        return ruleApplications.getOrDefault(rule, 0);
    }

    /**
     * @return tempo di costruzione in ms (parziale se il timer è ancora attivo)
     */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("Stats[α=%d, β=%d, rami=%d, chiusi=%d, aperti=%d, lunghezzaMax=%d, tempo=%dms]",
                alphaApplications, betaApplications, branches, closedBranches,
                getOpenBranches(), maxBranchLength, getExecutionTimeMs());
    }
}
