package org.tableaux.tableaux;

import org.tableaux.formula.SignedFormula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * TABLEAU - Insieme esaustivo dei rami completamente espansi di una radice
 *
 * Ogni formula non atomica di ogni ramo aperto è stata espansa: il tableau è
 * chiuso (tutti i rami chiusi) se e solo se le formule della radice non sono
 * simultaneamente soddisfacibili.
 */
public final class Tableaux {

    private final List<SignedFormula> roots;
    private final List<Branch> branches;
    private final TableauxStatistics statistics;

    Tableaux(List<SignedFormula> roots, List<Branch> branches, TableauxStatistics statistics) {
        this.roots = List.copyOf(roots);
        this.branches = List.copyOf(branches);
        this.statistics = statistics;
    }

    public List<SignedFormula> getRoots() {
        return roots;
    }

    public List<Branch> getBranches() {
        return branches;
    }

    public TableauxStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return true se tutti i rami sono chiusi
     */
    public boolean isClosed() {
        return branches.stream().allMatch(Branch::isClosed);
    }

    public List<Branch> getOpenBranches() {
        return branches.stream().filter(Branch::isOpen).collect(Collectors.toList());
    }

    public List<Branch> getClosedBranches() {
        return branches.stream().filter(Branch::isClosed).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Tableau ").append(roots).append(isClosed() ? " [CHIUSO]" : " [APERTO]").append('\n');
        for (int i = 0; i < branches.size(); i++) {
            sb.append("  ramo ").append(i + 1).append(": ").append(branches.get(i)).append('\n');
        }
        return sb.toString();
    }
}
