package org.tableaux.classifier;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import org.junit.jupiter.api.Test;
import org.tableaux.formula.FormulaParser;
import org.tableaux.support.Literal;

public class ConjunctiveClauseTest {
    private static final Literal A = Literal.positive("a");
    private static final Literal NOT_B = Literal.negative("b");
    private static final Literal C = Literal.positive("c");

    @Test
    public void testEqualityIgnoresOrderAndDuplicates() {
        ConjunctiveClause clause = new ConjunctiveClause(List.of(A, NOT_B, A));
        assertThat(clause.size(), is(2));
        assertThat(clause.getLiterals(), contains(A, NOT_B));
        assertThat(clause, is(ConjunctiveClause.of(NOT_B, A)));
        assertThat(clause.hashCode(), is(ConjunctiveClause.of(NOT_B, A).hashCode()));
        assertThat(clause.toString(), is("[a, ¬b]"));
    }

    @Test
    public void testSubsumption() {
        ConjunctiveClause small = ConjunctiveClause.of(A);
        ConjunctiveClause large = ConjunctiveClause.of(NOT_B, A, C);
        assertThat(small.subsumes(large), is(true));
        assertThat(large.subsumes(small), is(false));
        assertThat(small.subsumes(small), is(true));
        assertThat(ConjunctiveClause.of(C).subsumes(ConjunctiveClause.of(A, NOT_B)), is(false));
    }

    @Test
    public void testSatisfactionAndVariables() {
        ConjunctiveClause clause = ConjunctiveClause.of(C, NOT_B);
        assertThat(clause.isSatisfiedBy(Map.of("b", false, "c", true)), is(true));
        assertThat(clause.isSatisfiedBy(Map.of("b", true, "c", true)), is(false));
        assertThat(clause.variables(), contains("b", "c"));
        assertThat(clause.contains(NOT_B), is(true));
        assertThat(clause.contains(NOT_B.negate()), is(false));
    }

    @Test
    public void testImmutableInputs() {
        ConjunctiveClause fromVarargs = ConjunctiveClause.of(A, NOT_B);
        ConjunctiveClause fromList = new ConjunctiveClause(List.of(A, NOT_B));
        assertThat(fromVarargs.getLiterals(), contains(A, NOT_B));
        assertThat(fromList, is(fromVarargs));
        assertThat(ConjunctiveClause.of().size(), is(0));
    }

    @Test
    public void testNullLiteralsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ConjunctiveClause(null));
        assertThrows(IllegalArgumentException.class, () -> ConjunctiveClause.of(A, null));
        assertThrows(IllegalArgumentException.class, () -> new ConjunctiveClause(Arrays.asList(A, null)));
    }

    @Test
    public void testVerdictRejectsInconsistentExplanations() {
        List<SortedSet<String>> noCauses = List.of();
        Verdict tautology = Verdict.tautology(FormulaParser.parse("a | (¬a)"), noCauses);
        assertThat(tautology.getTrueOn().isEmpty(), is(true));
        assertThat(tautology.getType().getDescription(), is("tautologia"));

        assertThrows(IllegalArgumentException.class, () -> Verdict.contingency(null, List.of(), List.of()));
    }

    @Test
    public void testConfigurationValidation() {
        ClassifierConfiguration defaults = ClassifierConfiguration.defaults();
        assertThat(defaults.isFirstCauseLevelOnly(), is(false));
        assertThat(defaults.getMaxCauseSearchAtoms(), is(ClassifierConfiguration.DEFAULT_MAX_CAUSE_SEARCH_ATOMS));
        assertThat(defaults.withFirstCauseLevelOnly(true).isFirstCauseLevelOnly(), is(true));
        assertThrows(IllegalArgumentException.class, () -> defaults.withMaxCauseSearchAtoms(0));
    }
}
