package org.tableaux.rules;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.tableaux.formula.SignedFormula.assumeFalse;
import static org.tableaux.formula.SignedFormula.assumeTrue;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.tableaux.formula.FormulaParser;
import org.tableaux.formula.PropositionalFormula;
import org.tableaux.formula.SignedFormula;

public class InferenceRuleTest {
    private static final PropositionalFormula A = PropositionalFormula.atom("a");
    private static final PropositionalFormula B = PropositionalFormula.atom("b");

    static Stream<Arguments> ruleTable() {
        return Stream.of(
                Arguments.of(assumeTrue(parse("¬a")), InferenceRule.TRUE_NOT,
                        List.of(List.of(assumeFalse(A)))),
                Arguments.of(assumeFalse(parse("¬a")), InferenceRule.FALSE_NOT,
                        List.of(List.of(assumeTrue(A)))),
                Arguments.of(assumeTrue(parse("a & b")), InferenceRule.TRUE_AND,
                        List.of(List.of(assumeTrue(A), assumeTrue(B)))),
                Arguments.of(assumeFalse(parse("a & b")), InferenceRule.FALSE_AND,
                        List.of(List.of(assumeFalse(A)), List.of(assumeFalse(B)))),
                Arguments.of(assumeTrue(parse("a | b")), InferenceRule.TRUE_OR,
                        List.of(List.of(assumeTrue(A)), List.of(assumeTrue(B)))),
                Arguments.of(assumeFalse(parse("a | b")), InferenceRule.FALSE_OR,
                        List.of(List.of(assumeFalse(A), assumeFalse(B)))),
                Arguments.of(assumeTrue(parse("a -> b")), InferenceRule.TRUE_IMPLIES,
                        List.of(List.of(assumeFalse(A)), List.of(assumeTrue(B)))),
                Arguments.of(assumeFalse(parse("a -> b")), InferenceRule.FALSE_IMPLIES,
                        List.of(List.of(assumeTrue(A), assumeFalse(B)))),
                Arguments.of(assumeTrue(parse("a <-> b")), InferenceRule.TRUE_IFF,
                        List.of(List.of(assumeTrue(A), assumeTrue(B)), List.of(assumeFalse(A), assumeFalse(B)))),
                Arguments.of(assumeFalse(parse("a <-> b")), InferenceRule.FALSE_IFF,
                        List.of(List.of(assumeTrue(A), assumeFalse(B)), List.of(assumeFalse(A), assumeTrue(B)))));
    }

    private static PropositionalFormula parse(String text) {
        return FormulaParser.parse(text);
    }

    @ParameterizedTest
    @MethodSource("ruleTable")
    public void testRuleTable(SignedFormula premise, InferenceRule rule, List<List<SignedFormula>> expected) {
        assertThat(InferenceRule.forFormula(premise), is(rule));

        Expansion expansion = InferenceRules.expand(premise);
        assertThat(expansion.getRule(), is(rule));
        assertThat(expansion.getAlternatives(), is(expected));
        assertThat(expansion.getKind(), is(expected.size() == 1 ? RuleKind.NON_BRANCHING : RuleKind.BRANCHING));
        assertThat(rule.isBranching(), is(expected.size() > 1));
    }

    @Test
    public void testLiteralsAreTerminal() {
        Expansion expansion = InferenceRules.expand(assumeFalse(A));
        assertThat(expansion.getKind(), is(RuleKind.TERMINAL));
        assertThat(expansion.getRule(), is(nullValue()));
        assertThat(expansion.getAlternatives(), is(empty()));
        assertThrows(IllegalArgumentException.class, () -> InferenceRule.forFormula(assumeTrue(A)));
    }

    @Test
    public void testConclusionsOnlyForNonBranchingRules() {
        assertThat(InferenceRules.expand(assumeFalse(parse("a | b"))).getConclusions(),
                contains(assumeFalse(A), assumeFalse(B)));
        assertThrows(IllegalStateException.class,
                () -> InferenceRules.expand(assumeTrue(parse("a | b"))).getConclusions());
    }

    @Test
    public void testDecomposeRejectsMismatchedPremise() {
        assertThrows(IllegalArgumentException.class, () -> InferenceRule.TRUE_AND.decompose(parse("a | b")));
    }

    @Test
    public void testConclusionsAreProperSubformulas() {
        PropositionalFormula premise = parse("((¬a) & b) <-> (c | (¬b))");
        for (InferenceRule rule : new InferenceRule[] {InferenceRule.TRUE_IFF, InferenceRule.FALSE_IFF}) {
            for (List<SignedFormula> alternative : rule.decompose(premise)) {
                for (SignedFormula conclusion : alternative) {
                    assertThat(conclusion.getFormula().size() < premise.size(), is(true));
                }
            }
        }
    }
}
