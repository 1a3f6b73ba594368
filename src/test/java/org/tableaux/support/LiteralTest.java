package org.tableaux.support;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class LiteralTest {
    @Test
    public void testContradictoryOnlyForSameVariableOppositePolarity() {
        assertThat(Literal.contradictory(Literal.positive("a"), Literal.negative("a")), is(true));
        assertThat(Literal.contradictory(Literal.negative("a"), Literal.positive("a")), is(true));
        assertThat(Literal.contradictory(Literal.positive("a"), Literal.positive("a")), is(false));
        assertThat(Literal.contradictory(Literal.positive("a"), Literal.negative("b")), is(false));
    }

    @Test
    public void testNegateIsInvolution() {
        Literal literal = Literal.negative("x1");
        assertThat(literal.negate(), is(Literal.positive("x1")));
        assertThat(literal.negate().negate(), is(literal));
        assertThat(literal.isComplementaryTo(literal.negate()), is(true));
    }

    @Test
    public void testOfSign() {
        assertThat(Literal.of("a", Sign.TRUE), is(Literal.positive("a")));
        assertThat(Literal.of("a", Sign.FALSE), is(Literal.negative("a")));
        assertThat(Literal.negative("a").getSign(), is(Sign.FALSE));
    }

    @Test
    public void testToString() {
        assertThat(Literal.positive("a").toString(), is("a"));
        assertThat(Literal.negative("a").toString(), is("¬a"));
    }

    @Test
    public void testOrderingByNameThenPolarity() {
        List<Literal> literals = new ArrayList<>(List.of(
                Literal.positive("b"), Literal.positive("a"), Literal.negative("a")));
        Collections.sort(literals);
        assertThat(literals, contains(Literal.negative("a"), Literal.positive("a"), Literal.positive("b")));
    }

    @Test
    public void testSatisfaction() {
        Map<String, Boolean> assignment = Map.of("a", true, "b", false);
        assertThat(Literal.positive("a").isSatisfiedBy(assignment), is(true));
        assertThat(Literal.negative("b").isSatisfiedBy(assignment), is(true));
        assertThat(Literal.negative("a").isSatisfiedBy(assignment), is(false));
        assertThrows(IllegalArgumentException.class, () -> Literal.positive("c").isSatisfiedBy(assignment));
    }

    @Test
    public void testBlankNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> Literal.positive(" "));
        assertThrows(IllegalArgumentException.class, () -> new Literal(null, true));
    }
}
