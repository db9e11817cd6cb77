package org.rowquery.exprCompiler.ir.expression;

import org.rowquery.exprCompiler.ir.type.RQType;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Set;

public class SplitConjunctsTests {
    final RQExpression a = new RQColumnReference(0, "a", RQType.BOOL);
    final RQExpression b = new RQColumnReference(1, "b", RQType.BOOL);
    final RQExpression c = new RQColumnReference(2, "c", RQType.BOOL);

    @Test
    public void splitAnd() {
        RQCompoundPredicate predicate = RQCompoundPredicate.and(this.a, this.b, this.c);
        Set<RQExpression> accepted = Set.of(this.a, this.b);
        SplitConjuncts split = predicate.splitConjuncts(accepted::contains);
        Assert.assertEquals(List.of(this.a, this.b), split.matches());
        // A single remaining conjunct is not wrapped
        Assert.assertSame(this.c, split.remainder());
        Assert.assertEquals(List.of(this.a, this.b, this.c), predicate.getComponents());
    }

    @Test
    public void splitKeepsOrder() {
        RQCompoundPredicate predicate = RQCompoundPredicate.and(this.a, this.b, this.c);
        SplitConjuncts split = predicate.splitConjuncts(e -> e == this.b);
        Assert.assertEquals(List.of(this.b), split.matches());
        RQExpression remainder = split.remainder();
        Assert.assertNotNull(remainder);
        Assert.assertTrue(remainder.isCompound(RQLogicalOperator.AND));
        Assert.assertEquals(List.of(this.a, this.c), remainder.getComponents());
    }

    @Test
    public void splitAll() {
        RQCompoundPredicate predicate = RQCompoundPredicate.and(this.a, this.b);
        SplitConjuncts split = predicate.splitConjuncts(e -> true);
        Assert.assertEquals(List.of(this.a, this.b), split.matches());
        Assert.assertNull(split.remainder());

        split = predicate.splitConjuncts(e -> false);
        Assert.assertTrue(split.matches().isEmpty());
        Assert.assertNotNull(split.remainder());
        Assert.assertTrue(predicate.sameStructure(split.remainder()));
    }

    @Test
    public void orAndNotAreNotSplit() {
        RQCompoundPredicate or = RQCompoundPredicate.or(this.a, this.b);
        SplitConjuncts split = or.splitConjuncts(e -> true);
        Assert.assertTrue(split.matches().isEmpty());
        Assert.assertSame(or, split.remainder());

        RQCompoundPredicate not = RQCompoundPredicate.not(this.a);
        split = not.splitConjuncts(e -> true);
        Assert.assertTrue(split.matches().isEmpty());
        Assert.assertSame(not, split.remainder());
    }

    @Test
    public void leafIsNotSplit() {
        SplitConjuncts split = this.a.splitConjuncts(e -> true);
        Assert.assertTrue(split.matches().isEmpty());
        Assert.assertSame(this.a, split.remainder());
    }
}
