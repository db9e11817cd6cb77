package org.rowquery.exprCompiler.ir.expression;

import org.rowquery.exprCompiler.compiler.errors.InternalCompilerError;
import org.rowquery.exprCompiler.ir.expression.literal.RQBoolLiteral;
import org.rowquery.exprCompiler.ir.expression.literal.RQI64Literal;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class CompoundPredicateTests {
    static RQColumnReference column(int index) {
        return new RQColumnReference(index, "c" + index, RQType.BOOL);
    }

    /** Flattening computed directly on the arguments, for comparison. */
    static void flatten(RQLogicalOperator operator, List<RQExpression> operands, List<RQExpression> result) {
        for (RQExpression operand: operands) {
            if (operand instanceof RQCompoundPredicate compound && compound.operator == operator)
                flatten(operator, compound.getComponents(), result);
            else
                result.add(operand);
        }
    }

    @Test
    public void flattenNestedAnd() {
        RQExpression a = column(0);
        RQExpression b = column(1);
        RQExpression c = column(2);
        RQExpression d = column(3);
        RQCompoundPredicate inner = RQCompoundPredicate.and(a, b);
        RQCompoundPredicate outer = RQCompoundPredicate.and(inner, c, RQCompoundPredicate.and(d, a));
        Assert.assertEquals(List.of(a, b, c, d, a), outer.getComponents());
        // The inner predicate is not modified
        Assert.assertEquals(List.of(a, b), inner.getComponents());
    }

    @Test
    public void flattenDeep() {
        RQExpression current = column(0);
        List<RQExpression> expected = new ArrayList<>();
        expected.add(current);
        for (int i = 1; i < 20; i++) {
            RQExpression next = column(i);
            expected.add(next);
            current = RQCompoundPredicate.or(current, next);
        }
        Assert.assertEquals(expected, current.getComponents());
        for (RQExpression component: current.getComponents())
            Assert.assertFalse(component.isCompound(RQLogicalOperator.OR));
    }

    @Test
    public void mixedOperatorsAreNotFlattened() {
        RQExpression a = column(0);
        RQExpression b = column(1);
        RQExpression c = column(2);
        RQCompoundPredicate or = RQCompoundPredicate.or(a, b);
        RQCompoundPredicate and = RQCompoundPredicate.and(or, c);
        Assert.assertEquals(2, and.getComponents().size());
        Assert.assertSame(or, and.getComponents().get(0));

        RQCompoundPredicate not = RQCompoundPredicate.not(RQCompoundPredicate.not(a));
        Assert.assertEquals(1, not.getComponents().size());
        Assert.assertTrue(not.getComponents().get(0).isCompound(RQLogicalOperator.NOT));
    }

    @Test
    public void flattenMatchesReference() {
        RQExpression a = column(0);
        RQExpression b = column(1);
        RQExpression c = column(2);
        List<RQExpression> operands = List.of(
                RQCompoundPredicate.and(a, RQCompoundPredicate.or(b, c)),
                RQCompoundPredicate.not(a),
                RQCompoundPredicate.and(RQCompoundPredicate.and(b, c), a),
                c);
        for (RQLogicalOperator operator: List.of(RQLogicalOperator.AND, RQLogicalOperator.OR)) {
            RQCompoundPredicate predicate = new RQCompoundPredicate(operator, operands);
            List<RQExpression> expected = new ArrayList<>();
            flatten(operator, operands, expected);
            Assert.assertEquals(expected, predicate.getComponents());
        }
    }

    @Test
    public void arity() {
        RQExpression a = column(0);
        RQExpression b = column(1);
        Assert.assertThrows(InternalCompilerError.class,
                () -> new RQCompoundPredicate(RQLogicalOperator.NOT, List.of()));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new RQCompoundPredicate(RQLogicalOperator.NOT, List.of(a, b)));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new RQCompoundPredicate(RQLogicalOperator.AND, List.of(a)));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new RQCompoundPredicate(RQLogicalOperator.OR, List.of()));
        Assert.assertEquals(2, RQCompoundPredicate.and(a, b).getComponents().size());
        Assert.assertEquals(1, RQCompoundPredicate.not(a).getComponents().size());
    }

    @Test
    public void operandsMustBeBoolean() {
        RQExpression x = new RQColumnReference(0, "x", RQType.INT64);
        RQExpression s = new RQColumnReference(1, "s", RQType.STRING);
        RQExpression f = column(2);
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class,
                () -> RQCompoundPredicate.and(x, f));
        Assert.assertTrue(error.getMessage().contains("not boolean"));
        Assert.assertThrows(InternalCompilerError.class, () -> RQCompoundPredicate.or(f, s));
        Assert.assertThrows(InternalCompilerError.class, () -> RQCompoundPredicate.not(s));
        Assert.assertThrows(InternalCompilerError.class, () -> RQCompoundPredicate.not(new RQI64Literal(1)));
        Assert.assertThrows(InternalCompilerError.class,
                () -> RQCompoundPredicate.makeConjunction(List.of(f, new RQI64Literal(0))));
        // Boolean-valued operands of any kind are accepted
        RQExpression cmp = new RQComparisonExpression(RQComparisonOpcode.EQ, x, new RQI64Literal(1));
        Assert.assertEquals(2, RQCompoundPredicate.and(cmp, new RQBoolLiteral(false)).getComponents().size());
    }

    @Test
    public void makeConjunction() {
        RQExpression a = column(0);
        RQExpression b = column(1);
        Assert.assertNull(RQCompoundPredicate.makeConjunction(List.of()));
        Assert.assertSame(a, RQCompoundPredicate.makeConjunction(List.of(a)));
        RQExpression both = RQCompoundPredicate.makeConjunction(List.of(a, b));
        Assert.assertNotNull(both);
        Assert.assertTrue(both.isCompound(RQLogicalOperator.AND));
        Assert.assertNull(RQCompoundPredicate.makeDisjunction(List.of()));
        Assert.assertSame(b, RQCompoundPredicate.makeDisjunction(List.of(b)));
    }

    @Test
    public void structuralIdentity() {
        RQExpression a = column(0);
        RQExpression b = column(1);
        RQCompoundPredicate ab = RQCompoundPredicate.and(a, b);
        RQCompoundPredicate ab2 = RQCompoundPredicate.and(column(0), column(1));
        RQCompoundPredicate ba = RQCompoundPredicate.and(b, a);
        RQCompoundPredicate orAb = RQCompoundPredicate.or(a, b);
        Assert.assertTrue(ab.sameStructure(ab2));
        Assert.assertEquals(ab.getStructuralId(), ab2.getStructuralId());
        Assert.assertFalse(ab.sameStructure(ba));
        Assert.assertFalse(ab.sameStructure(orAb));
        // Nesting does not matter after flattening
        RQCompoundPredicate nested = RQCompoundPredicate.and(RQCompoundPredicate.and(a, b), column(2));
        RQCompoundPredicate flat = RQCompoundPredicate.and(a, b, column(2));
        Assert.assertTrue(nested.sameStructure(flat));
        Assert.assertFalse(new RQI64Literal(1).sameStructure(new RQBoolLiteral(true)));
    }

    @Test
    public void render() {
        RQExpression a = column(0);
        RQExpression b = column(1);
        RQExpression c = column(2);
        Assert.assertEquals("(c0) & (c1)", RQCompoundPredicate.and(a, b).toString());
        Assert.assertEquals("(c0) | (c1) | (c2)", RQCompoundPredicate.or(a, b, c).toString());
        Assert.assertEquals("~(c0)", RQCompoundPredicate.not(a).toString());
        Assert.assertEquals("((c0) | (c1)) & (~(c2))",
                RQCompoundPredicate.and(RQCompoundPredicate.or(a, b), RQCompoundPredicate.not(c)).toString());
    }

    @Test
    public void literalRendering() {
        RQExpression x = new RQColumnReference(0, "x", RQType.INT64);
        RQExpression cmp = new RQComparisonExpression(RQComparisonOpcode.GT, x, new RQI64Literal(5));
        Assert.assertEquals("(x > 5) & (true)",
                RQCompoundPredicate.and(cmp, new RQBoolLiteral(true)).toString());
    }
}
