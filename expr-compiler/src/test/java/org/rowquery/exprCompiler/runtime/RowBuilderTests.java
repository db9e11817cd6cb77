package org.rowquery.exprCompiler.runtime;

import org.rowquery.exprCompiler.compiler.errors.InternalCompilerError;
import org.rowquery.exprCompiler.ir.expression.RQColumnReference;
import org.rowquery.exprCompiler.ir.expression.RQComparisonExpression;
import org.rowquery.exprCompiler.ir.expression.RQComparisonOpcode;
import org.rowquery.exprCompiler.ir.expression.RQCompoundPredicate;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.exprCompiler.ir.expression.RQFunctionCall;
import org.rowquery.exprCompiler.ir.expression.literal.RQI64Literal;
import org.rowquery.exprCompiler.ir.expression.literal.RQStringLiteral;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class RowBuilderTests {
    static RQColumnReference bool(int index) {
        return new RQColumnReference(index, "b" + index, RQType.BOOL);
    }

    static Object evaluate(RQExpression expression, Object... row) {
        RowBuilder builder = new RowBuilder(expression);
        return builder.evaluate(Arrays.asList(row)).get(0);
    }

    @Test
    public void not() {
        Assert.assertEquals(false, evaluate(RQCompoundPredicate.not(bool(0)), true));
        Assert.assertEquals(true, evaluate(RQCompoundPredicate.not(bool(0)), false));
    }

    @Test
    public void and() {
        RQExpression and = RQCompoundPredicate.and(bool(0), bool(1), bool(2));
        RowBuilder builder = new RowBuilder(and);
        Assert.assertEquals(List.of(false), builder.evaluate(List.of(true, true, false)));
        Assert.assertEquals(List.of(true), builder.evaluate(List.of(true, true, true)));
        Assert.assertEquals(List.of(false), builder.evaluate(List.of(false, true, true)));
    }

    @Test
    public void or() {
        RQExpression or = RQCompoundPredicate.or(bool(0), bool(1), bool(2));
        RowBuilder builder = new RowBuilder(or);
        Assert.assertEquals(List.of(true), builder.evaluate(List.of(false, false, true)));
        Assert.assertEquals(List.of(false), builder.evaluate(List.of(false, false, false)));
    }

    @Test
    public void everyComponentIsEvaluated() {
        AtomicInteger calls = new AtomicInteger();
        RuntimeFunction positive = new RuntimeFunction("positive", RQType.BOOL, args -> {
            calls.incrementAndGet();
            return (Long) args.get(0) > 0;
        });
        RQExpression x = new RQColumnReference(1, "x", RQType.INT64);
        RQExpression and = RQCompoundPredicate.and(bool(0), new RQFunctionCall(positive, x));
        RowBuilder builder = new RowBuilder(and);
        Assert.assertEquals(List.of(false), builder.evaluate(List.of(false, 5L)));
        Assert.assertEquals(1, calls.get());
        Assert.assertEquals(List.of(true), builder.evaluate(List.of(true, 5L)));
        Assert.assertEquals(2, calls.get());

        RQExpression or = RQCompoundPredicate.or(
                new RQColumnReference(0, "t", RQType.BOOL),
                new RQFunctionCall(positive, new RQColumnReference(1, "y", RQType.INT64)));
        builder = new RowBuilder(or);
        Assert.assertEquals(List.of(true), builder.evaluate(List.of(true, -1L)));
        Assert.assertEquals(3, calls.get());
    }

    @Test
    public void sharedSubexpressions() {
        AtomicInteger calls = new AtomicInteger();
        RuntimeFunction odd = new RuntimeFunction("odd", RQType.BOOL, args -> {
            calls.incrementAndGet();
            return (Long) args.get(0) % 2 != 0;
        });
        RQExpression first = new RQFunctionCall(odd, new RQColumnReference(0, "x", RQType.INT64));
        RQExpression second = new RQFunctionCall(odd, new RQColumnReference(0, "x", RQType.INT64));
        RQExpression contradiction = RQCompoundPredicate.and(first, RQCompoundPredicate.not(second));
        RowBuilder builder = new RowBuilder(contradiction);
        // x, odd(x), ~odd(x), and the conjunction
        Assert.assertEquals(4, builder.getSlotCount());
        Assert.assertEquals(first.getSlotIndex(), second.getSlotIndex());
        Assert.assertEquals(List.of(false), builder.evaluate(List.of(3L)));
        Assert.assertEquals(1, calls.get());
    }

    @Test
    public void functionsWithTheSameName() {
        RuntimeFunction positive = new RuntimeFunction("check", RQType.BOOL, args -> (Long) args.get(0) > 0);
        RuntimeFunction negative = new RuntimeFunction("check", RQType.BOOL, args -> (Long) args.get(0) < 0);
        RQExpression first = new RQFunctionCall(positive, new RQColumnReference(0, "x", RQType.INT64));
        RQExpression second = new RQFunctionCall(negative, new RQColumnReference(0, "x", RQType.INT64));
        Assert.assertFalse(first.sameStructure(second));
        Assert.assertTrue(first.sameStructure(
                new RQFunctionCall(positive, new RQColumnReference(0, "x", RQType.INT64))));
        RQExpression or = RQCompoundPredicate.or(first, second);
        RowBuilder builder = new RowBuilder(or);
        // x, both calls, and the disjunction
        Assert.assertEquals(4, builder.getSlotCount());
        Assert.assertNotEquals(first.getSlotIndex(), second.getSlotIndex());
        Assert.assertEquals(List.of(true), builder.evaluate(List.of(-2L)));
        Assert.assertEquals(List.of(true), builder.evaluate(List.of(2L)));
        Assert.assertEquals(List.of(false), builder.evaluate(List.of(0L)));
    }

    @Test
    public void componentsHaveSmallerSlots() {
        RQExpression a = bool(0);
        RQExpression b = bool(1);
        RQCompoundPredicate or = RQCompoundPredicate.or(a, b);
        RQCompoundPredicate and = RQCompoundPredicate.and(RQCompoundPredicate.not(a), or);
        RowBuilder builder = new RowBuilder(and);
        Assert.assertEquals(5, builder.getSlotCount());
        Assert.assertEquals(4, and.getSlotIndex());
        for (RQExpression component: and.getComponents())
            Assert.assertTrue(component.getSlotIndex() < and.getSlotIndex());
        Assert.assertTrue(a.getSlotIndex() < or.getSlotIndex());
        Assert.assertTrue(b.getSlotIndex() < or.getSlotIndex());
    }

    @Test
    public void multipleOutputs() {
        RQExpression x = new RQColumnReference(0, "x", RQType.INT64);
        RQExpression name = new RQColumnReference(1, "name", RQType.STRING);
        RQExpression big = new RQComparisonExpression(RQComparisonOpcode.GTE, x, new RQI64Literal(100));
        RQExpression isBob = new RQComparisonExpression(RQComparisonOpcode.EQ, name, new RQStringLiteral("bob"));
        RowBuilder builder = new RowBuilder(big);
        int slot = builder.addOutput(RQCompoundPredicate.or(big, isBob));
        Assert.assertEquals(slot, builder.getSlotCount() - 1);
        Assert.assertEquals(2, builder.getOutputs().size());
        Assert.assertEquals(List.of(false, true), builder.evaluate(List.of(10L, "bob")));
        Assert.assertEquals(List.of(true, true), builder.evaluate(List.of(100L, "alice")));
        Assert.assertEquals(List.of(false, false), builder.evaluate(List.of(99L, "alice")));
    }

    @Test
    public void rowBuffer() {
        RQExpression a = bool(0);
        RQExpression not = RQCompoundPredicate.not(a);
        RowBuilder builder = new RowBuilder(not);
        DataRow row = builder.createRow(List.of(true));
        Assert.assertEquals(2, row.getSlotCount());
        Assert.assertFalse(row.has(not));
        builder.eval(row);
        Assert.assertTrue(row.has(a));
        Assert.assertFalse(row.getBoolean(not));
        row.clear();
        Assert.assertFalse(row.has(not));
    }

    @Test
    public void slotCannotMove() {
        RQExpression a = bool(0);
        new RowBuilder(RQCompoundPredicate.not(a));
        Assert.assertEquals(0, a.getSlotIndex());
        Assert.assertThrows(InternalCompilerError.class,
                () -> new RowBuilder(RQCompoundPredicate.and(bool(1), a)));
    }

    @Test
    public void badInputs() {
        RowBuilder builder = new RowBuilder(RQCompoundPredicate.not(bool(0)));
        Assert.assertThrows(InternalCompilerError.class, () -> builder.evaluate(List.of(1L)));
        Assert.assertThrows(InternalCompilerError.class, () -> builder.evaluate(List.of()));
        Assert.assertThrows(InternalCompilerError.class, () -> builder.evaluate(Arrays.asList((Object) null)));
    }
}
