package org.rowquery.exprCompiler.compiler.backend;

import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.SqlKind;
import org.rowquery.exprCompiler.ir.expression.RQColumnReference;
import org.rowquery.exprCompiler.ir.expression.RQComparisonExpression;
import org.rowquery.exprCompiler.ir.expression.RQComparisonOpcode;
import org.rowquery.exprCompiler.ir.expression.RQCompoundPredicate;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.exprCompiler.ir.expression.RQFunctionCall;
import org.rowquery.exprCompiler.ir.expression.literal.RQI64Literal;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.exprCompiler.runtime.RuntimeFunction;
import org.junit.Assert;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

public class CompiledElementCacheTests {
    final RQExpression a = new RQColumnReference(0, "a", RQType.BOOL);
    final RQExpression b = new RQColumnReference(1, "b", RQType.BOOL);
    final RQExpression x = new RQColumnReference(2, "x", RQType.INT64);
    final RuntimeFunction isEven = new RuntimeFunction("is_even", RQType.BOOL,
            args -> ((Long) args.get(0)) % 2 == 0);

    @Test
    public void columnReference() {
        CompiledElementCache cache = new CompiledElementCache();
        RexNode node = cache.get(this.x);
        Assert.assertNotNull(node);
        Assert.assertTrue(node instanceof RexInputRef);
        Assert.assertEquals(2, ((RexInputRef) node).getIndex());
        Assert.assertEquals("BIGINT", node.getType().getSqlTypeName().getName());
    }

    @Test
    public void connectors() {
        CompiledElementCache cache = new CompiledElementCache();
        RQExpression c = new RQComparisonExpression(RQComparisonOpcode.LT, this.x, new RQI64Literal(10));

        RexNode and = cache.get(RQCompoundPredicate.and(this.a, this.b, c));
        Assert.assertNotNull(and);
        Assert.assertEquals(SqlKind.AND, and.getKind());
        Assert.assertEquals(3, ((RexCall) and).getOperands().size());
        Assert.assertEquals(SqlKind.LESS_THAN, ((RexCall) and).getOperands().get(2).getKind());

        RexNode or = cache.get(RQCompoundPredicate.or(this.a, this.b));
        Assert.assertNotNull(or);
        Assert.assertEquals(SqlKind.OR, or.getKind());
        Assert.assertEquals(2, ((RexCall) or).getOperands().size());

        RexNode not = cache.get(RQCompoundPredicate.not(this.a));
        Assert.assertNotNull(not);
        Assert.assertEquals(SqlKind.NOT, not.getKind());
        Assert.assertEquals(1, ((RexCall) not).getOperands().size());
    }

    @Test
    public void nestedConnectors() {
        CompiledElementCache cache = new CompiledElementCache();
        RexNode node = cache.get(RQCompoundPredicate.and(
                RQCompoundPredicate.or(this.a, this.b), RQCompoundPredicate.not(this.b)));
        Assert.assertNotNull(node);
        Assert.assertEquals(SqlKind.AND, node.getKind());
        RexCall call = (RexCall) node;
        Assert.assertEquals(SqlKind.OR, call.getOperands().get(0).getKind());
        Assert.assertEquals(SqlKind.NOT, call.getOperands().get(1).getKind());
    }

    @Test
    public void fallback() {
        CompiledElementCache cache = new CompiledElementCache();
        RQExpression even = new RQFunctionCall(this.isEven, this.x);
        Assert.assertNull(cache.get(even));
        Assert.assertNull(cache.get(RQCompoundPredicate.and(this.a, even)));
        Assert.assertNull(cache.get(RQCompoundPredicate.or(even, this.b)));
        Assert.assertNull(cache.get(RQCompoundPredicate.not(even)));
        Assert.assertNull(cache.get(RQCompoundPredicate.and(this.a, RQCompoundPredicate.not(even))));
        // Components are still translated
        Assert.assertNotNull(cache.get(this.a));
        Assert.assertTrue(cache.contains(this.b));
    }

    @Test
    public void memoization() {
        CompiledElementCache cache = new CompiledElementCache();
        RQCompoundPredicate and = RQCompoundPredicate.and(this.a, this.b);
        RexNode first = cache.get(and);
        int size = cache.size();
        Assert.assertEquals(3, size);
        RexNode second = cache.get(RQCompoundPredicate.and(
                new RQColumnReference(0, "a", RQType.BOOL),
                new RQColumnReference(1, "b", RQType.BOOL)));
        Assert.assertSame(first, second);
        Assert.assertEquals(size, cache.size());
    }

    @Test
    public void absentResultIsMemoized() {
        AtomicInteger calls = new AtomicInteger();
        CompiledElementCache cache = new CompiledElementCache();
        RQExpression even = new RQFunctionCall(new RuntimeFunction("f", RQType.BOOL, args -> {
            calls.incrementAndGet();
            return true;
        }), this.x);
        Assert.assertNull(cache.get(even));
        Assert.assertTrue(cache.contains(even));
        int size = cache.size();
        Assert.assertNull(cache.get(even));
        Assert.assertEquals(size, cache.size());
        Assert.assertEquals(0, calls.get());
    }
}
