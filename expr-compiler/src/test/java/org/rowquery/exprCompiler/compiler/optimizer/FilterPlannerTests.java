package org.rowquery.exprCompiler.compiler.optimizer;

import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.sql.SqlKind;
import org.rowquery.exprCompiler.compiler.backend.CompiledElementCache;
import org.rowquery.exprCompiler.compiler.errors.InternalCompilerError;
import org.rowquery.exprCompiler.ir.expression.RQColumnReference;
import org.rowquery.exprCompiler.ir.expression.RQComparisonExpression;
import org.rowquery.exprCompiler.ir.expression.RQComparisonOpcode;
import org.rowquery.exprCompiler.ir.expression.RQCompoundPredicate;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.exprCompiler.ir.expression.RQFunctionCall;
import org.rowquery.exprCompiler.ir.expression.RQLogicalOperator;
import org.rowquery.exprCompiler.ir.expression.literal.RQI64Literal;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.exprCompiler.runtime.RuntimeFunction;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Objects;

public class FilterPlannerTests {
    final RQExpression a = new RQColumnReference(0, "a", RQType.BOOL);
    final RQExpression b = new RQColumnReference(1, "b", RQType.BOOL);
    final RQExpression x = new RQColumnReference(2, "x", RQType.INT64);
    final RQExpression small = new RQComparisonExpression(RQComparisonOpcode.LT, this.x, new RQI64Literal(5));
    final RQExpression odd = new RQFunctionCall(
            new RuntimeFunction("odd", RQType.BOOL, args -> (Long) args.get(0) % 2 != 0), this.x);

    FilterPlan plan(RQExpression filter) {
        return new FilterPlanner(new CompiledElementCache()).plan(filter);
    }

    @Test
    public void fullyPushed() {
        RQExpression filter = RQCompoundPredicate.and(this.a, this.small);
        FilterPlan plan = this.plan(filter);
        Assert.assertTrue(plan.isFullyPushed());
        Assert.assertNull(plan.residual());
        Assert.assertEquals(SqlKind.AND, Objects.requireNonNull(plan.sqlWhere()).getKind());

        plan = this.plan(RQCompoundPredicate.or(this.a, RQCompoundPredicate.not(this.b)));
        Assert.assertTrue(plan.isFullyPushed());
        Assert.assertEquals(SqlKind.OR, Objects.requireNonNull(plan.sqlWhere()).getKind());
    }

    @Test
    public void partiallyPushed() {
        RQExpression filter = RQCompoundPredicate.and(this.a, this.odd, this.small);
        FilterPlan plan = this.plan(filter);
        Assert.assertFalse(plan.isFullyPushed());
        Assert.assertSame(this.odd, plan.residual());
        RexCall where = (RexCall) Objects.requireNonNull(plan.sqlWhere());
        Assert.assertEquals(SqlKind.AND, where.getKind());
        Assert.assertEquals(2, where.getOperands().size());
        Assert.assertEquals(SqlKind.LESS_THAN, where.getOperands().get(1).getKind());
    }

    @Test
    public void singleConjunctPushed() {
        RQExpression other = new RQFunctionCall(
                new RuntimeFunction("even", RQType.BOOL, args -> (Long) args.get(0) % 2 == 0), this.x);
        FilterPlan plan = this.plan(RQCompoundPredicate.and(this.a, this.odd, other));
        Assert.assertTrue(plan.sqlWhere() instanceof RexInputRef);
        RQExpression residual = plan.residual();
        Assert.assertNotNull(residual);
        Assert.assertTrue(residual.isCompound(RQLogicalOperator.AND));
        Assert.assertEquals(List.of(this.odd, other), residual.getComponents());
    }

    @Test
    public void nothingPushed() {
        RQExpression or = RQCompoundPredicate.or(this.a, this.odd);
        FilterPlan plan = this.plan(or);
        Assert.assertNull(plan.sqlWhere());
        Assert.assertSame(or, plan.residual());

        RQExpression not = RQCompoundPredicate.not(this.odd);
        plan = this.plan(not);
        Assert.assertNull(plan.sqlWhere());
        Assert.assertSame(not, plan.residual());

        plan = this.plan(this.odd);
        Assert.assertNull(plan.sqlWhere());
        Assert.assertSame(this.odd, plan.residual());
    }

    @Test
    public void notBoolean() {
        Assert.assertThrows(InternalCompilerError.class, () -> this.plan(this.x));
    }
}
