/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.rowquery.exprCompiler.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import org.apache.calcite.rex.RexNode;
import org.rowquery.exprCompiler.compiler.backend.CompiledElementCache;
import org.rowquery.exprCompiler.compiler.backend.JsonDecoder;
import org.rowquery.exprCompiler.compiler.errors.DeserializationError;
import org.rowquery.exprCompiler.compiler.errors.InternalCompilerError;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.exprCompiler.runtime.DataRow;
import org.rowquery.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/** A boolean expression combining its components with AND, OR, or NOT.
 *
 * <p>AND and OR nodes are kept flat: a component is never itself a compound
 * predicate with the same operator.  Flattening only re-nests operands,
 * it never removes any, and it does not cross operator boundaries.
 * NOT nodes have exactly one component.  All components are boolean. */
public final class RQCompoundPredicate extends RQExpression {
    public final RQLogicalOperator operator;
    private final ImmutableList<RQExpression> components;

    public RQCompoundPredicate(RQLogicalOperator operator, List<RQExpression> operands) {
        super(RQType.BOOL);
        this.operator = operator;
        for (RQExpression operand: operands) {
            if (Objects.requireNonNull(operand).getType() != RQType.BOOL)
                throw new InternalCompilerError(
                        operator.name() + " operand of type " + operand.getType() + " is not boolean", operand);
        }
        this.components = switch (operator) {
            case NOT -> {
                if (operands.size() != 1)
                    throw new InternalCompilerError(
                            "NOT requires exactly one operand, got " + operands.size());
                yield ImmutableList.of(Objects.requireNonNull(operands.get(0)));
            }
            case AND, OR -> {
                if (operands.size() < 2)
                    throw new InternalCompilerError(
                            operator.name() + " requires at least two operands, got " + operands.size());
                ImmutableList.Builder<RQExpression> builder = ImmutableList.builder();
                for (RQExpression operand: operands)
                    merge(operator, Objects.requireNonNull(operand), builder);
                yield builder.build();
            }
        };
        this.createId();
    }

    /** Add 'operand' to 'builder', absorbing the components of nested
     * compound predicates that use the same operator. */
    static void merge(RQLogicalOperator operator, RQExpression operand,
                      ImmutableList.Builder<RQExpression> builder) {
        if (operand.isCompound(operator)) {
            for (RQExpression child: operand.getComponents())
                merge(operator, child, builder);
        } else {
            builder.add(operand);
        }
    }

    public static RQCompoundPredicate and(RQExpression... operands) {
        return new RQCompoundPredicate(RQLogicalOperator.AND, Arrays.asList(operands));
    }

    public static RQCompoundPredicate or(RQExpression... operands) {
        return new RQCompoundPredicate(RQLogicalOperator.OR, Arrays.asList(operands));
    }

    public static RQCompoundPredicate not(RQExpression operand) {
        return new RQCompoundPredicate(RQLogicalOperator.NOT, List.of(operand));
    }

    /** Combine 'operands' with AND.
     * @return null for an empty list, the operand itself for a single operand. */
    @Nullable
    public static RQExpression makeConjunction(List<RQExpression> operands) {
        return make(RQLogicalOperator.AND, operands);
    }

    /** Combine 'operands' with OR.
     * @return null for an empty list, the operand itself for a single operand. */
    @Nullable
    public static RQExpression makeDisjunction(List<RQExpression> operands) {
        return make(RQLogicalOperator.OR, operands);
    }

    @Nullable
    static RQExpression make(RQLogicalOperator operator, List<RQExpression> operands) {
        if (operands.isEmpty())
            return null;
        if (operands.size() == 1)
            return operands.get(0);
        return new RQCompoundPredicate(operator, operands);
    }

    @Override
    public List<RQExpression> getComponents() {
        return this.components;
    }

    @Override
    public boolean isCompound(RQLogicalOperator operator) {
        return this.operator == operator;
    }

    @Override
    protected String idAttributes() {
        return "operator=" + this.operator.code;
    }

    @Override
    public SplitConjuncts splitConjuncts(Predicate<RQExpression> condition) {
        return switch (this.operator) {
            // Pulling a term out of a disjunction or a negation changes its meaning
            case OR, NOT -> super.splitConjuncts(condition);
            case AND -> {
                List<RQExpression> matches = new ArrayList<>();
                List<RQExpression> others = new ArrayList<>();
                for (RQExpression component: this.components) {
                    if (condition.test(component))
                        matches.add(component);
                    else
                        others.add(component);
                }
                yield new SplitConjuncts(matches, makeConjunction(others));
            }
        };
    }

    @Nullable
    @Override
    public RexNode toCompiled(CompiledElementCache cache) {
        List<RexNode> compiled = new ArrayList<>(this.components.size());
        boolean missing = false;
        for (RQExpression component: this.components) {
            RexNode element = cache.get(component);
            if (element == null)
                missing = true;
            compiled.add(element);
        }
        if (missing)
            return null;
        return switch (this.operator) {
            case NOT -> cache.not(compiled.get(0));
            case AND -> cache.and(compiled);
            case OR -> cache.or(compiled);
        };
    }

    @Override
    public void evaluate(DataRow row) {
        // Every component is read; all of them have already been evaluated.
        boolean result = switch (this.operator) {
            case NOT -> !row.getBoolean(this.components.get(0));
            case AND -> {
                boolean value = true;
                for (RQExpression component: this.components)
                    value &= row.getBoolean(component);
                yield value;
            }
            case OR -> {
                boolean value = false;
                for (RQExpression component: this.components)
                    value |= row.getBoolean(component);
                yield value;
            }
        };
        row.set(this, result);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.operator == RQLogicalOperator.NOT)
            return builder.append("~(")
                    .append(this.components.get(0))
                    .append(")");
        boolean first = true;
        for (RQExpression component: this.components) {
            if (!first)
                builder.append(" ")
                        .append(this.operator.toString())
                        .append(" ");
            first = false;
            builder.append("(").append(component).append(")");
        }
        return builder;
    }

    @Override
    protected void addJsonProperties(ObjectNode node) {
        node.put("operator", this.operator.code);
    }

    @SuppressWarnings("unused")
    public static RQCompoundPredicate fromJson(
            JsonNode node, List<RQExpression> components, JsonDecoder decoder) {
        RQLogicalOperator operator = RQLogicalOperator.fromJson(node);
        try {
            return new RQCompoundPredicate(operator, components);
        } catch (InternalCompilerError ex) {
            throw new DeserializationError(ex.getMessage(), ex);
        }
    }
}
