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

package org.rowquery.exprCompiler.compiler.backend;

import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeSystem;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.type.SqlTypeFactoryImpl;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.util.HashString;
import org.rowquery.util.IWritesLogs;
import org.rowquery.util.Logger;
import org.rowquery.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Translates expressions to Calcite relational expressions, memoizing
 * the result for each structurally distinct expression.
 *
 * <p>Expressions without a relational equivalent translate to null;
 * this is remembered as well, and is not an error: such expressions are
 * evaluated in-process instead.  Not thread-safe. */
public class CompiledElementCache implements IWritesLogs {
    private final RexBuilder rexBuilder;
    /** Values may be null. */
    private final Map<HashString, RexNode> compiled = new HashMap<>();

    public CompiledElementCache(RexBuilder rexBuilder) {
        this.rexBuilder = rexBuilder;
    }

    public CompiledElementCache() {
        this(new RexBuilder(new SqlTypeFactoryImpl(RelDataTypeSystem.DEFAULT)));
    }

    public RexBuilder getRexBuilder() {
        return this.rexBuilder;
    }

    public RelDataType toRelType(RQType type) {
        return type.toRelType(this.rexBuilder.getTypeFactory());
    }

    /** The relational form of 'expression', or null if it has none. */
    @Nullable
    public RexNode get(RQExpression expression) {
        HashString id = expression.getStructuralId();
        if (this.compiled.containsKey(id))
            return this.compiled.get(id);
        RexNode result = expression.toCompiled(this);
        if (result == null)
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Evaluated in-process: ")
                    .append(expression)
                    .newline();
        this.compiled.put(id, result);
        return result;
    }

    /** True if the translation of 'expression' has been computed, successfully or not. */
    public boolean contains(RQExpression expression) {
        return this.compiled.containsKey(expression.getStructuralId());
    }

    public int size() {
        return this.compiled.size();
    }

    public RexNode and(List<RexNode> operands) {
        Utilities.enforce(operands.size() > 1, "AND needs at least 2 operands");
        return this.rexBuilder.makeCall(SqlStdOperatorTable.AND, operands);
    }

    public RexNode or(List<RexNode> operands) {
        Utilities.enforce(operands.size() > 1, "OR needs at least 2 operands");
        return this.rexBuilder.makeCall(SqlStdOperatorTable.OR, operands);
    }

    public RexNode not(RexNode operand) {
        return this.rexBuilder.makeCall(SqlStdOperatorTable.NOT, operand);
    }
}
