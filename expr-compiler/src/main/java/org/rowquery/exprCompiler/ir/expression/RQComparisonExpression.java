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
import org.apache.calcite.rex.RexNode;
import org.rowquery.exprCompiler.compiler.backend.CompiledElementCache;
import org.rowquery.exprCompiler.compiler.backend.JsonDecoder;
import org.rowquery.exprCompiler.compiler.errors.DeserializationError;
import org.rowquery.exprCompiler.compiler.errors.InternalCompilerError;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.exprCompiler.runtime.DataRow;
import org.rowquery.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** Compares two values of the same type. */
public final class RQComparisonExpression extends RQExpression {
    public final RQComparisonOpcode opcode;
    public final RQExpression left;
    public final RQExpression right;

    public RQComparisonExpression(RQComparisonOpcode opcode, RQExpression left, RQExpression right) {
        super(RQType.BOOL);
        if (left.getType() != right.getType())
            throw new InternalCompilerError("Comparing values of different types " +
                    left.getType() + " and " + right.getType());
        this.opcode = opcode;
        this.left = left;
        this.right = right;
        this.createId();
    }

    @Override
    public List<RQExpression> getComponents() {
        return List.of(this.left, this.right);
    }

    @Override
    protected String idAttributes() {
        return "opcode=" + this.opcode.name();
    }

    @Nullable
    @Override
    public RexNode toCompiled(CompiledElementCache cache) {
        RexNode left = cache.get(this.left);
        RexNode right = cache.get(this.right);
        if (left == null || right == null)
            return null;
        return cache.getRexBuilder().makeCall(this.opcode.sqlOperator, left, right);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void evaluate(DataRow row) {
        Comparable<Object> left = (Comparable<Object>) row.get(this.left);
        Object right = row.get(this.right);
        row.set(this, this.opcode.holds(left.compareTo(right)));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.left)
                .append(" ")
                .append(this.opcode.toString())
                .append(" ")
                .append(this.right);
    }

    @Override
    protected void addJsonProperties(ObjectNode node) {
        node.put("opcode", this.opcode.name());
    }

    @SuppressWarnings("unused")
    public static RQComparisonExpression fromJson(
            JsonNode node, List<RQExpression> components, JsonDecoder decoder) {
        RQComparisonOpcode opcode = RQComparisonOpcode.fromJson(node);
        if (components.size() != 2)
            throw new DeserializationError("Comparison needs 2 components, got " + components.size());
        try {
            return new RQComparisonExpression(opcode, components.get(0), components.get(1));
        } catch (InternalCompilerError ex) {
            throw new DeserializationError(ex.getMessage(), ex);
        }
    }
}
