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
import org.rowquery.util.Utilities;

import java.util.List;

/** Reference to a column of the input row. */
public final class RQColumnReference extends RQExpression {
    public final int index;
    public final String name;

    public RQColumnReference(int index, String name, RQType type) {
        super(type);
        Utilities.enforce(index >= 0, "Negative column index " + index);
        this.index = index;
        this.name = name;
        this.createId();
    }

    @Override
    public List<RQExpression> getComponents() {
        return List.of();
    }

    @Override
    protected String idAttributes() {
        return "index=" + this.index + ",name=" + this.name;
    }

    @Override
    public RexNode toCompiled(CompiledElementCache cache) {
        return cache.getRexBuilder().makeInputRef(cache.toRelType(this.type), this.index);
    }

    @Override
    public void evaluate(DataRow row) {
        Object value = row.getInput(this.index);
        if (!this.type.accepts(value))
            throw new InternalCompilerError("Column " + this.name + " of type " + this.type +
                    " holds value " + value, this);
        row.set(this, value);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @Override
    protected void addJsonProperties(ObjectNode node) {
        node.put("index", this.index);
        node.put("name", this.name);
    }

    @SuppressWarnings("unused")
    public static RQColumnReference fromJson(
            JsonNode node, List<RQExpression> components, JsonDecoder decoder) {
        if (!components.isEmpty())
            throw new DeserializationError("Column reference with components");
        int index = Utilities.getIntProperty(node, "index");
        if (index < 0)
            throw new DeserializationError("Negative column index " + index);
        String name = Utilities.getStringProperty(node, "name");
        return new RQColumnReference(index, name, RQType.fromJson(node));
    }
}
