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
import org.rowquery.exprCompiler.runtime.DataRow;
import org.rowquery.exprCompiler.runtime.RuntimeFunction;
import org.rowquery.util.IIndentStream;
import org.rowquery.util.Linq;
import org.rowquery.util.Utilities;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/** Call of a {@link RuntimeFunction}.  Such calls have no relational
 * equivalent, so any predicate that contains one is evaluated in-process. */
public final class RQFunctionCall extends RQExpression {
    public final RuntimeFunction function;
    private final ImmutableList<RQExpression> arguments;

    public RQFunctionCall(RuntimeFunction function, List<RQExpression> arguments) {
        super(function.resultType);
        this.function = function;
        this.arguments = ImmutableList.copyOf(arguments);
        this.createId();
    }

    public RQFunctionCall(RuntimeFunction function, RQExpression... arguments) {
        this(function, Arrays.asList(arguments));
    }

    @Override
    public List<RQExpression> getComponents() {
        return this.arguments;
    }

    @Override
    protected String idAttributes() {
        return "function=" + this.function.name + "#" + this.function.id;
    }

    @Nullable
    @Override
    public RexNode toCompiled(CompiledElementCache cache) {
        return null;
    }

    @Override
    public void evaluate(DataRow row) {
        List<Object> values = Linq.map(this.arguments, row::get);
        Object result = this.function.apply(values);
        if (!this.type.accepts(result))
            throw new InternalCompilerError("Function " + this.function.name + " returned " + result +
                    ", expected a value of type " + this.type, this);
        row.set(this, result);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.function.name)
                .append("(")
                .joinI(", ", this.arguments)
                .append(")");
    }

    @Override
    protected void addJsonProperties(ObjectNode node) {
        node.put("function", this.function.name);
    }

    @SuppressWarnings("unused")
    public static RQFunctionCall fromJson(
            JsonNode node, List<RQExpression> components, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "function");
        RuntimeFunction function = decoder.functions.lookup(name);
        if (function == null)
            throw new DeserializationError("Unknown function " + Utilities.singleQuote(name));
        return new RQFunctionCall(function, components);
    }
}
