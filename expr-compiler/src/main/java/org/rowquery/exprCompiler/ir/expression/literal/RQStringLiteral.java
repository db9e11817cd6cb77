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

package org.rowquery.exprCompiler.ir.expression.literal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.calcite.rex.RexNode;
import org.rowquery.exprCompiler.compiler.backend.CompiledElementCache;
import org.rowquery.exprCompiler.compiler.backend.JsonDecoder;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.util.IIndentStream;
import org.rowquery.util.Utilities;

import java.util.List;

public final class RQStringLiteral extends RQLiteral {
    public final String value;

    public RQStringLiteral(String value) {
        super(RQType.STRING);
        this.value = value;
        this.createId();
    }

    @Override
    public Object getValue() {
        return this.value;
    }

    @Override
    protected String idAttributes() {
        return "value=" + this.value.length() + ":" + this.value;
    }

    @Override
    public RexNode toCompiled(CompiledElementCache cache) {
        return cache.getRexBuilder().makeLiteral(this.value);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(Utilities.singleQuote(this.value));
    }

    @Override
    protected void addJsonProperties(ObjectNode node) {
        node.put("value", this.value);
    }

    @SuppressWarnings("unused")
    public static RQStringLiteral fromJson(JsonNode node, List<RQExpression> components, JsonDecoder decoder) {
        return new RQStringLiteral(Utilities.getStringProperty(node, "value"));
    }
}
