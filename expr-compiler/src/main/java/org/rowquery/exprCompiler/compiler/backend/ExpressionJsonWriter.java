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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rowquery.exprCompiler.compiler.visitors.inner.InnerVisitor;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.util.Utilities;

import javax.annotation.Nullable;
import java.util.IdentityHashMap;
import java.util.Map;

/** Serializes a whole expression tree as JSON.
 * Each node contributes its own properties through {@link RQExpression#asJson()};
 * this visitor adds the serialized components of each node under "components". */
public class ExpressionJsonWriter extends InnerVisitor {
    private final Map<RQExpression, ObjectNode> written = new IdentityHashMap<>();
    @Nullable
    private ObjectNode result = null;

    @Override
    public void startVisit() {
        this.written.clear();
        this.result = null;
    }

    @Override
    public void postorder(RQExpression expression) {
        ObjectNode node = expression.asJson();
        ArrayNode components = node.putArray("components");
        for (RQExpression component: expression.getComponents())
            components.add(Utilities.getExists(this.written, component));
        this.written.put(expression, node);
        this.result = node;
    }

    public ObjectNode getResult() {
        Utilities.enforce(this.result != null, "Nothing was serialized");
        return this.result;
    }

    public static ObjectNode toJson(RQExpression expression) {
        ExpressionJsonWriter writer = new ExpressionJsonWriter();
        writer.apply(expression);
        return writer.getResult();
    }

    public static String toJsonString(RQExpression expression) {
        try {
            return Utilities.deterministicObjectMapper()
                    .writerWithDefaultPrettyPrinter()
                    .writeValueAsString(toJson(expression));
        } catch (JsonProcessingException ex) {
            throw new RuntimeException(ex);
        }
    }
}
