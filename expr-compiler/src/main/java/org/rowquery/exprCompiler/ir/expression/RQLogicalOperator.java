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
import org.rowquery.exprCompiler.compiler.errors.DeserializationError;
import org.rowquery.util.Utilities;

/** Operators that combine boolean expressions. */
public enum RQLogicalOperator {
    AND(0, "&"),
    OR(1, "|"),
    NOT(2, "~");

    /** Tag used in the serialized form. */
    public final int code;
    private final String text;

    RQLogicalOperator(int code, String text) {
        this.code = code;
        this.text = text;
    }

    @Override
    public String toString() {
        return this.text;
    }

    public static RQLogicalOperator fromCode(int code) {
        for (RQLogicalOperator operator: RQLogicalOperator.values()) {
            if (operator.code == code)
                return operator;
        }
        throw new DeserializationError("Unknown logical operator code " + code);
    }

    public static RQLogicalOperator fromJson(JsonNode node) {
        return fromCode(Utilities.getIntProperty(node, "operator"));
    }
}
