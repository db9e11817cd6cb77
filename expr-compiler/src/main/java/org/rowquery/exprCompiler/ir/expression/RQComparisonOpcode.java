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
import org.apache.calcite.sql.SqlOperator;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.rowquery.exprCompiler.compiler.errors.DeserializationError;
import org.rowquery.util.Utilities;

/** Comparison operators. */
public enum RQComparisonOpcode {
    EQ("==", SqlStdOperatorTable.EQUALS),
    NEQ("!=", SqlStdOperatorTable.NOT_EQUALS),
    LT("<", SqlStdOperatorTable.LESS_THAN),
    GT(">", SqlStdOperatorTable.GREATER_THAN),
    LTE("<=", SqlStdOperatorTable.LESS_THAN_OR_EQUAL),
    GTE(">=", SqlStdOperatorTable.GREATER_THAN_OR_EQUAL);

    private final String text;
    /** Equivalent relational operator. */
    public final SqlOperator sqlOperator;

    RQComparisonOpcode(String text, SqlOperator sqlOperator) {
        this.text = text;
        this.sqlOperator = sqlOperator;
    }

    /** True if the comparison holds, given the result of compareTo on the operands. */
    public boolean holds(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NEQ -> comparison != 0;
            case LT -> comparison < 0;
            case GT -> comparison > 0;
            case LTE -> comparison <= 0;
            case GTE -> comparison >= 0;
        };
    }

    @Override
    public String toString() {
        return this.text;
    }

    public static RQComparisonOpcode fromJson(JsonNode node) {
        String name = Utilities.getStringProperty(node, "opcode");
        try {
            return RQComparisonOpcode.valueOf(name);
        } catch (IllegalArgumentException ex) {
            throw new DeserializationError("Unknown comparison " + Utilities.singleQuote(name), ex);
        }
    }
}
