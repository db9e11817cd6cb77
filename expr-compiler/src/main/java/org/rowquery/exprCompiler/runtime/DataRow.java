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

package org.rowquery.exprCompiler.runtime;

import org.rowquery.exprCompiler.compiler.errors.InternalCompilerError;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** Values computed for one input row.
 * The input columns are read by column references; every other value
 * lives in the slot assigned to the expression that computed it.
 * A DataRow is owned by a single thread. */
public class DataRow {
    private final List<Object> input;
    private final Object[] values;
    private final boolean[] hasValue;

    public DataRow(int slots, List<Object> input) {
        for (Object value: input)
            Utilities.enforce(value != null, "NULL input values are not supported");
        this.input = new ArrayList<>(input);
        this.values = new Object[slots];
        this.hasValue = new boolean[slots];
    }

    public int getSlotCount() {
        return this.values.length;
    }

    public Object getInput(int column) {
        if (column >= this.input.size())
            throw new InternalCompilerError("Row has " + this.input.size() +
                    " columns, cannot read column " + column);
        return this.input.get(column);
    }

    public void set(RQExpression expression, Object value) {
        int slot = expression.getSlotIndex();
        Utilities.enforce(slot < this.values.length, "Slot " + slot + " out of range");
        Utilities.enforce(value != null, "Storing NULL for " + expression);
        this.values[slot] = value;
        this.hasValue[slot] = true;
    }

    public boolean has(RQExpression expression) {
        return expression.hasSlot() &&
                expression.getSlotIndex() < this.hasValue.length &&
                this.hasValue[expression.getSlotIndex()];
    }

    public Object get(RQExpression expression) {
        if (!this.has(expression))
            throw new InternalCompilerError("Value not yet computed", expression);
        return this.values[expression.getSlotIndex()];
    }

    public boolean getBoolean(RQExpression expression) {
        Object value = this.get(expression);
        if (!(value instanceof Boolean b))
            throw new InternalCompilerError("Expected a boolean value, found " + value, expression);
        return b;
    }

    /** Forget all computed values, keeping the input. */
    public void clear() {
        for (int i = 0; i < this.values.length; i++) {
            this.values[i] = null;
            this.hasValue[i] = false;
        }
    }
}
