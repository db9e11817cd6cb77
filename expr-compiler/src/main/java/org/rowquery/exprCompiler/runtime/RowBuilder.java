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

import org.rowquery.exprCompiler.compiler.visitors.inner.InnerVisitor;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.util.HashString;
import org.rowquery.util.IIndentStream;
import org.rowquery.util.IWritesLogs;
import org.rowquery.util.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Schedules the evaluation of a set of expressions over rows.
 *
 * <p>Each structurally distinct expression gets one slot in the row buffer;
 * structurally equal expressions share a slot and are evaluated once.
 * Slots are numbered so that the components of an expression always have
 * smaller slots than the expression itself; evaluating in slot order
 * therefore computes operands before their dependents.
 *
 * <p>Every scheduled expression is evaluated for every row.
 * Not thread-safe. */
public class RowBuilder implements IWritesLogs {
    /** Expressions evaluated, indexed by slot. */
    private final List<RQExpression> unique = new ArrayList<>();
    private final Map<HashString, Integer> slots = new HashMap<>();
    private final List<RQExpression> outputs = new ArrayList<>();

    class SlotAssigner extends InnerVisitor {
        @Override
        public void postorder(RQExpression expression) {
            HashString id = expression.getStructuralId();
            Integer slot = RowBuilder.this.slots.get(id);
            if (slot == null) {
                slot = RowBuilder.this.unique.size();
                RowBuilder.this.unique.add(expression);
                RowBuilder.this.slots.put(id, slot);
                Logger.INSTANCE.belowLevel(RowBuilder.this, 1)
                        .append("Slot ")
                        .append(slot)
                        .append(" for ")
                        .append(expression)
                        .newline();
            }
            expression.setSlotIndex(slot);
        }
    }

    public RowBuilder(List<RQExpression> outputs) {
        for (RQExpression output: outputs)
            this.addOutput(output);
    }

    public RowBuilder(RQExpression... outputs) {
        this(List.of(outputs));
    }

    /** Schedule 'output' and all its components for evaluation.
     * @return The slot holding the value of 'output'. */
    public int addOutput(RQExpression output) {
        new SlotAssigner().apply(output);
        this.outputs.add(output);
        this.describe(Logger.INSTANCE.belowLevel(this, 2));
        return output.getSlotIndex();
    }

    /** Write the evaluation schedule to 'stream'. */
    public IIndentStream describe(IIndentStream stream) {
        stream.append("Schedule with ")
                .append(this.unique.size())
                .append(" slots")
                .increase();
        for (int i = 0; i < this.unique.size(); i++) {
            stream.append(i)
                    .append(": ")
                    .append(this.unique.get(i))
                    .newline();
        }
        return stream.decrease();
    }

    public List<RQExpression> getOutputs() {
        return Collections.unmodifiableList(this.outputs);
    }

    public int getSlotCount() {
        return this.unique.size();
    }

    public DataRow createRow(List<Object> input) {
        return new DataRow(this.unique.size(), input);
    }

    /** Evaluate every scheduled expression for 'row'. */
    public void eval(DataRow row) {
        for (RQExpression expression: this.unique)
            expression.evaluate(row);
    }

    /** Evaluate all outputs for the specified input row.
     * @return The value of each output, in order. */
    public List<Object> evaluate(List<Object> input) {
        DataRow row = this.createRow(input);
        this.eval(row);
        List<Object> result = new ArrayList<>(this.outputs.size());
        for (RQExpression output: this.outputs)
            result.add(row.get(output));
        return result;
    }
}
