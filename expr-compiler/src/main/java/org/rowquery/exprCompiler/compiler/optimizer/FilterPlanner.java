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

package org.rowquery.exprCompiler.compiler.optimizer;

import org.apache.calcite.rex.RexNode;
import org.rowquery.exprCompiler.compiler.backend.CompiledElementCache;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.exprCompiler.ir.expression.SplitConjuncts;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.util.IWritesLogs;
import org.rowquery.util.Linq;
import org.rowquery.util.Logger;
import org.rowquery.util.Utilities;

import java.util.List;
import java.util.Objects;

/** Decides which parts of a filter are pushed to a relational data source.
 * A conjunct is pushed if it has a relational form; the remaining conjuncts
 * are evaluated in-process.  Disjunctions and negations are pushed whole or not at all. */
public class FilterPlanner implements IWritesLogs {
    private final CompiledElementCache cache;

    public FilterPlanner(CompiledElementCache cache) {
        this.cache = cache;
    }

    public FilterPlan plan(RQExpression filter) {
        Utilities.enforce(filter.getType() == RQType.BOOL, "Filter is not boolean: " + filter);
        RexNode whole = this.cache.get(filter);
        if (whole != null) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Pushing entire filter ")
                    .append(filter)
                    .newline();
            return new FilterPlan(whole, null);
        }

        SplitConjuncts split = filter.splitConjuncts(e -> this.cache.get(e) != null);
        if (split.matches().isEmpty()) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Nothing to push in ")
                    .append(filter)
                    .newline();
            return new FilterPlan(null, filter);
        }
        List<RexNode> pushed = Linq.map(split.matches(), e -> Objects.requireNonNull(this.cache.get(e)));
        RexNode where = pushed.size() == 1 ? pushed.get(0) : this.cache.and(pushed);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Pushing ")
                .append(pushed.size())
                .append(" conjuncts of ")
                .append(filter)
                .newline();
        return new FilterPlan(where, split.remainder());
    }
}
