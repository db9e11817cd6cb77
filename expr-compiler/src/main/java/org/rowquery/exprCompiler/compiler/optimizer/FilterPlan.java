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
import org.rowquery.exprCompiler.ir.expression.RQExpression;

import javax.annotation.Nullable;

/** How a filter is evaluated.
 *
 * @param sqlWhere  Part of the filter that is pushed to the data source, as a relational
 *                  expression; null if nothing can be pushed.
 * @param residual  Part of the filter evaluated in-process on the rows returned by the
 *                  data source; null if the whole filter is pushed. */
public record FilterPlan(@Nullable RexNode sqlWhere, @Nullable RQExpression residual) {
    public boolean isFullyPushed() {
        return this.residual == null;
    }
}
