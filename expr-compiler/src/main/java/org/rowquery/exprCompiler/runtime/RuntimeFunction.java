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

import org.rowquery.exprCompiler.ir.type.RQType;

import java.util.List;
import java.util.function.Function;

/** A function implemented in Java, which can only be evaluated in-process.
 * Each instance gets a distinct id, so functions that share a name are
 * still told apart by the structural identity of their calls. */
public final class RuntimeFunction {
    static long nextId = 0;
    /** Creation-order id of this function. */
    public final long id;
    public final String name;
    public final RQType resultType;
    final Function<List<Object>, Object> implementation;

    public RuntimeFunction(String name, RQType resultType, Function<List<Object>, Object> implementation) {
        synchronized (RuntimeFunction.class) {
            this.id = nextId++;
        }
        this.name = name;
        this.resultType = resultType;
        this.implementation = implementation;
    }

    public Object apply(List<Object> arguments) {
        return this.implementation.apply(arguments);
    }

    @Override
    public String toString() {
        return this.name;
    }
}
