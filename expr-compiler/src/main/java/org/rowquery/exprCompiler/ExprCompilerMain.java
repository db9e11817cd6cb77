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

package org.rowquery.exprCompiler;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.calcite.rex.RexNode;
import org.rowquery.exprCompiler.compiler.CompilerOptions;
import org.rowquery.exprCompiler.compiler.backend.CompiledElementCache;
import org.rowquery.exprCompiler.compiler.backend.JsonDecoder;
import org.rowquery.exprCompiler.compiler.errors.BaseCompilerException;
import org.rowquery.exprCompiler.compiler.errors.DeserializationError;
import org.rowquery.exprCompiler.compiler.optimizer.FilterPlan;
import org.rowquery.exprCompiler.compiler.optimizer.FilterPlanner;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.exprCompiler.runtime.FunctionRegistry;
import org.rowquery.exprCompiler.runtime.RowBuilder;
import org.rowquery.util.Utilities;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Main entry point of the expression compiler.
 * Loads an expression, shows its relational translation and filter plan,
 * and evaluates it in-process over the supplied rows. */
public class ExprCompilerMain {
    final CompilerOptions options;
    final FunctionRegistry functions;
    final PrintStream out;
    final PrintStream err;

    ExprCompilerMain(FunctionRegistry functions, PrintStream out, PrintStream err) {
        this.options = new CompilerOptions();
        this.functions = functions;
        this.out = out;
        this.err = err;
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("expr-compiler");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            this.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            StringBuilder usage = new StringBuilder();
            commander.getUsageFormatter().usage(usage);
            this.err.println(usage);
            return 1;
        }
        return 0;
    }

    static Object rowValue(JsonNode value) {
        if (value.isBoolean())
            return value.asBoolean();
        if (value.isIntegralNumber() && value.canConvertToLong())
            return value.asLong();
        if (value.isTextual())
            return value.asText();
        throw new DeserializationError("Unsupported row value " + value);
    }

    static List<List<Object>> readRows(String json) {
        JsonNode rows;
        try {
            rows = Utilities.deterministicObjectMapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new DeserializationError("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (!rows.isArray())
            throw new DeserializationError("Rows must be an array of arrays");
        List<List<Object>> result = new ArrayList<>();
        for (JsonNode row: rows) {
            if (!row.isArray())
                throw new DeserializationError("Row is not an array: " + row);
            List<Object> values = new ArrayList<>();
            for (JsonNode value: row)
                values.add(rowValue(value));
            result.add(values);
        }
        return result;
    }

    void run() throws IOException {
        this.options.validate();
        if (this.options.verbosity >= 1)
            this.out.println(this.options);
        String input = Utilities.readFile(Paths.get(Objects.requireNonNull(this.options.inputFile)));
        JsonDecoder decoder = new JsonDecoder(this.functions);
        RQExpression expression = decoder.decode(input);
        this.out.println("expression: " + expression);

        if (!this.options.interpretedOnly) {
            CompiledElementCache cache = new CompiledElementCache();
            RexNode compiled = cache.get(expression);
            this.out.println("compiled: " + (compiled == null ? "no compiled form" : compiled.toString()));
            if (expression.getType() == RQType.BOOL) {
                FilterPlan plan = new FilterPlanner(cache).plan(expression);
                this.out.println("pushed: " + (plan.sqlWhere() == null ? "none" : plan.sqlWhere().toString()));
                this.out.println("residual: " + (plan.residual() == null ? "none" : plan.residual().toString()));
            }
        }

        if (this.options.rowsFile != null) {
            List<List<Object>> rows = readRows(Utilities.readFile(Paths.get(this.options.rowsFile)));
            RowBuilder builder = new RowBuilder(expression);
            for (int i = 0; i < rows.size(); i++) {
                Object value = builder.evaluate(rows.get(i)).get(0);
                this.out.println("row " + i + ": " + value);
            }
        }
    }

    /** Run the compiler.
     * @return The process exit code. */
    public static int execute(FunctionRegistry functions, PrintStream out, PrintStream err, String... argv) {
        ExprCompilerMain main = new ExprCompilerMain(functions, out, err);
        int result = main.parseOptions(argv);
        if (result != 0)
            return result;
        try {
            main.run();
        } catch (BaseCompilerException ex) {
            err.println(ex.toReport());
            return 1;
        } catch (IOException ex) {
            err.println("Error reading file: " + ex.getMessage());
            return 1;
        }
        return 0;
    }

    public static void main(String[] argv) {
        int exitCode = execute(new FunctionRegistry(), System.out, System.err, argv);
        if (exitCode != 0)
            System.exit(exitCode);
    }
}
