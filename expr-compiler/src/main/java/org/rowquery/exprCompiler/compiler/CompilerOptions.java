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

package org.rowquery.exprCompiler.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import org.rowquery.exprCompiler.compiler.errors.CompilationError;
import org.rowquery.util.Logger;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Command-line options for the expression compiler */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    @Parameter(description = "JSON file containing the expression to compile")
    @Nullable
    public String inputFile = null;
    @Parameter(names = "--rows", description = "JSON file containing an array of input rows")
    @Nullable
    public String rowsFile = null;
    @Parameter(names = "--interpreted",
            description = "Only evaluate in-process; do not translate to relational expressions")
    public boolean interpretedOnly = false;
    @Parameter(names = "-v", description = "Output verbosity")
    public int verbosity = 0;
    @DynamicParameter(names = "-T",
            description = "Specify logging level for a class (can be repeated)")
    public Map<String, String> loggingLevel = new HashMap<>();
    @Parameter(names = {"-h", "--help"}, help = true,
            description = "Show this message and exit")
    public boolean help = false;

    /** Check the options and apply the logging levels.
     * Throws {@link CompilationError} if the options are not usable. */
    public void validate() {
        if (this.inputFile == null)
            throw new CompilationError("No input file specified");
        for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
            int level;
            try {
                level = Integer.parseInt(entry.getValue());
            } catch (NumberFormatException ex) {
                throw new CompilationError("-T option must be followed by 'class=number'; could not parse " +
                        entry, ex);
            }
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
        }
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\n\tinputFile=" + this.inputFile +
                ",\n\trowsFile=" + this.rowsFile +
                ",\n\tinterpretedOnly=" + this.interpretedOnly +
                ",\n\tverbosity=" + this.verbosity +
                ",\n\tloggingLevel=" + this.loggingLevel +
                '}';
    }
}
