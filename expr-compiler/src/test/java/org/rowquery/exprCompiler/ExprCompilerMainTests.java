package org.rowquery.exprCompiler;

import org.rowquery.exprCompiler.compiler.backend.ExpressionJsonWriter;
import org.rowquery.exprCompiler.ir.expression.RQColumnReference;
import org.rowquery.exprCompiler.ir.expression.RQComparisonExpression;
import org.rowquery.exprCompiler.ir.expression.RQComparisonOpcode;
import org.rowquery.exprCompiler.ir.expression.RQCompoundPredicate;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.exprCompiler.ir.expression.RQFunctionCall;
import org.rowquery.exprCompiler.ir.expression.literal.RQI64Literal;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.exprCompiler.runtime.FunctionRegistry;
import org.rowquery.exprCompiler.runtime.RuntimeFunction;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class ExprCompilerMainTests {
    final RuntimeFunction odd = new RuntimeFunction("odd", RQType.BOOL, args -> (Long) args.get(0) % 2 != 0);

    static class Output {
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        final PrintStream out = new PrintStream(this.outBytes, true, StandardCharsets.UTF_8);
        final PrintStream err = new PrintStream(this.errBytes, true, StandardCharsets.UTF_8);
        int exitCode;

        String out() {
            return this.outBytes.toString(StandardCharsets.UTF_8);
        }

        String err() {
            return this.errBytes.toString(StandardCharsets.UTF_8);
        }
    }

    static File write(String contents, String suffix) throws IOException {
        File file = File.createTempFile("expr", suffix);
        file.deleteOnExit();
        Files.writeString(file.toPath(), contents);
        return file;
    }

    Output run(String... argv) {
        FunctionRegistry functions = new FunctionRegistry();
        functions.register(this.odd);
        Output output = new Output();
        output.exitCode = ExprCompilerMain.execute(functions, output.out, output.err, argv);
        return output;
    }

    RQExpression filter(boolean withFunction) {
        RQExpression flag = new RQColumnReference(0, "flag", RQType.BOOL);
        RQExpression x = new RQColumnReference(1, "x", RQType.INT64);
        RQExpression big = new RQComparisonExpression(RQComparisonOpcode.GTE, x, new RQI64Literal(3));
        if (withFunction)
            return RQCompoundPredicate.and(flag, big, new RQFunctionCall(this.odd, x));
        return RQCompoundPredicate.and(flag, big);
    }

    @Test
    public void compileAndEvaluate() throws IOException {
        File input = write(ExpressionJsonWriter.toJsonString(this.filter(false)), ".json");
        File rows = write("[[true, 5], [false, 5], [true, 1]]", ".json");
        Output output = this.run(input.getPath(), "--rows", rows.getPath());
        Assert.assertEquals(output.err(), 0, output.exitCode);
        String out = output.out();
        Assert.assertTrue(out.contains("expression: (flag) & (x >= 3)"));
        Assert.assertFalse(out.contains("no compiled form"));
        Assert.assertFalse(out.contains("pushed: none"));
        Assert.assertTrue(out.contains("residual: none"));
        Assert.assertTrue(out.contains("row 0: true"));
        Assert.assertTrue(out.contains("row 1: false"));
        Assert.assertTrue(out.contains("row 2: false"));
    }

    @Test
    public void residualFilter() throws IOException {
        File input = write(ExpressionJsonWriter.toJsonString(this.filter(true)), ".json");
        File rows = write("[[true, 5], [true, 4]]", ".json");
        Output output = this.run(input.getPath(), "--rows", rows.getPath());
        Assert.assertEquals(output.err(), 0, output.exitCode);
        String out = output.out();
        Assert.assertTrue(out.contains("compiled: no compiled form"));
        Assert.assertTrue(out.contains("residual: odd(x)"));
        Assert.assertTrue(out.contains("row 0: true"));
        Assert.assertTrue(out.contains("row 1: false"));
    }

    @Test
    public void interpreted() throws IOException {
        File input = write(ExpressionJsonWriter.toJsonString(this.filter(true)), ".json");
        File rows = write("[[false, 7]]", ".json");
        Output output = this.run("--interpreted", "--rows", rows.getPath(), input.getPath());
        Assert.assertEquals(output.err(), 0, output.exitCode);
        Assert.assertFalse(output.out().contains("compiled:"));
        Assert.assertFalse(output.out().contains("pushed:"));
        Assert.assertTrue(output.out().contains("row 0: false"));
    }

    @Test
    public void errors() throws IOException {
        Output output = this.run();
        Assert.assertEquals(1, output.exitCode);
        Assert.assertTrue(output.err().contains("Compilation error"));

        File bad = write("{\"class\": \"RQCompoundPredicate\", \"type\": \"BOOL\", \"components\": []}", ".json");
        output = this.run(bad.getPath());
        Assert.assertEquals(1, output.exitCode);
        Assert.assertTrue(output.err().contains("Deserialization error"));

        File input = write(ExpressionJsonWriter.toJsonString(this.filter(false)), ".json");
        File rows = write("[[true, 1.5]]", ".json");
        output = this.run(input.getPath(), "--rows", rows.getPath());
        Assert.assertEquals(1, output.exitCode);
        Assert.assertTrue(output.err().contains("Deserialization error"));

        output = this.run(input.getPath(), "-TFilterPlanner=high");
        Assert.assertEquals(1, output.exitCode);
        Assert.assertTrue(output.err().contains("Compilation error"));

        output = this.run(input.getPath(), "-TNoSuchClass=1");
        Assert.assertEquals(1, output.exitCode);

        output = this.run(input.getPath() + ".missing");
        Assert.assertEquals(1, output.exitCode);
    }

    @Test
    public void loggingOption() throws IOException {
        File input = write(ExpressionJsonWriter.toJsonString(this.filter(false)), ".json");
        Output output = this.run(input.getPath(), "-TFilterPlanner=0", "-TCompiledElementCache=0");
        Assert.assertEquals(output.err(), 0, output.exitCode);
    }

    @Test
    public void help() {
        Output output = this.run("--help");
        Assert.assertEquals(1, output.exitCode);
        Assert.assertTrue(output.err().contains("--rows"));
    }
}
