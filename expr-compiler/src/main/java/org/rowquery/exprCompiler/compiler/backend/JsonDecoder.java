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

package org.rowquery.exprCompiler.compiler.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.rowquery.exprCompiler.compiler.errors.BaseCompilerException;
import org.rowquery.exprCompiler.compiler.errors.DeserializationError;
import org.rowquery.exprCompiler.ir.expression.RQExpression;
import org.rowquery.exprCompiler.runtime.FunctionRegistry;
import org.rowquery.util.Utilities;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Reads expression trees written by {@link ExpressionJsonWriter}.
 * The components of a node are decoded first; the node itself is then
 * built by the static method 'fromJson(JsonNode, List, JsonDecoder)'
 * of the class named by its "class" property. */
public class JsonDecoder {
    static final String ROOT = "org.rowquery.exprCompiler.ir";
    static final List<String> PACKAGES = Arrays.asList(
            "expression", "expression.literal");

    /** Functions that can be referenced by name in the input. */
    public final FunctionRegistry functions;

    public JsonDecoder(FunctionRegistry functions) {
        this.functions = functions;
    }

    public JsonDecoder() {
        this(new FunctionRegistry());
    }

    static Class<?> getClass(String simpleName) {
        for (String pack : PACKAGES) {
            String className = ROOT + "." + pack + "." + simpleName;
            try {
                Class<?> result = Class.forName(className);
                if (RQExpression.class.isAssignableFrom(result))
                    return result;
            } catch (ClassNotFoundException ignored) {
                // try the next package
            }
        }
        throw new DeserializationError("Expression class " + Utilities.singleQuote(simpleName) + " not found");
    }

    public RQExpression decode(JsonNode node) {
        if (!node.isObject())
            throw new DeserializationError("Expected a JSON object: " + Utilities.toDepth(node, 80));
        String cls = Utilities.getStringProperty(node, "class");
        List<RQExpression> components = new ArrayList<>();
        JsonNode children = node.get("components");
        if (children != null) {
            if (!children.isArray())
                throw new DeserializationError("'components' is not an array: " + Utilities.toDepth(node, 80));
            for (JsonNode child: children)
                components.add(this.decode(child));
        }
        Class<?> clazz = getClass(cls);
        try {
            Method method = clazz.getMethod("fromJson", JsonNode.class, List.class, JsonDecoder.class);
            if (!Modifier.isStatic(method.getModifiers()))
                throw new DeserializationError(cls + ".fromJson is not static");
            return (RQExpression) method.invoke(null, node, components, this);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BaseCompilerException compilerException)
                throw compilerException;
            throw new DeserializationError("Cannot decode " + cls + ": " + cause.getMessage(), cause);
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new DeserializationError("Class " + cls + " cannot be decoded", e);
        }
    }

    public RQExpression decode(String json) {
        try {
            JsonNode node = Utilities.deterministicObjectMapper().readTree(json);
            return this.decode(node);
        } catch (JsonProcessingException e) {
            throw new DeserializationError("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }
}
