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

package org.rowquery.exprCompiler.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;
import org.rowquery.exprCompiler.compiler.errors.DeserializationError;
import org.rowquery.util.Utilities;

import javax.annotation.Nullable;

/** Types of the values produced by expressions.  SQL NULL is not represented. */
public enum RQType {
    BOOL("bool", SqlTypeName.BOOLEAN, Boolean.class),
    INT64("i64", SqlTypeName.BIGINT, Long.class),
    STRING("string", SqlTypeName.VARCHAR, String.class);

    private final String text;
    public final SqlTypeName sqlTypeName;
    /** Java class used to represent runtime values of this type. */
    public final Class<?> runtimeClass;

    RQType(String text, SqlTypeName sqlTypeName, Class<?> runtimeClass) {
        this.text = text;
        this.sqlTypeName = sqlTypeName;
        this.runtimeClass = runtimeClass;
    }

    /** True if 'value' is a legal runtime value of this type. */
    public boolean accepts(@Nullable Object value) {
        return this.runtimeClass.isInstance(value);
    }

    public RelDataType toRelType(RelDataTypeFactory factory) {
        return factory.createSqlType(this.sqlTypeName);
    }

    @Override
    public String toString() {
        return this.text;
    }

    public static RQType fromJson(JsonNode node) {
        JsonNode prop = Utilities.getProperty(node, "type");
        if (!prop.isTextual())
            throw new DeserializationError("Type is not a string: " + Utilities.toDepth(node, 80));
        try {
            return RQType.valueOf(prop.asText());
        } catch (IllegalArgumentException ex) {
            throw new DeserializationError("Unknown type " + Utilities.singleQuote(prop.asText()), ex);
        }
    }
}
