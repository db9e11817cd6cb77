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

package org.rowquery.exprCompiler.ir.expression;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.calcite.rex.RexNode;
import org.rowquery.exprCompiler.compiler.backend.CompiledElementCache;
import org.rowquery.exprCompiler.compiler.errors.InternalCompilerError;
import org.rowquery.exprCompiler.compiler.visitors.VisitDecision;
import org.rowquery.exprCompiler.compiler.visitors.inner.InnerVisitor;
import org.rowquery.exprCompiler.ir.RQNode;
import org.rowquery.exprCompiler.ir.type.RQType;
import org.rowquery.exprCompiler.runtime.DataRow;
import org.rowquery.util.HashString;
import org.rowquery.util.Logger;
import org.rowquery.util.Utilities;

import javax.annotation.Nullable;
import java.util.List;
import java.util.function.Predicate;

/** Base class for all expressions.
 *
 * <p>An expression has a structural identity, computed once when the
 * expression is built from its class, its own attributes and the
 * identities of its components, in order.  Two expressions with the same
 * identity compute the same value; caches and the row scheduler use the
 * identity to share work between such expressions.
 *
 * <p>Expressions are immutable, except for the storage slot, which is
 * assigned once by the {@link org.rowquery.exprCompiler.runtime.RowBuilder}. */
public abstract class RQExpression extends RQNode {
    public static final int NO_SLOT = -1;

    public final RQType type;
    @Nullable
    private HashString structuralId;
    private int slotIndex = NO_SLOT;

    protected RQExpression(RQType type) {
        this.type = type;
    }

    public RQType getType() {
        return this.type;
    }

    /** The operands of this expression, in evaluation order. */
    public abstract List<RQExpression> getComponents();

    /** Describes the attributes of this node that are not components.
     * Part of the structural identity. */
    protected abstract String idAttributes();

    /** Must be called by every concrete constructor, after all fields are set. */
    protected final void createId() {
        Utilities.enforce(this.structuralId == null, "Identity computed twice");
        StringBuilder builder = new StringBuilder();
        builder.append(this.getClass().getSimpleName())
                .append(":")
                .append(this.type.name())
                .append("(")
                .append(this.idAttributes())
                .append(")[");
        boolean first = true;
        for (RQExpression component: this.getComponents()) {
            if (!first)
                builder.append(",");
            first = false;
            builder.append(component.getStructuralId().value());
        }
        builder.append("]");
        String data = builder.toString();
        this.structuralId = HashString.sha256(data);
        Logger.INSTANCE.belowLevel(RQExpression.class, 3)
                .append("Identity of ")
                .append(data)
                .append(" is ")
                .append(this.structuralId.shortString())
                .newline();
    }

    public HashString getStructuralId() {
        if (this.structuralId == null)
            throw new InternalCompilerError("Expression identity not computed", this);
        return this.structuralId;
    }

    /** True if both expressions have the same structure, and thus the same value. */
    public boolean sameStructure(RQExpression other) {
        return this.getStructuralId().equals(other.getStructuralId());
    }

    /** True if this is a compound predicate using the specified operator. */
    public boolean isCompound(RQLogicalOperator operator) {
        return false;
    }

    public boolean hasSlot() {
        return this.slotIndex != NO_SLOT;
    }

    public int getSlotIndex() {
        if (this.slotIndex == NO_SLOT)
            throw new InternalCompilerError("Expression has no slot", this);
        return this.slotIndex;
    }

    /** Assign the slot in the row buffer where the value of this expression is stored.
     * Can only be done once; assigning the same slot again is allowed. */
    public void setSlotIndex(int slotIndex) {
        Utilities.enforce(slotIndex >= 0, "Negative slot index " + slotIndex);
        if (this.slotIndex != NO_SLOT && this.slotIndex != slotIndex)
            throw new InternalCompilerError("Expression already stored in slot " + this.slotIndex +
                    ", cannot move to slot " + slotIndex, this);
        this.slotIndex = slotIndex;
    }

    /** Split this expression into conjuncts which satisfy 'condition' and the rest.
     * Only conjunctions can be split; every other expression is returned whole as remainder. */
    public SplitConjuncts splitConjuncts(Predicate<RQExpression> condition) {
        return new SplitConjuncts(List.of(), this);
    }

    /** Translate this expression to a relational expression.
     * Components are translated through 'cache'.
     * @return null if the expression has no relational equivalent. */
    @Nullable
    public abstract RexNode toCompiled(CompiledElementCache cache);

    /** Compute the value of this expression for the current row and store it
     * in the slot of this expression.  Components must have been evaluated. */
    public abstract void evaluate(DataRow row);

    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop())
            return;
        for (RQExpression component: this.getComponents())
            component.accept(visitor);
        visitor.postorder(this);
    }

    /** Serialized form of this node alone, without components. */
    public ObjectNode asJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("class", this.getClass().getSimpleName());
        result.put("type", this.type.name());
        this.addJsonProperties(result);
        return result;
    }

    /** Add the properties specific to this node to its serialized form. */
    protected void addJsonProperties(ObjectNode node) {}
}
