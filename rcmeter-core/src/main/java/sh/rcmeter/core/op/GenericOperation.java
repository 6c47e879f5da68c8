// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * An operation whose usage depends only on its tag. The wire fields are kept
 * as decoded but never inspected by the resource counter.
 *
 * @param type  the operation tag; must not be a structured type
 * @param value the wire fields
 */
public record GenericOperation(OperationType type, JsonNode value) implements Operation {

    public GenericOperation {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (type.isStructured()) {
            throw new IllegalArgumentException(type.wireName() + " has a dedicated operation record");
        }
        if (!value.isObject()) {
            throw new IllegalArgumentException("value must be a JSON object");
        }
        value = value.deepCopy();
    }

    /**
     * Creates an operation of {@code type} with no fields.
     */
    public static GenericOperation of(final OperationType type) {
        return new GenericOperation(type, JsonNodeFactory.instance.objectNode());
    }

    /**
     * @return a copy of the wire fields
     */
    @Override
    public JsonNode value() {
        return value.deepCopy();
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitGeneric(this);
    }
}
