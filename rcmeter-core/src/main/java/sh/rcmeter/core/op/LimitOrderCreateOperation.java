// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.Objects;

import sh.rcmeter.core.types.Asset;

/**
 * Places an order on the internal market. Covers both
 * {@link OperationType#LIMIT_ORDER_CREATE} and {@link OperationType#LIMIT_ORDER_CREATE2};
 * they differ only in how the price is stated, which does not affect usage.
 *
 * @param type         which of the two create operations this is
 * @param owner        order owner
 * @param orderId      owner-scoped order id
 * @param amountToSell amount offered
 * @param fillOrKill   true if the order is discarded instead of stored when unmatched
 * @param expiration   expiration time as sent on the wire
 */
public record LimitOrderCreateOperation(
        OperationType type,
        String owner,
        long orderId,
        Asset amountToSell,
        boolean fillOrKill,
        String expiration) implements Operation {

    public LimitOrderCreateOperation {
        Objects.requireNonNull(type, "type cannot be null");
        if (type != OperationType.LIMIT_ORDER_CREATE && type != OperationType.LIMIT_ORDER_CREATE2) {
            throw new IllegalArgumentException("not a limit order create type: " + type);
        }
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(amountToSell, "amountToSell cannot be null");
        Objects.requireNonNull(expiration, "expiration cannot be null");
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitLimitOrderCreate(this);
    }
}
