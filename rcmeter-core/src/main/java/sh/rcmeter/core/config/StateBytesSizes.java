// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import sh.rcmeter.core.error.RcConfigException;
import sh.rcmeter.core.op.OperationType;

/**
 * Immutable state-bytes size table.
 *
 * <p>Sizes are expressed in units of {@code 1 / stateBytesScale} bytes. The
 * table must define every {@link StateObjectSize}; this is checked once, at
 * construction.
 */
public final class StateBytesSizes {

    private final Map<StateObjectSize, Long> sizes;
    private final long stateBytesScale;

    /**
     * @param sizes           one non-negative entry per {@link StateObjectSize}
     * @param stateBytesScale number of size units per byte
     * @throws RcConfigException if an entry is missing or negative
     */
    public StateBytesSizes(final Map<StateObjectSize, Long> sizes, final long stateBytesScale) {
        Objects.requireNonNull(sizes, "sizes cannot be null");
        final Set<StateObjectSize> missing = EnumSet.allOf(StateObjectSize.class);
        missing.removeAll(sizes.keySet());
        if (!missing.isEmpty()) {
            throw new RcConfigException("State-bytes size table is missing entries: " + missing);
        }
        for (Map.Entry<StateObjectSize, Long> entry : sizes.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new RcConfigException("State-bytes size " + entry.getKey().wireName()
                        + " must be non-negative, got: " + entry.getValue());
            }
        }
        if (stateBytesScale <= 0) {
            throw new RcConfigException("STATE_BYTES_SCALE must be positive, got: " + stateBytesScale);
        }
        this.sizes = new EnumMap<>(sizes);
        this.stateBytesScale = stateBytesScale;
    }

    public long get(final StateObjectSize key) {
        return sizes.get(key);
    }

    public long stateBytesScale() {
        return stateBytesScale;
    }

    /**
     * State bytes of an operation that stores one fixed-size object, or zero for
     * operations that store nothing or whose size depends on their fields.
     */
    public long fixedStateBytes(final OperationType type) {
        return switch (type) {
            case ACCOUNT_WITNESS_VOTE -> get(StateObjectSize.WITNESS_VOTE_OBJECT_BASE);
            case CONVERT -> get(StateObjectSize.CONVERT_REQUEST_OBJECT_BASE);
            case DECLINE_VOTING_RIGHTS -> get(StateObjectSize.DECLINE_VOTING_RIGHTS_REQUEST_OBJECT_BASE);
            case DELEGATE_VESTING_SHARES -> Math.max(
                    get(StateObjectSize.VESTING_DELEGATION_OBJECT_BASE),
                    get(StateObjectSize.VESTING_DELEGATION_EXPIRATION_OBJECT_BASE));
            case ESCROW_TRANSFER -> get(StateObjectSize.ESCROW_OBJECT_BASE);
            case REQUEST_ACCOUNT_RECOVERY -> get(StateObjectSize.ACCOUNT_RECOVERY_REQUEST_OBJECT_BASE);
            case SET_WITHDRAW_VESTING_ROUTE -> get(StateObjectSize.WITHDRAW_VESTING_ROUTE_OBJECT_BASE);
            case TRANSFER_FROM_SAVINGS -> get(StateObjectSize.SAVINGS_WITHDRAW_OBJECT_BYTE);
            case VOTE -> get(StateObjectSize.COMMENT_VOTE_OBJECT_BASE);
            default -> 0L;
        };
    }
}
