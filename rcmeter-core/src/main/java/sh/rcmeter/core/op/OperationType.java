// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The closed set of operation tags known to the resource counter.
 *
 * <p>
 * Every tag is either {@link Category#CHARGED} (it consumes resources and has a
 * configured execution time) or {@link Category#IGNORED} (legacy operations and
 * virtual operations the ledger emits itself, which never contribute usage).
 * A tag outside this enum is unknown, which is an error rather than an
 * implicit no-op.
 *
 * <p>
 * The wire tag is the lower-cased constant name followed by {@code _operation},
 * e.g. {@link #LIMIT_ORDER_CREATE2} is {@code limit_order_create2_operation}.
 */
public enum OperationType {

    ACCOUNT_CREATE(Category.CHARGED, Shape.STRUCTURED),
    ACCOUNT_CREATE_WITH_DELEGATION(Category.CHARGED, Shape.STRUCTURED),
    ACCOUNT_UPDATE(Category.CHARGED),
    ACCOUNT_WITNESS_PROXY(Category.CHARGED),
    ACCOUNT_WITNESS_VOTE(Category.CHARGED),
    CANCEL_TRANSFER_FROM_SAVINGS(Category.CHARGED),
    CHANGE_RECOVERY_ACCOUNT(Category.CHARGED),
    CLAIM_ACCOUNT(Category.CHARGED, Shape.STRUCTURED),
    CLAIM_REWARD_BALANCE(Category.CHARGED),
    CLAIM_REWARD_BALANCE2(Category.CHARGED),
    COMMENT(Category.CHARGED, Shape.STRUCTURED),
    COMMENT_OPTIONS(Category.CHARGED, Shape.STRUCTURED),
    CONVERT(Category.CHARGED),
    CREATE_CLAIMED_ACCOUNT(Category.CHARGED, Shape.STRUCTURED),
    CUSTOM(Category.CHARGED),
    CUSTOM_BINARY(Category.CHARGED),
    CUSTOM_JSON(Category.CHARGED),
    DECLINE_VOTING_RIGHTS(Category.CHARGED),
    DELEGATE_VESTING_SHARES(Category.CHARGED),
    DELETE_COMMENT(Category.CHARGED),
    ESCROW_APPROVE(Category.CHARGED),
    ESCROW_DISPUTE(Category.CHARGED),
    ESCROW_RELEASE(Category.CHARGED),
    ESCROW_TRANSFER(Category.CHARGED),
    FEED_PUBLISH(Category.CHARGED),
    LIMIT_ORDER_CANCEL(Category.CHARGED),
    LIMIT_ORDER_CREATE(Category.CHARGED, Shape.STRUCTURED, true),
    LIMIT_ORDER_CREATE2(Category.CHARGED, Shape.STRUCTURED, true),
    REQUEST_ACCOUNT_RECOVERY(Category.CHARGED),
    SET_WITHDRAW_VESTING_ROUTE(Category.CHARGED),
    SMT_CAP_REVEAL(Category.CHARGED),
    SMT_CREATE(Category.CHARGED),
    SMT_REFUND(Category.CHARGED),
    SMT_SET_RUNTIME_PARAMETERS(Category.CHARGED),
    SMT_SET_SETUP_PARAMETERS(Category.CHARGED),
    SMT_SETUP(Category.CHARGED),
    SMT_SETUP_EMISSIONS(Category.CHARGED),
    TRANSFER(Category.CHARGED, Shape.GENERIC, true),
    TRANSFER_FROM_SAVINGS(Category.CHARGED),
    TRANSFER_TO_SAVINGS(Category.CHARGED),
    TRANSFER_TO_VESTING(Category.CHARGED, Shape.GENERIC, true),
    VOTE(Category.CHARGED),
    WITHDRAW_VESTING(Category.CHARGED),
    WITNESS_SET_PROPERTIES(Category.CHARGED),
    WITNESS_UPDATE(Category.CHARGED, Shape.STRUCTURED),

    // Legacy operations
    RECOVER_ACCOUNT(Category.IGNORED),
    POW(Category.IGNORED),
    POW2(Category.IGNORED),
    REPORT_OVER_PRODUCTION(Category.IGNORED),
    RESET_ACCOUNT(Category.IGNORED),
    SET_RESET_ACCOUNT(Category.IGNORED),

    // Virtual operations
    FILL_CONVERT_REQUEST(Category.IGNORED),
    AUTHOR_REWARD(Category.IGNORED),
    CURATION_REWARD(Category.IGNORED),
    COMMENT_REWARD(Category.IGNORED),
    LIQUIDITY_REWARD(Category.IGNORED),
    INTEREST(Category.IGNORED),
    FILL_VESTING_WITHDRAW(Category.IGNORED),
    FILL_ORDER(Category.IGNORED),
    SHUTDOWN_WITNESS(Category.IGNORED),
    FILL_TRANSFER_FROM_SAVINGS(Category.IGNORED),
    HARDFORK(Category.IGNORED),
    COMMENT_PAYOUT_UPDATE(Category.IGNORED),
    RETURN_VESTING_DELEGATION(Category.IGNORED),
    COMMENT_BENEFACTOR_REWARD(Category.IGNORED),
    PRODUCER_REWARD(Category.IGNORED),
    CLEAR_NULL_ACCOUNT_BALANCE(Category.IGNORED);

    /**
     * Whether an operation is billed.
     */
    public enum Category {
        CHARGED,
        IGNORED
    }

    /**
     * Whether an operation decodes into a dedicated record or into
     * {@link GenericOperation}.
     */
    enum Shape {
        STRUCTURED,
        GENERIC
    }

    private static final Map<String, OperationType> BY_WIRE_NAME = new HashMap<>();
    private static final Set<OperationType> CHARGED = EnumSet.noneOf(OperationType.class);

    static {
        for (OperationType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
            if (type.category == Category.CHARGED) {
                CHARGED.add(type);
            }
        }
    }

    private final Category category;
    private final Shape shape;
    private final boolean market;
    private final String wireName;

    OperationType(final Category category) {
        this(category, Shape.GENERIC, false);
    }

    OperationType(final Category category, final Shape shape) {
        this(category, shape, false);
    }

    OperationType(final Category category, final Shape shape, final boolean market) {
        this.category = category;
        this.shape = shape;
        this.market = market;
        this.wireName = name().toLowerCase(Locale.ROOT) + "_operation";
    }

    public String wireName() {
        return wireName;
    }

    public Category category() {
        return category;
    }

    public boolean isCharged() {
        return category == Category.CHARGED;
    }

    /**
     * @return true if the operation is billed through the market-bytes resource
     */
    public boolean isMarket() {
        return market;
    }

    /**
     * @return true if the operation decodes into a dedicated record type
     */
    public boolean isStructured() {
        return shape == Shape.STRUCTURED;
    }

    /**
     * Looks up a wire tag such as {@code vote_operation}.
     *
     * @param wireName the tag
     * @return the matching type, or empty if the tag is unknown
     */
    public static Optional<OperationType> fromWireName(final String wireName) {
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    /**
     * @return the operations that must have a configured execution time
     */
    public static Set<OperationType> charged() {
        return Collections.unmodifiableSet(CHARGED);
    }
}
