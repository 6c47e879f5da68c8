// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import java.util.Optional;

/**
 * Keys of the state-bytes size table. Base sizes are per stored object,
 * member and char sizes are per list element or per encoded byte.
 */
public enum StateObjectSize {
    AUTHORITY_BASE("authority_base_size"),
    AUTHORITY_ACCOUNT_MEMBER("authority_account_member_size"),
    AUTHORITY_KEY_MEMBER("authority_key_member_size"),
    ACCOUNT_OBJECT_BASE("account_object_base_size"),
    ACCOUNT_AUTHORITY_OBJECT_BASE("account_authority_object_base_size"),
    ACCOUNT_RECOVERY_REQUEST_OBJECT_BASE("account_recovery_request_object_base_size"),
    COMMENT_OBJECT_BASE("comment_object_base_size"),
    COMMENT_OBJECT_PERMLINK_CHAR("comment_object_permlink_char_size"),
    COMMENT_OBJECT_PARENT_PERMLINK_CHAR("comment_object_parent_permlink_char_size"),
    COMMENT_OBJECT_BENEFICIARIES_MEMBER("comment_object_beneficiaries_member_size"),
    COMMENT_VOTE_OBJECT_BASE("comment_vote_object_base_size"),
    CONVERT_REQUEST_OBJECT_BASE("convert_request_object_base_size"),
    DECLINE_VOTING_RIGHTS_REQUEST_OBJECT_BASE("decline_voting_rights_request_object_base_size"),
    ESCROW_OBJECT_BASE("escrow_object_base_size"),
    LIMIT_ORDER_OBJECT_BASE("limit_order_object_base_size"),
    SAVINGS_WITHDRAW_OBJECT_BYTE("savings_withdraw_object_byte_size"),
    TRANSACTION_OBJECT_BASE("transaction_object_base_size"),
    TRANSACTION_OBJECT_BYTE("transaction_object_byte_size"),
    VESTING_DELEGATION_OBJECT_BASE("vesting_delegation_object_base_size"),
    VESTING_DELEGATION_EXPIRATION_OBJECT_BASE("vesting_delegation_expiration_object_base_size"),
    WITHDRAW_VESTING_ROUTE_OBJECT_BASE("withdraw_vesting_route_object_base_size"),
    WITNESS_OBJECT_BASE("witness_object_base_size"),
    WITNESS_OBJECT_URL_CHAR("witness_object_url_char_size"),
    WITNESS_VOTE_OBJECT_BASE("witness_vote_object_base_size");

    private final String wireName;

    StateObjectSize(final String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<StateObjectSize> fromWireName(final String wireName) {
        for (StateObjectSize key : values()) {
            if (key.wireName.equals(wireName)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
