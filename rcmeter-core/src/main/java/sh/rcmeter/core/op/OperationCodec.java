// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import sh.rcmeter.core.error.MalformedOperationException;
import sh.rcmeter.core.error.UnknownOperationException;
import sh.rcmeter.core.types.Asset;
import sh.rcmeter.core.types.Authority;
import sh.rcmeter.core.types.Beneficiary;

/**
 * Decodes operations from their tagged JSON form
 * {@code {"type": "vote_operation", "value": {...}}}.
 *
 * <p>
 * Decoding is strict: a missing field or a field of the wrong JSON type raises
 * {@link MalformedOperationException}, and an unrecognized tag raises
 * {@link UnknownOperationException}. Numbers are never read from strings or
 * vice versa, except asset amounts, which the wire format sends as decimal
 * strings.
 *
 * @see sh.rcmeter.core.tx.TransactionJson
 */
public final class OperationCodec {

    private OperationCodec() {
    }

    /**
     * Decodes one tagged operation.
     *
     * @param node the {@code {type, value}} object
     * @return the decoded operation
     * @throws UnknownOperationException   if the tag is not a known operation
     * @throws MalformedOperationException if the envelope or any required field is malformed
     */
    public static Operation decode(final JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedOperationException("operation", "", "must be a JSON object");
        }
        final JsonNode tag = node.get("type");
        if (tag == null || !tag.isTextual()) {
            throw new MalformedOperationException("operation", "type", "must be a string");
        }
        final OperationType type = OperationType.fromWireName(tag.asText())
                .orElseThrow(() -> new UnknownOperationException(tag.asText()));

        final Fields value = Fields.of(type.wireName(), node, "value");
        try {
            return decodeValue(type, value);
        } catch (IllegalArgumentException e) {
            throw new MalformedOperationException(type.wireName(), "value", e.getMessage(), e);
        }
    }

    private static Operation decodeValue(final OperationType type, final Fields value) {
        return switch (type) {
            case ACCOUNT_CREATE -> new AccountCreateOperation(
                    value.asset("fee"),
                    value.text("creator"),
                    value.text("new_account_name"),
                    value.authority("owner"),
                    value.authority("active"),
                    value.authority("posting"),
                    value.text("memo_key"));
            case ACCOUNT_CREATE_WITH_DELEGATION -> new AccountCreateWithDelegationOperation(
                    value.asset("fee"),
                    value.asset("delegation"),
                    value.text("creator"),
                    value.text("new_account_name"),
                    value.authority("owner"),
                    value.authority("active"),
                    value.authority("posting"),
                    value.text("memo_key"));
            case CREATE_CLAIMED_ACCOUNT -> new CreateClaimedAccountOperation(
                    value.text("creator"),
                    value.text("new_account_name"),
                    value.authority("owner"),
                    value.authority("active"),
                    value.authority("posting"),
                    value.text("memo_key"));
            case CLAIM_ACCOUNT -> new ClaimAccountOperation(
                    value.text("creator"),
                    value.asset("fee"));
            case COMMENT -> new CommentOperation(
                    value.text("parent_author"),
                    value.text("parent_permlink"),
                    value.text("author"),
                    value.text("permlink"),
                    value.text("title"),
                    value.text("body"),
                    value.text("json_metadata"));
            case COMMENT_OPTIONS -> new CommentOptionsOperation(
                    value.text("author"),
                    value.text("permlink"),
                    value.asset("max_accepted_payout"),
                    value.integer("percent_steem_dollars"),
                    value.bool("allow_votes"),
                    value.bool("allow_curation_rewards"),
                    commentOptionsExtensions(value));
            case LIMIT_ORDER_CREATE, LIMIT_ORDER_CREATE2 -> new LimitOrderCreateOperation(
                    type,
                    value.text("owner"),
                    value.number("orderid"),
                    value.asset("amount_to_sell"),
                    value.bool("fill_or_kill"),
                    value.text("expiration"));
            case WITNESS_UPDATE -> new WitnessUpdateOperation(
                    value.text("owner"),
                    value.text("url"),
                    value.text("block_signing_key"),
                    value.asset("fee"));
            default -> new GenericOperation(type, value.node());
        };
    }

    /**
     * Decodes an array of tagged operations, preserving order.
     */
    public static List<Operation> decodeAll(final JsonNode array) {
        if (array == null || !array.isArray()) {
            throw new MalformedOperationException("transaction", "operations", "must be an array");
        }
        final List<Operation> operations = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            operations.add(decode(element));
        }
        return operations;
    }

    private static List<CommentOptionsExtension> commentOptionsExtensions(final Fields value) {
        final List<CommentOptionsExtension> extensions = new ArrayList<>();
        for (Fields element : value.objects("extensions")) {
            final String tag = element.text("type");
            if (CommentPayoutBeneficiaries.TAG.equals(tag)) {
                final List<Beneficiary> beneficiaries = new ArrayList<>();
                for (Fields b : element.child("value").objects("beneficiaries")) {
                    beneficiaries.add(new Beneficiary(b.text("account"), b.integer("weight")));
                }
                extensions.add(new CommentPayoutBeneficiaries(beneficiaries));
            } else if (AllowedVoteAssets.TAG.equals(tag)) {
                final List<String> nais = new ArrayList<>();
                final Fields assets = element.child("value");
                for (JsonNode pair : assets.array("votable_assets")) {
                    if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isTextual()) {
                        throw assets.malformed("votable_assets", "entries must be [nai, params] pairs");
                    }
                    nais.add(pair.get(0).asText());
                }
                extensions.add(new AllowedVoteAssets(nais));
            } else {
                throw new UnknownOperationException(tag);
            }
        }
        return extensions;
    }

    /**
     * Strict field access on one JSON object, tracking the path for error messages.
     */
    private static final class Fields {

        private final String operation;
        private final String path;
        private final JsonNode node;

        private Fields(final String operation, final String path, final JsonNode node) {
            this.operation = operation;
            this.path = path;
            this.node = node;
        }

        static Fields of(final String operation, final JsonNode parent, final String field) {
            final JsonNode child = parent.get(field);
            if (child == null || !child.isObject()) {
                throw new MalformedOperationException(operation, field, "must be a JSON object");
            }
            return new Fields(operation, field, child);
        }

        JsonNode node() {
            return node;
        }

        Fields child(final String field) {
            final JsonNode child = require(field);
            if (!child.isObject()) {
                throw malformed(field, "must be a JSON object");
            }
            return new Fields(operation, qualify(field), child);
        }

        String text(final String field) {
            final JsonNode child = require(field);
            if (!child.isTextual()) {
                throw malformed(field, "must be a string");
            }
            return child.asText();
        }

        boolean bool(final String field) {
            final JsonNode child = require(field);
            if (!child.isBoolean()) {
                throw malformed(field, "must be a boolean");
            }
            return child.booleanValue();
        }

        int integer(final String field) {
            final JsonNode child = require(field);
            if (!child.isIntegralNumber() || !child.canConvertToInt()) {
                throw malformed(field, "must be a 32-bit integer");
            }
            return child.intValue();
        }

        long number(final String field) {
            final JsonNode child = require(field);
            if (!child.isIntegralNumber() || !child.canConvertToLong()) {
                throw malformed(field, "must be a 64-bit integer");
            }
            return child.longValue();
        }

        JsonNode array(final String field) {
            final JsonNode child = require(field);
            if (!child.isArray()) {
                throw malformed(field, "must be an array");
            }
            return child;
        }

        List<Fields> objects(final String field) {
            final JsonNode array = array(field);
            final List<Fields> result = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                final JsonNode element = array.get(i);
                if (!element.isObject()) {
                    throw malformed(field + "[" + i + "]", "must be a JSON object");
                }
                result.add(new Fields(operation, qualify(field + "[" + i + "]"), element));
            }
            return result;
        }

        Asset asset(final String field) {
            final Fields asset = child(field);
            final JsonNode amount = asset.require("amount");
            final BigInteger value;
            if (amount.isTextual()) {
                try {
                    value = new BigInteger(amount.asText());
                } catch (NumberFormatException e) {
                    throw new MalformedOperationException(operation, asset.qualify("amount"),
                            "must be a decimal integer, got: " + amount.asText(), e);
                }
            } else if (amount.isIntegralNumber()) {
                value = amount.bigIntegerValue();
            } else {
                throw asset.malformed("amount", "must be a decimal string or integer");
            }
            return new Asset(value, asset.integer("precision"), asset.text("nai"));
        }

        Authority authority(final String field) {
            final Fields authority = child(field);
            return new Authority(
                    authority.number("weight_threshold"),
                    authority.weightedPairs("account_auths"),
                    authority.weightedPairs("key_auths"));
        }

        private List<Authority.Entry> weightedPairs(final String field) {
            final JsonNode array = array(field);
            final List<Authority.Entry> entries = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                final JsonNode pair = array.get(i);
                if (!pair.isArray() || pair.size() != 2
                        || !pair.get(0).isTextual() || !pair.get(1).isIntegralNumber()) {
                    throw malformed(field + "[" + i + "]", "must be a [principal, weight] pair");
                }
                entries.add(new Authority.Entry(pair.get(0).asText(), pair.get(1).longValue()));
            }
            return entries;
        }

        private JsonNode require(final String field) {
            final JsonNode child = node.get(field);
            if (child == null || child.isNull()) {
                throw malformed(field, "is missing");
            }
            return child;
        }

        MalformedOperationException malformed(final String field, final String reason) {
            return new MalformedOperationException(operation, qualify(field), reason);
        }

        private String qualify(final String field) {
            return path + "." + field;
        }
    }
}
