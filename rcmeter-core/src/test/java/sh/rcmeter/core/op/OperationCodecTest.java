// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.rcmeter.core.error.MalformedOperationException;
import sh.rcmeter.core.error.UnknownOperationException;
import sh.rcmeter.core.types.Authority;

class OperationCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String AUTHORITY = """
            {"weight_threshold": 1, "account_auths": [["carol", 1]],
             "key_auths": [["STM6LLegbAgLAy28EHrffBVuANFWcFgmqRMW13wBmTExqFE9SCkg4", 1]]}
            """;

    @Test
    void decodesVoteAsGenericOperation() throws Exception {
        Operation op = OperationCodec.decode(json("""
                {"type": "vote_operation",
                 "value": {"voter": "alice", "author": "bob", "permlink": "hello", "weight": 10000}}
                """));

        GenericOperation generic = assertInstanceOf(GenericOperation.class, op);
        assertEquals(OperationType.VOTE, generic.type());
        assertEquals("alice", generic.value().get("voter").asText());
    }

    @Test
    void decodesAccountCreate() throws Exception {
        Operation op = OperationCodec.decode(json("""
                {"type": "account_create_operation", "value": {
                  "fee": {"amount": "3000", "precision": 3, "nai": "@@000000021"},
                  "creator": "alice", "new_account_name": "bob",
                  "owner": %1$s, "active": %1$s, "posting": %1$s,
                  "memo_key": "STM8key", "json_metadata": ""}}
                """.formatted(AUTHORITY)));

        AccountCreateOperation create = assertInstanceOf(AccountCreateOperation.class, op);
        assertEquals("bob", create.newAccountName());
        assertEquals(BigInteger.valueOf(3000L), create.fee().amount());
        Authority owner = create.owner();
        assertEquals(1L, owner.weightThreshold());
        assertEquals(List.of(new Authority.Entry("carol", 1L)), owner.accountAuths());
        assertEquals(1, owner.keyAuths().size());
    }

    @Test
    void decodesCommentOptionsExtensions() throws Exception {
        Operation op = OperationCodec.decode(json("""
                {"type": "comment_options_operation", "value": {
                  "author": "bob", "permlink": "hello",
                  "max_accepted_payout": {"amount": "1000000000", "precision": 3, "nai": "@@000000013"},
                  "percent_steem_dollars": 10000, "allow_votes": true, "allow_curation_rewards": true,
                  "extensions": [
                    {"type": "comment_payout_beneficiaries",
                     "value": {"beneficiaries": [{"account": "carol", "weight": 1000}]}},
                    {"type": "allowed_vote_assets",
                     "value": {"votable_assets": [["@@000000013", {"max_accepted_payout": 10}]]}}
                  ]}}
                """));

        CommentOptionsOperation options = assertInstanceOf(CommentOptionsOperation.class, op);
        assertEquals(2, options.extensions().size());
        CommentPayoutBeneficiaries beneficiaries =
                assertInstanceOf(CommentPayoutBeneficiaries.class, options.extensions().get(0));
        assertEquals("carol", beneficiaries.beneficiaries().get(0).account());
        AllowedVoteAssets assets = assertInstanceOf(AllowedVoteAssets.class, options.extensions().get(1));
        assertEquals(List.of("@@000000013"), assets.assetNais());
    }

    @Test
    void decodesLimitOrderOfEitherVersion() throws Exception {
        String value = """
                {"owner": "alice", "orderid": 7,
                 "amount_to_sell": {"amount": 1000, "precision": 3, "nai": "@@000000021"},
                 "fill_or_kill": true, "expiration": "2018-09-28T01:02:03"}
                """;

        LimitOrderCreateOperation v1 = assertInstanceOf(LimitOrderCreateOperation.class,
                OperationCodec.decode(json("{\"type\": \"limit_order_create_operation\", \"value\": " + value + "}")));
        LimitOrderCreateOperation v2 = assertInstanceOf(LimitOrderCreateOperation.class,
                OperationCodec.decode(json("{\"type\": \"limit_order_create2_operation\", \"value\": " + value + "}")));

        assertEquals(OperationType.LIMIT_ORDER_CREATE, v1.type());
        assertEquals(OperationType.LIMIT_ORDER_CREATE2, v2.type());
        assertTrue(v2.fillOrKill());
        assertEquals(7L, v1.orderId());
    }

    @Test
    void decodesIgnoredOperations() throws Exception {
        Operation op = OperationCodec.decode(json("{\"type\": \"producer_reward_operation\", \"value\": {}}"));
        assertEquals(OperationType.PRODUCER_REWARD, op.type());
        assertFalse(op.type().isCharged());
    }

    @Test
    void unknownTagIsRejected() throws Exception {
        UnknownOperationException ex = assertThrows(UnknownOperationException.class,
                () -> OperationCodec.decode(json("{\"type\": \"teleport_operation\", \"value\": {}}")));
        assertEquals("teleport_operation", ex.tag());
    }

    @Test
    void unknownCommentOptionsExtensionIsRejected() throws Exception {
        JsonNode node = json("""
                {"type": "comment_options_operation", "value": {
                  "author": "bob", "permlink": "hello",
                  "max_accepted_payout": {"amount": "0", "precision": 3, "nai": "@@000000013"},
                  "percent_steem_dollars": 0, "allow_votes": true, "allow_curation_rewards": true,
                  "extensions": [{"type": "mystery_extension", "value": {}}]}}
                """);

        UnknownOperationException ex = assertThrows(UnknownOperationException.class, () -> OperationCodec.decode(node));
        assertEquals("mystery_extension", ex.tag());
    }

    @Test
    void missingFieldNamesItsPath() throws Exception {
        JsonNode node = json("{\"type\": \"claim_account_operation\", \"value\": "
                + "{\"fee\": {\"amount\": \"0\", \"precision\": 3, \"nai\": \"@@000000021\"}}}");

        MalformedOperationException ex = assertThrows(MalformedOperationException.class,
                () -> OperationCodec.decode(node));

        assertEquals("claim_account_operation", ex.operation());
        assertEquals("value.creator", ex.field());
    }

    @Test
    void malformedAuthorityPairNamesItsIndex() throws Exception {
        String badAuthority = "{\"weight_threshold\": 1, \"account_auths\": [], \"key_auths\": [[\"STM8key\"]]}";
        JsonNode node = json("""
                {"type": "create_claimed_account_operation", "value": {
                  "creator": "alice", "new_account_name": "bob",
                  "owner": %s, "active": %s, "posting": %s, "memo_key": "STM8key"}}
                """.formatted(badAuthority, AUTHORITY, AUTHORITY));

        MalformedOperationException ex = assertThrows(MalformedOperationException.class,
                () -> OperationCodec.decode(node));

        assertEquals("value.owner.key_auths[0]", ex.field());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "[]",
        "{\"value\": {}}",
        "{\"type\": 5, \"value\": {}}",
        "{\"type\": \"vote_operation\"}",
        "{\"type\": \"vote_operation\", \"value\": []}"
    })
    void malformedEnvelopeIsRejected(String envelope) throws Exception {
        JsonNode node = json(envelope);
        assertThrows(MalformedOperationException.class, () -> OperationCodec.decode(node));
    }

    @Test
    void wrongFieldTypeIsRejected() throws Exception {
        JsonNode node = json("""
                {"type": "witness_update_operation", "value": {
                  "owner": "alice", "url": 42, "block_signing_key": "STM8key",
                  "fee": {"amount": "0", "precision": 3, "nai": "@@000000021"}}}
                """);

        MalformedOperationException ex = assertThrows(MalformedOperationException.class,
                () -> OperationCodec.decode(node));
        assertEquals("value.url", ex.field());
    }

    @Test
    void invalidRecordArgumentsBecomeMalformed() throws Exception {
        JsonNode node = json("""
                {"type": "claim_account_operation", "value": {
                  "creator": "alice", "fee": {"amount": "0", "precision": -1, "nai": "@@000000021"}}}
                """);

        assertThrows(MalformedOperationException.class, () -> OperationCodec.decode(node));
    }

    @Test
    void decodeAllPreservesOrder() throws Exception {
        List<Operation> ops = OperationCodec.decodeAll(json("""
                [{"type": "transfer_operation", "value": {}},
                 {"type": "vote_operation", "value": {}},
                 {"type": "custom_json_operation", "value": {}}]
                """));

        assertEquals(List.of(OperationType.TRANSFER, OperationType.VOTE, OperationType.CUSTOM_JSON),
                ops.stream().map(Operation::type).toList());
    }

    @Test
    void decodeAllRequiresAnArray() throws Exception {
        JsonNode node = json("{}");
        assertThrows(MalformedOperationException.class, () -> OperationCodec.decodeAll(node));
        assertThrows(MalformedOperationException.class, () -> OperationCodec.decodeAll(null));
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }
}
