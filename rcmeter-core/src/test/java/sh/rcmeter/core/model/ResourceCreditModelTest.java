// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import sh.rcmeter.core.Fixtures;
import sh.rcmeter.core.config.ResourceParameters;
import sh.rcmeter.core.config.ResourceParams;
import sh.rcmeter.core.config.ResourcePool;
import sh.rcmeter.core.config.ResourceType;
import sh.rcmeter.core.error.DegenerateCurveException;
import sh.rcmeter.core.error.MissingExecutionTimeException;
import sh.rcmeter.core.error.UnknownOperationException;
import sh.rcmeter.core.op.ClaimAccountOperation;
import sh.rcmeter.core.op.GenericOperation;
import sh.rcmeter.core.op.OperationType;
import sh.rcmeter.core.tx.Transaction;
import sh.rcmeter.core.types.Asset;
import sh.rcmeter.core.usage.UsageVector;
import sh.rcmeter.primitives.CurveParams;

class ResourceCreditModelTest {

    private final ResourceCreditModel model = Fixtures.model();

    @ParameterizedTest
    @CsvSource({
        "vote,       133,  280272911",
        "transfer,   282,  610729799",
        "short_post, 952,  1714308736",
        "long_post,  9303, 5059516814"
    })
    void matchesReferenceTotals(String name, long size, long expected) {
        TransactionCost cost = model.getTransactionCost(Fixtures.transaction(name), size);
        assertEquals(BigInteger.valueOf(expected), cost.total());
    }

    @Test
    void votePerResourceCosts() {
        TransactionCost cost = model.getTransactionCost(Fixtures.transaction("vote"), Fixtures.VOTE_SIZE);

        assertEquals(BigInteger.valueOf(42083274L), cost.cost(ResourceType.HISTORY_BYTES));
        assertEquals(BigInteger.ZERO, cost.cost(ResourceType.NEW_ACCOUNTS));
        assertEquals(BigInteger.ZERO, cost.cost(ResourceType.MARKET_BYTES));
        assertEquals(BigInteger.valueOf(238189637L), cost.cost(ResourceType.STATE_BYTES));
        assertEquals(BigInteger.ZERO, cost.cost(ResourceType.EXECUTION_TIME));
        assertEquals(499232L, cost.usage().stateBytes());
        assertEquals(BigInteger.valueOf(499232L), cost.scaledUsage().get(ResourceType.STATE_BYTES));
    }

    @Test
    void transferChargesMarketBytesScaledByResourceUnit() {
        TransactionCost cost = model.getTransactionCost(Fixtures.transaction("transfer"), Fixtures.TRANSFER_SIZE);

        assertEquals(282L, cost.usage().marketBytes());
        assertEquals(BigInteger.valueOf(2820L), cost.scaledUsage().get(ResourceType.MARKET_BYTES));
        assertEquals(BigInteger.valueOf(89229198L), cost.cost(ResourceType.HISTORY_BYTES));
        assertEquals(BigInteger.valueOf(495184050L), cost.cost(ResourceType.MARKET_BYTES));
        assertEquals(BigInteger.valueOf(26316551L), cost.cost(ResourceType.STATE_BYTES));
    }

    @Test
    void postsPerResourceCosts() {
        TransactionCost longPost = model.getTransactionCost(Fixtures.transaction("long_post"), Fixtures.LONG_POST_SIZE);
        assertEquals(BigInteger.valueOf(2943614268L), longPost.cost(ResourceType.HISTORY_BYTES));
        assertEquals(BigInteger.valueOf(2115902546L), longPost.cost(ResourceType.STATE_BYTES));
        assertEquals(4434812L, longPost.usage().stateBytes());

        TransactionCost shortPost = model.getTransactionCost(Fixtures.transaction("short_post"), Fixtures.SHORT_POST_SIZE);
        assertEquals(BigInteger.valueOf(301227646L), shortPost.cost(ResourceType.HISTORY_BYTES));
        assertEquals(BigInteger.valueOf(1413081090L), shortPost.cost(ResourceType.STATE_BYTES));
        assertEquals(2961738L, shortPost.usage().stateBytes());
    }

    @Test
    void executionTimeIsAccumulatedButNotPricedByDefault() {
        TransactionCost cost = model.getTransactionCost(Fixtures.transaction("vote"), Fixtures.VOTE_SIZE);

        assertEquals(26500L, cost.usage().executionTime());
        assertEquals(BigInteger.ZERO, cost.scaledUsage().get(ResourceType.EXECUTION_TIME));
        assertEquals(BigInteger.ZERO, cost.cost(ResourceType.EXECUTION_TIME));
    }

    @Test
    void pricingExecutionTimeAddsItsCost() {
        ResourceCreditModel priced = model.toBuilder()
                .pricedResources(EnumSet.allOf(ResourceType.class))
                .build();

        TransactionCost cost = priced.getTransactionCost(Fixtures.transaction("vote"), Fixtures.VOTE_SIZE);

        assertEquals(BigInteger.valueOf(35356940L), cost.cost(ResourceType.EXECUTION_TIME));
        assertEquals(BigInteger.valueOf(280272911L + 35356940L), cost.total());
    }

    @Test
    void decodesAndPricesJsonInOneStep() {
        TransactionCost cost = model.getTransactionCost(Fixtures.transactionJson("vote"), Fixtures.VOTE_SIZE);
        assertEquals(BigInteger.valueOf(280272911L), cost.total());
    }

    @Test
    void unknownOperationLeavesPoolUntouched() {
        String json = """
                {"ref_block_num": 1, "ref_block_prefix": 2, "expiration": "2018-09-28T01:02:03",
                 "operations": [{"type": "teleport_operation", "value": {}}]}
                """;
        ResourcePool before = model.pool();

        UnknownOperationException ex = assertThrows(UnknownOperationException.class,
                () -> model.getTransactionCost(json, 100L));

        assertEquals("teleport_operation", ex.tag());
        assertEquals(before, model.pool());
    }

    @Test
    void operationWithoutExecutionTimeFailsOnlyItsTransaction() {
        String json = """
                {"ref_block_num": 1, "ref_block_prefix": 2, "expiration": "2018-09-28T01:02:03",
                 "operations": [{"type": "smt_create_operation", "value": {}}]}
                """;
        ResourcePool before = model.pool();

        MissingExecutionTimeException ex = assertThrows(MissingExecutionTimeException.class,
                () -> model.getTransactionCost(json, 120L));

        assertEquals("smt_create_operation", ex.operation());
        assertEquals(before, model.pool());
        assertEquals(BigInteger.valueOf(280272911L),
                model.getTransactionCost(Fixtures.transaction("vote"), Fixtures.VOTE_SIZE).total());
    }

    @Test
    void freeClaimAccountConsumesOneAccountToken() {
        Transaction tx = Transaction.of(new ClaimAccountOperation("alice",
                new Asset(BigInteger.ZERO, 3, "@@000000021")));

        TransactionCost cost = model.getTransactionCost(tx, 100L);

        assertEquals(1L, cost.usage().newAccounts());
        assertEquals(BigInteger.valueOf(10000L), cost.scaledUsage().get(ResourceType.NEW_ACCOUNTS));
        assertEquals(BigInteger.valueOf(7823340709703L), cost.cost(ResourceType.NEW_ACCOUNTS));
    }

    @Test
    void zeroUsageIsFree() {
        TransactionCost cost = model.price(UsageVector.ZERO);
        assertEquals(BigInteger.ZERO, cost.total());
    }

    @Test
    void degenerateCurveNamesTheResource() {
        CurveParams broken = new CurveParams(BigInteger.ONE, BigInteger.ZERO, 0);
        ResourceParameters params = Fixtures.params();
        Map<ResourceType, BigInteger> empty = new EnumMap<>(ResourceType.class);
        for (ResourceType type : ResourceType.values()) {
            empty.put(type, BigInteger.ZERO);
        }
        ResourceParameters brokenParams = new ResourceParameters(
                params.resourceNames(),
                withCurve(params, ResourceType.HISTORY_BYTES, broken),
                params.stateBytesSizes(),
                params.executionTimes());
        ResourceCreditModel degenerate = model.toBuilder()
                .parameters(brokenParams)
                .pool(new ResourcePool(empty))
                .build();
        Transaction tx = Transaction.of(GenericOperation.of(OperationType.TRANSFER_TO_SAVINGS));

        DegenerateCurveException ex = assertThrows(DegenerateCurveException.class,
                () -> degenerate.getTransactionCost(tx, 10L));

        assertEquals(ResourceType.HISTORY_BYTES, ex.resource());
    }

    @Test
    void withPoolKeepsEverythingElse() {
        ResourcePool next = model.applyPoolDynamics(UsageVector.ZERO).nextPool();

        ResourceCreditModel advanced = model.withPool(next);

        assertEquals(next, advanced.pool());
        assertEquals(model.regen(), advanced.regen());
        assertEquals(model.pricedResources(), advanced.pricedResources());
        assertEquals(model.dt(), advanced.dt());
        assertNotEquals(model.pool(), advanced.pool());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(NullPointerException.class, () -> ResourceCreditModel.builder().pool(Fixtures.pool()).build());
        assertThrows(IllegalArgumentException.class,
                () -> model.toBuilder().regen(BigInteger.valueOf(-1)).build());
        assertThrows(IllegalArgumentException.class, () -> model.toBuilder().dt(-1L).build());
    }

    @Test
    void sizeFromSizerRequiresOne() {
        Transaction tx = Fixtures.transaction("vote");
        assertThrows(IllegalStateException.class, () -> model.getTransactionCost(tx));

        ResourceCreditModel sized = model.toBuilder().sizer(t -> Fixtures.VOTE_SIZE).build();
        assertEquals(BigInteger.valueOf(280272911L), sized.getTransactionCost(tx).total());
    }

    private static Map<ResourceType, ResourceParams> withCurve(
            ResourceParameters params, ResourceType type, CurveParams curve) {
        Map<ResourceType, ResourceParams> map = new EnumMap<>(ResourceType.class);
        for (ResourceType t : ResourceType.values()) {
            map.put(t, params.params(t));
        }
        map.put(type, new ResourceParams(params.params(type).dynamics(), curve));
        return map;
    }
}
