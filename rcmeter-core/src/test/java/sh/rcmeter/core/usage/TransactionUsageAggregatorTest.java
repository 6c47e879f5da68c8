// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.usage;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.rcmeter.core.Fixtures;
import sh.rcmeter.core.config.ResourceParameters;
import sh.rcmeter.core.error.UsageOverflowException;
import sh.rcmeter.core.op.GenericOperation;
import sh.rcmeter.core.op.OperationType;
import sh.rcmeter.core.tx.Transaction;

@ExtendWith(MockitoExtension.class)
class TransactionUsageAggregatorTest {

    private static final ResourceParameters PARAMS = Fixtures.params();

    @Mock
    private TransactionSizer sizer;

    private final TransactionUsageAggregator aggregator = new TransactionUsageAggregator(PARAMS);

    @Test
    void voteUsage() {
        UsageVector usage = aggregator.compute(Fixtures.transaction("vote"), Fixtures.VOTE_SIZE);

        assertEquals(133L, usage.historyBytes());
        assertEquals(0L, usage.newAccounts());
        assertEquals(0L, usage.marketBytes());
        // transaction_object_base + transaction_object_byte * size + comment_vote_object_base
        assertEquals(6090L + 174L * 133L + 470_000L, usage.stateBytes());
        assertEquals(26_500L, usage.executionTime());
    }

    @Test
    void transferChargesWholeSizeAsMarketBytes() {
        UsageVector usage = aggregator.compute(Fixtures.transaction("transfer"), Fixtures.TRANSFER_SIZE);

        assertEquals(282L, usage.marketBytes());
        assertEquals(55_158L, usage.stateBytes());
        assertEquals(9_600L, usage.executionTime());
    }

    @Test
    void postsMatchReferenceStateBytes() {
        assertEquals(4_434_812L,
                aggregator.compute(Fixtures.transaction("long_post"), Fixtures.LONG_POST_SIZE).stateBytes());
        assertEquals(2_961_738L,
                aggregator.compute(Fixtures.transaction("short_post"), Fixtures.SHORT_POST_SIZE).stateBytes());
    }

    @Test
    void marketBytesChargedOncePerTransaction() {
        Transaction tx = Transaction.of(
                GenericOperation.of(OperationType.TRANSFER),
                GenericOperation.of(OperationType.TRANSFER_TO_VESTING));

        assertEquals(300L, aggregator.compute(tx, 300L).marketBytes());
    }

    @Test
    void emptyTransactionOfZeroSizeStoresOnlyTheTransactionObject() {
        UsageVector usage = aggregator.compute(Transaction.of(List.of()), 0L);

        assertEquals(new UsageVector(0L, 0L, 0L, 6090L, 0L), usage);
    }

    @Test
    void rejectsNegativeSize() {
        Transaction tx = Fixtures.transaction("vote");
        assertThrows(IllegalArgumentException.class, () -> aggregator.compute(tx, -1L));
    }

    @Test
    void hugeSizeOverflows() {
        Transaction tx = Fixtures.transaction("vote");
        assertThrows(UsageOverflowException.class, () -> aggregator.compute(tx, Long.MAX_VALUE / 2));
    }

    @Test
    void measuresWithConfiguredSizer() {
        Transaction tx = Fixtures.transaction("vote");
        when(sizer.serializedSize(tx)).thenReturn(Fixtures.VOTE_SIZE);

        UsageVector usage = new TransactionUsageAggregator(PARAMS, sizer).compute(tx);

        assertEquals(499_232L, usage.stateBytes());
        verify(sizer).serializedSize(tx);
    }

    @Test
    void failsWithoutSizer() {
        Transaction tx = Fixtures.transaction("vote");
        assertThrows(IllegalStateException.class, () -> aggregator.compute(tx));
    }
}
