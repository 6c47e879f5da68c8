// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.rcmeter.core.error.MissingExecutionTimeException;
import sh.rcmeter.core.error.RcConfigException;
import sh.rcmeter.core.op.OperationType;

class ExecutionTimeTableTest {

    @Test
    void coversEveryChargedOperation() {
        ExecutionTimeTable table = new ExecutionTimeTable(complete());
        assertTrue(table.missing().isEmpty());

        for (OperationType type : OperationType.charged()) {
            assertEquals(100L, table.get(type));
        }
    }

    @Test
    void acceptsPartialTable() {
        Map<OperationType, Long> times = complete();
        times.remove(OperationType.CLAIM_REWARD_BALANCE2);
        times.remove(OperationType.SMT_CREATE);

        ExecutionTimeTable table = new ExecutionTimeTable(times);

        assertEquals(EnumSet.of(OperationType.CLAIM_REWARD_BALANCE2, OperationType.SMT_CREATE), table.missing());
        assertFalse(table.contains(OperationType.SMT_CREATE));
        assertTrue(table.contains(OperationType.VOTE));
        assertEquals(100L, table.get(OperationType.VOTE));
    }

    @Test
    void missingEntryFailsOnLookup() {
        ExecutionTimeTable table = new ExecutionTimeTable(new EnumMap<>(OperationType.class));

        MissingExecutionTimeException ex = assertThrows(MissingExecutionTimeException.class,
                () -> table.get(OperationType.SMT_CREATE));
        assertEquals("smt_create_operation", ex.operation());
        assertEquals(OperationType.charged(), table.missing());
    }

    @Test
    void rejectsIgnoredOperation() {
        Map<OperationType, Long> times = complete();
        times.put(OperationType.POW, 1L);

        assertThrows(RcConfigException.class, () -> new ExecutionTimeTable(times));
    }

    @Test
    void rejectsNegativeTime() {
        Map<OperationType, Long> times = complete();
        times.put(OperationType.VOTE, -1L);

        assertThrows(RcConfigException.class, () -> new ExecutionTimeTable(times));
    }

    @Test
    void ignoredOperationsHaveNoTime() {
        ExecutionTimeTable table = new ExecutionTimeTable(complete());
        assertThrows(IllegalArgumentException.class, () -> table.get(OperationType.FILL_ORDER));
    }

    @Test
    void keyIsWireNameWithSuffix() {
        assertEquals("vote_operation_exec_time", ExecutionTimeTable.key(OperationType.VOTE));
    }

    @Test
    void copiesItsInput() {
        Map<OperationType, Long> times = complete();
        ExecutionTimeTable table = new ExecutionTimeTable(times);
        times.put(OperationType.VOTE, 5L);

        assertEquals(100L, table.get(OperationType.VOTE));
    }

    private static Map<OperationType, Long> complete() {
        Map<OperationType, Long> times = new EnumMap<>(OperationType.class);
        for (OperationType type : OperationType.charged()) {
            times.put(type, 100L);
        }
        return times;
    }
}
