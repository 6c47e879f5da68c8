// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.rcmeter.core.config.ResourceType;

class RcExceptionTest {

    @Test
    void allErrorsShareTheRoot() {
        assertInstanceOf(RcException.class, new UnknownOperationException("x_operation"));
        assertInstanceOf(RcException.class, new RcConfigException("bad"));
        assertInstanceOf(RuntimeException.class, new UsageOverflowException("big", new ArithmeticException()));
    }

    @Test
    void malformedCarriesOperationAndField() {
        MalformedOperationException ex = new MalformedOperationException("vote_operation", "value.weight", "is missing");

        assertEquals("vote_operation", ex.operation());
        assertEquals("value.weight", ex.field());
        assertEquals("Malformed vote_operation: field 'value.weight' is missing", ex.getMessage());
    }

    @Test
    void degenerateCurveKeepsTheArithmeticCause() {
        ArithmeticException cause = new ArithmeticException("denominator is zero");

        DegenerateCurveException ex = new DegenerateCurveException(ResourceType.MARKET_BYTES, cause);

        assertEquals(ResourceType.MARKET_BYTES, ex.resource());
        assertSame(cause, ex.getCause());
        assertTrue(ex.getMessage().contains("resource_market_bytes"));
    }

    @Test
    void missingExecutionTimeNamesTheOperation() {
        MissingExecutionTimeException ex = new MissingExecutionTimeException("smt_create_operation");

        assertEquals("smt_create_operation", ex.operation());
        assertEquals("No execution time configured for smt_create_operation", ex.getMessage());
        assertInstanceOf(RcException.class, ex);
    }
}
