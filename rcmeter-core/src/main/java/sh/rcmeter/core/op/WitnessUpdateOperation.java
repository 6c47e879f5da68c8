// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import sh.rcmeter.core.types.Asset;

/**
 * Registers or updates a block producer.
 */
public record WitnessUpdateOperation(
        String owner,
        String url,
        String blockSigningKey,
        Asset fee) implements Operation {

    public WitnessUpdateOperation {
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(url, "url cannot be null");
        Objects.requireNonNull(blockSigningKey, "blockSigningKey cannot be null");
        Objects.requireNonNull(fee, "fee cannot be null");
    }

    /**
     * @return the UTF-8 encoded length of the url
     */
    public int urlByteLength() {
        return url.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public OperationType type() {
        return OperationType.WITNESS_UPDATE;
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitWitnessUpdate(this);
    }
}
