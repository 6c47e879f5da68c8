// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.rcmeter.core.error.MalformedOperationException;
import sh.rcmeter.core.op.OperationCodec;

/**
 * JSON parsing for transactions in the node API format.
 *
 * <p>Example:
 * <pre>{@code
 * Transaction tx = TransactionJson.parse("""
 *     {"ref_block_num": 12345, "ref_block_prefix": 31415926,
 *      "expiration": "2018-09-28T01:02:03",
 *      "operations": [{"type": "vote_operation", "value": {...}}],
 *      "extensions": [], "signatures": []}
 *     """);
 * }</pre>
 *
 * @see OperationCodec
 */
public final class TransactionJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS, true);

    private TransactionJson() {
    }

    /**
     * Parses a transaction from a JSON string.
     *
     * @throws MalformedOperationException if the JSON is invalid or a field is malformed
     * @throws sh.rcmeter.core.error.UnknownOperationException if an operation tag is unknown
     */
    public static Transaction parse(final String json) {
        Objects.requireNonNull(json, "json");
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedOperationException("transaction", "", "is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return fromTree(root);
    }

    /**
     * Decodes a transaction from an already parsed JSON tree.
     */
    public static Transaction fromTree(final JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedOperationException("transaction", "", "must be a JSON object");
        }
        final JsonNode refBlockNum = root.path("ref_block_num");
        if (!refBlockNum.isIntegralNumber() || !refBlockNum.canConvertToInt()) {
            throw new MalformedOperationException("transaction", "ref_block_num", "must be an integer");
        }
        final JsonNode refBlockPrefix = root.path("ref_block_prefix");
        if (!refBlockPrefix.isIntegralNumber() || !refBlockPrefix.canConvertToLong()) {
            throw new MalformedOperationException("transaction", "ref_block_prefix", "must be an integer");
        }
        final JsonNode expiration = root.path("expiration");
        if (!expiration.isTextual()) {
            throw new MalformedOperationException("transaction", "expiration", "must be a string");
        }

        final List<String> signatures = new ArrayList<>();
        final JsonNode sigs = root.path("signatures");
        if (!sigs.isMissingNode()) {
            if (!sigs.isArray()) {
                throw new MalformedOperationException("transaction", "signatures", "must be an array");
            }
            for (JsonNode sig : sigs) {
                if (!sig.isTextual()) {
                    throw new MalformedOperationException("transaction", "signatures", "entries must be strings");
                }
                signatures.add(sig.asText());
            }
        }

        return new Transaction(
                refBlockNum.intValue(),
                refBlockPrefix.longValue(),
                expiration.asText(),
                OperationCodec.decodeAll(root.get("operations")),
                signatures);
    }
}
