// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.rcmeter.core.error.RcConfigException;
import sh.rcmeter.core.op.OperationType;
import sh.rcmeter.primitives.CurveParams;
import sh.rcmeter.primitives.DecayParams;

/**
 * Loads resource parameters and pool snapshots from the node API JSON
 * documents ({@code get_resource_params} and {@code get_resource_pool}).
 *
 * <p>
 * Values that may exceed 64 bits are accepted either as JSON integers or as
 * decimal strings and are always read into {@link BigInteger}; they never pass
 * through a {@code long} or {@code double}.
 *
 * <p>Example:
 * <pre>{@code
 * ResourceParameters params = ResourceParametersJson.loadParameters("rc/resource-params.json");
 * ResourcePool pool = ResourceParametersJson.parsePool(poolJson);
 * }</pre>
 */
public final class ResourceParametersJson {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceParametersJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS, true);

    private static final Map<String, OperationType> EXEC_TIME_KEYS = execTimeKeys();

    private ResourceParametersJson() {
    }

    private static Map<String, OperationType> execTimeKeys() {
        final Map<String, OperationType> keys = new HashMap<>();
        for (OperationType type : OperationType.charged()) {
            keys.put(ExecutionTimeTable.key(type), type);
        }
        return Map.copyOf(keys);
    }

    public static ResourceParameters parseParameters(final String json) {
        Objects.requireNonNull(json, "json");
        return parameters(read(json));
    }

    public static ResourceParameters parseParameters(final InputStream in) {
        Objects.requireNonNull(in, "in");
        return parameters(read(in));
    }

    /**
     * Loads parameters from a classpath resource.
     *
     * @throws RcConfigException if the resource does not exist or is invalid
     */
    public static ResourceParameters loadParameters(final String resource) {
        try (InputStream in = open(resource)) {
            return parseParameters(in);
        } catch (IOException e) {
            throw new RcConfigException("Failed to read " + resource + ": " + e.getMessage(), e);
        }
    }

    public static ResourcePool parsePool(final String json) {
        Objects.requireNonNull(json, "json");
        return pool(read(json));
    }

    public static ResourcePool parsePool(final InputStream in) {
        Objects.requireNonNull(in, "in");
        return pool(read(in));
    }

    /**
     * Loads a pool snapshot from a classpath resource.
     *
     * @throws RcConfigException if the resource does not exist or is invalid
     */
    public static ResourcePool loadPool(final String resource) {
        try (InputStream in = open(resource)) {
            return parsePool(in);
        } catch (IOException e) {
            throw new RcConfigException("Failed to read " + resource + ": " + e.getMessage(), e);
        }
    }

    private static ResourceParameters parameters(final JsonNode root) {
        final List<ResourceType> names = new ArrayList<>();
        for (JsonNode name : array(root, "resource_names")) {
            names.add(resourceType(name, "resource_names"));
        }

        final JsonNode paramsNode = object(root, "resource_params");
        final Map<ResourceType, ResourceParams> params = new EnumMap<>(ResourceType.class);
        final Iterator<Map.Entry<String, JsonNode>> fields = paramsNode.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            final ResourceType type = ResourceType.fromWireName(entry.getKey())
                    .orElseThrow(() -> new RcConfigException("Unknown resource in resource_params: " + entry.getKey()));
            params.put(type, resourceParams(entry.getValue(), "resource_params." + entry.getKey()));
        }

        final JsonNode sizeInfo = object(root, "size_info");
        final ResourceParameters parameters = new ResourceParameters(
                names,
                params,
                stateBytesSizes(object(sizeInfo, "resource_state_bytes")),
                executionTimes(object(sizeInfo, "resource_execution_time")));
        LOG.debug("Loaded resource parameters for {}", names);
        return parameters;
    }

    private static ResourceParams resourceParams(final JsonNode node, final String path) {
        final JsonNode dynamics = object(node, "resource_dynamics_params", path);
        final String dynamicsPath = path + ".resource_dynamics_params";
        final JsonNode decay = object(dynamics, "decay_params", dynamicsPath);
        final String decayPath = dynamicsPath + ".decay_params";
        final JsonNode curve = object(node, "price_curve_params", path);
        final String curvePath = path + ".price_curve_params";
        try {
            return new ResourceParams(
                    new ResourceDynamicsParams(
                            wide(dynamics, "resource_unit", dynamicsPath),
                            wide(dynamics, "budget_per_time_unit", dynamicsPath),
                            wide(dynamics, "pool_eq", dynamicsPath),
                            wide(dynamics, "max_pool_size", dynamicsPath),
                            new DecayParams(
                                    wide(decay, "decay_per_time_unit", decayPath),
                                    smallInt(decay, "decay_per_time_unit_denom_shift", decayPath)),
                            wide(dynamics, "min_decay", dynamicsPath)),
                    new CurveParams(
                            wide(curve, "coeff_a", curvePath),
                            wide(curve, "coeff_b", curvePath),
                            smallInt(curve, "shift", curvePath)));
        } catch (IllegalArgumentException e) {
            throw new RcConfigException("Invalid " + path + ": " + e.getMessage(), e);
        }
    }

    private static StateBytesSizes stateBytesSizes(final JsonNode node) {
        final Map<StateObjectSize, Long> sizes = new EnumMap<>(StateObjectSize.class);
        long scale = 1L;
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            final String path = "size_info.resource_state_bytes." + entry.getKey();
            if ("STATE_BYTES_SCALE".equals(entry.getKey())) {
                scale = longValue(entry.getValue(), path);
                continue;
            }
            final StateObjectSize key = StateObjectSize.fromWireName(entry.getKey()).orElse(null);
            if (key == null) {
                LOG.debug("Ignoring unknown state-bytes size {}", entry.getKey());
                continue;
            }
            sizes.put(key, longValue(entry.getValue(), path));
        }
        return new StateBytesSizes(sizes, scale);
    }

    private static ExecutionTimeTable executionTimes(final JsonNode node) {
        final Map<OperationType, Long> execTimes = new EnumMap<>(OperationType.class);
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            final String key = entry.getKey();
            final OperationType type = EXEC_TIME_KEYS.get(key);
            if (type == null) {
                LOG.debug("Ignoring unknown execution-time entry {}", key);
                continue;
            }
            execTimes.put(type, longValue(entry.getValue(), "size_info.resource_execution_time." + key));
        }
        final ExecutionTimeTable table = new ExecutionTimeTable(execTimes);
        if (!table.missing().isEmpty()) {
            LOG.warn("No execution time configured for {}; transactions containing them cannot be priced",
                    table.missing());
        }
        return table;
    }

    private static ResourcePool pool(final JsonNode root) {
        if (!root.isObject()) {
            throw new RcConfigException("Resource pool document must be a JSON object");
        }
        final Map<ResourceType, BigInteger> balances = new EnumMap<>(ResourceType.class);
        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            final ResourceType type = ResourceType.fromWireName(entry.getKey())
                    .orElseThrow(() -> new RcConfigException("Unknown resource in pool: " + entry.getKey()));
            if (!entry.getValue().isObject()) {
                throw new RcConfigException("Pool entry " + entry.getKey() + " must be a JSON object");
            }
            balances.put(type, wide(entry.getValue(), "pool", entry.getKey()));
        }
        return new ResourcePool(balances);
    }

    private static ResourceType resourceType(final JsonNode node, final String path) {
        if (!node.isTextual()) {
            throw new RcConfigException(path + " entries must be strings");
        }
        return ResourceType.fromWireName(node.asText())
                .orElseThrow(() -> new RcConfigException("Unknown resource in " + path + ": " + node.asText()));
    }

    private static BigInteger wide(final JsonNode parent, final String field, final String path) {
        final JsonNode node = parent.get(field);
        final String fullPath = path + "." + field;
        if (node == null || node.isNull()) {
            throw new RcConfigException(fullPath + " is missing");
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isTextual()) {
            try {
                return new BigInteger(node.asText());
            } catch (NumberFormatException e) {
                throw new RcConfigException(fullPath + " must be a decimal integer, got: " + node.asText(), e);
            }
        }
        throw new RcConfigException(fullPath + " must be an integer or decimal string");
    }

    private static int smallInt(final JsonNode parent, final String field, final String path) {
        final BigInteger value = wide(parent, field, path);
        if (value.bitLength() > 31) {
            throw new RcConfigException(path + "." + field + " is out of range: " + value);
        }
        return value.intValue();
    }

    private static long longValue(final JsonNode node, final String path) {
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new RcConfigException(path + " must be a 64-bit integer");
        }
        return node.longValue();
    }

    private static JsonNode array(final JsonNode parent, final String field) {
        final JsonNode node = parent.get(field);
        if (node == null || !node.isArray()) {
            throw new RcConfigException(field + " must be an array");
        }
        return node;
    }

    private static JsonNode object(final JsonNode parent, final String field) {
        return object(parent, field, null);
    }

    private static JsonNode object(final JsonNode parent, final String field, final String path) {
        final JsonNode node = parent.get(field);
        if (node == null || !node.isObject()) {
            throw new RcConfigException((path == null ? field : path + "." + field) + " must be a JSON object");
        }
        return node;
    }

    private static JsonNode read(final String json) {
        try {
            return MAPPER.readTree(json);
        } catch (IOException e) {
            throw new RcConfigException("Invalid resource JSON: " + e.getMessage(), e);
        }
    }

    private static JsonNode read(final InputStream in) {
        try {
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new RcConfigException("Invalid resource JSON: " + e.getMessage(), e);
        }
    }

    private static InputStream open(final String resource) {
        Objects.requireNonNull(resource, "resource");
        final InputStream in = ResourceParametersJson.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new RcConfigException("Classpath resource not found: " + resource);
        }
        return in;
    }
}
