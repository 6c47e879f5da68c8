// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import sh.rcmeter.core.error.RcConfigException;

/**
 * The complete, immutable resource configuration: the ordered resource list,
 * each resource's dynamics and price curve, and the size and execution-time
 * tables used to count usage.
 *
 * @see ResourceParametersJson
 */
public final class ResourceParameters {

    private final List<ResourceType> resourceNames;
    private final Map<ResourceType, ResourceParams> params;
    private final StateBytesSizes stateBytesSizes;
    private final ExecutionTimeTable executionTimes;

    /**
     * @throws RcConfigException if the resource list is not a permutation of all
     *                           {@link ResourceType}s or a resource has no params
     */
    public ResourceParameters(
            final List<ResourceType> resourceNames,
            final Map<ResourceType, ResourceParams> params,
            final StateBytesSizes stateBytesSizes,
            final ExecutionTimeTable executionTimes) {
        Objects.requireNonNull(resourceNames, "resourceNames cannot be null");
        Objects.requireNonNull(params, "params cannot be null");
        this.stateBytesSizes = Objects.requireNonNull(stateBytesSizes, "stateBytesSizes cannot be null");
        this.executionTimes = Objects.requireNonNull(executionTimes, "executionTimes cannot be null");

        final Set<ResourceType> listed = EnumSet.noneOf(ResourceType.class);
        for (ResourceType type : resourceNames) {
            if (!listed.add(type)) {
                throw new RcConfigException("Resource listed twice: " + type.wireName());
            }
        }
        if (listed.size() != ResourceType.values().length) {
            final Set<ResourceType> missing = EnumSet.allOf(ResourceType.class);
            missing.removeAll(listed);
            throw new RcConfigException("Resource list is missing: " + missing);
        }
        for (ResourceType type : resourceNames) {
            if (params.get(type) == null) {
                throw new RcConfigException("No resource params for " + type.wireName());
            }
        }
        this.resourceNames = List.copyOf(resourceNames);
        this.params = new EnumMap<>(params);
    }

    /**
     * @return the resources in configured order
     */
    public List<ResourceType> resourceNames() {
        return resourceNames;
    }

    public ResourceParams params(final ResourceType type) {
        return params.get(type);
    }

    public StateBytesSizes stateBytesSizes() {
        return stateBytesSizes;
    }

    public ExecutionTimeTable executionTimes() {
        return executionTimes;
    }
}
