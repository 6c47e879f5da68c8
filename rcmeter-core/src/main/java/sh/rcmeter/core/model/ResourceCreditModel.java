// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.model;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import sh.rcmeter.core.DebugLogger;
import sh.rcmeter.core.LogFormatter;
import sh.rcmeter.core.config.ResourceDynamicsParams;
import sh.rcmeter.core.config.ResourceParameters;
import sh.rcmeter.core.config.ResourceParams;
import sh.rcmeter.core.config.ResourcePool;
import sh.rcmeter.core.config.ResourceType;
import sh.rcmeter.core.error.DegenerateCurveException;
import sh.rcmeter.core.error.UnknownOperationException;
import sh.rcmeter.core.tx.Transaction;
import sh.rcmeter.core.tx.TransactionJson;
import sh.rcmeter.core.usage.TransactionSizer;
import sh.rcmeter.core.usage.TransactionUsageAggregator;
import sh.rcmeter.core.usage.UsageVector;
import sh.rcmeter.primitives.PoolDecay;
import sh.rcmeter.primitives.PricingCurve;

/**
 * Prices transactions and advances resource pools.
 *
 * <p>
 * A model is an immutable snapshot of resource parameters, pool balances and
 * the global regen rate. Cost queries never change it; applying a block's
 * usage returns a {@link PoolDynamics} whose {@link PoolDynamics#nextPool()}
 * feeds {@link #withPool(ResourcePool)} to obtain the next snapshot.
 *
 * <p>
 * Only priced resources contribute usage. By default every resource except
 * {@link ResourceType#EXECUTION_TIME} is priced; execution time is still
 * accumulated and reported in {@link TransactionCost#usage()}.
 *
 * <p>Example:
 * <pre>{@code
 * ResourceCreditModel model = ResourceCreditModel.builder()
 *         .parameters(ResourceParametersJson.loadParameters("rc/resource-params.json"))
 *         .pool(ResourceParametersJson.loadPool("rc/resource-pool.json"))
 *         .regen(RcRegen.fromTotalVestingShares(totalVestingShares))
 *         .build();
 * BigInteger rc = model.getTransactionCost(tx, serializedSize).total();
 * }</pre>
 *
 * <p>Thread-safe.
 */
public final class ResourceCreditModel {

    /** Resources priced unless {@link Builder#pricedResources(Set)} says otherwise. */
    public static final Set<ResourceType> DEFAULT_PRICED_RESOURCES = Collections.unmodifiableSet(EnumSet.of(
            ResourceType.HISTORY_BYTES,
            ResourceType.NEW_ACCOUNTS,
            ResourceType.MARKET_BYTES,
            ResourceType.STATE_BYTES));

    private final ResourceParameters parameters;
    private final ResourcePool pool;
    private final BigInteger regen;
    private final Set<ResourceType> pricedResources;
    private final long dt;
    private final @Nullable TransactionSizer sizer;
    private final TransactionUsageAggregator aggregator;

    private ResourceCreditModel(final Builder builder) {
        this.parameters = Objects.requireNonNull(builder.parameters, "parameters cannot be null");
        this.pool = Objects.requireNonNull(builder.pool, "pool cannot be null");
        this.regen = Objects.requireNonNull(builder.regen, "regen cannot be null");
        if (regen.signum() < 0) {
            throw new IllegalArgumentException("regen cannot be negative: " + regen);
        }
        if (builder.dt < 0) {
            throw new IllegalArgumentException("dt cannot be negative: " + builder.dt);
        }
        this.pricedResources = Collections.unmodifiableSet(builder.pricedResources.isEmpty()
                ? EnumSet.noneOf(ResourceType.class)
                : EnumSet.copyOf(builder.pricedResources));
        this.dt = builder.dt;
        this.sizer = builder.sizer;
        this.aggregator = new TransactionUsageAggregator(parameters, sizer);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ResourceParameters parameters() {
        return parameters;
    }

    public ResourcePool pool() {
        return pool;
    }

    public BigInteger regen() {
        return regen;
    }

    public Set<ResourceType> pricedResources() {
        return pricedResources;
    }

    public long dt() {
        return dt;
    }

    /**
     * Returns a model identical to this one but priced against {@code next}.
     */
    public ResourceCreditModel withPool(final ResourcePool next) {
        return toBuilder().pool(next).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .parameters(parameters)
                .pool(pool)
                .regen(regen)
                .pricedResources(pricedResources)
                .dt(dt)
                .sizer(sizer);
    }

    /**
     * Prices a transaction of known serialized size.
     *
     * @param tx   the transaction
     * @param size serialized length in bytes
     * @return usage and per-resource cost
     * @throws DegenerateCurveException if a curve denominator is not positive
     */
    public TransactionCost getTransactionCost(final Transaction tx, final long size) {
        final UsageVector usage = aggregator.compute(tx, size);
        final TransactionCost cost = price(usage);
        DebugLogger.logCost(LogFormatter.formatCost(tx.operations().size(), size, cost.total(), cost.cost()));
        return cost;
    }

    /**
     * Prices a transaction, measuring it with the configured {@link TransactionSizer}.
     *
     * @throws IllegalStateException if no sizer is configured
     */
    public TransactionCost getTransactionCost(final Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        if (sizer == null) {
            throw new IllegalStateException("No TransactionSizer configured; pass the serialized size explicitly");
        }
        return getTransactionCost(tx, sizer.serializedSize(tx));
    }

    /**
     * Decodes and prices a transaction in its JSON form.
     *
     * @throws UnknownOperationException if an operation tag is unknown
     */
    public TransactionCost getTransactionCost(final String transactionJson, final long size) {
        return getTransactionCost(TransactionJson.parse(transactionJson), size);
    }

    /**
     * Prices raw usage against the current pools.
     */
    public TransactionCost price(final UsageVector usage) {
        Objects.requireNonNull(usage, "usage cannot be null");
        final Map<ResourceType, BigInteger> scaled = new EnumMap<>(ResourceType.class);
        final Map<ResourceType, BigInteger> costs = new EnumMap<>(ResourceType.class);
        for (ResourceType type : parameters.resourceNames()) {
            final ResourceParams params = parameters.params(type);
            final BigInteger scaledUsage = scaledUsage(type, usage, params.dynamics());
            scaled.put(type, scaledUsage);
            try {
                costs.put(type, PricingCurve.cost(params.priceCurve(), pool.get(type), scaledUsage, regen));
            } catch (ArithmeticException e) {
                throw new DegenerateCurveException(type, e);
            }
        }
        return new TransactionCost(usage, scaled, costs);
    }

    /**
     * Applies a block's usage to the pools over the configured {@code dt}.
     */
    public PoolDynamics applyPoolDynamics(final UsageVector usage) {
        return applyPoolDynamics(usage, dt);
    }

    /**
     * Applies usage to the pools over {@code dt} time units.
     *
     * <p>Per resource: {@code newPool = pool - decay(pool - usage, dt) + budget_per_time_unit * dt - usage},
     * with {@code usage} already scaled by {@code resource_unit}.
     */
    public PoolDynamics applyPoolDynamics(final UsageVector usage, final long dt) {
        Objects.requireNonNull(usage, "usage cannot be null");
        if (dt < 0) {
            throw new IllegalArgumentException("dt cannot be negative: " + dt);
        }
        final BigInteger elapsed = BigInteger.valueOf(dt);
        final Map<ResourceType, BigInteger> pools = new EnumMap<>(ResourceType.class);
        final Map<ResourceType, BigInteger> budgets = new EnumMap<>(ResourceType.class);
        final Map<ResourceType, BigInteger> usages = new EnumMap<>(ResourceType.class);
        final Map<ResourceType, BigInteger> decays = new EnumMap<>(ResourceType.class);
        final Map<ResourceType, BigInteger> newPools = new EnumMap<>(ResourceType.class);
        for (ResourceType type : parameters.resourceNames()) {
            final ResourceDynamicsParams dynamics = parameters.params(type).dynamics();
            final BigInteger current = pool.get(type);
            final BigInteger budget = dynamics.budgetPerTimeUnit().multiply(elapsed);
            final BigInteger used = scaledUsage(type, usage, dynamics);
            final BigInteger decay = PoolDecay.decay(dynamics.decayParams(), current.subtract(used), dt);
            final BigInteger newPool = current.subtract(decay).add(budget).subtract(used);

            pools.put(type, current);
            budgets.put(type, budget);
            usages.put(type, used);
            decays.put(type, decay);
            newPools.put(type, newPool);
            DebugLogger.logPool(LogFormatter.formatPool(type, current, decay, budget, used, newPool));
        }
        return new PoolDynamics(dt, pools, budgets, usages, decays, newPools, Map.of());
    }

    private BigInteger scaledUsage(final ResourceType type, final UsageVector usage, final ResourceDynamicsParams dynamics) {
        if (!pricedResources.contains(type)) {
            return BigInteger.ZERO;
        }
        return BigInteger.valueOf(usage.get(type)).multiply(dynamics.resourceUnit());
    }

    /**
     * Builder for {@link ResourceCreditModel}.
     */
    public static final class Builder {
        private @Nullable ResourceParameters parameters;
        private @Nullable ResourcePool pool;
        private BigInteger regen = BigInteger.ZERO;
        private Set<ResourceType> pricedResources = DEFAULT_PRICED_RESOURCES;
        private long dt = 1L;
        private @Nullable TransactionSizer sizer;

        Builder() {
        }

        public Builder parameters(final ResourceParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder pool(final ResourcePool pool) {
            this.pool = pool;
            return this;
        }

        /**
         * Sets the global regen rate, see {@link RcRegen#fromTotalVestingShares(BigInteger)}.
         */
        public Builder regen(final BigInteger regen) {
            this.regen = regen;
            return this;
        }

        /**
         * Sets the resources that contribute usage to cost and pool drain.
         * Defaults to {@link ResourceCreditModel#DEFAULT_PRICED_RESOURCES}.
         */
        public Builder pricedResources(final Set<ResourceType> pricedResources) {
            this.pricedResources = Objects.requireNonNull(pricedResources, "pricedResources cannot be null");
            return this;
        }

        /**
         * Sets the time units elapsed per pool update. Defaults to one block.
         */
        public Builder dt(final long dt) {
            this.dt = dt;
            return this;
        }

        public Builder sizer(final @Nullable TransactionSizer sizer) {
            this.sizer = sizer;
            return this;
        }

        public ResourceCreditModel build() {
            return new ResourceCreditModel(this);
        }
    }
}
