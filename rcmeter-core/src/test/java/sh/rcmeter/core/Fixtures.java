// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import sh.rcmeter.core.config.ResourceParameters;
import sh.rcmeter.core.config.ResourceParametersJson;
import sh.rcmeter.core.config.ResourcePool;
import sh.rcmeter.core.model.ResourceCreditModel;
import sh.rcmeter.core.tx.Transaction;
import sh.rcmeter.core.tx.TransactionJson;

/**
 * Mainnet parameter and pool snapshots plus sample transactions, loaded from
 * {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String PARAMS = "fixtures/rc-params.json";
    public static final String POOL = "fixtures/rc-pool.json";

    /** total_vesting_shares 397114288290855167 spread over five days of blocks. */
    public static final BigInteger REGEN = new BigInteger("2757738113130");

    public static final long VOTE_SIZE = 133L;
    public static final long TRANSFER_SIZE = 282L;
    public static final long SHORT_POST_SIZE = 952L;
    public static final long LONG_POST_SIZE = 9303L;

    private Fixtures() {
    }

    public static ResourceParameters params() {
        return ResourceParametersJson.loadParameters(PARAMS);
    }

    public static ResourcePool pool() {
        return ResourceParametersJson.loadPool(POOL);
    }

    public static ResourceCreditModel model() {
        return ResourceCreditModel.builder()
                .parameters(params())
                .pool(pool())
                .regen(REGEN)
                .build();
    }

    /**
     * @param name one of {@code vote}, {@code transfer}, {@code short_post}, {@code long_post}
     */
    public static String transactionJson(final String name) {
        return read("fixtures/transactions/" + name + ".json");
    }

    public static Transaction transaction(final String name) {
        return TransactionJson.parse(transactionJson(name));
    }

    public static String read(final String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
