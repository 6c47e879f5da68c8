// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.types;

import java.util.List;
import java.util.Objects;

/**
 * A weighted multi-signature authority (owner, active or posting).
 *
 * <p>On the wire both auth lists are arrays of {@code [principal, weight]}
 * pairs, where the principal is an account name for {@code account_auths}
 * and a public key for {@code key_auths}.
 *
 * @param weightThreshold minimum summed weight required to satisfy the authority
 * @param accountAuths    delegated account principals
 * @param keyAuths        public key principals
 */
public record Authority(long weightThreshold, List<Entry> accountAuths, List<Entry> keyAuths) {

    public Authority {
        if (weightThreshold < 0) {
            throw new IllegalArgumentException("weightThreshold must be non-negative, got: " + weightThreshold);
        }
        accountAuths = List.copyOf(Objects.requireNonNull(accountAuths, "accountAuths cannot be null"));
        keyAuths = List.copyOf(Objects.requireNonNull(keyAuths, "keyAuths cannot be null"));
    }

    /**
     * A single principal and its weight.
     *
     * @param principal account name or public key
     * @param weight    signing weight
     */
    public record Entry(String principal, long weight) {

        public Entry {
            Objects.requireNonNull(principal, "principal cannot be null");
        }
    }
}
