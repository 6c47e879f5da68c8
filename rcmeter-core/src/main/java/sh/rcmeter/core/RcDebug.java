// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global switches for verbose debug logging, one per {@link Channel}.
 *
 * <p>
 * Initial state comes from the {@value #PROPERTY} system property, a
 * comma-separated list of channel names or {@code all}, e.g.
 * {@code -Drcmeter.debug=cost,block}. Unknown names are skipped with a warning.
 *
 * <p>Thread-safe. Readers see an immutable snapshot.
 */
public final class RcDebug {

    /** System property read once at class initialization. */
    public static final String PROPERTY = "rcmeter.debug";

    /**
     * What a debug line traces.
     */
    public enum Channel {
        /** One {@code [RC-COST]} line per priced transaction. */
        COST,
        /** One {@code [RC-POOL]} line per resource per pool update. */
        POOL,
        /** One {@code [RC-BLOCK]} line per closed block. */
        BLOCK
    }

    private static final Logger LOG = LoggerFactory.getLogger(RcDebug.class);

    private static volatile Set<Channel> enabled = parse(System.getProperty(PROPERTY));

    private RcDebug() {
    }

    public static boolean isEnabled(final Channel channel) {
        return enabled.contains(channel);
    }

    /**
     * @return the channels currently enabled
     */
    public static Set<Channel> enabled() {
        return enabled;
    }

    public static synchronized void enable(final Channel... channels) {
        final Set<Channel> next = copy(enabled);
        Collections.addAll(next, channels);
        enabled = Collections.unmodifiableSet(next);
    }

    public static synchronized void disable(final Channel... channels) {
        final Set<Channel> next = copy(enabled);
        for (Channel channel : channels) {
            next.remove(channel);
        }
        enabled = Collections.unmodifiableSet(next);
    }

    public static synchronized void disableAll() {
        enabled = Collections.unmodifiableSet(EnumSet.noneOf(Channel.class));
    }

    static Set<Channel> parse(final @Nullable String value) {
        final Set<Channel> channels = EnumSet.noneOf(Channel.class);
        if (value == null || value.isBlank()) {
            return Collections.unmodifiableSet(channels);
        }
        for (String token : value.split(",")) {
            final String name = token.trim().toUpperCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            if (name.equals("ALL")) {
                channels.addAll(EnumSet.allOf(Channel.class));
                continue;
            }
            try {
                channels.add(Channel.valueOf(name));
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring unknown {} channel '{}'", PROPERTY, token.trim());
            }
        }
        return Collections.unmodifiableSet(channels);
    }

    private static Set<Channel> copy(final Set<Channel> channels) {
        return channels.isEmpty() ? EnumSet.noneOf(Channel.class) : EnumSet.copyOf(channels);
    }
}
