// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.rcmeter.core.RcDebug.Channel;

/**
 * Writes pre-formatted trace lines to the {@code sh.rcmeter.debug} logger
 * when the matching {@link RcDebug} channel is on.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.rcmeter.debug");

    private DebugLogger() {
    }

    public static void logCost(final String line) {
        log(Channel.COST, line);
    }

    public static void logPool(final String line) {
        log(Channel.POOL, line);
    }

    public static void logBlock(final String line) {
        log(Channel.BLOCK, line);
    }

    private static void log(final Channel channel, final String line) {
        if (RcDebug.isEnabled(channel)) {
            LOG.info(line);
        }
    }
}
