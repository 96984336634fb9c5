package com.caseclosed.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup settings. Each one is read from a JVM system property, then an
 * environment variable of the same name, then falls back to a default.
 */
final class AgentConfig {
    private static final Logger LOG = LoggerFactory.getLogger(AgentConfig.class);

    final int port;
    final String participant;
    final String agentName;
    final boolean boostEnabled;
    final int boostThreshold;
    final int panicThreshold;

    AgentConfig(int port, String participant, String agentName,
                boolean boostEnabled, int boostThreshold, int panicThreshold) {
        this.port = port;
        this.participant = participant;
        this.agentName = agentName;
        this.boostEnabled = boostEnabled;
        this.boostThreshold = boostThreshold;
        this.panicThreshold = panicThreshold;
    }

    static AgentConfig defaults() {
        return new AgentConfig(5008, "ACPC_diddy_party_desuwa", "Sneaky_Golem", false, 10, 1);
    }

    static AgentConfig fromEnvironment() {
        AgentConfig d = defaults();
        return new AgentConfig(
                intSetting("PORT", d.port),
                setting("PARTICIPANT", d.participant),
                setting("AGENT_NAME", d.agentName),
                Boolean.parseBoolean(setting("BOOST_ENABLED", String.valueOf(d.boostEnabled))),
                intSetting("BOOST_THRESHOLD", d.boostThreshold),
                intSetting("PANIC_THRESHOLD", d.panicThreshold));
    }

    AgentConfig withBoost(boolean enabled, int threshold) {
        return new AgentConfig(port, participant, agentName, enabled, threshold, panicThreshold);
    }

    static String setting(String name, String fallback) {
        String v = System.getProperty(name);
        if (v == null) v = System.getenv(name);
        return v == null || v.trim().isEmpty() ? fallback : v.trim();
    }

    static int intSetting(String name, int fallback) {
        String v = setting(name, null);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            LOG.warn("{}={} is not a number, using {}", name, v, fallback);
            return fallback;
        }
    }
}
