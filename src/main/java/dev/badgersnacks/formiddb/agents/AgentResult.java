package dev.badgersnacks.formiddb.agents;

import java.time.Duration;

/**
 * Payload of a finished agent run together with how long it took.
 */
public record AgentResult<T>(String agentName, T payload, Duration duration) {
}
