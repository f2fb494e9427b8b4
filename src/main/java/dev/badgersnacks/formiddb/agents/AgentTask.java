package dev.badgersnacks.formiddb.agents;

/**
 * A unit of background work run by the {@link AgentOrchestrator}: a plugin scan or an ingestion run.
 */
public interface AgentTask<T> {
    String name();
    T run() throws Exception;
}
