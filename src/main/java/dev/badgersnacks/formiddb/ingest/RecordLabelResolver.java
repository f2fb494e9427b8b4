package dev.badgersnacks.formiddb.ingest;

import dev.badgersnacks.formiddb.decoder.NamedRecord;
import dev.badgersnacks.formiddb.decoder.PluginRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Picks a human-readable label for a decoded record.
 *
 * <p>Priority: editor ID, then {@link NamedRecord#name()}, then a per-type strategy, then
 * {@code [TypeName_XXXXXX]}. The per-type strategy is looked up once per concrete class and cached:
 * the strategy registered for that exact class, else one registered for a supertype, else none.
 */
public class RecordLabelResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordLabelResolver.class);
    private static final LabelStrategy NO_LABEL = record -> null;

    @FunctionalInterface
    public interface LabelStrategy {
        String extract(PluginRecord record) throws Exception;
    }

    private final Map<Class<?>, LabelStrategy> registered = new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, LabelStrategy> strategies = new ConcurrentHashMap<>();

    /**
     * Registers an explicit strategy for {@code type} and its subclasses. Must be called before the
     * first record of that type is resolved.
     */
    public <T extends PluginRecord> void register(Class<T> type, LabelStrategy strategy) {
        registered.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(strategy, "strategy"));
    }

    public String resolve(PluginRecord record, String formId) {
        try {
            String editorId = record.editorId();
            if (hasText(editorId)) {
                return editorId;
            }
            if (record instanceof NamedRecord named) {
                String name = named.name();
                if (hasText(name)) {
                    return name;
                }
            }
            String label = extractWithStrategy(record);
            return hasText(label) ? label : fallbackLabel(record, formId);
        } catch (RuntimeException e) {
            LOGGER.debug("Label lookup failed for {} {}", record.getClass().getSimpleName(), formId, e);
            return fallbackLabel(record, formId);
        }
    }

    public static String fallbackLabel(PluginRecord record, String formId) {
        return "[" + record.getClass().getSimpleName() + "_" + formId + "]";
    }

    /**
     * Number of record classes whose strategy has been looked up so far.
     */
    public int cachedTypeCount() {
        return strategies.size();
    }

    private String extractWithStrategy(PluginRecord record) {
        LabelStrategy strategy = strategies.computeIfAbsent(record.getClass(), this::lookup);
        try {
            return strategy.extract(record);
        } catch (Exception e) {
            LOGGER.debug("Name extraction failed for {}: {}", record.getClass().getSimpleName(), e.getMessage());
            return null;
        }
    }

    private LabelStrategy lookup(Class<?> type) {
        LabelStrategy explicit = registered.get(type);
        if (explicit != null) {
            return explicit;
        }
        for (Map.Entry<Class<?>, LabelStrategy> entry : registered.entrySet()) {
            if (entry.getKey().isAssignableFrom(type)) {
                LOGGER.debug("Using strategy registered for {} to label {}", entry.getKey().getSimpleName(),
                        type.getSimpleName());
                return entry.getValue();
            }
        }
        return NO_LABEL;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
