package dev.badgersnacks.formiddb.ingest;

import dev.badgersnacks.formiddb.decoder.NamedRecord;
import dev.badgersnacks.formiddb.decoder.PluginRecord;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RecordLabelResolverTest {

    @Test
    void prefersEditorId() {
        RecordLabelResolver resolver = new RecordLabelResolver();
        assertEquals("IronSword", resolver.resolve(new WeaponRecord(1, "IronSword", "Iron Sword"), "000001"));
    }

    @Test
    void usesNamedRecordCapability() {
        RecordLabelResolver resolver = new RecordLabelResolver();
        assertEquals("Iron Sword", resolver.resolve(new WeaponRecord(1, null, "Iron Sword"), "000001"));
    }

    @Test
    void emptyNameFallsThroughToTypeLabel() {
        RecordLabelResolver resolver = new RecordLabelResolver();
        assertEquals("[WeaponRecord_000002]", resolver.resolve(new WeaponRecord(2, null, ""), "000002"));
    }

    @Test
    void recordWithoutNameOrStrategyGetsTypeLabel() {
        RecordLabelResolver resolver = new RecordLabelResolver();
        assertEquals("[TranslatedRecord_000003]",
                resolver.resolve(new TranslatedRecord(3, new Translated("Hide Armor")), "000003"));
    }

    @Test
    void registeredStrategyReadsNestedName() {
        RecordLabelResolver resolver = new RecordLabelResolver();
        resolver.register(TranslatedRecord.class, record -> {
            Translated name = ((TranslatedRecord) record).name();
            return name == null ? null : name.string();
        });
        assertEquals("Hide Armor", resolver.resolve(new TranslatedRecord(2, new Translated("Hide Armor")), "000002"));
        assertEquals("[TranslatedRecord_000003]", resolver.resolve(new TranslatedRecord(3, null), "000003"));
    }

    @Test
    void strategyRegisteredForSupertypeAppliesToSubtypes() {
        RecordLabelResolver resolver = new RecordLabelResolver();
        resolver.register(ArmorRecord.class, record -> "armor-" + record.formKeyId());
        assertEquals("armor-7", resolver.resolve(new HeavyArmorRecord(7), "000007"));
    }

    @Test
    void fallsBackWhenStrategyThrows() {
        RecordLabelResolver resolver = new RecordLabelResolver();
        resolver.register(CountingRecord.class, record -> {
            throw new IllegalStateException("lazy name decode failed");
        });
        assertEquals("[CountingRecord_000004]", resolver.resolve(new CountingRecord(4), "000004"));
    }

    @Test
    void strategyIsLookedUpOncePerType() {
        RecordLabelResolver resolver = new RecordLabelResolver();
        AtomicInteger lookups = new AtomicInteger();
        resolver.register(CountingRecord.class, record -> {
            lookups.incrementAndGet();
            return "label";
        });
        for (int i = 0; i < 50; i++) {
            assertEquals("label", resolver.resolve(new CountingRecord(i), "000000"));
            resolver.resolve(new TranslatedRecord(i, null), "000000");
        }
        assertEquals(2, resolver.cachedTypeCount());
        assertEquals(50, lookups.get());
    }

    public record WeaponRecord(long formKeyId, String editorId, String name) implements NamedRecord {
    }

    public record Translated(String string) {
    }

    public record TranslatedRecord(long formKeyId, Translated name) implements PluginRecord {
        @Override
        public String editorId() {
            return null;
        }
    }

    public record CountingRecord(long formKeyId) implements PluginRecord {
        @Override
        public String editorId() {
            return null;
        }
    }

    public static class ArmorRecord implements PluginRecord {
        private final long id;

        ArmorRecord(long id) {
            this.id = id;
        }

        @Override
        public long formKeyId() {
            return id;
        }

        @Override
        public String editorId() {
            return null;
        }
    }

    public static final class HeavyArmorRecord extends ArmorRecord {
        HeavyArmorRecord(long id) {
            super(id);
        }
    }
}
