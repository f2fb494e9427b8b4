package dev.badgersnacks.formiddb.decoder;

import dev.badgersnacks.formiddb.model.GameRelease;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginDecodersTest {

    @Test
    void findsFirstDecoderSupportingTheRelease() {
        FakePluginDecoder decoder = new FakePluginDecoder();
        PluginDecoders decoders = new PluginDecoders(List.of(decoder));
        assertSame(decoder, decoders.require(GameRelease.STARFIELD));
    }

    @Test
    void requireExplainsMissingDecoder() {
        PluginDecoders decoders = new PluginDecoders(List.of());
        assertTrue(decoders.find(GameRelease.SKYRIM_SE).isEmpty());
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> decoders.require(GameRelease.SKYRIM_SE));
        assertTrue(error.getMessage().contains("import a FormID list file instead"));
    }

    @Test
    void serviceLoaderFindsNothingByDefault() {
        assertTrue(PluginDecoders.fromServiceLoader().find(GameRelease.FALLOUT_4).isEmpty());
    }
}
