package dev.badgersnacks.formiddb.decoder;

import dev.badgersnacks.formiddb.loadorder.LoadOrderSnapshot;
import dev.badgersnacks.formiddb.model.GameRelease;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes binary plugin files into record streams. Implementations are discovered through
 * {@link java.util.ServiceLoader}; see {@link PluginDecoders}.
 *
 * <p>{@link #open} is synchronous and is not expected to honour interruption, so a very large plugin
 * is a single uninterruptible unit of work.
 */
public interface PluginDecoder {

    boolean supports(GameRelease release);

    /**
     * @param loadOrder the run's load order; its master styles are populated when the release uses
     *                  separated master addressing
     */
    DecodedPlugin open(Path pluginPath, GameRelease release, LoadOrderSnapshot loadOrder) throws IOException;
}
