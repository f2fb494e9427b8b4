package dev.badgersnacks.formiddb.decoder;

import dev.badgersnacks.formiddb.model.GameRelease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Looks up {@link PluginDecoder} implementations registered under
 * {@code META-INF/services/dev.badgersnacks.formiddb.decoder.PluginDecoder}.
 */
public final class PluginDecoders {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginDecoders.class);

    private final List<PluginDecoder> decoders;

    public PluginDecoders(List<PluginDecoder> decoders) {
        this.decoders = List.copyOf(Objects.requireNonNull(decoders, "decoders"));
    }

    public static PluginDecoders fromServiceLoader() {
        List<PluginDecoder> loaded = ServiceLoader.load(PluginDecoder.class).stream()
                .map(ServiceLoader.Provider::get)
                .collect(Collectors.toUnmodifiableList());
        LOGGER.info("Discovered {} plugin decoder(s)", loaded.size());
        return new PluginDecoders(loaded);
    }

    public Optional<PluginDecoder> find(GameRelease release) {
        return decoders.stream()
                .filter(decoder -> decoder.supports(release))
                .findFirst();
    }

    public PluginDecoder require(GameRelease release) {
        return find(release).orElseThrow(() -> new IllegalStateException(
                "No plugin decoder is installed for " + release
                        + ". Add a decoder to the classpath or import a FormID list file instead."));
    }
}
