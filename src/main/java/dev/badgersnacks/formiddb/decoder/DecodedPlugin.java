package dev.badgersnacks.formiddb.decoder;

import java.io.IOException;

/**
 * An opened plugin file. Closing releases any file handles or memory maps held by the decoder.
 */
public interface DecodedPlugin extends AutoCloseable {

    /**
     * Major records in file order. The iterator's {@code next()} may throw for a record it cannot
     * parse; it must then be positioned on the following record. A failing {@code hasNext()} ends the
     * plugin.
     */
    Iterable<PluginRecord> records();

    @Override
    void close() throws IOException;
}
