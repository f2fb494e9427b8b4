package dev.badgersnacks.formiddb.decoder;

/**
 * A major record yielded by a {@link PluginDecoder}.
 */
public interface PluginRecord {

    /**
     * Full record identifier. Only the low 24 bits identify the record within its plugin.
     *
     * @throws RuntimeException when the record header is malformed
     */
    long formKeyId();

    /**
     * Short editor identifier, or {@code null} when the record has none.
     */
    String editorId();
}
