package dev.badgersnacks.formiddb.model;

import java.util.Objects;

/**
 * One persisted row. {@code formId} is the record's low 24 bits as six uppercase hex characters;
 * rows are not unique per plugin + formId.
 */
public record RecordRow(String plugin, String formId, String entry) {

    public RecordRow {
        Objects.requireNonNull(plugin, "plugin");
        Objects.requireNonNull(formId, "formId");
        Objects.requireNonNull(entry, "entry");
    }
}
