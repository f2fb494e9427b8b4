package dev.badgersnacks.formiddb.util;

import java.util.Locale;

/**
 * FormID rendering helpers.
 */
public final class FormIds {

    private static final int LOCAL_ID_MASK = 0xFFFFFF;

    private FormIds() {
    }

    /**
     * Renders the low 24 bits of {@code formKeyId} as six uppercase hex characters.
     */
    public static String format(long formKeyId) {
        return String.format(Locale.ROOT, "%06X", formKeyId & LOCAL_ID_MASK);
    }
}
