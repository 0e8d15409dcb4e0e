package bsp.indexer.model;

import java.nio.file.Path;
import java.util.Objects;

public final class Values {

    /** Upper bound for {@code symbols.value}. */
    public static final int SYMBOL_VALUE_LIMIT = 200;

    /** Upper bound for {@code dt_properties.value}. */
    public static final int PROPERTY_VALUE_LIMIT = 500;

    private Values() {
    }

    public static String truncate(String value, int limit) {
        if (value == null) {
            return null;
        }
        if (value.length() <= limit) {
            return value;
        }
        // never keep half of a surrogate pair
        final int end = limit > 0 && Character.isHighSurrogate(value.charAt(limit - 1)) ? limit - 1 : limit;
        return value.substring(0, end);
    }

    /**
     * Path of {@code file} relative to {@code root}, always '/' separated.
     */
    public static String relativePath(Path root, Path file) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(file, "file");
        return root.relativize(file.toAbsolutePath().normalize())
                .toString().replace('\\', '/');
    }

    public static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
