package org.morm.model;

import org.morm.exception.DeclarationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsed index request of a field: {@code btree}, {@code gin:gin_trgm_ops}, {@code -hash}.
 * A leading {@code -} marks the kind for removal.
 */
public record IndexSpec(String kind, String opClass, boolean removal) {

    public static final String REMOVAL_MARKER = "-";

    private static final Pattern KIND = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern OP_CLASS = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    public static IndexSpec parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new DeclarationException("Index spec must not be blank");
        }
        String s = raw.trim();
        boolean removal = s.startsWith(REMOVAL_MARKER);
        if (removal) {
            s = s.substring(REMOVAL_MARKER.length()).trim();
        }
        String kind = s;
        String opClass = null;
        int colon = s.indexOf(':');
        if (colon >= 0) {
            kind = s.substring(0, colon).trim();
            opClass = s.substring(colon + 1).trim();
            if (!OP_CLASS.matcher(opClass).matches()) {
                throw new DeclarationException("Invalid operator class in index spec '" + raw + "'");
            }
        }
        if (!KIND.matcher(kind).matches()) {
            throw new DeclarationException("Invalid index kind in index spec '" + raw + "'");
        }
        return new IndexSpec(kind.toLowerCase(Locale.ROOT), opClass, removal);
    }

    @Override
    public String toString() {
        return (removal ? REMOVAL_MARKER : "") + kind + (opClass != null ? ":" + opClass : "");
    }
}
