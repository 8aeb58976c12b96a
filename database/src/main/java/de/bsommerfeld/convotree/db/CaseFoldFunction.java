package de.bsommerfeld.convotree.db;

import org.sqlite.Function;

import java.sql.SQLException;
import java.util.Locale;

/**
 * {@code casefold(text)}: lower-cases with Java's full Unicode mapping. The
 * built-in SQLite {@code lower()} and {@code LIKE} only fold ASCII letters.
 * NULL stays NULL.
 */
class CaseFoldFunction extends Function {

    static final String NAME = "casefold";

    @Override
    protected void xFunc() throws SQLException {
        String value = value_text(0);
        if (value == null) {
            result();
        } else {
            result(fold(value));
        }
    }

    static String fold(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
