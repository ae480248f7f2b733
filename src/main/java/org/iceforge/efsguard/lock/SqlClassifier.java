package org.iceforge.efsguard.lock;

import java.util.List;
import java.util.Locale;

/**
 * Textual statement classifier used to decide whether the database lock is needed.
 *
 * <p>This is a prefix heuristic over normalized text, not a parser:
 * <ul>
 *   <li>{@code BEGIN ...} starts a transaction</li>
 *   <li>{@code SELECT ...} and {@code EXPLAIN ...} are reads</li>
 *   <li>anything else (including empty or malformed text) is a write</li>
 * </ul>
 */
public final class SqlClassifier {

    public static final String TRANSACTION_BEGIN_KEYWORD = "BEGIN";

    private static final List<String> READ_PREFIXES = List.of("SELECT", "EXPLAIN");

    private SqlClassifier() {
    }

    /**
     * Collapses whitespace runs (tabs and line breaks included) to a single space, trims and
     * upper-cases.
     */
    public static String normalize(String sql) {
        if (sql == null) return "";
        StringBuilder sb = new StringBuilder(sql.length());
        boolean inWs = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                if (!inWs && sb.length() > 0) {
                    sb.append(' ');
                }
                inWs = true;
            } else {
                sb.append(c);
                inWs = false;
            }
        }
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == ' ') end--;
        sb.setLength(end);
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    public static StatementKind classify(String sql) {
        String norm = normalize(sql);
        if (norm.startsWith(TRANSACTION_BEGIN_KEYWORD)) {
            return StatementKind.TRANSACTION_START;
        }
        for (String prefix : READ_PREFIXES) {
            if (norm.startsWith(prefix)) {
                return StatementKind.READ;
            }
        }
        return StatementKind.WRITE;
    }

    public static boolean isTransactionStart(String sql) {
        return classify(sql) == StatementKind.TRANSACTION_START;
    }

    /** Transaction starts count as writes too; only SELECT / EXPLAIN are reads. */
    public static boolean isWrite(String sql) {
        return classify(sql) != StatementKind.READ;
    }
}
