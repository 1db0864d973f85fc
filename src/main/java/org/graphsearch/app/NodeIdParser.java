package org.graphsearch.app;

import lombok.experimental.UtilityClass;
import org.graphsearch.graph.id.NodeId;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses user-typed node literals into {@link NodeId} values.
 *
 * <p>Recognized forms, tried in order:</p>
 * <ul>
 * <li>signed integer, e.g. {@code 7} or {@code -3}: {@link org.graphsearch.graph.id.IntegerNode}</li>
 * <li>parenthesized integer pair, e.g. {@code (0, 5)}: {@link org.graphsearch.graph.id.GridNode}</li>
 * <li>anything else: {@link org.graphsearch.graph.id.NamedNode}, with one pair of matching
 * surrounding quotes removed</li>
 * </ul>
 * <p>No expression evaluation is performed.</p>
 */
@UtilityClass
public class NodeIdParser {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d{1,9}");
    private static final Pattern GRID = Pattern.compile("\\(\\s*([+-]?\\d{1,9})\\s*,\\s*([+-]?\\d{1,9})\\s*\\)");

    /**
     * Parses one node literal.
     *
     * @param text raw user text.
     * @return parsed node id.
     * @throws IllegalArgumentException when text is null or blank.
     */
    public static NodeId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("node literal must be non-blank");
        }
        String trimmed = text.trim();
        if (INTEGER.matcher(trimmed).matches()) {
            return NodeId.of(Integer.parseInt(trimmed));
        }
        Matcher grid = GRID.matcher(trimmed);
        if (grid.matches()) {
            return NodeId.grid(Integer.parseInt(grid.group(1)), Integer.parseInt(grid.group(2)));
        }
        return NodeId.named(unquote(trimmed));
    }

    private static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                String inner = text.substring(1, text.length() - 1);
                if (!inner.isBlank()) {
                    return inner;
                }
            }
        }
        return text;
    }
}
