package com.raditha.divergence.normalization;

import com.raditha.divergence.config.NormalizationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites IR text into a canonical form so that two snapshots that differ only in
 * value names, label names, comments, debug attachments or spacing compare equal.
 * <p>
 * The output depends on nothing but the text and the options: every call starts
 * with empty rename tables.
 */
public class IRNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(IRNormalizer.class);

    private static final char METADATA_SIGIL = '!';
    private static final Pattern DEBUG_INFO = Pattern.compile(",\\s*!dbg\\s+!\\d+");
    private static final Pattern LABEL_DEFINITION = Pattern.compile("^\\s*([A-Za-z$._][A-Za-z$._0-9-]*|[0-9]+):");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    static final String TEMP_PREFIX = "temp_";
    static final String LABEL_PREFIX = "label_";

    /**
     * A line that survived the filters, remembering whether it was blank to begin with.
     */
    private record PreparedLine(String text, boolean originallyBlank) {
    }

    /**
     * Normalize a whole block.
     *
     * @param text    IR text, any line separator
     * @param options which rewrites to apply
     * @return canonical text, lines joined with {@code \n}
     */
    public String normalize(String text, NormalizationOptions options) {
        List<PreparedLine> prepared = prepare(text, options);

        RenameTable labels = new RenameTable(LABEL_PREFIX);
        if (options.renameLabels()) {
            collectLabels(prepared, labels);
        }
        RenameTable temporaries = new RenameTable(TEMP_PREFIX);

        List<String> output = new ArrayList<>(prepared.size());
        for (PreparedLine line : prepared) {
            String rewritten = line.text();
            if (options.renameLabels() || options.renameTemporaries()) {
                rewritten = rewriteTokens(rewritten, labels, options.renameTemporaries() ? temporaries : null);
            }
            if (options.collapseWhitespace()) {
                rewritten = WHITESPACE.matcher(rewritten).replaceAll(" ").trim();
            }
            if (rewritten.isBlank() && !line.originallyBlank()) {
                continue;
            }
            output.add(rewritten);
        }

        String result = String.join("\n", output);
        if (logger.isDebugEnabled()) {
            NormalizationStats stats = NormalizationStats.of(text, result);
            logger.debug("Normalized IR: {} -> {} lines ({} labels, {} temporaries)",
                    stats.originalLines(), stats.normalizedLines(), labels.size(), temporaries.size());
        }
        return result;
    }

    /**
     * Line filters and in-line strips, before any renaming.
     */
    private List<PreparedLine> prepare(String text, NormalizationOptions options) {
        String[] lines = LINE_BREAK.split(text, -1);
        List<PreparedLine> prepared = new ArrayList<>(lines.length);
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                if (!options.dropBlankLines()) {
                    prepared.add(new PreparedLine(line, true));
                }
                continue;
            }
            if (options.dropMetadata() && trimmed.charAt(0) == METADATA_SIGIL) {
                continue;
            }
            String current = line;
            if (options.stripComments()) {
                current = stripComment(current);
            }
            if (options.stripDebugInfo()) {
                current = DEBUG_INFO.matcher(current).replaceAll("");
            }
            prepared.add(new PreparedLine(current, false));
        }
        return prepared;
    }

    /**
     * Assign canonical names to label definitions in definition order.
     */
    private static void collectLabels(List<PreparedLine> lines, RenameTable labels) {
        for (PreparedLine line : lines) {
            Matcher matcher = LABEL_DEFINITION.matcher(line.text());
            if (matcher.find()) {
                labels.rename(matcher.group(1));
            }
        }
    }

    /**
     * Cut everything from the first {@code ;} that is not inside a string literal.
     */
    static String stripComment(String line) {
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '\\' && quoted) {
                i++;
            } else if (c == ';' && !quoted) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    /**
     * One left-to-right pass over the line. String literals are copied untouched;
     * every other token is compared whole against the label table, and
     * {@code %}-prefixed tokens that are not labels are renamed as temporaries.
     *
     * @param temporaries null when temporaries are not renamed
     */
    static String rewriteTokens(String line, RenameTable labels, RenameTable temporaries) {
        StringBuilder out = new StringBuilder(line.length());
        int n = line.length();
        int firstToken = 0;
        while (firstToken < n && Character.isWhitespace(line.charAt(firstToken))) {
            firstToken++;
        }
        int i = 0;
        while (i < n) {
            char c = line.charAt(i);
            if (c == '"') {
                int end = closingQuote(line, i);
                out.append(line, i, end);
                i = end;
            } else if (isTokenChar(c)) {
                int end = i + 1;
                while (end < n && isTokenChar(line.charAt(end))) {
                    end++;
                }
                String token = line.substring(i, end);
                char before = i > 0 ? line.charAt(i - 1) : ' ';
                boolean definition = i == firstToken && end < n && line.charAt(end) == ':';
                out.append(renameToken(token, before, definition, labels, temporaries));
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static String renameToken(String token, char before, boolean definition,
            RenameTable labels, RenameTable temporaries) {
        boolean valueSigil = before == '%';
        String label = labels.lookup(token);
        if (label != null && before != '@') {
            // numeric labels only count where a label can stand, so plain constants keep their value
            if (!isNumber(token) || valueSigil || definition) {
                return label;
            }
        }
        if (valueSigil && temporaries != null && isValueName(token)) {
            return temporaries.rename(token);
        }
        return token;
    }

    private static int closingQuote(String line, int open) {
        int i = open + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            i++;
        }
        return line.length();
    }

    private static boolean isTokenChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '_' || c == '.' || c == '$' || c == '-';
    }

    private static boolean isNumber(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return false;
            }
        }
        return !token.isEmpty();
    }

    /**
     * {@code %name} or {@code %123}; anything else after a {@code %} is left alone.
     */
    private static boolean isValueName(String token) {
        char first = token.charAt(0);
        if (first >= '0' && first <= '9') {
            return isNumber(token);
        }
        return first != '-';
    }
}
