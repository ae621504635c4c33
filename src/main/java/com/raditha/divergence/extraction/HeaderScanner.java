package com.raditha.divergence.extraction;

import com.raditha.divergence.model.HeaderDescriptor;
import com.raditha.divergence.model.PassScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds pass header banners in a pipeline dump.
 * Lines that match neither banner are content, never errors.
 */
public class HeaderScanner {

    private static final Logger logger = LoggerFactory.getLogger(HeaderScanner.class);

    private static final Pattern LEGACY_BANNER = Pattern.compile(
            "^\\s*#?\\s*\\*\\*\\* IR Dump After (.+) \\*\\*\\*:?");
    private static final Pattern NEW_PM_BANNER = Pattern.compile(
            "^\\s*;\\s*\\*\\*\\* IR Dump After (.+?) on (.+?) \\*\\*\\*");
    private static final Pattern PARENTHESIZED = Pattern.compile("\\(([^)]+)\\)");

    static final String MODULE_MARKER = "[module]";

    private final HeaderDialect dialect;

    public HeaderScanner(HeaderDialect dialect) {
        if (dialect == null) {
            throw new IllegalArgumentException("dialect cannot be null");
        }
        this.dialect = dialect;
    }

    /**
     * Scan a stream line by line.
     *
     * @throws IOException only when the stream itself cannot be read
     */
    public List<HeaderDescriptor> scanHeaders(BufferedReader reader) throws IOException {
        List<HeaderDescriptor> headers = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            HeaderDescriptor header = recognize(line, lineNumber);
            if (header != null) {
                headers.add(header);
            }
        }
        logger.debug("Found {} {} headers in {} lines", headers.size(), dialect, lineNumber);
        return headers;
    }

    /**
     * Scan lines that are already in memory.
     */
    public List<HeaderDescriptor> scanHeaders(List<String> lines) {
        List<HeaderDescriptor> headers = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            HeaderDescriptor header = recognize(lines.get(i), i + 1);
            if (header != null) {
                headers.add(header);
            }
        }
        logger.debug("Found {} {} headers in {} lines", headers.size(), dialect, lines.size());
        return headers;
    }

    /**
     * Recognize a single line.
     *
     * @return the descriptor, or null if the line is not a banner of this dialect
     */
    HeaderDescriptor recognize(String rawLine, int lineNumber) {
        String line = rawLine.stripTrailing();
        return switch (dialect) {
            case LEGACY -> recognizeLegacy(line, lineNumber);
            case NEW_PM -> recognizeNewPm(line, lineNumber);
        };
    }

    private HeaderDescriptor recognizeLegacy(String line, int lineNumber) {
        Matcher matcher = LEGACY_BANNER.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        String name = lastParenthesized(matcher.group(1).trim());
        logger.debug("Legacy header at line {}: {}", lineNumber, name);
        return new HeaderDescriptor(name, PassScope.UNKNOWN, null, lineNumber, line);
    }

    private HeaderDescriptor recognizeNewPm(String line, int lineNumber) {
        Matcher matcher = NEW_PM_BANNER.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1).trim();
        String target = matcher.group(2).trim();
        logger.debug("New PM header at line {}: {} on {}", lineNumber, name, target);
        if (MODULE_MARKER.equals(target)) {
            return new HeaderDescriptor(name, PassScope.MODULE, null, lineNumber, line);
        }
        return new HeaderDescriptor(name, PassScope.FUNCTION, target, lineNumber, line);
    }

    /**
     * "Instrument function entry/exit (post inlining) (post-inline-ee-instrument)"
     * yields "post-inline-ee-instrument"; text without parentheses is returned as is.
     */
    static String lastParenthesized(String text) {
        Matcher matcher = PARENTHESIZED.matcher(text);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1);
        }
        return last != null ? last.trim() : text.trim();
    }
}
