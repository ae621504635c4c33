package com.raditha.divergence.extraction;

import com.raditha.divergence.model.ArtifactHandle;
import com.raditha.divergence.model.HeaderDescriptor;
import com.raditha.divergence.model.PassRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a dump into one block per header and stores each block.
 * Block i holds the lines strictly between header i and header i+1 (or the end of input),
 * each with trailing whitespace removed.
 */
public class ContentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ContentExtractor.class);

    private final ArtifactStorage storage;

    public ContentExtractor(ArtifactStorage storage) {
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        this.storage = storage;
    }

    /**
     * Extract and store the block of every header.
     *
     * @param lines   the whole dump
     * @param headers headers found in {@code lines}, in line order
     * @return one record per header, indexed in discovery order
     * @throws StorageFaultException if any block cannot be stored
     */
    public List<PassRecord> extract(List<String> lines, List<HeaderDescriptor> headers) {
        List<PassRecord> records = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            HeaderDescriptor header = headers.get(i);
            // line numbers are 1-based, so header.lineNumber() is the 0-based index of the first content line
            int start = header.lineNumber();
            int end = i + 1 < headers.size() ? headers.get(i + 1).lineNumber() - 1 : lines.size();
            if (end < start) {
                throw new IllegalArgumentException("Headers out of order at line " + header.lineNumber());
            }

            String content = block(lines, start, end);
            String name = ArtifactNames.forPass(i, header.canonicalName(), header.scope(), header.target());
            ArtifactHandle handle = storage.write(name, content.getBytes(StandardCharsets.UTF_8));

            records.add(new PassRecord(header.canonicalName(), i, header.scope(), header.target(), handle));
            logger.debug("Extracted pass {}: {} ({} lines)", i, header.canonicalName(), end - start);
        }
        logger.info("Extracted {} passes", records.size());
        return records;
    }

    static String block(List<String> lines, int start, int end) {
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < end; i++) {
            sb.append(lines.get(i).stripTrailing()).append('\n');
        }
        return sb.toString();
    }
}
