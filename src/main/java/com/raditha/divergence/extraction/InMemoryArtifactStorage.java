package com.raditha.divergence.extraction;

import com.raditha.divergence.model.ArtifactHandle;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps blocks in memory. Used by tests and by callers that only want the result.
 */
public class InMemoryArtifactStorage implements ArtifactStorage {

    private final String prefix;
    private final Map<String, String> blocks = new LinkedHashMap<>();

    public InMemoryArtifactStorage() {
        this("memory");
    }

    public InMemoryArtifactStorage(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public synchronized ArtifactHandle write(String name, byte[] bytes) {
        String location = prefix + "/" + name;
        blocks.put(location, new String(bytes, StandardCharsets.UTF_8));
        return new ArtifactHandle(name, location);
    }

    @Override
    public synchronized String read(ArtifactHandle handle) {
        String content = blocks.get(handle.location());
        if (content == null) {
            throw new StorageFaultException("No block stored at " + handle.location(), null);
        }
        return content;
    }

    public synchronized int size() {
        return blocks.size();
    }
}
