package com.raditha.divergence.extraction;

import com.raditha.divergence.model.ArtifactHandle;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stores each block as a UTF-8 file in one directory.
 */
public class FileArtifactStorage implements ArtifactStorage {

    private final Path directory;

    public FileArtifactStorage(Path directory) {
        this.directory = directory;
    }

    @Override
    public ArtifactHandle write(String name, byte[] bytes) {
        Path file = directory.resolve(name);
        try {
            Files.createDirectories(directory);
            try (OutputStream out = Files.newOutputStream(file)) {
                out.write(bytes);
            }
        } catch (IOException e) {
            throw new StorageFaultException("Failed to save IR to " + file + ": " + e.getMessage(), e);
        }
        return new ArtifactHandle(name, file.toString());
    }

    @Override
    public String read(ArtifactHandle handle) {
        try {
            return Files.readString(Path.of(handle.location()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageFaultException("Failed to read IR from " + handle.location() + ": " + e.getMessage(), e);
        }
    }
}
