package com.raditha.divergence.model;

/**
 * Reference to a stored content block.
 *
 * @param name     file-system safe artifact name
 * @param location where the storage put it (a file path, or a memory key)
 */
public record ArtifactHandle(String name, String location) {

    @Override
    public String toString() {
        return location;
    }
}
