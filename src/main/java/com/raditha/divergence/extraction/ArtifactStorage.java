package com.raditha.divergence.extraction;

import com.raditha.divergence.model.ArtifactHandle;

/**
 * Where extracted pass blocks are kept for the rest of the run.
 */
public interface ArtifactStorage {

    /**
     * Store one block durably.
     *
     * @throws StorageFaultException if the block cannot be stored
     */
    ArtifactHandle write(String name, byte[] bytes);

    /**
     * Read a block previously returned by {@link #write}.
     *
     * @throws StorageFaultException if the block cannot be read
     */
    String read(ArtifactHandle handle);
}
