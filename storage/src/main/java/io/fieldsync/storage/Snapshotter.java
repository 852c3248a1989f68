// file: src/main/java/io/fieldsync/storage/Snapshotter.java
package io.fieldsync.storage;

/**
 * Snapshot abstraction to bound recovery time and WAL size.
 * <p>
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL segments from {@link StoreImage#replayFromSegment()} onward.
 */
public interface Snapshotter {

    /**
     * Persist a full image of the store. Must be atomic: a crash leaves either the
     * previous snapshot or the new one, never a partial file.
     *
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(StoreImage image);

    /** Load the latest snapshot, or null if none was ever written. */
    StoreImage loadLatest();
}
