package dev.mediasync.service.storage;

import org.springframework.core.io.buffer.DataBuffer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * Abstraction for where downloaded media bytes end up.
 * Implementation: LocalMediaStorage (filesystem directory shared by all concurrent downloads).
 */
public interface MediaStorage {

    /**
     * Create the directory (and parents) if missing.
     *
     * @param directory the media directory
     * @return the same directory once it exists
     */
    Mono<Path> ensureDirectory(Path directory);

    /**
     * Stream bytes into a new file. The file must not exist yet. Nothing is left behind when
     * the stream fails or is cancelled.
     *
     * @param target  the file to create
     * @param content the bytes to write
     * @return number of bytes written
     */
    Mono<Long> write(Path target, Flux<DataBuffer> content);

    /**
     * Delete a stored file.
     *
     * @param file the file to delete
     * @return true if a file was removed
     */
    Mono<Boolean> delete(Path file);

    /**
     * @return true if files can be created in the directory
     */
    Mono<Boolean> isWritable(Path directory);

    /**
     * @return the storage type identifier (e.g., "LOCAL")
     */
    String getType();
}
