package dev.mediasync.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Local filesystem media storage.
 * Files are named by the downloader with a random 128-bit id, so concurrent writers never
 * touch the same path and no locking is needed; {@code CREATE_NEW} turns an impossible
 * collision into an error instead of an overwrite.
 */
@Slf4j
public class LocalMediaStorage implements MediaStorage {

    @Override
    public Mono<Path> ensureDirectory(Path directory) {
        return Mono.fromCallable(() -> {
            Files.createDirectories(directory);
            return directory;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Long> write(Path target, Flux<DataBuffer> content) {
        return DataBufferUtils.write(content, target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)
                .then(Mono.fromCallable(() -> Files.size(target)).subscribeOn(Schedulers.boundedElastic()))
                .doOnNext(size -> log.debug("Media file written: {} ({} bytes)", target, size))
                .onErrorResume(e -> e instanceof FileAlreadyExistsException
                        ? Mono.error(e)
                        : delete(target).then(Mono.error(e)))
                .doOnCancel(() -> deleteQuietly(target));
    }

    @Override
    public Mono<Boolean> delete(Path file) {
        return Mono.fromCallable(() -> {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.debug("Media file deleted: {}", file);
            }
            return deleted;
        }).subscribeOn(Schedulers.boundedElastic())
          .onErrorResume(IOException.class, e -> {
              log.warn("Failed to delete media file {}: {}", file, e.getMessage());
              return Mono.just(false);
          });
    }

    @Override
    public Mono<Boolean> isWritable(Path directory) {
        return ensureDirectory(directory)
                .map(Files::isWritable)
                .onErrorReturn(false);
    }

    @Override
    public String getType() {
        return "LOCAL";
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to remove partial media file {}: {}", file, e.getMessage());
        }
    }
}
