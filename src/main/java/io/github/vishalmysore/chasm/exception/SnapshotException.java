package io.github.vishalmysore.chasm.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * I/O or format failure while reading or writing a graph snapshot.
 */
@Getter
public class SnapshotException extends ChasmException {

    private final Path path;

    public SnapshotException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public SnapshotException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
