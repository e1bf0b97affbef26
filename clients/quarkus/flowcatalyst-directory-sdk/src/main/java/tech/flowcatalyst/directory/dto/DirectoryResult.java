package tech.flowcatalyst.directory.dto;

import java.util.Optional;

/**
 * Successful outcome of a directory operation: the decoded value, if the operation returns one,
 * and the HTTP status it completed with.
 */
public record DirectoryResult<T>(T value, int status) {

    public static <T> DirectoryResult<T> of(T value, int status) {
        return new DirectoryResult<>(value, status);
    }

    public static DirectoryResult<Void> status(int status) {
        return new DirectoryResult<>(null, status);
    }

    public Optional<T> valueOptional() {
        return Optional.ofNullable(value);
    }
}
