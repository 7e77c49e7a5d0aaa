package com.chronoline.timeline.loaders.api;

import java.nio.file.Path;
import java.util.Optional;

/**
 * What is known about a producer input before it is read.
 */
public record InputContext(
        String filename,
        Optional<Path> sourcePath,
        Optional<String> mimeType
) {
    public static InputContext of(String filename) {
        return new InputContext(filename, Optional.empty(), Optional.empty());
    }

    public static InputContext of(Path path) {
        return new InputContext(
                path.getFileName().toString(),
                Optional.of(path),
                Optional.empty()
        );
    }

    public static InputContext ofMimeType(String mimeType) {
        return new InputContext(null, Optional.empty(), Optional.ofNullable(mimeType));
    }

    public InputContext withMimeType(String mimeType) {
        return new InputContext(filename, sourcePath, Optional.of(mimeType));
    }
}
