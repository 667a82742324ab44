package com.storyarchitect.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class JsonStorage {

    private JsonStorage() {
    }

    public static <T> T read(ObjectMapper mapper, Path file, Class<T> type) throws IOException {
        return mapper.readValue(Files.readString(file, StandardCharsets.UTF_8), type);
    }

    /**
     * Atomic write: write to .tmp file, then rename.
     */
    public static void writeAtomic(ObjectMapper mapper, Path target, Object value) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        Files.writeString(tmpFile, json, StandardCharsets.UTF_8);
        Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
