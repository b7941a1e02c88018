package com.gitagent.server.git;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads and writes text files inside one working tree. Any path that resolves outside the
 * root is rejected before the filesystem is touched.
 */
public class WorkingTreeFiles {

    private final Path root;

    public WorkingTreeFiles(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * @throws IllegalArgumentException if the path escapes the tree or the file is not UTF-8 text
     * @throws NoSuchFileException      if the file does not exist
     */
    public String read(String relativePath) throws IOException {
        Path file = resolve(relativePath);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(relativePath, null, "File not found");
        }
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Binary or non-UTF-8 file");
        }
    }

    /** Overwrite (or create) a file. The parent directory must already exist. */
    public void write(String relativePath, String content) throws IOException {
        Files.writeString(resolve(relativePath), content, StandardCharsets.UTF_8);
    }

    Path resolve(String relativePath) {
        Path file = root.resolve(relativePath).normalize();
        if (!file.startsWith(root) || file.equals(root)) {
            throw new IllegalArgumentException("Invalid path");
        }
        return file;
    }
}
