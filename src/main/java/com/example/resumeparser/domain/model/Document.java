package com.example.resumeparser.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable handle to the bytes of a submitted résumé.
 * The page count is not known here; engines report it in the {@link ExtractionResult}.
 */
public record Document(String fileName, String path, byte[] content) {

    public Document {
        content = content == null ? new byte[0] : content.clone();
    }

    /**
     * Creates an in-memory document that has no backing file.
     */
    public static Document ofBytes(String fileName, byte[] content) {
        return new Document(fileName, null, content);
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public long byteSize() {
        return content.length;
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    /**
     * @return the path when the document came from disk, otherwise the file name
     */
    public String reference() {
        return path != null ? path : fileName;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Document that)) {
            return false;
        }
        return Objects.equals(fileName, that.fileName)
                && Objects.equals(path, that.path)
                && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(fileName, path) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "Document[fileName=" + fileName + ", path=" + path + ", bytes=" + content.length + "]";
    }
}
