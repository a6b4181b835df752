package io.github.pierce.analyzer;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw bytes of an uploaded tabular file together with the encoding the caller
 * declared for it and, optionally, the name it was uploaded under.
 *
 * <p>Instances are immutable: the payload is copied on the way in and on the way out.</p>
 */
public final class RawFile {

    private final byte[] content;
    private final String encoding;
    private final String fileName;

    private RawFile(byte[] content, String encoding, String fileName) {
        if (content == null) {
            throw new IllegalArgumentException("File content cannot be null");
        }
        this.content = content.clone();
        this.encoding = encoding;
        this.fileName = fileName;
    }

    public static RawFile of(byte[] content) {
        return new RawFile(content, null, null);
    }

    public static RawFile of(byte[] content, String encoding) {
        return new RawFile(content, encoding, null);
    }

    public static RawFile of(byte[] content, String encoding, String fileName) {
        return new RawFile(content, encoding, fileName);
    }

    /**
     * Returns a copy of the payload.
     */
    public byte[] getContent() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    /**
     * Returns the declared encoding, or empty when the resolver should detect it.
     */
    public Optional<String> getEncoding() {
        return Optional.ofNullable(encoding).filter(e -> !e.isBlank());
    }

    public Optional<String> getFileName() {
        return Optional.ofNullable(fileName).filter(n -> !n.isBlank());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawFile other)) return false;
        return Arrays.equals(content, other.content)
                && Objects.equals(encoding, other.encoding)
                && Objects.equals(fileName, other.fileName);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(content) + Objects.hash(encoding, fileName);
    }

    @Override
    public String toString() {
        return "RawFile{size=" + content.length + ", encoding=" + encoding + ", fileName=" + fileName + "}";
    }
}
