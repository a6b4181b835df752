package io.github.pierce.analyzer.io;

import io.github.pierce.analyzer.RawFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads files from a base directory. Identifiers are paths relative to that directory
 * and may not escape it.
 */
public class FileSystemRawFileSource implements RawFileSource {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemRawFileSource.class);

    private final Path baseDirectory;
    private final String encoding;

    public FileSystemRawFileSource(Path baseDirectory) {
        this(baseDirectory, null);
    }

    /**
     * @param encoding encoding declared for every file, or null to let the analyzer detect it
     */
    public FileSystemRawFileSource(Path baseDirectory, String encoding) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        this.encoding = encoding;
    }

    @Override
    public RawFile fetch(String fileId) throws IOException {
        Path resolved = baseDirectory.resolve(fileId).normalize();
        if (!resolved.startsWith(baseDirectory)) {
            throw new SecurityException("Path traversal attempt detected: " + fileId);
        }
        if (!Files.isRegularFile(resolved)) {
            throw new FileNotFoundException("File not found: " + fileId);
        }
        LOG.debug("Reading {} ({} bytes)", resolved, Files.size(resolved));
        return RawFile.of(Files.readAllBytes(resolved), encoding, resolved.getFileName().toString());
    }
}
