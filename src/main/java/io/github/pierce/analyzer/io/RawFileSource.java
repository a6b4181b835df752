package io.github.pierce.analyzer.io;

import io.github.pierce.analyzer.RawFile;

import java.io.IOException;

/**
 * Supplies the bytes of a stored file. Where and how files are stored is up to the implementation.
 */
public interface RawFileSource {

    /**
     * Loads a file by its identifier.
     *
     * @throws java.io.FileNotFoundException if no file has that identifier
     * @throws IOException                   if the file cannot be read
     */
    RawFile fetch(String fileId) throws IOException;
}
