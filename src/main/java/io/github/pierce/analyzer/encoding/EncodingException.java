package io.github.pierce.analyzer.encoding;

import io.github.pierce.analyzer.AnalysisException;
import io.github.pierce.analyzer.EngineError;

/**
 * Exception thrown when bytes cannot be decoded under the requested or detected encoding.
 */
public class EncodingException extends AnalysisException {

    public EncodingException(String detail) {
        super(new EngineError.EncodingError(detail));
    }

    public EncodingException(String detail, Throwable cause) {
        super(new EngineError.EncodingError(detail), cause);
    }
}
