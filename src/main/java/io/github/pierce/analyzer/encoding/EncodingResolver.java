package io.github.pierce.analyzer.encoding;

import io.github.pierce.analyzer.RawFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnmappableCharacterException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes raw file bytes to text.
 *
 * <p>Decoding is always strict: malformed or unmappable input is reported, never
 * replaced with substitution characters. When no encoding is declared, a byte order
 * mark decides; otherwise UTF-8 is tried first and ISO-8859-1 is the fallback.</p>
 */
public class EncodingResolver {

    private static final Logger LOG = LoggerFactory.getLogger(EncodingResolver.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final Map<String, Charset> SUPPORTED = new LinkedHashMap<>();

    static {
        register(StandardCharsets.UTF_8, "utf-8", "utf8");
        register(StandardCharsets.UTF_16, "utf-16", "utf16");
        register(StandardCharsets.UTF_16LE, "utf-16le", "utf16le");
        register(StandardCharsets.UTF_16BE, "utf-16be", "utf16be");
        register(StandardCharsets.ISO_8859_1, "iso-8859-1", "iso8859-1", "iso_8859_1", "latin1", "latin-1");
        register(StandardCharsets.US_ASCII, "us-ascii", "ascii");
        register(Charset.forName("windows-1252"), "windows-1252", "cp1252");
    }

    private static void register(Charset charset, String... aliases) {
        for (String alias : aliases) {
            SUPPORTED.put(alias, charset);
        }
    }

    /**
     * Returns the accepted encoding names, aliases included.
     */
    public static Set<String> supportedEncodings() {
        return Collections.unmodifiableSet(SUPPORTED.keySet());
    }

    /**
     * Looks up a supported charset by name or alias.
     */
    public static Optional<Charset> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(SUPPORTED.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Decodes the file under its declared encoding, or a detected one when none is declared.
     *
     * @throws EncodingException if the declared encoding is unsupported or the bytes are invalid
     */
    public DecodedText decode(RawFile file) {
        byte[] bytes = file.getContent();
        Optional<String> hint = file.getEncoding();
        if (hint.isPresent()) {
            Charset charset = lookup(hint.get())
                    .orElseThrow(() -> new EncodingException("Unsupported encoding '" + hint.get()
                            + "'. Supported encodings: " + String.join(", ", SUPPORTED.keySet())));
            return new DecodedText(stripByteOrderMark(decodeStrict(bytes, charset)), charset.name());
        }
        return detect(bytes);
    }

    private DecodedText detect(byte[] bytes) {
        Charset fromBom = charsetFromByteOrderMark(bytes);
        if (fromBom != null) {
            LOG.debug("Byte order mark selects {}", fromBom.name());
            return new DecodedText(stripByteOrderMark(decodeStrict(bytes, fromBom)), fromBom.name());
        }
        try {
            return new DecodedText(stripByteOrderMark(decodeStrict(bytes, StandardCharsets.UTF_8)),
                    StandardCharsets.UTF_8.name());
        } catch (EncodingException e) {
            LOG.debug("Input is not valid UTF-8, falling back to ISO-8859-1: {}", e.getMessage());
        }
        // every byte sequence is valid ISO-8859-1
        return new DecodedText(stripByteOrderMark(decodeStrict(bytes, StandardCharsets.ISO_8859_1)),
                StandardCharsets.ISO_8859_1.name());
    }

    private static Charset charsetFromByteOrderMark(byte[] bytes) {
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            return StandardCharsets.UTF_8;
        }
        if (bytes.length >= 2) {
            int first = bytes[0] & 0xFF;
            int second = bytes[1] & 0xFF;
            if ((first == 0xFE && second == 0xFF) || (first == 0xFF && second == 0xFE)) {
                return StandardCharsets.UTF_16;
            }
        }
        return null;
    }

    private static String decodeStrict(byte[] bytes, Charset charset) {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes);
        CharBuffer out = CharBuffer.allocate((int) Math.ceil(bytes.length * (double) decoder.maxCharsPerByte()) + 1);
        CoderResult result = decoder.decode(in, out, true);
        if (result.isUnderflow()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            CharacterCodingException cause = result.isMalformed()
                    ? new MalformedInputException(result.length())
                    : new UnmappableCharacterException(result.length());
            throw new EncodingException(String.format("%s %s input at byte offset %d (length %d)",
                    result.isMalformed() ? "Malformed" : "Unmappable",
                    charset.name(), in.position(), result.length()), cause);
        }
        out.flip();
        return out.toString();
    }

    private static String stripByteOrderMark(String text) {
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            return text.substring(1);
        }
        return text;
    }
}
