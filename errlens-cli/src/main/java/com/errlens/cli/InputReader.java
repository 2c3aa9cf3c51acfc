package com.errlens.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads tool output from a file or standard input.
 *
 * <p>Bytes are decoded as UTF-8; malformed sequences are replaced rather than
 * rejected, since build logs frequently mix encodings.
 */
final class InputReader {

    static final String STDIN = "-";

    private InputReader() {
        // Utility class
    }

    /**
     * Reads the whole input.
     *
     * @param source file path, or {@code -} for standard input
     * @return decoded text
     * @throws IOException if the file or stream cannot be read
     */
    static String read(String source) throws IOException {
        if (source == null || STDIN.equals(source)) {
            return read(System.in);
        }
        Path path = Paths.get(source);
        if (!Files.isRegularFile(path)) {
            throw new IOException("Input file not found: " + path);
        }
        return decode(Files.readAllBytes(path));
    }

    static String read(InputStream in) throws IOException {
        return decode(in.readAllBytes());
    }

    private static String decode(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }
}
