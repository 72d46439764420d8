package com.williamcallahan.flarenormalizer.service.finalize;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Decodes percent-encoded path attributes such as {@code Screens%20Shot.png}.
 *
 * Only spaces, unreserved ASCII characters and complete UTF-8 sequences are decoded. Reserved
 * characters stay encoded, including {@code %25}, so decoding an already decoded value is a
 * no-op.
 */
final class PathAttributeDecoder {

    private PathAttributeDecoder() {
    }

    /**
     * @param value raw attribute value
     * @return decoded value, or empty when the value contains a malformed escape
     */
    static Optional<String> decode(String value) {
        if (value == null || value.indexOf('%') < 0) {
            return Optional.ofNullable(value);
        }
        StringBuilder out = new StringBuilder(value.length());
        int index = 0;
        while (index < value.length()) {
            char c = value.charAt(index);
            if (c != '%') {
                out.append(c);
                index++;
                continue;
            }
            int end = index;
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            while (end < value.length() && value.charAt(end) == '%') {
                if (end + 2 >= value.length()) {
                    return Optional.empty();
                }
                int high = Character.digit(value.charAt(end + 1), 16);
                int low = Character.digit(value.charAt(end + 2), 16);
                if (high < 0 || low < 0) {
                    return Optional.empty();
                }
                bytes.write((high << 4) | low);
                end += 3;
            }
            appendDecoded(out, value.substring(index, end), bytes.toByteArray());
            index = end;
        }
        return Optional.of(out.toString());
    }

    private static void appendDecoded(StringBuilder out, String escaped, byte[] bytes) {
        int position = 0;
        while (position < bytes.length) {
            int b = bytes[position] & 0xFF;
            if (b < 0x80) {
                if (isDecodable(b)) {
                    out.append((char) b);
                } else {
                    out.append(escaped, position * 3, position * 3 + 3);
                }
                position++;
                continue;
            }
            int runEnd = position;
            while (runEnd < bytes.length && (bytes[runEnd] & 0xFF) >= 0x80) {
                runEnd++;
            }
            String decoded = decodeUtf8(bytes, position, runEnd - position);
            if (decoded == null) {
                out.append(escaped, position * 3, runEnd * 3);
            } else {
                out.append(decoded);
            }
            position = runEnd;
        }
    }

    private static boolean isDecodable(int b) {
        return b == ' ' || b == '-' || b == '.' || b == '_' || b == '~'
            || (b >= '0' && b <= '9') || (b >= 'A' && b <= 'Z') || (b >= 'a' && b <= 'z');
    }

    private static String decodeUtf8(byte[] bytes, int offset, int length) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes, offset, length))
                .toString();
        } catch (CharacterCodingException invalidSequence) {
            return null;
        }
    }
}
