package stac.adapter.out.storage.memory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque pagination token for the in-memory catalog. Encodes the offset of the next page.
 */
final class PageToken {

    private static final String PREFIX = "offset:";

    private PageToken() {}

    static String encode(int offset) {
        var bytes = (PREFIX + offset).getBytes(StandardCharsets.UTF_8);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Decode a token.
     *
     * @param token the token, or null for the first page
     * @return the offset
     * @throws IllegalArgumentException if the token was not issued by {@link #encode}
     */
    static int decode(String token) {
        if (token == null || token.isBlank()) {
            return 0;
        }
        String text;
        try {
            text = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid pagination token: " + token, e);
        }
        if (!text.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Invalid pagination token: " + token);
        }
        try {
            var offset = Integer.parseInt(text.substring(PREFIX.length()));
            if (offset < 0) {
                throw new IllegalArgumentException("Invalid pagination token: " + token);
            }
            return offset;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid pagination token: " + token, e);
        }
    }
}
