package stac.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("PageToken")
class PageTokenTest {

    @Test
    @DisplayName("Should decode the offset it encoded")
    void shouldDecodeEncodedOffset() {
        assertEquals(25, PageToken.decode(PageToken.encode(25)));
    }

    @Test
    @DisplayName("Should produce URL safe tokens without padding")
    void shouldBeUrlSafe() {
        var token = PageToken.encode(1234567);

        assertFalse(token.contains("="));
        assertFalse(token.contains("+"));
        assertFalse(token.contains("/"));
    }

    @Test
    @DisplayName("Should start at zero without a token")
    void shouldStartAtZero() {
        assertEquals(0, PageToken.decode(null));
        assertEquals(0, PageToken.decode(" "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not base64!", "b2Zmc2V0OmFiYw", "cGFnZToy", "b2Zmc2V0Oi0x"})
    @DisplayName("Should reject tokens it did not issue")
    void shouldRejectForeignTokens(String token) {
        var e = assertThrows(IllegalArgumentException.class, () -> PageToken.decode(token));

        assertEquals("Invalid pagination token: " + token, e.getMessage());
    }
}
