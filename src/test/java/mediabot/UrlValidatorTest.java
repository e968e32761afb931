package mediabot;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlValidatorTest {

    private final UrlValidator validator = new UrlValidator();

    @Test
    void acceptsSupportedPlatforms() {
        assertTrue(validator.isSupportedUrl("https://www.youtube.com/watch?v=dQw4w9WgXcQ"));
        assertTrue(validator.isSupportedUrl("https://music.youtube.com/watch?v=abc"));
        assertTrue(validator.isSupportedUrl("https://vm.tiktok.com/ZMabc/"));
        assertTrue(validator.isSupportedUrl("https://www.instagram.com/reel/xyz/"));
        assertTrue(validator.isSupportedUrl("https://fb.watch/abc/"));
        assertTrue(validator.isSupportedUrl("https://x.com/user/status/1"));
        assertTrue(validator.isSupportedUrl("https://soundcloud.com/artist/track"));
        assertTrue(validator.isSupportedUrl("https://vimeo.com/123"));
        assertTrue(validator.isSupportedUrl("https://www.dailymotion.com/video/x7"));
    }

    @Test
    void hostIsMatchedCaseInsensitively() {
        assertTrue(validator.isSupportedUrl("HTTPS://WWW.YOUTUBE.COM/watch?v=abc"));
    }

    @Test
    void missingSchemeIsTreatedAsHttps() {
        assertTrue(validator.isSupportedUrl("youtu.be/abc"));
        assertFalse(validator.isSupportedUrl("example.com/video"));
        assertEquals("https://youtu.be/abc", UrlValidator.normalize("  youtu.be/abc "));
        assertEquals("http://youtu.be/abc", UrlValidator.normalize("http://youtu.be/abc"));
    }

    @Test
    void rejectsOtherHostsThatOnlyContainAllowedName() {
        assertFalse(validator.isSupportedUrl("https://dropbox.com/s/file"));
        assertFalse(validator.isSupportedUrl("https://notyoutube.com.evil.org/watch"));
        assertFalse(validator.isSupportedUrl("https://notyoutube.com/watch?v=abc"));
        assertFalse(validator.isSupportedUrl("https://youtube.com.evil.org/watch?v=abc"));
        assertTrue(validator.isSupportedUrl("https://music.youtube.com/watch?v=abc"));
        assertTrue(validator.isSupportedUrl("https://x.com/user/status/1"));
    }

    @Test
    void garbageIsRejectedWithoutThrowing() {
        assertFalse(validator.isSupportedUrl(null));
        assertFalse(validator.isSupportedUrl(""));
        assertFalse(validator.isSupportedUrl("   "));
        assertFalse(validator.isSupportedUrl("hello world"));
        assertFalse(validator.isSupportedUrl("https://youtube.com/ watch?v=%%%"));
        assertFalse(validator.isSupportedUrl("::::"));
        assertNull(UrlValidator.normalize("  "));
    }
}
