package mediabot.download;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UniquenessTokensTest {

    private final Clock fixed = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @Test
    void tokenCarriesTimeChatAndSequence() {
        var tokens = new UniquenessTokens(fixed);

        assertEquals("dl_1700000000000_42_1", tokens.next(42));
        assertEquals("dl_1700000000000_42_2", tokens.next(42));
        assertEquals("dl_1700000000000_g100_3", tokens.next(-100));
    }

    @Test
    void sameChatSameMillisecondStillDiffers() {
        var tokens = new UniquenessTokens(fixed);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            assertTrue(seen.add(tokens.next(7)));
        }
    }

    @Test
    void concurrentCallersNeverCollide() throws Exception {
        var tokens = new UniquenessTokens(fixed);
        Set<String> seen = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 800; i++) {
            pool.execute(() -> seen.add(tokens.next(7)));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(800, seen.size());
    }

    @Test
    void prefixDoesNotMatchLongerSequence() {
        String prefix = UniquenessTokens.filePrefix("dl_1_42_1");
        assertFalse("dl_1_42_12_song.mp3".startsWith(prefix));
        assertTrue("dl_1_42_1_song.mp3".startsWith(prefix));
    }
}
