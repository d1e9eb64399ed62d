package offlinecache.domain.query;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class QueryFingerprintTest {

    private final QueryFingerprint queryFingerprint = new QueryFingerprint();

    @Test
    public void testWhitespaceAndSemicolonsAreIgnored() {
        Assertions.assertEquals(
                queryFingerprint.fingerprint("SELECT * FROM sales"),
                queryFingerprint.fingerprint("  SELECT *\n\tFROM   sales ;; "));
    }

    @Test
    public void testDifferentQueriesDiffer() {
        Assertions.assertNotEquals(
                queryFingerprint.fingerprint("SELECT * FROM sales"),
                queryFingerprint.fingerprint("SELECT * FROM stock"));
    }

    @Test
    public void testNormalize() {
        Assertions.assertEquals("SELECT 1", queryFingerprint.normalize(" SELECT   1; "));
    }

    @Test
    public void testCacheKey() {
        final String key = queryFingerprint.cacheKey("SELECT 1");

        Assertions.assertTrue(key.startsWith("query-"));
        Assertions.assertTrue(key.endsWith(".json"));
        // sha256 as hex
        Assertions.assertEquals("query-".length() + 64 + ".json".length(), key.length());
    }

    @Test
    public void testBlankQueryIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> queryFingerprint.fingerprint("   "));
    }
}
