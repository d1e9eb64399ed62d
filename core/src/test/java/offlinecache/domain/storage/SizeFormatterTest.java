package offlinecache.domain.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SizeFormatterTest {

    @Test
    public void testZero() {
        Assertions.assertEquals("0 Bytes", SizeFormatter.format(0));
    }

    @Test
    public void testWholeUnits() {
        Assertions.assertEquals("1 Bytes", SizeFormatter.format(1));
        Assertions.assertEquals("1 KB", SizeFormatter.format(1024));
        Assertions.assertEquals("1 MB", SizeFormatter.format(1048576));
        Assertions.assertEquals("1 GB", SizeFormatter.format(1073741824));
    }

    @Test
    public void testFractions() {
        Assertions.assertEquals("1.5 KB", SizeFormatter.format(1536));
        Assertions.assertEquals("1023 Bytes", SizeFormatter.format(1023));
        Assertions.assertEquals("2.3 MB", SizeFormatter.format(2411724));
    }

    @Test
    public void testLargestUnitIsGigabytes() {
        Assertions.assertEquals("1024 GB", SizeFormatter.format(1099511627776L));
    }

    @Test
    public void testNegative() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> SizeFormatter.format(-1));
    }
}
