package mediagate.gpu.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriorityTierTest {

    @Test
    void parsesCaseInsensitively() {
        assertEquals(PriorityTier.REALTIME, PriorityTier.parse("realtime"));
        assertEquals(PriorityTier.BATCH, PriorityTier.parse(" Batch "));
    }

    @Test
    void blankMeansNormal() {
        assertEquals(PriorityTier.NORMAL, PriorityTier.parse(null));
        assertEquals(PriorityTier.NORMAL, PriorityTier.parse(""));
    }

    @Test
    void rejectsUnknownTier() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PriorityTier.parse("urgent"));
        assertTrue(e.getMessage().contains("urgent"));
    }

    @Test
    void declarationOrderIsDequeueOrder() {
        PriorityTier[] tiers = PriorityTier.values();
        assertArrayEquals(new PriorityTier[] {
                PriorityTier.REALTIME, PriorityTier.HIGH, PriorityTier.NORMAL, PriorityTier.BATCH }, tiers);
    }
}
