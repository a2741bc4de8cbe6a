package com.secondhand.status;

import com.google.gson.JsonObject;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class MarketStatisticsTest {

    @Test
    public void testIncrement_PerOwner() {
        MarketStatistics statistics = new MarketStatistics();
        statistics.increment("p1", StatisticType.SEARCHES_STARTED);
        statistics.increment("p1", StatisticType.SEARCHES_STARTED);
        statistics.increment("p2", StatisticType.SALES_LISTED);

        assertEquals(2, statistics.get("p1", StatisticType.SEARCHES_STARTED));
        assertEquals(0, statistics.get("p2", StatisticType.SEARCHES_STARTED));
        assertEquals(0, statistics.get("nobody", StatisticType.SALES_LISTED));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testSnapshot_ReadOnly() {
        MarketStatistics statistics = new MarketStatistics();
        statistics.increment("p1", StatisticType.ITEMS_FOUND);

        Map<StatisticType, Long> snapshot = statistics.snapshot("p1");
        assertEquals(Long.valueOf(1), snapshot.get(StatisticType.ITEMS_FOUND));
        snapshot.put(StatisticType.ITEMS_FOUND, 5L);
    }

    @Test
    public void testRestore_SkipsUnknownCounters() {
        MarketStatistics statistics = new MarketStatistics();
        statistics.increment("p1", StatisticType.OFFERS_RECEIVED);
        JsonObject json = statistics.serialize();
        json.getAsJsonObject("p1").addProperty("TELEPORTS", 9);
        json.addProperty("p2", "garbage");

        MarketStatistics restored = new MarketStatistics();
        restored.restore(json);

        assertEquals(1, restored.get("p1", StatisticType.OFFERS_RECEIVED));
        assertEquals(1, restored.snapshot("p1").size());
        assertTrue(restored.snapshot("p2").isEmpty());
    }
}
