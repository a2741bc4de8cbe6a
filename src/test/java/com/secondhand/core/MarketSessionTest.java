package com.secondhand.core;

import com.secondhand.error.ErrorKind;
import com.secondhand.state.ItemCategory;
import com.secondhand.support.InMemoryHost;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class MarketSessionTest {

    private InMemoryHost host;
    private MarketSession session;

    @Before
    public void setUp() {
        host = new InMemoryHost().fund("p1", 100_000);
        session = MarketSession.open(host.services());
    }

    @Test
    public void testOnHourTick_StaleHoursIgnored() {
        String searchId = session.requestSearch("p1", new ItemCategory("plow", "Plow", 10_000), 1, 1)
                .getValue().getId();

        session.onHourTick(5);
        session.onHourTick(5);
        session.onHourTick(3);

        assertEquals(5, session.currentHour());
        assertEquals("One timer hour per forward tick", Integer.valueOf(23), session.getHoursRemaining(searchId).getValue());
    }

    @Test
    public void testGetHoursRemaining_UnknownId_Validation() {
        assertTrue(session.getHoursRemaining("LST-404").failedWith(ErrorKind.VALIDATION));
    }

    @Test
    public void testSessions_ShareNothing() {
        MarketSession other = MarketSession.open(new InMemoryHost().fund("p1", 100_000).services());

        session.requestSearch("p1", new ItemCategory("plow", "Plow", 10_000), 1, 1);

        assertEquals(1, session.getActiveSearches("p1").size());
        assertTrue(other.getActiveSearches("p1").isEmpty());
    }

    @Test
    public void testOwnerOf_LiveSearch() {
        String searchId = session.requestSearch("p1", new ItemCategory("plow", "Plow", 10_000), 1, 1)
                .getValue().getId();

        assertEquals("p1", session.ownerOf(searchId).orElse(null));
        assertFalse(session.ownerOf("SRCH-999").isPresent());
    }
}
