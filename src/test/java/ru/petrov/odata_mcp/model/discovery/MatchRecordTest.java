package ru.petrov.odata_mcp.model.discovery;

import org.junit.jupiter.api.Test;
import ru.petrov.odata_mcp.CatalogFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchRecordTest {

    @Test
    void scoreMustBeWithinUnitInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> MatchRecord.service(1.5, CatalogFixtures.miscService(), "too high"));
        assertThrows(IllegalArgumentException.class,
                () -> new MatchRecord(MatchKind.ENTITY, -0.1, CatalogFixtures.miscService(), CatalogFixtures.note(), List.of(), "negative"));
    }

    @Test
    void serviceMatchHasNoEntity() {
        MatchRecord match = MatchRecord.service(0.9, CatalogFixtures.miscService(), "id");

        assertEquals(MatchKind.SERVICE, match.kind());
        assertNull(match.entity());
        assertTrue(match.matchedProperties().isEmpty());
    }
}
