package ru.petrov.odata_mcp.model.catalog;

import org.junit.jupiter.api.Test;
import ru.petrov.odata_mcp.CatalogFixtures;
import ru.petrov.odata_mcp.model.operation.Operation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityDefinitionTest {
    private static final PropertyDefinition ID = new PropertyDefinition("ID", "Edm.String", false, 10);

    @Test
    void keyMustBeDeclared() {
        assertThrows(IllegalArgumentException.class,
                () -> new EntityDefinition("E", "Es", "N", List.of(), List.of(ID), true, true, true));
        assertThrows(IllegalArgumentException.class,
                () -> new EntityDefinition("E", "Es", "N", List.of("Other"), List.of(ID), true, true, true));
    }

    @Test
    void readIsAlwaysAllowed() {
        EntityDefinition readOnly = CatalogFixtures.supplier();

        assertTrue(readOnly.allows(Operation.READ));
        assertTrue(readOnly.allows(Operation.READ_SINGLE));
        assertFalse(readOnly.allows(Operation.CREATE));
        assertFalse(readOnly.allows(Operation.UPDATE));
        assertFalse(readOnly.allows(Operation.DELETE));
        assertEquals("read=yes, create=no, update=no, delete=no", readOnly.capabilitiesSummary());
    }

    @Test
    void serviceDefaultsTitleToId() {
        ServiceDefinition service = new ServiceDefinition("ZSRV", null, null, "/zsrv", "1", "V2", null);

        assertEquals("ZSRV", service.title());
        assertEquals("", service.description());
        assertTrue(service.entityTypes().isEmpty());
        assertTrue(service.findEntity("Any").isEmpty());
    }
}
