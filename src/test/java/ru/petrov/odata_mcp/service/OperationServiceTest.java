package ru.petrov.odata_mcp.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.petrov.odata_mcp.CatalogFixtures;
import ru.petrov.odata_mcp.client.EntityClient;
import ru.petrov.odata_mcp.exception.DestinationException;
import ru.petrov.odata_mcp.exception.ErrorCode;
import ru.petrov.odata_mcp.exception.MissingKeyPropertyException;
import ru.petrov.odata_mcp.model.destination.Destination;
import ru.petrov.odata_mcp.model.destination.EntityKey;
import ru.petrov.odata_mcp.model.destination.EntityTarget;
import ru.petrov.odata_mcp.model.operation.ExecuteRequest;
import ru.petrov.odata_mcp.model.operation.OperationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OperationServiceTest {
    private static final Destination ERP = Destination.basic("ERP_SYSTEM", "http://erp.local", "tech", "secret");

    @Mock
    private DestinationService destinationService;

    @Mock
    private EntityClient entityClient;

    private OperationService operationService;

    @BeforeEach
    void setUp() {
        operationService = new OperationService(CatalogFixtures.catalog(), destinationService, entityClient);
    }

    private void givenDestination() {
        when(destinationService.getExecutionDestination(any(), anyBoolean())).thenReturn(ERP);
    }

    private static ExecuteRequest.ExecuteRequestBuilder request(String serviceId, String entityName, String operation) {
        return ExecuteRequest.builder().serviceId(serviceId).entityName(entityName).operation(operation);
    }

    @Test
    @DisplayName("Чтение списка передает собранные параметры запроса")
    void readPassesQueryOptions() {
        givenDestination();
        when(entityClient.read(any(), anyMap())).thenReturn(List.of(Map.of("ID", "1")));

        OperationResult result = operationService.execute(request("API_BP", "Customer", "read")
                .filterString("Name eq 'A'").topNumber(5).build(), "user-token");

        assertTrue(result.success());
        assertEquals("read", result.operation());
        assertEquals("Reading Customer entities (top 5) with filter: Name eq 'A'", result.message());
        assertEquals(List.of(Map.of("ID", "1")), result.result());

        ArgumentCaptor<EntityTarget> target = ArgumentCaptor.forClass(EntityTarget.class);
        verify(entityClient).read(target.capture(), eq(Map.of("$filter", "Name eq 'A'", "$top", 5)));
        assertEquals("Customers", target.getValue().entitySet());
        assertEquals("http://erp.local/sap/opu/odata/sap/API_BP", target.getValue().serviceRoot());
        assertEquals("Edm.String", target.getValue().keyType());
        verify(destinationService).getExecutionDestination("user-token", true);
    }

    @Test
    void updateSendsPayloadWithoutKeyProperties() {
        givenDestination();

        OperationResult result = operationService.execute(request("API_BP", "Customer", "update")
                .parameters(Map.of("ID", "1")).build(), null);

        assertTrue(result.success());
        assertEquals("Updating Customer with key: 1", result.message());
        verify(entityClient).update(any(), eq(EntityKey.single("ID", "1")), eq(Map.of()));
    }

    @Test
    @DisplayName("Удаление запрещенной сущности не доходит до сети")
    void deleteOnNonDeletableEntityFailsBeforeAnyCall() {
        OperationResult result = operationService.execute(request("API_BP", "Customer", "delete").build(), "user-token");

        assertFalse(result.success());
        assertEquals(ErrorCode.OPERATION_NOT_ALLOWED, result.errorCode());
        assertEquals("Entity 'Customer' does not support delete operations", result.error());
        assertNotNull(result.suggestion());
        verifyNoInteractions(entityClient, destinationService);
    }

    @Test
    void createOnReadOnlyEntityIsRejected() {
        OperationResult result = operationService.execute(request("API_BP", "Supplier", "create")
                .parameters(Map.of("CompanyName", "ACME")).build(), null);

        assertEquals(ErrorCode.OPERATION_NOT_ALLOWED, result.errorCode());
        verifyNoInteractions(entityClient);
    }

    @Test
    void deleteReturnsAcknowledgement() {
        givenDestination();

        OperationResult result = operationService.execute(request("API_SALES_ORDER_SRV", "SalesOrder", "delete")
                .parameters(Map.of("SalesOrder", "42")).build(), null);

        assertTrue(result.success());
        assertEquals("Successfully deleted SalesOrder with key: 42", result.message());
        assertEquals(Map.of("message", "Successfully deleted SalesOrder with key: 42", "success", true), result.result());
        verify(entityClient).delete(any(), eq(EntityKey.single("SalesOrder", "42")));
    }

    @Test
    @DisplayName("Составной ключ собирается в порядке объявления")
    void compositeKeyFollowsDeclaredOrder() {
        givenDestination();
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("SalesOrderItem", "10");
        parameters.put("SalesOrder", "1");

        OperationResult result = operationService.execute(request("API_SALES_ORDER_SRV", "SalesOrderItem", "read-single")
                .parameters(parameters).build(), null);

        ArgumentCaptor<EntityTarget> target = ArgumentCaptor.forClass(EntityTarget.class);
        ArgumentCaptor<EntityKey> key = ArgumentCaptor.forClass(EntityKey.class);
        verify(entityClient).readOne(target.capture(), key.capture(), anyMap());
        assertNull(target.getValue().keyType());
        assertEquals(List.of("SalesOrder", "SalesOrderItem"), List.copyOf(key.getValue().values().keySet()));
        assertEquals("Reading single SalesOrderItem with key: SalesOrder='1',SalesOrderItem='10'", result.message());
    }

    @Test
    void missingKeyPropertyIsReported() {
        OperationResult result = operationService.execute(request("API_SALES_ORDER_SRV", "SalesOrderItem", "read-single")
                .parameters(Map.of("SalesOrder", "1")).build(), null);

        assertFalse(result.success());
        assertEquals(ErrorCode.MISSING_KEY_PROPERTY, result.errorCode());
        assertEquals("Missing required key property: SalesOrderItem. Required keys: SalesOrder, SalesOrderItem", result.error());
        verifyNoInteractions(entityClient, destinationService);
    }

    @Test
    void singleKeyIsPassedRaw() {
        EntityKey key = OperationService.buildKey(CatalogFixtures.note(), Map.of("NoteID", 7));
        assertFalse(key.isComposite());
        assertEquals("7", key.value());
        assertThrows(MissingKeyPropertyException.class,
                () -> OperationService.buildKey(CatalogFixtures.note(), Map.of("Text", "x")));
    }

    @Test
    @DisplayName("Старый объект queryOptions перезаписывает плоские поля")
    void legacyQueryOptionsOverrideDiscreteFields() {
        Map<String, Object> legacy = new LinkedHashMap<>();
        legacy.put("$filter", "B");
        legacy.put("$top", 3);

        Map<String, Object> options = OperationService.buildQueryOptions(request("S", "E", "read")
                .filterString("A").selectString("Name").orderbyString(" ").skipNumber(0).queryOptions(legacy).build());

        assertEquals("B", options.get("$filter"));
        assertEquals(3, options.get("$top"));
        assertEquals("Name", options.get("$select"));
        assertEquals(0, options.get("$skip"));
        assertFalse(options.containsKey("$orderby"));
        assertFalse(options.containsKey("$expand"));
    }

    @Test
    void serviceTitleInsteadOfIdGetsSuggestion() {
        OperationResult result = operationService.execute(request("Business Partner", "Customer", "read").build(), null);

        assertFalse(result.success());
        assertEquals(ErrorCode.NOT_FOUND, result.errorCode());
        assertEquals("Use serviceId 'API_BP' instead.", result.suggestion());
        verifyNoInteractions(entityClient, destinationService);
    }

    @Test
    void unknownEntityListsAvailableNames() {
        OperationResult result = operationService.execute(request("API_BP", "Vendor", "read").build(), null);

        assertEquals(ErrorCode.NOT_FOUND, result.errorCode());
        assertTrue(result.error().contains("Available entities: Customer, Supplier"));
    }

    @Test
    void invalidOperationListsValidOperations() {
        OperationResult result = operationService.execute(request("API_BP", "Customer", "upsert").build(), null);

        assertFalse(result.success());
        assertEquals("upsert", result.operation());
        assertEquals(ErrorCode.INVALID_ARGUMENT, result.errorCode());
        assertTrue(result.error().contains("read, read-single, create, update, delete"));
    }

    @Test
    void upstreamFailureIsWrapped() {
        givenDestination();
        when(entityClient.read(any(), anyMap())).thenThrow(new IllegalStateException("connection refused"));

        OperationResult result = operationService.execute(request("API_BP", "Customer", "read").build(), null);

        assertFalse(result.success());
        assertEquals(ErrorCode.UPSTREAM_ERROR, result.errorCode());
        assertEquals("connection refused", result.error());
    }

    @Test
    void destinationFailureIsReported() {
        when(destinationService.getExecutionDestination(any(), anyBoolean()))
                .thenThrow(new DestinationException("Destination 'ERP_SYSTEM' not found in environment variables or destination service"));

        OperationResult result = operationService.execute(request("API_BP", "Customer", "read").build(), "token");

        assertEquals(ErrorCode.DESTINATION_ERROR, result.errorCode());
        verify(entityClient, never()).read(any(), anyMap());
    }

    @Test
    void technicalUserCanBeForced() {
        givenDestination();

        operationService.execute(request("API_BP", "Customer", "create")
                .parameters(Map.of("ID", "9", "Name", "New")).useUserToken(false).build(), "user-token");

        verify(destinationService).getExecutionDestination("user-token", false);
        verify(entityClient).create(any(), eq(Map.of("ID", "9", "Name", "New")));
    }
}
