package ru.petrov.odata_mcp.controller;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import ru.petrov.odata_mcp.model.discovery.DiscoveryRequest;
import ru.petrov.odata_mcp.model.discovery.ServiceOverview;
import ru.petrov.odata_mcp.model.operation.ExecuteRequest;
import ru.petrov.odata_mcp.model.operation.OperationResult;
import ru.petrov.odata_mcp.service.DiscoveryService;
import ru.petrov.odata_mcp.service.InstructionsService;
import ru.petrov.odata_mcp.service.OperationService;
import ru.petrov.odata_mcp.tools.UserTokens;

import java.util.List;

/**
 * REST-доступ к тем же операциям, что и инструменты MCP.
 */
@RestController
public class ODataController {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ODataController.class);
    private final DiscoveryService discoveryService;
    private final OperationService operationService;
    private final InstructionsService instructionsService;

    public ODataController(DiscoveryService discoveryService, OperationService operationService,
                           InstructionsService instructionsService) {
        this.discoveryService = discoveryService;
        this.operationService = operationService;
        this.instructionsService = instructionsService;
    }

    @PostMapping("/api/discover")
    public Object discover(@RequestBody DiscoveryRequest request) {
        log.info("Запрос поиска: {}", request);
        if (isPresent(request.serviceId()) && isPresent(request.entityName())) {
            return discoveryService.describeEntity(request.serviceId(), request.entityName());
        }
        if (isPresent(request.serviceId())) {
            return discoveryService.describeService(request.serviceId());
        }
        return discoveryService.discover(request.query(), request.category(), request.limit());
    }

    @PostMapping("/api/execute")
    public ResponseEntity<OperationResult> execute(
            @RequestBody ExecuteRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        OperationResult result = operationService.execute(request, UserTokens.fromAuthorizationHeader(authorization));
        if (result.success()) {
            return ResponseEntity.ok(result);
        }
        return ResponseEntity.status(result.errorCode().httpStatus()).body(result);
    }

    @GetMapping("/api/services")
    public List<ServiceOverview> services() {
        return discoveryService.listServices();
    }

    @GetMapping(value = "/api/instructions", produces = "text/markdown;charset=UTF-8")
    public String instructions() {
        return instructionsService.instructions();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
