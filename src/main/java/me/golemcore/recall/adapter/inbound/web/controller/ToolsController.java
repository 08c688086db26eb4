package me.golemcore.recall.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.recall.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.service.ToolCatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST endpoint for listing and invoking tools. The response body is always
 * the tool's {@link ToolResult}; the HTTP status follows its error kind.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final ToolCatalogService toolCatalogService;

    @GetMapping
    public Mono<ResponseEntity<List<ToolDefinition>>> listTools() {
        return Mono.just(ResponseEntity.ok(toolCatalogService.listDefinitions()));
    }

    @PostMapping("/{name}")
    public Mono<ResponseEntity<ToolResult>> invokeTool(@PathVariable String name,
            @RequestBody(required = false) Map<String, Object> parameters) {
        if (toolCatalogService.findTool(name).isEmpty()) {
            return Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown tool: " + name));
        }
        return Mono.fromFuture(() -> toolCatalogService.execute(name, parameters != null ? parameters : Map.of()))
                .map(result -> ResponseEntity.status(statusFor(result)).body(result));
    }

    private static HttpStatus statusFor(ToolResult result) {
        return result.isSuccess() ? HttpStatus.OK : GlobalExceptionHandler.statusFor(result.getErrorKind());
    }
}
