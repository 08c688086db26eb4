package me.golemcore.recall.domain.service;

import me.golemcore.recall.domain.component.ToolComponent;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ToolCatalogServiceTest {

    @Test
    void shouldListDefinitionsSortedByName() {
        ToolCatalogService catalog = new ToolCatalogService(List.of(tool("smart_search"), tool("context_bridge")));

        List<String> names = catalog.listDefinitions().stream().map(ToolDefinition::getName).toList();

        assertEquals(List.of("context_bridge", "smart_search"), names);
        assertTrue(catalog.findTool("smart_search").isPresent());
        assertTrue(catalog.findTool(null).isEmpty());
    }

    @Test
    void shouldRejectDuplicateNames() {
        List<ToolComponent> tools = List.of(tool("smart_search"), tool("smart_search"));

        assertThrows(IllegalStateException.class, () -> new ToolCatalogService(tools));
    }

    @Test
    void shouldDelegateExecution() throws Exception {
        ToolComponent bridge = tool("context_bridge");
        when(bridge.execute(any())).thenReturn(CompletableFuture.completedFuture(ToolResult.success("ok", null)));
        ToolCatalogService catalog = new ToolCatalogService(List.of(bridge));

        ToolResult result = catalog.execute("context_bridge", null).get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        verify(bridge).execute(Map.of());
    }

    @Test
    void shouldReportUnknownToolAsValidationFailure() throws Exception {
        ToolCatalogService catalog = new ToolCatalogService(List.of(tool("context_bridge")));

        ToolResult result = catalog.execute("teleport", Map.of()).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertTrue(result.getError().contains("context_bridge"));
    }

    @Test
    void shouldWrapFailedFuture() throws Exception {
        ToolComponent bridge = tool("context_bridge");
        when(bridge.execute(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("lost")));
        ToolCatalogService catalog = new ToolCatalogService(List.of(bridge));

        ToolResult result = catalog.execute("context_bridge", Map.of()).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals(RetrievalErrorKind.STORAGE_ERROR, result.getErrorKind());
    }

    private static ToolComponent tool(String name) {
        ToolComponent tool = mock(ToolComponent.class);
        when(tool.getDefinition()).thenReturn(ToolDefinition.builder().name(name).build());
        when(tool.getToolName()).thenReturn(name);
        return tool;
    }
}
