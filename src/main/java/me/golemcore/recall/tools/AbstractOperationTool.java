package me.golemcore.recall.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.recall.domain.component.ToolComponent;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Base for tools that dispatch on an {@code operation} parameter.
 *
 * <p>
 * Operation names resolve to the enum {@code O}; an unknown name is reported as
 * a {@link RetrievalErrorKind#VALIDATION_ERROR} failure. A
 * {@link RetrievalException} from the operation becomes a failure of its kind,
 * and any other exception a failure of {@link #unexpectedErrorKind()}. The
 * operation name is echoed in the failure data.
 */
@Slf4j
public abstract class AbstractOperationTool<O extends Enum<O> & ToolOperation> implements ToolComponent {

    protected static final String OPERATION = "operation";

    private final Class<O> operationType;
    protected final ToolParameters params;

    protected AbstractOperationTool(Class<O> operationType, ToolParameters params) {
        this.operationType = operationType;
        this.params = params;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> executeOperation(parameters != null ? parameters : Map.of()));
    }

    protected abstract ToolResult dispatch(O operation, Map<String, Object> parameters);

    /**
     * Kind reported for exceptions that are not {@link RetrievalException}s.
     */
    protected RetrievalErrorKind unexpectedErrorKind() {
        return RetrievalErrorKind.STORAGE_ERROR;
    }

    protected List<String> operationNames() {
        return Arrays.stream(operationType.getEnumConstants())
                .map(ToolOperation::getWireName)
                .toList();
    }

    ToolResult executeOperation(Map<String, Object> parameters) {
        Object rawOperation = parameters.get(OPERATION);
        String operationName = rawOperation != null ? rawOperation.toString() : null;
        Optional<O> operation = resolve(operationName);
        if (operation.isEmpty()) {
            log.warn("[Tools] {}: unknown operation '{}'", getToolName(), operationName);
            return ToolResult.failure(RetrievalErrorKind.VALIDATION_ERROR,
                    "Unknown operation: " + operationName + ". Valid operations: "
                            + String.join(", ", operationNames()),
                    echo(operationName));
        }

        try {
            ToolResult result = dispatch(operation.get(), parameters);
            log.info("[Tools] {}.{} result: success={}", getToolName(), operationName, result.isSuccess());
            return result;
        } catch (RetrievalException e) {
            log.warn("[Tools] {}.{} failed ({}): {}", getToolName(), operationName, e.getKind(), e.getMessage());
            return ToolResult.failure(e.getKind(), e.getMessage(), echo(operationName));
        } catch (Exception e) { // NOSONAR - nothing escapes the tool envelope
            log.error("[Tools] {}.{} ERROR: {}", getToolName(), operationName, e.getMessage(), e);
            return ToolResult.failure(unexpectedErrorKind(), "Unexpected error: " + e.getMessage(),
                    echo(operationName));
        }
    }

    private Optional<O> resolve(String operationName) {
        if (operationName == null || operationName.isBlank()) {
            return Optional.empty();
        }
        String normalized = operationName.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(operationType.getEnumConstants())
                .filter(candidate -> candidate.getWireName().equals(normalized))
                .findFirst();
    }

    private static Map<String, Object> echo(String operationName) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(OPERATION, operationName);
        return data;
    }
}
