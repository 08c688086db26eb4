package me.golemcore.recall.domain.model;

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

/**
 * Unchecked failure raised by retrieval services. Tool components translate it
 * into a structured {@link ToolResult} at the boundary, so it never reaches
 * the caller of an operation.
 */
public class RetrievalException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final RetrievalErrorKind kind;

    public RetrievalException(RetrievalErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RetrievalException(RetrievalErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public RetrievalErrorKind getKind() {
        return kind;
    }

    public static RetrievalException notFound(String message) {
        return new RetrievalException(RetrievalErrorKind.NOT_FOUND, message);
    }

    public static RetrievalException validation(String message) {
        return new RetrievalException(RetrievalErrorKind.VALIDATION_ERROR, message);
    }

    public static RetrievalException storage(String message, Throwable cause) {
        return new RetrievalException(RetrievalErrorKind.STORAGE_ERROR, message, cause);
    }
}
