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
 * Classification of retrieval failures. Carried by {@link RetrievalException}
 * inside the domain and echoed as {@code errorKind} in tool envelopes so
 * callers can tell "nothing matched" apart from "the source failed".
 */
public enum RetrievalErrorKind {

    /**
     * Session, project state or checkpoint does not exist.
     */
    NOT_FOUND,

    /**
     * A session exists but belongs to a different project than requested.
     */
    PROJECT_MISMATCH,

    /**
     * I/O failure on the persistence medium.
     */
    STORAGE_ERROR,

    /**
     * A search backend failed or timed out. Never propagates to sibling
     * backends.
     */
    BACKEND_ERROR,

    /**
     * A required parameter is missing or malformed.
     */
    VALIDATION_ERROR
}
