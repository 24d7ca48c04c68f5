/*
 * Copyright 2026 The FlowLedger Authors
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
 */


package org.flowledger.workflow.store;

import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.exception.ConcurrentInstanceModificationException;
import org.flowledger.workflow.exception.StorageFailureException;
import org.flowledger.workflow.exception.WorkflowException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;

import java.util.function.Function;

/**
 * Maps storage errors onto the engine's error taxonomy.
 * <p>
 * Lock and version conflicts on an instance become
 * {@link ConcurrentInstanceModificationException}; every other failure becomes
 * {@link StorageFailureException}. Engine exceptions pass through unchanged.
 */
@Slf4j
final class StorageErrors {

    private StorageErrors() {
    }

    /**
     * Creates an {@code onErrorMap} function for an operation that is not tied to one instance.
     */
    static Function<Throwable, Throwable> translate(String operation) {
        return error -> translate(operation, null, error);
    }

    /**
     * Creates an {@code onErrorMap} function for an operation on one instance.
     */
    static Function<Throwable, Throwable> translate(String operation, String instanceId) {
        return error -> translate(operation, instanceId, error);
    }

    static Throwable translate(String operation, String instanceId, Throwable error) {
        if (error instanceof WorkflowException) {
            return error;
        }
        if (instanceId != null && isConflict(error)) {
            log.warn("STORAGE_CONFLICT: operation={}, instanceId={}, error={}",
                    operation, instanceId, error.getMessage());
            return new ConcurrentInstanceModificationException(instanceId, error);
        }
        log.error("STORAGE_FAILURE: operation={}, instanceId={}, error={}",
                operation, instanceId, error.getMessage(), error);
        return new StorageFailureException(operation, error);
    }

    private static boolean isConflict(Throwable error) {
        return error instanceof ConcurrencyFailureException
                || error instanceof QueryTimeoutException
                || error instanceof DuplicateKeyException;
    }
}
