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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.flowledger.workflow.exception.ConcurrentInstanceModificationException;
import org.flowledger.workflow.exception.StorageFailureException;
import org.flowledger.workflow.model.InstanceStatus;
import org.flowledger.workflow.model.InstanceSummary;
import org.flowledger.workflow.model.WorkflowInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.r2dbc.core.FetchSpec;
import org.springframework.r2dbc.core.RowsFetchSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link R2dbcWorkflowInstanceStore}.
 */
@ExtendWith(MockitoExtension.class)
class R2dbcWorkflowInstanceStoreTest {

    private static final String INSTANCE_ID = "2f1b7c9e-6a0d-4e55-9d4b-7c1e3a9f0b21";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private GenericExecuteSpec executeSpec;

    @Mock
    private RowsFetchSpec<WorkflowInstance> instanceRowsFetchSpec;

    @Mock
    private RowsFetchSpec<InstanceSummary> summaryRowsFetchSpec;

    @Mock
    @SuppressWarnings("rawtypes")
    private FetchSpec fetchSpec;

    @Captor
    private ArgumentCaptor<String> sqlCaptor;

    private R2dbcWorkflowInstanceStore store;

    @BeforeEach
    void setUp() {
        store = new R2dbcWorkflowInstanceStore(databaseClient, new JsonColumnMapper(new ObjectMapper()));
    }

    private WorkflowInstance instance(long version) {
        return WorkflowInstance.builder()
                .id(INSTANCE_ID)
                .definitionId("definition-1")
                .entityId("contract-42")
                .organizationId("org-1")
                .currentState("review")
                .previousState("draft")
                .status(InstanceStatus.ACTIVE)
                .contextData(Map.of("amount", 100))
                .progressPercentage(33)
                .startedAt(NOW)
                .createdAt(NOW)
                .updatedAt(NOW)
                .version(version)
                .build();
    }

    private String capturedSql() {
        verify(databaseClient).sql(sqlCaptor.capture());
        return sqlCaptor.getValue();
    }

    private void setupBinds() {
        when(databaseClient.sql(anyString())).thenReturn(executeSpec);
        lenient().when(executeSpec.bind(anyString(), any())).thenReturn(executeSpec);
        lenient().when(executeSpec.bindNull(anyString(), any())).thenReturn(executeSpec);
    }

    @SuppressWarnings("unchecked")
    private void setupSelectReturning(WorkflowInstance... instances) {
        setupBinds();
        when(executeSpec.map(any(Function.class))).thenReturn(instanceRowsFetchSpec);
        when(instanceRowsFetchSpec.one()).thenReturn(instances.length == 0 ? Mono.empty() : Mono.just(instances[0]));
    }

    @SuppressWarnings("unchecked")
    private void setupUpdateReturning(Mono<Long> rowsUpdated) {
        setupBinds();
        when(executeSpec.fetch()).thenReturn(fetchSpec);
        when(fetchSpec.rowsUpdated()).thenReturn(rowsUpdated);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        @DisplayName("findByIdForUpdate should lock the row within the organization")
        void findByIdForUpdate_shouldLockRow() {
            setupSelectReturning(instance(3));

            StepVerifier.create(store.findByIdForUpdate(INSTANCE_ID, "org-1"))
                    .assertNext(found -> assertThat(found.version()).isEqualTo(3))
                    .verifyComplete();

            String sql = capturedSql();
            assertThat(sql).contains("WHERE id = :id AND organization_id = :organizationId");
            assertThat(sql).endsWith(" FOR UPDATE");
            verify(executeSpec).bind("organizationId", "org-1");
        }

        @Test
        @DisplayName("findById should neither lock nor scope without an organization")
        void findById_shouldSkipScopeWithoutOrganization() {
            setupSelectReturning();

            StepVerifier.create(store.findById(INSTANCE_ID, null))
                    .verifyComplete();

            String sql = capturedSql();
            assertThat(sql).doesNotContain("FOR UPDATE");
            assertThat(sql).doesNotContain("organization_id = :organizationId");
            verify(executeSpec, never()).bind(eq("organizationId"), any());
        }

        @Test
        @DisplayName("findById should translate driver failures")
        @SuppressWarnings("unchecked")
        void findById_shouldTranslateFailures() {
            setupBinds();
            when(executeSpec.map(any(Function.class))).thenReturn(instanceRowsFetchSpec);
            when(instanceRowsFetchSpec.one())
                    .thenReturn(Mono.error(new DataAccessResourceFailureException("connection refused")));

            StepVerifier.create(store.findById(INSTANCE_ID, "org-1"))
                    .expectError(StorageFailureException.class)
                    .verify();
        }

        @Test
        @DisplayName("findByAssignee should page newest first within one organization")
        @SuppressWarnings("unchecked")
        void findByAssignee_shouldPageWithinOrganization() {
            setupBinds();
            when(executeSpec.map(any(Function.class))).thenReturn(summaryRowsFetchSpec);
            when(summaryRowsFetchSpec.all()).thenReturn(Flux.empty());

            StepVerifier.create(store.findByAssignee("user-1", "org-1", InstanceStatus.ACTIVE, 20, 40, NOW))
                    .verifyComplete();

            String sql = capturedSql();
            assertThat(sql).contains("i.organization_id = :organizationId");
            assertThat(sql).contains("i.status = :status");
            assertThat(sql).contains("ORDER BY i.created_at DESC");
            assertThat(sql).contains("LIMIT :limit OFFSET :offset");
            verify(executeSpec).bind("status", "active");
            verify(executeSpec).bind("limit", 20);
            verify(executeSpec).bind("offset", 40);
        }
    }

    // ========================================================================
    // Versioned Updates
    // ========================================================================

    @Nested
    @DisplayName("Versioned updates")
    class UpdateTests {

        @Test
        @DisplayName("update should increment the version when the row matches")
        void update_shouldIncrementVersion() {
            setupUpdateReturning(Mono.just(1L));

            StepVerifier.create(store.update(instance(4)))
                    .assertNext(updated -> {
                        assertThat(updated.version()).isEqualTo(5);
                        assertThat(updated.currentState()).isEqualTo("review");
                    })
                    .verifyComplete();

            assertThat(capturedSql())
                    .contains("row_version = row_version + 1")
                    .contains("WHERE id = :id AND row_version = :expectedVersion");
            verify(executeSpec).bind("expectedVersion", 4L);
            verify(executeSpec).bind("contextData", "{\"amount\":100}");
        }

        @Test
        @DisplayName("update should report a version conflict when no row matches")
        void update_shouldFailOnVersionConflict() {
            setupUpdateReturning(Mono.just(0L));

            StepVerifier.create(store.update(instance(4)))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ConcurrentInstanceModificationException.class);
                        assertThat(((ConcurrentInstanceModificationException) error).getInstanceId())
                                .isEqualTo(INSTANCE_ID);
                        assertThat(((ConcurrentInstanceModificationException) error).isRetryable()).isTrue();
                    })
                    .verify();
        }

        @Test
        @DisplayName("update should map lock failures to a concurrent modification")
        void update_shouldMapLockFailures() {
            setupUpdateReturning(Mono.error(new PessimisticLockingFailureException("lock timeout")));

            StepVerifier.create(store.update(instance(4)))
                    .expectError(ConcurrentInstanceModificationException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("isHealthy should report false when the query fails")
    @SuppressWarnings("unchecked")
    void isHealthy_shouldReportFailure() {
        RowsFetchSpec<Boolean> booleanRowsFetchSpec = mock(RowsFetchSpec.class);
        when(databaseClient.sql(anyString())).thenReturn(executeSpec);
        when(executeSpec.map(any(Function.class))).thenReturn(booleanRowsFetchSpec);
        when(booleanRowsFetchSpec.one()).thenReturn(Mono.error(new DataAccessResourceFailureException("down")));

        StepVerifier.create(store.isHealthy())
                .expectNext(false)
                .verifyComplete();
    }
}
