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

import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import org.flowledger.workflow.model.AIInsight;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static org.flowledger.workflow.store.SqlSupport.bindNullable;
import static org.flowledger.workflow.store.SqlSupport.bindTimestamp;
import static org.flowledger.workflow.store.SqlSupport.timestamp;

/**
 * {@link InsightStore} backed by the {@code workflow_insights} table.
 */
@RequiredArgsConstructor
public class R2dbcInsightStore implements InsightStore {

    private final DatabaseClient databaseClient;
    private final JsonColumnMapper jsonMapper;

    @Override
    public Mono<AIInsight> insert(AIInsight insight) {
        GenericExecuteSpec spec = databaseClient.sql("""
                    INSERT INTO workflow_insights (
                        id, instance_id, insight_type, content, confidence_score,
                        generated_by, organization_id, created_at)
                    VALUES (
                        :id, :instanceId, :insightType, :content, :confidence,
                        :generatedBy, :organizationId, :createdAt)
                    """)
                .bind("id", insight.id())
                .bind("instanceId", insight.instanceId())
                .bind("insightType", insight.insightType())
                .bind("content", jsonMapper.write(insight.content()))
                .bind("organizationId", insight.organizationId());
        spec = bindNullable(spec, "confidence", insight.confidenceScore(), Double.class);
        spec = bindNullable(spec, "generatedBy", insight.generatedBy(), String.class);
        spec = bindTimestamp(spec, "createdAt", insight.createdAt());
        return spec.fetch()
                .rowsUpdated()
                .thenReturn(insight)
                .onErrorMap(StorageErrors.translate("insight-insert"));
    }

    @Override
    public Flux<AIInsight> findByInstanceId(String instanceId, String organizationId, String insightType) {
        String sql = """
                SELECT id, instance_id, insight_type, content, confidence_score,
                       generated_by, organization_id, created_at
                FROM workflow_insights
                WHERE instance_id = :instanceId AND organization_id = :organizationId
                """
                + (insightType != null ? "  AND insight_type = :insightType\n" : "")
                + "ORDER BY created_at ASC, id";
        GenericExecuteSpec spec = databaseClient.sql(sql)
                .bind("instanceId", instanceId)
                .bind("organizationId", organizationId);
        if (insightType != null) {
            spec = spec.bind("insightType", insightType);
        }
        return spec.map(this::mapRow)
                .all()
                .onErrorMap(StorageErrors.translate("insight-find"));
    }

    @Override
    public Mono<Long> deleteByInstanceId(String instanceId) {
        return databaseClient.sql("DELETE FROM workflow_insights WHERE instance_id = :instanceId")
                .bind("instanceId", instanceId)
                .fetch()
                .rowsUpdated()
                .onErrorMap(StorageErrors.translate("insight-delete"));
    }

    private AIInsight mapRow(Readable row) {
        Number confidence = (Number) row.get("confidence_score");
        return new AIInsight(
                row.get("id", String.class),
                row.get("instance_id", String.class),
                row.get("insight_type", String.class),
                jsonMapper.readMap(row.get("content", String.class)),
                confidence != null ? confidence.doubleValue() : null,
                row.get("generated_by", String.class),
                row.get("organization_id", String.class),
                timestamp(row, "created_at"));
    }
}
