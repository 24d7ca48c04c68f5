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


package org.flowledger.workflow.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.flowledger.workflow.condition.ConditionParser;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the workflow engine.
 */
@ConfigurationProperties(prefix = "flowledger.workflow")
@Validated
@Data
public class WorkflowProperties {

    /**
     * Whether the workflow engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to enable health checks.
     */
    private boolean healthEnabled = true;

    /**
     * Audit trail configuration.
     */
    @Valid
    @NotNull
    private HistoryConfig history = new HistoryConfig();

    /**
     * Listing configuration.
     */
    @Valid
    @NotNull
    private QueryConfig query = new QueryConfig();

    /**
     * Definition cache configuration.
     */
    @Valid
    @NotNull
    private DefinitionCacheConfig definitionCache = new DefinitionCacheConfig();

    /**
     * Parsed transition condition cache configuration.
     */
    @Valid
    @NotNull
    private ConditionCacheConfig conditionCache = new ConditionCacheConfig();

    /**
     * Schema initialization configuration.
     */
    @Valid
    @NotNull
    private SchemaConfig schema = new SchemaConfig();

    /**
     * Audit trail configuration.
     */
    @Data
    public static class HistoryConfig {

        /**
         * Number of history entries returned with an instance status.
         */
        @Min(1)
        @Max(1000)
        private int recentLimit = 10;

        /**
         * Whether rejected transition attempts are written to the audit trail as
         * unsuccessful entries.
         */
        private boolean recordRejectedAttempts = false;
    }

    /**
     * Listing configuration.
     */
    @Data
    public static class QueryConfig {

        /**
         * Page size used when the caller does not give one.
         */
        @Min(1)
        private int defaultLimit = 50;

        /**
         * Largest page size a caller may request.
         */
        @Min(1)
        private int maxLimit = 200;
    }

    /**
     * Definition cache configuration.
     */
    @Data
    public static class DefinitionCacheConfig {

        /**
         * Whether definitions are cached by ID.
         */
        private boolean enabled = true;

        /**
         * Time after which a cached definition is reloaded.
         */
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);

        /**
         * Maximum number of cached definitions.
         */
        @Min(1)
        private long maxSize = 1000;
    }

    /**
     * Parsed transition condition cache configuration.
     */
    @Data
    public static class ConditionCacheConfig {

        /**
         * Maximum number of parsed conditions kept, keyed by their text.
         */
        @Min(1)
        private long maxSize = ConditionParser.DEFAULT_CACHE_SIZE;
    }

    /**
     * Schema initialization configuration.
     */
    @Data
    public static class SchemaConfig {

        /**
         * Whether to run the bundled schema script against the connection factory on startup.
         */
        private boolean initialize = false;

        /**
         * Location of the schema script.
         */
        @NotNull
        private String location = "classpath:org/flowledger/workflow/schema.sql";
    }
}
