/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
package dev.mars.jobrelay.rest;

import dev.mars.jobrelay.rest.config.RelayServerConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Starts the job relay server using ConfigRetriever.
 *
 * Configuration precedence (highest to lowest):
 * 1. System properties (-Dport=9090)
 * 2. Environment variables (export port=9090)
 * 3. Config file (conf/jobrelay.json)
 * 4. Defaults (in RelayServerConfig and ListenerConfig)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @see JobRelayServer
 * @see RelayServerConfig
 */
public final class StartJobRelayServer {

    private static final Logger logger = LoggerFactory.getLogger(StartJobRelayServer.class);

    private StartJobRelayServer() {
        // Utility class - not instantiable
    }

    public static void main(String[] args) {
        logger.info("Starting job relay server...");

        Vertx vertx = Vertx.vertx();

        ConfigStoreOptions fileStore = new ConfigStoreOptions()
            .setType("file")
            .setOptional(true)
            .setConfig(new JsonObject()
                .put("path", "conf/jobrelay.json"));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
            .setType("env")
            .setConfig(new JsonObject().put("raw-data", true));

        ConfigStoreOptions sysPropsStore = new ConfigStoreOptions()
            .setType("sys")
            .setConfig(new JsonObject().put("cache", false));

        ConfigRetrieverOptions retrieverOptions = new ConfigRetrieverOptions()
            .addStore(fileStore)       // Lowest priority
            .addStore(envStore)        // Middle priority
            .addStore(sysPropsStore);  // Highest priority

        ConfigRetriever retriever = ConfigRetriever.create(vertx, retrieverOptions);

        retriever.getConfig()
            .compose(jsonConfig -> {
                // Parse and validate configuration once
                RelayServerConfig config = RelayServerConfig.from(jsonConfig);
                logger.info("Configuration loaded: port={}, servers={}, listener={}",
                    config.port(), config.servers().servers().size(), config.listener());
                return vertx.deployVerticle(new JobRelayServer(config, new SimpleMeterRegistry()));
            })
            .onSuccess(id -> {
                logger.info("Job relay server started successfully");
                logger.info("WebSocket endpoint: ws://localhost:<port>/ws/job-status");
                logger.info("Health check: http://localhost:<port>/health");
            })
            .onFailure(cause -> {
                logger.error("Failed to start: {}", cause.getMessage(), cause);
                System.exit(1);
            });

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down job relay server...");
            try {
                vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
            } catch (Exception e) {
                logger.warn("Job relay server did not shut down cleanly: {}", e.getMessage());
            }
        }));
    }
}
