package com.ordinalcomparator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.ordinalcomparator.reconcile.checkpoint.CheckpointStore;
import com.ordinalcomparator.reconcile.checkpoint.FileCheckpointStore;
import com.ordinalcomparator.reconcile.checkpoint.MongoCheckpointStore;
import com.ordinalcomparator.reconcile.config.CheckpointProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;

/**
 * Selects the checkpoint store from comparator.checkpoint.type (FILE by default).
 * Mongo auto-configuration is excluded in application.yml so a FILE run never connects to MongoDB.
 */
@Configuration
@Slf4j
public class CheckpointStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "comparator.checkpoint", name = "type", havingValue = "FILE", matchIfMissing = true)
    public CheckpointStore fileCheckpointStore(CheckpointProperties properties, ObjectMapper objectMapper) {
        Path directory = Path.of(properties.getDirectory());
        log.info("Checkpoints stored in {}", directory.toAbsolutePath());
        return new FileCheckpointStore(directory, objectMapper);
    }

    @Configuration
    @ConditionalOnProperty(prefix = "comparator.checkpoint", name = "type", havingValue = "MONGO")
    static class MongoStoreConfig {

        @Bean(destroyMethod = "close")
        public MongoClient checkpointMongoClient(CheckpointProperties properties) {
            return MongoClients.create(properties.getMongoUri());
        }

        @Bean
        public MongoTemplate checkpointMongoTemplate(MongoClient checkpointMongoClient, CheckpointProperties properties) {
            return new MongoTemplate(checkpointMongoClient, properties.getMongoDatabase());
        }

        @Bean
        public CheckpointStore mongoCheckpointStore(MongoTemplate checkpointMongoTemplate, CheckpointProperties properties) {
            log.info("Checkpoints stored in MongoDB database {}", properties.getMongoDatabase());
            return new MongoCheckpointStore(checkpointMongoTemplate);
        }
    }
}
