package com.hookmetrics.consumer.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;
import org.springframework.data.mongodb.core.convert.DbRefResolver;
import org.springframework.data.mongodb.core.convert.DefaultDbRefResolver;
import org.springframework.data.mongodb.core.convert.DefaultMongoTypeMapper;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import java.util.concurrent.TimeUnit;

@Configuration
public class MongoConfig {

    // FULLWIDTH FULL STOP, also used by the analytics reader
    static final String MAP_KEY_DOT_REPLACEMENT = "\uFF0E";

    private final String mongoUri;
    private final String databaseName;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public MongoConfig(
        @Value("${spring.data.mongodb.uri:mongodb://localhost:27017/hook_metrics}") String mongoUri,
        @Value("${spring.data.mongodb.database:hook_metrics}") String databaseName,
        @Value("${mongodb.connect-timeout-ms:5000}") int connectTimeoutMs,
        @Value("${mongodb.read-timeout-ms:10000}") int readTimeoutMs) {
            this.mongoUri = mongoUri;
            this.databaseName = databaseName;
            this.connectTimeoutMs = connectTimeoutMs;
            this.readTimeoutMs = readTimeoutMs;
    }

    @Bean
    public MongoClient mongoClient() {
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(mongoUri))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
                        .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS))
                .build();
        return MongoClients.create(settings);
    }

    @Bean
    public MongoDatabaseFactory mongoDatabaseFactory(MongoClient mongoClient) {
        return new SimpleMongoClientDatabaseFactory(mongoClient, databaseName);
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoDatabaseFactory mongoDatabaseFactory,
                                       MongoMappingContext mongoMappingContext) {
        return new MongoTemplate(mongoDatabaseFactory,
                webhookConverter(new DefaultDbRefResolver(mongoDatabaseFactory), mongoMappingContext));
    }

    static MappingMongoConverter webhookConverter(DbRefResolver dbRefResolver, MongoMappingContext mappingContext) {
        MappingMongoConverter converter = new MappingMongoConverter(dbRefResolver, mappingContext);

        // MongoDB rejects dots in map keys. GitHub payload keys are snake_case, so "_" cannot stand in for them
        converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
        converter.setTypeMapper(new DefaultMongoTypeMapper(null));
        converter.afterPropertiesSet();

        return converter;
    }
}
