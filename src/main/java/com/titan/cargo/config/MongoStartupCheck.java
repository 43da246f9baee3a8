package com.titan.cargo.config;

import com.mongodb.MongoException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * Fails the startup when MongoDB cannot be reached, instead of serving without a store.
 */
@Component
@Order(0)
public class MongoStartupCheck implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(MongoStartupCheck.class);

    private final MongoTemplate mongoTemplate;

    public MongoStartupCheck(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            logger.info("Connecté à MongoDB, base: {}", mongoTemplate.getDb().getName());
        } catch (MongoException | DataAccessException e) {
            logger.error("Erreur de connexion MongoDB: {}", e.getMessage());
            throw new IllegalStateException("MongoDB connection failed", e);
        }
    }
}
