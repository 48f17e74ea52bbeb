package com.example.brd.config;

import com.example.brd.model.Taxonomy;
import com.example.brd.service.TaxonomyLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Shared beans of the classifier.
 * <p>
 * - objectMapper: JSON for requirement documents, the sections file and API responses
 * - taxonomy: the BRD outline, loaded once at startup and shared read-only
 */
@Configuration
public class ClassifierConfig {

    /**
     * ObjectMapper with ISO-8601 dates, also used by Spring MVC.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Taxonomy from {@code brd.taxonomy.location}. A missing or unusable file fails startup.
     */
    @Bean
    public Taxonomy taxonomy(TaxonomyLoader loader, BrdProperties properties, ResourceLoader resourceLoader) {
        return loader.load(resourceLoader.getResource(properties.taxonomy().location()));
    }
}
