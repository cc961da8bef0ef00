package com.trackly.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trackly.backend.model.TerminalCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the terminal catalog (route table, seed tracks, platform range) once
 * at startup.
 */
@Configuration
@Slf4j
public class CatalogConfig {

    @Value("${catalog.location:classpath:terminal-catalog.json}")
    private Resource catalogResource;

    @Bean
    public TerminalCatalog terminalCatalog(ObjectMapper objectMapper) {
        if (!catalogResource.exists()) {
            throw new IllegalStateException("Terminal catalog not found: " + catalogResource.getDescription());
        }
        try (InputStream in = catalogResource.getInputStream()) {
            TerminalCatalog catalog = objectMapper.readValue(in, TerminalCatalog.class);
            log.info("✅ Terminal catalog loaded: {} | {} routes | {} seed patterns | tracks {}-{}",
                    catalog.getTerminal(), catalog.getRoutes().size(), catalog.getSeedPatterns().size(),
                    catalog.getPlatformRange().getMin(), catalog.getPlatformRange().getMax());
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load terminal catalog from "
                    + catalogResource.getDescription(), e);
        }
    }
}
