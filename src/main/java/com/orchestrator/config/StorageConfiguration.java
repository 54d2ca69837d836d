package com.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orchestrator.service.api.SessionStorage;
import com.orchestrator.service.impl.FileSessionStorage;
import com.orchestrator.service.impl.InMemorySessionStorage;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the session storage with {@code orchestrator.storage.type}: {@code file} (the default)
 * keeps sessions under {@code orchestrator.storage.data-dir}, {@code memory} keeps them for the
 * lifetime of the process only.
 */
@Configuration
public class StorageConfiguration {

    @Bean
    @ConditionalOnProperty(name = "orchestrator.storage.type", havingValue = "file", matchIfMissing = true)
    public SessionStorage fileSessionStorage(ObjectMapper objectMapper,
                                             @Value("${orchestrator.storage.data-dir}") String dataDirectory) {
        return new FileSessionStorage(objectMapper, Path.of(dataDirectory));
    }

    @Bean
    @ConditionalOnProperty(name = "orchestrator.storage.type", havingValue = "memory")
    public SessionStorage inMemorySessionStorage(ObjectMapper objectMapper) {
        return new InMemorySessionStorage(objectMapper);
    }
}
