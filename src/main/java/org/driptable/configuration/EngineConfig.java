package org.driptable.configuration;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.driptable.service.validation.CapabilitySchemaChecker;
import org.driptable.service.validation.ValidationError;
import org.driptable.service.validation.ValidationKey;
import org.driptable.service.validation.ValidationOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class EngineConfig {

    @Bean
    public Cache<ValidationKey, List<ValidationError>> validationCache(DripTableProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.validation().cacheSize())
                .build();
    }

    @Bean
    public CapabilitySchemaChecker capabilitySchemaChecker() {
        return new CapabilitySchemaChecker();
    }

    @Bean
    public ValidationOptions defaultValidationOptions(DripTableProperties properties) {
        DripTableProperties.Validation validation = properties.validation();
        return validation.enabled()
                ? new ValidationOptions(true, validation.additionalProperties())
                : ValidationOptions.disabled();
    }
}
