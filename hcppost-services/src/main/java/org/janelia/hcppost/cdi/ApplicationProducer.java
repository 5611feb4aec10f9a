package org.janelia.hcppost.cdi;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.janelia.hcppost.cdi.qualifier.ApplicationProperties;
import org.janelia.hcppost.cdi.qualifier.IntPropertyValue;
import org.janelia.hcppost.cdi.qualifier.StrPropertyValue;
import org.janelia.hcppost.config.ApplicationConfig;

@ApplicationScoped
public class ApplicationProducer {

    @Produces
    public ObjectMapper objectMapper(ObjectMapperFactory objectMapperFactory) {
        return objectMapperFactory.getDefaultObjectMapper();
    }

    @IntPropertyValue(name = "")
    @Produces
    public int intPropertyValueWithDefault(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final IntPropertyValue property = injectionPoint.getAnnotated().getAnnotation(IntPropertyValue.class);
        return applicationConfig.getIntegerPropertyValue(property.name(), property.defaultValue());
    }

    @StrPropertyValue(name = "")
    @Produces
    public String stringPropertyValueWithDefault(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final StrPropertyValue property = injectionPoint.getAnnotated().getAnnotation(StrPropertyValue.class);
        return applicationConfig.getStringPropertyValue(property.name(), property.defaultValue());
    }

    @ApplicationProperties
    @ApplicationScoped
    @Produces
    public ApplicationConfig applicationConfig() {
        return new ApplicationConfigProvider()
                .fromDefaultResources()
                .fromEnvVar("HCPPOST_CONFIG")
                .fromMap(ApplicationConfigProvider.applicationArgs())
                .build();
    }
}
