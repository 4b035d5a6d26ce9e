package com.geojoin.joiner.config;

import com.geojoin.joiner.client.DatabaseRegisterClient;
import com.geojoin.joiner.client.LdApiRegisterClient;
import com.geojoin.joiner.repository.AddressDefaultGeocodeRepository;
import com.geojoin.joiner.repository.AddressDetailRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Exactly one register is created, chosen by {@code joiner.index-backend}. It serves both as the
 * identifier pager and as the point provider.
 */
@Configuration
public class RegisterConfig {

    @Bean
    @ConditionalOnProperty(prefix = "joiner", name = "index-backend", havingValue = "database", matchIfMissing = true)
    DatabaseRegisterClient databaseRegisterClient(
        AddressDetailRepository addressDetailRepository,
        AddressDefaultGeocodeRepository geocodeRepository
    ) {
        return new DatabaseRegisterClient(addressDetailRepository, geocodeRepository);
    }

    @Bean
    @ConditionalOnProperty(prefix = "joiner", name = "index-backend", havingValue = "ldapi")
    LdApiRegisterClient ldApiRegisterClient(
        @Qualifier("registerWebClient") WebClient registerWebClient,
        JoinerProperties properties
    ) {
        return new LdApiRegisterClient(registerWebClient, properties.getIndexEndpoint(), properties.getRequestTimeout());
    }
}
