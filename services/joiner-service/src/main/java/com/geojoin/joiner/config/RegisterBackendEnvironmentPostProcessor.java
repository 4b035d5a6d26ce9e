package com.geojoin.joiner.config;

import com.geojoin.joiner.domain.IndexBackend;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Switches the database stack off when {@code joiner.index-backend} selects the Linked Data API
 * register, so that backend starts without a reachable database.
 * <p>
 * Runs after the config data files are loaded, so a profile can set the selector too.
 */
public class RegisterBackendEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "joinerRegisterBackend";
    static final String EXCLUDE_PROPERTY = "spring.autoconfigure.exclude";
    static final List<String> DATABASE_AUTO_CONFIGURATIONS = List.of(
        DataSourceAutoConfiguration.class.getName(),
        HibernateJpaAutoConfiguration.class.getName(),
        JpaRepositoriesAutoConfiguration.class.getName()
    );

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Binder binder = Binder.get(environment);
        IndexBackend backend = binder.bind("joiner.index-backend", IndexBackend.class).orElse(IndexBackend.DATABASE);
        if (backend != IndexBackend.LDAPI) {
            return;
        }
        Set<String> exclusions = new LinkedHashSet<>(
            Arrays.asList(binder.bind(EXCLUDE_PROPERTY, String[].class).orElse(new String[0]))
        );
        exclusions.addAll(DATABASE_AUTO_CONFIGURATIONS);
        environment.getPropertySources().addFirst(
            new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(EXCLUDE_PROPERTY, String.join(",", exclusions)))
        );
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
