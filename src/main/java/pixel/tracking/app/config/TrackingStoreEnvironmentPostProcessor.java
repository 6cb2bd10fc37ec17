package pixel.tracking.app.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.config.ConfigDataEnvironmentPostProcessor;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the database out of the context unless tracking.store=jpa.
 * The in-memory store must start without any reachable datasource.
 */
public class TrackingStoreEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {
    static final String EXCLUDE_PROPERTY = "spring.autoconfigure.exclude";
    static final String PROPERTY_SOURCE_NAME = "trackingStoreExclusions";
    static final List<String> JPA_AUTO_CONFIGURATIONS = List.of(
        DataSourceAutoConfiguration.class.getName(),
        HibernateJpaAutoConfiguration.class.getName(),
        JpaRepositoriesAutoConfiguration.class.getName());

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String store = environment.getProperty("tracking.store", "memory").trim();
        if ("jpa".equalsIgnoreCase(store)) {
            return;
        }

        Set<String> excludes = new LinkedHashSet<>();
        Binder.get(environment).bind(EXCLUDE_PROPERTY, String[].class)
            .ifBound(existing -> Arrays.stream(existing).map(String::trim).forEach(excludes::add));
        excludes.addAll(JPA_AUTO_CONFIGURATIONS);

        environment.getPropertySources().addFirst(
            new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(EXCLUDE_PROPERTY, String.join(",", excludes))));
    }

    @Override
    public int getOrder() {
        // application.properties must already be loaded
        return ConfigDataEnvironmentPostProcessor.ORDER + 1;
    }
}
