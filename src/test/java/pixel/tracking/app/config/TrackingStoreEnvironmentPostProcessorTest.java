package pixel.tracking.app.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.SpringApplication;
import org.springframework.mock.env.MockEnvironment;

import static org.junit.jupiter.api.Assertions.*;

class TrackingStoreEnvironmentPostProcessorTest {
    private final TrackingStoreEnvironmentPostProcessor postProcessor = new TrackingStoreEnvironmentPostProcessor();

    @Test
    void postProcessEnvironment_InMemoryMode_ShouldExcludeJpaAutoConfiguration() {
        // Given
        MockEnvironment environment = new MockEnvironment().withProperty("tracking.store", "memory");

        // When
        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        // Then
        String excludes = environment.getProperty("spring.autoconfigure.exclude");
        assertNotNull(excludes);
        TrackingStoreEnvironmentPostProcessor.JPA_AUTO_CONFIGURATIONS
            .forEach(name -> assertTrue(excludes.contains(name), name));
    }

    @Test
    void postProcessEnvironment_WithoutStoreProperty_ShouldDefaultToMemory() {
        // Given
        MockEnvironment environment = new MockEnvironment();

        // When
        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        // Then
        assertTrue(environment.getProperty("spring.autoconfigure.exclude", "").contains("HibernateJpaAutoConfiguration"));
    }

    @Test
    void postProcessEnvironment_JpaMode_ShouldLeaveAutoConfigurationAlone() {
        // Given
        MockEnvironment environment = new MockEnvironment().withProperty("tracking.store", "jpa");

        // When
        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        // Then
        assertNull(environment.getProperty("spring.autoconfigure.exclude"));
        assertFalse(environment.getPropertySources().contains(TrackingStoreEnvironmentPostProcessor.PROPERTY_SOURCE_NAME));
    }

    @Test
    void postProcessEnvironment_ShouldKeepExistingExclusions() {
        // Given
        MockEnvironment environment = new MockEnvironment()
            .withProperty("spring.autoconfigure.exclude", "com.example.FooAutoConfiguration");

        // When
        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        // Then
        String excludes = environment.getProperty("spring.autoconfigure.exclude");
        assertTrue(excludes.startsWith("com.example.FooAutoConfiguration,"));
        assertTrue(excludes.contains("DataSourceAutoConfiguration"));
    }
}
