package me.golemcore.context.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.context.domain.component.SimilarityComponent;
import me.golemcore.context.domain.component.TopicComponent;
import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.service.ContextBudgetConfigService;
import me.golemcore.context.domain.service.ContextWindowLogBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

class ContextWindowConfigurationTest {

    @Mock
    private ContextBudgetConfigService configService;
    @Mock
    private SimilarityComponent similarityComponent;
    @Mock
    private TopicComponent topicComponent;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(configService.getConfig()).thenReturn(ContextBudgetConfig.defaults());
    }

    @Test
    void shouldLogStartupSummary() {
        ContextWindowProperties properties = new ContextWindowProperties();
        properties.getDebugLog().setEnabled(false);
        ContextWindowConfiguration configuration = new ContextWindowConfiguration(properties, configService,
                similarityComponent, topicComponent);

        assertDoesNotThrow(configuration::init);
    }

    @Test
    void shouldSizeLogBufferFromProperties() {
        ContextWindowProperties properties = new ContextWindowProperties();
        properties.getDebugLog().setCapacity(7);
        ContextWindowConfiguration configuration = new ContextWindowConfiguration(properties, configService,
                similarityComponent, topicComponent);

        ContextWindowLogBuffer buffer = configuration.contextWindowLogBuffer(properties);

        assertEquals(7, buffer.getCapacity());
    }

    @Test
    void shouldWriteIsoTimestamps() throws Exception {
        ObjectMapper mapper = ContextWindowConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Instant.parse("2026-03-01T12:00:00Z"));

        assertEquals("\"2026-03-01T12:00:00Z\"", json);
        assertTrue(ContextWindowConfiguration.clock() != null);
    }
}
