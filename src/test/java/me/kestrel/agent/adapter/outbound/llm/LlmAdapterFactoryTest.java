package me.kestrel.agent.adapter.outbound.llm;

import me.kestrel.agent.domain.model.LlmRequest;
import me.kestrel.agent.domain.model.LlmResponse;
import me.kestrel.agent.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmAdapterFactoryTest {

    private BotProperties properties;
    private LlmProviderAdapter langchain;
    private LlmProviderAdapter none;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        langchain = mock(LlmProviderAdapter.class);
        when(langchain.getProviderId()).thenReturn("langchain4j");
        when(langchain.getCurrentModel()).thenReturn("openai/gpt-4o-mini");
        when(langchain.isAvailable()).thenReturn(true);
        none = mock(LlmProviderAdapter.class);
        when(none.getProviderId()).thenReturn("none");
    }

    @Test
    void selectsConfiguredProvider() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(none, langchain));
        factory.init();

        assertSame(langchain, factory.getActiveAdapter());
        assertEquals("langchain4j", factory.getProviderId());
        assertEquals("openai/gpt-4o-mini", factory.getCurrentModel());
        assertTrue(factory.isAvailable());
        verify(langchain).initialize();
        verify(none, never()).initialize();
    }

    @Test
    void fallsBackToNoneAdapter() {
        properties.getLlm().setProvider("missing");
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain, none));
        factory.init();

        assertSame(none, factory.getActiveAdapter());
        assertFalse(factory.isAvailable());
    }

    @Test
    void fallsBackToFirstAdapterWithoutNone() {
        properties.getLlm().setProvider("missing");
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain));
        factory.init();

        assertSame(langchain, factory.getActiveAdapter());
    }

    @Test
    void delegatesChatToActiveAdapter() throws Exception {
        LlmResponse response = LlmResponse.builder().content("hi").build();
        LlmRequest request = LlmRequest.builder().model("openai/gpt-4o-mini").build();
        when(langchain.chat(request)).thenReturn(CompletableFuture.completedFuture(response));
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain));
        factory.init();

        assertSame(response, factory.chat(request).get());
    }

    @Test
    void chatFailsWithoutAnyAdapter() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> factory.chat(LlmRequest.builder().build()).get());
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }
}
