package com.critter.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.StompWebSocketEndpointRegistration;

import static org.mockito.Mockito.*;

/**
 * Unit tests for the STOMP endpoint setup.
 */
class WebSocketConfigTest {

    @Test
    @DisplayName("should register /ws with every configured origin pattern")
    void shouldSplitAllowedOrigins() {
        WebSocketConfig config = new WebSocketConfig();
        ReflectionTestUtils.setField(config, "allowedOrigins", "https://chat.example.org,http://localhost:*");
        StompEndpointRegistry registry = mock(StompEndpointRegistry.class);
        StompWebSocketEndpointRegistration registration = mock(StompWebSocketEndpointRegistration.class);
        when(registry.addEndpoint("/ws")).thenReturn(registration);

        config.registerStompEndpoints(registry);

        verify(registration).setAllowedOriginPatterns("https://chat.example.org", "http://localhost:*");
    }

    @Test
    @DisplayName("should broker /topic destinations")
    void shouldEnableTopicBroker() {
        MessageBrokerRegistry registry = mock(MessageBrokerRegistry.class);

        new WebSocketConfig().configureMessageBroker(registry);

        verify(registry).enableSimpleBroker("/topic");
        verify(registry).setApplicationDestinationPrefixes("/app");
    }
}
