package com.relaychat.config;

import com.relaychat.ingest.MessageIngest;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final MessageIngest messageIngest;
    private final String endpoint;
    private final int maxTextMessageSize;

    public WebSocketConfig(MessageIngest messageIngest,
                           @Value("${relay.websocket.path:/ws}") String endpoint,
                           @Value("${relay.websocket.max-text-message-size:1048576}") int maxTextMessageSize) {
        this.messageIngest = messageIngest;
        this.endpoint = endpoint;
        this.maxTextMessageSize = maxTextMessageSize;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // raw frames, no STOMP: the relay tracks every connection itself
        registry.addHandler(messageIngest, endpoint)
                .setAllowedOriginPatterns("*");
    }

    // Tomcat's default is 8 KiB; a larger frame would close the connection with 1009
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageSize);
        return container;
    }

    // used by the submission gateway to act as a one-shot client
    @Bean
    public WebSocketClient webSocketClient() {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(maxTextMessageSize);
        return new StandardWebSocketClient(container);
    }
}
