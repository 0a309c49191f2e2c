package com.example.clipflow.config;

import com.example.clipflow.gateway.GatewayHandshakeInterceptor;
import com.example.clipflow.gateway.RealtimeGatewayHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String PROGRESS_ENDPOINT = "/ws/progress";

    private final RealtimeGatewayHandler gatewayHandler;
    private final GatewayHandshakeInterceptor handshakeInterceptor;

    @Value("${cors.allowed.origins}")
    private String[] allowedOrigins;

    public WebSocketConfig(RealtimeGatewayHandler gatewayHandler, GatewayHandshakeInterceptor handshakeInterceptor) {
        this.gatewayHandler = gatewayHandler;
        this.handshakeInterceptor = handshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(gatewayHandler, PROGRESS_ENDPOINT)
                .addInterceptors(handshakeInterceptor)
                .setAllowedOrigins(allowedOrigins);
    }
}
