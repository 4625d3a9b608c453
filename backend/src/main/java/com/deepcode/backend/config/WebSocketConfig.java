package com.deepcode.backend.config;

import com.deepcode.backend.api.ws.ProgressWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ProgressWebSocketHandler progressHandler;
    private final DeepCodeProperties props;

    public WebSocketConfig(ProgressWebSocketHandler progressHandler, DeepCodeProperties props) {
        this.progressHandler = progressHandler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        DeepCodeProperties.Progress p = props.progress();
        registry.addHandler(progressHandler, p.path())
                .setAllowedOriginPatterns(p.allowedOrigins().toArray(String[]::new));
    }
}
