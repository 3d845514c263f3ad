package com.example.sessionservice.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final SessionTools sessionTools;

    public ToolRegistrationConfig(SessionTools sessionTools) {
        this.sessionTools = sessionTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(sessionTools)
                .build();
    }
}
