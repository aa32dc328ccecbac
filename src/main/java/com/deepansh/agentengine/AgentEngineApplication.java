package com.deepansh.agentengine;

import com.deepansh.agentengine.config.AgentProperties;
import com.deepansh.agentengine.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AgentProperties.class, LlmProperties.class})
public class AgentEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(AgentEngineApplication.class, args);
    }
}
