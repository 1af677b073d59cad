package com.eainde.atlas.config;

import com.eainde.atlas.execution.InMemoryRunRecordStore;
import com.eainde.atlas.execution.JdbcRunRecordStore;
import com.eainde.atlas.execution.RunRecordStore;
import com.eainde.atlas.reasoning.ChatModelLoggingListener;
import com.eainde.atlas.reasoning.ChatModelReasoning;
import com.eainde.atlas.reasoning.ReasoningModel;
import com.eainde.atlas.reasoning.UnavailableReasoningModel;
import com.eainde.atlas.run.RunContextRegistry;
import com.eainde.atlas.thread.MdcAwareExecutor;
import com.eainde.atlas.tools.ToolCapability;
import com.eainde.atlas.tools.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties({AgentProperties.class, LlmProperties.class})
public class AgentConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Every {@link ToolCapability} bean, in bean order. Frozen before any run can start.
     */
    @Bean
    public ToolRegistry toolRegistry(List<ToolCapability> capabilities) {
        ToolRegistry registry = new ToolRegistry(capabilities);
        registry.freeze();
        return registry;
    }

    @Bean
    public RunContextRegistry runContextRegistry() {
        return new RunContextRegistry();
    }

    @Bean
    public MdcAwareExecutor runExecutor(AgentProperties properties) {
        return new MdcAwareExecutor("atlas-run", properties.getRunPoolSize());
    }

    @Bean
    public MdcAwareExecutor reasoningExecutor(AgentProperties properties) {
        return new MdcAwareExecutor("atlas-reasoning", properties.getRunPoolSize());
    }

    @Bean
    public MdcAwareExecutor toolExecutor(AgentProperties properties) {
        return new MdcAwareExecutor("atlas-tool", properties.getToolPoolSize());
    }

    @Bean
    public MdcAwareExecutor transportExecutor(AgentProperties properties) {
        return new MdcAwareExecutor("atlas-sse", properties.getRunPoolSize());
    }

    @Bean
    @ConditionalOnProperty(prefix = "atlas.llm", name = "api-key")
    public ChatModel chatModel(LlmProperties llm) {
        return OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .baseUrl(llm.getBaseUrl())
                .modelName(llm.getModelName())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout())
                .logRequests(llm.isLogRequests())
                .logResponses(llm.isLogRequests())
                .listeners(List.of(new ChatModelLoggingListener()))
                .build();
    }

    @Bean
    public ReasoningModel reasoningModel(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper,
                                         AgentProperties properties) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.warn("No chat model configured (atlas.llm.api-key is unset); runs will fail as reasoning-unavailable");
            return new UnavailableReasoningModel("No chat model configured");
        }
        return new ChatModelReasoning(model, objectMapper, properties.getSystemPrompt());
    }

    @Bean
    @ConditionalOnProperty(prefix = "atlas.persistence", name = "store", havingValue = "jdbc")
    public RunRecordStore jdbcRunRecordStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        log.info("Persisting run records to the agent_runs table");
        return new JdbcRunRecordStore(jdbcTemplate, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean(RunRecordStore.class)
    public RunRecordStore inMemoryRunRecordStore(Clock clock) {
        return new InMemoryRunRecordStore(clock);
    }
}
