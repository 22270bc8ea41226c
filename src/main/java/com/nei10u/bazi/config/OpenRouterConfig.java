package com.nei10u.bazi.config;

import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * 报告生成走 OpenAI 兼容接口，默认指向 OpenRouter。
 */
@Configuration
public class OpenRouterConfig {

    @Value("${spring.ai.openai.api-key}")
    private String apiKey;

    @Value("${spring.ai.openai.base-url}")
    private String baseUrl;

    @Value("${spring.ai.openai.chat.options.model}")
    private String model;

    @Value("${spring.ai.openai.chat.options.temperature:0.7}")
    private Double temperature;

    @Value("${spring.ai.openai.chat.options.max-tokens:4000}")
    private Integer maxTokens;

    @Value("${spring.ai.openai.chat.options.headers.HTTP-Referer:}")
    private String httpReferer;

    @Value("${spring.ai.openai.chat.options.headers.X-Title:}")
    private String xTitle;

    @Bean
    @Primary
    public OpenAiApi openAiApi() {
        // OpenRouter 的路径不带 /v1 前缀
        return new OpenAiApi.Builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .completionsPath("/chat/completions")
                .embeddingsPath("/embeddings")
                .build();
    }

    @Bean
    @Primary
    public OpenAiChatModel openAiChatModel(OpenAiApi openAiApi) {
        Map<String, String> httpHeaders = new HashMap<>();
        if (StringUtils.hasText(httpReferer)) {
            httpHeaders.put("HTTP-Referer", httpReferer);
        }
        if (StringUtils.hasText(xTitle)) {
            httpHeaders.put("X-Title", xTitle);
        }

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .httpHeaders(httpHeaders)
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(options)
                .build();
    }
}
