package me.golemcore.router.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import me.golemcore.router.domain.model.LlmRequest;
import me.golemcore.router.domain.model.LlmResponse;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class Langchain4jAdapterTest {

    private static final String IS_RATE_LIMIT_ERROR = "isRateLimitError";

    private RouterProperties properties;
    private ChatModel model;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        properties.getLlm().getOpenai().setApiKey("sk-test");
        properties.getLlm().getAnthropic().setApiKey("sk-ant-test");
        model = mock(ChatModel.class);
    }

    private static ChatResponse reply(String text) {
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text))
                .finishReason(FinishReason.STOP)
                .build();
    }

    // ===== chat() =====

    @Test
    void shouldReturnModelText() throws Exception {
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter(properties);
        adapter.setChatModel(model);
        when(model.chat(anyList())).thenReturn(reply("8"));

        LlmResponse response = adapter.chat(LlmRequest.builder().prompt("5 + 3?").build())
                .get(5, TimeUnit.SECONDS);

        assertEquals("8", response.getContent());
        assertEquals("gpt-4", response.getModel());
        assertEquals("STOP", response.getFinishReason());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendSystemPromptBeforeUserPrompt() throws Exception {
        AnthropicLlmAdapter adapter = new AnthropicLlmAdapter(properties);
        adapter.setChatModel(model);
        when(model.chat(anyList())).thenReturn(reply("ok"));

        adapter.chat(LlmRequest.builder().systemPrompt("Be brief.").prompt("Hello").build())
                .get(5, TimeUnit.SECONDS);

        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(model).chat(captor.capture());
        List<ChatMessage> messages = captor.getValue();
        assertEquals(2, messages.size());
        assertEquals("Be brief.", ((SystemMessage) messages.get(0)).text());
        assertEquals("Hello", ((UserMessage) messages.get(1)).singleText());
    }

    @Test
    void shouldFailFutureOnBackendError() {
        properties.getLlm().setMaxRetries(0);
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter(properties);
        adapter.setChatModel(model);
        when(model.chat(anyList())).thenThrow(new RuntimeException("401 Unauthorized"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().prompt("hi").build()).get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains("401 Unauthorized"));
        verify(model, times(1)).chat(anyList());
    }

    @Test
    void shouldRetryRateLimitedRequest() throws Exception {
        properties.getLlm().setMaxRetries(1);
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter(properties);
        adapter.setChatModel(model);
        when(model.chat(anyList()))
                .thenThrow(new RuntimeException("HTTP 429 Too Many Requests"))
                .thenReturn(reply("done"));

        LlmResponse response = adapter.chat(LlmRequest.builder().prompt("hi").build())
                .get(10, TimeUnit.SECONDS);

        assertEquals("done", response.getContent());
        verify(model, times(2)).chat(anyList());
    }

    @Test
    void shouldFailFutureWithoutApiKey() {
        properties.getLlm().getOpenai().setApiKey(null);
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter(properties);

        assertFalse(adapter.isAvailable());
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().prompt("hi").build()).get(5, TimeUnit.SECONDS));
        assertTrue(e.getCause().getMessage().contains("not available"));
    }

    // ===== initialize() =====

    @Test
    void shouldBuildBackendModelsFromSettings() {
        OpenAiLlmAdapter openai = new OpenAiLlmAdapter(properties);
        AnthropicLlmAdapter anthropic = new AnthropicLlmAdapter(properties);

        openai.initialize();
        anthropic.initialize();

        assertTrue(openai.isAvailable());
        assertNotNull(ReflectionTestUtils.getField(openai, "chatModel"));
        assertNotNull(ReflectionTestUtils.getField(anthropic, "chatModel"));
        assertEquals("claude-3-7-sonnet-20250219", anthropic.getCurrentModel());
    }

    // ===== isRateLimitError() =====

    @Test
    void shouldDetectRateLimitInMessage() {
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter(properties);

        assertTrue((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException("rate_limit_exceeded")));
        assertTrue((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException("wrapped", new RuntimeException("Anthropic API overloaded"))));
    }

    @Test
    void shouldNotTreatOtherErrorsAsRateLimit() {
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter(properties);

        assertFalse((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException("Connection refused")));
        assertFalse((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException((String) null)));
    }
}
