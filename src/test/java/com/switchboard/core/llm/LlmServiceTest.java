package com.switchboard.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}. The {@link ChatClient} chain is mocked end to end.
 */
class LlmServiceTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://test:1234");
    }

    @Test
    @DisplayName("structuredCall sends the system prompt and the user prompt followed by format instructions")
    void sendsPrompts() {
        when(mockCallResponse.content()).thenReturn("{\"intent\":\"create_task\",\"confidence\":0.8}");

        llmService.structuredCall("System prompt", "User prompt", GenerativeIntentPayload.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("User prompt\n\n"));
        assertTrue(userCaptor.getValue().length() > "User prompt\n\n".length());
    }

    @Test
    @DisplayName("structuredCall deserializes the reply into the target type")
    void deserializes() {
        when(mockCallResponse.content()).thenReturn("""
                {"intent":"sync_data","confidence":0.91,"platforms":["asana","slack"],
                 "crossPlatformAction":true,
                 "dataIntegration":{"sourcePlatforms":["asana"],"targetPlatforms":["slack"],"syncOperation":"sync"}}
                """);

        GenerativeIntentPayload payload = llmService.structuredCall("sys", "usr", GenerativeIntentPayload.class);

        assertEquals("sync_data", payload.intent());
        assertEquals(0.91, payload.confidence());
        assertEquals(List.of("asana", "slack"), payload.platforms());
        assertTrue(payload.crossPlatformAction());
        assertEquals("sync", payload.dataIntegration().syncOperation());
    }

    @Test
    @DisplayName("a reply wrapped in a markdown fence is still parsed")
    void fencedReply() {
        when(mockCallResponse.content()).thenReturn("```json\n{\"intent\":\"create_task\",\"confidence\":0.7}\n```");

        GenerativeIntentPayload payload = llmService.structuredCall("sys", "usr", GenerativeIntentPayload.class);

        assertEquals("create_task", payload.intent());
    }

    @Test
    @DisplayName("empty content raises LlmEmptyResponseException")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn("  ");
        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("sys", "usr", GenerativeIntentPayload.class));
    }

    @Test
    @DisplayName("unparseable content raises LlmParseException")
    void garbage() {
        when(mockCallResponse.content()).thenReturn("I think the user wants a task");
        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("sys", "usr", GenerativeIntentPayload.class));
    }

    @Test
    @DisplayName("stripCodeFence removes json and bare fences")
    void stripCodeFence() {
        assertEquals("{}", LlmService.stripCodeFence("```json\n{}\n```"));
        assertEquals("{}", LlmService.stripCodeFence("```{}```"));
        assertEquals("{}", LlmService.stripCodeFence(" {} "));
    }
}
