package com.coursegen.core.generation;

import com.coursegen.core.model.ErrorClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.image.Image;
import org.springframework.ai.image.ImageGeneration;
import org.springframework.ai.image.ImageModel;
import org.springframework.ai.image.ImagePrompt;
import org.springframework.ai.image.ImageResponse;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SpringAiGenerationService}.
 * <p>
 * Mocks the {@link ChatClient} chain and the {@link ImageModel} so no real model calls are made.
 */
class SpringAiGenerationServiceTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private ImageModel mockImageModel;
    private ObjectProvider<ImageModel> imageProvider;
    private SpringAiGenerationService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        mockImageModel = mock(ImageModel.class);
        imageProvider = mock(ObjectProvider.class);
        when(imageProvider.getIfAvailable()).thenReturn(mockImageModel);

        service = new SpringAiGenerationService(mockBuilder, imageProvider, "http://test:1234");
    }

    private static Map<String, String> constraints(String provider) {
        return Map.of(GenerationPrompt.STAGE, "content", GenerationPrompt.TARGET_REF, "01-01",
                GenerationPrompt.PROVIDER, provider);
    }

    @Test
    @DisplayName("Text prompts go through the chat client")
    void textPrompt() {
        when(mockCallResponse.content()).thenReturn("# Lesson");

        var response = service.generate(GenerationPrompt.text("System", "User", constraints("openai")));

        assertEquals("# Lesson", response.text());
        verify(mockRequestSpec).system("System");
        verify(mockRequestSpec).user("User");
        assertTrue(response.metadata().containsKey("elapsedMs"));
    }

    @Test
    @DisplayName("Empty model content is a transient rejection")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn("");

        var e = assertThrows(GenerationServiceException.class,
                () -> service.generate(GenerationPrompt.text("S", "U", constraints("openai"))));
        assertEquals(ErrorClass.TRANSIENT_REJECTION, e.errorClass());
    }

    @Test
    @DisplayName("Unsupported providers are rejected before any call")
    void unsupportedProvider() {
        var e = assertThrows(GenerationServiceException.class,
                () -> service.generate(GenerationPrompt.text("S", "U", constraints("anthropic"))));

        assertEquals(ErrorClass.MALFORMED_INPUT, e.errorClass());
        verify(mockRequestSpec, never()).call();
    }

    @Test
    @DisplayName("Image prompts decode inline base64 data")
    void imagePrompt() {
        byte[] png = "png-bytes".getBytes(StandardCharsets.UTF_8);
        var image = new Image(null, Base64.getEncoder().encodeToString(png));
        when(mockImageModel.call(any(ImagePrompt.class)))
                .thenReturn(new ImageResponse(List.of(new ImageGeneration(image))));

        var response = service.generate(GenerationPrompt.image("a diagram", constraints("")));

        assertArrayEquals(png, response.binary());
    }

    @Test
    @DisplayName("An image result without inline data is a transient rejection")
    void imageWithoutData() {
        when(mockImageModel.call(any(ImagePrompt.class)))
                .thenReturn(new ImageResponse(List.of(new ImageGeneration(new Image("http://x/1.png", null)))));

        var e = assertThrows(GenerationServiceException.class,
                () -> service.generate(GenerationPrompt.image("a diagram", constraints("openai"))));
        assertEquals(ErrorClass.TRANSIENT_REJECTION, e.errorClass());
    }

    @Test
    @DisplayName("Missing image model is a policy rejection")
    void noImageModel() {
        when(imageProvider.getIfAvailable()).thenReturn(null);

        var e = assertThrows(GenerationServiceException.class,
                () -> service.generate(GenerationPrompt.image("a diagram", constraints("openai"))));
        assertEquals(ErrorClass.POLICY_REJECTION, e.errorClass());
    }
}
