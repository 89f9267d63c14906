package com.coursegen.core.generation;

import com.coursegen.core.model.ErrorClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.image.ImageModel;
import org.springframework.ai.image.ImageOptionsBuilder;
import org.springframework.ai.image.ImagePrompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.Map;
import java.util.Set;

/**
 * {@link GenerationService} backed by Spring AI: text through {@link ChatClient},
 * images through the configured {@link ImageModel}.
 * <p>
 * Spring AI's own retry is disabled in configuration; retries happen in the stage adapter.
 */
@Service
public class SpringAiGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(SpringAiGenerationService.class);

    private static final Set<String> SUPPORTED_PROVIDERS = Set.of("openai");

    private final ChatClient chatClient;
    private final ObjectProvider<ImageModel> imageModel;

    public SpringAiGenerationService(ChatClient.Builder builder, ObjectProvider<ImageModel> imageModel,
                                     @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.imageModel = imageModel;
        log.info("SpringAiGenerationService initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public GenerationResponse generate(GenerationPrompt prompt) {
        String provider = prompt.constraint(GenerationPrompt.PROVIDER);
        if (!provider.isBlank() && !SUPPORTED_PROVIDERS.contains(provider)) {
            throw new GenerationServiceException(ErrorClass.MALFORMED_INPUT,
                    "Unsupported model provider '" + provider + "', expected one of " + SUPPORTED_PROVIDERS);
        }
        return switch (prompt.kind()) {
            case TEXT -> text(prompt);
            case IMAGE -> image(prompt);
        };
    }

    private GenerationResponse text(GenerationPrompt prompt) {
        long start = System.currentTimeMillis();
        String content = chatClient.prompt()
                .system(prompt.system())
                .user(prompt.prompt())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("Text generation for {} [{}] complete ({}s)", prompt.constraint(GenerationPrompt.TARGET_REF),
                prompt.constraint(GenerationPrompt.STAGE), String.format("%.1f", elapsed / 1000.0));
        if (content == null || content.isBlank()) {
            throw new GenerationServiceException(ErrorClass.TRANSIENT_REJECTION,
                    "Model returned empty content for " + prompt.constraint(GenerationPrompt.TARGET_REF));
        }
        return new GenerationResponse(content, null, Map.of("elapsedMs", String.valueOf(elapsed)));
    }

    private GenerationResponse image(GenerationPrompt prompt) {
        ImageModel model = imageModel.getIfAvailable();
        if (model == null) {
            throw new GenerationServiceException(ErrorClass.POLICY_REJECTION, "No image model is configured");
        }
        var options = ImageOptionsBuilder.builder().responseFormat("b64_json").build();
        var response = model.call(new ImagePrompt(prompt.prompt(), options));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new GenerationServiceException(ErrorClass.TRANSIENT_REJECTION, "Image model returned no result");
        }
        String b64 = response.getResult().getOutput().getB64Json();
        if (b64 == null || b64.isBlank()) {
            throw new GenerationServiceException(ErrorClass.TRANSIENT_REJECTION,
                    "Image model returned no inline image data");
        }
        return GenerationResponse.ofBinary(Base64.getDecoder().decode(b64));
    }
}
