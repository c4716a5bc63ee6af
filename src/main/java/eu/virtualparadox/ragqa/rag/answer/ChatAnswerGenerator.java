package eu.virtualparadox.ragqa.rag.answer;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.exception.GenerationUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link AnswerGenerator} backed by a Spring AI {@link ChatModel}.
 * <p>With a non-empty context the model is told to ground its answer in the document snippets;
 * with an empty context it answers from general knowledge.</p>
 */
@Service
@Slf4j
public class ChatAnswerGenerator implements AnswerGenerator {

    static final String SYSTEM_PROMPT = "You are a helpful AI assistant.";

    private final ChatModel chatModel;
    private final ChatOptions options;

    public ChatAnswerGenerator(final ChatModel chatModel, final ApplicationConfig config) {
        this.chatModel = chatModel;
        this.options = ChatOptions.builder()
                .temperature(config.getGeneration().getTemperature())
                .maxTokens(config.getGeneration().getMaxTokens())
                .build();
    }

    @Override
    public String generate(final String question, final String context) {
        final Prompt prompt = new Prompt(
                List.of(new SystemMessage(SYSTEM_PROMPT), new UserMessage(buildUserPrompt(question, context))),
                options);

        log.debug(" !!! Prompt: \nUser: {}", prompt.getContents());

        final ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (final RuntimeException e) {
            throw new GenerationUnavailableException("Chat model call failed", e);
        }

        final String answer = response == null || response.getResult() == null
                ? null
                : response.getResult().getOutput().getText();
        if (answer == null || answer.isBlank()) {
            throw new GenerationUnavailableException("Chat model returned an empty answer", null);
        }
        return answer.strip();
    }

    static String buildUserPrompt(final String question, final String context) {
        if (context == null || context.isBlank()) {
            return String.join("\n",
                    "Use your general knowledge to answer the user truthfully.",
                    "",
                    "USER QUESTION: " + question,
                    "ANSWER:");
        }

        return String.join("\n",
                "You have access to the following document snippets.",
                "",
                "DOCUMENT CONTEXT:",
                context,
                "",
                "USER QUESTION:",
                question,
                "",
                "INSTRUCTIONS:",
                "1. Use the DOCUMENT CONTEXT to answer the question as accurately as possible.",
                "2. If the context contains relevant information, say so clearly (e.g. \"The document states...\").",
                "3. If the context is unrelated to the question, answer from general knowledge,"
                        + " but prefer the context whenever it covers the topic.",
                "4. Do not claim you have no access to documents when snippets are provided above.",
                "",
                "ANSWER:");
    }
}
