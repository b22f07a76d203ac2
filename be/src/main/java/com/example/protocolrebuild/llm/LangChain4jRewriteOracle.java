package com.example.protocolrebuild.llm;

import com.example.protocolrebuild.regeneration.OracleException;
import com.example.protocolrebuild.regeneration.RewriteOracle;
import com.example.protocolrebuild.regeneration.SectionRequest;
import com.example.protocolrebuild.regeneration.TransientOracleException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link RewriteOracle} backed by a LangChain4j {@link ChatModel}.
 * <p>
 * Retriable client failures (timeouts, rate limits, server errors) surface as
 * {@link TransientOracleException}; everything else as {@link OracleException}. A response cut off
 * at the token budget is still returned, since the extraction layer can often repair it.
 * </p>
 */
@Slf4j
public class LangChain4jRewriteOracle implements RewriteOracle {

    private final ChatModel chatModel;
    private final RewritePromptBuilder promptBuilder;

    public LangChain4jRewriteOracle(ChatModel chatModel, RewritePromptBuilder promptBuilder) {
        this.chatModel = chatModel;
        this.promptBuilder = promptBuilder;
    }

    @Override
    public String rewrite(SectionRequest request) {
        List<ChatMessage> messages = List.of(
                SystemMessage.from(promptBuilder.systemPrompt(request)),
                UserMessage.from(promptBuilder.userPrompt(request)));
        ChatResponse response;
        try {
            response = chatModel.chat(messages);
        } catch (RetriableException e) {
            throw new TransientOracleException("oracle call failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new OracleException("oracle call failed: " + e.getMessage(), e);
        }
        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new TransientOracleException("oracle returned no text");
        }
        if (response.finishReason() == FinishReason.LENGTH) {
            log.warn("Oracle output truncated at token budget section={} attempt={} length={}",
                    request.sectionIndex(), request.attemptNumber(), response.aiMessage().text().length());
        }
        return response.aiMessage().text();
    }
}
