package com.example.protocolrebuild.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;

import java.util.ArrayList;
import java.util.List;

/**
 * Stub {@link ChatModel} for tests. Returns a fixed text (or throws a fixed error) for any
 * request and keeps every message list it received.
 */
public class StubChatModel implements ChatModel {

    private final String fixedReply;
    private final FinishReason finishReason;
    private final RuntimeException failure;
    private final List<List<ChatMessage>> received = new ArrayList<>();

    public StubChatModel(String fixedReply, FinishReason finishReason) {
        this(fixedReply, finishReason, null);
    }

    public StubChatModel(String fixedReply) {
        this(fixedReply, FinishReason.STOP);
    }

    private StubChatModel(String fixedReply, FinishReason finishReason, RuntimeException failure) {
        this.fixedReply = fixedReply != null ? fixedReply : "{\"nodes\": []}";
        this.finishReason = finishReason;
        this.failure = failure;
    }

    public static StubChatModel failing(RuntimeException failure) {
        return new StubChatModel(null, FinishReason.OTHER, failure);
    }

    public List<List<ChatMessage>> received() {
        return received;
    }

    @Override
    public ChatResponse chat(List<ChatMessage> messages) {
        received.add(List.copyOf(messages));
        if (failure != null) {
            throw failure;
        }
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(fixedReply))
                .finishReason(finishReason)
                .build();
    }
}
