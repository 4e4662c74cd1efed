package com.llmrouter.service;

import com.llmrouter.exception.ErrorKind;
import com.llmrouter.model.dto.ChatCompletionChunk;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One element of a streamed completion as delivered to the caller: a chunk,
 * the end-of-stream sentinel, or a terminal in-band error.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StreamFrame {

    public enum Type {
        CHUNK,
        DONE,
        ERROR
    }

    private final Type type;
    private final ChatCompletionChunk chunk;
    private final ErrorKind errorKind;
    private final String errorMessage;

    public static StreamFrame chunk(ChatCompletionChunk chunk) {
        return new StreamFrame(Type.CHUNK, chunk, null, null);
    }

    public static StreamFrame done() {
        return new StreamFrame(Type.DONE, null, null, null);
    }

    public static StreamFrame error(ErrorKind kind, String message) {
        return new StreamFrame(Type.ERROR, null, kind, message);
    }
}
