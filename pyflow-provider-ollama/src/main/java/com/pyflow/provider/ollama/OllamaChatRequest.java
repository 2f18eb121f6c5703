package com.pyflow.provider.ollama;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/** Ollama /api/chat request body. {@code format} is set to {@code json} for JSON-mode calls. */
@JsonInclude(JsonInclude.Include.NON_NULL)
final class OllamaChatRequest {

    private final String model;
    private final List<Message> messages;
    @JsonProperty("stream")
    private final boolean stream;
    private final String format;
    private final Map<String, Object> options;

    OllamaChatRequest(String model, List<Message> messages, String format, Map<String, Object> options) {
        this.model = model;
        this.messages = messages;
        this.stream = false;
        this.format = format;
        this.options = options;
    }

    public String getModel() { return model; }
    public List<Message> getMessages() { return messages; }
    public boolean isStream() { return stream; }
    public String getFormat() { return format; }
    public Map<String, Object> getOptions() { return options; }

    static final class Message {
        private final String role;
        private final String content;

        Message(String role, String content) {
            this.role = role;
            this.content = content;
        }

        public String getRole() { return role; }
        public String getContent() { return content; }
    }
}
