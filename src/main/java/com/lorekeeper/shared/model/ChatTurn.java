package com.lorekeeper.shared.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record ChatTurn(String role, String content) {

    public static ChatTurn user(String content) { return new ChatTurn("user", content); }

    public static ChatTurn assistant(String content) { return new ChatTurn("assistant", content); }

    public boolean isUser() { return "user".equals(role); }

    public boolean isAssistant() { return "assistant".equals(role); }

    public boolean isConversational() { return isUser() || isAssistant(); }

    public Map<String, Object> toMessage() {
        var msg = new LinkedHashMap<String, Object>();
        msg.put("role", role);
        msg.put("content", content != null ? content : "");
        return msg;
    }
}
