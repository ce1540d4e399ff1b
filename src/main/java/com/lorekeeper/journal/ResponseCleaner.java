package com.lorekeeper.journal;

import java.util.regex.Pattern;

/** Strips reasoning blocks and code fences that models wrap around structured output. */
public final class ResponseCleaner {

    private static final Pattern REASONING_BLOCK = Pattern.compile(
            "(?is)<(think|thinking|reasoning)>.*?</\\1>");
    private static final Pattern DANGLING_REASONING = Pattern.compile(
            "(?is)^.*?</(think|thinking|reasoning)>");
    private static final Pattern CODE_FENCE = Pattern.compile("```[A-Za-z0-9_-]*");

    private ResponseCleaner() {}

    public static String clean(String raw) {
        if (raw == null) return "";
        var text = REASONING_BLOCK.matcher(raw).replaceAll("");
        // opening tag was cut off by the provider, only the closer survived
        text = DANGLING_REASONING.matcher(text).replaceFirst("");
        text = CODE_FENCE.matcher(text).replaceAll("");
        return text.trim();
    }
}
