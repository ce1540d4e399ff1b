package com.lorekeeper.context;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** r50k_base token counts, or {@code ceil(length / 4)} when the encoding is unavailable. */
public class TokenEstimator {

    private static final Logger log = LoggerFactory.getLogger(TokenEstimator.class);

    private final Encoding encoding;

    private TokenEstimator(Encoding encoding) {
        this.encoding = encoding;
    }

    public static TokenEstimator r50k() {
        try {
            return new TokenEstimator(Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.R50K_BASE));
        } catch (RuntimeException e) {
            log.warn("Tokenizer unavailable, using length/4 estimate: {}", e.getMessage());
            return heuristic();
        }
    }

    public static TokenEstimator heuristic() {
        return new TokenEstimator(null);
    }

    public boolean exact() {
        return encoding != null;
    }

    public int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        if (encoding != null) {
            try {
                return encoding.countTokens(text);
            } catch (RuntimeException e) {
                log.warn("Tokenizer error, using length/4 estimate: {}", e.getMessage());
            }
        }
        return (int) Math.ceil(text.length() / 4.0);
    }
}
