package com.harden.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns the reasoning tool's raw text into structured JSON.
 * <p>
 * Markdown fences around the payload are stripped first. When the cleaned text
 * still does not parse, the outermost {@code {...}} span is tried, which
 * recovers JSON wrapped in prose. If nothing parses, a degraded result
 * carrying {@value #PARSE_ERROR} and a truncated {@value #RAW_RESPONSE} is
 * returned instead of an exception: malformed output degrades one unit's
 * result, it never aborts a phase.
 */
@Component
public class ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    public static final String PARSE_ERROR = "parse_error";
    public static final String RAW_RESPONSE = "raw_response";

    static final int MAX_RAW_CAPTURE = 1000;

    private static final Pattern LEADING_FENCE = Pattern.compile("\\A\\s*```json\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```\\s*\\z");

    private final ObjectMapper mapper;
    private final ObjectReader strictReader;

    public ResponseNormalizer(ObjectMapper mapper) {
        this.mapper = mapper;
        this.strictReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Parses the raw tool output. Never throws.
     *
     * @param raw raw tool output, may be null
     * @return the parsed value, or a degraded {@code {parse_error, raw_response}} object
     */
    public JsonNode parse(String raw) {
        String text = raw == null ? "" : raw;
        String cleaned = stripFences(text);
        try {
            return readStrict(cleaned);
        } catch (JsonProcessingException e) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                try {
                    return readStrict(text.substring(start, end + 1));
                } catch (JsonProcessingException nested) {
                    log.debug("Embedded JSON extraction failed: {}", nested.getOriginalMessage());
                }
            }
            log.warn("Tool response is not valid JSON ({} chars): {}", text.length(), e.getOriginalMessage());
            return degraded(e.getOriginalMessage(), text);
        }
    }

    /**
     * True when the node is a degraded parse-failure wrapper produced by {@link #parse}.
     */
    public static boolean isDegraded(JsonNode node) {
        return node != null && node.isObject() && node.has(PARSE_ERROR) && node.has(RAW_RESPONSE);
    }

    static String stripFences(String text) {
        String withoutLeading = LEADING_FENCE.matcher(text).replaceFirst("");
        return TRAILING_FENCE.matcher(withoutLeading).replaceFirst("").strip();
    }

    private JsonNode readStrict(String json) throws JsonProcessingException {
        JsonNode node = strictReader.readTree(json);
        if (node == null || node.isMissingNode()) {
            throw new EmptyResponseException();
        }
        return node;
    }

    private ObjectNode degraded(String message, String raw) {
        ObjectNode node = mapper.createObjectNode();
        node.put(PARSE_ERROR, message != null ? message : "Unparseable response");
        node.put(RAW_RESPONSE, raw.length() <= MAX_RAW_CAPTURE ? raw : raw.substring(0, MAX_RAW_CAPTURE));
        return node;
    }

    private static final class EmptyResponseException extends JsonProcessingException {
        EmptyResponseException() {
            super("No content to parse");
        }
    }
}
