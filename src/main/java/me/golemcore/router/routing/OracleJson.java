package me.golemcore.router.routing;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Optimistic extraction of structured data from free oracle text.
 *
 * <p>
 * Oracle replies are untrusted: JSON may be wrapped in prose or a markdown
 * fence, contain raw control characters, or be cut off. Every method here
 * returns {@link Optional#empty()} instead of throwing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OracleJson {

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final Pattern CODE_FENCE = Pattern.compile("```[a-zA-Z0-9_+-]*\\s*\\n(.*?)```", Pattern.DOTALL);
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private final ObjectMapper objectMapper;

    /**
     * Parse the first JSON object found in {@code raw}: a ```json fence wins,
     * otherwise the first balanced {@code {...}} span.
     */
    public Optional<JsonNode> parseObject(String raw) {
        Optional<String> span = extractObject(raw);
        if (span.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.reader()
                    .with(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
                    .readTree(span.get());
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("[Oracle] Unparseable JSON in reply: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public <T> Optional<T> parseObject(String raw, Class<T> type) {
        return parseObject(raw).flatMap(node -> {
            try {
                return Optional.ofNullable(objectMapper.treeToValue(node, type));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[Oracle] Reply does not match {}: {}", type.getSimpleName(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    static Optional<String> extractObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = stripControlCharacters(raw);

        Matcher fence = JSON_FENCE.matcher(text);
        if (fence.find()) {
            return Optional.of(fence.group(1));
        }
        return firstBalancedObject(text);
    }

    /**
     * Finds the first {@code {...}} span whose braces balance, ignoring braces
     * inside string literals.
     */
    static Optional<String> firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = balancedEnd(text, start);
            if (end > 0) {
                return Optional.of(text.substring(start, end));
            }
            // unbalanced from here, try the next opening brace
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    /**
     * Offset just past the brace closing the one at {@code start}, or -1.
     */
    private static int balancedEnd(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\' && inString) {
                escaped = true;
            } else if (c == '"') {
                inString = !inString;
            } else if (!inString && c == '{') {
                depth++;
            } else if (!inString && c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    /**
     * Start and end offsets of every top-level balanced {@code {...}} span, in
     * order of appearance.
     */
    static List<int[]> balancedObjectSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = balancedEnd(text, start);
            if (end > 0) {
                spans.add(new int[] { start, end });
                start = text.indexOf('{', end);
            } else {
                start = text.indexOf('{', start + 1);
            }
        }
        return spans;
    }

    /**
     * The last JSON object in {@code raw} that has {@code field}. Stage
     * signals trail the prose, so earlier objects are examples.
     */
    Optional<JsonNode> lastObjectWithField(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = stripControlCharacters(raw);
        List<int[]> spans = balancedObjectSpans(text);
        for (int i = spans.size() - 1; i >= 0; i--) {
            int[] span = spans.get(i);
            Optional<JsonNode> node = readObject(text.substring(span[0], span[1]));
            if (node.isPresent() && node.get().has(field)) {
                return node;
            }
        }
        return Optional.empty();
    }

    private Optional<JsonNode> readObject(String json) {
        try {
            JsonNode node = objectMapper.reader()
                    .with(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
                    .readTree(json);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * The reply with its trailing {@code field} signal object (and an
     * enclosing ```json fence) removed, for showing the prose part to the
     * user. Other objects in the prose are kept.
     */
    public String withoutSignal(String raw, String field) {
        if (raw == null) {
            return "";
        }
        List<int[]> spans = balancedObjectSpans(raw);
        for (int i = spans.size() - 1; i >= 0; i--) {
            int[] span = spans.get(i);
            Optional<JsonNode> node = readObject(stripControlCharacters(raw.substring(span[0], span[1])));
            if (node.isPresent() && node.get().has(field)) {
                int from = span[0];
                int to = span[1];
                Matcher fence = JSON_FENCE.matcher(raw);
                while (fence.find()) {
                    if (fence.start(1) == from && fence.end(1) == to) {
                        from = fence.start();
                        to = fence.end();
                        break;
                    }
                }
                return (raw.substring(0, from) + raw.substring(to)).strip();
            }
        }
        return raw.strip();
    }

    static String stripControlCharacters(String text) {
        return CONTROL_CHARS.matcher(text).replaceAll("");
    }

    /**
     * Recover a string field from text that is not valid JSON, for example a
     * truncated object.
     */
    public Optional<String> salvageString(String raw, String field) {
        if (raw == null) {
            return Optional.empty();
        }
        Pattern pattern = Pattern.compile("\"" + Pattern.quote(field) + "\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");
        Matcher matcher = pattern.matcher(raw);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String quoted = "\"" + matcher.group(1) + "\"";
        try {
            String value = objectMapper.readValue(quoted, String.class);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
        } catch (JsonProcessingException e) {
            return Optional.of(matcher.group(1));
        }
    }

    /**
     * Body of the first fenced code block, any language tag.
     */
    public Optional<String> extractCodeBlock(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = CODE_FENCE.matcher(raw);
        if (matcher.find()) {
            String code = matcher.group(1).strip();
            return code.isEmpty() ? Optional.empty() : Optional.of(code);
        }
        return Optional.empty();
    }

    /**
     * Reads a boolean signal such as {@code {"advance": true}} from the last
     * object that carries it.
     */
    public Optional<Boolean> readFlag(String raw, String field) {
        return lastObjectWithField(raw, field)
                .map(node -> node.get(field))
                .filter(value -> value != null && (value.isBoolean() || value.isTextual()))
                .flatMap(value -> {
                    if (value.isBoolean()) {
                        return Optional.of(value.asBoolean());
                    }
                    String text = value.asText().trim();
                    if ("true".equalsIgnoreCase(text) || "yes".equalsIgnoreCase(text)) {
                        return Optional.of(Boolean.TRUE);
                    }
                    if ("false".equalsIgnoreCase(text) || "no".equalsIgnoreCase(text)) {
                        return Optional.of(Boolean.FALSE);
                    }
                    return Optional.empty();
                });
    }
}
