package io.github.goodees.wiretap.audit.parse;

/*-
 * #%L
 * wiretap
 * %%
 * Copyright (C) 2026 The Wiretap Authors
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.wiretap.core.store.JacksonSerialization;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Parses JSON bodies of the common LLM APIs.
 *
 * <p>The format is chosen by URI: {@code /v1/chat/completions} and {@code /v1/completions} are OpenAI style,
 * {@code /v1/messages} is Anthropic style, {@code /bedrock} and {@code /invoke} are Bedrock invocations with the
 * model in the path. Other URIs are recognized by content: model with messages is OpenAI style, model with prompt
 * is Anthropic style.
 */
public class JsonRequestParser implements RequestParser {
    static final String ANTHROPIC_VERSION_HEADER = "anthropic-version";

    private final ObjectMapper mapper;

    public JsonRequestParser() {
        this(JacksonSerialization.createMapper());
    }

    public JsonRequestParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ParsedRequest parse(byte[] body, String uri, Map<String, String> headers) throws ParseException {
        JsonNode json = readJson(body);
        String path = uri == null ? "" : uri;
        if (path.contains("/v1/chat/completions") || path.contains("/v1/completions")) {
            return parseOpenAi(json);
        } else if (path.contains("/v1/messages")) {
            return parseAnthropic(json, headers);
        } else if (path.contains("/bedrock") || path.contains("/invoke")) {
            return parseBedrock(json, path);
        } else if (json.has("model") && json.has("messages")) {
            return parseOpenAi(json);
        } else if (json.has("model") && json.has("prompt")) {
            return parseAnthropic(json, headers);
        }
        throw ParseException.unknownFormat(path);
    }

    private JsonNode readJson(byte[] body) throws ParseException {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            throw ParseException.invalidEncoding(e);
        }
        try {
            JsonNode json = mapper.readTree(text);
            if (json == null || json.isMissingNode()) {
                throw ParseException.invalidFieldValue("root", "Body is empty");
            }
            return json;
        } catch (JsonProcessingException e) {
            throw ParseException.invalidJson(e);
        }
    }

    private ParsedRequest parseOpenAi(JsonNode json) throws ParseException {
        requireObject(json);
        if (!json.hasNonNull("model")) {
            throw ParseException.missingField("model");
        }
        String model = json.get("model").asText();
        checkModel(model);
        String provider = model.startsWith("gpt-") || model.startsWith("o1-") ? "openai" : "openai-compatible";
        return new ParsedRequest(provider, model, prompt(json), parameters(json));
    }

    private ParsedRequest parseAnthropic(JsonNode json, Map<String, String> headers) throws ParseException {
        requireObject(json);
        String model = json.hasNonNull("model") ? json.get("model").asText()
                : header(headers, ANTHROPIC_VERSION_HEADER).orElseThrow(() -> ParseException.missingField("model"));
        checkModel(model);
        return new ParsedRequest("anthropic", model, prompt(json), parameters(json));
    }

    private ParsedRequest parseBedrock(JsonNode json, String uri) throws ParseException {
        requireObject(json);
        String model = Arrays.stream(uri.split("/"))
                .filter(segment -> segment.contains("."))
                .findFirst()
                .orElseThrow(() -> ParseException.missingField("model in URI"));
        checkModel(model);
        String prompt;
        if (json.path("prompt").isTextual()) {
            prompt = json.get("prompt").asText();
        } else if (json.path("inputText").isTextual()) {
            prompt = json.get("inputText").asText();
        } else if (json.path("messages").isArray()) {
            List<String> contents = new ArrayList<>();
            for (JsonNode message : json.get("messages")) {
                if (message.path("content").isTextual()) {
                    contents.add(message.get("content").asText());
                }
            }
            prompt = String.join("\n", contents);
        } else {
            throw ParseException.missingField("prompt, inputText, or messages");
        }
        checkPrompt(prompt);
        Map<String, String> parameters = new TreeMap<>();
        json.fields().forEachRemaining(e -> parameters.put(e.getKey(), e.getValue().toString()));
        return new ParsedRequest("bedrock", model, prompt, parameters);
    }

    private static String prompt(JsonNode json) throws ParseException {
        String prompt;
        if (json.path("messages").isArray()) {
            List<String> lines = new ArrayList<>();
            for (JsonNode message : json.get("messages")) {
                String role = message.path("role").asText(null);
                String content = message.path("content").isTextual() ? message.get("content").asText() : null;
                if (role != null && content != null) {
                    lines.add(role + ": " + content);
                }
            }
            prompt = String.join("\n", lines);
        } else if (json.path("prompt").isTextual()) {
            prompt = json.get("prompt").asText();
        } else {
            throw ParseException.missingField("messages or prompt");
        }
        checkPrompt(prompt);
        return prompt;
    }

    private static Map<String, String> parameters(JsonNode json) {
        Map<String, String> parameters = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            switch (field.getKey()) {
                case "model":
                case "messages":
                case "prompt":
                    break;
                default:
                    parameters.put(field.getKey(), field.getValue().toString());
            }
        }
        return parameters;
    }

    private static void requireObject(JsonNode json) throws ParseException {
        if (!json.isObject()) {
            throw ParseException.invalidFieldValue("root", "Expected JSON object");
        }
    }

    private static void checkModel(String model) throws ParseException {
        if (model.trim().isEmpty()) {
            throw ParseException.invalidFieldValue("model", "must not be blank");
        }
    }

    private static void checkPrompt(String prompt) throws ParseException {
        if (prompt.trim().isEmpty()) {
            throw ParseException.invalidFieldValue("prompt", "must not be empty");
        }
    }

    private static Optional<String> header(Map<String, String> headers, String name) {
        if (headers == null) {
            return Optional.empty();
        }
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
