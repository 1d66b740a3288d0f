package com.bulwark.core.baseline;

import com.bulwark.core.model.Baseline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads previous scores from disk. Two document shapes are accepted:
 * <ul>
 *   <li>an audit report: {@code {"scores": {"file_permissions": 8, ...}}}</li>
 *   <li>a scorecard result: {@code {"checks": [{"name": "...", "score": 7.5, "reason": "..."}]}}</li>
 * </ul>
 */
@Service
public class BaselineLoader {

    private static final Logger log = LoggerFactory.getLogger(BaselineLoader.class);

    private final ObjectMapper objectMapper;

    public BaselineLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IOException           if the file cannot be read
     * @throws InputFormatException  if the content is not a recognised baseline
     */
    public Baseline load(Path path) throws IOException {
        String json = Files.readString(path, StandardCharsets.UTF_8);
        Baseline baseline = parse(json, path.toString());
        log.info("Loaded baseline with {} checks from {}", baseline.scores().size(), path);
        return baseline;
    }

    public Baseline parse(String json, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InputFormatException("Invalid JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InputFormatException("Baseline " + source + " must be a JSON object");
        }

        var scores = new LinkedHashMap<String, Double>();
        var reasons = new LinkedHashMap<String, String>();

        JsonNode scoresNode = root.get("scores");
        JsonNode checksNode = root.get("checks");
        if (scoresNode != null && scoresNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = scoresNode.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                scores.put(field.getKey(), number(field.getValue(), field.getKey(), source));
            }
        } else if (checksNode != null && checksNode.isArray()) {
            for (JsonNode check : checksNode) {
                String name = check.path("name").asText("");
                if (name.isEmpty()) {
                    throw new InputFormatException("Check without a name in " + source);
                }
                scores.put(name, number(check.get("score"), name, source));
                reasons.put(name, check.path("reason").asText(""));
            }
        } else {
            throw new InputFormatException(
                    "Baseline " + source + " has neither a 'scores' object nor a 'checks' array");
        }
        return new Baseline(scores, reasons);
    }

    private static double number(JsonNode node, String check, String source) {
        if (node == null || !node.isNumber()) {
            throw new InputFormatException("Score for '" + check + "' in " + source + " is not a number");
        }
        return node.asDouble();
    }
}
