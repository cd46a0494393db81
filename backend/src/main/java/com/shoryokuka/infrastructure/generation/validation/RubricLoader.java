package com.shoryokuka.infrastructure.generation.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.shoryokuka.domain.plan.model.IssueCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the quality rubric YAML (penalties, catalogues, limits) into a {@link QualityRubric}.
 */
@Slf4j
@Component
public class RubricLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper;

    public RubricLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * @param location Spring resource location, e.g. {@code classpath:quality/rubric.yml}
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public QualityRubric load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Quality rubric not found: " + location);
        }
        try (InputStream is = resource.getInputStream()) {
            JsonNode root = yamlMapper.readTree(is);
            if (root == null || !root.isObject()) {
                throw new IllegalStateException("Quality rubric is empty: " + location);
            }
            QualityRubric rubric = new QualityRubric(
                    parsePenalties(root.path("penalties")),
                    parseRepetition(root.path("repetition")),
                    parseGenericPhrases(root.path("generic-phrases")),
                    parseRules(root.path("unnatural-patterns")),
                    parseRules(root.path("text-holes")),
                    parseEnumeration(root.path("enumeration")),
                    parseRewrite(root.path("rewrite")));
            log.info("Loaded quality rubric {}: {} generic phrases, {} unnatural patterns, {} hole patterns",
                    location, rubric.genericPhrases().size(), rubric.unnaturalPatterns().size(),
                    rubric.textHoles().size());
            return rubric;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read quality rubric: " + location, e);
        }
    }

    private Map<IssueCategory, BigDecimal> parsePenalties(JsonNode node) {
        Map<IssueCategory, BigDecimal> penalties = new EnumMap<>(IssueCategory.class);
        for (IssueCategory category : IssueCategory.values()) {
            String key = category.name().toLowerCase().replace('_', '-');
            JsonNode value = node.path(key);
            if (!value.isNumber() && !value.isTextual()) {
                throw new IllegalStateException("Missing penalty for " + key);
            }
            penalties.put(category, new BigDecimal(value.asText()));
        }
        return penalties;
    }

    private QualityRubric.Repetition parseRepetition(JsonNode node) {
        return new QualityRubric.Repetition(
                node.path("opening-length").asInt(3),
                node.path("opening-limit").asInt(2),
                node.path("document-opening-limit").asInt(6),
                node.path("ending-length").asInt(2),
                node.path("ending-run-limit").asInt(3),
                node.path("min-duplicate-length").asInt(10),
                node.path("list-marker").asText("・"));
    }

    private List<QualityRubric.GenericPhrase> parseGenericPhrases(JsonNode node) {
        List<QualityRubric.GenericPhrase> phrases = new ArrayList<>();
        for (JsonNode item : node) {
            String phrase = item.path("phrase").asText("");
            if (phrase.isEmpty()) {
                throw new IllegalStateException("Generic phrase entry without phrase");
            }
            phrases.add(new QualityRubric.GenericPhrase(
                    phrase,
                    item.path("replacement").asText(""),
                    item.path("fallback").asText("")));
        }
        return phrases;
    }

    private List<QualityRubric.PatternRule> parseRules(JsonNode node) {
        List<QualityRubric.PatternRule> rules = new ArrayList<>();
        for (JsonNode item : node) {
            String id = item.path("id").asText("");
            String regex = item.path("pattern").asText("");
            try {
                rules.add(new QualityRubric.PatternRule(
                        id,
                        Pattern.compile(regex),
                        item.hasNonNull("replacement") ? item.get("replacement").asText() : null,
                        item.path("description").asText(id)));
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Invalid pattern in rule " + id, e);
            }
        }
        return rules;
    }

    private QualityRubric.Enumeration parseEnumeration(JsonNode node) {
        List<String> markers = new ArrayList<>();
        node.path("markers").forEach(m -> markers.add(m.asText()));
        return new QualityRubric.Enumeration(markers, node.path("limit").asInt(2));
    }

    private QualityRubric.Rewrite parseRewrite(JsonNode node) {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> openings = node.path("opening-synonyms").fields();
        while (openings.hasNext()) {
            Map.Entry<String, JsonNode> entry = openings.next();
            List<String> alternatives = new ArrayList<>();
            entry.getValue().forEach(v -> alternatives.add(v.asText()));
            synonyms.put(entry.getKey(), alternatives);
        }
        Map<String, String> joins = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> endings = node.path("ending-joins").fields();
        while (endings.hasNext()) {
            Map.Entry<String, JsonNode> entry = endings.next();
            joins.put(entry.getKey(), entry.getValue().asText());
        }
        return new QualityRubric.Rewrite(synonyms, joins, node.path("backend-rewrite").asBoolean(false));
    }
}
