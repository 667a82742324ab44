package com.storyarchitect.knowledge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.models.EntityCategory;
import com.storyarchitect.models.ExtractedFacts;
import com.storyarchitect.models.ExtractedFacts.EntityFact;
import com.storyarchitect.models.ExtractedFacts.EventFact;
import com.storyarchitect.models.ExtractedFacts.PrecedenceFact;
import com.storyarchitect.models.ExtractedFacts.ThreadFact;
import com.storyarchitect.models.StageKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the fenced {@code facts} block the prompts ask the model to append.
 * Falls back to the last {@code json} block, then to a top-level
 * {@code facts} key in a bare JSON answer (the outline stage).
 */
public class JsonFactExtractor implements FactExtractor {

    public static final String FACTS_TAG = "facts";

    private final ObjectMapper mapper;

    public JsonFactExtractor(ObjectMapper mapper) {
        this.mapper = mapper != null ? mapper : new ObjectMapper();
    }

    @Override
    public ExtractedFacts extract(String text, StageKind stage) throws ExtractionException {
        if (text == null || text.isBlank()) {
            throw new ExtractionException("No text to extract facts from");
        }
        JsonNode facts = locateFacts(text);
        if (facts == null) {
            throw new ExtractionException("No facts block found in " + stage + " output");
        }
        return readFacts(facts);
    }

    private JsonNode locateFacts(String text) throws ExtractionException {
        List<JsonBlocks.Block> blocks = JsonBlocks.fencedBlocks(text);
        JsonBlocks.Block factsBlock = null;
        JsonBlocks.Block jsonBlock = null;
        for (JsonBlocks.Block block : blocks) {
            if (FACTS_TAG.equals(block.getTag())) {
                factsBlock = block;
            } else if ("json".equals(block.getTag()) || block.getTag().isEmpty()) {
                jsonBlock = block;
            }
        }
        if (factsBlock != null) {
            JsonNode node = JsonBlocks.parseObject(mapper, factsBlock.getBody());
            if (node == null) {
                throw new ExtractionException("Facts block is not a JSON object");
            }
            return node.has(FACTS_TAG) && node.get(FACTS_TAG).isObject() ? node.get(FACTS_TAG) : node;
        }
        JsonNode node = JsonBlocks.parseObject(mapper, jsonBlock != null ? jsonBlock.getBody() : text);
        if (node == null) {
            return null;
        }
        if (node.path(FACTS_TAG).isObject()) {
            return node.get(FACTS_TAG);
        }
        if (node.has("entities") || node.has("characters") || node.has("events")) {
            return node;
        }
        return null;
    }

    ExtractedFacts readFacts(JsonNode node) {
        String summary = node.path("summary").isTextual() ? node.get("summary").asText().trim() : null;
        List<EntityFact> entities = new ArrayList<>();
        readEntities(node.path("entities"), null, entities);
        readEntities(node.path("characters"), EntityCategory.CHARACTER, entities);
        readEntities(node.path("locations"), EntityCategory.LOCATION, entities);
        readEntities(node.path("objects"), EntityCategory.OBJECT, entities);

        List<EventFact> events = new ArrayList<>();
        List<PrecedenceFact> precedences = new ArrayList<>();
        readEvents(node.path("events"), events, precedences);
        readEvents(node.path("timeline"), events, precedences);
        for (JsonNode edge : iterable(node.path("precedences"))) {
            String before = text(edge, "before");
            String after = text(edge, "after");
            if (before != null && after != null) {
                precedences.add(new PrecedenceFact(before, after));
            }
        }

        List<ThreadFact> opened = new ArrayList<>();
        List<String> resolved = new ArrayList<>();
        JsonNode threads = node.path("plotThreads");
        readOpened(threads.path("opened"), opened);
        readOpened(node.path("openedThreads"), opened);
        readResolved(threads.path("resolved"), resolved);
        readResolved(node.path("resolvedThreads"), resolved);

        return new ExtractedFacts(summary, entities, events, precedences, opened, resolved);
    }

    private void readEntities(JsonNode array, EntityCategory forced, List<EntityFact> out) {
        for (JsonNode item : iterable(array)) {
            if (item.isTextual()) {
                if (!item.asText().isBlank()) {
                    out.add(new EntityFact(item.asText().trim(), forced, null, null));
                }
                continue;
            }
            String name = text(item, "name");
            if (name == null) {
                continue;
            }
            EntityCategory category = forced;
            if (category == null) {
                String raw = text(item, "category");
                category = EntityCategory.fromString(raw != null ? raw : text(item, "type"));
            }
            List<String> aliases = new ArrayList<>();
            for (JsonNode alias : iterable(item.path("aliases"))) {
                if (alias.isTextual() && !alias.asText().isBlank()) {
                    aliases.add(alias.asText().trim());
                }
            }
            Map<String, String> attributes = new LinkedHashMap<>();
            JsonNode attrs = item.path("attributes");
            if (attrs.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = attrs.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    JsonNode value = field.getValue();
                    if (value == null || value.isNull() || value.isContainerNode()) {
                        continue;
                    }
                    String asText = value.asText().trim();
                    if (!asText.isEmpty()) {
                        attributes.put(field.getKey(), asText);
                    }
                }
            }
            out.add(new EntityFact(name, category, aliases, attributes));
        }
    }

    private void readEvents(JsonNode array, List<EventFact> events, List<PrecedenceFact> precedences) {
        for (JsonNode item : iterable(array)) {
            String key = text(item, "key");
            if (key == null) {
                key = text(item, "id");
            }
            if (key == null) {
                continue;
            }
            events.add(new EventFact(key, text(item, "description")));
            for (JsonNode earlier : iterable(item.path("after"))) {
                if (earlier.isTextual()) {
                    precedences.add(new PrecedenceFact(earlier.asText(), key));
                }
            }
            for (JsonNode later : iterable(item.path("before"))) {
                if (later.isTextual()) {
                    precedences.add(new PrecedenceFact(key, later.asText()));
                }
            }
        }
    }

    private void readOpened(JsonNode array, List<ThreadFact> out) {
        for (JsonNode item : iterable(array)) {
            if (item.isTextual() && !item.asText().isBlank()) {
                out.add(new ThreadFact(item.asText().trim(), null));
            } else if (text(item, "name") != null) {
                out.add(new ThreadFact(text(item, "name"), text(item, "description")));
            }
        }
    }

    private void readResolved(JsonNode array, List<String> out) {
        for (JsonNode item : iterable(array)) {
            String name = item.isTextual() ? item.asText().trim() : text(item, "name");
            if (name != null && !name.isEmpty()) {
                out.add(name);
            }
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Iterable<JsonNode> iterable(JsonNode array) {
        return array != null && array.isArray() ? array : List.of();
    }
}
