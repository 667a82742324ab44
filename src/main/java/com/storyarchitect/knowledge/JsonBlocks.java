package com.storyarchitect.knowledge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates JSON inside model output: fenced code blocks, or the whole text
 * when the model answered with bare JSON.
 */
public final class JsonBlocks {

    private static final Pattern FENCE = Pattern.compile("```([A-Za-z0-9_-]*)[ \\t]*\\r?\\n(.*?)```", Pattern.DOTALL);

    private JsonBlocks() {
    }

    public static final class Block {
        private final String tag;
        private final String body;
        private final int start;

        Block(String tag, String body, int start) {
            this.tag = tag;
            this.body = body;
            this.start = start;
        }

        public String getTag() {
            return tag;
        }

        public String getBody() {
            return body;
        }

        public int getStart() {
            return start;
        }
    }

    public static List<Block> fencedBlocks(String text) {
        List<Block> blocks = new ArrayList<>();
        if (text == null) {
            return blocks;
        }
        Matcher matcher = FENCE.matcher(text);
        while (matcher.find()) {
            blocks.add(new Block(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2).trim(), matcher.start()));
        }
        return blocks;
    }

    /**
     * Parse the text as a JSON object, unwrapping a single surrounding code fence.
     * Returns null when the text is not a JSON object.
     */
    public static JsonNode parseObject(ObjectMapper mapper, String text) {
        if (text == null) {
            return null;
        }
        String trimmed = unwrapFence(text.trim());
        int first = trimmed.indexOf('{');
        int last = trimmed.lastIndexOf('}');
        if (first < 0 || last <= first) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(trimmed.substring(first, last + 1));
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public static String unwrapFence(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        if (firstNewline < 0) {
            return trimmed;
        }
        String body = trimmed.substring(firstNewline + 1);
        if (body.endsWith("```")) {
            body = body.substring(0, body.length() - 3);
        }
        return body.trim();
    }

    /**
     * The text with every fenced block tagged {@code tag} removed.
     */
    public static String withoutBlocks(String text, String tag) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        Matcher matcher = FENCE.matcher(text);
        int last = 0;
        while (matcher.find()) {
            if (tag.equalsIgnoreCase(matcher.group(1))) {
                out.append(text, last, matcher.start());
                last = matcher.end();
            }
        }
        out.append(text.substring(last));
        return out.toString().trim();
    }
}
