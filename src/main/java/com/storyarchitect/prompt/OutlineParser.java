package com.storyarchitect.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.knowledge.JsonBlocks;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the chapter plan out of an outline stage's text. Accepts the
 * three-act JSON outline, a flat {@code chapters} array, or markdown
 * "Chapter N: Title" headings. Unreadable text yields an empty plan.
 */
public class OutlineParser {

    private static final Pattern CHAPTER_HEADING = Pattern.compile(
        "^\\s*(?:#+\\s*)?(?:\\*\\*)?chapter\\s+(\\d+)\\s*[:.\\-]?\\s*(.*?)(?:\\*\\*)?\\s*$",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private final ObjectMapper mapper;

    public OutlineParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<ChapterPlan> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        JsonNode root = JsonBlocks.parseObject(mapper, text);
        if (root != null) {
            List<ChapterPlan> plans = fromJson(root.has("outline") ? root.get("outline") : root);
            if (!plans.isEmpty()) {
                return plans;
            }
        }
        return fromMarkdown(text);
    }

    private List<ChapterPlan> fromJson(JsonNode outline) {
        List<ChapterPlan> plans = new ArrayList<>();
        if (outline == null) {
            return plans;
        }
        if (outline.isArray() || outline.path("chapters").isArray()) {
            addChapters(outline.isArray() ? outline : outline.get("chapters"), null, plans);
            return plans;
        }
        Iterator<Map.Entry<String, JsonNode>> acts = outline.fields();
        while (acts.hasNext()) {
            Map.Entry<String, JsonNode> act = acts.next();
            JsonNode chapters = act.getValue().path("chapters");
            if (!chapters.isArray()) {
                continue;
            }
            String actTitle = act.getValue().path("title").asText(act.getKey());
            addChapters(chapters, actTitle, plans);
        }
        return plans;
    }

    private static void addChapters(JsonNode chapters, String act, List<ChapterPlan> plans) {
        for (JsonNode chapter : chapters) {
            String title = chapter.isTextual() ? chapter.asText() : chapter.path("title").asText("");
            String summary = chapter.path("summary").asText(chapter.path("description").asText(""));
            plans.add(new ChapterPlan(plans.size() + 1, title.trim(), summary.trim(), act));
        }
    }

    private static List<ChapterPlan> fromMarkdown(String text) {
        List<ChapterPlan> plans = new ArrayList<>();
        Matcher matcher = CHAPTER_HEADING.matcher(text);
        List<int[]> spans = new ArrayList<>();
        List<String> titles = new ArrayList<>();
        while (matcher.find()) {
            spans.add(new int[] {matcher.start(), matcher.end()});
            titles.add(matcher.group(2).trim());
        }
        for (int i = 0; i < spans.size(); i++) {
            int bodyEnd = i + 1 < spans.size() ? spans.get(i + 1)[0] : text.length();
            String summary = text.substring(spans.get(i)[1], bodyEnd)
                .replaceAll("(?m)^\\s*[-*]\\s*", "")
                .replaceAll("\\s+", " ")
                .trim();
            plans.add(new ChapterPlan(plans.size() + 1, titles.get(i), summary, null));
        }
        return plans;
    }
}
