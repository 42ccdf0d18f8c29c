package com.deepansh.orchestrator.agent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a labelled model reply ("SUBTASKS:", "ANSWER:", ...) into sections.
 *
 * Lines are stripped; blank lines are dropped. Text after the colon on a
 * label line becomes the first line of that section. Lines before the
 * first label belong to no section.
 */
final class SectionParser {

    static final int MIN_ITEM_LENGTH = 6;

    private static final Pattern LIST_ITEM = Pattern.compile("^(?:\\d+\\s*[.)]?|[-*•])\\s*(.*)$");

    private SectionParser() {
    }

    /**
     * @param labels label prefix (upper case, with colon) to section key;
     *               several prefixes may map to one key
     */
    static Map<String, List<String>> parse(String response, Map<String, String> labels) {
        Map<String, List<String>> sections = new LinkedHashMap<>();
        labels.values().forEach(key -> sections.putIfAbsent(key, new ArrayList<>()));

        List<String> current = null;
        for (String raw : response.strip().split("\\R")) {
            String line = raw.strip();
            String upper = line.toUpperCase(Locale.ROOT);

            Optional<Map.Entry<String, String>> label = labels.entrySet().stream()
                    .filter(e -> upper.startsWith(e.getKey()))
                    .findFirst();

            if (label.isPresent()) {
                current = sections.get(label.get().getValue());
                String rest = line.substring(label.get().getKey().length()).strip();
                if (!rest.isEmpty()) {
                    current.add(rest);
                }
                continue;
            }

            if (current != null && !line.isEmpty()) {
                current.add(line);
            }
        }
        return sections;
    }

    /**
     * Numbered or bulleted lines with the marker removed. Unmarked lines and
     * items shorter than {@value #MIN_ITEM_LENGTH} characters are skipped.
     */
    static List<String> listItems(List<String> lines) {
        List<String> items = new ArrayList<>();
        for (String line : lines) {
            Matcher m = LIST_ITEM.matcher(line);
            if (!m.matches()) {
                continue;
            }
            String item = m.group(1).strip();
            if (item.length() >= MIN_ITEM_LENGTH) {
                items.add(item);
            }
        }
        return items;
    }
}
