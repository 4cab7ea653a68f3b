package com.eainde.research.nodes;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers for reading free-text model answers.
 */
final class ModelAnswers {

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)]|#+)\\s*");

    private ModelAnswers() {
    }

    /**
     * Splits the answer into lines, strips bullet and numbering markers and
     * drops blank lines.
     */
    static List<String> listItems(String answer) {
        List<String> items = new ArrayList<>();
        if (answer == null) {
            return items;
        }
        for (String line : answer.split("\\R")) {
            String item = LIST_MARKER.matcher(line).replaceFirst("").trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    /**
     * Strips markdown code fences and anything around the outermost JSON object.
     */
    static String cleanJson(String answer) {
        String cleaned = answer.replace("```json", "").replace("```", "").trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        return start >= 0 && end > start ? cleaned.substring(start, end + 1) : cleaned;
    }

    /**
     * @return the trimmed answer
     * @throws ResearchPipelineException {@link ErrorKind#MALFORMED_RESPONSE} if the answer is blank
     */
    static String requireText(String step, String answer) {
        if (answer == null || answer.isBlank()) {
            throw new ResearchPipelineException(ErrorKind.MALFORMED_RESPONSE,
                    "Model returned a blank answer for " + step);
        }
        return answer.trim();
    }
}
