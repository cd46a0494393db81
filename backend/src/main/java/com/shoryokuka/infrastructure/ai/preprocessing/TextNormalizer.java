package com.shoryokuka.infrastructure.ai.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans text returned by the generation backend before it is put into a slot:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Markdown code fences and leading labels removed
 * - Blank lines collapsed, since a slot is a single paragraph
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");

    // "書き直し:" / "修正後：" style label on the first line
    private static final Pattern LEADING_LABEL = Pattern.compile("^(書き直し|修正後|出力|回答)\\s*[:：]\\s*");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]{2,}");

    private static final Pattern BLANK_LINES = Pattern.compile("\\n(?:[ \\t\\u3000]*\\n)+");

    /**
     * Normalize backend output.
     *
     * @param text raw backend output
     * @return normalized single-paragraph text
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = result.replace("\r\n", "\n").replace("\r", "\n");
        result = result.strip();
        result = CODE_FENCE.matcher(result).replaceAll("");
        result = LEADING_LABEL.matcher(result.strip()).replaceFirst("");
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        result = BLANK_LINES.matcher(result).replaceAll("\n");

        return result.strip();
    }
}
