package com.example.reqbot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans raw page text extracted from a PDF before segmentation.
 * <p>
 * The steps run in a fixed order: hyphenation repair, footer stripping, character normalization,
 * whitespace collapsing and blank-line folding. Never throws; on an unexpected failure the input is
 * returned unchanged.
 */
@Service
public class TextPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(TextPreprocessor.class);

    private static final Pattern HYPHENATED_BREAK = Pattern.compile("(\\w+)-[ \\t]*\\r?\\n\\s*(\\w+)",
            Pattern.UNICODE_CHARACTER_CLASS);

    private static final List<Pattern> FOOTER_LINES = List.of(
            Pattern.compile("(?i)^\\s*page\\s+\\d+\\s*(of|/)\\s*\\d+\\s*$"),
            Pattern.compile("(?i)^\\s*page\\s+\\d+\\s*$"),
            Pattern.compile("^\\s*\\d+\\s*/\\s*\\d+\\s*$"),
            Pattern.compile("^\\s*[-\u2013\u2014]\\s*\\d+\\s*[-\u2013\u2014]\\s*$"),
            Pattern.compile("^\\s*\\d+\\s*$"),
            Pattern.compile("(?i)^\\s*(confidential|draft)\\s*$"));

    private static final Pattern INLINE_PAGE_MARKER = Pattern.compile("(?i)\\bpage\\s+\\d+\\s+of\\s+\\d+\\b");

    private static final Map<String, String> CHARACTER_MAP = Map.ofEntries(
            Map.entry("\u00A0", " "),   // no-break space
            Map.entry("\u202F", " "),   // narrow no-break space
            Map.entry("\u2009", " "),   // thin space
            Map.entry("\u2007", " "),   // figure space
            Map.entry("\u2002", " "),
            Map.entry("\u2003", " "),
            Map.entry("\u2013", "-"),   // en dash
            Map.entry("\u2014", "-"),   // em dash
            Map.entry("\u2012", "-"),   // figure dash
            Map.entry("\u2212", "-"),   // minus sign
            Map.entry("\u2018", "'"),
            Map.entry("\u2019", "'"),
            Map.entry("\u201A", "'"),
            Map.entry("\u201C", "\""),
            Map.entry("\u201D", "\""),
            Map.entry("\u201E", "\""),
            Map.entry("\u00AB", "\""),
            Map.entry("\u00BB", "\""),
            Map.entry("\uFB00", "ff"),
            Map.entry("\uFB01", "fi"),
            Map.entry("\uFB02", "fl"),
            Map.entry("\uFB03", "ffi"),
            Map.entry("\uFB04", "ffl"),
            Map.entry("\u00AD", ""),    // soft hyphen
            Map.entry("\u200B", ""),    // zero-width space
            Map.entry("\uFEFF", ""));   // byte order mark

    // C0/C1 controls except tab and line feed.
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B-\\x1F\\x7F-\\x9F]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f]+");

    public String preprocess(String text) {
        if (text == null || text.isEmpty()) return "";
        try {
            String result = joinHyphenatedWords(text.replace("\r\n", "\n").replace('\r', '\n'));
            result = stripFooters(result);
            result = normalizeCharacters(result);
            return collapseWhitespace(result);
        } catch (RuntimeException e) {
            log.warn("Text preprocessing failed ({}), using raw text", e.toString());
            return text;
        }
    }

    String joinHyphenatedWords(String text) {
        return HYPHENATED_BREAK.matcher(text).replaceAll("$1$2");
    }

    /**
     * Removes footer lines together with their line break, so text around a page number inside a
     * paragraph stays in that paragraph.
     */
    String stripFooters(String text) {
        List<String> kept = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            if (isFooter(line)) continue;
            kept.add(INLINE_PAGE_MARKER.matcher(line).replaceAll(" "));
        }
        return String.join("\n", kept);
    }

    String normalizeCharacters(String text) {
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        StringBuilder sb = new StringBuilder(result.length());
        result.codePoints().forEach(cp -> {
            String replacement = CHARACTER_MAP.get(new String(Character.toChars(cp)));
            if (replacement != null) {
                sb.append(replacement);
            } else {
                sb.appendCodePoint(cp);
            }
        });
        return CONTROL_CHARS.matcher(sb).replaceAll("");
    }

    String collapseWhitespace(String text) {
        List<String> lines = new ArrayList<>();
        boolean pendingBreak = false;
        for (String raw : text.split("\n", -1)) {
            String line = HORIZONTAL_WHITESPACE.matcher(raw).replaceAll(" ").strip();
            if (line.isEmpty()) {
                pendingBreak = !lines.isEmpty();
                continue;
            }
            if (pendingBreak) {
                lines.add("");
                pendingBreak = false;
            }
            lines.add(line);
        }
        return String.join("\n", lines);
    }

    private static boolean isFooter(String line) {
        for (Pattern footer : FOOTER_LINES) {
            if (footer.matcher(line).matches()) return true;
        }
        return false;
    }
}
