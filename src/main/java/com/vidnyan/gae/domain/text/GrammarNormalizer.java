package com.vidnyan.gae.domain.text;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes raw grammar text before any other stage sees it.
 * 
 * Comments are removed, whitespace runs collapse to one space, every definition
 * sign becomes " = " and every ';' ends its line. Quoted literals are copied
 * verbatim; a literal left open ends at its line break, which is kept. An unterminated
 * block comment is left in place so that the syntax checker reports it.
 */
@Slf4j
@Component
public class GrammarNormalizer {

    public String normalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }
        String normalized = canonicalize(stripComments(rawText));
        log.debug("Normalized {} chars to {} chars", rawText.length(), normalized.length());
        return normalized;
    }

    String stripComments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean inLiteral = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';

            if (inLiteral) {
                out.append(c);
                if (c == '"' || c == '\n' || c == '\r') {
                    inLiteral = false;
                }
                i++;
            } else if (c == '"') {
                out.append(c);
                inLiteral = true;
                i++;
            } else if (c == '/' && next == '/') {
                int end = i;
                while (end < text.length() && text.charAt(end) != '\n') {
                    end++;
                }
                i = end;
            } else if (c == '/' && next == '*') {
                int end = text.indexOf("*/", i + 2);
                if (end < 0) {
                    out.append(c);
                    i++;
                } else {
                    out.append(' ');
                    i = end + 2;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    String canonicalize(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean inLiteral = false;
        boolean pendingSpace = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (inLiteral) {
                if (c == '\n' || c == '\r') {
                    // Unterminated literal: keep the line break so the scanner closes it here too
                    inLiteral = false;
                    out.append('\n');
                    pendingSpace = false;
                    continue;
                }
                out.append(c);
                if (c == '"') {
                    inLiteral = false;
                }
                continue;
            }

            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                continue;
            }

            if (c == '=') {
                trimTrailingSpaces(out);
                out.append(" = ");
                pendingSpace = false;
                continue;
            }

            if (c == ';') {
                trimTrailingSpaces(out);
                out.append(";\n");
                pendingSpace = false;
                continue;
            }

            if (pendingSpace) {
                appendSeparator(out);
                pendingSpace = false;
            }
            out.append(c);
            if (c == '"') {
                inLiteral = true;
            }
        }
        return out.toString().strip();
    }

    private void appendSeparator(StringBuilder out) {
        if (out.length() == 0) {
            return;
        }
        char last = out.charAt(out.length() - 1);
        if (last != ' ' && last != '\n') {
            out.append(' ');
        }
    }

    private void trimTrailingSpaces(StringBuilder out) {
        while (out.length() > 0 && out.charAt(out.length() - 1) == ' ') {
            out.setLength(out.length() - 1);
        }
    }
}
