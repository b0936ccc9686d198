package com.formula.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A render template parsed into literal text and placeholder segments.
 * <p>
 * Placeholders:
 * <ul>
 *   <li>{@code {{autoindent}}}: indentation for the token, empty when the token does not start a line</li>
 *   <li>{@code {{token}}}: the token text</li>
 *   <li>{@code {{autolinebreak}}}: the newline string when the next token is an argument separator</li>
 * </ul>
 */
public final class Template {

    public static final String AUTO_INDENT = "{{autoindent}}";
    public static final String TOKEN = "{{token}}";
    public static final String AUTO_LINE_BREAK = "{{autolinebreak}}";

    public enum Kind {
        LITERAL,
        AUTO_INDENT,
        TOKEN,
        AUTO_LINE_BREAK
    }

    /**
     * @param kind Segment kind
     * @param text Literal text, empty for placeholders
     */
    public record Segment(Kind kind, String text) {
    }

    private final String source;
    private final List<Segment> segments;

    private Template(String source, List<Segment> segments) {
        this.source = source;
        this.segments = List.copyOf(segments);
    }

    public static Template parse(String source) {
        Objects.requireNonNull(source, "source");
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int pos = 0;

        while (pos < source.length()) {
            Kind placeholder = placeholderAt(source, pos);
            if (placeholder == null) {
                literal.append(source.charAt(pos++));
                continue;
            }
            if (literal.length() > 0) {
                segments.add(new Segment(Kind.LITERAL, literal.toString()));
                literal.setLength(0);
            }
            segments.add(new Segment(placeholder, ""));
            pos += placeholderText(placeholder).length();
        }
        if (literal.length() > 0) {
            segments.add(new Segment(Kind.LITERAL, literal.toString()));
        }
        return new Template(source, segments);
    }

    /**
     * Apply the template to one token.
     */
    public String apply(String indent, String token, String lineBreak) {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            switch (segment.kind()) {
                case LITERAL -> sb.append(segment.text());
                case AUTO_INDENT -> sb.append(indent);
                case TOKEN -> sb.append(token);
                case AUTO_LINE_BREAK -> sb.append(lineBreak);
            }
        }
        return sb.toString();
    }

    public List<Segment> segments() {
        return segments;
    }

    public String source() {
        return source;
    }

    private static Kind placeholderAt(String source, int pos) {
        for (Kind kind : List.of(Kind.AUTO_INDENT, Kind.TOKEN, Kind.AUTO_LINE_BREAK)) {
            if (source.startsWith(placeholderText(kind), pos)) {
                return kind;
            }
        }
        return null;
    }

    private static String placeholderText(Kind kind) {
        return switch (kind) {
            case AUTO_INDENT -> AUTO_INDENT;
            case TOKEN -> TOKEN;
            case AUTO_LINE_BREAK -> AUTO_LINE_BREAK;
            case LITERAL -> throw new IllegalArgumentException("Literal has no placeholder text");
        };
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Template other && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return "Template(" + source + ")";
    }
}
