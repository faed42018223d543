package com.monolith.maven.template.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses template text into a {@link Template}.
 * <p>
 * Syntax:
 * <pre>
 * {{ path.to.value | default:'fallback' }}
 * {%1 if cond %} ... {%1 elseif cond %} ... {%1 else %} ... {%1 endif %}
 * {%2 for item in items %} ... {%2 endfor %}
 * </pre>
 * The number after {@code {%} is the block id. An opening tag pairs with the closing
 * tag of the same id and kind at its nesting level inside the enclosing body, and
 * {@code elseif}/{@code else} tags of that id split the body into branches. Nested
 * groups are matched as a whole before branch tags are looked for, so an inner group's
 * tags never split an outer one.
 * <p>
 * Tags that do not pair up are not an error: they stay in the output as literal text.
 */
public final class TemplateParser {

    // Opening tag: id, keyword (if|for), argument
    private static final String OPENING_TAG = "\\{%(\\d+)\\s+(if|for)\\s+((?s:.*?))\\s*%\\}";

    private static final Pattern OPENING = Pattern.compile(OPENING_TAG);

    // Opening tag (groups 1-3) or variable (group 4)
    private static final Pattern DIRECTIVE = Pattern.compile(
            OPENING_TAG + "|\\{\\{\\s*(.*?)\\s*\\}\\}");

    private static final Pattern FOR_HEAD = Pattern.compile("(\\w+)\\s+in\\s+(.+)", Pattern.DOTALL);

    private TemplateParser() {
    }

    public static Template parse(String source) {
        String src = source == null ? "" : source;
        return new Template(parseRange(src, 0, src.length()));
    }

    private static List<Node> parseRange(String src, int start, int end) {
        List<Node> nodes = new ArrayList<>();
        Matcher matcher = DIRECTIVE.matcher(src);
        int textStart = start;
        int pos = start;

        while (pos < end) {
            matcher.region(pos, end);
            if (!matcher.find()) {
                break;
            }

            if (matcher.group(4) != null) {
                addText(nodes, src, textStart, matcher.start());
                nodes.add(new VariableNode(matcher.group(4)));
                pos = textStart = matcher.end();
                continue;
            }

            int closeStart = findClosing(src, matcher, end);
            if (closeStart < 0) {
                // Unpaired opening tag is kept as text
                pos = matcher.end();
                continue;
            }

            addText(nodes, src, textStart, matcher.start());
            String id = matcher.group(1);
            if ("if".equals(matcher.group(2))) {
                nodes.add(parseIf(src, id, matcher.group(3), matcher.end(), closeStart));
            } else {
                Matcher head = FOR_HEAD.matcher(matcher.group(3));
                head.matches();
                nodes.add(new ForNode(head.group(1), head.group(2),
                        parseRange(src, matcher.end(), closeStart)));
            }
            pos = textStart = closingEnd(src, matcher, closeStart);
        }

        addText(nodes, src, textStart, end);
        return nodes;
    }

    private static IfNode parseIf(String src, String id, String condition, int bodyStart, int bodyEnd) {
        Pattern branchTag = Pattern.compile(
                "\\{%" + id + "\\s+(?:(elseif)\\s+((?s:.*?))\\s*|else\\s*)%\\}");

        List<IfNode.Branch> branches = new ArrayList<>();
        String branchCondition = condition.trim();
        int segmentStart = bodyStart;
        int pos = bodyStart;

        while (true) {
            Matcher tag = nextBranchTag(src, branchTag, pos, bodyEnd);
            if (tag == null) {
                break;
            }
            branches.add(new IfNode.Branch(branchCondition, parseRange(src, segmentStart, tag.start())));
            branchCondition = tag.group(1) != null ? tag.group(2).trim() : null;
            segmentStart = pos = tag.end();
        }
        branches.add(new IfNode.Branch(branchCondition, parseRange(src, segmentStart, bodyEnd)));

        return new IfNode(branches);
    }

    /**
     * Finds the next branch tag that is not inside a nested group.
     */
    private static Matcher nextBranchTag(String src, Pattern branchTag, int start, int end) {
        Matcher tag = branchTag.matcher(src);
        Matcher opening = OPENING.matcher(src);
        int pos = start;

        while (pos < end) {
            tag.region(pos, end);
            if (!tag.find()) {
                return null;
            }
            opening.region(pos, end);
            if (!opening.find() || opening.start() > tag.start()) {
                return tag;
            }
            int closeStart = findClosing(src, opening, end);
            pos = closeStart < 0 ? opening.end() : closingEnd(src, opening, closeStart);
        }
        return null;
    }

    /**
     * Returns the start of the closing tag paired with the opening tag the matcher is on,
     * or -1 when the group is not well-formed.
     * <p>
     * Openings of the same id and kind nest: each one has to be closed before the outer
     * group can be. When the tags do not balance, the first closing tag is used.
     */
    private static int findClosing(String src, Matcher opening, int end) {
        if ("for".equals(opening.group(2)) && !FOR_HEAD.matcher(opening.group(3)).matches()) {
            return -1;
        }
        String keyword = opening.group(2);
        Matcher tag = Pattern.compile("\\{%" + opening.group(1) + "\\s+(?:(" + keyword
                + ")\\s+(?s:.*?)\\s*|end" + keyword + "\\s*)%\\}").matcher(src);
        tag.region(opening.end(), end);

        int depth = 1;
        int firstClosing = -1;
        while (tag.find()) {
            if (tag.group(1) != null) {
                depth++;
                continue;
            }
            if (firstClosing < 0) {
                firstClosing = tag.start();
            }
            if (--depth == 0) {
                return tag.start();
            }
        }
        return firstClosing;
    }

    private static int closingEnd(String src, Matcher opening, int closeStart) {
        Matcher closing = closingTag(opening).matcher(src);
        closing.region(closeStart, src.length());
        closing.lookingAt();
        return closing.end();
    }

    private static Pattern closingTag(Matcher opening) {
        String keyword = "if".equals(opening.group(2)) ? "endif" : "endfor";
        return Pattern.compile("\\{%" + opening.group(1) + "\\s+" + keyword + "\\s*%\\}");
    }

    private static void addText(List<Node> nodes, String src, int start, int end) {
        if (end > start) {
            nodes.add(new TextNode(src.substring(start, end)));
        }
    }
}
