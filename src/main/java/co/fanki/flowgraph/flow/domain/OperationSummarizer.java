package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;

import java.util.Locale;

/**
 * Renders raw operations into short human-readable summaries.
 *
 * <p>The summary of each kind is built from the structured details of the
 * raw operation. When a detail is absent the summarizer reads what it
 * needs from the source text instead, so a front end that only reports
 * kinds and text still gets useful labels.</p>
 *
 * <p>Examples: {@code total = total + item}, {@code var count},
 * {@code Process(,)}, {@code return result}, {@code ? x > 0},
 * {@code foreach loop}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class OperationSummarizer {

    /**
     * Maps a raw operation into a domain operation with its summary.
     *
     * @param raw the raw operation
     * @return the domain operation, never null
     */
    public Operation summarize(final RawOperation raw) {
        Preconditions.requireNonNull(raw, "Raw operation is required");

        final OperationKind kind = OperationKind.fromString(raw.kind());
        return Operation.of(kind, raw.sourceText(), summary(kind, raw),
                raw.location());
    }

    /**
     * Renders the condition a block branches on.
     *
     * @param branchValue the raw branch value, may be null
     * @return the branch information, or null when the block does not
     *         branch
     */
    public BranchInfo summarizeBranch(final RawBranchValue branchValue) {
        if (branchValue == null) {
            return null;
        }
        return new BranchInfo(
                stripTerminator(branchValue.conditionText()),
                BranchType.fromString(branchValue.branchType()));
    }

    String summary(final OperationKind kind, final RawOperation raw) {
        return switch (kind) {
            case ASSIGNMENT -> assignment(raw);
            case VARIABLE_DECLARATION -> "var " + declaredName(raw);
            case INVOCATION -> invocation(raw);
            case RETURN -> returnValue(raw);
            case CONDITIONAL -> "? " + orText(raw.detail(RawOperation.CONDITION),
                    raw);
            case BINARY_OPERATOR -> binaryOperator(raw);
            case LOOP -> loop(raw);
            case ARRAY_ELEMENT_REFERENCE, PROPERTY_REFERENCE, THROW, OTHER ->
                    fallback(kind, raw);
        };
    }

    // -- per kind ----------------------------------------------------------

    private String assignment(final RawOperation raw) {
        String target = raw.detail(RawOperation.TARGET);
        String value = raw.detail(RawOperation.VALUE);

        if (target == null || value == null) {
            final String text = stripTerminator(raw.sourceText());
            final int equals = assignmentOperator(text);
            if (equals < 0) {
                return fallback(OperationKind.ASSIGNMENT, raw);
            }
            if (target == null) {
                target = text.substring(0, equals).trim();
            }
            if (value == null) {
                value = text.substring(equals + 1).trim();
            }
        }
        return target + " = " + value;
    }

    private String declaredName(final RawOperation raw) {
        final String variable = raw.detail(RawOperation.VARIABLE);
        if (variable != null) {
            return variable;
        }
        String text = stripTerminator(raw.sourceText());
        final int equals = assignmentOperator(text);
        if (equals >= 0) {
            text = text.substring(0, equals).trim();
        }
        final int space = text.lastIndexOf(' ');
        return space < 0 ? text : text.substring(space + 1);
    }

    private String invocation(final RawOperation raw) {
        final String text = stripTerminator(raw.sourceText());
        final int open = text.indexOf('(');

        String method = raw.detail(RawOperation.METHOD);
        if (method == null) {
            method = open < 0 ? text : text.substring(0, open).trim();
        }

        int arguments = parseCount(raw.detail(RawOperation.ARGUMENT_COUNT));
        if (arguments < 0) {
            arguments = open < 0 ? 0 : countArguments(text.substring(open));
        }
        return method + "(" + ",".repeat(Math.max(0, arguments - 1)) + ")";
    }

    private String returnValue(final RawOperation raw) {
        String value = raw.detail(RawOperation.VALUE);
        if (value == null) {
            final String text = stripTerminator(raw.sourceText());
            value = text.startsWith("return")
                    ? text.substring("return".length()).trim()
                    : text;
        }
        return value.isEmpty() ? "return" : "return " + value;
    }

    private String binaryOperator(final RawOperation raw) {
        final String left = raw.detail(RawOperation.LEFT);
        final String operator = raw.detail(RawOperation.OPERATOR);
        final String right = raw.detail(RawOperation.RIGHT);
        if (left == null || operator == null || right == null) {
            return fallback(OperationKind.BINARY_OPERATOR, raw);
        }
        return left + " " + operator + " " + right;
    }

    private String loop(final RawOperation raw) {
        String flavour = raw.detail(RawOperation.LOOP_KIND);
        if (flavour == null) {
            final String text = raw.sourceText().trim();
            if (text.startsWith("foreach")) {
                flavour = "foreach";
            } else if (text.startsWith("for")) {
                flavour = "for";
            } else if (text.startsWith("while") || text.startsWith("do")) {
                flavour = "while";
            } else {
                flavour = "";
            }
        }
        return switch (flavour.toLowerCase(Locale.ROOT)) {
            case "for" -> "for loop";
            case "foreach" -> "foreach loop";
            case "while", "dowhile" -> "while loop";
            default -> "loop";
        };
    }

    private String fallback(final OperationKind kind, final RawOperation raw) {
        final String text = raw.sourceText().trim();
        return text.isEmpty() ? kind.displayName() : text;
    }

    // -- text helpers ------------------------------------------------------

    private String orText(final String detail, final RawOperation raw) {
        return detail != null ? detail : stripTerminator(raw.sourceText());
    }

    private static String stripTerminator(final String text) {
        if (text == null) {
            return "";
        }
        final String trimmed = text.trim();
        return trimmed.endsWith(";")
                ? trimmed.substring(0, trimmed.length() - 1).trim()
                : trimmed;
    }

    /** Position of the first '=' that is not part of ==, !=, <= or >=. */
    private static int assignmentOperator(final String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != '=') {
                continue;
            }
            final char before = i > 0 ? text.charAt(i - 1) : ' ';
            final char after = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
            if (after == '=' || before == '=' || before == '!'
                    || before == '<' || before == '>') {
                continue;
            }
            return i;
        }
        return -1;
    }

    private static int parseCount(final String value) {
        if (value == null || value.isBlank()) {
            return -1;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            return -1;
        }
    }

    /** Counts top-level arguments in a text starting at the open paren. */
    private static int countArguments(final String parenthesized) {
        int depth = 0;
        int commas = 0;
        boolean content = false;
        for (int i = 0; i < parenthesized.length(); i++) {
            final char c = parenthesized.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
                if (depth == 1) {
                    continue;
                }
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (c == ',' && depth == 1) {
                commas++;
            }
            if (depth >= 1 && !Character.isWhitespace(c)) {
                content = true;
            }
        }
        return content ? commas + 1 : 0;
    }

}
