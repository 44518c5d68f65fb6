package com.acme.finops.fieldpath.field;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parses path expressions such as {@code resource.host}, {@code attributes['k8s.pod.name']}
 * or {@code body['a.b'].c} into a {@link Field}.
 *
 * <p>Grammar: a root keyword followed by any mix of {@code .key} and {@code ['key']} segments.
 * Bracketed keys may be quoted with single or double quotes and may contain {@code .}, {@code [}
 * and {@code ]} literally. The text is split first and the root keyword checked afterwards, so
 * syntax errors win over a wrong root.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class FieldPathParser {
    static final String NOT_A_STRING_MESSAGE = "the field is not a string";
    static final String UNCLOSED_BRACKET_MESSAGE = "found unclosed left bracket";

    private static final Set<RootKind> ANY_ROOT = EnumSet.allOf(RootKind.class);

    private FieldPathParser() {
    }

    public static ParseResult parse(String expression) {
        return parse(expression, ANY_ROOT);
    }

    public static ParseResult parse(String expression, RootKind requiredRoot) {
        return parse(expression, EnumSet.of(Objects.requireNonNull(requiredRoot, "requiredRoot")));
    }

    public static ParseResult parse(String expression, Set<RootKind> allowedRoots) {
        Objects.requireNonNull(allowedRoots, "allowedRoots");
        if (allowedRoots.isEmpty()) {
            throw new IllegalArgumentException("allowedRoots must not be empty");
        }
        if (expression == null) {
            return new ParseResult.Failure(ParseErrorCode.NOT_A_STRING, NOT_A_STRING_MESSAGE, 0);
        }

        List<String> tokens = new ArrayList<>();
        ParseResult.Failure failure = split(expression, tokens);
        if (failure != null) {
            return failure;
        }

        RootKind root = RootKind.fromKeyword(tokens.get(0));
        if (root == null || !allowedRoots.contains(root)) {
            return new ParseResult.Failure(ParseErrorCode.WRONG_ROOT, wrongRootMessage(allowedRoots), 0);
        }
        return new ParseResult.Success(new Field(root, tokens.subList(1, tokens.size())));
    }

    /**
     * Builds {@code must start with 'resource'} or, for several roots,
     * {@code must start with 'body', 'attributes', or 'resource'}.
     */
    static String wrongRootMessage(Set<RootKind> allowedRoots) {
        List<String> quoted = new ArrayList<>(allowedRoots.size());
        for (RootKind kind : RootKind.values()) {
            if (allowedRoots.contains(kind)) {
                quoted.add("'" + kind.keyword() + "'");
            }
        }
        StringBuilder sb = new StringBuilder("must start with ");
        for (int i = 0; i < quoted.size(); i++) {
            if (i > 0) {
                sb.append(quoted.size() > 2 ? ", " : " ");
                if (i == quoted.size() - 1) {
                    sb.append("or ");
                }
            }
            sb.append(quoted.get(i));
        }
        return sb.toString();
    }

    private static ParseResult.Failure split(String source, List<String> out) {
        State state = State.IN_TOKEN;
        char quote = 0;
        int tokenStart = 0;

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            switch (state) {
                case IN_TOKEN -> {
                    if (c == '.') {
                        out.add(source.substring(tokenStart, i));
                        tokenStart = i + 1;
                    } else if (c == '[') {
                        out.add(source.substring(tokenStart, i));
                        state = State.IN_BRACKET;
                    } else if (c == ']') {
                        return new ParseResult.Failure(ParseErrorCode.UNEXPECTED_RIGHT_BRACKET,
                            "found unexpected right bracket", i);
                    }
                }
                case IN_BRACKET -> {
                    if (c != '\'' && c != '"') {
                        return new ParseResult.Failure(ParseErrorCode.UNQUOTED_BRACKET_KEY,
                            "strings in brackets must be surrounded by quotes", i);
                    }
                    quote = c;
                    tokenStart = i + 1;
                    state = State.IN_QUOTE;
                }
                case IN_QUOTE -> {
                    if (c == quote) {
                        out.add(source.substring(tokenStart, i));
                        state = State.OUT_QUOTE;
                    }
                }
                case OUT_QUOTE -> {
                    if (c != ']') {
                        return new ParseResult.Failure(ParseErrorCode.TEXT_AFTER_QUOTE,
                            "found characters between closed quote and closing bracket", i);
                    }
                    state = State.OUT_BRACKET;
                }
                case OUT_BRACKET -> {
                    if (c == '.') {
                        tokenStart = i + 1;
                        state = State.IN_TOKEN;
                    } else if (c == '[') {
                        state = State.IN_BRACKET;
                    } else {
                        return new ParseResult.Failure(ParseErrorCode.MISSING_SEPARATOR,
                            "bracketed access must be followed by a dot or another bracketed access", i);
                    }
                }
            }
        }

        switch (state) {
            case IN_TOKEN -> out.add(source.substring(tokenStart));
            case IN_BRACKET, OUT_QUOTE -> {
                return new ParseResult.Failure(ParseErrorCode.UNCLOSED_BRACKET,
                    UNCLOSED_BRACKET_MESSAGE, source.length());
            }
            case IN_QUOTE -> {
                String kind = quote == '"' ? "double" : "single";
                return new ParseResult.Failure(ParseErrorCode.UNCLOSED_QUOTE,
                    UNCLOSED_BRACKET_MESSAGE + ": missing closing " + kind + " quote", source.length());
            }
            case OUT_BRACKET -> {
                // trailing bracketed key already emitted
            }
        }
        return null;
    }

    private enum State {
        IN_TOKEN,
        IN_BRACKET,
        IN_QUOTE,
        OUT_QUOTE,
        OUT_BRACKET
    }
}
