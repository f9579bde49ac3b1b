package com.hooktide.service;

import com.hooktide.exception.InvalidConditionException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles and evaluates filter expressions against a webhook.
 *
 * Supported expressions:
 *   - "body.action == 'opened'"                    → equality (string form)
 *   - "body.action != 'closed'"                    → inequality
 *   - "body.pull_request.number > 100"             → numeric >, >=, <, <=
 *   - "body.comment.body =~ '^/recheck'"           → regex find
 *   - "body.action in ['opened', 'reopened']"      → membership
 *   - "body.pull_request.merged"                   → truthy (present, not false, not empty)
 *   - "header.X-GitHub-Event == 'push'"            → request header, case-insensitive
 *   - "body.ref =~ $trackedBranches"               → per-provider variable
 *   - "a && (b || !c)"                             → boolean composition
 *   - null or empty string                         → always matches (catch-all)
 *
 * Numeric path segments index into lists: "body.commits.0.id".
 *
 * Expressions are compiled once into an immutable tree (see {@link Condition}).
 * A comparison whose left side is missing from the payload is false, except
 * against the literal null.
 */
@Component
public class ConditionEvaluator {

    /**
     * Compile an expression, resolving $variables from the given map.
     *
     * @throws InvalidConditionException if the expression cannot be parsed
     */
    public Condition compile(String expression, Map<String, String> variables) {
        if (expression == null || expression.isBlank()) {
            return new Condition("", (body, headers) -> true);
        }
        Parser parser = new Parser(tokenize(expression), variables == null ? Map.of() : variables, expression);
        Node root = parser.parseExpression();
        parser.expectEnd();
        return new Condition(expression.trim(), root);
    }

    // --- Evaluation tree ---

    @FunctionalInterface
    interface Node {
        boolean test(Map<String, Object> body, Map<String, String> headers);
    }

    private interface Operand {
        Object resolve(Map<String, Object> body, Map<String, String> headers);
    }

    private record Literal(Object value) implements Operand {
        @Override
        public Object resolve(Map<String, Object> body, Map<String, String> headers) {
            return value;
        }
    }

    private record BodyPath(String[] segments) implements Operand {
        @Override
        public Object resolve(Map<String, Object> body, Map<String, String> headers) {
            Object current = body;
            for (String key : segments) {
                if (current instanceof Map<?, ?> map) {
                    current = map.get(key);
                } else if (current instanceof List<?> list && isIndex(key)) {
                    int index = Integer.parseInt(key);
                    current = index < list.size() ? list.get(index) : null;
                } else {
                    return null;
                }
            }
            return current;
        }

        private static boolean isIndex(String key) {
            return !key.isEmpty() && key.chars().allMatch(Character::isDigit);
        }
    }

    private record HeaderRef(String name) implements Operand {
        @Override
        public Object resolve(Map<String, Object> body, Map<String, String> headers) {
            String value = headers.get(name);
            if (value != null) {
                return value;
            }
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    return entry.getValue();
                }
            }
            return null;
        }
    }

    private static boolean truthy(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        }
        if (value instanceof String s) {
            return !s.isEmpty() && !"false".equalsIgnoreCase(s);
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    private static Node comparison(Operand left, String operator, Operand right, String source) {
        if ("=~".equals(operator)) {
            if (!(right instanceof Literal literal) || literal.value() == null) {
                throw new InvalidConditionException("Right side of =~ must be a pattern literal: " + source);
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(literal.value().toString());
            } catch (PatternSyntaxException e) {
                throw new InvalidConditionException("Invalid pattern in condition: " + source, e);
            }
            return (body, headers) -> {
                Object actual = left.resolve(body, headers);
                return actual != null && pattern.matcher(actual.toString()).find();
            };
        }
        return (body, headers) -> {
            Object actual = left.resolve(body, headers);
            Object expected = right.resolve(body, headers);
            if (expected == null) {
                return switch (operator) {
                    case "==" -> actual == null;
                    case "!=" -> actual != null;
                    default -> false;
                };
            }
            if (actual == null) {
                return false;
            }
            return compare(actual, expected, operator);
        };
    }

    private static boolean compare(Object actual, Object expected, String operator) {
        return switch (operator) {
            case "==" -> actual.toString().equals(expected.toString());
            case "!=" -> !actual.toString().equals(expected.toString());
            case ">", ">=", "<", "<=" -> compareNumeric(actual, expected, operator);
            default -> false;
        };
    }

    private static boolean compareNumeric(Object actual, Object expected, String operator) {
        try {
            double a = Double.parseDouble(actual.toString());
            double e = Double.parseDouble(expected.toString());
            return switch (operator) {
                case ">" -> a > e;
                case ">=" -> a >= e;
                case "<" -> a < e;
                case "<=" -> a <= e;
                default -> false;
            };
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    // --- Tokenizer ---

    private enum TokenType { LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, AND, OR, NOT, OP, IN, STRING, NUMBER, IDENT, VAR, END }

    private record Token(TokenType type, String text, int position) {
    }

    private static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            switch (c) {
                case '(' -> { tokens.add(new Token(TokenType.LPAREN, "(", start)); i++; }
                case ')' -> { tokens.add(new Token(TokenType.RPAREN, ")", start)); i++; }
                case '[' -> { tokens.add(new Token(TokenType.LBRACKET, "[", start)); i++; }
                case ']' -> { tokens.add(new Token(TokenType.RBRACKET, "]", start)); i++; }
                case ',' -> { tokens.add(new Token(TokenType.COMMA, ",", start)); i++; }
                case '&', '|' -> {
                    if (i + 1 >= input.length() || input.charAt(i + 1) != c) {
                        throw new InvalidConditionException("Expected '" + c + c + "' at " + start + ": " + input);
                    }
                    tokens.add(new Token(c == '&' ? TokenType.AND : TokenType.OR, c == '&' ? "&&" : "||", start));
                    i += 2;
                }
                case '!' -> {
                    if (i + 1 < input.length() && input.charAt(i + 1) == '=') {
                        tokens.add(new Token(TokenType.OP, "!=", start));
                        i += 2;
                    } else {
                        tokens.add(new Token(TokenType.NOT, "!", start));
                        i++;
                    }
                }
                case '=' -> {
                    char next = i + 1 < input.length() ? input.charAt(i + 1) : ' ';
                    if (next != '=' && next != '~') {
                        throw new InvalidConditionException("Unknown operator at " + start + ": " + input);
                    }
                    tokens.add(new Token(TokenType.OP, "=" + next, start));
                    i += 2;
                }
                case '>', '<' -> {
                    if (i + 1 < input.length() && input.charAt(i + 1) == '=') {
                        tokens.add(new Token(TokenType.OP, c + "=", start));
                        i += 2;
                    } else {
                        tokens.add(new Token(TokenType.OP, String.valueOf(c), start));
                        i++;
                    }
                }
                case '\'', '"' -> i = readString(input, i, tokens);
                case '$' -> {
                    i++;
                    while (i < input.length() && isIdentPart(input.charAt(i))) {
                        i++;
                    }
                    if (i == start + 1) {
                        throw new InvalidConditionException("Empty variable name at " + start + ": " + input);
                    }
                    tokens.add(new Token(TokenType.VAR, input.substring(start + 1, i), start));
                }
                default -> {
                    if (Character.isDigit(c) || (c == '-' && i + 1 < input.length() && Character.isDigit(input.charAt(i + 1)))) {
                        i++;
                        while (i < input.length() && (Character.isDigit(input.charAt(i)) || input.charAt(i) == '.')) {
                            i++;
                        }
                        tokens.add(new Token(TokenType.NUMBER, input.substring(start, i), start));
                    } else if (Character.isLetter(c) || c == '_') {
                        while (i < input.length() && isIdentPart(input.charAt(i))) {
                            i++;
                        }
                        String word = input.substring(start, i);
                        tokens.add(new Token("in".equals(word) ? TokenType.IN : TokenType.IDENT, word, start));
                    } else {
                        throw new InvalidConditionException("Unexpected character '" + c + "' at " + start + ": " + input);
                    }
                }
            }
        }
        tokens.add(new Token(TokenType.END, "", input.length()));
        return tokens;
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }

    // Backslash only escapes the quote character; anything else (regex escapes) is kept as-is.
    private static int readString(String input, int start, List<Token> tokens) {
        char quote = input.charAt(start);
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\' && i + 1 < input.length() && input.charAt(i + 1) == quote) {
                value.append(quote);
                i += 2;
            } else if (c == quote) {
                tokens.add(new Token(TokenType.STRING, value.toString(), start));
                return i + 1;
            } else {
                value.append(c);
                i++;
            }
        }
        throw new InvalidConditionException("Unterminated string at " + start + ": " + input);
    }

    // --- Recursive-descent parser ---

    private static final class Parser {

        private final List<Token> tokens;
        private final Map<String, String> variables;
        private final String source;
        private int pos;

        Parser(List<Token> tokens, Map<String, String> variables, String source) {
            this.tokens = tokens;
            this.variables = variables;
            this.source = source;
        }

        Node parseExpression() {
            List<Node> terms = new ArrayList<>();
            terms.add(parseAnd());
            while (peek().type() == TokenType.OR) {
                pos++;
                terms.add(parseAnd());
            }
            if (terms.size() == 1) {
                return terms.get(0);
            }
            List<Node> any = List.copyOf(terms);
            return (body, headers) -> {
                for (Node node : any) {
                    if (node.test(body, headers)) {
                        return true;
                    }
                }
                return false;
            };
        }

        private Node parseAnd() {
            List<Node> terms = new ArrayList<>();
            terms.add(parseUnary());
            while (peek().type() == TokenType.AND) {
                pos++;
                terms.add(parseUnary());
            }
            if (terms.size() == 1) {
                return terms.get(0);
            }
            List<Node> all = List.copyOf(terms);
            return (body, headers) -> {
                for (Node node : all) {
                    if (!node.test(body, headers)) {
                        return false;
                    }
                }
                return true;
            };
        }

        private Node parseUnary() {
            if (peek().type() == TokenType.NOT) {
                pos++;
                Node inner = parseUnary();
                return (body, headers) -> !inner.test(body, headers);
            }
            if (peek().type() == TokenType.LPAREN) {
                pos++;
                Node inner = parseExpression();
                expect(TokenType.RPAREN);
                return inner;
            }
            return parseComparison();
        }

        private Node parseComparison() {
            Operand left = parseOperand();
            Token next = peek();
            if (next.type() == TokenType.OP) {
                pos++;
                Operand right = parseOperand();
                return comparison(left, next.text(), right, source);
            }
            if (next.type() == TokenType.IN) {
                pos++;
                List<Operand> options = parseList();
                return (body, headers) -> {
                    Object actual = left.resolve(body, headers);
                    if (actual == null) {
                        return false;
                    }
                    for (Operand option : options) {
                        Object candidate = option.resolve(body, headers);
                        if (candidate != null && actual.toString().equals(candidate.toString())) {
                            return true;
                        }
                    }
                    return false;
                };
            }
            return (body, headers) -> truthy(left.resolve(body, headers));
        }

        private List<Operand> parseList() {
            expect(TokenType.LBRACKET);
            List<Operand> items = new ArrayList<>();
            if (peek().type() != TokenType.RBRACKET) {
                items.add(parseOperand());
                while (peek().type() == TokenType.COMMA) {
                    pos++;
                    items.add(parseOperand());
                }
            }
            expect(TokenType.RBRACKET);
            return List.copyOf(items);
        }

        private Operand parseOperand() {
            Token token = tokens.get(pos++);
            return switch (token.type()) {
                case STRING -> new Literal(token.text());
                case NUMBER -> new Literal(parseNumber(token));
                case VAR -> {
                    String value = variables.get(token.text());
                    if (value == null) {
                        throw new InvalidConditionException("Unknown variable $" + token.text() + " in: " + source);
                    }
                    yield new Literal(value);
                }
                case IDENT -> identifier(token);
                default -> throw new InvalidConditionException(
                        "Unexpected '" + token.text() + "' at " + token.position() + ": " + source);
            };
        }

        private Operand identifier(Token token) {
            String text = token.text();
            switch (text) {
                case "true":
                    return new Literal(Boolean.TRUE);
                case "false":
                    return new Literal(Boolean.FALSE);
                case "null":
                    return new Literal(null);
                default:
                    break;
            }
            if (text.startsWith("body.") && text.length() > "body.".length()) {
                return new BodyPath(text.substring("body.".length()).split("\\."));
            }
            if (text.startsWith("header.") && text.length() > "header.".length()) {
                return new HeaderRef(text.substring("header.".length()));
            }
            throw new InvalidConditionException(
                    "Unknown reference '" + text + "' (expected body.* or header.*) in: " + source);
        }

        private Object parseNumber(Token token) {
            try {
                if (token.text().contains(".")) {
                    return Double.parseDouble(token.text());
                }
                return Long.parseLong(token.text());
            } catch (NumberFormatException e) {
                throw new InvalidConditionException("Invalid number '" + token.text() + "' in: " + source, e);
            }
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private void expect(TokenType type) {
            Token token = tokens.get(pos);
            if (token.type() != type) {
                throw new InvalidConditionException(
                        "Expected " + type + " at " + token.position() + " but found '" + token.text() + "': " + source);
            }
            pos++;
        }

        void expectEnd() {
            expect(TokenType.END);
        }
    }
}
