package com.bizplanner.orchestrator.rules;

import com.bizplanner.orchestrator.exception.FormulaEvaluationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Arithmetic over named numeric answers, e.g. {@code (capital_needed / equity_dilution) * 100}.
 *
 * <p>Grammar:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/') factor)*
 * factor     := ('+' | '-') factor | number | identifier | '(' expression ')'
 * </pre>
 * Identifiers resolve only to {@link Number} values; a missing or non-numeric
 * variable, a syntax error or a division by zero raises
 * {@link FormulaEvaluationException}. Nothing else is evaluated.
 *
 * @since 2.0.0
 */
public class FormulaEvaluator {

    public double evaluate(String formula, Map<String, ?> variables) {
        Parser parser = new Parser(formula, tokenize(formula), variables);
        double result = parser.parseExpression();
        parser.expectEnd();
        return result;
    }

    /**
     * Checks syntax only; used when rules are loaded.
     */
    public void validate(String formula) {
        Parser parser = new Parser(formula, tokenize(formula), null);
        parser.parseExpression();
        parser.expectEnd();
    }

    public Set<String> variables(String formula) {
        Set<String> names = new LinkedHashSet<>();
        for (Token token : tokenize(formula)) {
            if (token.type == TokenType.IDENTIFIER) {
                names.add(token.text);
            }
        }
        return names;
    }

    private static List<Token> tokenize(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new FormulaEvaluationException("Empty formula", formula);
        }

        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < formula.length()) {
            char c = formula.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || c == '.') {
                int start = i;
                while (i < formula.length() && (Character.isDigit(formula.charAt(i)) || formula.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, formula.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < formula.length()
                        && (Character.isLetterOrDigit(formula.charAt(i)) || formula.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, formula.substring(start, i)));
            } else if ("+-*/()".indexOf(c) >= 0) {
                tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c)));
                i++;
            } else {
                throw new FormulaEvaluationException("Unexpected character '" + c + "' at " + i, formula);
            }
        }
        return tokens;
    }

    private enum TokenType { NUMBER, IDENTIFIER, SYMBOL }

    private record Token(TokenType type, String text) {
    }

    /**
     * Recursive-descent parser that evaluates while parsing. With a null
     * variable map it only checks syntax and every identifier reads as 1.
     */
    private static final class Parser {

        private final String formula;
        private final List<Token> tokens;
        private final Map<String, ?> variables;
        private int position;

        Parser(String formula, List<Token> tokens, Map<String, ?> variables) {
            this.formula = formula;
            this.tokens = tokens;
            this.variables = variables;
        }

        double parseExpression() {
            double value = parseTerm();
            while (peekSymbol("+") || peekSymbol("-")) {
                String op = tokens.get(position++).text;
                double right = parseTerm();
                value = op.equals("+") ? value + right : value - right;
            }
            return value;
        }

        double parseTerm() {
            double value = parseFactor();
            while (peekSymbol("*") || peekSymbol("/")) {
                String op = tokens.get(position++).text;
                double right = parseFactor();
                if (op.equals("*")) {
                    value = value * right;
                } else {
                    if (right == 0 && variables != null) {
                        throw new FormulaEvaluationException("Division by zero", formula);
                    }
                    value = variables == null ? value : value / right;
                }
            }
            return value;
        }

        double parseFactor() {
            if (position >= tokens.size()) {
                throw new FormulaEvaluationException("Unexpected end of formula", formula);
            }
            Token token = tokens.get(position++);
            switch (token.type) {
                case NUMBER:
                    try {
                        return Double.parseDouble(token.text);
                    } catch (NumberFormatException e) {
                        throw new FormulaEvaluationException("Malformed number '" + token.text + "'", formula);
                    }
                case IDENTIFIER:
                    return resolve(token.text);
                case SYMBOL:
                default:
                    if (token.text.equals("-")) {
                        return -parseFactor();
                    }
                    if (token.text.equals("+")) {
                        return parseFactor();
                    }
                    if (token.text.equals("(")) {
                        double value = parseExpression();
                        if (!peekSymbol(")")) {
                            throw new FormulaEvaluationException("Missing closing parenthesis", formula);
                        }
                        position++;
                        return value;
                    }
                    throw new FormulaEvaluationException("Unexpected '" + token.text + "'", formula);
            }
        }

        void expectEnd() {
            if (position < tokens.size()) {
                throw new FormulaEvaluationException("Unexpected '" + tokens.get(position).text + "'", formula);
            }
        }

        private double resolve(String name) {
            if (variables == null) {
                return 1;
            }
            Object value = variables.get(name);
            if (!(value instanceof Number)) {
                throw new FormulaEvaluationException(value == null
                        ? "Unresolved variable '" + name + "'"
                        : "Variable '" + name + "' is not numeric", formula);
            }
            return ((Number) value).doubleValue();
        }

        private boolean peekSymbol(String symbol) {
            return position < tokens.size()
                    && tokens.get(position).type == TokenType.SYMBOL
                    && tokens.get(position).text.equals(symbol);
        }
    }
}
