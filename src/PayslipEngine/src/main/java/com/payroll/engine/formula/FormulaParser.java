package com.payroll.engine.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Single-use recursive-descent parser that evaluates while it parses.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('+' | '-') unary | primary
 * primary    := number | '{' name '}' | '(' expression ')' | function
 * function   := MAX(args) | MIN(args) | ROUND(expression) | IF(condition, expression, expression)
 * condition  := expression [('>' | '<' | '>=' | '<=' | '==' | '!=') expression]
 * </pre>
 */
class FormulaParser {

    static final int MAX_DEPTH = 100;

    private final String source;
    private final Map<String, Double> variables;
    private int pos;
    private int depth;

    FormulaParser(String source, Map<String, Double> variables) {
        this.source = source;
        this.variables = variables;
    }

    double parse() {
        double value = expression();
        skipWhitespace();
        if (pos < source.length()) {
            throw error("unexpected '" + source.charAt(pos) + "'");
        }
        return value;
    }

    private double expression() {
        double value = term();
        while (true) {
            if (accept('+')) {
                value += term();
            } else if (accept('-')) {
                value -= term();
            } else {
                return value;
            }
        }
    }

    private double term() {
        double value = unary();
        while (true) {
            if (accept('*')) {
                value *= unary();
            } else if (accept('/')) {
                double divisor = unary();
                if (divisor == 0) {
                    throw error("division by zero");
                }
                value /= divisor;
            } else {
                return value;
            }
        }
    }

    private double unary() {
        if (accept('-')) {
            enter();
            double value = -unary();
            depth--;
            return value;
        }
        if (accept('+')) {
            enter();
            double value = unary();
            depth--;
            return value;
        }
        return primary();
    }

    private double primary() {
        skipWhitespace();
        if (pos >= source.length()) {
            throw error("unexpected end of formula");
        }
        char c = source.charAt(pos);
        if (c == '(') {
            pos++;
            enter();
            double value = expression();
            expect(')');
            depth--;
            return value;
        }
        if (c == '{') {
            return variable();
        }
        if (Character.isDigit(c) || c == '.') {
            return number();
        }
        if (Character.isLetter(c)) {
            return function();
        }
        throw error("unexpected '" + c + "'");
    }

    private double variable() {
        int close = source.indexOf('}', pos);
        if (close < 0) {
            throw error("unterminated variable");
        }
        String name = source.substring(pos + 1, close).trim();
        Double value = variables.get(name);
        if (value == null) {
            throw error("undefined variable '" + name + "'");
        }
        pos = close + 1;
        return value;
    }

    private double number() {
        int start = pos;
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        String literal = source.substring(start, pos);
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            throw error("malformed number '" + literal + "'");
        }
    }

    private double function() {
        int start = pos;
        while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
            pos++;
        }
        String name = source.substring(start, pos).toUpperCase(Locale.ROOT);
        expect('(');
        enter();
        double value = switch (name) {
            case "MAX" -> arguments().stream().mapToDouble(Double::doubleValue).max().orElseThrow();
            case "MIN" -> arguments().stream().mapToDouble(Double::doubleValue).min().orElseThrow();
            case "ROUND" -> Math.floor(expression() + 0.5);
            case "IF" -> conditional();
            default -> throw error("unknown function '" + name + "'");
        };
        expect(')');
        depth--;
        return value;
    }

    private List<Double> arguments() {
        List<Double> values = new ArrayList<>();
        values.add(expression());
        while (accept(',')) {
            values.add(expression());
        }
        return values;
    }

    // Both branches are always parsed and evaluated.
    private double conditional() {
        boolean condition = condition();
        expect(',');
        double whenTrue = expression();
        expect(',');
        double whenFalse = expression();
        return condition ? whenTrue : whenFalse;
    }

    private boolean condition() {
        double left = expression();
        skipWhitespace();
        String operator = comparisonOperator();
        if (operator == null) {
            // a bare value is not a comparison; take the false branch
            return false;
        }
        double right = expression();
        return switch (operator) {
            case ">" -> left > right;
            case "<" -> left < right;
            case ">=" -> left >= right;
            case "<=" -> left <= right;
            case "==" -> left == right;
            case "!=" -> left != right;
            default -> throw error("unknown comparison '" + operator + "'");
        };
    }

    private String comparisonOperator() {
        for (String op : new String[] {">=", "<=", "==", "!=", ">", "<"}) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                return op;
            }
        }
        return null;
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("formula nested too deeply");
        }
    }

    private boolean accept(char expected) {
        skipWhitespace();
        if (pos < source.length() && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char expected) {
        if (!accept(expected)) {
            throw error("expected '" + expected + "'");
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private FormulaException error(String message) {
        return new FormulaException(message + " at position " + pos + " in '" + source + "'");
    }
}
