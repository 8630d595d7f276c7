package com.example.aspects.roll;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent evaluator for roll formulas.
 * <pre>
 *   expr    := term (('+' | '-') term)*
 *   term    := unary (('*' | '/') unary)*
 *   unary   := ('+' | '-') unary | primary
 *   primary := number | dice | '@' name | '(' expr ')'
 *   dice    := [count] 'd' sides
 * </pre>
 * Unknown variables evaluate to zero.
 */
public class FormulaRoller implements RollEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaRoller.class);
    private static final int MAX_DICE = 1000;
    /** With MAX_DICE, keeps any dice total within an int. */
    private static final int MAX_SIDES = 1_000_000;

    private final DieRoller dieRoller;

    public FormulaRoller() {
        this(DieRoller.random());
    }

    public FormulaRoller(DieRoller dieRoller) {
        this.dieRoller = dieRoller;
    }

    @Override
    public RollResult evaluate(String formula, Map<String, Double> bindings) {
        if (formula == null || formula.isBlank()) {
            throw new FormulaException("Empty formula", String.valueOf(formula), 0);
        }
        Parser p = new Parser(formula, bindings != null ? bindings : Collections.emptyMap());
        double total = p.parseExpression();
        p.skipSpaces();
        if (!p.atEnd()) {
            throw new FormulaException("Unexpected '" + p.peek() + "'", formula, p.pos);
        }
        logger.debug("[FormulaRoller] {} = {} {}", formula, total, p.dice);
        return new RollResult(formula, total, p.dice);
    }

    private final class Parser {
        private final String src;
        private final Map<String, Double> bindings;
        private final List<DieResult> dice = new ArrayList<>();
        private int pos;

        Parser(String src, Map<String, Double> bindings) {
            this.src = src;
            this.bindings = bindings;
        }

        double parseExpression() {
            double value = parseTerm();
            while (true) {
                skipSpaces();
                if (match('+')) value += parseTerm();
                else if (match('-')) value -= parseTerm();
                else return value;
            }
        }

        double parseTerm() {
            double value = parseUnary();
            while (true) {
                skipSpaces();
                if (match('*')) {
                    value *= parseUnary();
                } else if (match('/')) {
                    int at = pos;
                    double divisor = parseUnary();
                    if (divisor == 0) throw new FormulaException("Division by zero", src, at);
                    value /= divisor;
                } else {
                    return value;
                }
            }
        }

        double parseUnary() {
            skipSpaces();
            if (match('-')) return -parseUnary();
            if (match('+')) return parseUnary();
            return parsePrimary();
        }

        double parsePrimary() {
            skipSpaces();
            if (atEnd()) throw new FormulaException("Unexpected end of formula", src, pos);
            char c = peek();
            if (c == '(') {
                pos++;
                double value = parseExpression();
                skipSpaces();
                if (!match(')')) throw new FormulaException("Missing ')'", src, pos);
                return value;
            }
            if (c == '@') {
                pos++;
                return variable(readName());
            }
            if (c == 'd' || c == 'D') {
                return rollDice(1);
            }
            if (Character.isDigit(c) || c == '.') {
                int start = pos;
                double number = readNumber();
                if (!atEnd() && (peek() == 'd' || peek() == 'D')) {
                    if (number != Math.floor(number)) throw new FormulaException("Dice count must be whole", src, start);
                    return rollDice((int) number);
                }
                return number;
            }
            throw new FormulaException("Unexpected '" + c + "'", src, pos);
        }

        private double rollDice(int count) {
            int at = pos;
            pos++; // the 'd'
            if (atEnd() || !Character.isDigit(peek())) throw new FormulaException("Missing die size", src, pos);
            double sidesValue = readNumber();
            int sides = (int) sidesValue;
            if (sides < 1 || sidesValue != sides || sides > MAX_SIDES) throw new FormulaException("Invalid die size", src, at);
            if (count < 0 || count > MAX_DICE) throw new FormulaException("Invalid dice count " + count, src, at);
            int[] faces = new int[count];
            int total = 0;
            for (int i = 0; i < count; i++) {
                faces[i] = dieRoller.roll(sides);
                total += faces[i];
            }
            dice.add(new DieResult(count, sides, faces, total));
            return total;
        }

        private double variable(String name) {
            if (name.isEmpty()) throw new FormulaException("Missing variable name", src, pos);
            Double value = bindings.get(name);
            if (value == null) {
                logger.debug("[FormulaRoller] Unbound variable @{} in '{}', using 0", name, src);
                return 0;
            }
            return value;
        }

        private String readName() {
            int start = pos;
            while (!atEnd()) {
                char c = peek();
                if (Character.isLetterOrDigit(c) || c == '.' || c == '_') pos++;
                else break;
            }
            return src.substring(start, pos);
        }

        private double readNumber() {
            int start = pos;
            while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) pos++;
            try {
                return Double.parseDouble(src.substring(start, pos));
            } catch (NumberFormatException e) {
                throw new FormulaException("Bad number", src, start);
            }
        }

        boolean match(char c) {
            if (!atEnd() && src.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        void skipSpaces() {
            while (!atEnd() && Character.isWhitespace(src.charAt(pos))) pos++;
        }

        char peek() { return src.charAt(pos); }

        boolean atEnd() { return pos >= src.length(); }
    }
}
