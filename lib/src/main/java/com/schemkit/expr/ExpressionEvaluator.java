package com.schemkit.expr;

import com.schemkit.expr.grammar.SchemExprBaseVisitor;
import com.schemkit.expr.grammar.SchemExprLexer;
import com.schemkit.expr.grammar.SchemExprParser;
import com.schemkit.loader.NumberFormats;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Evaluates arithmetic embedded in property values.
 *
 * <p>{@link #substitute} rewrites every {@code expr_eng4(...)}, then {@code expr_eng(...)}, then
 * {@code expr(...)} call in a string. {@code expr} results are written with 15 significant
 * digits; the engineering forms use {@link SpiceValues#toEngineering} with 4 and 3 digits. A call
 * whose argument fails to evaluate is replaced by the bare argument text.
 *
 * <p>Expressions support {@code + - * / % ** ^}, unary signs, parentheses, numbers with SPICE
 * scale suffixes, the functions {@code sin cos tan asin acos atan log ln exp sqrt int round round1
 * round6 abs floor ceil} and the constants {@code pi e k h echarge abszero c}. {@code log} is base
 * 10, {@code ln} is natural, {@code int} truncates and the {@code round} family rounds half to even.
 */
public final class ExpressionEvaluator {
    private static final Logger LOGGER = Logger.getLogger(ExpressionEvaluator.class.getName());

    private static final Map<String, Double> CONSTANTS = Map.of(
            "pi", Math.PI,
            "e", Math.E,
            "k", 1.380649e-23,
            "h", 6.62607e-34,
            "echarge", 1.60217646e-19,
            "abszero", 273.15,
            "c", 2.99792458e8);

    private static final Map<String, DoubleUnaryOperator> FUNCTIONS = Map.ofEntries(
            Map.entry("sin", Math::sin),
            Map.entry("cos", Math::cos),
            Map.entry("tan", Math::tan),
            Map.entry("asin", Math::asin),
            Map.entry("acos", Math::acos),
            Map.entry("atan", Math::atan),
            Map.entry("log", Math::log10),
            Map.entry("ln", Math::log),
            Map.entry("exp", Math::exp),
            Map.entry("sqrt", Math::sqrt),
            Map.entry("int", x -> x < 0 ? Math.ceil(x) : Math.floor(x)),
            Map.entry("round", Math::rint),
            Map.entry("round1", x -> roundTo(x, 1)),
            Map.entry("round6", x -> roundTo(x, 6)),
            Map.entry("abs", Math::abs),
            Map.entry("floor", Math::floor),
            Map.entry("ceil", Math::ceil));

    private static final Pattern EXPR_ENG4 = Pattern.compile("expr_eng4\\s*\\(");
    private static final Pattern EXPR_ENG = Pattern.compile("expr_eng\\s*\\(");
    private static final Pattern EXPR = Pattern.compile("expr\\s*\\(");

    /**
     * Evaluates a bare expression such as {@code 2*pi} or {@code 10k/3}.
     *
     * @throws ExpressionException on a syntax error, an unknown name, division by zero or a
     *     function argument outside its domain
     */
    public double evaluate(String expression) throws ExpressionException {
        Objects.requireNonNull(expression, "expression");
        SchemExprLexer lexer = new SchemExprLexer(CharStreams.fromString(expression));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        SchemExprParser parser = new SchemExprParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        try {
            return new EvaluatingVisitor().visit(parser.expression());
        } catch (ParseCancellationException ex) {
            throw new ExpressionException("Syntax error in '" + expression + "' at " + ex.getMessage(), expression, ex);
        } catch (ArithmeticException ex) {
            throw new ExpressionException(ex.getMessage() + " in '" + expression + "'", expression, ex);
        }
    }

    /** Replaces every expression call in {@code text}; null and empty input are returned as is. */
    public String substitute(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = replaceCalls(text, EXPR_ENG4, Format.ENGINEERING_4);
        result = replaceCalls(result, EXPR_ENG, Format.ENGINEERING_3);
        return replaceCalls(result, EXPR, Format.PLAIN);
    }

    private enum Format {
        PLAIN,
        ENGINEERING_3,
        ENGINEERING_4
    }

    private String replaceCalls(String text, Pattern call, Format format) {
        StringBuilder out = new StringBuilder(text.length());
        Matcher matcher = call.matcher(text);
        int i = 0;
        while (i < text.length()) {
            matcher.region(i, text.length());
            if (!matcher.lookingAt()) {
                out.append(text.charAt(i++));
                continue;
            }
            int close = matchingParen(text, matcher.end());
            if (close < 0) {
                out.append(text.charAt(i++));
                continue;
            }
            String inner = text.substring(matcher.end(), close);
            out.append(render(inner, format));
            i = close + 1;
        }
        return out.toString();
    }

    private String render(String inner, Format format) {
        try {
            double value = evaluate(inner);
            switch (format) {
                case ENGINEERING_4:
                    return SpiceValues.toEngineering(value, 4);
                case ENGINEERING_3:
                    return SpiceValues.toEngineering(value, 3);
                default:
                    return NumberFormats.formatG(value, 15);
            }
        } catch (ExpressionException ex) {
            LOGGER.log(Level.FINE, "Leaving expression unevaluated: {0}", ex.getMessage());
            return inner;
        }
    }

    /** Index of the {@code )} closing the group that starts at {@code start}, or -1. */
    private static int matchingParen(String text, int start) {
        int depth = 1;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static double roundTo(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static final class EvaluatingVisitor extends SchemExprBaseVisitor<Double> {

        @Override
        public Double visitExpression(SchemExprParser.ExpressionContext ctx) {
            return visit(ctx.additive());
        }

        @Override
        public Double visitAdditive(SchemExprParser.AdditiveContext ctx) {
            double result = visit(ctx.multiplicative(0));
            for (int i = 1; i < ctx.multiplicative().size(); i++) {
                double operand = visit(ctx.multiplicative(i));
                String op = ctx.getChild(2 * i - 1).getText();
                result = op.equals("+") ? result + operand : result - operand;
            }
            return result;
        }

        @Override
        public Double visitMultiplicative(SchemExprParser.MultiplicativeContext ctx) {
            double result = visit(ctx.unary(0));
            for (int i = 1; i < ctx.unary().size(); i++) {
                double operand = visit(ctx.unary(i));
                String op = ctx.getChild(2 * i - 1).getText();
                if (op.equals("*")) {
                    result *= operand;
                } else if (operand == 0.0) {
                    throw new ArithmeticException((op.equals("/") ? "Division" : "Modulo") + " by zero");
                } else if (op.equals("/")) {
                    result /= operand;
                } else {
                    result = floorMod(result, operand);
                }
            }
            return result;
        }

        @Override
        public Double visitUnary(SchemExprParser.UnaryContext ctx) {
            if (ctx.power() != null) {
                return visit(ctx.power());
            }
            double operand = visit(ctx.unary());
            return ctx.MINUS() != null ? -operand : operand;
        }

        @Override
        public Double visitPower(SchemExprParser.PowerContext ctx) {
            double base = visit(ctx.primary());
            if (ctx.unary() == null) {
                return base;
            }
            double exponent = visit(ctx.unary());
            if (base == 0.0 && exponent < 0) {
                throw new ArithmeticException("Zero raised to a negative power");
            }
            double result = Math.pow(base, exponent);
            if (Double.isNaN(result) && !Double.isNaN(base) && !Double.isNaN(exponent)) {
                throw new ArithmeticException("Negative base with fractional exponent");
            }
            if (Double.isInfinite(result) && !Double.isInfinite(base) && !Double.isInfinite(exponent)) {
                throw new ArithmeticException("Power overflow");
            }
            return result;
        }

        @Override
        public Double visitNumberLiteral(SchemExprParser.NumberLiteralContext ctx) {
            double value = Double.parseDouble(ctx.NUMBER().getText());
            if (ctx.suffix == null) {
                return value;
            }
            Double multiplier = SpiceValues.multiplier(ctx.suffix.getText());
            if (multiplier == null) {
                throw new ArithmeticException("Unknown scale suffix '" + ctx.suffix.getText() + "'");
            }
            return value * multiplier;
        }

        @Override
        public Double visitFunctionCall(SchemExprParser.FunctionCallContext ctx) {
            String name = ctx.name.getText();
            DoubleUnaryOperator function = FUNCTIONS.get(name);
            if (function == null) {
                throw new ArithmeticException("Unknown function '" + name + "'");
            }
            double argument = visit(ctx.additive());
            double result = function.applyAsDouble(argument);
            if ((Double.isNaN(result) && !Double.isNaN(argument))
                    || (Double.isInfinite(result) && !Double.isInfinite(argument))) {
                throw new ArithmeticException("Argument " + argument + " outside the domain of " + name);
            }
            return result;
        }

        @Override
        public Double visitConstant(SchemExprParser.ConstantContext ctx) {
            Double value = CONSTANTS.get(ctx.name.getText());
            if (value == null) {
                throw new ArithmeticException("Unknown name '" + ctx.name.getText() + "'");
            }
            return value;
        }

        @Override
        public Double visitParenthesized(SchemExprParser.ParenthesizedContext ctx) {
            return visit(ctx.additive());
        }

        private static double floorMod(double a, double b) {
            double result = a % b;
            if (result != 0.0 && (b < 0) != (result < 0)) {
                result += b;
            }
            return result;
        }
    }
}
