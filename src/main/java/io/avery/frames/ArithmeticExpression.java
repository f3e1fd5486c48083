/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.frames;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.operators.arithmetic.Addition;
import net.sf.jsqlparser.expression.operators.arithmetic.BitwiseXor;
import net.sf.jsqlparser.expression.operators.arithmetic.Division;
import net.sf.jsqlparser.expression.operators.arithmetic.Modulo;
import net.sf.jsqlparser.expression.operators.arithmetic.Multiplication;
import net.sf.jsqlparser.expression.operators.arithmetic.Subtraction;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A compiled arithmetic expression over named variables, such as {@code (price - cost) / price * 100}.
 *
 * <p>Supports {@code + - * / %}, unary signs, parentheses, {@code ^} as power, numeric literals, and the functions
 * {@code abs, sqrt, pow, round, floor, ceil, min, max, ln, log, exp}. {@code log} is base 10 with one argument, or
 * {@code log(base, x)} with two. Expressions are parsed once, by JSqlParser, and evaluated any number of times.
 *
 * <p>Example:
 * <pre>{@code
 * ArithmeticExpression margin = ArithmeticExpression.compile("(price - cost) / price * 100");
 * double m = margin.evaluate(Map.of("price", 80.0, "cost", 60.0)); // 25.0
 * }</pre>
 */
public final class ArithmeticExpression {
    /** A {@code {name}} placeholder, naming a reducer to bind. */
    static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    
    private final String source;
    private final Expression expression;
    
    private ArithmeticExpression(String source, Expression expression) {
        this.source = source;
        this.expression = expression;
    }
    
    /**
     * Parses an expression.
     *
     * @param source the expression text
     * @return the compiled expression
     * @throws IllegalArgumentException if the expression is malformed or uses unsupported syntax
     */
    public static ArithmeticExpression compile(String source) {
        Expression expression;
        try {
            expression = CCJSqlParserUtil.parseExpression(source, false);
        } catch (JSQLParserException e) {
            throw new IllegalArgumentException("Malformed expression: " + source, e);
        }
        ArithmeticExpression compiled = new ArithmeticExpression(source, expression);
        compiled.collect(expression, new LinkedHashSet<>());
        return compiled;
    }
    
    /**
     * Evaluates the expression.
     *
     * @param bindings variable values by name
     * @return the value of the expression
     * @throws IllegalArgumentException if the expression references a variable with no (or a null) binding
     */
    public double evaluate(Map<String, ? extends Number> bindings) {
        return eval(expression, bindings);
    }
    
    /**
     * Returns the names of the variables the expression references, in order of first appearance.
     *
     * @return the variable names
     */
    public Set<String> variables() {
        Set<String> variables = new LinkedHashSet<>();
        collect(expression, variables);
        return Collections.unmodifiableSet(variables);
    }
    
    /**
     * Returns the variable a {@code {reducer}} placeholder is rewritten to.
     */
    static String reducerVariable(String reducer) {
        return "reducer_" + reducer;
    }
    
    @Override
    public String toString() {
        return source;
    }
    
    private double eval(Expression e, Map<String, ? extends Number> bindings) {
        if (e instanceof LongValue)
            return ((LongValue) e).getValue();
        if (e instanceof DoubleValue)
            return ((DoubleValue) e).getValue();
        if (e instanceof Column) {
            String name = ((Column) e).getColumnName();
            Number value = bindings.get(name);
            if (value == null)
                throw new IllegalArgumentException("Unknown variable: " + name + " in expression: " + source);
            return value.doubleValue();
        }
        if (e instanceof SignedExpression) {
            SignedExpression signed = (SignedExpression) e;
            double value = eval(signed.getExpression(), bindings);
            return signed.getSign() == '-' ? -value : value;
        }
        if (e instanceof ExpressionList) {
            ExpressionList<?> list = (ExpressionList<?>) e;
            if (list.size() != 1)
                throw new IllegalArgumentException("Unsupported expression: " + e + " in expression: " + source);
            return eval(list.get(0), bindings);
        }
        if (e instanceof BinaryExpression) {
            BinaryExpression binary = (BinaryExpression) e;
            double left = eval(binary.getLeftExpression(), bindings);
            double right = eval(binary.getRightExpression(), bindings);
            if (e instanceof Addition)
                return left + right;
            if (e instanceof Subtraction)
                return left - right;
            if (e instanceof Multiplication)
                return left * right;
            if (e instanceof Division)
                return left / right;
            if (e instanceof Modulo)
                return left % right;
            if (e instanceof BitwiseXor)
                return Math.pow(left, right);
        }
        if (e instanceof Function)
            return call((Function) e, bindings);
        throw new IllegalArgumentException("Unsupported expression: " + e + " in expression: " + source);
    }
    
    private double call(Function function, Map<String, ? extends Number> bindings) {
        List<Double> args = new ArrayList<>();
        ExpressionList<?> parameters = function.getParameters();
        if (parameters != null)
            for (Expression parameter : parameters)
                args.add(eval(parameter, bindings));
        String name = function.getName().toLowerCase(Locale.ROOT);
        switch (name) {
            case "abs": return Math.abs(arg(name, args, 1, 0));
            case "sqrt": return Math.sqrt(arg(name, args, 1, 0));
            case "pow": return Math.pow(arg(name, args, 2, 0), arg(name, args, 2, 1));
            case "round": return Math.round(arg(name, args, 1, 0));
            case "floor": return Math.floor(arg(name, args, 1, 0));
            case "ceil": return Math.ceil(arg(name, args, 1, 0));
            case "ln": return Math.log(arg(name, args, 1, 0));
            case "exp": return Math.exp(arg(name, args, 1, 0));
            case "log":
                if (args.size() == 2)
                    return Math.log(args.get(1)) / Math.log(args.get(0));
                return Math.log10(arg(name, args, 1, 0));
            case "min":
            case "max":
                if (args.isEmpty())
                    throw new IllegalArgumentException("Function " + name + " expects arguments in expression: " + source);
                double result = args.get(0);
                for (double arg : args)
                    result = name.equals("min") ? Math.min(result, arg) : Math.max(result, arg);
                return result;
            default:
                throw new IllegalArgumentException("Unknown function: " + function.getName() + " in expression: " + source);
        }
    }
    
    private double arg(String function, List<Double> args, int arity, int index) {
        if (args.size() != arity)
            throw new IllegalArgumentException("Function " + function + " expects " + arity + " argument(s) in expression: " + source);
        return args.get(index);
    }
    
    /**
     * Collects variable names, and rejects unsupported syntax up front.
     */
    private void collect(Expression e, Set<String> variables) {
        if (e instanceof LongValue || e instanceof DoubleValue)
            return;
        if (e instanceof Column)
            variables.add(((Column) e).getColumnName());
        else if (e instanceof SignedExpression)
            collect(((SignedExpression) e).getExpression(), variables);
        else if (e instanceof ExpressionList && ((ExpressionList<?>) e).size() == 1)
            collect(((ExpressionList<?>) e).get(0), variables);
        else if (e instanceof Addition || e instanceof Subtraction || e instanceof Multiplication
                 || e instanceof Division || e instanceof Modulo || e instanceof BitwiseXor) {
            collect(((BinaryExpression) e).getLeftExpression(), variables);
            collect(((BinaryExpression) e).getRightExpression(), variables);
        }
        else if (e instanceof Function) {
            ExpressionList<?> parameters = ((Function) e).getParameters();
            if (parameters != null)
                for (Expression parameter : parameters)
                    collect(parameter, variables);
        }
        else
            throw new IllegalArgumentException("Unsupported expression: " + e + " in expression: " + source);
    }
}
