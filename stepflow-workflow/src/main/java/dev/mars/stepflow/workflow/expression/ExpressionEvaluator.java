/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stepflow.workflow.expression;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates expressions and {@code ${{ }}} templates against an
 * {@link EvaluationContext}.
 *
 * <p>Evaluation never mutates the context and only reaches data through the
 * context roots and the {@link FilterRegistry}. Instances are thread-safe and
 * cache parsed expressions.</p>
 */
public class ExpressionEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final int MAX_CACHE_SIZE = 4096;

    private final FilterRegistry filters;
    private final Map<String, ExpressionNode> cache = new ConcurrentHashMap<>();

    public ExpressionEvaluator() {
        this(FilterRegistry.defaults());
    }

    public ExpressionEvaluator(FilterRegistry filters) {
        this.filters = filters;
    }

    public FilterRegistry getFilters() {
        return filters;
    }

    /**
     * Parses a bare expression, using the cache.
     */
    public ExpressionNode parse(String expression) {
        ExpressionNode node = cache.get(expression);
        if (node != null) {
            return node;
        }
        node = ExpressionParser.parse(expression);
        if (cache.size() >= MAX_CACHE_SIZE) {
            logger.debug("Expression cache full, clearing {} entries", cache.size());
            cache.clear();
        }
        cache.put(expression, node);
        return node;
    }

    /**
     * Evaluates a bare expression. Undefined results are returned as {@code null}.
     */
    public Object evaluate(String expression, EvaluationContext context) {
        return ExpressionValues.toPlain(evaluateRaw(expression, context));
    }

    /**
     * Evaluates a value that is either a bare expression or a single
     * interpolation, as used by {@code if}, {@code loop} and {@code break_if}.
     */
    public Object evaluateBare(String expression, EvaluationContext context) {
        if (Template.containsExpression(expression) && Template.singleExpression(expression).isEmpty()) {
            return render(expression, context);
        }
        return evaluate(Template.bareExpression(expression), context);
    }

    public boolean evaluateCondition(String condition, EvaluationContext context) {
        if (Template.containsExpression(condition) && Template.singleExpression(condition).isEmpty()) {
            return ExpressionValues.isTruthy(render(condition, context));
        }
        return ExpressionValues.isTruthy(evaluateRaw(Template.bareExpression(condition), context));
    }

    /**
     * Renders a template string. A string that is exactly one interpolation
     * yields the typed value; otherwise each value is rendered as text and spliced.
     */
    public Object render(String template, EvaluationContext context) {
        if (!Template.containsExpression(template)) {
            return template;
        }
        Optional<String> single = Template.singleExpression(template);
        if (single.isPresent()) {
            return evaluate(single.get(), context);
        }
        StringBuilder result = new StringBuilder();
        for (Template.Segment segment : Template.split(template)) {
            if (segment.expression()) {
                result.append(ExpressionValues.toText(evaluateRaw(segment.text(), context)));
            } else {
                result.append(segment.text());
            }
        }
        return result.toString();
    }

    /**
     * Renders a string-form shell command. With {@code autoQuote} every
     * interpolation that is not already passed through {@code shell_quote} is
     * quoted, so substituted values always form a single shell word.
     */
    public String renderShellCommand(String template, EvaluationContext context, boolean autoQuote) {
        if (!autoQuote) {
            return ExpressionValues.toText(render(template, context));
        }
        StringBuilder result = new StringBuilder();
        for (Template.Segment segment : Template.split(template)) {
            if (!segment.expression()) {
                result.append(segment.text());
                continue;
            }
            String text = ExpressionValues.toText(evaluateRaw(segment.text(), context));
            result.append(ExpressionAnalyzer.isShellQuoted(segment.text()) ? text : ShellQuoting.quote(text));
        }
        return result.toString();
    }

    /**
     * Renders every string inside a value tree of maps and lists.
     */
    public Object resolve(Object value, EvaluationContext context) {
        if (value instanceof String s) {
            return render(s, context);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((key, item) -> resolved.put(String.valueOf(key), resolve(item, context)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(item -> resolved.add(resolve(item, context)));
            return resolved;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> resolveMap(Map<String, Object> values, EvaluationContext context) {
        return (Map<String, Object>) resolve(values, context);
    }

    private Object evaluateRaw(String expression, EvaluationContext context) {
        try {
            return eval(parse(expression), context);
        } catch (ExpressionException e) {
            throw e.withExpression(expression);
        }
    }

    private Object eval(ExpressionNode node, EvaluationContext context) {
        if (node instanceof ExpressionNode.Literal literal) {
            return literal.value();
        }
        if (node instanceof ExpressionNode.Identifier identifier) {
            if (!EvaluationContext.ROOTS.contains(identifier.name())) {
                throw new ExpressionException("unknown identifier '" + identifier.name() + "'",
                        null, identifier.position());
            }
            return context.resolveRoot(identifier.name());
        }
        if (node instanceof ExpressionNode.Attribute attribute) {
            return member(eval(attribute.target(), context), attribute.name(), attribute.position());
        }
        if (node instanceof ExpressionNode.Index index) {
            return index(eval(index.target(), context), eval(index.index(), context), index.position());
        }
        if (node instanceof ExpressionNode.Unary unary) {
            return unary(unary, eval(unary.operand(), context));
        }
        if (node instanceof ExpressionNode.Binary binary) {
            return binary(binary, context);
        }
        if (node instanceof ExpressionNode.Filter filter) {
            Object subject = eval(filter.subject(), context);
            return filters.apply(filter.name(), subject, evalAll(filter.arguments(), context));
        }
        if (node instanceof ExpressionNode.Call call) {
            return call(call, context);
        }
        if (node instanceof ExpressionNode.ListLiteral list) {
            return evalAll(list.items(), context);
        }
        throw new ExpressionException("unsupported expression node " + node.getClass().getSimpleName());
    }

    private List<Object> evalAll(List<ExpressionNode> nodes, EvaluationContext context) {
        List<Object> values = new ArrayList<>(nodes.size());
        for (ExpressionNode node : nodes) {
            values.add(eval(node, context));
        }
        return values;
    }

    private Object call(ExpressionNode.Call call, EvaluationContext context) {
        if (call.name().equals("now") && call.arguments().isEmpty()) {
            return context.now().toString();
        }
        if (!filters.contains(call.name())) {
            throw new ExpressionException("unknown function '" + call.name() + "'", null, call.position());
        }
        List<Object> arguments = evalAll(call.arguments(), context);
        if (arguments.isEmpty()) {
            throw new ExpressionException("function '" + call.name() + "' needs at least one argument",
                    null, call.position());
        }
        return filters.apply(call.name(), arguments.get(0), arguments.subList(1, arguments.size()));
    }

    private static Object member(Object target, String name, int position) {
        if (Undefined.isMissing(target)) {
            return Undefined.INSTANCE;
        }
        if (target instanceof Map<?, ?> map) {
            return map.containsKey(name) ? map.get(name) : Undefined.INSTANCE;
        }
        if (target instanceof LazyScope scope) {
            return scope.get(name);
        }
        throw new ExpressionException("cannot read attribute '" + name + "' of "
                + ExpressionValues.typeName(target), null, position);
    }

    private static Object index(Object target, Object key, int position) {
        if (Undefined.isMissing(target)) {
            return Undefined.INSTANCE;
        }
        if (target instanceof Map<?, ?> || target instanceof LazyScope) {
            if (!(key instanceof String)) {
                throw new ExpressionException("mapping keys must be strings, got "
                        + ExpressionValues.typeName(key), null, position);
            }
            return member(target, (String) key, position);
        }
        if (target instanceof List<?> || target instanceof String) {
            if (!(key instanceof Number n) || !ExpressionValues.isIntegral(n)) {
                throw new ExpressionException("list index must be an integer, got "
                        + ExpressionValues.typeName(key), null, position);
            }
            int size = target instanceof List<?> list ? list.size() : ((String) target).length();
            long i = n.longValue() < 0 ? size + n.longValue() : n.longValue();
            if (i < 0 || i >= size) {
                return Undefined.INSTANCE;
            }
            return target instanceof List<?> list
                    ? list.get((int) i)
                    : String.valueOf(((String) target).charAt((int) i));
        }
        throw new ExpressionException("cannot index " + ExpressionValues.typeName(target), null, position);
    }

    private static Object unary(ExpressionNode.Unary unary, Object operand) {
        if (unary.operator().equals("not")) {
            return !ExpressionValues.isTruthy(operand);
        }
        if (ExpressionValues.isIntegral(operand)) {
            return Math.negateExact(((Number) operand).longValue());
        }
        if (operand instanceof Number n) {
            return -n.doubleValue();
        }
        throw new ExpressionException("cannot negate " + ExpressionValues.typeName(operand), null, unary.position());
    }

    private Object binary(ExpressionNode.Binary binary, EvaluationContext context) {
        String operator = binary.operator();
        Object left = eval(binary.left(), context);
        if (operator.equals("and")) {
            return ExpressionValues.isTruthy(left) ? eval(binary.right(), context) : left;
        }
        if (operator.equals("or")) {
            return ExpressionValues.isTruthy(left) ? left : eval(binary.right(), context);
        }
        Object right = eval(binary.right(), context);
        try {
            switch (operator) {
                case "==":
                    return ExpressionValues.valuesEqual(left, right);
                case "!=":
                    return !ExpressionValues.valuesEqual(left, right);
                case "<":
                    return ExpressionValues.compare(left, right) < 0;
                case "<=":
                    return ExpressionValues.compare(left, right) <= 0;
                case ">":
                    return ExpressionValues.compare(left, right) > 0;
                case ">=":
                    return ExpressionValues.compare(left, right) >= 0;
                case "in":
                    return BuiltinFilters.contains(right, left);
                case "not in":
                    return !BuiltinFilters.contains(right, left);
                case "~":
                    return ExpressionValues.toText(left) + ExpressionValues.toText(right);
                case "+":
                    return add(left, right);
                default:
                    return arithmetic(operator, left, right);
            }
        } catch (ArithmeticException e) {
            throw new ExpressionException("integer overflow in '" + operator + "'", null, binary.position(), e);
        } catch (ExpressionException e) {
            if (e.getPosition() >= 0) {
                throw e;
            }
            throw new ExpressionException(e.getReason(), null, binary.position(), e.getCause());
        }
    }

    private static Object add(Object left, Object right) {
        if (left instanceof String a && right instanceof String b) {
            return a + b;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            List<Object> joined = new ArrayList<>(a);
            joined.addAll(b);
            return joined;
        }
        return arithmetic("+", left, right);
    }

    private static Object arithmetic(String operator, Object left, Object right) {
        if (!(left instanceof Number a) || !(right instanceof Number b)
                || left instanceof Boolean || right instanceof Boolean) {
            throw new ExpressionException("unsupported operand types for '" + operator + "': "
                    + ExpressionValues.typeName(left) + " and " + ExpressionValues.typeName(right));
        }
        boolean integral = ExpressionValues.isIntegral(a) && ExpressionValues.isIntegral(b);
        switch (operator) {
            case "+":
                return integral ? (Object) Math.addExact(a.longValue(), b.longValue())
                        : (Object) (a.doubleValue() + b.doubleValue());
            case "-":
                return integral ? (Object) Math.subtractExact(a.longValue(), b.longValue())
                        : (Object) (a.doubleValue() - b.doubleValue());
            case "*":
                return integral ? (Object) Math.multiplyExact(a.longValue(), b.longValue())
                        : (Object) (a.doubleValue() * b.doubleValue());
            case "/":
                requireNonZero(b, operator);
                return a.doubleValue() / b.doubleValue();
            case "//":
                requireNonZero(b, operator);
                return integral ? (Object) Math.floorDiv(a.longValue(), b.longValue())
                        : (Object) Math.floor(a.doubleValue() / b.doubleValue());
            case "%":
                requireNonZero(b, operator);
                if (integral) {
                    return Math.floorMod(a.longValue(), b.longValue());
                }
                return a.doubleValue() - b.doubleValue() * Math.floor(a.doubleValue() / b.doubleValue());
            default:
                throw new ExpressionException("unknown operator '" + operator + "'");
        }
    }

    private static void requireNonZero(Number divisor, String operator) {
        if (divisor.doubleValue() == 0.0) {
            throw new ExpressionException("division by zero in '" + operator + "'");
        }
    }
}
