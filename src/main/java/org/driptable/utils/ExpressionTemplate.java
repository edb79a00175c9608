package org.driptable.utils;

import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code {{ expression }}} placeholders against a record exposed as {@code rec}.
 * Each placeholder is evaluated on its own; a failing one is replaced by
 * {@code {{Render Error: <message>}}} and the others are still rendered. Expressions are
 * parsed per call and nothing is retained between renders.
 */
public final class ExpressionTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.+?)}}", Pattern.DOTALL);
    private static final ExpressionParser PARSER = new SpelExpressionParser();

    private ExpressionTemplate() {
    }

    public static String render(String template, Map<String, ?> record) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        EvaluationContext context = SimpleEvaluationContext
                .forPropertyAccessors(new MapAccessor())
                .withInstanceMethods()
                .withRootObject(Map.of("rec", record == null ? Map.of() : record))
                .build();
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(builder, Matcher.quoteReplacement(evaluate(matcher.group(1).trim(), context)));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private static String evaluate(String source, EvaluationContext context) {
        try {
            Expression expression = PARSER.parseExpression(source);
            return JsonNodes.stringify(expression.getValue(context));
        } catch (RuntimeException ex) {
            String message = ex.getMessage();
            return message != null ? "{{Render Error: " + message + "}}" : "{{Unknown Render Error}}";
        }
    }
}
