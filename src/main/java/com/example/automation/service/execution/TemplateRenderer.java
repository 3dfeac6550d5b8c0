package com.example.automation.service.execution;

import com.example.automation.domain.model.ExecutionContext;
import com.example.automation.exception.ConfigurationException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {variable}} placeholders from the execution context.
 * A placeholder with no value is an error, never an empty string.
 */
@Component
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_][A-Za-z0-9_.\\-]*)}");

    public String render(String template, ExecutionContext context) {
        return substitute(template, context, UnaryOperator.identity());
    }

    /**
     * Render a JSON document template. Substituted values are escaped as JSON string
     * content, so a value containing quotes or backslashes stays inside its string literal.
     */
    public String renderJson(String template, ExecutionContext context) {
        var encoder = JsonStringEncoder.getInstance();
        return substitute(template, context, value -> new String(encoder.quoteAsString(value)));
    }

    private String substitute(String template, ExecutionContext context, UnaryOperator<String> escape) {
        if (template == null || template.indexOf('{') < 0) {
            return template;
        }

        var matcher = PLACEHOLDER.matcher(template);
        var out = new StringBuilder();
        while (matcher.find()) {
            var name = matcher.group(1);
            var value = context.lookup(name);
            if (value == null) {
                throw new ConfigurationException("Missing template variable: " + name);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(escape.apply(String.valueOf(value))));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Render every string found in a parameter map, descending into nested maps and lists.
     */
    public Map<String, Object> renderParams(Map<String, Object> params, ExecutionContext context) {
        var rendered = new LinkedHashMap<String, Object>();
        params.forEach((key, value) -> rendered.put(key, renderValue(value, context)));
        return rendered;
    }

    @SuppressWarnings("unchecked")
    private Object renderValue(Object value, ExecutionContext context) {
        if (value instanceof String s) {
            return render(s, context);
        }
        if (value instanceof Map<?, ?> map) {
            return renderParams((Map<String, Object>) map, context);
        }
        if (value instanceof List<?> list) {
            var rendered = new ArrayList<>(list.size());
            for (var item : list) {
                rendered.add(renderValue(item, context));
            }
            return rendered;
        }
        return value;
    }
}
