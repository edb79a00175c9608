package org.driptable.service.components;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.driptable.adapters.TableDriver;
import org.driptable.models.render.RenderNode;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.service.columns.WidthNormalizer;
import org.driptable.utils.DataIndex;
import org.driptable.utils.ExpressionTemplate;
import org.driptable.utils.JsonNodes;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in {@code text} component.
 * <ul>
 *     <li>{@code single}: the column value between {@code prefix} and {@code suffix}</li>
 *     <li>{@code multiple}: one line per entry of {@code parts}, each with its own data index</li>
 *     <li>{@code custom}: {@code format} with {@code {{ expression }}} placeholders over {@code rec}</li>
 * </ul>
 * Values found in the {@code i18n} map are replaced by their translation.
 */
@Component
public class TextRenderer implements CellRenderer {

    public static final String NAME = "text";
    private static final String SCHEMA_LOCATION = "schemas/components/text.schema.json";
    private static final double DEFAULT_LINE_HEIGHT = 1.5;

    private final JsonNode capabilitySchema;

    public TextRenderer(ObjectMapper objectMapper) {
        try (InputStream input = new ClassPathResource(SCHEMA_LOCATION).getInputStream()) {
            this.capabilitySchema = objectMapper.readTree(input);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load " + SCHEMA_LOCATION, ex);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JsonNode capabilitySchema() {
        return capabilitySchema;
    }

    @Override
    public RenderNode render(CellContext context) {
        TableDriver driver = context.driver();
        Map<String, Object> options = context.options();
        if (!configured(context.column(), options)) {
            return driver.alert("Field is not configured", "error");
        }
        Number maxRow = options.get("maxRow") instanceof Number number ? number : null;
        Map<String, Object> textStyle = textStyle(options);

        Map<String, Object> wrapperStyle = new LinkedHashMap<>(textStyle);
        List<String> classNames = new ArrayList<>();
        classNames.add("word-break");
        if (Boolean.TRUE.equals(options.get("ellipsis"))) {
            classNames.add("text-ellipsis");
        }
        if (maxRow != null) {
            classNames.add("max-row");
            wrapperStyle.put("WebkitLineClamp", maxRow.intValue());
            wrapperStyle.put("maxHeight", (maxRow.doubleValue() * lineHeight(options)) + "em");
        }

        List<String> lines = rawText(context, options);
        RenderNode wrapper = driver.element("div",
                Map.of("className", String.join(" ", classNames), "style", wrapperStyle),
                lineNodes(driver, lines));
        if (maxRow == null) {
            return wrapper;
        }
        RenderNode fullText = driver.element("div",
                Map.of("className", "word-break", "style", textStyle),
                lineNodes(driver, lines));
        return driver.tooltip(fullText, wrapper);
    }

    private static boolean configured(ColumnSchema column, Map<String, Object> options) {
        String mode = mode(options);
        switch (mode) {
            case "custom":
                return options.get("format") instanceof String format && !format.isEmpty();
            case "multiple":
                return options.get("parts") instanceof List<?> parts && !parts.isEmpty();
            case "single":
                return column.dataIndex() != null && !column.dataIndex().isEmpty()
                        && column.dataIndex().stream().anyMatch(segment -> segment != null && !segment.isEmpty());
            default:
                return false;
        }
    }

    private static String mode(Map<String, Object> options) {
        Object mode = options.get("mode");
        return mode == null ? "single" : String.valueOf(mode);
    }

    private static Map<String, Object> textStyle(Map<String, Object> options) {
        Map<String, Object> style = new LinkedHashMap<>();
        String fontSize = WidthNormalizer.normalize(options.get("fontSize"));
        if (fontSize != null && !fontSize.isEmpty()) {
            style.put("fontSize", fontSize);
        }
        style.put("lineHeight", lineHeight(options));
        return style;
    }

    private static double lineHeight(Map<String, Object> options) {
        return options.get("lineHeight") instanceof Number number && number.doubleValue() > 0
                ? number.doubleValue()
                : DEFAULT_LINE_HEIGHT;
    }

    @SuppressWarnings("unchecked")
    private static List<String> rawText(CellContext context, Map<String, Object> options) {
        ColumnSchema column = context.column();
        Object defaultValue = options.containsKey("defaultValue")
                ? options.get("defaultValue")
                : JsonNodes.stringify(column.defaultValue());
        String prefix = textOption(options, "prefix");
        String suffix = textOption(options, "suffix");
        Map<String, Object> i18n = options.get("i18n") instanceof Map<?, ?> map ? (Map<String, Object>) map : null;

        String mode = mode(options);
        if ("custom".equals(mode)) {
            return splitLines(ExpressionTemplate.render((String) options.get("format"), context.record()));
        }
        if ("multiple".equals(mode)) {
            List<String> lines = new ArrayList<>();
            for (Object part : (List<?>) options.get("parts")) {
                if (part instanceof Map<?, ?> config) {
                    lines.add(partText(context, (Map<String, Object>) config, defaultValue));
                }
            }
            return splitLines(String.join("\n", lines));
        }
        Object value = context.value() != null ? context.value() : defaultValue;
        return splitLines(prefix + translate(i18n, value) + suffix);
    }

    @SuppressWarnings("unchecked")
    private static String partText(CellContext context, Map<String, Object> part, Object defaultValue) {
        Object value = DataIndex.get(context.record(), dataIndexOf(part.get("dataIndex")), defaultValue);
        Map<String, Object> i18n = part.get("i18n") instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
        return textOption(part, "prefix") + translate(i18n, value) + textOption(part, "suffix");
    }

    private static List<String> dataIndexOf(Object dataIndex) {
        if (dataIndex instanceof List<?> path) {
            return path.stream().map(segment -> String.valueOf(segment)).toList();
        }
        return dataIndex == null ? List.of() : List.of(String.valueOf(dataIndex));
    }

    private static String translate(Map<String, Object> i18n, Object origin) {
        if (origin instanceof String text && i18n != null && i18n.containsKey(text)) {
            return JsonNodes.stringify(i18n.get(text));
        }
        return JsonNodes.stringify(origin);
    }

    private static String textOption(Map<String, Object> options, String name) {
        Object value = options.get(name);
        return value == null ? "" : String.valueOf(value);
    }

    private static List<String> splitLines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }

    private static List<RenderNode> lineNodes(TableDriver driver, List<String> lines) {
        List<RenderNode> nodes = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            nodes.add(driver.element("div", Map.of("key", i), RenderNode.text(lines.get(i))));
        }
        return nodes;
    }
}
