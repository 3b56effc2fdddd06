package com.querytuner.service.explain;

import com.querytuner.model.explain.ExplainConfig;
import com.querytuner.model.explain.ExplainSetting;
import com.querytuner.model.explain.ExplainSettings;
import com.querytuner.model.explain.ExplainType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the exact EXPLAIN text sent to the engine.
 *
 * <p>Output shape:
 * <pre>
 *   EXPLAIN [KIND] [kind settings] &lt;query&gt; [SETTINGS log_comment='…', enable_analyzer=1, max_execution_time=s.mmm]
 * </pre>
 *
 * <p>The result must be byte-stable for identical input: history comparison and the
 * {@code log_comment} correlation on the engine side key off this text. Keep the order
 * of parts, the order of {@link ExplainSetting} constants, and the separators as they are.
 */
public final class ExplainQueryBuilder {

    private static final String SEPARATOR = ", ";

    private ExplainQueryBuilder() {
    }

    public static String build(ExplainConfig config, String query, String logComment,
                               boolean forceAnalyzer, int maxExecutionTimeMs) {
        return build(config.getType(), config.getSettings(), query, logComment, forceAnalyzer, maxExecutionTimeMs);
    }

    /**
     * @param type               EXPLAIN kind; null behaves like {@link ExplainType#DEFAULT}
     * @param settings           kind settings; unset and non-applicable ones are skipped
     * @param query              query text, appended verbatim
     * @param logComment         tracing tag rendered as {@code log_comment='…'} when non-empty
     * @param forceAnalyzer      adds {@code enable_analyzer=1}, QUERY TREE only
     * @param maxExecutionTimeMs rendered in seconds with three decimals when positive
     */
    public static String build(ExplainType type, ExplainSettings settings, String query, String logComment,
                               boolean forceAnalyzer, int maxExecutionTimeMs) {
        ExplainType kind = type == null ? ExplainType.DEFAULT : type;
        List<String> parts = new ArrayList<>();

        parts.add(kind.isDefault() ? "EXPLAIN" : "EXPLAIN " + kind.getKeyword());

        String kindSettings = buildKindSettings(kind, settings);
        if (!kindSettings.isEmpty()) {
            parts.add(kindSettings);
        }

        parts.add(query == null ? "" : query);

        List<String> requestSettings = new ArrayList<>();
        if (logComment != null && !logComment.isEmpty()) {
            requestSettings.add("log_comment='" + logComment + "'");
        }
        if (forceAnalyzer && kind == ExplainType.QUERY_TREE) {
            requestSettings.add("enable_analyzer=1");
        }
        if (maxExecutionTimeMs > 0) {
            requestSettings.add("max_execution_time=" + formatSeconds(maxExecutionTimeMs));
        }

        if (!requestSettings.isEmpty()) {
            parts.add("SETTINGS");
            parts.add(String.join(SEPARATOR, requestSettings));
        }

        return String.join(" ", parts);
    }

    static String buildKindSettings(ExplainType type, ExplainSettings settings) {
        if (settings == null) {
            return "";
        }
        List<String> rendered = new ArrayList<>();
        for (ExplainSetting setting : ExplainSetting.values()) {
            Integer value = setting.valueIn(settings);
            if (value != null && setting.appliesTo(type)) {
                rendered.add(setting.getSettingName() + "=" + value);
            }
        }
        return String.join(SEPARATOR, rendered);
    }

    /**
     * 1500 -> "1.500", 1 -> "0.001". Integer arithmetic, so no rounding drift.
     */
    static String formatSeconds(int millis) {
        return String.format(Locale.ROOT, "%d.%03d", millis / 1000, millis % 1000);
    }
}
