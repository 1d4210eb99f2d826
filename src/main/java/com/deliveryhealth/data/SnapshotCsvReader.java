package com.deliveryhealth.data;

import com.deliveryhealth.model.DeliveryFramework;
import com.deliveryhealth.model.WeeklySnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模块说明：SnapshotCsvReader（class）。
 * 主要职责：读取每周项目状态 CSV，按表头映射字段并转换为 WeeklySnapshot。
 * 使用建议：可选列缺失或无法解析时保持为空，不填充默认值。
 */
public final class SnapshotCsvReader {
    private static final Logger LOG = LogManager.getLogger(SnapshotCsvReader.class);

    static final List<String> REQUIRED_COLUMNS = List.of(
            "project_id",
            "week_ending",
            "actual_percent_complete",
            "planned_percent_complete"
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("M/d/yyyy")
    );

    public List<WeeklySnapshot> read(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        return parse(text);
    }

    public List<WeeklySnapshot> parse(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        String text = body.startsWith("\uFEFF") ? body.substring(1) : body;
        List<List<String>> records = tokenize(text);
        if (records.isEmpty()) {
            return List.of();
        }

        List<String> header = records.get(0);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            columns.put(header.get(i).trim().toLowerCase(Locale.ROOT), i);
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new IllegalArgumentException("missing required column: " + required);
            }
        }

        List<WeeklySnapshot> out = new ArrayList<>(Math.max(16, records.size()));
        int dropped = 0;
        for (int i = 1; i < records.size(); i++) {
            List<String> cells = records.get(i);
            if (isBlankRow(cells)) {
                dropped++;
                continue;
            }
            Row row = new Row(columns, cells, i);
            out.add(WeeklySnapshot.builder()
                    .projectId(row.text("project_id"))
                    .projectName(row.text("project_name"))
                    .weekEnding(row.date("week_ending"))
                    .plannedEndDate(row.date("planned_end_date"))
                    .forecastEndDate(row.date("forecast_end_date"))
                    .deliveryFramework(DeliveryFramework.fromTag(row.text("delivery_framework")))
                    .actualPercentComplete(row.required("actual_percent_complete"))
                    .plannedPercentComplete(row.required("planned_percent_complete"))
                    .backlogItemsAdded(row.required("backlog_items_added_last_4w"))
                    .backlogItemsClosed(row.required("backlog_items_closed_last_4w"))
                    .requirementsChanged(row.required("requirements_changed_last_4w"))
                    .defectEscapeRate(row.required("defect_escape_rate_last_4w"))
                    .defectsOpenCritical(row.required("defects_open_critical"))
                    .teamSize(row.required("team_size"))
                    .teamChurn(row.required("team_churn_last_4w"))
                    .blockedDays(row.required("blocked_days_last_2w"))
                    .unplannedWorkRatio(row.required("unplanned_work_ratio_last_4w"))
                    .dependencyCount(row.required("dependency_count"))
                    .plannedCostToDate(row.optional("planned_cost_to_date"))
                    .actualCostToDate(row.optional("actual_cost_to_date"))
                    .milestonesPlanned(row.optional("milestones_planned"))
                    .milestonesHit(row.optional("milestones_hit"))
                    .risksOpen(row.optional("risks_open"))
                    .risksHigh(row.optional("risks_high"))
                    .throughput(row.optional("throughput"))
                    .cycleTimeDays(row.optional("cycle_time_days", "cycle_time"))
                    .wipCurrent(row.optional("wip_current"))
                    .wipLimit(row.optional("wip_limit"))
                    .agingWipItems(row.optional("aging_wip_items", "aging_wip"))
                    .build());
        }
        LOG.info("snapshot rows read={} dropped_empty={}", out.size(), dropped);
        return out;
    }

    static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        // 兼容带时间的写法，只取日期部分
        int space = value.indexOf(' ');
        if (space > 0) {
            value = value.substring(0, space);
        }
        int t = value.indexOf('T');
        if (t > 0) {
            value = value.substring(0, t);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        return null;
    }

    /**
     * Splits the whole body into records of trimmed cells. Quote state is tracked across line
     * breaks, so a quoted cell may span several lines.
     */
    static List<List<String>> tokenize(String text) {
        List<List<String>> records = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return records;
        }
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        cell.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString().trim());
                cell.setLength(0);
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                cells.add(cell.toString().trim());
                cell.setLength(0);
                records.add(cells);
                cells = new ArrayList<>();
            } else {
                cell.append(c);
            }
        }
        if (quoted) {
            LOG.warn("unterminated quoted cell at end of input, record={}", records.size() + 1);
        }
        if (cell.length() > 0 || !cells.isEmpty()) {
            cells.add(cell.toString().trim());
            records.add(cells);
        }
        return records;
    }

    private static boolean isBlankRow(List<String> cells) {
        for (String cell : cells) {
            if (!cell.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static final class Row {
        private final Map<String, Integer> columns;
        private final List<String> cells;
        private final int rowNo;

        private Row(Map<String, Integer> columns, List<String> cells, int rowNo) {
            this.columns = columns;
            this.cells = cells;
            this.rowNo = rowNo;
        }

        String text(String name) {
            Integer idx = columns.get(name);
            if (idx == null || idx >= cells.size()) {
                return "";
            }
            return cells.get(idx);
        }

        LocalDate date(String name) {
            String value = text(name);
            LocalDate parsed = parseDate(value);
            if (parsed == null && !value.isEmpty()) {
                LOG.warn("unparseable date row={} column={} value={}", rowNo, name, value);
            }
            return parsed;
        }

        double required(String name) {
            Double value = number(name);
            return value == null ? 0.0 : value;
        }

        Double optional(String... names) {
            for (String name : names) {
                Double value = number(name);
                if (value != null) {
                    return value;
                }
            }
            return null;
        }

        private Double number(String name) {
            String value = text(name);
            if (value.isEmpty() || value.equalsIgnoreCase("null") || value.equalsIgnoreCase("nan")) {
                return null;
            }
            try {
                double parsed = Double.parseDouble(value);
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException e) {
                LOG.warn("unparseable number row={} column={} value={}", rowNo, name, value);
                return null;
            }
        }
    }
}
