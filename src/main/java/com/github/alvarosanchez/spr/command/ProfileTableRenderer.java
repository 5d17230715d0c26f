package com.github.alvarosanchez.spr.command;

import com.github.alvarosanchez.spr.service.ProfileService.ProfileListRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import picocli.CommandLine.Help;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Column;
import picocli.CommandLine.Help.Column.Overflow;
import picocli.CommandLine.Help.TextTable;

final class ProfileTableRenderer {

    private static final int DEFAULT_MAX_TABLE_WIDTH = 120;
    private static final int COLUMN_GAP = 2;
    private static final int MIN_NAME_WIDTH = 12;
    private static final String[] HEADERS = {"NAMESPACE", "NAME", "TYPE", "SLICER", "VERSION", "LAST UPDATED", "UUID"};

    private ProfileTableRenderer() {
    }

    static String render(List<ProfileListRow> rows) {
        return render(rows, System.getenv());
    }

    static String render(List<ProfileListRow> rows, Map<String, String> environment) {
        int[] widths = columnWidths(rows, resolvedMaxTableWidth(environment));
        Column[] columns = new Column[widths.length];
        for (int i = 0; i < widths.length; i++) {
            columns[i] = new Column(widths[i] + COLUMN_GAP, 0, i == 1 ? Overflow.WRAP : Overflow.TRUNCATE);
        }

        TextTable table = TextTable.forColumns(Help.defaultColorScheme(Ansi.AUTO), columns);
        String[] headers = new String[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) {
            headers[i] = "@|bold,fg(blue) " + HEADERS[i] + "|@";
        }
        table.addRowValues(headers);
        for (ProfileListRow row : rows) {
            table.addRowValues(cells(row));
        }
        return table.toString();
    }

    static int resolvedMaxTableWidth(Map<String, String> environment) {
        OptionalInt columns = parsePositiveInt(environment.get("COLUMNS"));
        return columns.orElse(DEFAULT_MAX_TABLE_WIDTH);
    }

    private static int[] columnWidths(List<ProfileListRow> rows, int maxTableWidth) {
        int[] widths = new int[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) {
            widths[i] = HEADERS[i].length();
        }
        for (ProfileListRow row : rows) {
            String[] cells = cells(row);
            for (int i = 0; i < cells.length; i++) {
                widths[i] = Math.max(widths[i], cells[i].length());
            }
        }

        int total = 0;
        for (int width : widths) {
            total += width + COLUMN_GAP;
        }
        if (total > maxTableWidth) {
            // only the name column shrinks; it wraps instead of truncating
            int overflow = total - maxTableWidth;
            widths[1] = Math.max(MIN_NAME_WIDTH, widths[1] - overflow);
        }
        return widths;
    }

    private static String[] cells(ProfileListRow row) {
        List<String> cells = new ArrayList<>();
        cells.add(valueOrDash(row.namespace()));
        cells.add(valueOrDash(row.name()));
        cells.add(valueOrDash(row.type()));
        cells.add(valueOrDash(row.slicer()));
        cells.add(valueOrDash(row.version()));
        cells.add(valueOrDash(row.lastUpdated()));
        cells.add(valueOrDash(row.uuid()));
        return cells.toArray(new String[0]);
    }

    private static String valueOrDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }

    private static OptionalInt parsePositiveInt(String value) {
        if (value == null || value.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? OptionalInt.of(parsed) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
