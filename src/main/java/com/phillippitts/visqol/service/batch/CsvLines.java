package com.phillippitts.visqol.service.batch;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal CSV field splitting and quoting for the two-column pair lists and result tables.
 *
 * <p>Handles double-quoted fields with embedded commas and doubled quotes. Multi-line fields are
 * not supported.
 */
final class CsvLines {

    private CsvLines() {}

    static List<String> split(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString().trim());
        return fields;
    }

    static String quote(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        String flat = value.replace('\r', ' ').replace('\n', ' ');
        return '"' + flat.replace("\"", "\"\"") + '"';
    }
}
