package com.company.querylog.query;

import com.company.querylog.domain.QueryEvent;
import com.company.querylog.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Renders query-log entries as CSV that is safe to open in a spreadsheet.
 */
@Component
public class QueryLogCsvExporter {

    public static final String HEADER = "Time,Client,Domain,Type,Status,Elapsed(ms),Reason";

    public String export(List<QueryEvent> events) {
        StringWriter out = new StringWriter();
        try {
            write(events.stream(), out);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * Writes the header and one line per event. Lines are separated by {@code \n}; there is
     * no trailing newline.
     */
    public void write(Stream<QueryEvent> events, Writer out) throws IOException {
        out.write(HEADER);
        Iterator<QueryEvent> it = events.iterator();
        while (it.hasNext()) {
            QueryEvent event = it.next();
            out.write('\n');
            out.write(TimeUtils.formatIso(event.getTimestamp()));
            out.write(',');
            out.write(escapeField(event.getClient()));
            out.write(',');
            out.write(escapeField(event.getDomain()));
            out.write(',');
            out.write(escapeField(event.getQueryType()));
            out.write(',');
            out.write(escapeField(event.getStatus().getRaw()));
            out.write(',');
            out.write(escapeField(formatElapsed(event.getElapsedMs())));
            out.write(',');
            out.write(escapeField(event.getReason()));
        }
        out.flush();
    }

    /**
     * Prefixes values a spreadsheet would evaluate as a formula with {@code '} and quotes
     * values containing a quote, comma or line break.
     */
    public static String escapeField(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String field = value;
        char first = field.charAt(0);
        if (first == '=' || first == '+' || first == '-' || first == '@' || first == '\t' || first == '\r') {
            field = "'" + field;
        }
        if (field.indexOf('"') >= 0 || field.indexOf(',') >= 0
                || field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0) {
            field = '"' + field.replace("\"", "\"\"") + '"';
        }
        return field;
    }

    // 12.0 -> "12", 12.50 -> "12.5"
    static String formatElapsed(double elapsedMs) {
        return BigDecimal.valueOf(elapsedMs).stripTrailingZeros().toPlainString();
    }
}
