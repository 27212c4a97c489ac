package ppi.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a monthly indicator table. Expected: a header row whose first column is the
 * date ({@code yyyy-MM} or {@code yyyy-MM-dd}) followed by numeric index columns.
 * Rows whose target or any predictor is missing or non-numeric are dropped. A month
 * given twice, or missing once the dropped rows are gone, makes the file invalid.
 */
public final class CsvDatasetReader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvDatasetReader.class);

    private final String target;

    public CsvDatasetReader(String target) {
        if (target == null || target.isBlank()) throw new IllegalArgumentException("target column required");
        this.target = target.trim();
    }

    public IndexData read(Path path) throws IOException {
        return parse(Files.readAllLines(path));
    }

    public IndexData parse(List<String> lines) {
        String[] header = null;
        TreeMap<YearMonth, double[]> byMonth = new TreeMap<>();
        int dropped = 0;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("[,;\t]", -1);
            if (header == null) {
                header = new String[parts.length];
                for (int i = 0; i < parts.length; i++) header[i] = unquote(parts[i]).toLowerCase();
                continue;
            }
            YearMonth month = parseMonth(unquote(parts[0]));
            if (month == null || parts.length != header.length) {
                dropped++;
                continue;
            }
            double[] row = new double[header.length - 1];
            boolean ok = true;
            for (int j = 1; j < parts.length && ok; j++) {
                try {
                    row[j - 1] = Double.parseDouble(unquote(parts[j]));
                    ok = !Double.isNaN(row[j - 1]);
                } catch (NumberFormatException e) {
                    ok = false;
                }
            }
            if (!ok) {
                dropped++;
                continue;
            }
            if (byMonth.put(month, row) != null) {
                throw new IllegalArgumentException("duplicate rows for month " + month);
            }
        }
        if (header == null || byMonth.isEmpty()) throw new IllegalArgumentException("no usable rows");
        if (dropped > 0) LOG.info("Dropped {} incomplete rows", dropped);

        YearMonth start = byMonth.firstKey();
        YearMonth expected = start;
        for (YearMonth m : byMonth.keySet()) {
            if (!m.equals(expected)) {
                throw new IllegalArgumentException("monthly gap: expected " + expected + " but found " + m);
            }
            expected = expected.plusMonths(1);
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        List<double[]> rows = new ArrayList<>(byMonth.values());
        for (int j = 1; j < header.length; j++) {
            double[] col = new double[rows.size()];
            for (int i = 0; i < rows.size(); i++) col[i] = rows.get(i)[j - 1];
            columns.put(header[j], col);
        }
        LOG.info("Loaded {} months from {} to {}", rows.size(), start, byMonth.lastKey());
        return new IndexData(start, new TabularDataset(columns, target));
    }

    static YearMonth parseMonth(String s) {
        if (s.isEmpty()) return null;
        String v = s.replace('/', '-');
        if (v.length() > 7) v = v.substring(0, 7);
        try {
            return YearMonth.parse(v);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String unquote(String s) {
        String v = s.trim();
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) v = v.substring(1, v.length() - 1).trim();
        return v;
    }
}
