package infra.text;

import domain.text.SqlSource;
import domain.text.SqlSourceLoader;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 배치 입력 CSV 로더.
 *
 * <p>헤더 필수: {@code id, sql[, lang]}. 헤더 별칭 허용
 * (sql_text / query, language / dialect). 첫 헤더의 BOM 은 제거한다.</p>
 *
 * <p>commons-csv 의 first-record-as-header 대신 첫 row 를 직접 헤더로 읽어
 * 빈 헤더를 COL_n 으로 보정한다.</p>
 */
public final class CsvSqlSourceLoader implements SqlSourceLoader {

    @Override
    public List<SqlSource> load(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("csv location is blank");
        }

        try (InputStream is = openStream(location);
             InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return Collections.emptyList();

            // 1) header row
            CSVRecord headerRec = it.next();
            Map<String, Integer> headerIndex = new LinkedHashMap<>();
            for (int i = 0; i < headerRec.size(); i++) {
                String h = norm(headerRec.get(i));
                if (h.isEmpty()) h = "col_" + (i + 1);
                headerIndex.putIfAbsent(h, i);
            }

            Integer idIdx = findIndex(headerIndex, "id", "sqlid", "sql_id", "name");
            Integer sqlIdx = findIndex(headerIndex, "sql", "sql_text", "sqltext", "query");
            Integer langIdx = findIndex(headerIndex, "lang", "language", "dialect");

            if (sqlIdx == null) {
                throw new IllegalArgumentException("csv header must contain a sql column: " + location);
            }

            // 2) records
            List<SqlSource> out = new ArrayList<>(256);
            int rowNo = 0;
            while (it.hasNext()) {
                CSVRecord r = it.next();
                rowNo++;

                String sql = get(r, sqlIdx);
                String id = get(r, idIdx).trim();
                String lang = get(r, langIdx).trim();

                if (id.isEmpty() && sql.isBlank()) continue; // 완전히 빈 줄
                if (id.isEmpty()) id = "row" + rowNo;

                out.add(new SqlSource(id, sql, lang));
            }
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read csv: " + location, e);
        }
    }

    private static String get(CSVRecord r, Integer idx) {
        if (idx == null || idx < 0 || idx >= r.size()) return "";
        String v = r.get(idx);
        return v == null ? "" : v;
    }

    private static Integer findIndex(Map<String, Integer> headerIndex, String... candidates) {
        for (String c : candidates) {
            Integer idx = headerIndex.get(c);
            if (idx != null) return idx;
        }
        return null;
    }

    private static String norm(String s) {
        return stripBom(s == null ? "" : s).trim()
                .toLowerCase(Locale.ROOT);
    }

    private static String stripBom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    private InputStream openStream(String location) throws IOException {
        String s = location.trim();

        // classpath: 지원(옵션)
        if (s.startsWith("classpath:")) {
            String cp = s.substring("classpath:".length());
            InputStream is = CsvSqlSourceLoader.class.getResourceAsStream(cp.startsWith("/") ? cp : ("/" + cp));
            if (is == null) throw new IOException("classpath resource not found: " + s);
            return new BufferedInputStream(is);
        }

        Path p = Path.of(s);
        if (!Files.exists(p)) throw new IOException("csv not found: " + p.toAbsolutePath());
        return new BufferedInputStream(Files.newInputStream(p));
    }
}
