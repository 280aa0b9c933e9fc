package infra.text;

import domain.text.SqlSource;
import domain.text.SqlSourceLoader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 단일 .sql 파일 로더. id 는 파일 경로, 언어 태그는 비워둔다(자동 감지 대상).
 */
public final class FileSqlSourceLoader implements SqlSourceLoader {

    @Override
    public List<SqlSource> load(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("sql file location is blank");
        }
        Path p = Path.of(location.trim());
        try {
            String text = Files.readString(p, StandardCharsets.UTF_8);
            return List.of(new SqlSource(p.toString(), text, ""));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to read sql file: " + p, e);
        }
    }
}
