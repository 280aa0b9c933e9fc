package domain.text;

import java.util.List;

/**
 * SQL 입력 목록을 얻는 책임을 캡슐화한다.
 */
public interface SqlSourceLoader {
    List<SqlSource> load(String location);
}
