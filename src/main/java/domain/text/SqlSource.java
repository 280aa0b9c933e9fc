package domain.text;

/**
 * 배치/파일 입력 한 건 (id + SQL 원문 + 선택적 언어 태그).
 */
public final class SqlSource {

    private final String id;
    private final String sqlText;
    /**
     * 비어있으면 실행 기본 언어를 사용한다.
     */
    private final String languageTag;

    public SqlSource(String id, String sqlText, String languageTag) {
        this.id = id == null ? "" : id.trim();
        this.sqlText = sqlText == null ? "" : sqlText;
        this.languageTag = languageTag == null ? "" : languageTag.trim();
    }

    public String getId() {
        return id;
    }

    public String getSqlText() {
        return sqlText;
    }

    public String getLanguageTag() {
        return languageTag;
    }

    public boolean hasLanguageTag() {
        return !languageTag.isEmpty();
    }

    public boolean isBlank() {
        return sqlText.trim().isEmpty();
    }

    @Override
    public String toString() {
        return id;
    }
}
