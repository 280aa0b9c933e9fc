package infra.output;

import domain.output.SqlFileNamePolicy;
import domain.output.SqlOutputWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores formatted SQL into files.
 * <p>
 * Output layout: {@code <outDir>/<sqlId>.sql}, always ending with a newline.
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public void write(Path outDir, String sqlId, String sqlText) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");

        try {
            Files.createDirectories(outDir);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create output directory: " + outDir, e);
        }

        Path target = outDir.resolve(SqlFileNamePolicy.build(sqlId));
        String body = sqlText == null ? "" : sqlText;
        if (!body.endsWith("\n")) body = body + "\n";

        try {
            Files.writeString(target, body, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write sql file: " + target, e);
        }
    }
}
