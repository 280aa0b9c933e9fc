package app;

import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.text.SqlSource;
import infra.config.ConfigFile;
import infra.config.ConfigFileLoader;
import infra.config.IgnoreFile;
import infra.output.FileSqlOutputWriter;
import infra.output.NullResultWriter;
import infra.output.NullSqlOutputWriter;
import infra.output.XlsxResultWriter;
import infra.text.CsvSqlSourceLoader;
import infra.text.FileSqlSourceLoader;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Object-assembly factory for {@link SqlFmtCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging and moves object
 * creation and file loading here.
 */
final class SqlFmtComponentsFactory {

    /** --config 가 있으면 그 파일, 없으면 시작 디렉토리부터 탐색. */
    Optional<ConfigFile> loadConfigFile(Path explicit, Path startDir, Path homeDir) {
        if (explicit != null) {
            return Optional.of(ConfigFileLoader.load(explicit));
        }
        return ConfigFileLoader.discover(startDir, homeDir)
                .map(ConfigFileLoader::load);
    }

    IgnoreFile loadIgnoreFile(Path startDir) {
        return IgnoreFile.discover(startDir);
    }

    List<SqlSource> loadBatchSources(Path csv) {
        return new CsvSqlSourceLoader().load(csv.toString());
    }

    SqlSource loadFile(Path file) {
        return new FileSqlSourceLoader().load(file.toString()).get(0);
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter();
    }
}
