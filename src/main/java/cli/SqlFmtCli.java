package cli;

import app.SqlFmtCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Option parsing, config resolution and the commands live in
 * {@link SqlFmtCliApp} so they can be tested without exiting the JVM.</p>
 */
public class SqlFmtCli {

    public static void main(String[] args) {
        int code = SqlFmtCliApp.run(args, System.in, System.out, System.err);
        if (code != 0) System.exit(code);
    }
}
