package domain.model;

/**
 * Sink for formatting warnings.
 *
 * <p>Lets the batch loop report problems without coupling it to the CLI
 * console or the XLSX writer.</p>
 */
public interface FormatWarningSink {

    static FormatWarningSink none() {
        return NullFormatWarningSink.INSTANCE;
    }

    void warn(FormatWarning warning);
}
