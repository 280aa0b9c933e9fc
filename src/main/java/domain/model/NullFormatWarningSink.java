package domain.model;

/** No-op warning sink. */
final class NullFormatWarningSink implements FormatWarningSink {

    static final NullFormatWarningSink INSTANCE = new NullFormatWarningSink();

    private NullFormatWarningSink() {
    }

    @Override
    public void warn(FormatWarning warning) {
        // no-op
    }
}
