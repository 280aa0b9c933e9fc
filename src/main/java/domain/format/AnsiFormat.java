package domain.format;

/** ANSI SGR sequences used for terminal decoration. */
public enum AnsiFormat {
    RESET("\u001b[0m"),
    BOLD("\u001b[1m"),
    DIM("\u001b[2m"),
    UNDERLINE("\u001b[4m"),

    RED("\u001b[31m"),
    ORANGE("\u001b[38;5;208m"),
    YELLOW("\u001b[33m"),
    GREEN("\u001b[32m"),
    BLUE("\u001b[34m"),
    PURPLE("\u001b[35m"),
    CYAN("\u001b[36m"),
    WHITE("\u001b[37m"),
    GRAY("\u001b[90m"),

    BRIGHT_RED("\u001b[91m"),
    BRIGHT_GREEN("\u001b[92m"),
    BRIGHT_YELLOW("\u001b[93m"),
    BRIGHT_BLUE("\u001b[94m"),
    BRIGHT_PURPLE("\u001b[95m"),
    BRIGHT_CYAN("\u001b[96m"),
    BRIGHT_WHITE("\u001b[97m");

    private final String code;

    AnsiFormat(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
