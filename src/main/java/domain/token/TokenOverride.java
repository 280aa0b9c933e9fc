package domain.token;

/**
 * Dialect hook applied to every token before the renderer dispatches on it.
 *
 * <p>Receives the token and the last reserved word the renderer has seen
 * ({@link Token#EMPTY} at the start) and returns the token to render.</p>
 */
@FunctionalInterface
public interface TokenOverride {

    TokenOverride NONE = (token, previousReservedWord) -> token;

    Token apply(Token token, Token previousReservedWord);
}
