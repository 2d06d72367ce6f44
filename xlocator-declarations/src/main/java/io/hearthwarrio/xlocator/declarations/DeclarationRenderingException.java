package io.hearthwarrio.xlocator.declarations;

/**
 * Thrown when locator metadata cannot be serialized.
 */
public class DeclarationRenderingException extends RuntimeException {
    public DeclarationRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
