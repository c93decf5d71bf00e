package io.cleanapi.core.error;

/**
 * Thrown while building an endpoint or a contract when the declaration is inconsistent: a path
 * template that does not start with {@code /}, placeholders that do not match the declared
 * path-parameter names, duplicate endpoint names, or a missing method, path or resolver.
 */
public final class ContractDefinitionException extends CleanApiException {

    private static final long serialVersionUID = 1L;

    private final String pathTemplate;

    public ContractDefinitionException(String message, String endpoint, String pathTemplate) {
        super(message, endpoint, Stage.DEFINITION);
        this.pathTemplate = pathTemplate;
    }

    public ContractDefinitionException(String message, Throwable cause, String endpoint, String pathTemplate) {
        super(message, cause, endpoint, Stage.DEFINITION);
        this.pathTemplate = pathTemplate;
    }

    /** The offending path template, or {@code null} when the error is not path related. */
    public String pathTemplate() {
        return pathTemplate;
    }
}
