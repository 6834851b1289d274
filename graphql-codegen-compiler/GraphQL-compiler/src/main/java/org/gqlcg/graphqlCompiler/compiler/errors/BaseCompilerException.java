package org.gqlcg.graphqlCompiler.compiler.errors;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by the compiler. */
public abstract class BaseCompilerException extends RuntimeException {
    public final SourcePosition position;

    protected BaseCompilerException(String message, SourcePosition position, @Nullable Throwable throwable) {
        super(message, throwable);
        this.position = position;
    }

    protected BaseCompilerException(String message, SourcePosition position) {
        this(message, position, null);
    }

    public SourcePosition getPosition() {
        return this.position;
    }

    public abstract String getErrorKind();

    /** Message prefixed with the kind of error and the position, if known. */
    public String format() {
        StringBuilder builder = new StringBuilder();
        if (this.position.isValid())
            builder.append(this.position).append(": ");
        builder.append(this.getErrorKind())
                .append(": ")
                .append(this.getMessage());
        return builder.toString();
    }
}
