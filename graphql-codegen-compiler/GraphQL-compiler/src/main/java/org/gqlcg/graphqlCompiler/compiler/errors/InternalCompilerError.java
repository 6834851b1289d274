package org.gqlcg.graphqlCompiler.compiler.errors;

/** Signals a bug in the compiler -- some expected invariant doesn't hold. */
public final class InternalCompilerError extends BaseCompilerException {
    public InternalCompilerError(String message, SourcePosition position) {
        super(message, position);
    }

    public InternalCompilerError(String message) {
        this(message, SourcePosition.INVALID);
    }

    public InternalCompilerError(String message, Throwable cause) {
        super(message, SourcePosition.INVALID, cause);
    }

    @Override
    public String getErrorKind() {
        return "Compiler error";
    }
}
