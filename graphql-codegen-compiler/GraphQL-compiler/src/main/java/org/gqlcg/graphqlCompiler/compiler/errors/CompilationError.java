package org.gqlcg.graphqlCompiler.compiler.errors;

import javax.annotation.Nullable;

/** A problem in the compiled document. */
public class CompilationError extends BaseCompilerException {
    public CompilationError(String message) {
        this(message, SourcePosition.INVALID);
    }

    public CompilationError(String message, SourcePosition position) {
        super(message, position);
    }

    public CompilationError(String message, SourcePosition position, @Nullable Throwable cause) {
        super(message, position, cause);
    }

    @Override
    public String getErrorKind() {
        return "Compilation error";
    }
}
