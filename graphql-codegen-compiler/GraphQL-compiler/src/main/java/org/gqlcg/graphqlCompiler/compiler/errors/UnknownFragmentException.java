package org.gqlcg.graphqlCompiler.compiler.errors;

/** A selection set spreads a fragment that is not defined in the document.
 * This aborts the compilation of the whole document. */
public final class UnknownFragmentException extends CompilationError {
    /** Name of the fragment that has no definition. */
    public final String fragmentName;
    /** Operation or fragment whose selections reference the missing fragment. */
    public final String referencedFrom;

    public UnknownFragmentException(String fragmentName, String referencedFrom) {
        super("Cannot find fragment " + fragmentName + " referenced from " + referencedFrom);
        this.fragmentName = fragmentName;
        this.referencedFrom = referencedFrom;
    }

    @Override
    public String getErrorKind() {
        return "Unknown fragment";
    }
}
