package org.gqlcg.graphqlCompiler.ir;

/** An argument value which refers to an operation variable. */
public record IRVariableReference(String variableName) {
    @Override
    public String toString() {
        return "$" + this.variableName;
    }
}
