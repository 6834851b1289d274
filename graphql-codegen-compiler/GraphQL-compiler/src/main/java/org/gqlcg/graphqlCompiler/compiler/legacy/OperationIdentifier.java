package org.gqlcg.graphqlCompiler.compiler.legacy;

import org.gqlcg.util.HashString;

import java.util.ArrayList;
import java.util.List;

/** Content-addressed identifiers of operations, used to match persisted
 * queries between clients and servers.  The identifier is the lowercase
 * hexadecimal SHA-256 of the UTF-8 encoding of the operation source
 * followed by the sources of the fragments it references, joined by
 * newlines.  Sources are the printed form of the parsed definitions, so
 * whitespace and comments in the input text do not change identifiers. */
public final class OperationIdentifier {
    private OperationIdentifier() {}

    public static String sourceWithFragments(String operationSource, List<String> fragmentSources) {
        List<String> parts = new ArrayList<>(fragmentSources.size() + 1);
        parts.add(operationSource);
        parts.addAll(fragmentSources);
        return String.join("\n", parts);
    }

    public static HashString compute(String sourceWithFragments) {
        return HashString.sha256(sourceWithFragments);
    }
}
