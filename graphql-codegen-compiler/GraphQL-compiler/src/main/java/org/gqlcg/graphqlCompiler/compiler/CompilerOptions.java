package org.gqlcg.graphqlCompiler.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import org.gqlcg.graphqlCompiler.compiler.errors.CompilationError;
import org.gqlcg.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** Options for the GraphQL compiler.  The fields can be set directly, or
 * parsed from an argument vector with {@link #parse(String...)}. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /** Options which change the shape of the compiled IR. */
    @SuppressWarnings("CanBeFinal")
    public static class Language {
        @Parameter(names = "--addTypename",
                description = "Add __typename to every selection set except operation roots")
        public boolean addTypename = false;
        @Parameter(names = "--mergeInFieldsFromFragmentSpreads", arity = 1,
                description = "Fold the fields of spread fragments into the selection sets that spread them")
        public boolean mergeInFieldsFromFragmentSpreads = true;
        @Parameter(names = "--generateOperationIds", arity = 1,
                description = "Compute a SHA-256 identifier for every operation")
        public boolean generateOperationIds = true;
        @Parameter(names = "--maxSelectionDepth",
                description = "Maximum nesting of selection sets accepted by the compiler")
        public int maxSelectionDepth = 128;

        public boolean same(Language other) {
            return this.addTypename == other.addTypename &&
                    this.mergeInFieldsFromFragmentSpreads == other.mergeInFieldsFromFragmentSpreads &&
                    this.generateOperationIds == other.generateOperationIds &&
                    this.maxSelectionDepth == other.maxSelectionDepth;
        }

        public void validate() {
            if (this.maxSelectionDepth <= 0)
                throw new CompilationError("Invalid options: maxSelectionDepth must be positive, got " +
                        this.maxSelectionDepth);
        }

        @Override
        public String toString() {
            return "Language{" +
                    "\n\taddTypename=" + this.addTypename +
                    ",\n\tmergeInFieldsFromFragmentSpreads=" + this.mergeInFieldsFromFragmentSpreads +
                    ",\n\tgenerateOperationIds=" + this.generateOperationIds +
                    ",\n\tmaxSelectionDepth=" + this.maxSelectionDepth +
                    '}';
        }
    }

    /** Options which are carried to the code generators and logging. */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "--passthroughCustomScalars",
                description = "Use the names of custom scalars as type names in generated code")
        public boolean passthroughCustomScalars = false;
        @Nullable @Parameter(names = "--customScalarsPrefix",
                description = "Prefix for the names of custom scalar types")
        public String customScalarsPrefix = null;
        @Nullable @Parameter(names = "--namespace",
                description = "Namespace for the generated code")
        public String namespace = null;

        public boolean same(IO other) {
            return this.passthroughCustomScalars == other.passthroughCustomScalars &&
                    Objects.equals(this.customScalarsPrefix, other.customScalarsPrefix) &&
                    Objects.equals(this.namespace, other.namespace);
        }

        public void validate() {
            if (this.customScalarsPrefix != null && !this.passthroughCustomScalars)
                throw new CompilationError(
                        "Invalid options: --customScalarsPrefix requires --passthroughCustomScalars");
            for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
                try {
                    Integer.parseInt(entry.getValue());
                } catch (NumberFormatException ex) {
                    throw new CompilationError(
                            "-T option must be followed by 'class=number'; could not parse " + entry);
                }
            }
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\tpassthroughCustomScalars=" + this.passthroughCustomScalars +
                    ",\n\tcustomScalarsPrefix=" + Utilities.singleQuote(this.customScalarsPrefix) +
                    ",\n\tnamespace=" + Utilities.singleQuote(this.namespace) +
                    ",\n\tloggingLevel=" + this.loggingLevel +
                    '}';
        }
    }

    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Language languageOptions = new Language();

    public CompilerOptions() {}

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    /** Build options from an argument vector, e.g. {@code --addTypename -T TypeCase=2}. */
    public static CompilerOptions parse(String... argv) {
        CompilerOptions options = new CompilerOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(options)
                .build();
        commander.setProgramName("graphql-legacy-ir");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            throw new CompilationError("Invalid options: " + ex.getMessage());
        }
        options.validate();
        return options;
    }

    public void validate() {
        this.ioOptions.validate();
        this.languageOptions.validate();
    }

    public boolean same(CompilerOptions other) {
        if (!this.ioOptions.same(other.ioOptions)) return false;
        return this.languageOptions.same(other.languageOptions);
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nioOptions=" + this.ioOptions +
                ",\nlanguageOptions=" + this.languageOptions +
                "\n}";
    }
}
