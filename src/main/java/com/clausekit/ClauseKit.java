package com.clausekit;

import com.clausekit.clause.ClauseSelector;
import com.clausekit.clause.Clauses;
import com.clausekit.filter.FilterSimplifier;
import com.clausekit.filter.QueryUpdater;
import com.clausekit.json.JsonNode;
import com.clausekit.json.JsonNodeParser;
import com.clausekit.output.OutputFormatter;
import com.clausekit.path.KeyPath;
import com.clausekit.walk.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "clausekit", mixinStandardHelpOptions = true, version = "1.0",
         description = "Inspect and rewrite the clauses of JSON query documents",
         subcommands = {
             ClauseKit.Normalize.class,
             ClauseKit.Collect.class,
             ClauseKit.Rewrite.class,
             ClauseKit.Simplify.class,
             ClauseKit.AddFilter.class
         })
public class ClauseKit implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ClauseKit.class);

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ClauseKit()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    /**
     * Options shared by every subcommand: the input document and how results are printed.
     */
    static class DocumentOptions {
        @Parameters(index = "0", arity = "0..1", description = "Input JSON document (default: stdin)")
        File inputFile;

        @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
        boolean compactOutput = false;

        @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
        boolean sortKeys = false;

        JsonNode readDocument() throws IOException {
            JsonNodeParser parser = new JsonNodeParser();
            if (inputFile == null) {
                return parser.parse(System.in);
            }
            try (InputStream input = new FileInputStream(inputFile)) {
                return parser.parse(input);
            }
        }

        OutputFormatter formatter() {
            return new OutputFormatter(!compactOutput, sortKeys);
        }
    }

    abstract static class DocumentCommand implements Callable<Integer> {
        @Mixin
        DocumentOptions options;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            try {
                JsonNode document = options.readDocument();
                PrintWriter out = spec.commandLine().getOut();
                OutputFormatter formatter = options.formatter();
                for (JsonNode result : process(document)) {
                    out.println(formatter.format(result));
                }
                out.flush();
                return 0;
            } catch (Exception e) {
                log.debug("{} failed", spec.name(), e);
                PrintWriter err = spec.commandLine().getErr();
                err.println("Error: " + e.getMessage());
                err.flush();
                return 1;
            }
        }

        abstract Iterable<JsonNode> process(JsonNode document) throws IOException;
    }

    @Command(name = "normalize", mixinStandardHelpOptions = true,
             description = "Rewrite every clause tag to its canonical lower-case, hyphenated form")
    static class Normalize extends DocumentCommand {
        @Override
        Iterable<JsonNode> process(JsonNode document) {
            return List.of(Clauses.normalizeTags(document));
        }
    }

    @Command(name = "collect", mixinStandardHelpOptions = true,
             description = "Print every clause with one of the given tags, innermost first")
    static class Collect extends DocumentCommand {
        @Option(names = {"-t", "--tag"}, required = true, description = "Clause tag to look for (repeatable)")
        String[] tags;

        @Option(names = {"-p", "--path"}, defaultValue = ".", description = "Key path to search under (default: ${DEFAULT-VALUE})")
        String path;

        @Override
        Iterable<JsonNode> process(JsonNode document) {
            JsonNode subtree = KeyPath.parse(path).get(document);
            return new TreeWalker().collect(ClauseSelector.anyOf(tags), subtree);
        }
    }

    @Command(name = "rewrite", mixinStandardHelpOptions = true,
             description = "Replace every clause with one of the given tags by a constant JSON value")
    static class Rewrite extends DocumentCommand {
        @Option(names = {"-t", "--tag"}, required = true, description = "Clause tag to replace (repeatable)")
        String[] tags;

        @Option(names = {"-w", "--with"}, required = true, description = "JSON replacement value")
        String replacement;

        @Option(names = {"-p", "--path"}, defaultValue = ".", description = "Key path to rewrite under (default: ${DEFAULT-VALUE})")
        String path;

        @Override
        Iterable<JsonNode> process(JsonNode document) throws IOException {
            JsonNode value = new JsonNodeParser().parse(replacement);
            return List.of(new TreeWalker().rewriteAt(KeyPath.parse(path), ClauseSelector.anyOf(tags), document,
                clause -> value));
        }
    }

    @Command(name = "simplify", mixinStandardHelpOptions = true,
             description = "Simplify the compound filter clause at a key path")
    static class Simplify extends DocumentCommand {
        @Option(names = {"-p", "--path"}, defaultValue = ".", description = "Key path of the filter clause (default: ${DEFAULT-VALUE})")
        String path;

        @Override
        Iterable<JsonNode> process(JsonNode document) {
            FilterSimplifier simplifier = new FilterSimplifier();
            return List.of(KeyPath.parse(path).update(document, simplifier::simplify));
        }
    }

    @Command(name = "add-filter", mixinStandardHelpOptions = true,
             description = "Combine a filter clause with the filter of a query document")
    static class AddFilter extends DocumentCommand {
        @Option(names = {"-f", "--clause"}, required = true, description = "JSON filter clause to add")
        String clause;

        @Option(names = {"-p", "--path"}, defaultValue = ".query.filter", description = "Key path of the filter (default: ${DEFAULT-VALUE})")
        String path;

        @Override
        Iterable<JsonNode> process(JsonNode document) throws IOException {
            JsonNode newClause = new JsonNodeParser().parse(clause);
            return List.of(new QueryUpdater().addFilterClause(document, KeyPath.parse(path), newClause));
        }
    }
}
