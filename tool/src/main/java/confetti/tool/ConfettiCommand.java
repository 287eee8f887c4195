package confetti.tool;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import confetti.lang.ParserOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Command-line entry point. Parser flags are given before the subcommand and
 * apply to all of them.
 */
@Command(
    name = "confetti",
    mixinStandardHelpOptions = true,
    version = "confetti 0.1.0",
    description = "Check, format and inspect Confetti configuration files",
    subcommands = {
        CheckCommand.class,
        FormatCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class ConfettiCommand implements Callable<Integer> {

    /** Stands for standard input in place of a file name. */
    static final String STDIN = "-";

    @Option(names = "--c-comments", description = "Accept // and /* */ comments")
    private boolean cStyleComments;

    @Option(names = "--expressions", description = "Accept parenthesized expression arguments")
    private boolean expressions;

    @Option(names = "--no-triple-quotes", description = "Read \"\"\" as an empty string followed by a quote")
    private boolean noTripleQuotes;

    @Option(names = "--max-depth", paramLabel = "N", description = "Maximum nesting depth (default: ${DEFAULT-VALUE})")
    private int maxDepth = ParserOptions.DEFAULT.getMaxDepth();

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        spec.commandLine().usage(out);
        out.flush();
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * The command line as {@link #main} runs it, for use in tests.
     */
    public static CommandLine createCommandLine() {
        var commandLine = new CommandLine(new ConfettiCommand());
        commandLine.setCommandName("confetti");
        return commandLine;
    }

    ParserOptions parserOptions() {
        return ParserOptions.builder()
            .allowCStyleComments(cStyleComments)
            .allowExpressionArguments(expressions)
            .allowTripleQuotes(!noTripleQuotes)
            .maxDepth(maxDepth)
            .build();
    }

    /**
     * The text of {@code file}, or of standard input for {@value #STDIN}.
     */
    static String readSource(String file) {
        if (STDIN.equals(file)) {
            try {
                return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new ConfettiIoException(Path.of(STDIN), ex);
            }
        }
        return ConfettiFiles.read(Path.of(file));
    }
}
