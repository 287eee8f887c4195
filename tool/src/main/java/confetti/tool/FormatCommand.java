package confetti.tool;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import confetti.lang.ConfettiException;
import confetti.lang.Confetti;
import confetti.lang.MapperOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "format",
    description = "Print a file in canonical layout, or rewrite it in place"
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "File to format, - for standard input")
    private String file;

    @Option(names = "--indent", paramLabel = "N", description = "Spaces per nesting level (default: ${DEFAULT-VALUE})")
    private int indent = 2;

    @Option(names = "--in-place", description = "Overwrite the file instead of printing")
    private boolean inPlace;

    @Option(names = "--drop-comments", description = "Allow --in-place to rewrite a file that has comments, which are not kept")
    private boolean dropComments;

    @ParentCommand
    private ConfettiCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        if (indent < 0) {
            err.println("Error: --indent must not be negative");
            return 2;
        }
        if (inPlace && ConfettiCommand.STDIN.equals(file)) {
            err.println("Error: --in-place needs a file, not standard input");
            return 2;
        }

        var parserOptions = parent.parserOptions();
        var options = MapperOptions.builder()
            .indent(" ".repeat(indent))
            .parserOptions(parserOptions)
            .build();
        try {
            var tree = Confetti.parse(ConfettiCommand.readSource(file), parserOptions);
            if (inPlace && !dropComments && !tree.comments().isEmpty()) {
                err.println(file + ": has " + tree.comments().size() + " comment(s) that formatting would drop;"
                    + " rerun with --drop-comments to rewrite it anyway");
                err.flush();
                return 1;
            }
            var text = Confetti.serialize(tree, options);
            if (inPlace) {
                ConfettiFiles.write(Path.of(file), text);
                log.info("Formatted {}", file);
            } else {
                out.print(text);
                out.flush();
            }
            return 0;
        } catch (ConfettiException ex) {
            err.println(file + ": " + ex.getMessage());
            err.flush();
            return 1;
        }
    }
}
