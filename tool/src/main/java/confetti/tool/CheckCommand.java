package confetti.tool;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import confetti.lang.ConfettiException;
import confetti.lang.Confetti;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "check",
    description = "Parse each file and report the first error in it"
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to check, - for standard input")
    private List<String> files;

    @ParentCommand
    private ConfettiCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        var options = parent.parserOptions();

        var failures = 0;
        for (var file : files) {
            try {
                var tree = Confetti.parse(ConfettiCommand.readSource(file), options);
                log.debug("{}: {} top-level directives", file, tree.directives().size());
                out.println(file + ": ok");
            } catch (ConfettiException ex) {
                failures++;
                err.println(file + ": " + ex.getMessage());
            }
        }
        out.flush();
        err.flush();
        return failures == 0 ? 0 : 1;
    }
}
