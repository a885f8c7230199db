package io.github.pyrox.ladder.cli;

import io.github.pyrox.ladder.LadderException;
import io.github.pyrox.ladder.layout.LayoutConfig;
import io.github.pyrox.ladder.layout.RoutineLayout;
import io.github.pyrox.ladder.util.LayoutIo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Lays out a routine file and prints the geometry snapshot, or writes it to a second path.
 */
@CommandLine.Command(
        name = "ladder-layout",
        mixinStandardHelpOptions = true,
        description = "Computes ladder geometry for a routine and emits it as JSON.")
public final class LadderLayoutCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(LadderLayoutCli.class);

    @CommandLine.Parameters(index = "0", paramLabel = "ROUTINE", description = "Routine JSON to lay out.")
    private Path routine;

    @CommandLine.Parameters(
            index = "1",
            arity = "0..1",
            paramLabel = "OUTPUT",
            description = "Where to write the layout; printed to stdout when omitted.")
    @Nullable
    private Path output;

    public static void main(String[] args) {
        System.exit(new CommandLine(new LadderLayoutCli()).execute(args));
    }

    @Override
    public Integer call() {
        try {
            var parsed = LayoutIo.readRoutine(routine);
            var layout = new RoutineLayout(parsed, LayoutConfig.load());
            logger.info("Laid out routine {} ({} rungs, extent {})", parsed.name(), parsed.size(), layout.extent());
            if (output == null) {
                System.out.println(LayoutIo.toJson(layout));
            } else {
                LayoutIo.writeLayout(layout, output);
            }
            return 0;
        } catch (IOException | LadderException e) {
            logger.error("Layout failed for {}", routine, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
