package org.cachegrid.cli.commands;

import org.cachegrid.cli.CommandLineInterface;
import org.cachegrid.runtime.GameOptions;
import org.cachegrid.runtime.GameSession;
import org.cachegrid.runtime.model.BaselineContent;
import org.cachegrid.runtime.model.CellBounds;
import org.cachegrid.runtime.model.CellId;
import org.cachegrid.runtime.worldgen.CacheGenerator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Prints the generated baseline of a square region, north at the top.
 * Empty cells print as {@code .}, caches as their value.
 */
@Command(
    name = "inspect",
    description = "Print the generated baseline caches around a cell"
)
public class InspectCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--row"}, description = "Row of the centre cell (default: ${DEFAULT-VALUE})", defaultValue = "0")
    private int row;

    @Option(names = {"-j", "--column"}, description = "Column of the centre cell (default: ${DEFAULT-VALUE})", defaultValue = "0")
    private int column;

    @Option(names = {"-r", "--radius"}, description = "Chebyshev radius of the region (default: ${DEFAULT-VALUE})", defaultValue = "8")
    private int radius;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (radius < 0) {
            spec.commandLine().getErr().println("Radius must be non-negative: " + radius);
            return 2;
        }
        GameOptions options = GameOptions.fromConfig(parent.getConfig().getConfig("cachegrid"));
        CacheGenerator generator = GameSession.createGenerator(options);
        CellBounds region = CellBounds.around(new CellId(row, column), radius);

        int caches = 0;
        out.printf("Seed %d, cells i=[%d..%d] j=[%d..%d]%n",
            options.getSeed(), region.minI(), region.maxI(), region.minJ(), region.maxJ());
        for (int i = region.maxI(); i >= region.minI(); i--) {
            StringBuilder line = new StringBuilder();
            for (int j = region.minJ(); j <= region.maxJ(); j++) {
                BaselineContent content = generator.generate(i, j);
                if (content.present()) {
                    caches++;
                }
                line.append(String.format("%3s", content.present() ? Integer.toString(content.value()) : "."));
            }
            out.println(line);
        }
        out.printf("%d caches in %d cells%n", caches, region.cellCount());
        out.flush();
        return 0;
    }
}
