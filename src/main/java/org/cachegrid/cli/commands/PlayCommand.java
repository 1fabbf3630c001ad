package org.cachegrid.cli.commands;

import org.cachegrid.cli.CommandLineInterface;
import org.cachegrid.cli.console.GameConsole;
import org.cachegrid.runtime.GameOptions;
import org.cachegrid.runtime.GameSession;
import org.cachegrid.runtime.model.CellId;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "play",
    description = "Start an interactive game session in the terminal"
)
public class PlayCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(PlayCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws IOException {
        GameOptions options = GameOptions.fromConfig(parent.getConfig().getConfig("cachegrid"));
        GameSession session = new GameSession(options);
        CellId start = session.reportPlayerMoved(options.getOrigin());
        LOG.info("Game started at cell {} with seed {}", start, options.getSeed());

        GameConsole console = new GameConsole(session);
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader lineReader = LineReaderBuilder.builder()
                .terminal(terminal)
                .history(new DefaultHistory())
                .build();
            PrintWriter out = terminal.writer();
            out.println("Welcome to CacheGrid. Type 'help' for a list of commands.");
            out.println(console.execute("status"));
            out.flush();

            while (!console.isExitRequested()) {
                String line;
                try {
                    line = lineReader.readLine("cachegrid> ");
                } catch (UserInterruptException | EndOfFileException e) {
                    // Ctrl+C or Ctrl+D
                    break;
                }
                String response = console.execute(line);
                if (!response.isEmpty()) {
                    out.println(response);
                    out.flush();
                }
            }
        }
        LOG.info("Game ended, {} cells changed, won={}", session.overlaySize(), session.isWon());
        return 0;
    }
}
