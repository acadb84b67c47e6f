package org.empiresim.cli.commands.odds;

import org.empiresim.runtime.probability.LobbyingOdds;
import org.empiresim.runtime.probability.LobbyingOdds.LobbyingAttempt;
import org.empiresim.runtime.probability.LobbyingOdds.OfficeLevel;
import org.empiresim.runtime.probability.ResolvedOutcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "lobbying",
    mixinStandardHelpOptions = true,
    description = "Resolves a lobbying attempt and prints every term of the formula."
)
public class LobbyingOddsCommand implements Callable<Integer> {

    @ParentCommand
    private OddsCommand parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--player", defaultValue = "player", description = "Acting player (default: ${DEFAULT-VALUE})")
    private String playerId;

    @Option(names = "--legislation", defaultValue = "bill", description = "Target legislation (default: ${DEFAULT-VALUE})")
    private String legislationId;

    @Option(names = "--office", defaultValue = "LOCAL", description = "Office level: ${COMPLETION-CANDIDATES}")
    private OfficeLevel officeLevel;

    @Option(names = "--donation", defaultValue = "0", description = "Donation amount")
    private double donation;

    @Option(names = "--influence", defaultValue = "0", description = "Influence score")
    private double influence;

    @Option(names = "--reputation", defaultValue = "50", description = "Reputation 0-100")
    private double reputation;

    @Option(names = "--composite", defaultValue = "0.5", description = "State composite 0-1")
    private double composite;

    @Option(names = "--weeks-to-election", defaultValue = "52", description = "Weeks until the next election")
    private double weeksToElection;

    @Option(names = "--prior-successes", defaultValue = "0", description = "Earlier successful attempts")
    private int priorSuccesses;

    @Option(names = "--economy", defaultValue = "0", description = "Economic condition -1..1")
    private double economy;

    @Override
    public Integer call() {
        final LobbyingOdds odds = LobbyingOdds.fromConfig(parent.probabilityConfig());
        final LobbyingAttempt attempt = new LobbyingAttempt(playerId, legislationId, officeLevel, donation,
            influence, reputation, composite, weeksToElection, priorSuccesses, economy);
        final ResolvedOutcome outcome = odds.resolve(attempt);

        final PrintWriter out = spec.commandLine().getOut();
        OddsCommand.printBreakdown(out, outcome.breakdown());
        out.printf(Locale.ROOT, "%-21s %.6f%n", "roll", outcome.roll());
        out.printf(Locale.ROOT, "%-21s %s%n", "outcome", outcome.success() ? "SUCCESS" : "FAILURE");
        out.flush();
        return 0;
    }
}
