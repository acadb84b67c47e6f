package org.empiresim.cli.commands.odds;

import org.empiresim.runtime.probability.BreakthroughOdds;
import org.empiresim.runtime.probability.BreakthroughOdds.Discovery;
import org.empiresim.runtime.probability.BreakthroughOdds.ResearchArea;
import org.empiresim.runtime.probability.BreakthroughOdds.ResearchAttempt;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "research",
    mixinStandardHelpOptions = true,
    description = "Rolls one research cycle and prints every term of the formula."
)
public class ResearchOddsCommand implements Callable<Integer> {

    @ParentCommand
    private OddsCommand parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--project", defaultValue = "project", description = "Research project (default: ${DEFAULT-VALUE})")
    private String projectId;

    @Option(names = "--area", defaultValue = "EFFICIENCY", description = "Research area: ${COMPLETION-CANDIDATES}")
    private ResearchArea area;

    @Option(names = "--compute", defaultValue = "0", description = "Compute budget of the cycle")
    private double compute;

    @Option(names = "--skill", defaultValue = "50", description = "Average team skill 0-100")
    private double skill;

    @Option(names = "--reputation", defaultValue = "50", description = "Lab reputation 0-100")
    private double reputation;

    @Option(names = "--specialization", defaultValue = "0.5", description = "Team fit to the area 0-1")
    private double specialization;

    @Option(names = "--months-to-deadline", defaultValue = "12", description = "Months until the deadline")
    private double monthsToDeadline;

    @Option(names = "--prior-breakthroughs", defaultValue = "0", description = "Earlier breakthroughs")
    private int priorBreakthroughs;

    @Option(names = "--economy", defaultValue = "0", description = "Economic condition -1..1")
    private double economy;

    @Option(names = "--cycle", defaultValue = "1", description = "Research cycle index, part of the seed")
    private long cycle;

    @Override
    public Integer call() {
        final BreakthroughOdds odds = BreakthroughOdds.fromConfig(parent.probabilityConfig());
        final ResearchAttempt attempt = new ResearchAttempt(projectId, area, compute, skill, reputation,
            specialization, monthsToDeadline, priorBreakthroughs, economy);
        final Discovery discovery = odds.roll(attempt, cycle);

        final PrintWriter out = spec.commandLine().getOut();
        OddsCommand.printBreakdown(out, discovery.outcome().breakdown());
        out.printf(Locale.ROOT, "%-21s %.6f%n", "roll", discovery.outcome().roll());
        out.printf(Locale.ROOT, "%-21s %s%n", "discovery", discovery.tier());
        out.flush();
        return 0;
    }
}
