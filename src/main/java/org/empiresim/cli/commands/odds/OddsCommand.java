package org.empiresim.cli.commands.odds;

import com.typesafe.config.Config;
import org.empiresim.cli.CommandLineInterface;
import org.empiresim.runtime.probability.ProbabilityBreakdown;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.Locale;

@Command(
    name = "odds",
    description = "Prints the full probability breakdown of an action for auditing",
    subcommands = {
        LobbyingOddsCommand.class,
        ResearchOddsCommand.class
    }
)
public class OddsCommand {

    @ParentCommand
    private CommandLineInterface parent;

    Config probabilityConfig() {
        return parent.getConfig().getConfig("empiresim.probability");
    }

    static void printBreakdown(final PrintWriter out, final ProbabilityBreakdown breakdown) {
        out.printf(Locale.ROOT, "profile               %s%n", breakdown.profile());
        out.printf(Locale.ROOT, "tier                  %s%n", breakdown.tierKey());
        out.printf(Locale.ROOT, "reputation curve      %s%n", breakdown.reputationCurve());
        row(out, "base", breakdown.base());
        row(out, "spend term", breakdown.spendTerm());
        row(out, "influence term", breakdown.influenceTerm());
        row(out, "composite", breakdown.compositeContribution());
        row(out, "proximity", breakdown.proximityMultiplier());
        row(out, "core", breakdown.core());
        row(out, "reputation term", breakdown.reputationTerm());
        row(out, "prior success bonus", breakdown.priorSuccessBonus());
        row(out, "economic modifier", breakdown.economicModifier());
        row(out, "jitter", breakdown.jitter());
        row(out, "raw", breakdown.raw());
        row(out, "softened", breakdown.softened());
        row(out, "probability", breakdown.finalProbability());
    }

    private static void row(final PrintWriter out, final String label, final double value) {
        out.printf(Locale.ROOT, "%-21s %.6f%n", label, value);
    }
}
