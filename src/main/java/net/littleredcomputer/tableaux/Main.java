package net.littleredcomputer.tableaux;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.tableaux.sat.BacktrackingSolver;
import net.littleredcomputer.tableaux.sat.SATProblem;
import net.littleredcomputer.tableaux.sat.SolverOutput;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {
    private static final Pattern pigeonholeRe = Pattern.compile("pigeonhole(\\d+)");
    private static final Pattern chainRe = Pattern.compile("chain(\\d+)");

    private static Options options() {
        return new Options()
                .addOption("task", true, "one of prove, sat, clausify, dimacs, solve")
                .addOption("problem", true, "formula name (pigeonholeN, chainN, distributive, nondistributive) or DIMACS file")
                .addOption("comment", true, "comment line for DIMACS output")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    static Formula formula(String name) {
        Matcher pm = pigeonholeRe.matcher(name);
        if (pm.matches()) return Formulas.pigeonhole(Integer.parseInt(pm.group(1)));
        Matcher cm = chainRe.matcher(name);
        if (cm.matches()) return Formulas.chain(Integer.parseInt(cm.group(1)));
        switch (name) {
            case "distributive": return Formulas.distributive();
            case "nondistributive": return Formulas.nondistributive();
            default: throw new IllegalArgumentException("unknown formula: " + name);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static Optional<Model> first(Strategy s, Sequent q, Duration interval) {
        return new Tableaux(s).setLogInterval(interval).expand(q).stream().findFirst().map(Clause::toModel);
    }

    static void run(CommandLine cmd, PrintStream out) throws IOException {
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String task = cmd.getOptionValue("task");
        String name = cmd.getOptionValue("problem");
        Duration interval = logInterval(cmd);
        switch (task) {
            case "prove": {
                Optional<Model> m = first(Strategy.SHORTCUT, Sequent.goal(formula(name)), interval);
                out.println(m.map(x -> "countermodel: " + x).orElse("valid"));
                break;
            }
            case "sat": {
                Optional<Model> m = first(Strategy.SHORTCUT, Sequent.hypothesis(formula(name)), interval);
                out.println(m.map(x -> "model: " + x).orElse("unsatisfiable"));
                break;
            }
            case "clausify":
                out.println(Clause.toString(new Tableaux(Strategy.UNION).setLogInterval(interval).expand(Sequent.goal(formula(name)))));
                break;
            case "dimacs": {
                ImmutableSet<Clause> clauses = new Tableaux(Strategy.UNION).setLogInterval(interval).expand(Sequent.goal(formula(name)));
                out.println(CnfEncoder.asDimacs(VariableIndex.of(clauses), clauses, cmd.getOptionValue("comment", name)));
                break;
            }
            case "solve": {
                SATProblem p;
                try (Reader r = problem(cmd)) {
                    p = SATProblem.parseFrom(r);
                }
                Stopwatch sw = Stopwatch.createStarted();
                Optional<boolean[]> outcome = new BacktrackingSolver().setLogInterval(interval).solve(p);
                sw.stop();
                out.println("c " + sw);
                out.print(SolverOutput.format(outcome));
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }

    public static void main(String[] args) throws ParseException, IOException {
        run(parse(args), System.out);
    }

    static CommandLine parse(String... args) throws ParseException {
        return new DefaultParser().parse(options(), args);
    }
}
