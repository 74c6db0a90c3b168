package io.limitgraph.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.limitgraph.config.LimitGraphConfig;
import io.limitgraph.config.LimitGraphSettings;
import io.limitgraph.error.GovernanceBlockedException;
import io.limitgraph.error.InvalidConfigException;
import io.limitgraph.governance.Orchestrator;
import io.limitgraph.governance.PatternAnomalyDetector;
import io.limitgraph.model.GovernanceCheckpoint;
import io.limitgraph.model.GovernancePolicy;
import io.limitgraph.model.RDPoint;
import io.limitgraph.model.RDSeries;
import io.limitgraph.model.Session;
import io.limitgraph.model.SessionConfig;
import io.limitgraph.model.SessionId;
import io.limitgraph.model.Trace;
import io.limitgraph.model.TraceFlagInfo;
import io.limitgraph.observability.GovernanceMetricsFormatter;
import io.limitgraph.rd.RdComputation;
import io.limitgraph.runner.BackendRunner;
import io.limitgraph.runner.EchoRunner;
import io.limitgraph.runner.RunnerRegistry;
import io.limitgraph.runner.ScriptRunner;
import io.limitgraph.session.SessionManager;
import io.limitgraph.storage.Storage;
import io.limitgraph.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "limitgraph",
        mixinStandardHelpOptions = true,
        description = "LIMIT-Graph governance and rate-distortion CLI",
        subcommands = {
                LimitGraphCommand.PolicyCommand.class,
                LimitGraphCommand.RateCommand.class,
                LimitGraphCommand.RdCommand.class,
                LimitGraphCommand.FgwCommand.class,
                LimitGraphCommand.DetectCommand.class,
                LimitGraphCommand.RunCommand.class,
                LimitGraphCommand.MetricsCommand.class
        }
)
public final class LimitGraphCommand implements Runnable {
    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_BLOCKED = 2;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = LimitGraphConfig.DEFAULT_ROOT)
    String root;

    /**
     * Command line with failures mapped to {@link #EXIT_ERROR} and a one-line message.
     */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new LimitGraphCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("error: " + ex.getMessage());
            return EXIT_ERROR;
        });
        return cmd;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: policy | rate | rd | fgw | detect | run | metrics");
    }

    LimitGraphConfig config() {
        return LimitGraphConfig.fromRoot(root);
    }

    LimitGraphSettings settings() {
        return LimitGraphSettings.load(config());
    }

    Orchestrator orchestrator(LimitGraphSettings settings) {
        Storage storage = settings.storage().open(config());
        return new Orchestrator(
                storage,
                settings.policy(),
                new PatternAnomalyDetector(settings.detector()),
                new SessionManager(),
                Clock.systemUTC()
        );
    }

    BackendRunner runner(LimitGraphSettings settings, String runnerId, List<String> command, String python) {
        RunnerRegistry registry = new RunnerRegistry();
        registry.register(new EchoRunner());
        registry.register(ScriptRunner.python(python, settings.runnerTimeoutMs(), config().sandboxRoot()));
        if (command != null && !command.isEmpty()) {
            registry.register(new ScriptRunner("script", command, settings.runnerTimeoutMs(), config().sandboxRoot()));
        }
        return registry.require(runnerId);
    }

    /**
     * Runs one input and attempts the merge. Returns the governed outcome; a blocked merge is
     * reported in the result rather than thrown.
     */
    static ObjectNode runGoverned(Orchestrator orchestrator, Session session, BackendRunner runner, String input) {
        Trace trace = orchestrator.runTask(session, runner, input);
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("session_id", session.id().toString());
        out.put("trace_id", trace.id().toString());
        GovernanceCheckpoint checkpoint;
        boolean admitted;
        try {
            checkpoint = orchestrator.validateMerge(session.id(), trace.id());
            admitted = true;
        } catch (GovernanceBlockedException e) {
            checkpoint = e.checkpoint();
            admitted = false;
        }
        out.put("admitted", admitted);
        out.put("state", orchestrator.traceState(trace.id()).name());
        out.set("flags", Jsons.mapper().valueToTree(orchestrator.traceFlags(trace.id())));
        out.set("checkpoint", Jsons.mapper().valueToTree(checkpoint));
        out.set("trace", trace.payload());
        return out;
    }

    static double[] parseDoubles(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidConfigException("expected a comma separated list of numbers");
        }
        String[] parts = raw.split(",");
        double[] out = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                out[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigException("not a number: " + parts[i].trim(), e);
            }
        }
        return out;
    }

    static double[][] matrix(JsonNode node, String field) {
        JsonNode rows = node.path(field);
        if (!rows.isArray()) {
            throw new InvalidConfigException("missing matrix field: " + field);
        }
        double[][] out = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            JsonNode row = rows.get(i);
            if (!row.isArray()) {
                throw new InvalidConfigException(field + "[" + i + "] is not an array");
            }
            out[i] = new double[row.size()];
            for (int j = 0; j < row.size(); j++) {
                if (!row.get(j).isNumber()) {
                    throw new InvalidConfigException(field + "[" + i + "][" + j + "] is not a number");
                }
                out[i][j] = row.get(j).asDouble();
            }
        }
        return out;
    }

    static String readInput(String inline, String file) throws Exception {
        if (inline != null) {
            return inline;
        }
        if (file != null) {
            return Files.readString(Path.of(file), StandardCharsets.UTF_8);
        }
        throw new InvalidConfigException("either --input or --input-file is required");
    }

    @Command(name = "policy", description = "Print a policy preset or the effective settings")
    static final class PolicyCommand implements Callable<Integer> {
        @ParentCommand
        LimitGraphCommand parent;

        @Option(names = {"--preset"}, description = "Preset: permissive|default|strict")
        String preset;

        @Override
        public Integer call() {
            if (preset != null) {
                System.out.println(Jsons.toJson(GovernancePolicy.preset(preset)));
            } else {
                System.out.println(Jsons.toJson(parent.settings()));
            }
            return EXIT_OK;
        }
    }

    @Command(name = "rate", description = "Gaussian rate for one distortion and variance")
    static final class RateCommand implements Callable<Integer> {
        @ParentCommand
        LimitGraphCommand parent;

        @Option(names = {"--distortion"}, required = true, description = "Distortion >= 0")
        double distortion;

        @Option(names = {"--variance"}, required = true, description = "Source variance > 0")
        double variance;

        @Override
        public Integer call() {
            RdComputation rd = new RdComputation(parent.settings().fgw());
            double rate = rd.computeRate(distortion, variance);
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("distortion", distortion);
            out.put("variance", variance);
            out.put("rate", rate);
            out.put("unbounded", Double.isInfinite(rate));
            System.out.println(Jsons.toJson(out));
            return EXIT_OK;
        }
    }

    @Command(name = "rd", description = "Build an RD curve from distortions and report its knee")
    static final class RdCommand implements Callable<Integer> {
        @ParentCommand
        LimitGraphCommand parent;

        @Option(names = {"--distortions"}, required = true, description = "Comma separated distortions, one per step")
        String distortions;

        @Option(names = {"--variance"}, required = true, description = "Source variance > 0")
        double variance;

        @Option(names = {"--metrics"}, description = "Print Prometheus text instead of JSON")
        boolean metrics;

        @Override
        public Integer call() {
            double[] values = parseDoubles(distortions);
            double[][] steps = new double[values.length][];
            for (int i = 0; i < values.length; i++) {
                steps[i] = new double[]{values[i], variance};
            }
            RdComputation rd = new RdComputation(parent.settings().fgw());
            RDSeries series = rd.computeRdCurve(steps);
            Optional<RDPoint> knee = rd.findKneePoint();
            if (metrics) {
                System.out.print(GovernanceMetricsFormatter.formatSeries(series, knee));
                return EXIT_OK;
            }
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.set("points", Jsons.mapper().valueToTree(series.points()));
            if (knee.isPresent()) {
                out.set("knee", Jsons.mapper().valueToTree(knee.get()));
            } else {
                out.putNull("knee");
            }
            System.out.println(Jsons.toJson(out));
            return EXIT_OK;
        }
    }

    @Command(name = "fgw", description = "FGW distortion from a JSON file with cost matrices or raw features")
    static final class FgwCommand implements Callable<Integer> {
        @ParentCommand
        LimitGraphCommand parent;

        @Option(names = {"--file"}, required = true, description = "JSON file: feature_cost/structure_cost, or source_/target_ features and structure")
        String file;

        @Option(names = {"--alpha"}, description = "Feature weight in [0,1]; defaults to the configured alpha")
        Double alpha;

        @Override
        public Integer call() throws Exception {
            JsonNode doc = Jsons.readTree(Files.readString(Path.of(file), StandardCharsets.UTF_8));
            double[][] feature;
            double[][] structure;
            if (doc.has("feature_cost")) {
                feature = matrix(doc, "feature_cost");
                structure = matrix(doc, "structure_cost");
            } else {
                feature = RdComputation.featureCostMatrix(matrix(doc, "source_features"), matrix(doc, "target_features"));
                structure = RdComputation.structureCostMatrix(matrix(doc, "source_structure"), matrix(doc, "target_structure"));
            }
            RdComputation rd = new RdComputation(parent.settings().fgw());
            double a = alpha == null ? rd.config().alpha() : alpha;
            double distortion = rd.computeFgwDistortion(feature, structure, a);
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("alpha", a);
            out.put("distortion", distortion);
            System.out.println(Jsons.toJson(out));
            return EXIT_OK;
        }
    }

    @Command(name = "detect", description = "Run the anomaly detector on a JSON payload")
    static final class DetectCommand implements Callable<Integer> {
        @ParentCommand
        LimitGraphCommand parent;

        @Option(names = {"--payload"}, description = "Inline JSON payload")
        String payload;

        @Option(names = {"--file"}, description = "JSON payload file")
        String file;

        @Override
        public Integer call() throws Exception {
            JsonNode node = Jsons.readTree(readInput(payload, file));
            Trace trace = Trace.create(SessionId.newId(), node, Instant.now());
            List<TraceFlagInfo> flags = new PatternAnomalyDetector(parent.settings().detector()).detect(trace, null);
            System.out.println(Jsons.toJson(flags));
            return EXIT_OK;
        }
    }

    @Command(name = "run", description = "Execute one input in a fresh session, govern the trace and merge it")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        LimitGraphCommand parent;

        @Option(names = {"--runner"}, defaultValue = "echo", description = "Runner id: echo|python|script")
        String runner;

        @Option(names = {"--command"}, split = ",", description = "Command for the script runner, comma separated")
        List<String> command;

        @Option(names = {"--python"}, defaultValue = "python3", description = "Interpreter for the python runner")
        String python;

        @Option(names = {"--input"}, description = "Task input")
        String input;

        @Option(names = {"--input-file"}, description = "Task input file")
        String inputFile;

        @Option(names = {"--session-name"}, defaultValue = "cli", description = "Session name")
        String sessionName;

        @Option(names = {"--max-concurrency"}, defaultValue = "4", description = "Session concurrency bound")
        int maxConcurrency;

        @Option(names = {"--allow-network"}, description = "Allow network access inside the session")
        boolean allowNetwork;

        @Override
        public Integer call() throws Exception {
            String text = readInput(input, inputFile);
            LimitGraphSettings settings = parent.settings();
            Orchestrator orchestrator = parent.orchestrator(settings);
            BackendRunner backend = parent.runner(settings, runner, command, python);
            Session session = orchestrator.sessions().open(new SessionConfig(sessionName, maxConcurrency, allowNetwork));
            ObjectNode out = runGoverned(orchestrator, session, backend, text);
            System.out.println(Jsons.toJson(out));
            return out.path("admitted").asBoolean(false) ? EXIT_OK : EXIT_BLOCKED;
        }
    }

    @Command(name = "metrics", description = "Run inputs in one session and print governance metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        LimitGraphCommand parent;

        @Option(names = {"--runner"}, defaultValue = "echo", description = "Runner id: echo|python|script")
        String runner;

        @Option(names = {"--command"}, split = ",", description = "Command for the script runner, comma separated")
        List<String> command;

        @Option(names = {"--python"}, defaultValue = "python3", description = "Interpreter for the python runner")
        String python;

        @Option(names = {"--input"}, required = true, description = "Task input; repeat for several tasks")
        List<String> inputs;

        @Option(names = {"--namespace"}, description = "Optional namespace label")
        String namespace;

        @Override
        public Integer call() {
            LimitGraphSettings settings = parent.settings();
            Orchestrator orchestrator = parent.orchestrator(settings);
            BackendRunner backend = parent.runner(settings, runner, command, python);
            Session session = orchestrator.sessions().open(SessionConfig.named("metrics"));
            for (String in : inputs) {
                runGoverned(orchestrator, session, backend, in);
            }
            System.out.print(GovernanceMetricsFormatter.format(orchestrator.governanceStats(), namespace));
            return EXIT_OK;
        }
    }
}
