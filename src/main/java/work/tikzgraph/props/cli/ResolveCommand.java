package work.tikzgraph.props.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.tikzgraph.props.api.PropertyResolver;
import work.tikzgraph.props.api.ResolveResult;
import work.tikzgraph.props.api.ResolverConfiguration;
import work.tikzgraph.props.core.DeclarationErrorPolicy;
import work.tikzgraph.props.core.DeclarationParser;
import work.tikzgraph.props.hierarchy.HierarchyMode;
import work.tikzgraph.props.runtime.ResolverConfigurationLoader;
import work.tikzgraph.props.shared.LogLevel;

@CommandLine.Command(
    name = "tikzgraph-props",
    description = "Resolve style property documents into page, style and element attribute trees.",
    mixinStandardHelpOptions = true,
    versionProvider = ResolveCommand.Versions.class,
    showDefaultValues = true
)
final class ResolveCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = {"-d", "--document"},
        required = true,
        description = "Property document (JSON); later documents apply after earlier ones.",
        arity = "1..*"
    )
    private List<Path> documents = new ArrayList<>();

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: tikzgraph-props.toml next to the first document, if present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = {"-r", "--renderer"},
        paramLabel = "NAME",
        description = "Compatible renderer; repeat to accept several (overrides the configuration).",
        split = ","
    )
    private List<String> renderers = new ArrayList<>();

    @CommandLine.Option(
        names = "--strict",
        description = "Fail on hierarchy shape conflicts instead of skipping them."
    )
    private boolean strict;

    @CommandLine.Option(
        names = "--abort-on-invalid",
        description = "Fail on the first invalid declaration instead of skipping it."
    )
    private boolean abortOnInvalid;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (documents == null || documents.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "At least one --document value is required.");
        }
        for (Path document : documents) {
            if (!Files.isRegularFile(document)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Property document not found: " + document);
            }
        }

        ResolverConfiguration configuration = resolveConfiguration();
        ResolveResult result = new PropertyResolver().resolve(configuration, documents);
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private ResolverConfiguration resolveConfiguration() {
        ResolverConfiguration base = locateConfig()
            .map(ResolverConfigurationLoader::load)
            .orElseGet(ResolverConfiguration::defaults);
        var builder = base.toBuilder();
        if (renderers != null && !renderers.isEmpty()) {
            builder.compatibleRenderers(renderers);
        }
        if (strict) {
            builder.hierarchyMode(HierarchyMode.STRICT);
        }
        if (abortOnInvalid) {
            builder.declarationErrorPolicy(DeclarationErrorPolicy.ABORT);
        }
        if (logLevelRaw != null) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        return builder.build();
    }

    /**
     * Reports a failure that escaped {@link #call()}: an unreadable or invalid configuration, or an
     * unsupported option value. Resolution failures never get here; they come back as a result.
     */
    static int reportFailure(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        String prefix = ex instanceof IllegalArgumentException ? "Configuration error: " : "Unexpected failure: ";
        commandLine.getErr().println(commandLine.getColorScheme().errorText(prefix + message));
        if (Boolean.getBoolean("tikzgraph.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return ResolveResult.Status.FAILURE.exitCode();
    }

    private Optional<Path> locateConfig() {
        if (config != null) {
            if (!Files.isRegularFile(config)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Configuration file not found: " + config);
            }
            return Optional.of(config);
        }
        Path parent = documents.get(0).toAbsolutePath().getParent();
        return ResolverConfigurationLoader.locate(parent);
    }

    static final class Versions implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {
                "tikzgraph-props " + PropertyResolver.version(),
                "declaration grammar " + DeclarationParser.GRAMMAR_VERSION,
                "default renderers " + String.join(", ", ResolverConfiguration.DEFAULT_RENDERERS)
            };
        }
    }
}
