package work.lcod.reshape.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import picocli.CommandLine;
import work.lcod.reshape.api.EvaluationOptions;
import work.lcod.reshape.api.LogLevel;
import work.lcod.reshape.api.Reshaper;

@CommandLine.Command(
    name = "reshape",
    description = "Restructure a JSON, YAML or TOML document with a declarative spec.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ReshapeCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(ReshapeCommand.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    enum TargetFormat { JSON, YAML, TOML }

    enum SpecFormat { JSON, YAML }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec commandSpec;

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "SPEC",
        description = "Spec document; a bare string is a dotted path (default: the whole target)."
    )
    private String specText;

    @CommandLine.Parameters(
        index = "1",
        arity = "0..1",
        paramLabel = "TARGET",
        description = "Target document (default: read from --target-file or stdin)."
    )
    private String targetText;

    @CommandLine.Option(
        names = "--spec-file",
        paramLabel = "PATH",
        description = "Read the spec from a file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String specFile;

    @CommandLine.Option(
        names = "--target-file",
        paramLabel = "PATH|-",
        description = "Read the target from a file; use '-' to read from stdin.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String targetFile;

    @CommandLine.Option(
        names = "--spec-format",
        description = "Spec document format (${COMPLETION-CANDIDATES}).",
        defaultValue = "YAML"
    )
    private SpecFormat specFormat = SpecFormat.YAML;

    @CommandLine.Option(
        names = "--target-format",
        description = "Target document format (${COMPLETION-CANDIDATES}).",
        defaultValue = "JSON"
    )
    private TargetFormat targetFormat = TargetFormat.JSON;

    @CommandLine.Option(
        names = "--default",
        paramLabel = "JSON",
        description = "JSON value printed instead of failing when evaluation raises.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String defaultJson;

    @CommandLine.Option(
        names = "--indent",
        description = "Output indentation; 0 prints compact JSON.",
        defaultValue = "2"
    )
    private int indent = 2;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        applyLogLevel(resolveLogLevel());
        if (specText != null && specFile != null) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), "Pass either SPEC or --spec-file, not both.");
        }
        if (targetText != null && targetFile != null) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), "Pass either TARGET or --target-file, not both.");
        }

        Object spec = loadSpec();
        Object target = loadTarget();
        var options = EvaluationOptions.builder();
        if (defaultJson != null) {
            options.defaultValue(JSON.readValue(defaultJson, Object.class));
        }
        LOG.debug("Evaluating spec {} against a {} target", spec, targetFormat);

        Object result = Reshaper.create().reshape(target, spec, options.build());
        commandSpec.commandLine().getOut().println(render(result));
        commandSpec.commandLine().getOut().flush();
        return 0;
    }

    private Object loadSpec() throws IOException {
        String text = specFile != null ? readFile(specFile) : specText;
        if (text == null || text.isBlank()) {
            return work.lcod.reshape.spec.Path.of();
        }
        var mapper = specFormat == SpecFormat.JSON ? JSON : YAML;
        return SpecDocuments.toSpec(mapper.readValue(text, Object.class));
    }

    private Object loadTarget() throws IOException {
        String text;
        if (targetText != null) {
            text = targetText;
        } else if (targetFile == null || "-".equals(targetFile)) {
            text = readStdin();
        } else {
            text = readFile(targetFile);
        }
        return switch (targetFormat) {
            case JSON -> JSON.readValue(text, Object.class);
            case YAML -> YAML.readValue(text, Object.class);
            case TOML -> parseToml(text);
        };
    }

    private Object parseToml(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new CommandLine.ParameterException(
                commandSpec.commandLine(),
                "Invalid TOML target: " + result.errors().get(0).toString()
            );
        }
        return SpecDocuments.convertTomlMap(result.toMap());
    }

    private String render(Object result) throws IOException {
        if (indent <= 0) {
            return JSON.writer().without(SerializationFeature.FAIL_ON_EMPTY_BEANS).writeValueAsString(result);
        }
        var printer = new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter(" ".repeat(indent), "\n"));
        return JSON.writer(printer).without(SerializationFeature.FAIL_ON_EMPTY_BEANS).writeValueAsString(result);
    }

    private String readFile(String value) {
        Path path = Paths.get(value).toAbsolutePath().normalize();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), "Cannot read file: " + path);
        }
    }

    private String readStdin() {
        try (InputStream in = System.in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), "Unable to read stdin: " + ex.getMessage());
        }
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("RESHAPE_LOG_LEVEL");
        }
        return LogLevel.from(candidate);
    }

    private static void applyLogLevel(LogLevel level) {
        var root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(level.name().toLowerCase(Locale.ROOT), Level.WARN));
        }
    }
}
