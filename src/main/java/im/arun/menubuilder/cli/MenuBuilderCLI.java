package im.arun.menubuilder.cli;

import im.arun.menubuilder.config.ConfigLoader;
import im.arun.menubuilder.config.MenuBuilderConfig;
import im.arun.menubuilder.service.MenuDocumentService;
import im.arun.menubuilder.util.ExecutorProvider;
import im.arun.menubuilder.util.LogLevels;
import im.arun.menubuilder.validation.Outcome;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Command-line interface for building and maintaining menu documents.
 */
@Command(
    name = "menubuilder",
    description = "Build, validate and merge nested command menus",
    mixinStandardHelpOptions = true,
    version = "MenuBuilder 1.0",
    subcommands = {
        ShowCommand.class,
        ValidateCommand.class,
        MergeCommand.class,
        FunctionsCommand.class,
        ImportShelfCommand.class,
        ConvertLegacyCommand.class
    }
)
public class MenuBuilderCLI implements Callable<Integer> {

    @Option(names = {"--config"}, description = "Path to a menubuilder.yaml settings file")
    private String configPath;

    @Option(names = {"--menu-dir"}, description = "Menu directory (overrides the settings file)")
    private String menuDir;

    @Spec
    private CommandSpec spec;

    private MenuBuilderConfig config;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Settings for this run, loaded once; applies the configured log level.
     */
    MenuBuilderConfig config() {
        if (config == null) {
            config = new ConfigLoader(configPath).getDefaultConfig();
            if (menuDir != null) {
                config.setMenuItemsDir(menuDir);
            }
            LogLevels.apply(config.getLogLevel());
        }
        return config;
    }

    MenuDocumentService documentService() {
        return new MenuDocumentService(config());
    }

    static int fail(CommandSpec spec, String message) {
        PrintWriter err = spec.commandLine().getErr();
        err.println("Error: " + message);
        err.flush();
        return 1;
    }

    static int fail(CommandSpec spec, String action, Outcome<?> outcome) {
        return fail(spec, action + ": " + outcome.getDetail());
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new MenuBuilderCLI()).execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
