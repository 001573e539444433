package im.arun.menubuilder.cli;

import im.arun.menubuilder.service.MenuDocumentService;
import im.arun.menubuilder.validation.Outcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "convert-legacy", description = "Convert a flat legacy menu file into a menu document")
public class ConvertLegacyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Legacy menu file (.json)")
    private Path legacyFile;

    @Option(names = {"--menu"}, description = "Name to save the converted menu under", required = true)
    private String menuName;

    @ParentCommand
    private MenuBuilderCLI parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        MenuDocumentService service = parent.documentService();
        try {
            Outcome<Void> converted = service.openLegacy(legacyFile, menuName);
            if (converted.isFailure()) {
                return MenuBuilderCLI.fail(spec, "Converted menu is not valid", converted);
            }
            Path saved = service.save();
            spec.commandLine().getOut().println("Converted " + legacyFile + " to " + saved);
            spec.commandLine().getOut().flush();
            return 0;
        } catch (IOException e) {
            return MenuBuilderCLI.fail(spec, e.getMessage());
        }
    }
}
