package im.arun.menubuilder.cli;

import im.arun.menubuilder.document.MenuFormatException;
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

@Command(name = "merge", description = "Merge one menu into another and save the result")
public class MergeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Base menu name")
    private String baseMenu;

    @Parameters(index = "1", description = "Incoming menu name")
    private String incomingMenu;

    @Option(names = {"--output"}, description = "Save the result under this menu name instead of the base")
    private String outputMenu;

    @ParentCommand
    private MenuBuilderCLI parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        MenuDocumentService service = parent.documentService();
        try {
            Outcome<Void> opened = service.open(baseMenu);
            if (opened.isFailure()) {
                return MenuBuilderCLI.fail(spec, "Cannot open " + baseMenu, opened);
            }
            Outcome<Void> merged = service.merge(incomingMenu);
            if (merged.isFailure()) {
                return MenuBuilderCLI.fail(spec, "Merge rejected", merged);
            }
            Path saved = outputMenu != null ? service.saveAs(outputMenu) : service.save();
            spec.commandLine().getOut().println("Merged " + incomingMenu + " into " + saved);
            spec.commandLine().getOut().flush();
            return 0;
        } catch (IOException | MenuFormatException e) {
            return MenuBuilderCLI.fail(spec, e.getMessage());
        }
    }
}
