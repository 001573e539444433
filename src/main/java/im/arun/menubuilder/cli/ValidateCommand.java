package im.arun.menubuilder.cli;

import im.arun.menubuilder.document.MenuFormatException;
import im.arun.menubuilder.model.MenuTree;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Check a menu document against every menu rule")
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Menu document (.json)")
    private Path file;

    @ParentCommand
    private MenuBuilderCLI parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try {
            MenuTree tree = parent.documentService().readTree(file);
            spec.commandLine().getOut().println("OK: " + file + " (" + tree.size() + " entries)");
            spec.commandLine().getOut().flush();
            return 0;
        } catch (IOException | MenuFormatException e) {
            return MenuBuilderCLI.fail(spec, "Invalid menu " + file + ": " + e.getMessage());
        }
    }
}
