package im.arun.menubuilder.cli;

import im.arun.menubuilder.document.MenuFormatException;
import im.arun.menubuilder.render.OutlineRenderer;
import im.arun.menubuilder.service.MenuDocumentService;
import im.arun.menubuilder.validation.Outcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "show", description = "Print a menu as an outline (default menu when no name is given)")
public class ShowCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Menu name")
    private String menuName;

    @ParentCommand
    private MenuBuilderCLI parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        MenuDocumentService service = parent.documentService();
        try {
            Outcome<Void> opened = menuName != null ? service.open(menuName) : service.loadDefault();
            if (opened.isFailure()) {
                return MenuBuilderCLI.fail(spec, "Cannot open menu", opened);
            }
        } catch (IOException | MenuFormatException e) {
            return MenuBuilderCLI.fail(spec, e.getMessage());
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println(service.getCurrentMenuName());
        out.print(new OutlineRenderer().render(service.getEngine()));
        out.flush();
        return 0;
    }
}
