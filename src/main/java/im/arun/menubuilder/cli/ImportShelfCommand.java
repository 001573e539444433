package im.arun.menubuilder.cli;

import im.arun.menubuilder.document.MenuFormatException;
import im.arun.menubuilder.engine.MenuStructureEngine;
import im.arun.menubuilder.engine.NodeSnapshot;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.NodeDraft;
import im.arun.menubuilder.model.NodeKind;
import im.arun.menubuilder.service.ImportService;
import im.arun.menubuilder.service.MenuDocumentService;
import im.arun.menubuilder.validation.Outcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

@Command(name = "import-shelf", description = "Append the buttons of a shelf script to a menu")
public class ImportShelfCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Shelf script (shelf_<name>.mel)")
    private Path shelfFile;

    @Option(names = {"--menu"}, description = "Menu to import into (created if missing)", required = true)
    private String menuName;

    @Option(names = {"--folder"}, description = "Top-level folder to import into (created if missing)")
    private String folderLabel;

    @ParentCommand
    private MenuBuilderCLI parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws InterruptedException {
        MenuDocumentService service = parent.documentService();
        try {
            Outcome<Void> opened = Files.exists(service.menuPath(menuName))
                ? service.open(menuName)
                : service.newMenu(menuName);
            if (opened.isFailure()) {
                return MenuBuilderCLI.fail(spec, "Cannot open " + menuName, opened);
            }

            List<NodeDraft> drafts = new ImportService().importShelf(shelfFile).get();
            MenuStructureEngine engine = service.getEngine();
            Outcome<Long> target = targetFolder(engine);
            if (target.isFailure()) {
                return MenuBuilderCLI.fail(spec, "Cannot create folder " + folderLabel, target);
            }
            Outcome<List<Long>> added = ImportService.addDrafts(engine, drafts, target.getValue());
            if (added.isFailure()) {
                return MenuBuilderCLI.fail(spec, "Import rejected", added);
            }
            Path saved = service.save();
            spec.commandLine().getOut().println("Imported " + added.getValue().size() + " entries into " + saved);
            spec.commandLine().getOut().flush();
            return 0;
        } catch (IOException | MenuFormatException e) {
            return MenuBuilderCLI.fail(spec, e.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return MenuBuilderCLI.fail(spec, cause.getMessage());
        }
    }

    private Outcome<Long> targetFolder(MenuStructureEngine engine) {
        if (folderLabel == null) {
            return Outcome.success(MenuTree.ROOT_ID);
        }
        for (NodeSnapshot child : engine.children(MenuTree.ROOT_ID)) {
            if (child.getKind() == NodeKind.FOLDER && folderLabel.trim().equals(child.getLabel().trim())) {
                return Outcome.success(child.getId());
            }
        }
        return engine.appendNode(NodeDraft.folder(folderLabel.trim()), MenuTree.ROOT_ID);
    }
}
