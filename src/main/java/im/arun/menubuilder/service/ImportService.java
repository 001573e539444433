package im.arun.menubuilder.service;

import im.arun.menubuilder.engine.CascadePolicy;
import im.arun.menubuilder.engine.MenuStructureEngine;
import im.arun.menubuilder.importer.ScriptFunctionLister;
import im.arun.menubuilder.importer.ShelfImporter;
import im.arun.menubuilder.model.CallableSignature;
import im.arun.menubuilder.model.CommandLanguage;
import im.arun.menubuilder.model.NodeDraft;
import im.arun.menubuilder.util.ExecutorProvider;
import im.arun.menubuilder.validation.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs script and shelf parsing in the background. Each call returns a
 * {@link Future}; cancelling it with interruption stops the parse. Parsing
 * never touches a tree: the drafts are placed afterwards with
 * {@link #addDrafts}.
 */
public class ImportService {
    private static final Logger logger = LoggerFactory.getLogger(ImportService.class);

    private final ExecutorService executor;
    private final ScriptFunctionLister functionLister;
    private final ShelfImporter shelfImporter;

    public ImportService() {
        this(ExecutorProvider.getExecutor());
    }

    public ImportService(ExecutorService executor) {
        this.executor = executor;
        this.functionLister = new ScriptFunctionLister();
        this.shelfImporter = new ShelfImporter();
    }

    public Future<List<CallableSignature>> listCallables(Path script) {
        return executor.submit(() -> {
            CommandLanguage language = ScriptFunctionLister.languageOf(script);
            List<CallableSignature> callables = functionLister.listCallables(readSource(script), language);
            logger.debug("Found {} callables in {}", callables.size(), script);
            return callables;
        });
    }

    /**
     * One command draft per callable in the script, invoking it through a fresh module load.
     */
    public Future<List<NodeDraft>> functionDrafts(Path script) {
        return executor.submit(() -> {
            CommandLanguage language = ScriptFunctionLister.languageOf(script);
            String moduleName = ScriptFunctionLister.moduleNameOf(script);
            List<NodeDraft> drafts = new ArrayList<>();
            for (CallableSignature callable : functionLister.listCallables(readSource(script), language)) {
                drafts.add(functionLister.toDraft(callable, moduleName));
            }
            return drafts;
        });
    }

    public Future<List<NodeDraft>> importShelf(Path shelfFile) {
        return executor.submit(() -> {
            List<NodeDraft> drafts = shelfImporter.importLegacyShelf(readSource(shelfFile));
            logger.debug("Read {} shelf buttons from {}", drafts.size(), shelfFile);
            return drafts;
        });
    }

    private static String readSource(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    /**
     * Append drafts under a folder, in order. All or nothing: if one draft is
     * refused, those already added are removed again and the failure returned.
     */
    public static Outcome<List<Long>> addDrafts(MenuStructureEngine engine, List<NodeDraft> drafts, long parentId) {
        List<Long> added = new ArrayList<>();
        for (NodeDraft draft : drafts) {
            Outcome<Long> outcome = engine.appendNode(draft, parentId);
            if (outcome.isFailure()) {
                logger.warn("Import stopped at {}: {}", draft.getAttributes().getLabel(), outcome.getDetail());
                for (int i = added.size() - 1; i >= 0; i--) {
                    engine.deleteNode(added.get(i), CascadePolicy.DELETE);
                }
                return outcome.asFailure();
            }
            added.add(outcome.getValue());
        }
        logger.info("Imported {} entries", added.size());
        return Outcome.success(Collections.unmodifiableList(added));
    }
}
