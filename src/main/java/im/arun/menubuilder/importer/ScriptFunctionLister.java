package im.arun.menubuilder.importer;

import im.arun.menubuilder.model.CallableSignature;
import im.arun.menubuilder.model.CommandLanguage;
import im.arun.menubuilder.model.NodeDraft;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the callables a script defines at top level, so that one can be picked
 * as a menu command. This is a line-based lexical scan: scripts with syntax
 * errors (old Python 2 code, say) still yield their definitions.
 */
public class ScriptFunctionLister {

    private static final Pattern PYTHON_DEF = Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern MEL_GLOBAL_PROC =
        Pattern.compile("^\\s*global\\s+proc\\s+(?:\\w+(?:\\[\\])?\\s+)?([A-Za-z_]\\w*)\\s*\\(");

    public List<CallableSignature> listCallables(String scriptSource) {
        return listCallables(scriptSource, CommandLanguage.PYTHON);
    }

    /**
     * @throws CancellationException if the calling thread is interrupted mid-scan
     */
    public List<CallableSignature> listCallables(String scriptSource, CommandLanguage language) {
        List<CallableSignature> callables = new ArrayList<>();
        if (scriptSource == null || scriptSource.isEmpty()) {
            return callables;
        }
        Pattern pattern = language == CommandLanguage.MEL ? MEL_GLOBAL_PROC : PYTHON_DEF;
        String[] lines = scriptSource.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Script scan cancelled");
            }
            Matcher matcher = pattern.matcher(lines[i]);
            if (matcher.find()) {
                String name = matcher.group(1);
                callables.add(new CallableSignature(name, language, i + 1, LabelGenerator.fromCommand(name)));
            }
        }
        return callables;
    }

    /**
     * Script language implied by a file name: {@code .mel} is MEL, anything else Python.
     */
    public static CommandLanguage languageOf(Path script) {
        String fileName = script.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".mel") ? CommandLanguage.MEL : CommandLanguage.PYTHON;
    }

    /**
     * Module name of a script file: its file name without extension.
     */
    public static String moduleNameOf(Path script) {
        String fileName = script.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');
        return dotIndex > 0 ? fileName.substring(0, dotIndex) : fileName;
    }

    /**
     * Command draft that loads the module fresh and invokes the callable.
     */
    public NodeDraft toDraft(CallableSignature callable, String moduleName) {
        String commandText;
        if (callable.getLanguage() == CommandLanguage.MEL) {
            commandText = "source \"" + moduleName + "\";\n" + callable.getName() + "();";
        } else {
            commandText = "import " + moduleName + "\n"
                + "from importlib import reload\n"
                + "reload(" + moduleName + ")\n"
                + moduleName + "." + callable.getName() + "()";
        }
        return NodeDraft.command(callable.getSuggestedLabel(), callable.getLanguage(), commandText);
    }
}
