package im.arun.menubuilder.cli;

import im.arun.menubuilder.model.CallableSignature;
import im.arun.menubuilder.service.ImportService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

@Command(name = "functions", description = "List the top-level callables of a Python or MEL script")
public class FunctionsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Script file (.py or .mel)")
    private Path script;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws InterruptedException {
        List<CallableSignature> callables;
        try {
            callables = new ImportService().listCallables(script).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return MenuBuilderCLI.fail(spec, cause.getMessage());
        }
        PrintWriter out = spec.commandLine().getOut();
        for (CallableSignature callable : callables) {
            out.println(callable.getLineNumber() + ": " + callable.getName() + " -> " + callable.getSuggestedLabel());
        }
        out.flush();
        return 0;
    }
}
