package de.mirkosertic.imagebatch.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: image-batch folder &lt;path&gt; [--recursive]
 * <p>
 * Processes the image files located in the folder. Links to them are not rewritten.
 */
@Command(name = "folder", mixinStandardHelpOptions = true, description = "Process the image files of a folder")
public class FolderCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<path>", description = "Folder")
    private String path;

    @Option(names = {"--recursive", "-r"}, description = "Include subfolders")
    private boolean recursive;

    private final BatchLauncher launcher;

    public FolderCommand(final BatchLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Integer call() {
        return launcher.launch(processor -> processor.processImagesInFolder(path, recursive));
    }
}
