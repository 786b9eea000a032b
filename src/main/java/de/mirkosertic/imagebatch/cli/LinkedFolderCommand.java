package de.mirkosertic.imagebatch.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: image-batch linked-folder &lt;path&gt; [--recursive]
 * <p>
 * Processes the images referenced by the notes and canvases of the folder, wherever
 * the images are located.
 */
@Command(name = "linked-folder", mixinStandardHelpOptions = true,
        description = "Process the images linked from the notes of a folder")
public class LinkedFolderCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<path>", description = "Folder")
    private String path;

    @Option(names = {"--recursive", "-r"}, description = "Include notes in subfolders")
    private boolean recursive;

    private final BatchLauncher launcher;

    public LinkedFolderCommand(final BatchLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Integer call() {
        return launcher.launch(processor -> processor.processLinkedImagesInFolder(path, recursive));
    }
}
