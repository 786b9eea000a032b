package de.mirkosertic.imagebatch.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: image-batch note &lt;path&gt;
 */
@Command(name = "note", mixinStandardHelpOptions = true, description = "Process the images of a note or canvas")
public class NoteCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<path>", description = "Note or canvas file")
    private String path;

    private final BatchLauncher launcher;

    public NoteCommand(final BatchLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Integer call() {
        return launcher.launch(processor -> processor.processImagesInNote(path));
    }
}
