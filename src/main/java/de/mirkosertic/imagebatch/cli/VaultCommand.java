package de.mirkosertic.imagebatch.cli;

import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: image-batch vault
 */
@Command(name = "vault", mixinStandardHelpOptions = true, description = "Process the images of the whole vault")
public class VaultCommand implements Callable<Integer> {

    private final BatchLauncher launcher;

    public VaultCommand(final BatchLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Integer call() {
        return launcher.launch(processor -> processor.processAllVaultImages());
    }
}
