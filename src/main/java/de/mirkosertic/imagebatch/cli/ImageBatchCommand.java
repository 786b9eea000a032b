package de.mirkosertic.imagebatch.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to the subcommands note, folder, linked-folder and vault.
 */
@Command(
        name = "image-batch",
        mixinStandardHelpOptions = true,
        version = "vault-image-batch 1.0.0",
        description = "Converts, compresses and resizes vault images and keeps the links to them intact.",
        footer = "Paths are relative to the vault root.",
        subcommands = {
                NoteCommand.class,
                FolderCommand.class,
                LinkedFolderCommand.class,
                VaultCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class ImageBatchCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing command");
    }
}
