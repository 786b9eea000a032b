package de.mirkosertic.imagebatch.cli;

import picocli.CommandLine;

/**
 * Creates the subcommands with the {@link BatchLauncher} that performs their runs.
 */
public class CommandFactory implements CommandLine.IFactory {

    private final BatchLauncher launcher;

    public CommandFactory(final BatchLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <K> K create(final Class<K> cls) throws Exception {
        if (cls == NoteCommand.class) {
            return (K) new NoteCommand(launcher);
        }
        if (cls == FolderCommand.class) {
            return (K) new FolderCommand(launcher);
        }
        if (cls == LinkedFolderCommand.class) {
            return (K) new LinkedFolderCommand(launcher);
        }
        if (cls == VaultCommand.class) {
            return (K) new VaultCommand(launcher);
        }
        return CommandLine.defaultFactory().create(cls);
    }
}
