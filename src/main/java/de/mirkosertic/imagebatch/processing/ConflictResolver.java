package de.mirkosertic.imagebatch.processing;

import java.io.IOException;

/**
 * Turns a desired file name into the final name under which a file is stored.
 */
public interface ConflictResolver {

    /**
     * @param destinationDir  vault folder the file will live in
     * @param desiredFilename file name including extension
     * @param mode            {@link ConflictMode#REUSE} returns the desired name unchanged;
     *                        {@link ConflictMode#INCREMENT} returns a name that does not exist in the folder
     * @return the final file name, without folder
     */
    String resolveConflict(String destinationDir, String desiredFilename, ConflictMode mode) throws IOException;
}
