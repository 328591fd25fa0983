package org.dxworks.ommlatex;

import java.nio.file.Path;

/**
 * Recognizes files holding serialized equation fragments by their extension.
 */
public class FragmentFileDetector {

    public static boolean isFragmentFile(Path filePath) {
        if (filePath == null || filePath.getFileName() == null) {
            return false;
        }
        String fileName = filePath.getFileName().toString().toLowerCase();

        return fileName.endsWith(".xml") || fileName.endsWith(".omml");
    }
}
